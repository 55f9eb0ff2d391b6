package de.codesourcery.opt6502.optimizer;

import de.codesourcery.opt6502.model.InstructionStream;

/**
 * A rewrite over the instruction stream.
 *
 * Passes never delete or reorder instructions, they only mark them dead or
 * replace mnemonics/operands. Instructions that are dead, disabled through <code>#NOOPT</code>
 * or branch targets are never removed.
 */
public interface IOptimizationPass
{
	public String getName();

	/**
	 * Whether this pass may run for the given target.
	 */
	public boolean isApplicable(OptimizationContext context);

	/**
	 * Applies this pass.
	 *
	 * @param stream
	 * @param context
	 * @return number of optimizations performed
	 */
	public int apply(InstructionStream stream,OptimizationContext context);
}
