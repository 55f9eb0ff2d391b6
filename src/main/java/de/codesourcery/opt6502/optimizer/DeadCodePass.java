package de.codesourcery.opt6502.optimizer;

import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;

/**
 * Removes unreachable code after unconditional jumps and returns.
 *
 * Code is considered unreachable up to the next label, disabled line or
 * unknown instruction (data, directives). Jumps and returns inside a disabled
 * region are never taken as the start of unreachable code.
 */
public class DeadCodePass extends AbstractOptimizationPass
{
	public DeadCodePass() {
		super("dead-code");
	}

	@Override
	public int apply(InstructionStream stream, OptimizationContext context)
	{
		int count = 0;
		for ( int i = 0 , len = stream.size() ; i < len ; i++ )
		{
			final Instruction terminator = stream.get( i );
			if ( ! isTerminator( terminator ) ) {
				continue;
			}
			for ( int j = i+1 ; j < len ; j++ )
			{
				final Instruction insn = stream.get( j );
				if ( insn.isDead() || insn.isCommentOrBlank() ) {
					continue;
				}
				if ( insn.hasLabel() || insn.isBranchTarget() || insn.isNoOptimize() || insn.isOpaque() ) {
					break;
				}
				insn.markDead();
				logRewrite( "unreachable "+insn.toSourceText() , insn );
				count++;
			}
		}
		return count;
	}
}
