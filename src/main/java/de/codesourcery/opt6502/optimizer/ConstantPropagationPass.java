package de.codesourcery.opt6502.optimizer;

import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;
import de.codesourcery.opt6502.model.Operand;
import de.codesourcery.opt6502.model.Register;

/**
 * Remembers the immediate value last loaded into the accumulator and removes
 * loads of that same value.
 *
 * Anything that changes A or the N/Z flags, and any branch target, makes the
 * value unknown again.
 */
public class ConstantPropagationPass extends AbstractOptimizationPass
{
	public ConstantPropagationPass() {
		super("constant-propagation");
	}

	@Override
	public int apply(InstructionStream stream, OptimizationContext context)
	{
		int count = 0;
		Operand accumulator = null;
		for ( Instruction insn : stream )
		{
			if ( insn.isDead() || insn.isCommentOrBlank() ) {
				continue;
			}
			if ( insn.isBranchTarget() ) {
				accumulator = null;
			}
			if ( insn.isNoOptimize() || insn.getMnemonic() == null )
			{
				accumulator = null;
				continue;
			}
			if ( insn.is( Mnemonic.LDA ) && insn.getOperand().isImmediate() )
			{
				if ( accumulator != null && accumulator.sameAs( insn.getOperand() ) && isRemovable( insn ) )
				{
					insn.markDead();
					logRewrite( "A already holds "+accumulator.expression , insn );
					count++;
				} else {
					accumulator = insn.getOperand();
				}
				continue;
			}
			if ( invalidatesAccumulator( insn ) ) {
				accumulator = null;
			}
		}
		return count;
	}

	private static boolean invalidatesAccumulator(Instruction insn)
	{
		final Mnemonic m = insn.getMnemonic();
		if ( m.isCall() || m.hasCategory( Mnemonic.Category.SYSTEM ) || m.hasUnmodelledEffects() ) {
			return true;
		}
		return m.writes( Register.A , insn.getOperand() ) ||
				m.getFlagsWritten( insn.getOperand() ).contains( Flag.NEGATIVE ) ||
				m.getFlagsWritten( insn.getOperand() ).contains( Flag.ZERO );
	}
}
