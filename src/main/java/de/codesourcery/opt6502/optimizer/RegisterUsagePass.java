package de.codesourcery.opt6502.optimizer;

import java.util.EnumSet;

import de.codesourcery.opt6502.analysis.RegisterLiveness;
import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;
import de.codesourcery.opt6502.model.Register;

/**
 * Removes register round-trips.
 *
 * <pre>
 * TAX / TXA
 * TAY / TYA
 * </pre>
 *
 * Both instructions are removed if the index register's new value is never read and the
 * N/Z flags either already reflect the accumulator or are not read either.
 */
public class RegisterUsagePass extends AbstractOptimizationPass
{
	public RegisterUsagePass() {
		super("register-usage");
	}

	@Override
	public int apply(InstructionStream stream, OptimizationContext context)
	{
		int count = 0;
		for ( int i = 0 , len = stream.size() ; i < len ; i++ )
		{
			final Instruction first = stream.get( i );
			if ( ! isCandidate( first ) || ! isRemovable( first ) ) {
				continue;
			}
			final Mnemonic back;
			final Register index;
			if ( first.is( Mnemonic.TAX ) ) {
				back = Mnemonic.TXA;
				index = Register.X;
			} else if ( first.is( Mnemonic.TAY ) ) {
				back = Mnemonic.TYA;
				index = Register.Y;
			} else {
				continue;
			}
			final int second = nextInWindow( stream , i , back );
			if ( second == -1 ) {
				continue;
			}
			if ( ! RegisterLiveness.isDeadAfter( stream , second , index ) ) {
				continue;
			}
			if ( ! flagsReflectAccumulator( stream , i ) &&
				 ! RegisterLiveness.isDeadAfter( stream , second , EnumSet.noneOf( Register.class ) , EnumSet.of( Flag.NEGATIVE , Flag.ZERO ) ) )
			{
				continue;
			}
			first.markDead();
			stream.get( second ).markDead();
			logRewrite( "removed "+first.toSourceText()+" / "+stream.get( second ).toSourceText() , first );
			count++;
		}
		return count;
	}

	/**
	 * Whether the instruction before <code>index</code> is known to have set N/Z from the accumulator's value.
	 */
	private static boolean flagsReflectAccumulator(InstructionStream stream,int index)
	{
		if ( stream.get( index ).isBranchTarget() ) {
			return false;
		}
		final Instruction previous = previousInstruction( stream , index );
		if ( previous == null || previous.getMnemonic() == null ) {
			return false;
		}
		final Mnemonic m = previous.getMnemonic();
		if ( m == Mnemonic.ADC || m == Mnemonic.SBC ) {
			return false;
		}
		return m.writes( Register.A , previous.getOperand() ) &&
				m.getFlagsWritten( previous.getOperand() ).contains( Flag.NEGATIVE ) &&
				m.getFlagsWritten( previous.getOperand() ).contains( Flag.ZERO );
	}
}
