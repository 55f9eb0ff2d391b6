package de.codesourcery.opt6502.optimizer;

import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;
import de.codesourcery.opt6502.model.Operand;
import de.codesourcery.opt6502.model.Register;

/**
 * Removes loads of values the accumulator already holds.
 *
 * <pre>
 * LDA mem         ...      (sets A,N,Z)
 * STA addr        STA mem
 * LDA mem  &lt;--    LDA mem  &lt;-- removed
 * </pre>
 *
 * Memory locations are assumed to keep their value, which is not true for
 * I/O registers. Wrap such code in <code>#NOOPT</code> / <code>#OPT</code>.
 */
public class LoadStorePass extends AbstractOptimizationPass
{
	public LoadStorePass() {
		super("load-store");
	}

	@Override
	public int apply(InstructionStream stream, OptimizationContext context)
	{
		int count = 0;
		for ( int i = 0 , len = stream.size() ; i < len ; i++ )
		{
			final Instruction first = stream.get( i );
			if ( ! isCandidate( first ) ) {
				continue;
			}
			final int store = nextInWindow( stream , i , Mnemonic.STA );
			if ( store == -1 ) {
				continue;
			}
			final int reload = nextInWindow( stream , store , Mnemonic.LDA );
			if ( reload == -1 ) {
				continue;
			}
			final Operand storeOperand = stream.get( store ).getOperand();
			final Operand reloadOperand = stream.get( reload ).getOperand();
			if ( ! reloadOperand.addressingMode.isDirect() ) {
				continue;
			}

			final boolean reloadsFirst = first.is( Mnemonic.LDA ) && reloadOperand.sameAs( first.getOperand() );
			final boolean reloadsStored = reloadOperand.sameAs( storeOperand ) && setsAccumulatorAndFlags( first );
			if ( reloadsFirst || reloadsStored )
			{
				stream.get( reload ).markDead();
				logRewrite( "removed reload "+stream.get( reload ).toSourceText() , stream.get( reload ) );
				count++;
			}
		}
		return count;
	}

	private static boolean setsAccumulatorAndFlags(Instruction insn)
	{
		final Mnemonic m = insn.getMnemonic();
		if ( m == Mnemonic.ADC || m == Mnemonic.SBC ) {
			return false; // NMOS N/Z are unreliable in decimal mode
		}
		return m.writes( Register.A , insn.getOperand() ) &&
				m.getFlagsWritten( insn.getOperand() ).contains( Flag.NEGATIVE ) &&
				m.getFlagsWritten( insn.getOperand() ).contains( Flag.ZERO );
	}
}
