package de.codesourcery.opt6502.optimizer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import de.codesourcery.opt6502.analysis.RegisterLiveness;
import de.codesourcery.opt6502.model.CpuType;
import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;
import de.codesourcery.opt6502.model.Register;

/**
 * Uses the 65C02 <code>STZ</code> (store zero) instruction.
 *
 * <pre>
 * LDA #0         LDA #0   &lt;-- removed if A and N/Z are not read afterwards
 * STA $1000  =&gt;  STZ $1000
 * STA $1001      STZ $1001
 * </pre>
 *
 * <b>Must never run on the 45GS02</b>, its <code>STZ</code> stores the Z register.
 */
public class Cpu65C02Pass extends AbstractOptimizationPass
{
	public Cpu65C02Pass() {
		super("65c02");
	}

	public static boolean isApplicable(CpuType cpu) {
		return cpu.allows65C02() && ! cpu.is45GS02();
	}

	@Override
	public boolean isApplicable(OptimizationContext context) {
		return isApplicable( context.getCpu() );
	}

	@Override
	public int apply(InstructionStream stream, OptimizationContext context)
	{
		if ( ! isApplicable( context ) ) {
			return 0;
		}

		int count = 0;
		for ( int i = 0 , len = stream.size() ; i < len ; i++ )
		{
			final Instruction load = stream.get( i );
			if ( ! isCandidate( load , Mnemonic.LDA ) || ! load.getOperand().isImmediate() || ! load.getOperand().hasValue( 0 ) ) {
				continue;
			}

			final List<Instruction> stores = new ArrayList<>();
			int current = i;
			while ( ( current = nextInWindow( stream , current ) ) != -1 )
			{
				final Instruction insn = stream.get( current );
				final Mnemonic m = insn.getMnemonic();
				if ( m == null ) {
					break;
				}
				if ( m == Mnemonic.STA && insn.getOperand().addressingMode.supportsStoreZ() ) {
					stores.add( insn );
					continue;
				}
				if ( m.isControlFlow() || m.hasUnmodelledEffects() ) {
					break;
				}
				if ( m.reads( Register.A , insn.getOperand() ) || m.writes( Register.A , insn.getOperand() ) ) {
					break;
				}
			}

			for ( Instruction store : stores )
			{
				store.replaceMnemonic( Mnemonic.STZ );
				logRewrite( "STA -> STZ "+store.getOperand() , store );
				count++;
			}

			if ( isRemovable( load ) && RegisterLiveness.isDeadAfter( stream , i , EnumSet.of( Register.A ) , EnumSet.of( Flag.NEGATIVE , Flag.ZERO ) ) )
			{
				load.markDead();
				logRewrite( "removed unused "+load.toSourceText() , load );
				count++;
			}
		}
		return count;
	}
}
