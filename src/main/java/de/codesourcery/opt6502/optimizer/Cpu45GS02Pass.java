package de.codesourcery.opt6502.optimizer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import de.codesourcery.opt6502.analysis.RegisterLiveness;
import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;
import de.codesourcery.opt6502.model.Register;

/**
 * 45GS02 (MEGA65) specific rewrites.
 *
 * <pre>
 * LDA #v / STA a / LDA #v / STA b   =&gt;  LDZ #v / STZ a / STZ b
 * EOR #$FF / SEC / ADC #0           =&gt;  NEG
 * CMP #$80 / ROR                    =&gt;  ASR
 * </pre>
 *
 * On this CPU <code>STZ</code> stores the Z register, so stores are only ever
 * rewritten together with an explicit <code>LDZ</code>.
 */
public class Cpu45GS02Pass extends AbstractOptimizationPass
{
	public Cpu45GS02Pass() {
		super("45gs02");
	}

	@Override
	public boolean isApplicable(OptimizationContext context) {
		return context.getCpu().is45GS02();
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
			final Instruction insn = stream.get( i );
			if ( ! isCandidate( insn ) ) {
				continue;
			}
			if ( insn.is( Mnemonic.LDA ) ) {
				count += storeViaZ( stream , i );
			} else if ( insn.is( Mnemonic.EOR ) ) {
				count += negate( stream , i );
			} else if ( insn.is( Mnemonic.CMP ) ) {
				count += arithmeticShiftRight( stream , i );
			}
		}
		return count;
	}

	private int storeViaZ(InstructionStream stream,int index)
	{
		final Instruction load = stream.get( index );
		if ( ! load.getOperand().isImmediate() ) {
			return 0;
		}

		final List<Instruction> stores = new ArrayList<>();
		final List<Instruction> reloads = new ArrayList<>();
		int last = index;
		int current = index;
		while ( ( current = nextInWindow( stream , current ) ) != -1 )
		{
			final Instruction insn = stream.get( current );
			if ( isStoreZCandidate( insn ) )
			{
				stores.add( insn );
				last = current;
				continue;
			}
			if ( insn.is( Mnemonic.LDA ) && insn.getOperand().sameAs( load.getOperand() ) )
			{
				final int next = nextInWindow( stream , current );
				if ( next != -1 && isStoreZCandidate( stream.get( next ) ) ) {
					reloads.add( insn );
					continue;
				}
			}
			break;
		}

		if ( stores.size() < 2 ) {
			return 0;
		}
		// A no longer gets loaded and Z gets clobbered
		if ( ! RegisterLiveness.isDeadAfter( stream , last , EnumSet.of( Register.A , Register.Z ) , EnumSet.noneOf( Flag.class ) ) ) {
			return 0;
		}

		load.replaceMnemonic( Mnemonic.LDZ );
		for ( Instruction store : stores ) {
			store.replaceMnemonic( Mnemonic.STZ );
		}
		for ( Instruction reload : reloads ) {
			reload.markDead();
		}
		logRewrite( "LDZ "+load.getOperand()+" with "+stores.size()+" STZ" , load );
		return 1 + reloads.size();
	}

	private static boolean isStoreZCandidate(Instruction insn) {
		return insn.is( Mnemonic.STA ) && insn.getOperand().addressingMode.supportsStoreZ();
	}

	private int negate(InstructionStream stream,int index)
	{
		final Instruction eor = stream.get( index );
		if ( ! eor.getOperand().isImmediate() || ! eor.getOperand().hasValue( 0xff ) ) {
			return 0;
		}
		final int sec = nextInWindow( stream , index , Mnemonic.SEC );
		if ( sec == -1 ) {
			return 0;
		}
		final int adc = nextInWindow( stream , sec , Mnemonic.ADC );
		if ( adc == -1 || ! stream.get( adc ).getOperand().isImmediate() || ! stream.get( adc ).getOperand().hasValue( 0 ) ) {
			return 0;
		}
		// NEG leaves C and V alone
		if ( ! RegisterLiveness.isDeadAfter( stream , adc , EnumSet.noneOf( Register.class ) , EnumSet.of( Flag.CARRY , Flag.OVERFLOW ) ) ) {
			return 0;
		}
		eor.replaceMnemonic( Mnemonic.NEG );
		eor.replaceOperand( "" );
		stream.get( sec ).markDead();
		stream.get( adc ).markDead();
		logRewrite( "EOR/SEC/ADC -> NEG" , eor );
		return 1;
	}

	private int arithmeticShiftRight(InstructionStream stream,int index)
	{
		final Instruction cmp = stream.get( index );
		if ( ! cmp.getOperand().isImmediate() || ! cmp.getOperand().hasValue( 0x80 ) ) {
			return 0;
		}
		final int ror = nextInWindow( stream , index , Mnemonic.ROR );
		if ( ror == -1 || ! stream.get( ror ).getOperand().isAccumulatorForm() ) {
			return 0;
		}
		cmp.replaceMnemonic( Mnemonic.ASR );
		cmp.replaceOperand( "" );
		stream.get( ror ).markDead();
		logRewrite( "CMP/ROR -> ASR" , cmp );
		return 1;
	}
}
