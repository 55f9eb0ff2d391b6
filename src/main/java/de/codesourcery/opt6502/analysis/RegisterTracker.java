package de.codesourcery.opt6502.analysis;

import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.Mnemonic;
import de.codesourcery.opt6502.model.Operand;
import de.codesourcery.opt6502.model.Register;

/**
 * Forward abstract interpretation of register and flag contents.
 *
 * Instruction effects are taken from {@link Mnemonic}. Reaching a branch target
 * forgets everything since the state on other incoming paths is unknown.
 */
public class RegisterTracker
{
	/**
	 * Computes the state after executing an instruction.
	 *
	 * @param insn
	 * @param state state before the instruction, never modified
	 * @return new state
	 */
	public RegisterState step(Instruction insn,RegisterState state)
	{
		final RegisterState result = state.copy();
		result.clearModified();

		if ( insn.isDead() ) {
			return result;
		}
		if ( insn.isBranchTarget() ) {
			result.invalidateAll();
		}
		if ( ! insn.hasOpcode() ) {
			return result;
		}
		if ( insn.isOpaque() )
		{
			result.invalidateAll();
			return result;
		}

		final Mnemonic m = insn.getMnemonic();
		final Operand operand = insn.getOperand();
		for ( Register r : m.getRegistersWritten( operand ) ) {
			result.setModified( r );
		}

		switch( m.category )
		{
			case LOAD:
				final Register target = m.getRegistersWritten( operand ).iterator().next();
				if ( operand.isImmediate() )
				{
					result.setKnown( target , operand );
					result.setNZ( operand );
				}
				else
				{
					result.setUnknown( target );
					result.setNZ( null );
				}
				return result;
			case STORE:
				return result;
			case TRANSFER:
				transfer( m , operand , result );
				return result;
			case CALL:
			case OTHER:
				result.invalidateAll();
				return result;
			case INTERRUPT_RETURN:
				result.invalidateFlags();
				return result;
			case FLAG:
				switch( m )
				{
					case CLC:
						result.setFlag( Flag.CARRY , false );
						break;
					case SEC:
						result.setFlag( Flag.CARRY , true );
						break;
					case CLV:
						result.setFlag( Flag.OVERFLOW , false );
						break;
					default:
						// I and D are not tracked
				}
				return result;
			default:
				for ( Register r : m.getRegistersWritten( operand ) ) {
					result.setUnknown( r );
				}
				for ( Flag f : m.getFlagsWritten( operand ) ) {
					result.setUnknown( f );
				}
				if ( m == Mnemonic.LSR ) {
					result.setFlag( Flag.NEGATIVE , false );
				}
				else if ( m == Mnemonic.NEG ) {
					result.setUnknown( Flag.CARRY );
				}
				return result;
		}
	}

	private void transfer(Mnemonic m,Operand operand,RegisterState result)
	{
		if ( m == Mnemonic.TXS ) {
			return;
		}
		final Register target = m.getRegistersWritten( operand ).iterator().next();
		if ( m == Mnemonic.TSX )
		{
			// stack pointer is not tracked
			result.setUnknown( target );
			result.setNZ( null );
			return;
		}
		final Register source = m.getRegistersRead( operand ).iterator().next();
		final Operand value = result.getValue( source );
		if ( value != null ) {
			result.setKnown( target , value );
		} else {
			result.setUnknown( target );
		}
		result.setNZ( value );
	}
}
