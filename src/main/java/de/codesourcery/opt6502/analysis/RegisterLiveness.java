package de.codesourcery.opt6502.analysis;

import java.util.EnumSet;
import java.util.Set;

import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;
import de.codesourcery.opt6502.model.Register;

/**
 * Checks whether register or flag values are overwritten before anything reads them.
 *
 * The look-ahead only follows the fall-through path. Anything that may transfer control elsewhere
 * (branches, jumps, calls, returns) or whose effects are unknown counts as a read. Reaching
 * the end of the program counts as "not read".
 */
public final class RegisterLiveness
{
	private RegisterLiveness() {
	}

	/**
	 * Checks whether the given registers and flags are dead after an instruction.
	 *
	 * @param stream
	 * @param index index of the instruction after which to start looking
	 * @param registers
	 * @param flags
	 * @return <code>true</code> if every register and flag is overwritten before being read
	 */
	public static boolean isDeadAfter(InstructionStream stream,int index,Set<Register> registers,Set<Flag> flags)
	{
		final Set<Register> pendingRegisters = registers.isEmpty() ? EnumSet.noneOf( Register.class ) : EnumSet.copyOf( registers );
		final Set<Flag> pendingFlags = flags.isEmpty() ? EnumSet.noneOf( Flag.class ) : EnumSet.copyOf( flags );

		for ( int i = index+1 , len = stream.size() ; i < len ; i++ )
		{
			if ( pendingRegisters.isEmpty() && pendingFlags.isEmpty() ) {
				return true;
			}
			final Instruction insn = stream.get( i );
			if ( insn.isDead() || ! insn.hasOpcode() ) {
				continue;
			}
			if ( insn.isNoOptimize() || insn.isOpaque() ) {
				return false;
			}
			final Mnemonic m = insn.getMnemonic();
			if ( m.isControlFlow() || m.hasUnmodelledEffects() ) {
				return false;
			}
			for ( Register r : m.getRegistersRead( insn.getOperand() ) ) {
				if ( pendingRegisters.contains( r ) ) {
					return false;
				}
			}
			for ( Flag f : m.getFlagsRead() ) {
				if ( pendingFlags.contains( f ) ) {
					return false;
				}
			}
			pendingRegisters.removeAll( m.getRegistersWritten( insn.getOperand() ) );
			pendingFlags.removeAll( m.getFlagsWritten( insn.getOperand() ) );
		}
		return true;
	}

	public static boolean isDeadAfter(InstructionStream stream,int index,Register register) {
		return isDeadAfter( stream , index , EnumSet.of( register ) , EnumSet.noneOf( Flag.class ) );
	}
}
