package de.codesourcery.opt6502.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Register;

/**
 * Register and flag usage statistics of an optimized program.
 */
public class ValidationReport
{
	private int instructionCount;
	private int registerModifications;
	private int flagModifications;

	private final Set<Register> registersUsed = EnumSet.noneOf( Register.class );
	private final Set<Flag> flagsAffected = EnumSet.noneOf( Flag.class );
	private final List<String> snapshots = new ArrayList<>();

	protected void instructionVisited() {
		instructionCount++;
	}

	protected void registerModified(Register r)
	{
		registerModifications++;
		registersUsed.add( r );
	}

	protected void registerRead(Register r) {
		registersUsed.add( r );
	}

	protected void flagModified(Flag f)
	{
		flagModifications++;
		flagsAffected.add( f );
	}

	protected void addSnapshot(String snapshot) {
		snapshots.add( snapshot );
	}

	public int getInstructionCount() {
		return instructionCount;
	}

	public int getRegisterModifications() {
		return registerModifications;
	}

	public int getFlagModifications() {
		return flagModifications;
	}

	public Set<Register> getRegistersUsed() {
		return Collections.unmodifiableSet( registersUsed );
	}

	public Set<Flag> getFlagsAffected() {
		return Collections.unmodifiableSet( flagsAffected );
	}

	/**
	 * Per-instruction register states, only recorded at trace level 2 and above.
	 */
	public List<String> getSnapshots() {
		return Collections.unmodifiableList( snapshots );
	}

	@Override
	public String toString()
	{
		final StringBuilder buffer = new StringBuilder();
		buffer.append("Instructions analyzed  : ").append( instructionCount ).append("\n");
		buffer.append("Register modifications : ").append( registerModifications ).append("\n");
		buffer.append("Flag modifications     : ").append( flagModifications ).append("\n");
		buffer.append("Registers used         : ");
		for ( Register r : registersUsed ) {
			buffer.append( r.symbol ).append(" ");
		}
		buffer.append("\n");
		buffer.append("Flags affected         : ");
		for ( Flag f : flagsAffected ) {
			buffer.append( f.symbol ).append(" ");
		}
		return buffer.toString().trim();
	}
}
