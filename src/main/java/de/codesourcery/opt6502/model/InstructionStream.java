package de.codesourcery.opt6502.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang.Validate;

/**
 * Ordered sequence of source lines.
 *
 * Lines are appended while reading and afterwards only ever flagged, the single
 * exception being {@link #insertAfter(int, List)} used by the subroutine inliner.
 */
public final class InstructionStream implements Iterable<Instruction>
{
	private final List<Instruction> instructions = new ArrayList<>();

	public InstructionStream() {
	}

	public InstructionStream(List<Instruction> instructions)
	{
		for ( Instruction i : instructions ) {
			add( i );
		}
	}

	public void add(Instruction instruction)
	{
		Validate.notNull( instruction , "instruction must not be NULL" );
		instructions.add( instruction );
	}

	public Instruction get(int index) {
		return instructions.get( index );
	}

	public int size() {
		return instructions.size();
	}

	public boolean isEmpty() {
		return instructions.isEmpty();
	}

	/**
	 * Looks up an instruction by identity.
	 *
	 * @return index or -1
	 */
	public int indexOf(Instruction instruction)
	{
		for ( int i = 0 , len = instructions.size() ; i < len ; i++ ) {
			if ( instructions.get(i) == instruction ) {
				return i;
			}
		}
		return -1;
	}

	public void insertAfter(int index,List<Instruction> toInsert)
	{
		Validate.isTrue( index >= 0 && index < instructions.size() , "index out of range: "+index );
		instructions.addAll( index+1 , toInsert );
	}

	public int getDeadCount()
	{
		int count = 0;
		for ( Instruction i : instructions ) {
			if ( i.isDead() ) {
				count++;
			}
		}
		return count;
	}

	public List<Instruction> getInstructions() {
		return Collections.unmodifiableList( instructions );
	}

	@Override
	public Iterator<Instruction> iterator() {
		return getInstructions().iterator();
	}
}
