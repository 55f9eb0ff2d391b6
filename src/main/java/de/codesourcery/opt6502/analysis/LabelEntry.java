package de.codesourcery.opt6502.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import de.codesourcery.opt6502.model.Instruction;

/**
 * A label definition together with everything referring to it.
 */
public class LabelEntry
{
	public final String name;
	public final Instruction definition;

	/**
	 * Name of the enclosing global label for local labels, <code>null</code> for global labels.
	 */
	public final String scope;

	private final List<Instruction> references = new ArrayList<>();
	private boolean subroutine;
	private Instruction bodyEnd;

	public LabelEntry(String name, Instruction definition, String scope)
	{
		this.name = name;
		this.definition = definition;
		this.scope = scope;
	}

	public boolean isLocal() {
		return scope != null;
	}

	public void addReference(Instruction instruction)
	{
		if ( ! references.contains( instruction ) ) {
			references.add( instruction );
		}
	}

	public List<Instruction> getReferences() {
		return Collections.unmodifiableList( references );
	}

	public int getReferenceCount() {
		return references.size();
	}

	public boolean isSubroutine() {
		return subroutine;
	}

	public void setSubroutine(boolean subroutine) {
		this.subroutine = subroutine;
	}

	/**
	 * Returns the return instruction that ends this subroutine's body.
	 *
	 * @return return instruction or <code>null</code> if none could be found
	 */
	public Instruction getBodyEnd() {
		return bodyEnd;
	}

	public void setBodyEnd(Instruction bodyEnd) {
		this.bodyEnd = bodyEnd;
	}

	public boolean isBounded() {
		return bodyEnd != null;
	}

	@Override
	public String toString()
	{
		return ( scope == null ? name : scope+"::"+name )+" (line "+definition.lineNumber+", "+references.size()+" references"+
				( subroutine ? ", subroutine" : "" )+")";
	}
}
