package de.codesourcery.opt6502.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang.Validate;

public class LabelTable implements ILabelTable
{
	private final Map<String,LabelEntry> globalLabels = new LinkedHashMap<>();
	private final Map<String,Map<String,LabelEntry>> localLabels = new LinkedHashMap<>();

	private final List<String> warnings = new ArrayList<>();

	@Override
	public List<LabelEntry> getGlobalLabels() {
		return new ArrayList<>( globalLabels.values() );
	}

	@Override
	public List<LabelEntry> getLocalLabels(String scope)
	{
		final Map<String, LabelEntry> map = localLabels.get( scope );
		if ( map == null ) {
			return new ArrayList<>();
		}
		return new ArrayList<>( map.values() );
	}

	@Override
	public List<LabelEntry> getAllLabels()
	{
		final List<LabelEntry> result = new ArrayList<>( globalLabels.values() );
		for ( Map<String, LabelEntry> map : localLabels.values() ) {
			result.addAll( map.values() );
		}
		return result;
	}

	@Override
	public LabelEntry getLabel(String name, String scope)
	{
		if ( scope == null ) {
			return globalLabels.get( name );
		}
		final Map<String, LabelEntry> map = localLabels.get( scope );
		return map == null ? null : map.get( name );
	}

	@Override
	public boolean isDefined(String name, String scope) {
		return getLabel( name , scope ) != null;
	}

	/**
	 * Adds a label.
	 *
	 * Redefinitions are ignored, the first definition wins.
	 */
	@Override
	public void defineLabel(LabelEntry entry)
	{
		Validate.notNull( entry , "entry must not be NULL" );
		if ( entry.scope == null )
		{
			if ( ! globalLabels.containsKey( entry.name ) ) {
				globalLabels.put( entry.name , entry );
			}
			return;
		}
		Map<String, LabelEntry> map = localLabels.get( entry.scope );
		if ( map == null ) {
			map = new LinkedHashMap<>();
			localLabels.put( entry.scope , map );
		}
		if ( ! map.containsKey( entry.name ) ) {
			map.put( entry.name , entry );
		}
	}

	public List<LabelEntry> getSubroutines()
	{
		final List<LabelEntry> result = new ArrayList<>();
		for ( LabelEntry e : getAllLabels() ) {
			if ( e.isSubroutine() ) {
				result.add( e );
			}
		}
		return result;
	}

	public void addWarning(String warning) {
		warnings.add( warning );
	}

	public List<String> getWarnings() {
		return Collections.unmodifiableList( warnings );
	}

	@Override
	public String toString()
	{
		final StringBuilder buffer = new StringBuilder("=== Label table ===\n");
		for ( LabelEntry global : globalLabels.values() )
		{
			buffer.append("\n").append( global );
			for ( LabelEntry local : getLocalLabels( global.name ) ) {
				buffer.append("\n    ").append( local );
			}
		}
		return buffer.toString();
	}
}
