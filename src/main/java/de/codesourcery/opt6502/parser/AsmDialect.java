package de.codesourcery.opt6502.parser;

import org.apache.commons.lang.StringUtils;

/**
 * Syntax rules of the assemblers whose source the optimizer can read and write.
 */
public enum AsmDialect
{
	GENERIC("generic" , new String[]{ ";" , "//" } , true , "@" , false),
	CA65("ca65" , new String[]{ ";" } , true , "@" , false),
	KICKASS("kick" , new String[]{ "//" } , true , "!" , true , "kickass"),
	ACME("acme" , new String[]{ ";" } , true , "." , false),
	DASM("dasm" , new String[]{ ";" } , true , "." , true),
	TASS("tass" , new String[]{ ";" } , true , "@" , false),
	TASS64("64tass" , new String[]{ ";" } , true , null , false),
	BUDDY("buddy" , new String[]{ "//" } , true , "@" , false),
	MERLIN("merlin" , new String[]{ ";" } , false , ":" , false),
	LISA("lisa" , new String[]{ ";" } , true , "." , false);

	public final String name;
	private final String[] aliases;
	private final String[] commentMarkers;
	private final boolean colonLabels;
	private final String localLabelPrefix;
	private final boolean numericLocalLabels;

	private AsmDialect(String name,String[] commentMarkers,boolean colonLabels,String localLabelPrefix,boolean numericLocalLabels,String... aliases)
	{
		this.name = name;
		this.aliases = aliases;
		this.commentMarkers = commentMarkers;
		this.colonLabels = colonLabels;
		this.localLabelPrefix = localLabelPrefix;
		this.numericLocalLabels = numericLocalLabels;
	}

	/**
	 * Looks up a dialect by name, falling back to {@link #GENERIC} for unknown names.
	 */
	public static AsmDialect fromName(String name)
	{
		if ( StringUtils.isNotBlank( name ) )
		{
			final String s = name.trim();
			for ( AsmDialect d : values() )
			{
				if ( d.name.equalsIgnoreCase( s ) ) {
					return d;
				}
				for ( String alias : d.aliases ) {
					if ( alias.equalsIgnoreCase( s ) ) {
						return d;
					}
				}
			}
		}
		return GENERIC;
	}

	/**
	 * Comment marker used when writing output.
	 */
	public String getCommentMarker() {
		return commentMarkers[0];
	}

	/**
	 * Returns the length of the comment marker starting at the given position or 0
	 * if no comment starts there.
	 */
	public int commentMarkerLength(String line,int position)
	{
		for ( String marker : commentMarkers ) {
			if ( line.startsWith( marker , position ) ) {
				return marker.length();
			}
		}
		return 0;
	}

	public boolean isCommentStart(String line,int position) {
		return commentMarkerLength( line , position ) > 0;
	}

	public boolean supportsColonLabels() {
		return colonLabels;
	}

	public boolean isLocalLabel(String label)
	{
		if ( StringUtils.isBlank( label ) ) {
			return false;
		}
		if ( localLabelPrefix != null && label.startsWith( localLabelPrefix ) ) {
			return true;
		}
		return numericLocalLabels && StringUtils.isNumeric( label );
	}

	@Override
	public String toString() {
		return name;
	}
}
