package de.codesourcery.opt6502.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;

/**
 * Turns source text into an {@link InstructionStream}, one record per line.
 *
 * Comment lines starting with <code>#NOOPT</code> disable optimization for all following lines until
 * a comment line starting with <code>#OPT</code> is encountered.
 */
public class SourceReader
{
	private static final Logger LOG = LoggerFactory.getLogger( SourceReader.class );

	public static final String DISABLE_DIRECTIVE = "#NOOPT";
	public static final String ENABLE_DIRECTIVE = "#OPT";

	private final AsmDialect dialect;
	private final LineParser parser;
	private final boolean initiallyEnabled;

	public SourceReader(AsmDialect dialect) {
		this( dialect , true );
	}

	public SourceReader(AsmDialect dialect,boolean optimizationsInitiallyEnabled)
	{
		Validate.notNull( dialect , "dialect must not be NULL" );
		this.dialect = dialect;
		this.parser = new LineParser( dialect );
		this.initiallyEnabled = optimizationsInitiallyEnabled;
	}

	public InstructionStream read(InputStream in) throws IOException
	{
		return read( IOUtils.readLines( in , StandardCharsets.UTF_8 ) );
	}

	public InstructionStream read(String source)
	{
		if ( source.isEmpty() ) {
			return new InstructionStream();
		}
		final List<String> lines = Arrays.asList( source.split("\r?\n",-1) );
		if ( source.endsWith("\n") ) {
			return read( lines.subList( 0 , lines.size() - 1 ) );
		}
		return read( lines );
	}

	public InstructionStream read(List<String> lines)
	{
		final InstructionStream result = new InstructionStream();
		boolean enabled = initiallyEnabled;
		int lineNumber = 1;
		for ( String line : lines )
		{
			final String directive = getDirective( line );
			if ( directive != null )
			{
				if ( directive.startsWith( DISABLE_DIRECTIVE ) )
				{
					enabled = false;
					LOG.info("Optimization disabled at line {}", lineNumber);
				}
				else if ( directive.startsWith( ENABLE_DIRECTIVE ) )
				{
					enabled = true;
					LOG.info("Optimization enabled at line {}", lineNumber);
				}
			}
			final Instruction instruction = parser.parse( lineNumber , line );
			instruction.setNoOptimize( ! enabled );
			result.add( instruction );
			lineNumber++;
		}
		return result;
	}

	/**
	 * Returns the comment text (without marker) of a comment-only line or <code>null</code>.
	 */
	private String getDirective(String line)
	{
		final String trimmed = line.trim();
		final int markerLength = dialect.commentMarkerLength( trimmed , 0 );
		if ( markerLength == 0 ) {
			return null;
		}
		return trimmed.substring( markerLength ).trim();
	}
}
