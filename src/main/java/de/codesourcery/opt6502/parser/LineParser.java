package de.codesourcery.opt6502.parser;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.Mnemonic;

/**
 * Splits a source line into label, opcode, operand and comment.
 */
public class LineParser
{
	private final AsmDialect dialect;

	public LineParser(AsmDialect dialect)
	{
		Validate.notNull( dialect , "dialect must not be NULL" );
		this.dialect = dialect;
	}

	public Instruction parse(int lineNumber,String line)
	{
		final String input = line == null ? "" : StringUtils.stripEnd( line , "\r\n" );

		final int commentStart = findCommentStart( input );
		final String code = commentStart == -1 ? input : input.substring( 0 , commentStart );
		final String comment = commentStart == -1 ? null : input.substring( commentStart ).trim();

		if ( StringUtils.isBlank( code ) ) {
			return new Instruction( lineNumber , input , null , null , null , comment );
		}

		String label = null;
		String rest = code;
		if ( ! Character.isWhitespace( code.charAt( 0 ) ) )
		{
			int end = 0;
			// a leading colon is part of the name (Merlin local labels)
			while ( end < code.length() && ! Character.isWhitespace( code.charAt( end ) ) && ( code.charAt( end ) != ':' || end == 0 ) ) {
				end++;
			}
			final String word = code.substring( 0 , end );
			if ( isLabel( word ) )
			{
				label = word;
				if ( end < code.length() && code.charAt( end ) == ':' ) {
					end++;
				}
				rest = code.substring( end );
			}
		}

		rest = rest.trim();
		String opcode = null;
		String operand = null;
		if ( rest.length() > 0 )
		{
			int end = 0;
			while ( end < rest.length() && ! Character.isWhitespace( rest.charAt( end ) ) ) {
				end++;
			}
			opcode = rest.substring( 0 , end );
			operand = rest.substring( end ).trim();
		}
		return new Instruction( lineNumber , input , label , opcode , operand , comment );
	}

	private boolean isLabel(String word)
	{
		if ( word.isEmpty() || word.startsWith("*") ) {
			return false;
		}
		return Mnemonic.fromString( word ) == null;
	}

	/**
	 * Finds the start of the comment, ignoring comment markers inside string or character literals.
	 *
	 * @return index or -1
	 */
	protected int findCommentStart(String line)
	{
		boolean inString = false;
		for ( int i = 0 , len = line.length() ; i < len ; i++ )
		{
			final char c = line.charAt( i );
			if ( inString )
			{
				if ( c == '"' ) {
					inString = false;
				}
				continue;
			}
			if ( c == '"' ) {
				inString = true;
			}
			else if ( c == '\'' )
			{
				// 'x' or just 'x
				i++;
				if ( i+1 < len && line.charAt( i+1 ) == '\'' ) {
					i++;
				}
			}
			else if ( dialect.isCommentStart( line , i ) ) {
				return i;
			}
		}
		return -1;
	}
}
