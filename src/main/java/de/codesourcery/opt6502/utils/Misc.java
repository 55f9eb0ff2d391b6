package de.codesourcery.opt6502.utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;

public class Misc
{
	private static final Pattern HEX_NUMBER = Pattern.compile("^(?:\\$|0[xX])([0-9a-fA-F]+)$");
	private static final Pattern BINARY_NUMBER = Pattern.compile("^%([01]+)$");
	private static final Pattern DECIMAL_NUMBER = Pattern.compile("^([0-9]+)$");
	private static final Pattern CHARACTER_LITERAL = Pattern.compile("^'(.)'?$");

	public static String to8BitHex(int value) {
		return "$"+StringUtils.leftPad( Integer.toHexString( value & 0xff ).toUpperCase() , 2 , '0' );
	}

	/**
	 * Parses a plain numeric literal.
	 *
	 * Understands <code>$ff</code>, <code>0xff</code>, <code>%1010</code>,
	 * decimal numbers and single-character literals (<code>'a'</code>).
	 *
	 * @param input
	 * @return the value or <code>null</code> if the input is not a plain number (expression,symbol,...)
	 */
	public static Integer parseNumber(String input)
	{
		if ( StringUtils.isBlank( input ) ) {
			return null;
		}
		final String s = input.trim();
		Matcher m = HEX_NUMBER.matcher( s );
		if ( m.matches() ) {
			return parse( m.group(1) , 16 );
		}
		m = BINARY_NUMBER.matcher( s );
		if ( m.matches() ) {
			return parse( m.group(1) , 2 );
		}
		m = DECIMAL_NUMBER.matcher( s );
		if ( m.matches() ) {
			return parse( m.group(1) , 10 );
		}
		m = CHARACTER_LITERAL.matcher( s );
		if ( m.matches() ) {
			return (int) m.group(1).charAt(0);
		}
		return null;
	}

	private static Integer parse(String digits,int radix)
	{
		try {
			return Integer.parseInt( digits , radix );
		}
		catch(NumberFormatException e) {
			// too large to be a 6502 value anyway
			return null;
		}
	}

	public static boolean isZeroPage(int value) {
		return value >= 0 && value <= 0xff;
	}
}
