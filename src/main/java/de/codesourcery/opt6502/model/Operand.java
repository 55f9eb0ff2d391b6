package de.codesourcery.opt6502.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.opt6502.utils.Misc;

/**
 * Structured instruction operand.
 *
 * Keeps the source text for output and derives the addressing mode plus, where the operand
 * is a plain number, its numeric value. Two operands with different spelling but the same
 * numeric value (<code>#$00</code> and <code>#0</code>) are considered equal by {@link #sameAs(Operand)}.
 */
public final class Operand
{
	private static final Pattern INDEXED_INDIRECT_X = Pattern.compile("^\\((.+),X\\)$");
	private static final Pattern INDIRECT_INDEXED_Y = Pattern.compile("^\\((.+)\\),Y$");
	private static final Pattern INDIRECT_INDEXED_Z = Pattern.compile("^\\((.+)\\),Z$");
	private static final Pattern STACK_RELATIVE_INDIRECT = Pattern.compile("^\\((.+),S\\),Y$");
	private static final Pattern INDIRECT = Pattern.compile("^\\((.+)\\)$");

	public final String text;
	public final AddressingMode addressingMode;

	/**
	 * The operand with '#', parentheses and index register stripped, whitespace removed.
	 */
	public final String expression;

	/**
	 * Numeric value of {@link #expression} or <code>null</code> if it is not a plain number.
	 */
	public final Integer value;

	private Operand(String text, AddressingMode addressingMode, String expression, Integer value)
	{
		this.text = text;
		this.addressingMode = addressingMode;
		this.expression = expression;
		this.value = value;
	}

	public static Operand parse(String input)
	{
		Validate.notNull( input , "input must not be NULL" );

		final String text = input.trim();
		final String compact = StringUtils.deleteWhitespace( text );
		final String upper = compact.toUpperCase();

		if ( compact.isEmpty() ) {
			return new Operand( text , AddressingMode.IMPLIED , "" , null );
		}
		if ( upper.equals("A") ) {
			return new Operand( text , AddressingMode.ACCUMULATOR , "" , null );
		}
		if ( compact.startsWith("#") )
		{
			final String expr = compact.substring(1);
			return new Operand( text , AddressingMode.IMMEDIATE , expr , Misc.parseNumber( expr ) );
		}
		if ( compact.startsWith("[") ) {
			return new Operand( text , AddressingMode.OTHER , compact , null );
		}
		if ( compact.startsWith("(") )
		{
			Matcher m = STACK_RELATIVE_INDIRECT.matcher( upper );
			if ( m.matches() ) {
				return indirect( text , compact , AddressingMode.STACK_RELATIVE , m.group(1).length() );
			}
			m = INDEXED_INDIRECT_X.matcher( upper );
			if ( m.matches() ) {
				return indirect( text , compact , AddressingMode.INDEXED_INDIRECT_X , m.group(1).length() );
			}
			m = INDIRECT_INDEXED_Y.matcher( upper );
			if ( m.matches() ) {
				return indirect( text , compact , AddressingMode.INDIRECT_INDEXED_Y , m.group(1).length() );
			}
			m = INDIRECT_INDEXED_Z.matcher( upper );
			if ( m.matches() ) {
				return indirect( text , compact , AddressingMode.INDIRECT_INDEXED_Z , m.group(1).length() );
			}
			m = INDIRECT.matcher( upper );
			if ( m.matches() ) {
				return indirect( text , compact , AddressingMode.INDIRECT , m.group(1).length() );
			}
			return new Operand( text , AddressingMode.OTHER , compact , null );
		}

		final int comma = compact.lastIndexOf(',');
		if ( comma == -1 )
		{
			final Integer value = Misc.parseNumber( compact );
			final AddressingMode mode = value != null && Misc.isZeroPage( value ) ? AddressingMode.ZERO_PAGE : AddressingMode.ABSOLUTE;
			return new Operand( text , mode , compact , value );
		}

		final String base = compact.substring( 0 , comma );
		final Integer value = Misc.parseNumber( base );
		final boolean zeroPage = value != null && Misc.isZeroPage( value );
		switch( upper.substring( comma+1 ) )
		{
			case "X":
				return new Operand( text , zeroPage ? AddressingMode.ZERO_PAGE_X : AddressingMode.ABSOLUTE_INDEXED_X , base , value );
			case "Y":
				return new Operand( text , zeroPage ? AddressingMode.ZERO_PAGE_Y : AddressingMode.ABSOLUTE_INDEXED_Y , base , value );
			case "S":
				return new Operand( text , AddressingMode.STACK_RELATIVE , base , value );
			default:
				// macro arguments, data lists, 45GS02 bit-branch operands, ...
				return new Operand( text , AddressingMode.OTHER , compact , null );
		}
	}

	private static Operand indirect(String text,String compact,AddressingMode mode,int innerLength)
	{
		final String expr = compact.substring( 1 , 1+innerLength );
		return new Operand( text , mode , expr , Misc.parseNumber( expr ) );
	}

	public boolean isImmediate() {
		return addressingMode == AddressingMode.IMMEDIATE;
	}

	/**
	 * Whether the operand is empty or explicitly names the accumulator.
	 */
	public boolean isAccumulatorForm() {
		return addressingMode == AddressingMode.IMPLIED || addressingMode == AddressingMode.ACCUMULATOR;
	}

	public boolean hasValue() {
		return value != null;
	}

	public boolean hasValue(int expected) {
		return value != null && value.intValue() == expected;
	}

	/**
	 * Checks whether this operand denotes the same value (immediate) or the same
	 * memory location (everything else) as another one.
	 */
	public boolean sameAs(Operand other)
	{
		if ( other == null || other.addressingMode != this.addressingMode ) {
			return false;
		}
		if ( this.value != null && other.value != null ) {
			return this.value.intValue() == other.value.intValue();
		}
		if ( this.value != null || other.value != null ) {
			return false;
		}
		return this.expression.equals( other.expression );
	}

	@Override
	public String toString() {
		return text;
	}
}
