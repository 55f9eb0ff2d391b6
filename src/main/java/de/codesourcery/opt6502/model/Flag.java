package de.codesourcery.opt6502.model;

/**
 * Processor flags whose state is tracked by the optimizer.
 *
 * I and D are deliberately absent, instructions touching them are treated as
 * having no trackable effect.
 */
public enum Flag
{
	CARRY('C' , "Carry"),
	NEGATIVE('N' , "Negative"),
	ZERO('Z' , "Zero"),
	OVERFLOW('V' , "Overflow");

	public final char symbol;
	public final String displayName;

	private Flag(char symbol,String displayName) {
		this.symbol = symbol;
		this.displayName = displayName;
	}

	public static Flag fromSymbol(char c)
	{
		final char flag = Character.toUpperCase( c );
		for ( int i = 0 ; i < values().length ; i++ ) {
			if ( values()[i].symbol == flag ) {
				return values()[i];
			}
		}
		throw new IllegalArgumentException("Unknown flag symbol: "+c);
	}
}
