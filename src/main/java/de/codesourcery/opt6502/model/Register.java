package de.codesourcery.opt6502.model;

/**
 * CPU registers whose contents are tracked by the optimizer.
 *
 * The Z register only exists on the 45GS02.
 */
public enum Register
{
	A('A'),
	X('X'),
	Y('Y'),
	Z('Z');

	public final char symbol;

	private Register(char symbol) {
		this.symbol = symbol;
	}

	public static Register fromSymbol(char c)
	{
		final char reg = Character.toUpperCase( c );
		for ( int i = 0 ; i < values().length ; i++ ) {
			if ( values()[i].symbol == reg ) {
				return values()[i];
			}
		}
		throw new IllegalArgumentException("Unknown register symbol: "+c);
	}
}
