package de.codesourcery.opt6502.analysis;

import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Operand;
import de.codesourcery.opt6502.model.Register;
import de.codesourcery.opt6502.utils.Misc;

/**
 * What is statically known about registers and flags at one point of the program.
 */
public final class RegisterState
{
	private static final int REGISTER_COUNT = Register.values().length;
	private static final int FLAG_COUNT = Flag.values().length;

	private final boolean[] registerKnown = new boolean[ REGISTER_COUNT ];
	private final Operand[] registerValue = new Operand[ REGISTER_COUNT ];
	private final boolean[] registerModified = new boolean[ REGISTER_COUNT ];

	private final boolean[] flagKnown = new boolean[ FLAG_COUNT ];
	private final boolean[] flagValue = new boolean[ FLAG_COUNT ];

	/**
	 * Creates a state where nothing is known.
	 */
	public RegisterState() {
	}

	private RegisterState(RegisterState other)
	{
		System.arraycopy( other.registerKnown , 0 , registerKnown , 0 , REGISTER_COUNT );
		System.arraycopy( other.registerValue , 0 , registerValue , 0 , REGISTER_COUNT );
		System.arraycopy( other.registerModified , 0 , registerModified , 0 , REGISTER_COUNT );
		System.arraycopy( other.flagKnown , 0 , flagKnown , 0 , FLAG_COUNT );
		System.arraycopy( other.flagValue , 0 , flagValue , 0 , FLAG_COUNT );
	}

	public RegisterState copy() {
		return new RegisterState( this );
	}

	public boolean isKnown(Register r) {
		return registerKnown[ r.ordinal() ];
	}

	/**
	 * Returns the immediate operand that was last loaded into a register.
	 *
	 * @return operand or <code>null</code> if the register's contents are unknown
	 */
	public Operand getValue(Register r) {
		return registerKnown[ r.ordinal() ] ? registerValue[ r.ordinal() ] : null;
	}

	/**
	 * @return <code>true</code> if the register is known to be zero, <code>false</code> if it is known to be non-zero
	 * and <code>null</code> if this is unknown
	 */
	public Boolean isZero(Register r)
	{
		final Operand value = getValue( r );
		if ( value == null || ! value.hasValue() ) {
			return null;
		}
		return ( value.value.intValue() & 0xff ) == 0;
	}

	public void setKnown(Register r,Operand value)
	{
		registerKnown[ r.ordinal() ] = true;
		registerValue[ r.ordinal() ] = value;
	}

	public void setUnknown(Register r)
	{
		registerKnown[ r.ordinal() ] = false;
		registerValue[ r.ordinal() ] = null;
	}

	public boolean isModified(Register r) {
		return registerModified[ r.ordinal() ];
	}

	public void setModified(Register r) {
		registerModified[ r.ordinal() ] = true;
	}

	public void clearModified()
	{
		for ( int i = 0 ; i < REGISTER_COUNT ; i++ ) {
			registerModified[i] = false;
		}
	}

	public boolean isKnown(Flag f) {
		return flagKnown[ f.ordinal() ];
	}

	/**
	 * Returns a flag's value.
	 *
	 * @return value or <code>null</code> if unknown
	 */
	public Boolean getFlag(Flag f) {
		return flagKnown[ f.ordinal() ] ? Boolean.valueOf( flagValue[ f.ordinal() ] ) : null;
	}

	public void setFlag(Flag f,boolean value)
	{
		flagKnown[ f.ordinal() ] = true;
		flagValue[ f.ordinal() ] = value;
	}

	public void setUnknown(Flag f)
	{
		flagKnown[ f.ordinal() ] = false;
		flagValue[ f.ordinal() ] = false;
	}

	/**
	 * Sets N and Z according to a value that was just loaded, or marks them unknown
	 * if the value is not a plain number.
	 */
	public void setNZ(Operand value)
	{
		if ( value != null && value.hasValue() )
		{
			final int v = value.value.intValue() & 0xff;
			setFlag( Flag.NEGATIVE , ( v & 0x80 ) != 0 );
			setFlag( Flag.ZERO , v == 0 );
		}
		else
		{
			setUnknown( Flag.NEGATIVE );
			setUnknown( Flag.ZERO );
		}
	}

	public void invalidateRegisters()
	{
		for ( Register r : Register.values() ) {
			setUnknown( r );
		}
	}

	public void invalidateFlags()
	{
		for ( Flag f : Flag.values() ) {
			setUnknown( f );
		}
	}

	public void invalidateAll()
	{
		invalidateRegisters();
		invalidateFlags();
	}

	@Override
	public String toString()
	{
		final StringBuilder buffer = new StringBuilder();
		for ( Register r : Register.values() )
		{
			final Operand value = getValue( r );
			buffer.append( r.symbol ).append("=");
			if ( value == null ) {
				buffer.append("?");
			} else {
				buffer.append( value.hasValue() ? Misc.to8BitHex( value.value ) : value.expression );
			}
			if ( isModified( r ) ) {
				buffer.append("*");
			}
			buffer.append(" ");
		}
		for ( Flag f : Flag.values() )
		{
			final Boolean value = getFlag( f );
			buffer.append( f.symbol ).append("=").append( value == null ? "?" : ( value ? "1" : "0" ) );
			if ( f.ordinal() < FLAG_COUNT-1 ) {
				buffer.append(" ");
			}
		}
		return buffer.toString();
	}
}
