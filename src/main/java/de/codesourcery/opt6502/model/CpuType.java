package de.codesourcery.opt6502.model;

public enum CpuType
{
	MOS6502("6502","6502"),
	WDC65C02("65c02","65C02"),
	WDC65816("65816","65816"),
	/**
	 * MEGA65 CPU. Careful: STZ stores the Z register here, NOT zero.
	 */
	CSG45GS02("45gs02","45GS02");

	public final String name;
	public final String displayName;

	private CpuType(String name,String displayName) {
		this.name = name;
		this.displayName = displayName;
	}

	/**
	 * Whether the 65C02 instruction set extensions (STZ,BRA,PHX,...) are available.
	 */
	public boolean allows65C02()
	{
		return this != MOS6502;
	}

	public boolean is45GS02() {
		return this == CSG45GS02;
	}

	public static CpuType fromName(String name)
	{
		if ( name != null )
		{
			for ( CpuType t : values() ) {
				if ( t.name.equalsIgnoreCase( name.trim() ) ) {
					return t;
				}
			}
		}
		throw new IllegalArgumentException("Unknown CPU type: '"+name+"'");
	}

	@Override
	public String toString() {
		return displayName;
	}
}
