package de.codesourcery.opt6502.model;

/**
 * The CPU family member that introduced a mnemonic.
 */
public enum InstructionSet
{
	NMOS,
	CMOS,
	W65816,
	GS45;

	public boolean isAvailableOn(CpuType cpu)
	{
		switch( this )
		{
			case NMOS:
				return true;
			case CMOS:
				return cpu.allows65C02();
			case W65816:
				return cpu == CpuType.WDC65816;
			case GS45:
				return cpu.is45GS02();
			default:
				throw new RuntimeException("Unhandled instruction set: "+this);
		}
	}
}
