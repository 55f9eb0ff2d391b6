package de.codesourcery.opt6502.model;

public enum AddressingMode
{
	/**
	 * CLC
	 */
	IMPLIED,
	/**
	 * ASL A
	 */
	ACCUMULATOR,
	/**
	 * LDA #$44
	 */
	IMMEDIATE,
	/**
	 * LDA $44
	 */
	ZERO_PAGE,
	/**
	 * LDA $44,X
	 */
	ZERO_PAGE_X,
	/**
	 * LDX $44,Y
	 */
	ZERO_PAGE_Y,
	/**
	 * LDA $0D00
	 */
	ABSOLUTE,
	/**
	 * LDA $da00,X
	 */
	ABSOLUTE_INDEXED_X,
	/**
	 * LDA $4400,Y
	 */
	ABSOLUTE_INDEXED_Y,
	/**
	 * LDA ($44,X)
	 */
	INDEXED_INDIRECT_X,
	/**
	 * LDA ($44),Y
	 */
	INDIRECT_INDEXED_Y,
	/**
	 * LDA ($44),Z (45GS02)
	 */
	INDIRECT_INDEXED_Z,
	/**
	 * JMP ($FFFC) or LDA ($44) (65C02)
	 */
	INDIRECT,
	/**
	 * LDA $03,S or LDA ($03,S),Y (65816)
	 */
	STACK_RELATIVE,
	/**
	 * Anything the optimizer does not need to understand (65816 long indirect, block moves, ...)
	 */
	OTHER;

	public boolean isIndirect()
	{
		switch( this )
		{
			case INDEXED_INDIRECT_X:
			case INDIRECT_INDEXED_Y:
			case INDIRECT_INDEXED_Z:
			case INDIRECT:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Plain memory operand whose effective address does not depend on memory contents.
	 */
	public boolean isDirect()
	{
		switch( this )
		{
			case ZERO_PAGE:
			case ZERO_PAGE_X:
			case ZERO_PAGE_Y:
			case ABSOLUTE:
			case ABSOLUTE_INDEXED_X:
			case ABSOLUTE_INDEXED_Y:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Whether STZ (65C02 and 45GS02 alike) can be encoded with this addressing mode.
	 */
	public boolean supportsStoreZ()
	{
		switch( this )
		{
			case ZERO_PAGE:
			case ZERO_PAGE_X:
			case ABSOLUTE:
			case ABSOLUTE_INDEXED_X:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Returns the index register this mode reads, if any.
	 */
	public Register getIndexRegister()
	{
		switch( this )
		{
			case ZERO_PAGE_X:
			case ABSOLUTE_INDEXED_X:
			case INDEXED_INDIRECT_X:
				return Register.X;
			case ZERO_PAGE_Y:
			case ABSOLUTE_INDEXED_Y:
			case INDIRECT_INDEXED_Y:
				return Register.Y;
			case INDIRECT_INDEXED_Z:
				return Register.Z;
			default:
				return null;
		}
	}
}
