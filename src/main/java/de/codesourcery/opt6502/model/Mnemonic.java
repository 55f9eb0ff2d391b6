package de.codesourcery.opt6502.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of mnemonics the optimizer understands, each with a description of
 * the registers and flags it reads and writes.
 *
 * This table is the single source of truth for instruction effects, both the
 * register tracker and the optimization passes query it.
 *
 * Written sets only list what an instruction <b>definitely</b> overwrites. Anything with
 * effects that cannot be described this way uses {@link Category#OTHER} and is treated as
 * touching everything.
 */
public enum Mnemonic
{
	// loads
	LDA(Category.LOAD , "" , "A" , "" , "NZ"),
	LDX(Category.LOAD , "" , "X" , "" , "NZ"),
	LDY(Category.LOAD , "" , "Y" , "" , "NZ"),
	LDZ(Category.LOAD , "" , "Z" , "" , "NZ" , InstructionSet.GS45),
	// stores
	STA(Category.STORE , "A" , "" , "" , ""),
	STX(Category.STORE , "X" , "" , "" , ""),
	STY(Category.STORE , "Y" , "" , "" , ""),
	/*
	 * 65C02: stores zero, 45GS02: stores the Z register.
	 */
	STZ(Category.STORE , "Z" , "" , "" , "" , InstructionSet.CMOS),
	// transfers
	TAX(Category.TRANSFER , "A" , "X" , "" , "NZ"),
	TXA(Category.TRANSFER , "X" , "A" , "" , "NZ"),
	TAY(Category.TRANSFER , "A" , "Y" , "" , "NZ"),
	TYA(Category.TRANSFER , "Y" , "A" , "" , "NZ"),
	TSX(Category.TRANSFER , "" , "X" , "" , "NZ"),
	TXS(Category.TRANSFER , "X" , "" , "" , ""),
	TAZ(Category.TRANSFER , "A" , "Z" , "" , "NZ" , InstructionSet.GS45),
	TZA(Category.TRANSFER , "Z" , "A" , "" , "NZ" , InstructionSet.GS45),
	TXY(Category.TRANSFER , "X" , "Y" , "" , "NZ" , InstructionSet.W65816),
	TYX(Category.TRANSFER , "Y" , "X" , "" , "NZ" , InstructionSet.W65816),
	// arithmetic
	ADC(Category.ARITHMETIC , "A" , "A" , "C" , "CNZV"),
	SBC(Category.ARITHMETIC , "A" , "A" , "C" , "CNZV"),
	NEG(Category.ARITHMETIC , "A" , "A" , "" , "NZ" , InstructionSet.GS45),
	// logical
	AND(Category.LOGICAL , "A" , "A" , "" , "NZ"),
	ORA(Category.LOGICAL , "A" , "A" , "" , "NZ"),
	EOR(Category.LOGICAL , "A" , "A" , "" , "NZ"),
	// shifts, accumulator only when used without a memory operand
	ASL(Category.SHIFT , "A" , "A" , "" , "CNZ"),
	LSR(Category.SHIFT , "A" , "A" , "" , "CNZ"),
	ROL(Category.SHIFT , "A" , "A" , "C" , "CNZ"),
	ROR(Category.SHIFT , "A" , "A" , "C" , "CNZ"),
	ASR(Category.SHIFT , "A" , "A" , "" , "CNZ" , InstructionSet.GS45),
	// increment/decrement
	INC(Category.INC_DEC , "A" , "A" , "" , "NZ"),
	DEC(Category.INC_DEC , "A" , "A" , "" , "NZ"),
	INX(Category.INC_DEC , "X" , "X" , "" , "NZ"),
	INY(Category.INC_DEC , "Y" , "Y" , "" , "NZ"),
	DEX(Category.INC_DEC , "X" , "X" , "" , "NZ"),
	DEY(Category.INC_DEC , "Y" , "Y" , "" , "NZ"),
	INZ(Category.INC_DEC , "Z" , "Z" , "" , "NZ" , InstructionSet.GS45),
	DEZ(Category.INC_DEC , "Z" , "Z" , "" , "NZ" , InstructionSet.GS45),
	INW(Category.INC_DEC , "" , "" , "" , "NZ" , InstructionSet.GS45),
	DEW(Category.INC_DEC , "" , "" , "" , "NZ" , InstructionSet.GS45),
	// comparisons
	CMP(Category.COMPARE , "A" , "" , "" , "CNZ"),
	CPX(Category.COMPARE , "X" , "" , "" , "CNZ"),
	CPY(Category.COMPARE , "Y" , "" , "" , "CNZ"),
	CPZ(Category.COMPARE , "Z" , "" , "" , "CNZ" , InstructionSet.GS45),
	// bit tests
	BIT(Category.BIT_TEST , "A" , "" , "" , "NZV"),
	TSB(Category.BIT_TEST , "A" , "" , "" , "Z" , InstructionSet.CMOS),
	TRB(Category.BIT_TEST , "A" , "" , "" , "Z" , InstructionSet.CMOS),
	// flags
	CLC(Category.FLAG , "" , "" , "" , "C"),
	SEC(Category.FLAG , "" , "" , "" , "C"),
	CLV(Category.FLAG , "" , "" , "" , "V"),
	CLI(Category.FLAG , "" , "" , "" , ""),
	SEI(Category.FLAG , "" , "" , "" , ""),
	CLD(Category.FLAG , "" , "" , "" , ""),
	SED(Category.FLAG , "" , "" , "" , ""),
	// stack
	PHA(Category.STACK , "A" , "" , "" , ""),
	PHP(Category.STACK , "" , "" , "CNZV" , ""),
	PLA(Category.STACK , "" , "A" , "" , "NZ"),
	PLP(Category.STACK , "" , "" , "" , "CNZV"),
	PHX(Category.STACK , "X" , "" , "" , "" , InstructionSet.CMOS),
	PHY(Category.STACK , "Y" , "" , "" , "" , InstructionSet.CMOS),
	PLX(Category.STACK , "" , "X" , "" , "NZ" , InstructionSet.CMOS),
	PLY(Category.STACK , "" , "Y" , "" , "NZ" , InstructionSet.CMOS),
	PHZ(Category.STACK , "Z" , "" , "" , "" , InstructionSet.GS45),
	PLZ(Category.STACK , "" , "Z" , "" , "NZ" , InstructionSet.GS45),
	// branches
	BCC(Category.BRANCH , "" , "" , "C" , ""),
	BCS(Category.BRANCH , "" , "" , "C" , ""),
	BEQ(Category.BRANCH , "" , "" , "Z" , ""),
	BNE(Category.BRANCH , "" , "" , "Z" , ""),
	BMI(Category.BRANCH , "" , "" , "N" , ""),
	BPL(Category.BRANCH , "" , "" , "N" , ""),
	BVC(Category.BRANCH , "" , "" , "V" , ""),
	BVS(Category.BRANCH , "" , "" , "V" , ""),
	BRA(Category.BRANCH , "" , "" , "" , "" , InstructionSet.CMOS),
	BRL(Category.BRANCH , "" , "" , "" , "" , InstructionSet.W65816),
	// jumps, calls and returns
	JMP(Category.JUMP , "" , "" , "" , ""),
	JML(Category.JUMP , "" , "" , "" , "" , InstructionSet.W65816),
	JSR(Category.CALL , "" , "" , "" , ""),
	JSL(Category.CALL , "" , "" , "" , "" , InstructionSet.W65816),
	BSR(Category.CALL , "" , "" , "" , "" , InstructionSet.GS45),
	RTS(Category.RETURN , "" , "" , "" , ""),
	RTL(Category.RETURN , "" , "" , "" , "" , InstructionSet.W65816),
	RTI(Category.INTERRUPT_RETURN , "" , "" , "" , "CNZV"),
	// misc
	BRK(Category.SYSTEM , "" , "" , "" , ""),
	NOP(Category.NOP , "" , "" , "" , ""),
	STP(Category.SYSTEM , "" , "" , "" , "" , InstructionSet.W65816),
	WAI(Category.SYSTEM , "" , "" , "" , "" , InstructionSet.W65816),
	// effects not modelled
	REP(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	SEP(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	XBA(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	XCE(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	TCD(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	TDC(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	TCS(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	TSC(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	PEA(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	PEI(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	PER(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	PHB(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	PHD(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	PHK(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	PLB(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	PLD(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	MVN(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	MVP(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	COP(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	WDM(Category.OTHER , "" , "" , "" , "" , InstructionSet.W65816),
	MAP(Category.OTHER , "" , "" , "" , "" , InstructionSet.GS45),
	EOM(Category.OTHER , "" , "" , "" , "" , InstructionSet.GS45),
	TAB(Category.OTHER , "" , "" , "" , "" , InstructionSet.GS45),
	TBA(Category.OTHER , "" , "" , "" , "" , InstructionSet.GS45),
	TSY(Category.OTHER , "" , "" , "" , "" , InstructionSet.GS45),
	TYS(Category.OTHER , "" , "" , "" , "" , InstructionSet.GS45),
	ASW(Category.OTHER , "" , "" , "" , "" , InstructionSet.GS45),
	ROW(Category.OTHER , "" , "" , "" , "" , InstructionSet.GS45),
	PHW(Category.OTHER , "" , "" , "" , "" , InstructionSet.GS45);

	public static enum Category
	{
		LOAD,
		STORE,
		TRANSFER,
		ARITHMETIC,
		LOGICAL,
		SHIFT,
		INC_DEC,
		COMPARE,
		BIT_TEST,
		FLAG,
		STACK,
		BRANCH,
		JUMP,
		CALL,
		RETURN,
		INTERRUPT_RETURN,
		NOP,
		SYSTEM,
		OTHER;
	}

	private static final Map<String,Mnemonic> BY_NAME = new HashMap<>();

	static
	{
		for ( Mnemonic m : values() ) {
			BY_NAME.put( m.name() , m );
		}
	}

	public final Category category;
	public final InstructionSet instructionSet;

	private final Set<Register> registersRead;
	private final Set<Register> registersWritten;
	private final Set<Flag> flagsRead;
	private final Set<Flag> flagsWritten;

	private Mnemonic(Category category,String regsRead,String regsWritten,String flagsRead,String flagsWritten)
	{
		this(category,regsRead,regsWritten,flagsRead,flagsWritten,InstructionSet.NMOS);
	}

	private Mnemonic(Category category,String regsRead,String regsWritten,String flagsRead,String flagsWritten,InstructionSet instructionSet)
	{
		this.category = category;
		this.instructionSet = instructionSet;
		this.registersRead = registers( regsRead );
		this.registersWritten = registers( regsWritten );
		this.flagsRead = flags( flagsRead );
		this.flagsWritten = flags( flagsWritten );
	}

	private static Set<Register> registers(String symbols)
	{
		final Set<Register> result = EnumSet.noneOf( Register.class );
		for ( char c : symbols.toCharArray() ) {
			result.add( Register.fromSymbol( c ) );
		}
		return Collections.unmodifiableSet( result );
	}

	private static Set<Flag> flags(String symbols)
	{
		final Set<Flag> result = EnumSet.noneOf( Flag.class );
		for ( char c : symbols.toCharArray() ) {
			result.add( Flag.fromSymbol( c ) );
		}
		return Collections.unmodifiableSet( result );
	}

	/**
	 * Looks up a mnemonic, case-insensitive.
	 *
	 * @param s
	 * @return mnemonic or <code>null</code> if the text is no instruction this optimizer knows (assembler directive, macro invocation, ...)
	 */
	public static Mnemonic fromString(String s)
	{
		if ( s == null ) {
			return null;
		}
		return BY_NAME.get( s.trim().toUpperCase() );
	}

	public String getMnemonic() {
		return name();
	}

	public boolean isAvailableOn(CpuType cpu) {
		return instructionSet.isAvailableOn( cpu );
	}

	/**
	 * Whether accumulator access depends on the operand (<code>ASL</code> vs. <code>ASL $10</code>).
	 */
	private boolean isAccumulatorOrMemory()
	{
		return ( category == Category.SHIFT || category == Category.INC_DEC ) && registersRead.contains( Register.A );
	}

	private boolean touchesAccumulator(Operand operand)
	{
		return ! isAccumulatorOrMemory() || operand == null || operand.isAccumulatorForm();
	}

	public Set<Register> getRegistersRead(Operand operand)
	{
		final Set<Register> result = EnumSet.noneOf( Register.class );
		result.addAll( registersRead );
		if ( ! touchesAccumulator( operand ) ) {
			result.remove( Register.A );
		}
		if ( operand != null && operand.addressingMode.getIndexRegister() != null ) {
			result.add( operand.addressingMode.getIndexRegister() );
		}
		return result;
	}

	public Set<Register> getRegistersWritten(Operand operand)
	{
		final Set<Register> result = EnumSet.noneOf( Register.class );
		result.addAll( registersWritten );
		if ( ! touchesAccumulator( operand ) ) {
			result.remove( Register.A );
		}
		return result;
	}

	public Set<Flag> getFlagsRead() {
		return flagsRead;
	}

	public Set<Flag> getFlagsWritten(Operand operand)
	{
		if ( this == BIT && operand != null && operand.isImmediate() ) {
			return Collections.unmodifiableSet( EnumSet.of( Flag.ZERO ) ); // 65C02 BIT #imm only sets Z
		}
		return flagsWritten;
	}

	public boolean reads(Register r,Operand operand) {
		return getRegistersRead( operand ).contains( r );
	}

	public boolean writes(Register r,Operand operand) {
		return getRegistersWritten( operand ).contains( r );
	}

	public boolean hasCategory(Category c) {
		return c == this.category;
	}

	public boolean isCall() {
		return category == Category.CALL;
	}

	public boolean isReturn() {
		return category == Category.RETURN;
	}

	/**
	 * Whether this instruction may transfer control somewhere else than the next instruction.
	 */
	public boolean isControlFlow()
	{
		switch( category )
		{
			case BRANCH:
			case JUMP:
			case CALL:
			case RETURN:
			case INTERRUPT_RETURN:
			case SYSTEM:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Whether execution never continues with the next instruction.
	 */
	public boolean isUnconditionalTransfer()
	{
		switch( category )
		{
			case JUMP:
			case RETURN:
			case INTERRUPT_RETURN:
				return true;
			case BRANCH:
				return flagsRead.isEmpty(); // BRA, BRL
			default:
				return false;
		}
	}

	/**
	 * Whether this instruction has effects the table does not describe.
	 */
	public boolean hasUnmodelledEffects() {
		return category == Category.OTHER;
	}

	public boolean touchesStackPointer() {
		return this == TSX || this == TXS;
	}
}
