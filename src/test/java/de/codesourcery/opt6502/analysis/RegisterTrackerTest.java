package de.codesourcery.opt6502.analysis;

import junit.framework.TestCase;
import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.Register;
import de.codesourcery.opt6502.parser.AsmDialect;
import de.codesourcery.opt6502.parser.LineParser;

public class RegisterTrackerTest extends TestCase
{
	private final RegisterTracker tracker = new RegisterTracker();
	private RegisterState state;

	@Override
	protected void setUp() throws Exception {
		state = new RegisterState();
	}

	private static Instruction insn(String line) {
		return new LineParser( AsmDialect.GENERIC ).parse( 1 , line );
	}

	private void step(String... lines)
	{
		for ( String line : lines ) {
			state = tracker.step( insn( line ) , state );
		}
	}

	public void testImmediateLoadZero()
	{
		step( "    LDA #$00" );
		assertTrue( state.isKnown( Register.A ) );
		assertEquals( Boolean.TRUE , state.isZero( Register.A ) );
		assertEquals( Boolean.TRUE , state.getFlag( Flag.ZERO ) );
		assertEquals( Boolean.FALSE , state.getFlag( Flag.NEGATIVE ) );
		assertTrue( state.isModified( Register.A ) );
		assertFalse( state.isModified( Register.X ) );
	}

	public void testImmediateLoadNegative()
	{
		step( "    LDX #$80" );
		assertEquals( Integer.valueOf( 0x80 ) , state.getValue( Register.X ).value );
		assertEquals( Boolean.TRUE , state.getFlag( Flag.NEGATIVE ) );
		assertEquals( Boolean.FALSE , state.getFlag( Flag.ZERO ) );
	}

	public void testSymbolicImmediateLeavesFlagsUnknown()
	{
		step( "    LDA #<label" );
		assertTrue( state.isKnown( Register.A ) );
		assertNull( state.isZero( Register.A ) );
		assertNull( state.getFlag( Flag.ZERO ) );
	}

	public void testMemoryLoadClearsKnowledge()
	{
		step( "    LDA #1" , "    LDA $10" );
		assertFalse( state.isKnown( Register.A ) );
		assertNull( state.getFlag( Flag.NEGATIVE ) );
	}

	public void testTransferCopiesValue()
	{
		step( "    LDA #5" , "    TAX" );
		assertEquals( Integer.valueOf( 5 ) , state.getValue( Register.X ).value );
		assertEquals( Boolean.FALSE , state.getFlag( Flag.ZERO ) );
		assertTrue( state.isModified( Register.X ) );
		assertFalse( state.isModified( Register.A ) );

		step( "    LDY $10" , "    TYA" );
		assertFalse( state.isKnown( Register.A ) );
	}

	public void testStackPointerTransfers()
	{
		step( "    LDX #5" , "    TXS" );
		assertTrue( state.isKnown( Register.X ) );
		step( "    TSX" );
		assertFalse( state.isKnown( Register.X ) );
	}

	public void testStoreChangesNothing()
	{
		step( "    LDA #1" , "    CLC" , "    STA $d020" );
		assertTrue( state.isKnown( Register.A ) );
		assertEquals( Boolean.FALSE , state.getFlag( Flag.CARRY ) );
		assertFalse( state.isModified( Register.A ) );
	}

	public void testCallInvalidatesEverything()
	{
		step( "    LDA #1" , "    SEC" , "    JSR sub" );
		assertFalse( state.isKnown( Register.A ) );
		assertNull( state.getFlag( Flag.CARRY ) );
	}

	public void testReturnFromInterruptInvalidatesFlagsOnly()
	{
		step( "    LDA #1" , "    SEC" , "    RTI" );
		assertTrue( state.isKnown( Register.A ) );
		assertNull( state.getFlag( Flag.CARRY ) );
	}

	public void testFlagInstructions()
	{
		step( "    SEC" , "    CLV" );
		assertEquals( Boolean.TRUE , state.getFlag( Flag.CARRY ) );
		assertEquals( Boolean.FALSE , state.getFlag( Flag.OVERFLOW ) );
		step( "    CLC" , "    SEI" , "    CLD" );
		assertEquals( Boolean.FALSE , state.getFlag( Flag.CARRY ) );
	}

	public void testShiftRightClearsNegative()
	{
		step( "    LSR $10" );
		assertEquals( Boolean.FALSE , state.getFlag( Flag.NEGATIVE ) );
		assertNull( state.getFlag( Flag.CARRY ) );
		step( "    ROR" );
		assertNull( state.getFlag( Flag.NEGATIVE ) );
	}

	public void testMemoryShiftKeepsAccumulator()
	{
		step( "    LDA #1" , "    ASL $10" );
		assertTrue( state.isKnown( Register.A ) );
		step( "    ASL" );
		assertFalse( state.isKnown( Register.A ) );
	}

	public void testComparisonOnlyTouchesFlags()
	{
		step( "    LDA #1" , "    SEC" , "    CMP #1" );
		assertTrue( state.isKnown( Register.A ) );
		assertNull( state.getFlag( Flag.CARRY ) );
		assertNull( state.getFlag( Flag.ZERO ) );
	}

	public void testBitTest()
	{
		step( "    LDA #1" , "    CLV" , "    BIT $10" );
		assertTrue( state.isKnown( Register.A ) );
		assertNull( state.getFlag( Flag.OVERFLOW ) );
	}

	public void testNegInvalidatesCarry()
	{
		step( "    LDA #1" , "    SEC" , "    NEG" );
		assertFalse( state.isKnown( Register.A ) );
		assertNull( state.getFlag( Flag.CARRY ) );
	}

	public void testBranchTargetForgetsEverything()
	{
		step( "    LDA #1" , "    SEC" );
		final Instruction target = insn( "label: NOP" );
		target.setBranchTarget( true );
		state = tracker.step( target , state );
		assertFalse( state.isKnown( Register.A ) );
		assertNull( state.getFlag( Flag.CARRY ) );
	}

	public void testUnknownInstructionForgetsEverything()
	{
		step( "    LDA #1" , "    .byte 1" );
		assertFalse( state.isKnown( Register.A ) );
	}

	public void testDeadInstructionIsIgnored()
	{
		step( "    LDA #1" );
		final Instruction dead = insn( "    LDA $10" );
		dead.markDead();
		state = tracker.step( dead , state );
		assertTrue( state.isKnown( Register.A ) );
	}

	public void testInputStateIsNotModified()
	{
		final RegisterState before = new RegisterState();
		final RegisterState after = tracker.step( insn( "    LDA #1" ) , before );
		assertFalse( before.isKnown( Register.A ) );
		assertTrue( after.isKnown( Register.A ) );
		assertNotSame( before , after );
	}
}
