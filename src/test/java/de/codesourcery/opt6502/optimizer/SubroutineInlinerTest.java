package de.codesourcery.opt6502.optimizer;

public class SubroutineInlinerTest extends PassTestSupport
{
	private final SubroutineInliner inliner = new SubroutineInliner();

	public void testInlinesSingleCall()
	{
		parse( "start:" , "    JSR sub" , "    RTS" , "sub:" , "    LDA #1" , "    STA $d020" , "    RTS" );
		assertEquals( 1 , apply( inliner ) );

		assertEquals( 9 , stream.size() );
		assertTrue( stream.get( 1 ).isDead() );
		assertEquals( "LDA #1" , stream.get( 2 ).toSourceText() );
		assertEquals( "STA $d020" , stream.get( 3 ).toSourceText() );
		assertTrue( stream.get( 5 ).isDead() );
		assertTrue( stream.get( 8 ).isDead() );
		assertLiveCode( "start" , "LDA #1" , "STA $d020" , "RTS" , "LDA #1" , "STA $d020" );

		// original body is unreachable now
		analyze();
		apply( new DeadCodePass() );
		assertLiveCode( "start" , "LDA #1" , "STA $d020" , "RTS" );
	}

	public void testInstructionOnLabelLine()
	{
		parse( "    JSR sub" , "    RTS" , "sub: LDA #1" , "    RTS" );
		assertEquals( 1 , apply( inliner ) );
		assertEquals( "LDA #1" , stream.get( 1 ).toSourceText() );
		assertFalse( stream.get( 1 ).hasLabel() );
		assertFalse( stream.get( 1 ).isDead() );
	}

	public void testMultipleCallsAreKept()
	{
		parse( "    JSR sub" , "    JSR sub" , "    RTS" , "sub:" , "    NOP" , "    RTS" );
		assertEquals( 0 , apply( inliner ) );
	}

	public void testIgnoresCallInUnreachableCode()
	{
		parse( "    JSR sub" , "    RTS" , "    JSR sub" , "    RTS" , "sub:" , "    NOP" , "    RTS" );
		assertEquals( 1 , apply( inliner ) );
		assertTrue( stream.get( 0 ).isDead() );
		assertEquals( "NOP" , stream.get( 1 ).toSourceText() );
		assertFalse( stream.get( 3 ).isDead() );
	}

	public void testOtherReferencesAreKept()
	{
		parse( "    JSR sub" , "    LDA #<sub" , "    RTS" , "sub:" , "    NOP" , "    RTS" );
		assertEquals( 0 , apply( inliner ) );
	}

	public void testFallThroughIsKept()
	{
		parse( "    JSR sub" , "    NOP" , "sub:" , "    LDA #1" , "    RTS" );
		assertEquals( 0 , apply( inliner ) );
	}

	public void testStackUsageIsKept()
	{
		parse( "    JSR sub" , "    RTS" , "sub:" , "    PHA" , "    PLA" , "    RTS" );
		assertEquals( 0 , apply( inliner ) );
	}

	public void testBranchInBodyIsKept()
	{
		parse( "    JSR sub" , "    RTS" , "sub:" , "    LDA $10" , "    BEQ .skip" , "    STA $20" , ".skip" , "    RTS" );
		assertEquals( 0 , apply( inliner ) );
	}

	public void testEmptySubroutineIsKept()
	{
		parse( "    JSR sub" , "    RTS" , "sub: RTS" );
		assertEquals( 0 , apply( inliner ) );
	}

	public void testUnboundedSubroutineIsKept()
	{
		parse( "    JSR sub" , "    RTS" , "sub:" , "    NOP" , "other:" , "    RTS" );
		assertEquals( 0 , apply( inliner ) );
	}

	public void testDisabledCallIsKept()
	{
		parse( "; #NOOPT" , "    JSR sub" , "; #OPT" , "    RTS" , "sub:" , "    NOP" , "    RTS" );
		assertEquals( 0 , apply( inliner ) );
	}
}
