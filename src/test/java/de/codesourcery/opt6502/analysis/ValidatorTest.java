package de.codesourcery.opt6502.analysis;

import java.util.Arrays;
import java.util.EnumSet;

import junit.framework.TestCase;
import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Register;
import de.codesourcery.opt6502.parser.AsmDialect;
import de.codesourcery.opt6502.parser.SourceReader;

public class ValidatorTest extends TestCase
{
	private InstructionStream stream;

	@Override
	protected void setUp() throws Exception
	{
		stream = new SourceReader( AsmDialect.GENERIC ).read( Arrays.asList(
				"; test",
				"start:",
				"    LDA #1",
				"    TAX",
				"    CLC",
				"    STA $10") );
	}

	public void testStatistics()
	{
		final ValidationReport report = new Validator().validate( stream , 0 );
		assertEquals( 4 , report.getInstructionCount() );
		assertEquals( 2 , report.getRegisterModifications() );
		assertEquals( 5 , report.getFlagModifications() );
		assertEquals( EnumSet.of( Register.A , Register.X ) , report.getRegistersUsed() );
		assertEquals( EnumSet.of( Flag.CARRY , Flag.NEGATIVE , Flag.ZERO ) , report.getFlagsAffected() );
		assertTrue( report.getSnapshots().isEmpty() );
		assertTrue( report.toString().contains( "Instructions analyzed  : 4" ) );
	}

	public void testDeadInstructionsAreNotCounted()
	{
		stream.get( 3 ).markDead();
		final ValidationReport report = new Validator().validate( stream , 0 );
		assertEquals( 3 , report.getInstructionCount() );
		assertFalse( report.getRegistersUsed().contains( Register.X ) );
	}

	public void testSnapshotsAtHighTraceLevel()
	{
		final ValidationReport report = new Validator().validate( stream , 2 );
		assertEquals( 4 , report.getSnapshots().size() );
		assertTrue( report.getSnapshots().get( 0 ).contains( "A=$01*" ) );
	}

	public void testValidationDoesNotChangeProgram()
	{
		new Validator().validate( stream , 2 );
		for ( int i = 0 ; i < stream.size() ; i++ ) {
			assertFalse( stream.get( i ).isDead() );
		}
		assertEquals( "LDA #1" , stream.get( 2 ).toSourceText() );
	}
}
