package de.codesourcery.opt6502.optimizer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;

import de.codesourcery.opt6502.exceptions.NonConvergenceException;
import de.codesourcery.opt6502.model.CpuType;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.output.SourceWriter;
import de.codesourcery.opt6502.parser.SourceReader;

public class OptimizerTest extends PassTestSupport
{
	private static final String[] SCREEN_COLORS = {
			"start:",
			"    LDA #$00",
			"    STA $D020",
			"    LDA #$00",
			"    STA $D021"
	};

	private OptimizationResult optimize(CpuType cpu,String... lines)
	{
		parse( cpu , lines );
		return new Optimizer( RunConfiguration.forCpu( cpu ) ).optimize( stream );
	}

	public void testRedundantLoadOn6502()
	{
		final OptimizationResult result = optimize( CpuType.MOS6502 , SCREEN_COLORS );
		assertLiveCode( "start" , "LDA #$00" , "STA $D020" , "STA $D021" );
		assertEquals( 1 , result.optimizations );
		assertEquals( 2 , result.iterations );
		assertTrue( result.converged );
		assertEquals( 5 , result.linesRead );
		assertEquals( 1 , result.deadLines );
		assertEquals( 4 , result.finalLineCount );
		assertEquals( 20.0d , result.getReductionPercent() , 0.001d );
		assertTrue( result.getWarnings().isEmpty() );
	}

	public void testStoreZeroOn65C02()
	{
		final OptimizationResult result = optimize( CpuType.WDC65C02 , SCREEN_COLORS );
		assertLiveCode( "start" , "STZ $D020" , "STZ $D021" );
		assertEquals( 4 , result.optimizations );
	}

	public void testStoreThroughZOn45GS02()
	{
		final OptimizationResult result = optimize( CpuType.CSG45GS02 ,
				"fill:",
				"    LDA #$20",
				"    STA $0400",
				"    LDA #$20",
				"    STA $0401",
				"    LDA #$20",
				"    STA $0402");
		assertLiveCode( "fill" , "LDZ #$20" , "STZ $0400" , "STZ $0401" , "STZ $0402" );
		assertEquals( 3 , result.optimizations );
	}

	public void testNoStoreZeroOn45GS02()
	{
		optimize( CpuType.CSG45GS02 , "start:" , "    LDA #0" , "    STA $10" , "    LDA #$00" , "    STA $11" , "    RTS" );
		assertLiveCode( "start" , "LDA #0" , "STA $10" , "STA $11" , "RTS" );
	}

	public void testInlinesSubroutine()
	{
		final OptimizationResult result = optimize( CpuType.MOS6502 ,
				"main:",
				"    JSR setup",
				"    RTS",
				"setup:",
				"    LDA #1",
				"    STA $d020",
				"    RTS");
		assertLiveCode( "main" , "LDA #1" , "STA $d020" , "RTS" );
		assertEquals( 3 , result.optimizations );
		assertEquals( 4 , result.finalLineCount );
	}

	public void testRemovesJumpToNextLine()
	{
		final OptimizationResult result = optimize( CpuType.MOS6502 , "start:" , "    LDA #1" , "    JMP next" , "next: STA $10" , "    RTS" );
		assertLiveCode( "start" , "LDA #1" , "next STA $10" , "RTS" );
		assertEquals( 1 , result.optimizations );
	}

	public void testBranchTargetsAreRespected()
	{
		final OptimizationResult result = optimize( CpuType.MOS6502 ,
				"start:",
				"    LDA #1",
				"    STA $10",
				"loop:",
				"    LDA #1",
				"    STA $11",
				"    JMP loop");
		assertEquals( 0 , result.optimizations );
		assertEquals( 1 , result.iterations );
		assertEquals( 0 , stream.getDeadCount() );
	}

	public void testDisabledRegionIsUntouched()
	{
		final OptimizationResult result = optimize( CpuType.WDC65C02 ,
				"start:",
				"; #NOOPT",
				"    LDA #$00",
				"    STA $D020",
				"    LDA #$00",
				"    STA $D021",
				"; #OPT",
				"    RTS");
		assertEquals( 0 , result.optimizations );
		assertLiveCode( "start" , "LDA #$00" , "STA $D020" , "LDA #$00" , "STA $D021" , "RTS" );
	}

	public void testUnboundedSubroutineWarning()
	{
		final OptimizationResult result = optimize( CpuType.MOS6502 , "    JSR sub" , "    RTS" , "sub:" , "    NOP" , "other:" , "    RTS" );
		assertEquals( Collections.singletonList( "Subroutine 'sub' (line 3) has no return before the next global label" ) , result.getWarnings() );
		assertTrue( result.converged );
	}

	public void testUnavailableInstructionWarning()
	{
		final OptimizationResult result = optimize( CpuType.MOS6502 , "    LDA #1" , "    STZ $10" , "    BRA $1000" );
		assertEquals( Arrays.asList( "Line 2: STZ is not available on the 6502" , "Line 3: BRA is not available on the 6502" ) , result.getWarnings() );
		assertTrue( optimize( CpuType.WDC65C02 , "    STZ $10" ).getWarnings().isEmpty() );
	}

	public void testNonConvergence()
	{
		parse( SCREEN_COLORS );
		final OptimizationResult result = new Optimizer( RunConfiguration.defaults() , null , Collections.singletonList( alwaysChanging() ) ).optimize( stream );
		assertFalse( result.converged );
		assertEquals( RunConfiguration.DEFAULT_MAX_ITERATIONS , result.iterations );
		assertEquals( 10 , result.optimizations );
		assertTrue( result.getWarnings().contains( "Optimizer did not converge after 10 iterations" ) );
		assertTrue( result.getSummary().contains( "did not converge" ) );
	}

	public void testNonConvergenceInStrictMode()
	{
		parse( SCREEN_COLORS );
		final RunConfiguration config = RunConfiguration.builder().strictConvergence( true ).maxIterations( 3 ).build();
		try {
			new Optimizer( config , null , Collections.singletonList( alwaysChanging() ) ).optimize( stream );
			fail("Should've failed");
		}
		catch(NonConvergenceException e) {
			assertEquals( 3 , e.iterations );
			assertEquals( 1 , e.optimizationsInLastIteration );
		}
	}

	public void testPassSelection()
	{
		assertEquals( Arrays.asList( "peephole" , "load-store" , "register-usage" , "constant-propagation" , "jump" , "dead-code" ) ,
				passNames( CpuType.MOS6502 ) );
		assertEquals( Arrays.asList( "peephole" , "load-store" , "register-usage" , "constant-propagation" , "65c02" , "jump" , "dead-code" ) ,
				passNames( CpuType.WDC65C02 ) );
		assertTrue( passNames( CpuType.WDC65816 ).contains( "65c02" ) );
		assertEquals( Arrays.asList( "peephole" , "load-store" , "register-usage" , "constant-propagation" , "45gs02" , "jump" , "dead-code" ) ,
				passNames( CpuType.CSG45GS02 ) );
	}

	public void testUnreachableCallDoesNotPreventInlining()
	{
		final RunConfiguration config = RunConfiguration.defaults();
		final String source = StringUtils.join( new String[] {
				"main:",
				"    JSR sub",
				"    RTS",
				"    JSR sub",
				"    RTS",
				"sub:",
				"    LDA #1",
				"    STA $10",
				"    RTS" } , "\n" );

		final String once = optimizeToText( config , source );
		assertFalse( once.contains( "JSR" ) );
		assertFalse( once.contains( "sub:" ) );
		assertEquals( once , optimizeToText( config , once ) );
	}

	public void testComprehensiveProgram() throws IOException
	{
		final RunConfiguration config = RunConfiguration.defaults();
		final String source = loadResource( "/comprehensive.asm" );
		final String optimized = optimizeToText( config , source );

		assertFalse( optimized.contains("JSR") );
		assertFalse( optimized.contains("clear:") );
		assertFalse( optimized.contains("JMP finish") );
		assertFalse( optimized.contains("LDA #$FF") );
		assertEquals( 1 , StringUtils.countMatches( optimized , "LDA #$00" ) );
		assertEquals( 1 , StringUtils.countMatches( optimized , "LDA #$20" ) );
		assertEquals( 1 , StringUtils.countMatches( optimized , "LDA $10" ) );
		assertTrue( optimized.contains("JMP loop") );
		assertTrue( optimized.contains("message:\t.byte \"HELLO\",0") );

		assertEquals( optimized , optimizeToText( config , optimized ) );
	}

	public void test45GS02Program() throws IOException
	{
		final RunConfiguration config = RunConfiguration.forCpu( CpuType.CSG45GS02 );
		final String source = loadResource( "/mega65.asm" );

		stream = new SourceReader( config.dialect ).read( source );
		final OptimizationResult result = new Optimizer( config ).optimize( stream );
		assertLiveCode( "fill" , "LDZ #$20" , "STZ $0400" , "STZ $0401" , "STZ $0402" , "LDZ #$00" ,
				"LDA $fd" , "ASR" , "STA $fe" , "LDA $fb" , "NEG" , "STA $fc" );
		assertEquals( 5 , result.optimizations );

		final String optimized = new SourceWriter( config ).setWriteHeader( false ).toString( stream , result.optimizations );
		assertEquals( optimized , optimizeToText( config , optimized ) );
	}

	private static String optimizeToText(RunConfiguration config,String source)
	{
		final InstructionStream program = new SourceReader( config.dialect ).read( source );
		final OptimizationResult result = new Optimizer( config ).optimize( program );
		return new SourceWriter( config ).setWriteHeader( false ).toString( program , result.optimizations );
	}

	private String loadResource(String name) throws IOException
	{
		try ( InputStream in = getClass().getResourceAsStream( name ) )
		{
			assertNotNull( "Missing test resource "+name , in );
			return IOUtils.toString( in , StandardCharsets.UTF_8 );
		}
	}

	private static List<String> passNames(CpuType cpu)
	{
		final List<String> result = new ArrayList<>();
		for ( IOptimizationPass pass : Optimizer.createPasses( RunConfiguration.forCpu( cpu ) ) ) {
			result.add( pass.getName() );
		}
		return result;
	}

	private static IOptimizationPass alwaysChanging()
	{
		return new AbstractOptimizationPass("always-changing") {

			@Override
			public int apply(InstructionStream stream, OptimizationContext context) {
				return 1;
			}
		};
	}
}
