package de.codesourcery.opt6502.cli;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

import org.apache.commons.io.FileUtils;

import de.codesourcery.opt6502.analysis.ValidationReport;
import de.codesourcery.opt6502.exceptions.NonConvergenceException;
import de.codesourcery.opt6502.model.CpuType;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.OptimizationMode;
import de.codesourcery.opt6502.optimizer.OptimizationResult;
import de.codesourcery.opt6502.optimizer.Optimizer;
import de.codesourcery.opt6502.optimizer.RunConfiguration;
import de.codesourcery.opt6502.output.SourceWriter;
import de.codesourcery.opt6502.parser.AsmDialect;
import de.codesourcery.opt6502.parser.SourceReader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
	name = "opt6502",
	mixinStandardHelpOptions = true,
	description = "Assembly-to-assembly optimizer for the 6502 family (6502, 65C02, 65816, 45GS02).",
	footer = {
		"",
		"Optimizer directives (in comment lines):",
		"  #NOOPT  disable optimizations from this line on",
		"  #OPT    enable optimizations again"
	}
)
public class Main implements Callable<Integer>
{
	@Option(names = "-speed", description = "Optimize for speed (default)")
	private boolean speed;

	@Option(names = "-size", description = "Optimize for size")
	private boolean size;

	@Option(names = "-cpu", paramLabel = "<type>", description = "Target CPU: 6502, 65c02, 65816, 45gs02 (default: 6502)")
	private String cpu = CpuType.MOS6502.name;

	@Option(names = "-asm", paramLabel = "<dialect>", description = "Assembler syntax: generic, ca65, kick, acme, dasm, tass, 64tass, buddy, merlin, lisa (default: generic)")
	private String dialect = AsmDialect.GENERIC.name;

	@Option(names = "-trace", paramLabel = "<level>", description = "Trace level 0-2 (default: 0)")
	private int traceLevel;

	@Option(names = "-strict", description = "Fail if the optimizer does not converge")
	private boolean strict;

	@Parameters(index = "0", paramLabel = "<input>", description = "Assembly source to optimize")
	private File input;

	@Parameters(index = "1", arity = "0..1", paramLabel = "<output>", description = "Output file (default: output.asm)")
	private File output = new File("output.asm");

	@Spec
	private CommandSpec spec;

	public static void main(String[] args)
	{
		System.exit( new CommandLine( new Main() ).execute( args ) );
	}

	@Override
	public Integer call()
	{
		final PrintWriter out = spec.commandLine().getOut();
		final PrintWriter err = spec.commandLine().getErr();

		final RunConfiguration config;
		try {
			config = createConfiguration();
		}
		catch(IllegalArgumentException e)
		{
			err.println("Error: "+e.getMessage());
			return 1;
		}

		try
		{
			final InstructionStream stream = new SourceReader( config.dialect , config.optimizationsInitiallyEnabled )
					.read( FileUtils.readLines( input , StandardCharsets.UTF_8 ) );

			final OptimizationResult result = new Optimizer( config ).optimize( stream );

			final String text = new SourceWriter( config ).toString( stream , result.optimizations );
			FileUtils.writeStringToFile( output , text , StandardCharsets.UTF_8 );

			printSummary( out , config , result );
			return 0;
		}
		catch(IOException e)
		{
			err.println("Error: "+e.getMessage());
			return 1;
		}
		catch(NonConvergenceException e)
		{
			err.println("Error: "+e.getMessage());
			return 1;
		}
	}

	protected RunConfiguration createConfiguration()
	{
		if ( speed && size ) {
			throw new IllegalArgumentException("-speed and -size are mutually exclusive");
		}
		return RunConfiguration.builder()
				.cpu( CpuType.fromName( cpu ) )
				.mode( size ? OptimizationMode.SIZE : OptimizationMode.SPEED )
				.dialect( AsmDialect.fromName( dialect ) )
				.traceLevel( traceLevel )
				.strictConvergence( strict )
				.build();
	}

	private void printSummary(PrintWriter out,RunConfiguration config,OptimizationResult result)
	{
		out.println("Target CPU             : "+config.cpu.displayName);
		out.println("Assembler              : "+config.dialect.name);
		out.println("Mode                   : "+config.mode);
		out.println( result.getSummary() );
		out.println("Output written to " + output.getPath());
		if ( config.traceLevel > 0 )
		{
			final ValidationReport report = result.report;
			out.println();
			out.println( report );
			if ( config.traceLevel >= 2 )
			{
				for ( String snapshot : report.getSnapshots() ) {
					out.println( snapshot );
				}
			}
		}
		out.flush();
	}
}
