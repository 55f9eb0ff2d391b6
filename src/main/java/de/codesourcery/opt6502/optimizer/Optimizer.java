package de.codesourcery.opt6502.optimizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.opt6502.analysis.ControlFlowAnalyzer;
import de.codesourcery.opt6502.analysis.LabelTable;
import de.codesourcery.opt6502.analysis.ValidationReport;
import de.codesourcery.opt6502.analysis.Validator;
import de.codesourcery.opt6502.exceptions.NonConvergenceException;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;

/**
 * Drives the optimization passes to a fixed point.
 *
 * <pre>
 * inline (once)
 * repeat until nothing changes or the iteration limit is reached:
 *   analyze, peephole, load-store, register-usage, constant-propagation,
 *   cpu-specific, jump, dead-code
 * validate
 * </pre>
 */
public class Optimizer
{
	private static final Logger LOG = LoggerFactory.getLogger( Optimizer.class );

	private final RunConfiguration config;
	private final IOptimizationPass inliner;
	private final List<IOptimizationPass> passes;

	public Optimizer(RunConfiguration config) {
		this( config , new SubroutineInliner() , createPasses( config ) );
	}

	public Optimizer(RunConfiguration config,IOptimizationPass inliner,List<IOptimizationPass> passes)
	{
		Validate.notNull( config , "config must not be NULL" );
		Validate.notNull( passes , "passes must not be NULL" );
		this.config = config;
		this.inliner = inliner;
		this.passes = new ArrayList<>( passes );
	}

	/**
	 * Creates the passes to run each iteration, dead-code elimination always last.
	 */
	public static List<IOptimizationPass> createPasses(RunConfiguration config)
	{
		final List<IOptimizationPass> result = new ArrayList<>();
		result.add( new PeepholePass() );
		result.add( new LoadStorePass() );
		result.add( new RegisterUsagePass() );
		result.add( new ConstantPropagationPass() );
		if ( config.cpu.is45GS02() ) {
			result.add( new Cpu45GS02Pass() );
		}
		else if ( Cpu65C02Pass.isApplicable( config.cpu ) ) {
			result.add( new Cpu65C02Pass() );
		}
		result.add( new JumpPass() );
		result.add( new DeadCodePass() );
		return result;
	}

	public List<IOptimizationPass> getPasses() {
		return Collections.unmodifiableList( passes );
	}

	public OptimizationResult optimize(InstructionStream stream)
	{
		Validate.notNull( stream , "stream must not be NULL" );

		final int linesRead = stream.size();
		final OptimizationContext context = new OptimizationContext( config );
		final ControlFlowAnalyzer analyzer = new ControlFlowAnalyzer( config.dialect );
		final Set<String> warnings = new LinkedHashSet<>();

		LOG.debug("Optimizing {} lines ({})", linesRead, config);
		checkInstructionSet( stream , warnings );

		int total = 0;
		if ( inliner != null )
		{
			analyze( analyzer , stream , context , warnings );
			final int inlined = inliner.apply( stream , context );
			LOG.debug("{}: {} optimizations", inliner.getName(), inlined);
			total += inlined;
		}

		int iterations = 0;
		int lastCount = 0;
		boolean converged = false;
		while ( iterations < config.maxIterations )
		{
			iterations++;
			analyze( analyzer , stream , context , warnings );
			lastCount = 0;
			for ( IOptimizationPass pass : passes )
			{
				if ( ! pass.isApplicable( context ) ) {
					continue;
				}
				final int count = pass.apply( stream , context );
				if ( count > 0 ) {
					LOG.debug("Iteration {}, {}: {} optimizations", iterations, pass.getName(), count);
				}
				lastCount += count;
			}
			total += lastCount;
			LOG.debug("Iteration {} finished with {} optimizations", iterations, lastCount);
			if ( lastCount == 0 ) {
				converged = true;
				break;
			}
		}

		if ( ! converged )
		{
			final String msg = "Optimizer did not converge after "+iterations+" iterations";
			LOG.warn( msg );
			warnings.add( msg );
			if ( config.strictConvergence ) {
				throw new NonConvergenceException( iterations , lastCount );
			}
		}

		final ValidationReport report = new Validator().validate( stream , config.traceLevel );
		final int dead = stream.getDeadCount();
		final OptimizationResult result = new OptimizationResult( total , iterations , converged , linesRead , dead , stream.size() - dead , new ArrayList<>( warnings ) , report );
		LOG.info("{} optimizations in {} iterations", total, iterations);
		return result;
	}

	/**
	 * Reports instructions the target CPU does not have. They are passed through unchanged.
	 */
	private void checkInstructionSet(InstructionStream stream,Set<String> warnings)
	{
		for ( Instruction insn : stream )
		{
			final Mnemonic m = insn.getMnemonic();
			if ( m != null && ! m.isAvailableOn( config.cpu ) )
			{
				final String msg = "Line "+insn.lineNumber+": "+m.getMnemonic()+" is not available on the "+config.cpu.displayName;
				if ( warnings.add( msg ) ) {
					LOG.warn( msg );
				}
			}
		}
	}

	private static void analyze(ControlFlowAnalyzer analyzer,InstructionStream stream,OptimizationContext context,Set<String> warnings)
	{
		final LabelTable labels = analyzer.analyze( stream );
		context.setLabels( labels );
		for ( String warning : labels.getWarnings() )
		{
			if ( warnings.add( warning ) ) {
				LOG.warn( warning );
			}
		}
	}
}
