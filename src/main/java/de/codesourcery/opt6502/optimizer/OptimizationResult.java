package de.codesourcery.opt6502.optimizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import de.codesourcery.opt6502.analysis.ValidationReport;

/**
 * Outcome of an optimizer run.
 */
public class OptimizationResult
{
	public final int optimizations;
	public final int iterations;
	public final boolean converged;
	public final int linesRead;
	public final int deadLines;
	public final int finalLineCount;
	public final ValidationReport report;
	private final List<String> warnings;

	public OptimizationResult(int optimizations,int iterations,boolean converged,int linesRead,int deadLines,int finalLineCount,List<String> warnings,ValidationReport report)
	{
		this.optimizations = optimizations;
		this.iterations = iterations;
		this.converged = converged;
		this.linesRead = linesRead;
		this.deadLines = deadLines;
		this.finalLineCount = finalLineCount;
		this.warnings = new ArrayList<>( warnings );
		this.report = report;
	}

	public List<String> getWarnings() {
		return Collections.unmodifiableList( warnings );
	}

	/**
	 * @return percentage of lines removed, 0 for empty input
	 */
	public double getReductionPercent() {
		return linesRead == 0 ? 0 : ( ( linesRead - finalLineCount ) * 100.0d ) / linesRead;
	}

	public String getSummary()
	{
		final StringBuilder buffer = new StringBuilder();
		buffer.append("Lines read             : ").append( linesRead ).append("\n");
		buffer.append("Optimizations applied  : ").append( optimizations ).append("\n");
		buffer.append("Iterations             : ").append( iterations ).append( converged ? "" : " (did not converge)" ).append("\n");
		buffer.append("Lines removed          : ").append( deadLines ).append("\n");
		buffer.append("Final line count       : ").append( finalLineCount ).append("\n");
		buffer.append("Reduction              : ").append( String.format("%.1f%%", getReductionPercent() ) );
		for ( String warning : warnings ) {
			buffer.append("\nWARNING: ").append( warning );
		}
		return buffer.toString();
	}

	@Override
	public String toString() {
		return "OptimizationResult[optimizations="+optimizations+", iterations="+iterations+", converged="+converged+"]";
	}
}
