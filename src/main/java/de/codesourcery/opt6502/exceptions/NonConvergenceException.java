package de.codesourcery.opt6502.exceptions;

public class NonConvergenceException extends RuntimeException {

	public final int iterations;
	public final int optimizationsInLastIteration;

	public NonConvergenceException(int iterations,int optimizationsInLastIteration)
	{
		super("Optimizer did not converge after "+iterations+" iterations ("+optimizationsInLastIteration+" optimizations in last iteration)");
		this.iterations = iterations;
		this.optimizationsInLastIteration = optimizationsInLastIteration;
	}
}
