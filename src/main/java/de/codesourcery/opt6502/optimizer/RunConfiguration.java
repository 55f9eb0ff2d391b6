package de.codesourcery.opt6502.optimizer;

import org.apache.commons.lang.Validate;

import de.codesourcery.opt6502.model.CpuType;
import de.codesourcery.opt6502.model.OptimizationMode;
import de.codesourcery.opt6502.parser.AsmDialect;

/**
 * Settings for one optimizer run.
 */
public final class RunConfiguration
{
	public static final int DEFAULT_MAX_ITERATIONS = 10;

	public final CpuType cpu;
	public final OptimizationMode mode;
	public final AsmDialect dialect;
	public final int traceLevel;
	public final boolean optimizationsInitiallyEnabled;
	public final boolean strictConvergence;
	public final int maxIterations;

	private RunConfiguration(Builder builder)
	{
		this.cpu = builder.cpu;
		this.mode = builder.mode;
		this.dialect = builder.dialect;
		this.traceLevel = builder.traceLevel;
		this.optimizationsInitiallyEnabled = builder.optimizationsInitiallyEnabled;
		this.strictConvergence = builder.strictConvergence;
		this.maxIterations = builder.maxIterations;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Default settings: 6502, optimize for speed, generic syntax.
	 */
	public static RunConfiguration defaults() {
		return builder().build();
	}

	public static RunConfiguration forCpu(CpuType cpu) {
		return builder().cpu( cpu ).build();
	}

	@Override
	public String toString() {
		return "cpu="+cpu+", mode="+mode+", dialect="+dialect+", trace="+traceLevel+", strict="+strictConvergence;
	}

	public static final class Builder
	{
		private CpuType cpu = CpuType.MOS6502;
		private OptimizationMode mode = OptimizationMode.SPEED;
		private AsmDialect dialect = AsmDialect.GENERIC;
		private int traceLevel;
		private boolean optimizationsInitiallyEnabled = true;
		private boolean strictConvergence;
		private int maxIterations = DEFAULT_MAX_ITERATIONS;

		private Builder() {
		}

		public Builder cpu(CpuType cpu)
		{
			Validate.notNull( cpu , "cpu must not be NULL" );
			this.cpu = cpu;
			return this;
		}

		public Builder mode(OptimizationMode mode)
		{
			Validate.notNull( mode , "mode must not be NULL" );
			this.mode = mode;
			return this;
		}

		public Builder dialect(AsmDialect dialect)
		{
			Validate.notNull( dialect , "dialect must not be NULL" );
			this.dialect = dialect;
			return this;
		}

		public Builder traceLevel(int traceLevel)
		{
			Validate.isTrue( traceLevel >= 0 , "trace level must be >= 0" );
			this.traceLevel = traceLevel;
			return this;
		}

		public Builder optimizationsInitiallyEnabled(boolean enabled)
		{
			this.optimizationsInitiallyEnabled = enabled;
			return this;
		}

		public Builder strictConvergence(boolean strict)
		{
			this.strictConvergence = strict;
			return this;
		}

		public Builder maxIterations(int maxIterations)
		{
			Validate.isTrue( maxIterations > 0 , "max iterations must be > 0" );
			this.maxIterations = maxIterations;
			return this;
		}

		public RunConfiguration build() {
			return new RunConfiguration( this );
		}
	}
}
