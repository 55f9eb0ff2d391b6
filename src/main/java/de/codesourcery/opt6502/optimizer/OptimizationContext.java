package de.codesourcery.opt6502.optimizer;

import org.apache.commons.lang.Validate;

import de.codesourcery.opt6502.analysis.LabelTable;
import de.codesourcery.opt6502.model.CpuType;

/**
 * What passes may need to know besides the instruction stream itself.
 */
public class OptimizationContext
{
	public final RunConfiguration config;
	private LabelTable labels = new LabelTable();

	public OptimizationContext(RunConfiguration config)
	{
		Validate.notNull( config , "config must not be NULL" );
		this.config = config;
	}

	public CpuType getCpu() {
		return config.cpu;
	}

	/**
	 * Label table computed at the start of the current iteration.
	 */
	public LabelTable getLabels() {
		return labels;
	}

	public void setLabels(LabelTable labels)
	{
		Validate.notNull( labels , "labels must not be NULL" );
		this.labels = labels;
	}
}
