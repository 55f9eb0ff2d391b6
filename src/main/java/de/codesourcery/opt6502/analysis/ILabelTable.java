package de.codesourcery.opt6502.analysis;

import java.util.List;

public interface ILabelTable
{
	public List<LabelEntry> getGlobalLabels();

	public List<LabelEntry> getLocalLabels(String scope);

	public List<LabelEntry> getAllLabels();

	/**
	 * Looks up a label.
	 *
	 * @param name
	 * @param scope enclosing global label for local labels, <code>null</code> for global labels
	 * @return label or <code>null</code>
	 */
	public LabelEntry getLabel(String name,String scope);

	public boolean isDefined(String name,String scope);

	public void defineLabel(LabelEntry entry);
}
