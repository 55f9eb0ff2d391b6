package de.codesourcery.opt6502.model;

public enum OptimizationMode
{
	SPEED("speed"),
	SIZE("size");

	public final String name;

	private OptimizationMode(String name) {
		this.name = name;
	}

	@Override
	public String toString() {
		return name;
	}
}
