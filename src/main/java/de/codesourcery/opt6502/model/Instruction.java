package de.codesourcery.opt6502.model;

import org.apache.commons.lang.StringUtils;

/**
 * One source line.
 *
 * Records are created once while reading the source and never physically removed, passes
 * only flag them as dead. Branch-target bookkeeping relies on this.
 */
public final class Instruction
{
	public final int lineNumber;
	public final String sourceText;

	private String label;
	private String opcodeText;
	private Mnemonic mnemonic;
	private Operand operand;
	private String comment;

	private boolean dead;
	private boolean noOptimize;
	private boolean localLabel;
	private boolean branchTarget;

	public Instruction(int lineNumber,String sourceText,String label,String opcodeText,String operandText,String comment)
	{
		this.lineNumber = lineNumber;
		this.sourceText = sourceText == null ? "" : sourceText;
		this.label = StringUtils.trimToNull( label );
		this.opcodeText = StringUtils.trimToNull( opcodeText );
		this.mnemonic = Mnemonic.fromString( this.opcodeText );
		this.operand = Operand.parse( operandText == null ? "" : operandText );
		this.comment = StringUtils.trimToNull( comment );
	}

	/**
	 * Creates a copy without label, comment and bookkeeping flags.
	 */
	public Instruction copyInstruction()
	{
		return new Instruction( lineNumber , sourceText , null , opcodeText , operand.text , null );
	}

	public String getLabel() {
		return label;
	}

	public boolean hasLabel() {
		return label != null;
	}

	public String getOpcodeText() {
		return opcodeText;
	}

	public boolean hasOpcode() {
		return opcodeText != null;
	}

	/**
	 * @return mnemonic or <code>null</code> if this line has no opcode or the opcode is unknown
	 */
	public Mnemonic getMnemonic() {
		return mnemonic;
	}

	public boolean is(Mnemonic m) {
		return mnemonic == m;
	}

	public Operand getOperand() {
		return operand;
	}

	public String getComment() {
		return comment;
	}

	/**
	 * Replaces the mnemonic, keeping the letter case the source used.
	 */
	public void replaceMnemonic(Mnemonic newMnemonic)
	{
		final String text = newMnemonic.getMnemonic();
		final boolean lowerCase = opcodeText != null && opcodeText.equals( opcodeText.toLowerCase() );
		this.opcodeText = lowerCase ? text.toLowerCase() : text;
		this.mnemonic = newMnemonic;
	}

	public void replaceOperand(String text) {
		this.operand = Operand.parse( text );
	}

	/**
	 * Whether this line contains neither a label nor an opcode.
	 */
	public boolean isCommentOrBlank() {
		return label == null && opcodeText == null;
	}

	/**
	 * Whether this line has an opcode the optimizer does not understand (assembler directive, macro, ...).
	 *
	 * Such lines are never matched by any pattern.
	 */
	public boolean isOpaque() {
		return opcodeText != null && mnemonic == null;
	}

	public boolean isDead() {
		return dead;
	}

	public void markDead() {
		this.dead = true;
	}

	public boolean isNoOptimize() {
		return noOptimize;
	}

	public void setNoOptimize(boolean noOptimize) {
		this.noOptimize = noOptimize;
	}

	public boolean isLocalLabel() {
		return localLabel;
	}

	public void setLocalLabel(boolean localLabel) {
		this.localLabel = localLabel;
	}

	public boolean isBranchTarget() {
		return branchTarget;
	}

	public void setBranchTarget(boolean branchTarget) {
		this.branchTarget = branchTarget;
	}

	/**
	 * Renders label, opcode and operand the way they would appear in source.
	 */
	public String toSourceText()
	{
		final StringBuilder buffer = new StringBuilder();
		if ( label != null ) {
			buffer.append( label ).append(" ");
		}
		if ( opcodeText != null )
		{
			buffer.append( opcodeText );
			if ( StringUtils.isNotBlank( operand.text ) ) {
				buffer.append(" ").append( operand.text );
			}
		}
		return buffer.toString().trim();
	}

	@Override
	public String toString() {
		return "line "+lineNumber+": "+toSourceText()+( dead ? " [dead]" : "" );
	}
}
