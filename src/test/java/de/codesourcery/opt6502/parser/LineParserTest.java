package de.codesourcery.opt6502.parser;

import junit.framework.TestCase;
import de.codesourcery.opt6502.model.AddressingMode;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.Mnemonic;

public class LineParserTest extends TestCase
{
	private Instruction parse(String line) {
		return parse( AsmDialect.GENERIC , line );
	}

	private Instruction parse(AsmDialect dialect,String line) {
		return new LineParser( dialect ).parse( 7 , line );
	}

	public void testLabelOpcodeOperandAndComment()
	{
		final Instruction insn = parse( "label: LDA #$00 ; comment" );
		assertEquals( "label" , insn.getLabel() );
		assertEquals( "LDA" , insn.getOpcodeText() );
		assertEquals( Mnemonic.LDA , insn.getMnemonic() );
		assertEquals( "#$00" , insn.getOperand().text );
		assertEquals( "; comment" , insn.getComment() );
		assertEquals( 7 , insn.lineNumber );
	}

	public void testLabelWithoutColon()
	{
		final Instruction insn = parse( "loop  dex" );
		assertEquals( "loop" , insn.getLabel() );
		assertEquals( Mnemonic.DEX , insn.getMnemonic() );
	}

	public void testIndentedInstruction()
	{
		final Instruction insn = parse( "    sta $d020,x" );
		assertNull( insn.getLabel() );
		assertEquals( "sta" , insn.getOpcodeText() );
		assertEquals( Mnemonic.STA , insn.getMnemonic() );
		assertEquals( AddressingMode.ABSOLUTE_INDEXED_X , insn.getOperand().addressingMode );
	}

	public void testMnemonicInFirstColumnIsNoLabel()
	{
		final Instruction insn = parse( "RTS" );
		assertNull( insn.getLabel() );
		assertEquals( Mnemonic.RTS , insn.getMnemonic() );
	}

	public void testLabelOnly()
	{
		final Instruction insn = parse( "loop:" );
		assertEquals( "loop" , insn.getLabel() );
		assertFalse( insn.hasOpcode() );
		assertFalse( insn.isCommentOrBlank() );
	}

	public void testCommentOnly()
	{
		final Instruction insn = parse( "   ; just a comment" );
		assertTrue( insn.isCommentOrBlank() );
		assertEquals( "; just a comment" , insn.getComment() );
		assertEquals( "   ; just a comment" , insn.sourceText );
	}

	public void testBlankLine()
	{
		final Instruction insn = parse( "" );
		assertTrue( insn.isCommentOrBlank() );
		assertNull( insn.getComment() );
	}

	public void testCommentMarkerInsideStringIsIgnored()
	{
		final Instruction insn = parse( "    .byte \"a;b\" ; real" );
		assertEquals( ".byte" , insn.getOpcodeText() );
		assertTrue( insn.isOpaque() );
		assertEquals( "\"a;b\"" , insn.getOperand().text );
		assertEquals( "; real" , insn.getComment() );
	}

	public void testCommentMarkerInsideCharacterLiteralIsIgnored()
	{
		final Instruction insn = parse( "    LDA #';'" );
		assertEquals( "#';'" , insn.getOperand().text );
		assertNull( insn.getComment() );
		assertTrue( insn.getOperand().hasValue( ';' ) );
	}

	public void testDoubleSlashComments()
	{
		final Instruction insn = parse( AsmDialect.KICKASS , "    lda #1 // load" );
		assertEquals( "#1" , insn.getOperand().text );
		assertEquals( "// load" , insn.getComment() );
	}

	public void testMerlinLocalLabel()
	{
		final Instruction insn = parse( AsmDialect.MERLIN , ":loop DEX" );
		assertEquals( ":loop" , insn.getLabel() );
		assertEquals( Mnemonic.DEX , insn.getMnemonic() );
	}

	public void testOriginDirectiveIsNoLabel()
	{
		final Instruction insn = parse( "*=$1000" );
		assertNull( insn.getLabel() );
		assertEquals( "*=$1000" , insn.getOpcodeText() );
		assertTrue( insn.isOpaque() );
	}

	public void testUnknownOpcodeIsOpaque()
	{
		final Instruction insn = parse( "    lda.w $1000" );
		assertTrue( insn.isOpaque() );
		assertNull( insn.getMnemonic() );
	}

	public void testDialects()
	{
		assertEquals( AsmDialect.KICKASS , AsmDialect.fromName( "kickass" ) );
		assertEquals( AsmDialect.KICKASS , AsmDialect.fromName( "kick" ) );
		assertEquals( AsmDialect.TASS64 , AsmDialect.fromName( "64TASS" ) );
		assertEquals( AsmDialect.GENERIC , AsmDialect.fromName( "unknown" ) );
		assertEquals( AsmDialect.GENERIC , AsmDialect.fromName( null ) );

		assertTrue( AsmDialect.GENERIC.isLocalLabel( "@loop" ) );
		assertFalse( AsmDialect.GENERIC.isLocalLabel( "loop" ) );
		assertTrue( AsmDialect.DASM.isLocalLabel( ".loop" ) );
		assertTrue( AsmDialect.DASM.isLocalLabel( "1" ) );
		assertFalse( AsmDialect.TASS64.isLocalLabel( "@loop" ) );
		assertFalse( AsmDialect.MERLIN.supportsColonLabels() );
		assertEquals( "//" , AsmDialect.BUDDY.getCommentMarker() );
		assertTrue( AsmDialect.GENERIC.isCommentStart( "// x" , 0 ) );
	}
}
