package de.codesourcery.opt6502.output;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.optimizer.RunConfiguration;
import de.codesourcery.opt6502.parser.AsmDialect;

/**
 * Writes an instruction stream back as assembly source.
 */
public class SourceWriter
{
	private static final String INDENT = "    ";

	private final RunConfiguration config;
	private boolean writeHeader = true;

	public SourceWriter(RunConfiguration config)
	{
		Validate.notNull( config , "config must not be NULL" );
		this.config = config;
	}

	public SourceWriter setWriteHeader(boolean writeHeader)
	{
		this.writeHeader = writeHeader;
		return this;
	}

	public String toString(InstructionStream stream,int optimizations)
	{
		final StringWriter writer = new StringWriter();
		try {
			write( stream , optimizations , writer );
		}
		catch (IOException e) {
			// StringWriter does not throw
			throw new RuntimeException( e );
		}
		return writer.toString();
	}

	public void write(InstructionStream stream,int optimizations,Writer writer) throws IOException
	{
		final AsmDialect dialect = config.dialect;
		final String marker = dialect.getCommentMarker();

		if ( writeHeader )
		{
			writer.write( marker+" Optimized for "+config.mode+"\n" );
			writer.write( marker+" Assembler: "+dialect.name+"\n" );
			writer.write( marker+" Target CPU: "+config.cpu.displayName+"\n" );
			writer.write( marker+" Total optimizations: "+optimizations+"\n\n" );
			if ( config.traceLevel > 0 )
			{
				writer.write( marker+" Optimization trace enabled (Level "+config.traceLevel+")\n" );
				writer.write( marker+" Lines marked with "+marker+" OPT: show applied optimizations\n\n" );
			}
		}

		for ( Instruction insn : stream )
		{
			if ( insn.isDead() )
			{
				if ( config.traceLevel > 0 ) {
					writer.write( marker+" OPT: Removed - "+insn.toSourceText()+" (line "+insn.lineNumber+")\n" );
				}
				continue;
			}
			writer.write( format( insn , dialect ) );
			writer.write( "\n" );
		}
		writer.flush();
	}

	protected String format(Instruction insn,AsmDialect dialect)
	{
		if ( insn.isCommentOrBlank() ) {
			return StringUtils.stripEnd( insn.sourceText , null );
		}

		final StringBuilder buffer = new StringBuilder();
		if ( insn.hasLabel() )
		{
			buffer.append( insn.getLabel() );
			if ( dialect.supportsColonLabels() ) {
				buffer.append(":");
			}
			if ( insn.hasOpcode() ) {
				buffer.append("\t");
			}
		}
		else
		{
			buffer.append( INDENT );
		}

		if ( insn.hasOpcode() )
		{
			buffer.append( insn.getOpcodeText() );
			if ( StringUtils.isNotBlank( insn.getOperand().text ) ) {
				buffer.append(" ").append( insn.getOperand().text );
			}
		}
		if ( insn.getComment() != null ) {
			buffer.append("\t").append( insn.getComment() );
		}
		return buffer.toString();
	}
}
