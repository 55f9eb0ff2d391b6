package de.codesourcery.opt6502.analysis;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;
import de.codesourcery.opt6502.parser.AsmDialect;

/**
 * Builds the label table, resolves label references, marks branch targets and
 * determines subroutine bodies.
 *
 * Re-running the analyzer on an unchanged stream yields the same result, all
 * per-instruction flags are reset before they get recomputed.
 */
public class ControlFlowAnalyzer
{
	private static final Logger LOG = LoggerFactory.getLogger( ControlFlowAnalyzer.class );

	private static final String NO_SCOPE = "";

	private final AsmDialect dialect;

	public ControlFlowAnalyzer(AsmDialect dialect)
	{
		Validate.notNull( dialect , "dialect must not be NULL" );
		this.dialect = dialect;
	}

	public LabelTable analyze(InstructionStream stream)
	{
		final LabelTable table = new LabelTable();

		defineLabels( stream , table );
		resolveReferences( stream , table );
		findSubroutineBodies( stream , table );

		if ( LOG.isTraceEnabled() ) {
			LOG.trace( table.toString() );
		}
		return table;
	}

	private void defineLabels(InstructionStream stream,LabelTable table)
	{
		String scope = null;
		for ( Instruction insn : stream )
		{
			insn.setBranchTarget( false );
			insn.setLocalLabel( false );
			if ( insn.isDead() || ! insn.hasLabel() ) {
				continue;
			}
			final String label = insn.getLabel();
			final boolean local = dialect.isLocalLabel( label );
			insn.setLocalLabel( local );
			// any labelled line may be reached from somewhere else
			insn.setBranchTarget( true );
			if ( local ) {
				table.defineLabel( new LabelEntry( label , insn , scope == null ? NO_SCOPE : scope ) );
			} else {
				scope = label;
				table.defineLabel( new LabelEntry( label , insn , null ) );
			}
		}
	}

	private void resolveReferences(InstructionStream stream,LabelTable table)
	{
		String scope = NO_SCOPE;
		for ( Instruction insn : stream )
		{
			if ( insn.isDead() ) {
				continue;
			}
			if ( insn.hasLabel() && ! insn.isLocalLabel() ) {
				scope = insn.getLabel();
			}
			if ( ! insn.hasOpcode() || StringUtils.isBlank( insn.getOperand().text ) ) {
				continue;
			}
			final Mnemonic mnemonic = insn.getMnemonic();
			final boolean controlFlow = mnemonic != null && mnemonic.isControlFlow();
			for ( String symbol : getSymbols( insn.getOperand().text ) )
			{
				// numeric local labels would otherwise match every plain decimal literal
				if ( Character.isDigit( symbol.charAt(0) ) && ! controlFlow ) {
					continue;
				}
				LabelEntry entry = dialect.isLocalLabel( symbol ) ? table.getLabel( symbol , scope ) : null;
				if ( entry == null ) {
					entry = table.getLabel( symbol , null );
				}
				if ( entry != null )
				{
					entry.addReference( insn );
					if ( mnemonic != null && mnemonic.isCall() ) {
						entry.setSubroutine( true );
					}
				}
			}
		}
	}

	/**
	 * Splits operand text into the symbols it mentions.
	 */
	protected static List<String> getSymbols(String operand)
	{
		final List<String> result = new ArrayList<>();
		final int len = operand.length();
		int i = 0;
		while ( i < len )
		{
			if ( ! isSymbolChar( operand.charAt( i ) ) ) {
				i++;
				continue;
			}
			final int start = i;
			while ( i < len && isSymbolChar( operand.charAt( i ) ) ) {
				i++;
			}
			final char previous = start > 0 ? operand.charAt( start - 1 ) : ' ';
			// hex and binary literals
			if ( previous != '$' && previous != '%' ) {
				result.add( operand.substring( start , i ) );
			}
		}
		return result;
	}

	public static boolean isSymbolChar(char c)
	{
		return Character.isLetterOrDigit( c ) || c == '_' || c == '@' || c == '.' || c == '!' || c == '?' || c == ':';
	}

	private void findSubroutineBodies(InstructionStream stream,LabelTable table)
	{
		for ( LabelEntry entry : table.getSubroutines() )
		{
			if ( isReturn( entry.definition ) )
			{
				entry.setBodyEnd( entry.definition );
				continue;
			}
			final int start = stream.indexOf( entry.definition );
			for ( int i = start+1 , len = stream.size() ; i < len ; i++ )
			{
				final Instruction insn = stream.get( i );
				if ( insn.isDead() ) {
					continue;
				}
				if ( insn.hasLabel() && ! insn.isLocalLabel() ) {
					break;
				}
				if ( isReturn( insn ) ) {
					entry.setBodyEnd( insn );
					break;
				}
			}
			if ( ! entry.isBounded() )
			{
				final String msg = "Subroutine '"+entry.name+"' (line "+entry.definition.lineNumber+") has no return before the next global label";
				LOG.debug( msg );
				table.addWarning( msg );
			}
		}
	}

	private static boolean isReturn(Instruction insn) {
		return insn.getMnemonic() != null && insn.getMnemonic().isReturn();
	}
}
