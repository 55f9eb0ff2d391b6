package de.codesourcery.opt6502.optimizer;

import java.util.ArrayList;
import java.util.List;

import de.codesourcery.opt6502.analysis.LabelEntry;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;

/**
 * Copies the body of subroutines that are called exactly once to the call site.
 *
 * <pre>
 *     JSR sub          LDA #1
 *     ...              STA $d020
 *     RTS              ...
 * sub:                 RTS
 *     LDA #1      =&gt;
 *     STA $d020
 *     RTS
 * </pre>
 *
 * The original call, label and return are marked dead, the now unreachable original body
 * is left to the dead-code pass.
 *
 * Requires an up-to-date label table.
 */
public class SubroutineInliner extends AbstractOptimizationPass
{
	public SubroutineInliner() {
		super("inline");
	}

	@Override
	public int apply(InstructionStream stream, OptimizationContext context)
	{
		int count = 0;
		for ( LabelEntry sub : context.getLabels().getSubroutines() )
		{
			final Instruction call = getInlinableCall( stream , sub );
			if ( call == null ) {
				continue;
			}
			final List<Instruction> body = getInlinableBody( stream , sub );
			if ( body == null ) {
				continue;
			}

			final List<Instruction> copies = new ArrayList<>();
			for ( Instruction insn : body ) {
				copies.add( insn.copyInstruction() );
			}
			stream.insertAfter( stream.indexOf( call ) , copies );
			call.markDead();
			sub.definition.markDead();
			sub.getBodyEnd().markDead();
			if ( log.isDebugEnabled() ) {
				log.debug( getName()+": inlined '"+sub.name+"' ("+body.size()+" instructions) at line "+call.lineNumber );
			}
			count++;
		}
		return count;
	}

	private static Instruction getInlinableCall(InstructionStream stream,LabelEntry sub)
	{
		if ( ! sub.isBounded() ) {
			return null;
		}
		// calls in unreachable code are removed later and do not count
		final List<Instruction> calls = new ArrayList<>();
		for ( Instruction ref : sub.getReferences() )
		{
			final int index = stream.indexOf( ref );
			if ( index == -1 || ! isUnreachable( stream , index ) ) {
				calls.add( ref );
			}
		}
		if ( calls.size() != 1 ) {
			return null;
		}
		final Instruction call = calls.get( 0 );
		if ( ! call.is( Mnemonic.JSR ) || ! call.getOperand().text.equals( sub.name ) ) {
			return null;
		}
		if ( call.isDead() || call.isNoOptimize() || call.hasLabel() ) {
			return null;
		}
		return call;
	}

	/**
	 * Returns the instructions between a subroutine's label and its return.
	 *
	 * @return instructions or <code>null</code> if the subroutine cannot be inlined
	 */
	private static List<Instruction> getInlinableBody(InstructionStream stream,LabelEntry sub)
	{
		final int start = stream.indexOf( sub.definition );
		final int end = stream.indexOf( sub.getBodyEnd() );
		if ( start == -1 || end <= start ) {
			return null;
		}
		if ( sub.definition.isNoOptimize() || sub.getBodyEnd().isNoOptimize() || sub.getBodyEnd().hasLabel() ) {
			return null;
		}

		// execution must not fall through into the subroutine
		final Instruction previous = previousInstruction( stream , start );
		if ( previous == null || previous.getMnemonic() == null || ! previous.getMnemonic().isUnconditionalTransfer() ) {
			return null;
		}

		final List<Instruction> body = new ArrayList<>();
		if ( sub.definition.hasOpcode() )
		{
			if ( ! isInlinable( sub.definition ) ) {
				return null;
			}
			body.add( sub.definition );
		}
		for ( int i = start+1 ; i < end ; i++ )
		{
			final Instruction insn = stream.get( i );
			if ( insn.isDead() || insn.isCommentOrBlank() ) {
				continue;
			}
			if ( insn.hasLabel() || ! isInlinable( insn ) ) {
				return null;
			}
			body.add( insn );
		}
		return body;
	}

	private static boolean isInlinable(Instruction insn)
	{
		if ( insn.isNoOptimize() || insn.isOpaque() ) {
			return false;
		}
		final Mnemonic m = insn.getMnemonic();
		// inlined code runs without the return address on the stack
		return ! m.isControlFlow() && ! m.hasUnmodelledEffects() && ! m.touchesStackPointer() &&
				! m.hasCategory( Mnemonic.Category.STACK );
	}
}
