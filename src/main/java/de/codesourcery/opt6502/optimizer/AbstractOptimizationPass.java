package de.codesourcery.opt6502.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;

/**
 * Base class for passes that match patterns over a window of adjacent instructions.
 *
 * A window may start at a branch target but never extends across one, nor across
 * a disabled or unknown instruction.
 */
public abstract class AbstractOptimizationPass implements IOptimizationPass
{
	protected final Logger log = LoggerFactory.getLogger( getClass() );

	private final String name;

	protected AbstractOptimizationPass(String name) {
		this.name = name;
	}

	@Override
	public final String getName() {
		return name;
	}

	@Override
	public boolean isApplicable(OptimizationContext context) {
		return true;
	}

	/**
	 * Whether an instruction may start a pattern.
	 */
	protected static boolean isCandidate(Instruction insn)
	{
		return ! insn.isDead() && ! insn.isNoOptimize() && insn.getMnemonic() != null;
	}

	protected static boolean isCandidate(Instruction insn,Mnemonic mnemonic)
	{
		return isCandidate( insn ) && insn.is( mnemonic );
	}

	/**
	 * Whether an instruction may be marked dead.
	 */
	protected static boolean isRemovable(Instruction insn)
	{
		return ! insn.isDead() && ! insn.isNoOptimize() && ! insn.isBranchTarget();
	}

	/**
	 * Whether an instruction is a live, enabled jump or return that
	 * execution never falls through.
	 */
	protected static boolean isTerminator(Instruction insn)
	{
		return isCandidate( insn ) && insn.getMnemonic().isUnconditionalTransfer();
	}

	/**
	 * Whether an instruction can only be reached by falling through a terminator.
	 *
	 * Uses the same rule as {@link DeadCodePass}: labels, branch targets, disabled
	 * and unknown instructions make code reachable.
	 *
	 * @param stream
	 * @param index
	 * @see #isTerminator(Instruction)
	 */
	protected static boolean isUnreachable(InstructionStream stream,int index)
	{
		final Instruction insn = stream.get( index );
		if ( insn.hasLabel() || insn.isBranchTarget() || insn.isNoOptimize() || insn.isOpaque() ) {
			return false;
		}
		for ( int i = index-1 ; i >= 0 ; i-- )
		{
			final Instruction previous = stream.get( i );
			if ( previous.isDead() || previous.isCommentOrBlank() ) {
				continue;
			}
			if ( isTerminator( previous ) ) {
				return true;
			}
			if ( previous.hasLabel() || previous.isBranchTarget() || previous.isNoOptimize() || previous.isOpaque() ) {
				return false;
			}
		}
		return false;
	}

	/**
	 * Returns the index of the next instruction that may continue a pattern.
	 *
	 * Dead instructions and comment lines are skipped.
	 *
	 * @param stream
	 * @param index
	 * @return index or -1 if the window ends before the next instruction
	 */
	protected static int nextInWindow(InstructionStream stream,int index)
	{
		for ( int i = index+1 , len = stream.size() ; i < len ; i++ )
		{
			final Instruction insn = stream.get( i );
			if ( insn.isDead() || insn.isCommentOrBlank() ) {
				continue;
			}
			if ( insn.isNoOptimize() || insn.isBranchTarget() || insn.isOpaque() ) {
				return -1;
			}
			return i;
		}
		return -1;
	}

	/**
	 * Returns the next window instruction if it has the given mnemonic.
	 *
	 * @return index or -1
	 */
	protected static int nextInWindow(InstructionStream stream,int index,Mnemonic expected)
	{
		final int next = nextInWindow( stream , index );
		return next != -1 && stream.get( next ).is( expected ) ? next : -1;
	}

	/**
	 * Returns the closest live instruction before an index.
	 *
	 * @return instruction or <code>null</code> if there is none
	 */
	protected static Instruction previousInstruction(InstructionStream stream,int index)
	{
		for ( int i = index-1 ; i >= 0 ; i-- )
		{
			final Instruction insn = stream.get( i );
			if ( ! insn.isDead() && ! insn.isCommentOrBlank() ) {
				return insn;
			}
		}
		return null;
	}

	protected final void logRewrite(String message,Instruction insn)
	{
		if ( log.isDebugEnabled() ) {
			log.debug( name+": "+message+" (line "+insn.lineNumber+")" );
		}
	}

	@Override
	public String toString() {
		return name;
	}
}
