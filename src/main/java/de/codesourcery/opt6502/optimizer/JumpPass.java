package de.codesourcery.opt6502.optimizer;

import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;

/**
 * Removes jumps to the immediately following label.
 */
public class JumpPass extends AbstractOptimizationPass
{
	public JumpPass() {
		super("jump");
	}

	@Override
	public int apply(InstructionStream stream, OptimizationContext context)
	{
		int count = 0;
		for ( int i = 0 , len = stream.size() ; i < len ; i++ )
		{
			final Instruction jump = stream.get( i );
			if ( ! isCandidate( jump ) || ! isRemovable( jump ) ) {
				continue;
			}
			if ( ! jump.is( Mnemonic.JMP ) && ! jump.is( Mnemonic.BRA ) ) {
				continue;
			}
			if ( jump.getOperand().addressingMode.isIndirect() ) {
				continue;
			}
			if ( jumpsToNextInstruction( stream , i , jump.getOperand().text ) )
			{
				jump.markDead();
				logRewrite( "removed jump to next instruction" , jump );
				count++;
			}
		}
		return count;
	}

	/**
	 * Checks whether any of the labels directly following an instruction has the given name.
	 */
	private static boolean jumpsToNextInstruction(InstructionStream stream,int index,String target)
	{
		for ( int i = index+1 , len = stream.size() ; i < len ; i++ )
		{
			final Instruction insn = stream.get( i );
			if ( insn.isDead() || insn.isCommentOrBlank() ) {
				continue;
			}
			if ( ! insn.hasLabel() || ! insn.isBranchTarget() ) {
				return false;
			}
			if ( insn.getLabel().equals( target.trim() ) ) {
				return true;
			}
			if ( insn.hasOpcode() ) {
				return false;
			}
		}
		return false;
	}
}
