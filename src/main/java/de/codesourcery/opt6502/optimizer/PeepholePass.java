package de.codesourcery.opt6502.optimizer;

import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;

/**
 * <pre>
 * LDA #v
 * STA addr
 * LDA #v    &lt;-- removed
 * </pre>
 */
public class PeepholePass extends AbstractOptimizationPass
{
	public PeepholePass() {
		super("peephole");
	}

	@Override
	public int apply(InstructionStream stream, OptimizationContext context)
	{
		int count = 0;
		for ( int i = 0 , len = stream.size() ; i < len ; i++ )
		{
			final Instruction load = stream.get( i );
			if ( ! isCandidate( load , Mnemonic.LDA ) || ! load.getOperand().isImmediate() ) {
				continue;
			}
			final int store = nextInWindow( stream , i , Mnemonic.STA );
			if ( store == -1 ) {
				continue;
			}
			final int reload = nextInWindow( stream , store , Mnemonic.LDA );
			if ( reload != -1 && stream.get( reload ).getOperand().sameAs( load.getOperand() ) )
			{
				stream.get( reload ).markDead();
				logRewrite( "removed redundant "+stream.get( reload ).toSourceText() , stream.get( reload ) );
				count++;
			}
		}
		return count;
	}
}
