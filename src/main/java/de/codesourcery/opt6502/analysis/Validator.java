package de.codesourcery.opt6502.analysis;

import org.apache.commons.lang.StringUtils;

import de.codesourcery.opt6502.model.Flag;
import de.codesourcery.opt6502.model.Instruction;
import de.codesourcery.opt6502.model.InstructionStream;
import de.codesourcery.opt6502.model.Mnemonic;
import de.codesourcery.opt6502.model.Register;

/**
 * Sweeps over the optimized program and gathers register/flag statistics.
 *
 * Never alters the program.
 */
public class Validator
{
	private final RegisterTracker tracker = new RegisterTracker();

	public ValidationReport validate(InstructionStream stream,int traceLevel)
	{
		final ValidationReport report = new ValidationReport();
		RegisterState state = new RegisterState();
		for ( Instruction insn : stream )
		{
			if ( insn.isDead() ) {
				continue;
			}
			// label-only lines still reset the state
			state = tracker.step( insn , state );
			if ( ! insn.hasOpcode() ) {
				continue;
			}
			report.instructionVisited();

			final Mnemonic m = insn.getMnemonic();
			if ( m != null )
			{
				for ( Register r : m.getRegistersRead( insn.getOperand() ) ) {
					report.registerRead( r );
				}
				for ( Register r : Register.values() ) {
					if ( state.isModified( r ) ) {
						report.registerModified( r );
					}
				}
				for ( Flag f : m.getFlagsWritten( insn.getOperand() ) ) {
					report.flagModified( f );
				}
			}
			if ( traceLevel >= 2 ) {
				report.addSnapshot( StringUtils.rightPad( "line "+insn.lineNumber+": "+insn.toSourceText() , 40 )+state );
			}
		}
		return report;
	}
}
