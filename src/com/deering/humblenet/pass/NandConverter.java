package com.deering.humblenet.pass;

import org.apache.logging.log4j.Logger;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Gate;

/**
 * Collapses an AIG into NAND form: an inner gate whose fan-out edges all invert
 * absorbs the inversion into its own output. Buffers absorb it too and become
 * inverters.
 *
 * @author tdeering
 *
 */
public class NandConverter extends NetPass {

	public NandConverter(BooleanNet net, Logger log){
		super(net, log);
	}

	@Override
	public boolean run(){
		log.trace("convNAND()");
		int converted = 0;
		for(Gate gate : net.getGates()){
			int fanOut = gate.getFanOut();
			int inverted = countInvertedFanOut(gate);
			log.debug("{} has {} inverted followers", gate, inverted);

			if(fanOut > 0 && inverted == fanOut){
				clearInvertedFanOut(gate);
				toggleOutputInversion(gate);
				converted++;
			}
		}
		log.info("NAND conversion: {} gates absorbed their output inverters", converted);
		return converted > 0;
	}
}
