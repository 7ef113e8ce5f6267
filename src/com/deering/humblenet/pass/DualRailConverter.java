package com.deering.humblenet.pass;

import java.util.List;

import org.apache.logging.log4j.Logger;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Edge;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.GateFunction;
import com.deering.humblenet.GatePlacement;
import com.deering.humblenet.NetException;

/**
 * Converts a single-rail net to its dual-rail version. Every gate, input and
 * output gets a complementary duplicate; afterwards inversion is expressed only
 * by choosing between the two rails, so the net has no inverting edges and no
 * inverting inner gates or outputs.
 *
 * NOTE: The net should be reduced with {@link InverterMover} first. XOR gates
 * have no structural dual and are rejected.
 *
 * @author tdeering
 *
 */
public class DualRailConverter extends NetPass {

	public DualRailConverter(BooleanNet net, Logger log){
		super(net, log);
	}

	@Override
	public boolean run(){
		log.trace("convDualRail()");
		List<Gate> gates = net.getGates();
		List<Gate> inputs = net.getInputs();
		List<Gate> outputs = net.getOutputs();

		for(Gate gate : gates){
			if(gate.getFunction() == GateFunction.XOR) throw new NetException("Cannot build the dual rail of XOR gate " + gate);
		}

		// Duplicate gates: dual function over the negated inputs
		for(Gate gate : gates){
			Gate dual = net.newGate("D_" + gate.getName(), gate.getFunction().dual(), GatePlacement.INNER);
			if(gate.isOutputInverting()) dual.setOutputInverting();
			for(int j = 0; j < gate.getFanIn(); ++j){
				dual.newInput(gate.getDriver(j), !gate.isInputInverting(j));
			}
			dual.setComplement(gate);
		}

		// Duplicate inputs
		for(Gate in : inputs){
			Gate dual = net.newGate("D_" + in.getName(), GateFunction.BUFFER, GatePlacement.INPUT);
			dual.newInput(in, false);
			dual.setOutputInverting();
			dual.resetDepth();
			dual.setComplement(in);
		}

		// Duplicate outputs, picking the rail that absorbs the output inversion
		for(Gate out : outputs){
			if(out.getFanIn() != 1) throw new NetException("Output " + out + " must have exactly one driver");
			Gate driver = out.getDriver(0);
			Gate complement = complementOf(driver);
			boolean inverted = out.isInputInverting(0) ^ out.isOutputInverting();

			Gate dual = net.newGate("D_" + out.getName(), out.getFunction(), GatePlacement.OUTPUT);
			dual.setComplement(out);
			out.setInputNonInverting(0);
			out.setOutputNonInverting();
			if(inverted){
				out.swapDriver(0, complement);
				dual.newInput(driver, false);
			} else {
				dual.newInput(complement, false);
			}
		}

		// Remove inverters from gate outputs
		for(Gate gate : net.getGates()){
			if(gate.isOutputInverting()){
				for(Edge edge : gate.getFanOutEdges()){
					toggleInputInversion(edge.getFollower(), edge.getIndex());
				}
				gate.setOutputNonInverting();
			}
		}

		// Route every remaining inverting edge to the complementary rail
		int swapped = 0;
		for(Gate gate : net.getGates()){
			swapped += swapInvertedInputs(gate);
		}
		for(Gate out : net.getOutputs()){
			swapped += swapInvertedInputs(out);
		}

		log.info("Dual rail: {} gates, {} inputs, {} outputs, {} edges rerouted",
				net.getGateCount(), net.getInputCount(), net.getOutputCount(), swapped);
		return true;
	}

	private int swapInvertedInputs(Gate gate){
		int swapped = 0;
		for(int j = 0; j < gate.getFanIn(); ++j){
			if(gate.isInputInverting(j)){
				Gate complement = complementOf(gate.getDriver(j));
				gate.setInputNonInverting(j);
				gate.swapDriver(j, complement);
				log.debug("{} input {} moved to {}", gate, j, complement);
				swapped++;
			}
		}
		return swapped;
	}

	private static Gate complementOf(Gate gate){
		Gate complement = gate.getComplement();
		if(complement == null) throw new NetException("Gate " + gate + " has no complement");
		return complement;
	}
}
