package com.deering.humblenet.graph;

import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.GatePlacement;
import com.deering.humblenet.NetException;
import com.deering.humblenet.UnsupportedFanInException;

/**
 * Maps gates onto two-input library cells. Input inversions are not part of the
 * cell; only the output inversion selects the negated variant.
 *
 * @author tdeering
 *
 */
public class CellMapper {

	private CellMapper(){}

	/**
	 * Cell name for the gate, e.g. NAND2 for an AND gate with an inverting output.
	 * Primary inputs and outputs map to null.
	 *
	 * @param gate
	 * @return
	 * @throws UnsupportedFanInException if the gate has more than two inputs
	 */
	public static String cellName(Gate gate){
		if(gate.getPlacement() != GatePlacement.INNER) return null;
		if(gate.getFanIn() > 2) throw new UnsupportedFanInException(gate.getName(), gate.getFanIn());

		boolean inv = gate.isOutputInverting();
		switch(gate.getFunction()){
		case BUFFER:
			return inv ? "INV" : "BUF";
		case AND:
			return inv ? "NAND2" : "AND2";
		case OR:
			return inv ? "NOR2" : "OR2";
		case XOR:
			return inv ? "XNOR2" : "XOR2";
		default:
			throw new NetException("Unknown gate function: " + gate.getFunction());
		}
	}
}
