package com.deering.humblenet.pass;

import org.apache.logging.log4j.Logger;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Edge;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.GatePlacement;
import com.google.common.base.Preconditions;

/**
 * Base class of every transformation or analysis run on a {@link BooleanNet}.
 * A pass mutates the net in place; references to gates taken before the pass
 * ran may point to removed gates afterwards.
 *
 * @author tdeering
 *
 */
public abstract class NetPass {
	protected final BooleanNet net;
	protected final Logger log;

	protected NetPass(BooleanNet net, Logger log){
		this.net = Preconditions.checkNotNull(net);
		this.log = Preconditions.checkNotNull(log);
	}

	/**
	 * Runs the pass over the whole net.
	 *
	 * @return whether the net was changed
	 */
	public abstract boolean run();

	/**
	 * Number of fan-out edges of the gate whose follower input is inverting.
	 *
	 * @param gate
	 * @return
	 */
	protected static int countInvertedFanOut(Gate gate){
		int count = 0;
		for(Edge edge : gate.getFanOutEdges()){
			if(edge.isInverting()) count++;
		}
		return count;
	}

	/**
	 * Number of inverting fan-out edges that end in a primary output.
	 *
	 * @param gate
	 * @return
	 */
	protected static int countInvertedFanOutToOutputs(Gate gate){
		int count = 0;
		for(Edge edge : gate.getFanOutEdges()){
			if(edge.isInverting() && edge.getFollower().getPlacement() == GatePlacement.OUTPUT) count++;
		}
		return count;
	}

	/**
	 * Makes every fan-out edge of the gate non-inverting.
	 *
	 * @param gate
	 */
	protected static void clearInvertedFanOut(Gate gate){
		for(Edge edge : gate.getFanOutEdges()){
			if(edge.isInverting()) edge.getFollower().setInputNonInverting(edge.getIndex());
		}
	}

	/**
	 * Rewires every inverting fan-out edge of the gate to the target, which must
	 * compute the complement of the gate, and makes the moved edges non-inverting.
	 *
	 * @param gate
	 * @param target
	 * @return number of moved edges
	 */
	protected static int moveInvertedFanOut(Gate gate, Gate target){
		int moved = 0;
		for(Edge edge : gate.getFanOutEdges()){
			if(edge.isInverting()){
				Gate follow = edge.getFollower();
				follow.swapDriver(edge.getIndex(), target);
				follow.setInputNonInverting(edge.getIndex());
				moved++;
			}
		}
		return moved;
	}

	protected static void toggleOutputInversion(Gate gate){
		if(gate.isOutputInverting()){
			gate.setOutputNonInverting();
		} else {
			gate.setOutputInverting();
		}
	}

	protected static void toggleInputInversion(Gate gate, int i){
		if(gate.isInputInverting(i)){
			gate.setInputNonInverting(i);
		} else {
			gate.setInputInverting(i);
		}
	}
}
