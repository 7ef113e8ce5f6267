package com.deering.humblenet.pass;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.Logger;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Edge;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.GateFunction;
import com.deering.humblenet.GatePlacement;
import com.deering.humblenet.NetException;

/**
 * Prepares a dual-rail net for the alternating spacer protocol. All gates are
 * switched to inverting outputs, so the spacer polarity must flip on every
 * level. An edge that connects two gates of the same depth parity breaks that
 * alternation and gets a pair of balancing inverters, one per rail, wired
 * across the rails.
 *
 * NOTE: Run {@link DualRailConverter} first.
 *
 * @author tdeering
 *
 */
public class AltSpacerBalancer extends NetPass {
	private int balanced;

	public AltSpacerBalancer(BooleanNet net, Logger log){
		super(net, log);
	}

	/**
	 * Number of gate pairs that received balancing inverters in the last run.
	 * @return
	 */
	public int getBalancedPairs(){
		return balanced;
	}

	@Override
	public boolean run(){
		log.trace("enableAltSpacer()");
		List<Gate> gates = net.getGates();
		balanced = 0;

		for(Gate gate : gates){
			gate.setOutputInverting();
		}

		Set<Integer> done = new HashSet<Integer>();
		for(Gate gate : gates){
			if(done.contains(gate.getId())) continue;
			Gate complement = gate.getComplement();
			if(complement == null) throw new NetException("Gate " + gate + " has no complement, convert to dual rail first");
			done.add(gate.getId());
			done.add(complement.getId());

			List<Edge> unbalanced = new ArrayList<Edge>();
			for(Edge edge : gate.getFanOutEdges()){
				if(edge.getFollower().getDepth() % 2 == gate.getDepth() % 2) unbalanced.add(edge);
			}
			if(unbalanced.isEmpty()) continue;

			log.debug("{} has {} unbalanced followers", gate, unbalanced.size());
			Gate inv0 = net.newGate(gate.getName() + "_BALANCE0", GateFunction.BUFFER, GatePlacement.INNER);
			Gate inv1 = net.newGate(gate.getName() + "_BALANCE1", GateFunction.BUFFER, GatePlacement.INNER);
			inv0.setOutputInverting();
			inv1.setOutputInverting();
			inv0.setComplement(inv1);
			inv0.newInput(gate, false);
			inv1.newInput(complement, false);

			for(Edge edge : unbalanced){
				Gate follow = edge.getFollower();
				int k = edge.getIndex();
				Gate mirror = complementOf(follow);
				if(mirror.getFanIn() <= k || mirror.getDriver(k) != complement){
					throw new NetException("No mirror of edge " + edge + " on the complementary rail");
				}
				follow.swapDriver(k, inv1);
				mirror.swapDriver(k, inv0);
			}
			balanced++;
		}

		log.info("Alternating spacer: {} gate pairs balanced", balanced);
		return balanced > 0;
	}

	private static Gate complementOf(Gate gate){
		Gate complement = gate.getComplement();
		if(complement == null) throw new NetException("Gate " + gate + " has no complement");
		return complement;
	}
}
