package com.deering.humblenet.pass;

import java.util.Comparator;
import java.util.PriorityQueue;

import org.apache.logging.log4j.Logger;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Edge;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.GateFunction;
import com.deering.humblenet.GatePlacement;
import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.math.LongMath;

/**
 * Places buffers behind the gates that are hardest to test. Gates are ranked by
 * the product cc0 * cc1 * co; each of the top ranked gates gets a buffer that
 * takes over all of its followers. Buffers are test points: the next SCOAP run
 * treats them as fully controllable and observable.
 *
 * NOTE: SCOAP values must be computed before, and the net depth recomputed after
 * this pass.
 *
 * @author tdeering
 *
 */
public class ScoapBufferInserter extends NetPass {
	private final int places;
	private int inserted;

	/**
	 * @param net
	 * @param log
	 * @param places maximum number of buffers to insert
	 */
	public ScoapBufferInserter(BooleanNet net, Logger log, int places){
		super(net, log);
		Preconditions.checkArgument(places >= 0, "Number of places must be non-negative: %s", places);
		this.places = places;
	}

	/**
	 * Number of buffers inserted by the last run.
	 * @return
	 */
	public int getInserted(){
		return inserted;
	}

	/**
	 * SCOAP product used for ranking, saturating at Long.MAX_VALUE.
	 *
	 * @param gate
	 * @return
	 */
	public static long scoapProduct(Gate gate){
		long product = LongMath.saturatedMultiply(gate.get0Controlability(), gate.get1Controlability());
		return LongMath.saturatedMultiply(product, gate.getObservability());
	}

	@Override
	public boolean run(){
		log.trace("insertBuffsByScoap({})", places);
		inserted = 0;

		PriorityQueue<Gate> maxHeap = new PriorityQueue<Gate>(11, new Comparator<Gate>(){
			@Override
			public int compare(Gate g1, Gate g2){
				return ComparisonChain.start()
						.compare(scoapProduct(g2), scoapProduct(g1))
						.compare(g1.getId(), g2.getId())
						.result();
			}
		});

		for(Gate gate : net.getGates()){
			// Prevent buffer chains
			if(gate.getFunction() == GateFunction.BUFFER){
				log.debug("Skipping buffer {}", gate);
				continue;
			}
			if(gate.getFanOut() == 0){
				log.debug("Skipping {} without followers", gate);
				continue;
			}
			if(gate.getFanOut() == 1 && gate.getFollow(0).getFunction() == GateFunction.BUFFER){
				log.debug("Skipping {} followed by a buffer", gate);
				continue;
			}
			maxHeap.add(gate);
		}

		while(inserted < places && !maxHeap.isEmpty()){
			Gate gate = maxHeap.poll();
			log.debug("Buffering {} (SCOAP product {})", gate, scoapProduct(gate));

			Gate buff = net.newGate(gate.getName() + "_SCOAPBUFF", GateFunction.BUFFER, GatePlacement.INNER);
			for(Edge edge : gate.getFanOutEdges()){
				edge.getFollower().swapDriver(edge.getIndex(), buff);
			}
			buff.newInput(gate, false);
			net.registerBuffer(buff);
			inserted++;
		}

		log.info("Inserted {} SCOAP buffers", inserted);
		return inserted > 0;
	}
}
