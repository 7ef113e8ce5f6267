package com.deering.humblenet.pass;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import org.apache.logging.log4j.Logger;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Gate;
import com.google.common.math.LongMath;

/**
 * SCOAP testability analysis. Primary inputs and synthesized buffers are fully
 * controllable (cc0 = cc1 = 1), primary outputs and buffers fully observable
 * (co = 0); every other value starts at {@link BooleanNet#INFINITY} and only
 * decreases while it propagates.
 *
 * Controllability flows forward from the inputs until no gate improves, then
 * observability flows backward from the outputs. Both use a FIFO worklist in
 * which a gate is queued at most once at a time.
 *
 * @author tdeering
 *
 */
public class ScoapAnalyzer extends NetPass {
	private long sumScoap;

	public ScoapAnalyzer(BooleanNet net, Logger log){
		super(net, log);
	}

	/**
	 * Sum of cc0 + cc1 + co over the inner gates, saturating at Long.MAX_VALUE.
	 * @return
	 */
	public long getSumScoap(){
		return sumScoap;
	}

	@Override
	public boolean run(){
		log.trace("computeSumScoap()");
		for(Gate gate : net.getAllGates()){
			gate.resetScoap();
		}
		for(Gate in : net.getInputs()){
			in.setControlability(1, 1);
		}
		for(Gate buff : net.getBuffers()){
			buff.setControlability(1, 1);
			buff.setObservability(0);
		}
		for(Gate out : net.getOutputs()){
			out.setObservability(0);
		}

		propagateControlability();
		propagateObservability();

		sumScoap = 0;
		for(Gate gate : net.getGates()){
			log.debug("{} SCOAP: CC0 = {}; CC1 = {}; CO = {}", gate,
					gate.get0Controlability(), gate.get1Controlability(), gate.getObservability());
			sumScoap = LongMath.saturatedAdd(sumScoap, gate.get0Controlability());
			sumScoap = LongMath.saturatedAdd(sumScoap, gate.get1Controlability());
			sumScoap = LongMath.saturatedAdd(sumScoap, gate.getObservability());
		}
		log.info("SCOAP sum: {}", sumScoap);
		return true;
	}

	private void propagateControlability(){
		WorkList work = new WorkList();
		for(Gate gate : net.getAllGates()){
			if(gate.getFanIn() > 0) work.offer(gate);
		}
		while(!work.isEmpty()){
			Gate gate = work.poll();
			if(gate.computeControlability()){
				log.trace("{} controllability ({}, {})", gate, gate.get0Controlability(), gate.get1Controlability());
				for(int i = 0; i < gate.getFanOut(); ++i){
					work.offer(gate.getFollow(i));
				}
			}
		}
	}

	private void propagateObservability(){
		WorkList work = new WorkList();
		for(Gate gate : net.getAllGates()){
			if(gate.getFanOut() > 0) work.offer(gate);
		}
		while(!work.isEmpty()){
			Gate gate = work.poll();
			if(gate.computeObservability()){
				log.trace("{} observability {}", gate, gate.getObservability());
				for(int i = 0; i < gate.getFanIn(); ++i){
					work.offer(gate.getDriver(i));
				}
			}
		}
	}

	/**
	 * FIFO queue that holds each gate at most once.
	 */
	private static class WorkList {
		private final Deque<Gate> queue = new ArrayDeque<Gate>();
		private final Set<Integer> queued = new HashSet<Integer>();

		void offer(Gate gate){
			if(queued.add(gate.getId())) queue.add(gate);
		}

		Gate poll(){
			Gate gate = queue.poll();
			queued.remove(gate.getId());
			return gate;
		}

		boolean isEmpty(){
			return queue.isEmpty();
		}
	}
}
