package com.deering.humblenet.pass;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.logging.log4j.Logger;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.GateFunction;
import com.deering.humblenet.GatePlacement;
import com.deering.humblenet.NetException;

/**
 * Moves inverters out of the net interior, leaving inversions only on primary
 * inputs and outputs. This separates the monotonic part of the circuit and is
 * required before dual-rail conversion.
 *
 * The pass alternates three rewrites until none applies:
 *
 * 1) trees of inverters that feed a primary output through fan-out 1 gates are
 *    folded into the output's own inversion,
 * 2) a gate whose followers all consume it inverted absorbs the inversion into
 *    its output,
 * 3) every gate with an inverting output is replaced by its De Morgan
 *    equivalent, which pushes the inversion to its inputs.
 *
 * A gate followed both inverted and non-inverted is a conflict. Conflicts are
 * resolved one per round by handing the inverted followers to a complementary
 * duplicate. Inverters left at the primary inputs end up in input buffers.
 *
 * @author tdeering
 *
 */
public class InverterMover extends NetPass {
	private int conflicts;
	private int inputDuplicates;

	public InverterMover(BooleanNet net, Logger log){
		super(net, log);
	}

	/**
	 * Runs the relocation. Every round either removes an inner inversion or
	 * resolves a conflict, so a well-formed net always converges. The round
	 * bound only guards against a malformed net, e.g. edges that disagree between
	 * the two ends, which would otherwise keep the pass spinning.
	 *
	 * @return whether the net changed
	 * @throws NetException if the round bound is exceeded
	 */
	@Override
	public boolean run(){
		log.trace("moveInverters()");
		boolean changed = false;
		int rounds = 0;
		int maxRounds = 4 * (net.getGateCount() + net.getInputCount() + net.getOutputCount()) + 16;

		boolean run = true;
		while(run){
			run = false;

			boolean run2 = true;
			while(run2){
				run2 = false;
				if(++rounds > maxRounds) throw new NetException("Inverter relocation did not converge after " + maxRounds + " rounds");

				if(shiftInvertersToOutputs()) run2 = true;
				if(shiftInverters(false)) run2 = true;
				if(changeToEqGates()) run2 = true;
				changed |= run2;
			}

			// One conflict per round keeps the rewrites local
			if(shiftInverters(true)){
				run = true;
				changed = true;
			}
		}

		changed |= shiftInvertersToInputBuffers();
		changed |= shiftInvertersInOutputBuffers();
		log.info("Inverters moved: {} conflicts resolved, {} inputs duplicated", conflicts, inputDuplicates);
		return changed;
	}

	/**
	 * Absorbs inverters into gate outputs, or resolves one conflict.
	 *
	 * @param solveConflict
	 * @return whether the net changed
	 */
	boolean shiftInverters(boolean solveConflict){
		log.trace("shiftInverters({})", solveConflict);
		boolean changed = false;

		for(Gate gate : net.getGates()){
			if(gate.isRemoved()) continue;
			int fanOut = gate.getFanOut();
			int inverted = countInvertedFanOut(gate);
			int invertedOutputs = countInvertedFanOutToOutputs(gate);

			if(fanOut > 0 && inverted == fanOut && inverted != invertedOutputs){
				log.debug("{} absorbs {} inverted followers", gate, inverted);
				toggleOutputInversion(gate);
				clearInvertedFanOut(gate);

				// The flipped gate now computes what its complement did
				Gate complement = gate.getComplement();
				if(complement != null){
					net.mergeEqGates(complement, gate);
				}
				changed = true;
			} else if(solveConflict && inverted > 0 && inverted < fanOut){
				Gate dup = gate.getComplement();
				if(dup == null){
					dup = net.newGate("D_" + gate.getName(), gate.getFunction(), GatePlacement.INNER);
					if(!gate.isOutputInverting()) dup.setOutputInverting();
					for(int i = 0; i < gate.getFanIn(); ++i){
						dup.newInput(gate.getDriver(i), gate.isInputInverting(i));
					}
					dup.setComplement(gate);
				}
				log.debug("Conflict on {}: {} of {} followers moved to {}", gate, inverted, fanOut, dup);
				moveInvertedFanOut(gate, dup);
				conflicts++;
				return true;
			}
		}
		return changed;
	}

	/**
	 * Replaces every inner gate with an inverting output by its De Morgan equivalent.
	 *
	 * @return whether any gate was replaced
	 */
	boolean changeToEqGates(){
		log.trace("changeToEqGates()");
		boolean changed = false;
		for(Gate gate : net.getGates()){
			if(gate.isRemoved()) continue;
			if(gate.isOutputInverting() && gate.getFunction().hasDual() && gate.getFanIn() > 0){
				gate.changeToEqGate();
				changed = true;
			}
		}
		return changed;
	}

	/**
	 * Folds trees of inverters into the primary outputs they feed.
	 *
	 * @return whether any tree was folded
	 */
	boolean shiftInvertersToOutputs(){
		log.trace("shiftInvertersToOutputs()");
		boolean changed = false;
		for(Gate out : net.getOutputs()){
			List<Gate> tree = detectTreeOfInverters(out);
			while(tree != null){
				log.debug("Folding tree of {} gates into {}", tree.size(), out);
				moveInvertersInTree(tree);
				changed = true;
				tree = detectTreeOfInverters(out);
			}
		}
		return changed;
	}

	/**
	 * Finds the tree of inverters under the given output: the fan-out 1 gates whose
	 * every input path ends in an inversion, either an inverting edge or a fan-out 1
	 * driver with an inverting output.
	 *
	 * @param out
	 * @return the tree gates, drivers before followers and the output last, or
	 *         null if there is no such tree
	 */
	List<Gate> detectTreeOfInverters(Gate out){
		if(out.getFanIn() == 0) return null;

		List<Gate> order = new ArrayList<Gate>();
		Deque<Gate> stack = new ArrayDeque<Gate>();
		stack.push(out);
		while(!stack.isEmpty()){
			Gate gate = stack.pop();
			order.add(gate);
			for(int i = 0; i < gate.getFanIn(); ++i){
				if(gate.isInputInverting(i)) continue;
				Gate driver = gate.getDriver(i);
				if(driver.getPlacement() != GatePlacement.INNER || driver.getFanOut() != 1) return null;
				if(driver.isOutputInverting()) continue;
				if(driver.getFanIn() == 0 || !driver.getFunction().hasDual()) return null;
				stack.push(driver);
			}
		}

		// Pre-order with the output first; reversed, every driver precedes its follower
		List<Gate> tree = new ArrayList<Gate>(order.size());
		for(int i = order.size() - 1; i >= 0; --i){
			tree.add(order.get(i));
		}
		return tree;
	}

	/**
	 * Moves all inversions of a detected tree to the output at its root.
	 *
	 * @param tree
	 */
	private void moveInvertersInTree(List<Gate> tree){
		for(Gate gate : tree){
			if(gate.isRemoved()) continue;
			for(int i = 0; i < gate.getFanIn(); ++i){
				if(gate.isInputInverting(i)) continue;
				Gate driver = gate.getDriver(i);
				if(driver.isOutputInverting()){
					driver.setOutputNonInverting();
					gate.setInputInverting(i);
					Gate complement = driver.getComplement();
					if(complement != null){
						net.mergeEqGates(complement, driver);
					}
				}
			}
			gate.changeToEqGate();
		}
	}

	/**
	 * Absorbs inverters on the edges leaving primary inputs. Inputs consumed in both
	 * polarities get an inverting input buffer that takes over the inverted edges.
	 *
	 * @return whether the net changed
	 */
	boolean shiftInvertersToInputBuffers(){
		log.trace("shiftInvertersToInputBuffers()");
		boolean changed = false;

		for(Gate in : net.getInputs()){
			int fanOut = in.getFanOut();
			int inverted = countInvertedFanOut(in);
			log.debug("Input {} has {} inverted followers of {}", in, inverted, fanOut);

			if(inverted > 0 && in.getFanIn() > 0 && in.getComplement() != null){
				// Synthesized input: its complement already carries the other polarity
				moveInvertedFanOut(in, in.getComplement());
				changed = true;
			} else if(fanOut > 0 && inverted == fanOut){
				toggleOutputInversion(in);
				clearInvertedFanOut(in);
				changed = true;
			} else if(inverted > 0){
				Gate dup = in.getComplement();
				if(dup == null){
					dup = net.newGate("D_" + in.getName(), GateFunction.BUFFER, GatePlacement.INPUT);
					dup.newInput(in, false);
					dup.setOutputInverting();
					dup.resetDepth();
					dup.setComplement(in);
					inputDuplicates++;
				}
				moveInvertedFanOut(in, dup);
				changed = true;
			}
		}
		return changed;
	}

	/**
	 * Turns the inverting input of every primary output into an inversion of the
	 * output itself.
	 *
	 * @return whether the net changed
	 */
	boolean shiftInvertersInOutputBuffers(){
		log.trace("shiftInvertersInOutputBuffers()");
		boolean changed = false;
		for(Gate out : net.getOutputs()){
			if(out.getFanIn() > 0 && out.isInputInverting(0)){
				out.setInputNonInverting(0);
				toggleOutputInversion(out);
				changed = true;
			}
		}
		return changed;
	}
}
