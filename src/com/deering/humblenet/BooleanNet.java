package com.deering.humblenet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.deering.humblenet.graph.NetGraphs;
import com.deering.humblenet.pass.AltSpacerBalancer;
import com.deering.humblenet.pass.DualRailConverter;
import com.deering.humblenet.pass.InverterMover;
import com.deering.humblenet.pass.NandConverter;
import com.deering.humblenet.pass.ScoapAnalyzer;
import com.deering.humblenet.pass.ScoapBufferInserter;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;

/**
 * A combinational Boolean network of gates, as loaded from an And-Inverter
 * Graph and then rewritten by the transformation passes.
 *
 * The net is the sole owner of its gates. Every gate receives a stable
 * integer id when it is created and all links between gates (drivers,
 * followers, complement) are stored as ids, so removing a gate can never
 * leave a dangling reference: resolving a removed id raises
 * {@link GateNotFoundException}.
 *
 * USAGE EXAMPLE:
 *
 * // 2 inputs, 1 output, 1 inner gate
 * BooleanNet net = new BooleanNet(2, 1, 1);
 * Gate and = net.getGate(0);
 * and.setFunction(GateFunction.AND);
 * and.newInput(net.getInput(0), false);
 * and.newInput(net.getInput(1), true);
 * net.getOutput(0).newInput(and, true);
 *
 * net.moveInverters();
 * net.convDualRail();
 *
 * @author tdeering
 *
 */
public class BooleanNet {
	/**
	 * Id used for "no gate", e.g. a missing complement.
	 */
	public static final int NONE = -1;

	/**
	 * SCOAP value of a gate that has not been reached by propagation.
	 */
	public static final int INFINITY = Integer.MAX_VALUE;

	/**
	 * All gates ever created, indexed by id. Removed gates leave a null slot.
	 */
	private final List<Gate> arena;

	/**
	 * Ids of the inner gates, primary inputs, primary outputs and synthesized
	 * buffers. Buffers are inner gates as well.
	 */
	private final List<Integer> gates;
	private final List<Integer> inputs;
	private final List<Integer> outputs;
	private final List<Integer> buffers;

	private final Logger log;

	private int netDepth;
	private float netAvgFanOut;
	private long netSumScoap;
	private boolean netPlaced;

	/**
	 * Constructs a net with the given number of primary inputs, primary outputs and
	 * inner gates. Inputs and outputs are buffers; inner gates are buffers until the
	 * loader assigns their function.
	 *
	 * @param in
	 * @param out
	 * @param gates
	 */
	public BooleanNet(int in, int out, int gates){
		this(in, out, gates, LogManager.getLogger(BooleanNet.class));
	}

	/**
	 * Constructs a net that reports to the given logger. The logger is handed to
	 * every pass run on this net.
	 *
	 * @param in
	 * @param out
	 * @param gates
	 * @param logger
	 */
	public BooleanNet(int in, int out, int gates, Logger logger){
		Preconditions.checkArgument(in >= 0 && out >= 0 && gates >= 0, "Gate counts must be non-negative");
		this.log = Preconditions.checkNotNull(logger);
		this.arena = new ArrayList<Gate>(in + out + gates);
		this.gates = new ArrayList<Integer>(gates);
		this.inputs = new ArrayList<Integer>(in);
		this.outputs = new ArrayList<Integer>(out);
		this.buffers = new ArrayList<Integer>();

		for(int i = 0; i < in; ++i){
			newGate("INPUT_" + i, GateFunction.BUFFER, GatePlacement.INPUT);
		}
		for(int i = 0; i < gates; ++i){
			newGate("GATE_" + i, GateFunction.BUFFER, GatePlacement.INNER);
		}
		for(int i = 0; i < out; ++i){
			newGate("OUT_" + i, GateFunction.BUFFER, GatePlacement.OUTPUT);
		}
	}

	/**
	 * Returns the logger this net and its passes report to.
	 * @return
	 */
	public Logger getLogger(){
		return log;
	}

	/**
	 * Creates a new gate and files it under the collection matching its placement.
	 *
	 * @param name
	 * @param fn
	 * @param placement
	 * @return
	 */
	public Gate newGate(String name, GateFunction fn, GatePlacement placement){
		Gate gate = new Gate(arena.size(), name);
		gate.function = Preconditions.checkNotNull(fn);
		gate.placement = Preconditions.checkNotNull(placement);
		arena.add(gate);
		switch(placement){
		case INPUT:
			inputs.add(gate.id);
			break;
		case INNER:
			gates.add(gate.id);
			break;
		case OUTPUT:
			outputs.add(gate.id);
			break;
		default:
			throw new NetException("Unknown placement: " + placement);
		}
		log.trace("Creating gate {}", name);
		return gate;
	}

	/**
	 * Marks an inner gate as a synthesized buffer. Buffers act as test points for
	 * SCOAP: they are fully controllable and observable.
	 *
	 * @param gate
	 */
	public void registerBuffer(Gate gate){
		Preconditions.checkArgument(gate.getNet() == this, "Gate belongs to another net");
		if(gate.placement != GatePlacement.INNER) throw new NetException("Only inner gates can be buffers: " + gate);
		if(!buffers.contains(gate.id)) buffers.add(gate.id);
	}

	/**
	 * Resolves a gate by its id.
	 *
	 * @param id
	 * @return
	 */
	public Gate gateById(int id){
		if(id < 0 || id >= arena.size() || arena.get(id) == null) throw new GateNotFoundException("gate id", id);
		return arena.get(id);
	}

	/**
	 * Return the inner gate with the given index.
	 *
	 * @param gateNr
	 * @return
	 */
	public Gate getGate(int gateNr){
		return lookup(gates, gateNr, "gate");
	}

	/**
	 * Return the primary input with the given index.
	 *
	 * @param inpNr
	 * @return
	 */
	public Gate getInput(int inpNr){
		return lookup(inputs, inpNr, "input");
	}

	/**
	 * Return the primary output with the given index.
	 *
	 * @param outNr
	 * @return
	 */
	public Gate getOutput(int outNr){
		return lookup(outputs, outNr, "output");
	}

	/**
	 * Return the synthesized buffer with the given index.
	 *
	 * @param bufNr
	 * @return
	 */
	public Gate getBuffer(int bufNr){
		return lookup(buffers, bufNr, "buffer");
	}

	private Gate lookup(List<Integer> ids, int index, String what){
		if(index < 0 || index >= ids.size()) throw new GateNotFoundException(what, index);
		return gateById(ids.get(index));
	}

	public int getGateCount(){
		return gates.size();
	}

	public int getInputCount(){
		return inputs.size();
	}

	public int getOutputCount(){
		return outputs.size();
	}

	public int getBufferCount(){
		return buffers.size();
	}

	/**
	 * Snapshot of the inner gates. Later changes to the net are not reflected.
	 * @return
	 */
	public List<Gate> getGates(){
		return snapshot(gates);
	}

	public List<Gate> getInputs(){
		return snapshot(inputs);
	}

	public List<Gate> getOutputs(){
		return snapshot(outputs);
	}

	public List<Gate> getBuffers(){
		return snapshot(buffers);
	}

	/**
	 * Snapshot of every gate of the net: inputs, then inner gates, then outputs.
	 * @return
	 */
	public List<Gate> getAllGates(){
		ImmutableList.Builder<Gate> builder = ImmutableList.builder();
		builder.addAll(getInputs());
		builder.addAll(getGates());
		builder.addAll(getOutputs());
		return builder.build();
	}

	private List<Gate> snapshot(List<Integer> ids){
		ImmutableList.Builder<Gate> builder = ImmutableList.builder();
		for(int id : ids) builder.add(gateById(id));
		return builder.build();
	}

	/**
	 * Removes the primary output with the given index, detaching it from its driver.
	 *
	 * @param outNr
	 */
	public void remOutput(int outNr){
		Gate out = getOutput(outNr);
		while(out.getFanIn() > 0){
			out.remInput(out.getDriver(0));
		}
		remove(out);
	}

	/**
	 * Merges two equivalent gates. All followers of the removed gate are rewired to
	 * the survivor, with their inversion flags unchanged, and the removed gate is
	 * deleted from the net.
	 *
	 * NOTE: Equivalence must be checked by the caller.
	 *
	 * @param removed
	 * @param survivor
	 */
	public void mergeEqGates(Gate removed, Gate survivor){
		Preconditions.checkArgument(removed != survivor, "Cannot merge a gate into itself");
		log.debug("Merging {} into {}", removed, survivor);

		while(removed.getFanIn() > 0){
			removed.remInput(removed.getDriver(0));
		}
		for(Edge edge : removed.getFanOutEdges()){
			edge.getFollower().swapDriver(edge.getIndex(), survivor);
		}
		removed.setComplement(null);
		remove(removed);
	}

	private void remove(Gate gate){
		Integer id = gate.id;
		gates.remove(id);
		inputs.remove(id);
		outputs.remove(id);
		buffers.remove(id);
		arena.set(gate.id, null);
		gate.removed = true;
	}

	/**
	 * Get average gate fan-out of the inner gates, as last computed.
	 * @return
	 */
	public float getAvgFanOut(){
		return netAvgFanOut;
	}

	/**
	 * Compute the average fan-out of the inner gates. An empty net has average 0.
	 * @return
	 */
	public float computeAvgFanOut(){
		int sum = 0;
		for(Gate gate : getGates()){
			log.debug("Fan-out of {}: {}", gate, gate.getFanOut());
			sum += gate.getFanOut();
		}
		netAvgFanOut = gates.isEmpty() ? 0 : ((float) sum) / gates.size();
		return netAvgFanOut;
	}

	/**
	 * Compute the net depth: the maximum depth of any primary output.
	 */
	public void computeNetDepth(){
		log.trace("computeNetDepth()");
		netDepth = 0;
		for(Gate out : getOutputs()){
			netDepth = Math.max(netDepth, out.getDepth());
		}
	}

	public int getNetDepth(){
		return netDepth;
	}

	/**
	 * Returns the SCOAP sum computed by the last call to {@link #computeSumScoap()}.
	 * @return
	 */
	public long getSumScoap(){
		return netSumScoap;
	}

	/**
	 * Recomputes SCOAP controllability and observability for every gate and returns
	 * the sum of cc0 + cc1 + co over the inner gates.
	 *
	 * @return
	 */
	public long computeSumScoap(){
		ScoapAnalyzer analyzer = new ScoapAnalyzer(this, log);
		analyzer.run();
		netSumScoap = analyzer.getSumScoap();
		return netSumScoap;
	}

	/**
	 * Computes, for every gate, the size of its input cone and output cone. Cones are
	 * counted with path multiplicity: a gate reachable over two paths counts twice.
	 */
	public void computeInOutTrees(){
		log.trace("computeInOutTrees()");
		List<Gate> order = NetGraphs.topologicalOrder(this);
		for(Gate gate : order){
			long size = 0;
			for(int i = 0; i < gate.getFanIn(); ++i){
				size = LongMath.saturatedAdd(size, LongMath.saturatedAdd(gate.getDriver(i).inTreeSize, 1));
			}
			gate.inTreeSize = size;
		}
		for(int i = order.size() - 1; i >= 0; --i){
			Gate gate = order.get(i);
			long size = 0;
			for(int j = 0; j < gate.getFanOut(); ++j){
				size = LongMath.saturatedAdd(size, LongMath.saturatedAdd(gate.getFollow(j).outTreeSize, 1));
			}
			gate.outTreeSize = size;
		}
	}

	/**
	 * Color the segment of the net from the given gate back to the primary inputs.
	 *
	 * @param gate
	 * @param color
	 */
	public void colorInTree(Gate gate, int color){
		log.trace("colorInTree({})", gate);
		Deque<Gate> stack = new ArrayDeque<Gate>();
		Set<Integer> visited = new HashSet<Integer>();
		stack.push(gate);
		while(!stack.isEmpty()){
			Gate tmp = stack.pop();
			if(!visited.add(tmp.id)) continue;
			tmp.addColor(color);
			for(int i = 0; i < tmp.getFanIn(); ++i){
				stack.push(tmp.getDriver(i));
			}
		}
	}

	/**
	 * Color the segment of the net from the given gate forward to the primary outputs.
	 *
	 * @param gate
	 * @param color
	 */
	public void colorOutTree(Gate gate, int color){
		log.trace("colorOutTree({})", gate);
		Deque<Gate> stack = new ArrayDeque<Gate>();
		Set<Integer> visited = new HashSet<Integer>();
		stack.push(gate);
		while(!stack.isEmpty()){
			Gate tmp = stack.pop();
			if(!visited.add(tmp.id)) continue;
			tmp.addColor(color);
			for(int i = 0; i < tmp.getFanOut(); ++i){
				stack.push(tmp.getFollow(i));
			}
		}
	}

	/**
	 * Color the base of a dual-rail circuit: exactly one inner gate of each
	 * complementary pair, every gate without a complement, and all primary inputs
	 * and outputs.
	 *
	 * @param color
	 */
	public void colorBaseGates(int color){
		log.trace("colorBaseGates()");
		for(Gate gate : getGates()){
			Gate complement = gate.getComplement();
			if(complement == null || !complement.hasColor(color)){
				gate.addColor(color);
			}
		}
		for(Gate in : getInputs()) in.addColor(color);
		for(Gate out : getOutputs()) out.addColor(color);
	}

	/**
	 * Moves inverters out of the net interior to the primary inputs and outputs.
	 * This always succeeds on a well-formed net.
	 *
	 * @return whether the net changed
	 * @throws NetException only if the net is malformed and relocation cannot converge
	 */
	public boolean moveInverters(){
		return new InverterMover(this, log).run();
	}

	/**
	 * Converts the net to its dual-rail version. Call {@link #moveInverters()} first.
	 */
	public void convDualRail(){
		new DualRailConverter(this, log).run();
	}

	/**
	 * Moves inverters shared by all followers of a gate into the gate output.
	 *
	 * @return whether the net changed
	 */
	public boolean convNAND(){
		return new NandConverter(this, log).run();
	}

	/**
	 * Enables the alternating spacer on a dual-rail net. Call {@link #convDualRail()} first.
	 *
	 * @return whether balancing buffers were inserted
	 */
	public boolean enableAltSpacer(){
		return new AltSpacerBalancer(this, log).run();
	}

	/**
	 * Inserts up to the given number of buffers behind the gates with the worst SCOAP
	 * product. SCOAP values should be computed first; net depth must be recomputed
	 * afterwards.
	 *
	 * @param places
	 * @return the number of buffers inserted
	 */
	public int insertBuffsByScoap(int places){
		ScoapBufferInserter inserter = new ScoapBufferInserter(this, log, places);
		inserter.run();
		return inserter.getInserted();
	}

	/**
	 * Simulates the given input vector. Bit i drives primary input i, for i < 32;
	 * primary inputs past bit 31 are driven low. Inputs that have a driver of their
	 * own (synthesized complement inputs) are evaluated like any other gate.
	 *
	 * Values are propagated breadth-first from the inputs; each gate is evaluated
	 * once, after all of its drivers.
	 *
	 * @param inVect
	 */
	public void simInVect(int inVect){
		log.trace("simInVect({})", Integer.toHexString(inVect));
		Map<Integer, Integer> pending = new HashMap<Integer, Integer>();
		Deque<Gate> queue = new ArrayDeque<Gate>();

		for(int i = 0; i < inputs.size(); ++i){
			Gate in = getInput(i);
			if(in.getFanIn() == 0){
				boolean bit = i < 32 && (inVect & (1 << i)) != 0;
				in.setOutputValue(bit ^ in.isOutputInverting());
				queue.add(in);
			}
		}
		for(int id : gates){
			Gate gate = gateById(id);
			if(gate.getFanIn() == 0) queue.add(gate);
		}

		while(!queue.isEmpty()){
			Gate tmp = queue.poll();
			if(tmp.getFanIn() > 0 || tmp.placement != GatePlacement.INPUT){
				tmp.computeOutputValue();
			}
			for(int follow : tmp.followers){
				Integer left = pending.get(follow);
				if(left == null) left = gateById(follow).getFanIn();
				pending.put(follow, --left);
				if(left == 0) queue.add(gateById(follow));
			}
		}
	}

	/**
	 * Returns the simulated primary outputs as a binary literal, output 0 first.
	 *
	 * NOTE: Run {@link #simInVect(int)} first.
	 * @return
	 */
	public String getSimOutput(){
		StringBuilder sb = new StringBuilder("0b");
		for(Gate out : getOutputs()){
			sb.append(out.getOutputValue() ? '1' : '0');
		}
		log.info("Output: {}", sb);
		return sb.toString();
	}

	public boolean isPlaced(){
		return netPlaced;
	}

	/**
	 * Places the net to a square: inner gates are laid out row by row, breadth-first
	 * by depth, starting from the gates directly behind the primary inputs. Inputs
	 * and outputs are not placed.
	 */
	public void place2Rect(){
		log.trace("place2Rect()");
		int edge = Math.max(1, (int) Math.sqrt(gates.size()));
		Deque<Gate> queue = new ArrayDeque<Gate>();
		int currX = 0;
		int currY = 0;

		for(Gate in : getInputs()){
			for(int i = 0; i < in.getFanOut(); ++i){
				Gate follow = in.getFollow(i);
				if(follow.placement == GatePlacement.INNER && follow.getDepth() == 1) queue.add(follow);
			}
		}

		while(!queue.isEmpty()){
			Gate tmp = queue.poll();
			if(tmp.isPlaced()) continue;

			tmp.placeGate(currX, currY);
			currX = (currX + 1) % edge;
			if(currX == 0) currY++;

			for(int i = 0; i < tmp.getFanOut(); ++i){
				Gate follow = tmp.getFollow(i);
				if(follow.placement == GatePlacement.INNER && tmp.getDepth() + 1 == follow.getDepth()) queue.add(follow);
			}
		}
		netPlaced = true;
	}

	/**
	 * Node of the Boolean net. Gates are created by the net and live in its arena;
	 * all references to other gates are ids resolved through the net.
	 *
	 * Fan-in is an ordered list of (driver, inverting?) pairs. Fan-out holds one
	 * follower entry per edge, so a follower that consumes this gate on two inputs
	 * is listed twice.
	 *
	 * @author tdeering
	 *
	 */
	public final class Gate {
		private final int id;
		private String name;
		private GateFunction function;
		private GatePlacement placement;

		private final List<Integer> drivers = new ArrayList<Integer>();
		private final List<Boolean> inverters = new ArrayList<Boolean>();
		private final List<Integer> followers = new ArrayList<Integer>();
		private boolean outputInverter;
		private int complement = NONE;

		private int depth;
		private int cc0 = INFINITY;
		private int cc1 = INFINITY;
		private int co = INFINITY;
		private long inTreeSize;
		private long outTreeSize;

		private boolean outputValue;
		private int color = Colors.EMPTY;

		private boolean placed;
		private int placeX;
		private int placeY;

		private boolean removed;

		private Gate(int id, String name){
			this.id = id;
			this.name = name;
		}

		public int getId(){
			return id;
		}

		public BooleanNet getNet(){
			return BooleanNet.this;
		}

		/**
		 * Whether the gate was deleted from the net.
		 * @return
		 */
		public boolean isRemoved(){
			return removed;
		}

		public String getName(){
			return name;
		}

		public void setName(String name){
			this.name = Preconditions.checkNotNull(name);
		}

		public GateFunction getFunction(){
			return function;
		}

		public void setFunction(GateFunction fn){
			this.function = Preconditions.checkNotNull(fn);
		}

		public String getFunctionName(){
			return function.getName();
		}

		public GatePlacement getPlacement(){
			return placement;
		}

		public void setPlacement(GatePlacement pl){
			this.placement = Preconditions.checkNotNull(pl);
		}

		/**
		 * Raises the gate depth to d and propagates d + 1 to the followers. The depth
		 * never decreases.
		 *
		 * @param d
		 * @return whether the depth of this gate changed
		 */
		public boolean setDepth(int d){
			if(depth >= d) return false;
			depth = d;

			Deque<Gate> work = new ArrayDeque<Gate>();
			work.push(this);
			while(!work.isEmpty()){
				Gate gate = work.pop();
				for(int f : gate.followers){
					Gate follow = gateById(f);
					if(follow.depth < gate.depth + 1){
						follow.depth = gate.depth + 1;
						work.push(follow);
					}
				}
			}
			return true;
		}

		public void resetDepth(){
			depth = 0;
		}

		/**
		 * Longest path from a primary input, as propagated so far.
		 * @return
		 */
		public int getDepth(){
			return depth;
		}

		public int getFanIn(){
			return drivers.size();
		}

		public int getFanOut(){
			return followers.size();
		}

		/**
		 * Adds a new driver at the end of the fan-in, registers this gate as its
		 * follower and raises the depth of this gate accordingly.
		 *
		 * @param driver
		 * @param isInverting
		 */
		public void newInput(Gate driver, boolean isInverting){
			checkSameNet(driver);
			drivers.add(driver.id);
			inverters.add(isInverting);
			driver.followers.add(id);
			setDepth(driver.depth + 1);
		}

		/**
		 * Removes every fan-in edge coming from the given driver, on both sides.
		 *
		 * @param driver
		 */
		public void remInput(Gate driver){
			checkSameNet(driver);
			for(int i = drivers.size() - 1; i >= 0; --i){
				if(drivers.get(i) == driver.id){
					drivers.remove(i);
					inverters.remove(i);
					driver.followers.remove(Integer.valueOf(id));
				}
			}
		}

		/**
		 * Adds the given gate as a follower. Same as follow.newInput(this, isInverting).
		 *
		 * @param follow
		 * @param isInverting
		 */
		public void newFollow(Gate follow, boolean isInverting){
			follow.newInput(this, isInverting);
		}

		public void newFollow(Gate follow){
			newFollow(follow, false);
		}

		/**
		 * Removes every edge from this gate to the given follower, on both sides.
		 *
		 * @param follow
		 */
		public void remFollow(Gate follow){
			follow.remInput(this);
		}

		/**
		 * Returns the i-th follower entry.
		 *
		 * @param i
		 * @return
		 */
		public Gate getFollow(int i){
			if(i < 0 || i >= followers.size()) throw new GateNotFoundException("follower of " + name, i);
			return gateById(followers.get(i));
		}

		/**
		 * Returns the driver of the i-th input.
		 *
		 * @param i
		 * @return
		 */
		public Gate getDriver(int i){
			checkInput(i);
			return gateById(drivers.get(i));
		}

		/**
		 * Lists every fan-out edge of this gate: one entry per (follower, input index).
		 * @return
		 */
		public List<Edge> getFanOutEdges(){
			List<Edge> edges = new ArrayList<Edge>(followers.size());
			Set<Integer> seen = new LinkedHashSet<Integer>(followers);
			for(int f : seen){
				Gate follow = gateById(f);
				for(int k = 0; k < follow.drivers.size(); ++k){
					if(follow.drivers.get(k) == id) edges.add(new Edge(follow.id, k));
				}
			}
			return edges;
		}

		/**
		 * Replaces the first fan-in edge from oldDriver with newDriver. The input keeps
		 * its index and inversion flag.
		 *
		 * @param oldDriver
		 * @param newDriver
		 */
		public void swapDriver(Gate oldDriver, Gate newDriver){
			int idx = drivers.indexOf(oldDriver.id);
			if(idx < 0) throw new NetException(name + " is not driven by " + oldDriver.getName());
			swapDriver(idx, newDriver);
		}

		/**
		 * Replaces the driver of the i-th input with newDriver, moving the follower
		 * entry from the old driver to the new one. The inversion flag is kept.
		 *
		 * @param i
		 * @param newDriver
		 */
		public void swapDriver(int i, Gate newDriver){
			checkInput(i);
			checkSameNet(newDriver);
			Gate oldDriver = gateById(drivers.get(i));
			drivers.set(i, newDriver.id);
			oldDriver.followers.remove(Integer.valueOf(id));
			newDriver.followers.add(id);
			setDepth(newDriver.depth + 1);
		}

		public boolean isInputInverting(int i){
			checkInput(i);
			return inverters.get(i);
		}

		public void setInputInverting(int i){
			checkInput(i);
			inverters.set(i, true);
		}

		public void setInputNonInverting(int i){
			checkInput(i);
			inverters.set(i, false);
		}

		public boolean isOutputInverting(){
			return outputInverter;
		}

		public void setOutputInverting(){
			outputInverter = true;
		}

		public void setOutputNonInverting(){
			outputInverter = false;
		}

		/**
		 * Replaces the gate with its De Morgan equivalent: AND and OR swap, and the
		 * output and every input flip their inversion. The logic function is unchanged.
		 */
		public void changeToEqGate(){
			function = function.dual();
			outputInverter = !outputInverter;
			for(int j = 0; j < inverters.size(); ++j){
				inverters.set(j, !inverters.get(j));
			}
		}

		/**
		 * Returns the complementary gate, or null if there is none.
		 * @return
		 */
		public Gate getComplement(){
			return complement == NONE ? null : gateById(complement);
		}

		/**
		 * Links this gate and the given gate as complements of each other. Previous
		 * partners of either gate are unlinked. Passing null unlinks this gate.
		 *
		 * @param gate
		 */
		public void setComplement(Gate gate){
			unlinkComplement();
			if(gate == null) return;
			checkSameNet(gate);
			gate.unlinkComplement();
			complement = gate.id;
			gate.complement = id;
		}

		private void unlinkComplement(){
			if(complement == NONE) return;
			if(complement < arena.size() && arena.get(complement) != null && arena.get(complement).complement == id){
				arena.get(complement).complement = NONE;
			}
			complement = NONE;
		}

		public int get0Controlability(){
			return cc0;
		}

		public int get1Controlability(){
			return cc1;
		}

		public int getObservability(){
			return co;
		}

		public void setControlability(int cc0, int cc1){
			this.cc0 = cc0;
			this.cc1 = cc1;
		}

		public void setObservability(int co){
			this.co = co;
		}

		/**
		 * Sets all SCOAP values back to {@link BooleanNet#INFINITY}.
		 */
		public void resetScoap(){
			cc0 = INFINITY;
			cc1 = INFINITY;
			co = INFINITY;
		}

		/**
		 * Computes the controllability from the drivers and keeps each value only if it
		 * improves on the stored one.
		 *
		 * @return whether cc0 or cc1 decreased
		 */
		public boolean computeControlability(){
			if(drivers.isEmpty()) return false;

			long[] zero = new long[drivers.size()];
			long[] one = new long[drivers.size()];
			for(int i = 0; i < drivers.size(); ++i){
				Gate driver = gateById(drivers.get(i));
				zero[i] = inverters.get(i) ? driver.cc1 : driver.cc0;
				one[i] = inverters.get(i) ? driver.cc0 : driver.cc1;
			}
			long[] cc = function.controllability(zero, one);
			long new0 = plusOne(cc[0]);
			long new1 = plusOne(cc[1]);
			if(outputInverter){
				long tmp = new0;
				new0 = new1;
				new1 = tmp;
			}

			boolean change = false;
			if(new0 < cc0){
				cc0 = (int) new0;
				change = true;
			}
			if(new1 < cc1){
				cc1 = (int) new1;
				change = true;
			}
			return change;
		}

		/**
		 * Computes the observability through every follower and keeps the minimum if
		 * it improves on the stored one.
		 *
		 * @return whether co decreased
		 */
		public boolean computeObservability(){
			long best = INFINITY;
			for(Edge edge : getFanOutEdges()){
				Gate follow = edge.getFollower();
				int fanIn = follow.drivers.size();
				long[] zero = new long[fanIn];
				long[] one = new long[fanIn];
				boolean[] observed = new boolean[fanIn];
				for(int j = 0; j < fanIn; ++j){
					Gate side = gateById(follow.drivers.get(j));
					zero[j] = follow.inverters.get(j) ? side.cc1 : side.cc0;
					one[j] = follow.inverters.get(j) ? side.cc0 : side.cc1;
					observed[j] = side == this;
				}
				long cost = follow.co + follow.function.sideInputCost(zero, one, observed);
				best = Math.min(best, plusOne(cost));
			}

			if(best < co){
				co = (int) best;
				return true;
			}
			return false;
		}

		public long getInTreeSize(){
			return inTreeSize;
		}

		public long getOutTreeSize(){
			return outTreeSize;
		}

		/**
		 * Is the gate colored with any of the given colors? Color 0 matches every gate.
		 *
		 * @param color
		 * @return
		 */
		public boolean hasColor(int color){
			if(color == Colors.EMPTY) return true;
			return (this.color & color) != 0;
		}

		public void addColor(int color){
			this.color |= color;
		}

		public int getColor(){
			return color;
		}

		public void placeGate(int x, int y){
			placed = true;
			placeX = x;
			placeY = y;
		}

		public boolean isPlaced(){
			return placed;
		}

		/**
		 * Placed x coordinate, or -1 if the gate is not placed.
		 * @return
		 */
		public int getPlaceXCoord(){
			return placed ? placeX : -1;
		}

		public int getPlaceYCoord(){
			return placed ? placeY : -1;
		}

		public boolean getOutputValue(){
			return outputValue;
		}

		/**
		 * Forces the simulated output, e.g. to preset a primary input or inject a fault.
		 *
		 * @param newValue
		 */
		public void setOutputValue(boolean newValue){
			outputValue = newValue;
		}

		/**
		 * Computes the simulated output from the simulated outputs of the drivers.
		 */
		public void computeOutputValue(){
			boolean[] values = new boolean[drivers.size()];
			for(int i = 0; i < values.length; ++i){
				values[i] = gateById(drivers.get(i)).outputValue ^ inverters.get(i);
			}
			outputValue = function.evaluate(values) ^ outputInverter;
		}

		private void checkInput(int i){
			if(i < 0 || i >= drivers.size()) throw new GateNotFoundException("input of " + name, i);
		}

		private void checkSameNet(Gate other){
			Preconditions.checkNotNull(other);
			if(other.getNet() != BooleanNet.this) throw new NetException(other.getName() + " belongs to another net");
			if(other.removed) throw new GateNotFoundException("gate id", other.id);
		}

		@Override
		public String toString(){
			return name;
		}
	}

	/**
	 * Single fan-out edge: the input with the given index of the follower.
	 * Inversion is read from the follower, so the edge stays current while the flag
	 * changes; it becomes stale once the follower's input is rewired.
	 *
	 * @author tdeering
	 *
	 */
	public final class Edge {
		private final int follower;
		private final int index;

		private Edge(int follower, int index){
			this.follower = follower;
			this.index = index;
		}

		public Gate getDriver(){
			return getFollower().getDriver(index);
		}

		public Gate getFollower(){
			return gateById(follower);
		}

		public int getIndex(){
			return index;
		}

		public boolean isInverting(){
			return getFollower().isInputInverting(index);
		}

		@Override
		public int hashCode() {
			final int prime = 31;
			int result = 1;
			result = prime * result + getOuterType().hashCode();
			result = prime * result + follower;
			result = prime * result + index;
			return result;
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (obj == null)
				return false;
			if (getClass() != obj.getClass())
				return false;
			Edge other = (Edge) obj;
			if (!getOuterType().equals(other.getOuterType()))
				return false;
			return follower == other.follower && index == other.index;
		}

		@Override
		public String toString(){
			return getDriver() + (isInverting() ? " -o " : " -> ") + getFollower() + "[" + index + "]";
		}

		private BooleanNet getOuterType() {
			return BooleanNet.this;
		}
	}

	private static long plusOne(long value){
		return value >= INFINITY ? INFINITY : value + 1;
	}
}
