package com.deering.humblenet.graph;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.traverse.TopologicalOrderIterator;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Edge;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.Colors;
import com.deering.humblenet.NetException;

/**
 * Read-only JGraphT views of a {@link BooleanNet}. Vertices are the gates, edges
 * point from driver to follower, one per fan-in entry.
 *
 * @author tdeering
 *
 */
public class NetGraphs {

	private NetGraphs(){}

	/**
	 * Builds a graph of every gate of the net.
	 *
	 * @param net
	 * @return
	 */
	public static Graph<Gate, Edge> toGraph(BooleanNet net){
		return toGraph(net, Colors.EMPTY);
	}

	/**
	 * Builds a graph of the gates carrying any of the given colors. Color 0 selects
	 * every gate. Edges are kept when both of their ends are selected.
	 *
	 * @param net
	 * @param color
	 * @return
	 */
	public static Graph<Gate, Edge> toGraph(BooleanNet net, int color){
		Graph<Gate, Edge> graph = new DirectedPseudograph<Gate, Edge>(Edge.class);
		for(Gate gate : net.getAllGates()){
			if(gate.hasColor(color)) graph.addVertex(gate);
		}
		for(Gate gate : net.getAllGates()){
			if(!graph.containsVertex(gate)) continue;
			for(Edge edge : gate.getFanOutEdges()){
				if(graph.containsVertex(edge.getFollower())){
					graph.addEdge(gate, edge.getFollower(), edge);
				}
			}
		}
		return graph;
	}

	/**
	 * Whether the net is free of combinational loops.
	 *
	 * @param net
	 * @return
	 */
	public static boolean isAcyclic(BooleanNet net){
		return !new CycleDetector<Gate, Edge>(toGraph(net)).detectCycles();
	}

	/**
	 * Orders all gates so that every driver precedes its followers.
	 *
	 * @param net
	 * @return
	 */
	public static List<Gate> topologicalOrder(BooleanNet net){
		Graph<Gate, Edge> graph = toGraph(net);
		List<Gate> order = new ArrayList<Gate>(graph.vertexSet().size());
		try{
			Iterator<Gate> it = new TopologicalOrderIterator<Gate, Edge>(graph);
			while(it.hasNext()){
				order.add(it.next());
			}
		} catch(IllegalArgumentException e){
			throw new NetException("Net contains a combinational loop", e);
		}
		return order;
	}
}
