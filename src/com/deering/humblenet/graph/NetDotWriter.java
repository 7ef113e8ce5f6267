package com.deering.humblenet.graph;

import java.io.StringWriter;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

import org.jgrapht.Graph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Edge;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.Colors;
import com.deering.humblenet.GatePlacement;

/**
 * Writes a net in Graphviz DOT format. Inner gates are labeled with their name
 * and two-input cell, inputs are drawn as triangles and outputs as inverted
 * triangles, inverting edges end in a circle.
 *
 * @author tdeering
 *
 */
public class NetDotWriter {

	private NetDotWriter(){}

	/**
	 * Writes the whole net.
	 *
	 * @param net
	 * @param writer
	 */
	public static void write(BooleanNet net, Writer writer){
		write(net, writer, Colors.EMPTY);
	}

	/**
	 * Writes the gates carrying any of the given colors.
	 *
	 * @param net
	 * @param writer
	 * @param color
	 * @throws com.deering.humblenet.UnsupportedFanInException if a written gate has more than two inputs
	 */
	public static void write(BooleanNet net, Writer writer, int color){
		DOTExporter<Gate, Edge> exporter = new DOTExporter<Gate, Edge>(new Function<Gate, String>(){
			@Override
			public String apply(Gate gate) {
				return "g" + gate.getId();
			}
		});
		exporter.setGraphIdProvider(new Supplier<String>(){
			@Override
			public String get() {
				return "net";
			}
		});
		exporter.setVertexAttributeProvider(new Function<Gate, Map<String, Attribute>>(){
			@Override
			public Map<String, Attribute> apply(Gate gate) {
				Map<String, Attribute> attrs = new LinkedHashMap<String, Attribute>();
				String cell = CellMapper.cellName(gate);
				attrs.put("label", DefaultAttribute.createAttribute(cell == null ? gate.getName() : gate.getName() + "\\n" + cell));
				if(gate.getPlacement() == GatePlacement.INPUT){
					attrs.put("shape", DefaultAttribute.createAttribute("triangle"));
				} else if(gate.getPlacement() == GatePlacement.OUTPUT){
					attrs.put("shape", DefaultAttribute.createAttribute("invtriangle"));
				}
				return attrs;
			}
		});
		exporter.setEdgeAttributeProvider(new Function<Edge, Map<String, Attribute>>(){
			@Override
			public Map<String, Attribute> apply(Edge edge) {
				Map<String, Attribute> attrs = new LinkedHashMap<String, Attribute>();
				if(edge.isInverting()) attrs.put("arrowhead", DefaultAttribute.createAttribute("odot"));
				return attrs;
			}
		});

		Graph<Gate, Edge> graph = NetGraphs.toGraph(net, color);
		exporter.exportGraph(graph, writer);
	}

	/**
	 * Renders the whole net to a DOT string.
	 *
	 * @param net
	 * @return
	 */
	public static String toDot(BooleanNet net){
		StringWriter writer = new StringWriter();
		write(net, writer);
		return writer.toString();
	}
}
