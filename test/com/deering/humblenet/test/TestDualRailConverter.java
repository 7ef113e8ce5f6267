package com.deering.humblenet.test;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.GateFunction;
import com.deering.humblenet.NetException;
import com.deering.humblenet.aig.AigBuilder;

public class TestDualRailConverter {

	@Test
	public void testAndGate(){
		BooleanNet net = Circuits.and2();
		net.moveInverters();
		net.convDualRail();

		Assertions.assertEquals(2, net.getGateCount());
		Assertions.assertEquals(4, net.getInputCount());
		Assertions.assertEquals(2, net.getOutputCount());

		Gate g0 = net.getGate(0);
		Gate dual = net.getGate(1);
		Assertions.assertEquals("D_GATE_0", dual.getName());
		Assertions.assertEquals(GateFunction.OR, dual.getFunction());
		Assertions.assertSame(dual, g0.getComplement());
		Assertions.assertSame(net.getInput(2), dual.getDriver(0));
		Assertions.assertSame(net.getInput(3), dual.getDriver(1));
		Assertions.assertSame(dual, net.getOutput(1).getDriver(0));
		Assertions.assertSame(net.getOutput(0), net.getOutput(1).getComplement());
	}

	@Test
	public void testInvertedOutputTakesOtherRail(){
		// o = NOT(a AND b), left unreduced
		BooleanNet net = AigBuilder.build(2, new int[]{7}, new int[][]{{6, 2, 4}});
		boolean[][] table = Circuits.truthTable(net, 2, 1);
		net.convDualRail();

		Gate out = net.getOutput(0);
		Assertions.assertFalse(out.isOutputInverting());
		Assertions.assertFalse(out.isInputInverting(0));
		Assertions.assertSame(net.getGate(0).getComplement(), out.getDriver(0));
		Assertions.assertSame(net.getGate(0), net.getOutput(1).getDriver(0));
		Circuits.assertSameTable(table, Circuits.truthTable(net, 2, 1));
	}

	@ParameterizedTest
	@ValueSource(longs = {3, 9, 27, 81, 243, 729})
	public void testDualRail(long seed){
		BooleanNet net = Circuits.randomAig(seed, 4, 15, 3);
		int outputs = net.getOutputCount();
		boolean[][] table = Circuits.truthTable(net, 4, outputs);

		net.moveInverters();
		net.convDualRail();
		Circuits.assertSymmetric(net);
		Circuits.assertDepthMonotonic(net);

		// Duality
		for(Gate gate : net.getGates()){
			Gate complement = gate.getComplement();
			Assertions.assertNotNull(complement, gate.toString());
			Assertions.assertSame(gate, complement.getComplement());
			Assertions.assertEquals(gate.getFunction().dual(), complement.getFunction());
		}
		for(Gate gate : net.getInputs()) Assertions.assertNotNull(gate.getComplement());
		for(Gate gate : net.getOutputs()) Assertions.assertNotNull(gate.getComplement());

		// Monotonicity
		for(Gate gate : net.getGates()){
			Assertions.assertFalse(gate.isOutputInverting(), gate.toString());
			for(int i = 0; i < gate.getFanIn(); ++i) Assertions.assertFalse(gate.isInputInverting(i));
		}
		for(Gate out : net.getOutputs()){
			Assertions.assertFalse(out.isOutputInverting());
			Assertions.assertFalse(out.isInputInverting(0));
		}

		// Original outputs keep their function, complementary outputs negate it
		boolean[][] dual = Circuits.truthTable(net, 4, 2 * outputs);
		for(int v = 0; v < table.length; ++v){
			for(int o = 0; o < outputs; ++o){
				Assertions.assertEquals(table[v][o], dual[v][o]);
				Assertions.assertEquals(!table[v][o], dual[v][outputs + o]);
			}
		}
	}

	@Test
	public void testRejectsXor(){
		BooleanNet net = new BooleanNet(2, 1, 1);
		Gate g = net.getGate(0);
		g.setFunction(GateFunction.XOR);
		g.newInput(net.getInput(0), false);
		g.newInput(net.getInput(1), false);
		net.getOutput(0).newInput(g, false);
		Assertions.assertThrows(NetException.class, new Executable(){
			@Override
			public void execute() throws Throwable {
				net.convDualRail();
			}
		});
		Assertions.assertEquals(1, net.getGateCount());
	}
}
