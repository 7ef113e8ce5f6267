package com.deering.humblenet.test;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.Colors;
import com.deering.humblenet.GateFunction;
import com.deering.humblenet.GateNotFoundException;
import com.deering.humblenet.GatePlacement;
import com.deering.humblenet.aig.AigBuilder;

public class TestBooleanNet {

	@Test
	public void testConstruction(){
		BooleanNet net = new BooleanNet(3, 2, 4);
		Assertions.assertEquals(3, net.getInputCount());
		Assertions.assertEquals(2, net.getOutputCount());
		Assertions.assertEquals(4, net.getGateCount());
		Assertions.assertEquals(0, net.getBufferCount());
		Assertions.assertEquals("INPUT_2", net.getInput(2).getName());
		Assertions.assertEquals("GATE_0", net.getGate(0).getName());
		Assertions.assertEquals("OUT_1", net.getOutput(1).getName());
		Assertions.assertEquals(GatePlacement.OUTPUT, net.getOutput(0).getPlacement());
		Assertions.assertEquals(GateFunction.BUFFER, net.getGate(3).getFunction());
		Assertions.assertEquals(9, net.getAllGates().size());
	}

	@Test
	public void testGateNotFound(){
		BooleanNet net = new BooleanNet(1, 1, 1);
		Assertions.assertThrows(GateNotFoundException.class, new Executable(){
			@Override
			public void execute() throws Throwable {
				net.getGate(1);
			}
		});
		Assertions.assertThrows(GateNotFoundException.class, new Executable(){
			@Override
			public void execute() throws Throwable {
				net.getInput(-1);
			}
		});
		Assertions.assertThrows(GateNotFoundException.class, new Executable(){
			@Override
			public void execute() throws Throwable {
				net.getOutput(7);
			}
		});
		Assertions.assertThrows(GateNotFoundException.class, new Executable(){
			@Override
			public void execute() throws Throwable {
				net.getBuffer(0);
			}
		});
		Assertions.assertThrows(GateNotFoundException.class, new Executable(){
			@Override
			public void execute() throws Throwable {
				net.gateById(42);
			}
		});
	}

	@Test
	public void testSimulateAnd(){
		BooleanNet net = Circuits.and2();
		net.simInVect(0b11);
		Assertions.assertTrue(net.getOutput(0).getOutputValue());
		Assertions.assertEquals("0b1", net.getSimOutput());
		net.simInVect(0b01);
		Assertions.assertFalse(net.getOutput(0).getOutputValue());
		Assertions.assertEquals("0b0", net.getSimOutput());
	}

	@Test
	public void testSimulateAllFunctions(){
		// o0 = a AND b, o1 = a OR b, o2 = a XOR NOT b, o3 = NOT a
		BooleanNet net = new BooleanNet(2, 4, 3);
		Gate a = net.getInput(0);
		Gate b = net.getInput(1);
		GateFunction[] fns = {GateFunction.AND, GateFunction.OR, GateFunction.XOR};
		for(int i = 0; i < 3; ++i){
			Gate g = net.getGate(i);
			g.setFunction(fns[i]);
			g.newInput(a, false);
			g.newInput(b, i == 2);
			net.getOutput(i).newInput(g, false);
		}
		net.getOutput(3).newInput(a, true);

		for(int v = 0; v < 4; ++v){
			boolean va = (v & 1) != 0;
			boolean vb = (v & 2) != 0;
			net.simInVect(v);
			Assertions.assertEquals(va && vb, net.getOutput(0).getOutputValue());
			Assertions.assertEquals(va || vb, net.getOutput(1).getOutputValue());
			Assertions.assertEquals(va ^ !vb, net.getOutput(2).getOutputValue());
			Assertions.assertEquals(!va, net.getOutput(3).getOutputValue());
		}
	}

	@Test
	public void testSimulateInvertedInput(){
		BooleanNet net = Circuits.and2();
		net.getInput(0).setOutputInverting();
		net.simInVect(0b10);
		Assertions.assertTrue(net.getOutput(0).getOutputValue());
	}

	@Test
	public void testRemOutput(){
		BooleanNet net = AigBuilder.build(2, new int[]{6, 2}, new int[][]{{6, 2, 4}});
		Gate removed = net.getOutput(0);
		net.remOutput(0);
		Assertions.assertEquals(1, net.getOutputCount());
		Assertions.assertEquals("OUT_1", net.getOutput(0).getName());
		Assertions.assertEquals(0, net.getGate(0).getFanOut());
		Assertions.assertTrue(removed.isRemoved());
		Assertions.assertThrows(GateNotFoundException.class, new Executable(){
			@Override
			public void execute() throws Throwable {
				net.gateById(removed.getId());
			}
		});
	}

	@Test
	public void testMergeEqGates(){
		// Two identical ANDs, each feeding one output
		BooleanNet net = AigBuilder.build(2, new int[]{6, 9}, new int[][]{{6, 2, 4}, {8, 2, 4}});
		Gate g0 = net.getGate(0);
		Gate g1 = net.getGate(1);
		boolean[][] before = Circuits.truthTable(net, 2, 2);

		net.mergeEqGates(g1, g0);
		Assertions.assertEquals(1, net.getGateCount());
		Assertions.assertSame(g0, net.getOutput(1).getDriver(0));
		Assertions.assertTrue(net.getOutput(1).isInputInverting(0));
		Assertions.assertEquals(2, g0.getFanOut());
		Assertions.assertEquals(1, net.getInput(0).getFanOut());
		Circuits.assertSymmetric(net);
		Circuits.assertSameTable(before, Circuits.truthTable(net, 2, 2));
	}

	@Test
	public void testAvgFanOutAndDepth(){
		// g0 = a & b, g1 = g0 & a, outputs g0, g1
		BooleanNet net = AigBuilder.build(2, new int[]{6, 8}, new int[][]{{6, 2, 4}, {8, 6, 2}});
		Assertions.assertEquals(1.5f, net.computeAvgFanOut(), 1e-6);
		Assertions.assertEquals(1.5f, net.getAvgFanOut(), 1e-6);
		net.computeNetDepth();
		Assertions.assertEquals(3, net.getNetDepth());

		Assertions.assertEquals(0f, new BooleanNet(1, 1, 0).computeAvgFanOut());
	}

	@Test
	public void testInOutTrees(){
		BooleanNet net = AigBuilder.build(2, new int[]{8}, new int[][]{{6, 2, 4}, {8, 6, 2}});
		net.computeInOutTrees();
		Gate g0 = net.getGate(0);
		Gate g1 = net.getGate(1);
		Assertions.assertEquals(2, g0.getInTreeSize());
		// g0 and its cone twice plus input a
		Assertions.assertEquals(4, g1.getInTreeSize());
		Assertions.assertEquals(2, g0.getOutTreeSize());
		// a reaches g0 (out tree 2) and g1 (out tree 1)
		Assertions.assertEquals(5, net.getInput(0).getOutTreeSize());
		Assertions.assertEquals(0, net.getOutput(0).getOutTreeSize());
	}

	@Test
	public void testColorTrees(){
		// g0 = a & b, g1 = b & c, outputs g0, g1
		BooleanNet net = AigBuilder.build(3, new int[]{8, 10}, new int[][]{{8, 2, 4}, {10, 4, 6}});
		net.colorInTree(net.getOutput(0), Colors.IN_TREE);
		Assertions.assertTrue(net.getGate(0).hasColor(Colors.IN_TREE));
		Assertions.assertTrue(net.getInput(0).hasColor(Colors.IN_TREE));
		Assertions.assertTrue(net.getInput(1).hasColor(Colors.IN_TREE));
		Assertions.assertFalse(net.getInput(2).hasColor(Colors.IN_TREE));
		Assertions.assertFalse(net.getGate(1).hasColor(Colors.IN_TREE));

		net.colorOutTree(net.getInput(2), Colors.OUT_TREE);
		Assertions.assertTrue(net.getGate(1).hasColor(Colors.OUT_TREE));
		Assertions.assertTrue(net.getOutput(1).hasColor(Colors.OUT_TREE));
		Assertions.assertFalse(net.getOutput(0).hasColor(Colors.OUT_TREE));

		Assertions.assertTrue(net.getInput(1).hasColor(Colors.IN_TREE | Colors.OUT_TREE));
		Assertions.assertTrue(net.getInput(2).hasColor(Colors.EMPTY));
		Assertions.assertEquals(Colors.IN_TREE, net.getGate(0).getColor());
	}

	@Test
	public void testColorBaseGates(){
		BooleanNet net = Circuits.and2();
		net.moveInverters();
		net.convDualRail();
		net.colorBaseGates(Colors.DUAL_BASE);

		for(Gate gate : net.getGates()){
			Assertions.assertTrue(gate.hasColor(Colors.DUAL_BASE) != gate.getComplement().hasColor(Colors.DUAL_BASE), gate.toString());
		}
		for(Gate gate : net.getInputs()) Assertions.assertTrue(gate.hasColor(Colors.DUAL_BASE));
		for(Gate gate : net.getOutputs()) Assertions.assertTrue(gate.hasColor(Colors.DUAL_BASE));
	}

	@Test
	public void testPlace2Rect(){
		BooleanNet net = Circuits.randomAig(7, 4, 10, 3);
		Assertions.assertFalse(net.isPlaced());
		net.place2Rect();
		Assertions.assertTrue(net.isPlaced());

		int edge = (int) Math.sqrt(net.getGateCount());
		boolean[][] used = new boolean[edge][net.getGateCount()];
		for(Gate gate : net.getGates()){
			if(!gate.isPlaced()) continue;
			int x = gate.getPlaceXCoord();
			int y = gate.getPlaceYCoord();
			Assertions.assertTrue(x >= 0 && x < edge);
			Assertions.assertFalse(used[x][y], "two gates at " + x + "," + y);
			used[x][y] = true;
		}
		for(Gate in : net.getInputs()) Assertions.assertFalse(in.isPlaced());
	}

	@Test
	public void testSnapshotsAreImmutable(){
		BooleanNet net = Circuits.and2();
		List<Gate> gates = net.getGates();
		Assertions.assertThrows(UnsupportedOperationException.class, new Executable(){
			@Override
			public void execute() throws Throwable {
				gates.clear();
			}
		});
		net.newGate("EXTRA", GateFunction.BUFFER, GatePlacement.INNER);
		Assertions.assertEquals(1, gates.size());
		Assertions.assertEquals(2, net.getGateCount());
	}
}
