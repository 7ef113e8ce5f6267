package com.deering.humblenet.test;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.GateFunction;
import com.deering.humblenet.aig.AigBuilder;
import com.deering.humblenet.pass.ScoapBufferInserter;

public class TestScoapBufferInserter {

	/**
	 * g0 = a & b, g1 = c & d, g2 = g0 & g1; outputs g2, g0, g1
	 */
	private static BooleanNet tree(){
		return AigBuilder.build(4, new int[]{14, 10, 12}, new int[][]{{10, 2, 4}, {12, 6, 8}, {14, 10, 12}});
	}

	@Test
	public void testInsertOne(){
		BooleanNet net = tree();
		boolean[][] table = Circuits.truthTable(net, 4, 3);
		net.computeSumScoap();
		Gate g0 = net.getGate(0);
		Gate g1 = net.getGate(1);
		Assertions.assertEquals(ScoapBufferInserter.scoapProduct(g0), ScoapBufferInserter.scoapProduct(g1));

		// Equal rank, the lower id wins
		Assertions.assertEquals(1, net.insertBuffsByScoap(1));
		Assertions.assertEquals(1, net.getBufferCount());
		Gate buff = net.getBuffer(0);
		Assertions.assertEquals("GATE_0_SCOAPBUFF", buff.getName());
		Assertions.assertEquals(GateFunction.BUFFER, buff.getFunction());
		Assertions.assertSame(g0, buff.getDriver(0));
		Assertions.assertEquals(1, g0.getFanOut());
		Assertions.assertSame(buff, net.getGate(2).getDriver(0));
		Assertions.assertSame(buff, net.getOutput(1).getDriver(0));

		Circuits.assertSymmetric(net);
		Circuits.assertDepthMonotonic(net);
		Circuits.assertSameTable(table, Circuits.truthTable(net, 4, 3));
		net.computeNetDepth();
		Assertions.assertEquals(4, net.getNetDepth());
	}

	@Test
	public void testSkipsGatesFeedingBuffers(){
		BooleanNet net = tree();
		net.computeSumScoap();
		// g2 only feeds an output buffer, so at most g0 and g1 qualify
		Assertions.assertEquals(2, net.insertBuffsByScoap(10));
		Assertions.assertEquals(2, net.getBufferCount());
		Assertions.assertEquals(1, net.getGate(2).getFanOut());

		// Buffered gates now feed a single buffer and are skipped too
		net.computeSumScoap();
		Assertions.assertEquals(0, net.insertBuffsByScoap(10));
	}

	@Test
	public void testNoPlaces(){
		BooleanNet net = tree();
		net.computeSumScoap();
		Assertions.assertEquals(0, net.insertBuffsByScoap(0));
		Assertions.assertEquals(3, net.getGateCount());
		Assertions.assertThrows(IllegalArgumentException.class, new Executable(){
			@Override
			public void execute() throws Throwable {
				net.insertBuffsByScoap(-1);
			}
		});
	}

	@Test
	public void testWorstGateFirst(){
		// g0 = a & b, g1 = g0 & c, g2 = g1 & d; every gate also drives an output
		BooleanNet net = AigBuilder.build(4, new int[]{10, 12, 14}, new int[][]{{10, 2, 4}, {12, 10, 6}, {14, 12, 8}});
		net.computeSumScoap();
		long p0 = ScoapBufferInserter.scoapProduct(net.getGate(0));
		long p1 = ScoapBufferInserter.scoapProduct(net.getGate(1));
		Assertions.assertTrue(p1 > p0);

		net.insertBuffsByScoap(1);
		Assertions.assertEquals("GATE_1_SCOAPBUFF", net.getBuffer(0).getName());
	}
}
