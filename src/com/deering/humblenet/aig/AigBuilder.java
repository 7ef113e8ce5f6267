package com.deering.humblenet.aig;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.deering.humblenet.BooleanNet;
import com.deering.humblenet.BooleanNet.Gate;
import com.deering.humblenet.GateFunction;
import com.deering.humblenet.NetException;
import com.google.common.base.Preconditions;

/**
 * Wires a {@link BooleanNet} from decoded And-Inverter Graph literals.
 *
 * Literal l refers to variable l / 2, inverted when l is odd. Variables 1..I are
 * the primary inputs, variables I+1..I+A the AND gates in order; literals 0 and
 * 1 are the constants FALSE and TRUE. Outputs tied to a constant are dropped.
 *
 * USAGE EXAMPLE:
 *
 * // o = NOT(a AND NOT b)
 * BooleanNet net = AigBuilder.build(2, new int[]{7}, new int[][]{{6, 2, 5}});
 *
 * @author tdeering
 *
 */
public class AigBuilder {
	private static final Logger LOG = LogManager.getLogger(AigBuilder.class);

	private AigBuilder(){}

	/**
	 * Builds the net.
	 *
	 * @param inputs number of primary inputs I
	 * @param outputs output literals
	 * @param ands AND gates as {lhs, rhs0, rhs1}; lhs must be 2 * (I + 1 + index)
	 * @return
	 */
	public static BooleanNet build(int inputs, int[] outputs, int[][] ands){
		return build(inputs, outputs, ands, LogManager.getLogger(BooleanNet.class));
	}

	/**
	 * Builds the net, which will report to the given logger.
	 *
	 * @param inputs
	 * @param outputs
	 * @param ands
	 * @param logger
	 * @return
	 */
	public static BooleanNet build(int inputs, int[] outputs, int[][] ands, Logger logger){
		Preconditions.checkNotNull(outputs);
		Preconditions.checkNotNull(ands);
		LOG.debug("AIG: I = {}, O = {}, A = {}", inputs, outputs.length, ands.length);

		BooleanNet net = new BooleanNet(inputs, outputs.length, ands.length, logger);

		for(int i = 0; i < ands.length; ++i){
			int[] and = ands[i];
			if(and == null || and.length != 3) throw new NetException("AND " + i + " must have exactly three literals");
			if(and[0] != 2 * (inputs + 1 + i)) throw new NetException("AND " + i + " defines literal " + and[0] + ", expected " + 2 * (inputs + 1 + i));

			Gate gate = net.getGate(i);
			gate.setFunction(GateFunction.AND);
			for(int j = 1; j < 3; ++j){
				gate.newInput(resolve(net, inputs, and[j]), isInverting(and[j]));
			}
		}

		// Outputs are removed while wiring, so the remaining ones shift down
		int out = 0;
		for(int i = 0; i < outputs.length; ++i){
			int lit = outputs[i];
			if(lit == 0 || lit == 1){
				LOG.warn("Output {} is constant {}, removing it", i, lit);
				net.remOutput(out);
				continue;
			}
			net.getOutput(out).newInput(resolve(net, inputs, lit), isInverting(lit));
			out++;
		}
		return net;
	}

	/**
	 * Whether the literal refers to its variable inverted.
	 *
	 * @param lit
	 * @return
	 */
	public static boolean isInverting(int lit){
		return lit % 2 == 1;
	}

	private static Gate resolve(BooleanNet net, int inputs, int lit){
		if(lit < 0) throw new NetException("Negative literal " + lit);
		int variable = lit / 2;
		if(variable == 0) throw new NetException("Constant literal " + lit + " cannot drive a gate");
		if(variable <= inputs) return net.getInput(variable - 1);
		return net.getGate(variable - inputs - 1);
	}
}
