package com.deering.humblenet;

/**
 * Logic function of a gate. The set of functions is closed; every rule below
 * is defined for each of them.
 * 
 * Controllability and observability rules work on per-input costs:
 * 
 * zero[i] -- cost of driving input line i to 0 (the driver's cc1 if the input inverts, else its cc0)
 * one[i]  -- cost of driving input line i to 1
 * 
 * The returned costs exclude the +1 for the gate itself.
 * 
 * @author tdeering
 *
 */
public enum GateFunction {
	/**
	 * Copy the first input to the output
	 */
	BUFFER,
	
	/**
	 * Logical AND of the inputs
	 */
	AND,
	
	/**
	 * Logical OR of the inputs
	 */
	OR,
	
	/**
	 * Logical XOR of the inputs
	 */
	XOR;
	
	/**
	 * Short label used in dumps and cell names.
	 * @return
	 */
	public String getName(){
		switch(this){
		case AND:
			return "AND";
		case OR:
			return "OR";
		case XOR:
			return "XOR";
		case BUFFER:
			return "BUFF";
		default:
			throw new NetException("Unknown gate function: " + this);
		}
	}
	
	/**
	 * Whether the function has a De Morgan dual, see {@link #dual()}.
	 * @return
	 */
	public boolean hasDual(){
		return this != XOR;
	}
	
	/**
	 * Returns the De Morgan dual: the function f' with f'(x) == NOT f(NOT x).
	 * 
	 * @return
	 */
	public GateFunction dual(){
		switch(this){
		case AND:
			return OR;
		case OR:
			return AND;
		case BUFFER:
			return BUFFER;
		case XOR:
			throw new NetException("XOR has no structural De Morgan dual");
		default:
			throw new NetException("Unknown gate function: " + this);
		}
	}
	
	/**
	 * Evaluates the function over already-inverted input values.
	 * 
	 * @param values
	 * @return
	 */
	public boolean evaluate(boolean[] values){
		boolean result;
		switch(this){
		case AND:
			result = true;
			for(boolean v : values) result &= v;
			return result;
		case OR:
			result = false;
			for(boolean v : values) result |= v;
			return result;
		case XOR:
			result = false;
			for(boolean v : values) result ^= v;
			return result;
		case BUFFER:
			return values.length > 0 && values[0];
		default:
			throw new NetException("Unknown gate function: " + this);
		}
	}
	
	/**
	 * SCOAP combinational controllability of the function output.
	 * 
	 * @param zero
	 * @param one
	 * @return {cc0, cc1}
	 */
	public long[] controllability(long[] zero, long[] one){
		long cc0, cc1;
		switch(this){
		case AND:
			cc0 = Long.MAX_VALUE;
			cc1 = 0;
			for(int i = 0; i < zero.length; ++i){
				cc0 = Math.min(cc0, zero[i]);
				cc1 += one[i];
			}
			break;
		case OR:
			cc0 = 0;
			cc1 = Long.MAX_VALUE;
			for(int i = 0; i < zero.length; ++i){
				cc0 += zero[i];
				cc1 = Math.min(cc1, one[i]);
			}
			break;
		case XOR:
			// Cheapest way to reach an even/odd number of ones
			cc0 = 0;
			cc1 = Long.MAX_VALUE;
			for(int i = 0; i < zero.length; ++i){
				long even = Math.min(cc0 + zero[i], cc1 == Long.MAX_VALUE ? Long.MAX_VALUE : cc1 + one[i]);
				long odd = Math.min(cc0 + one[i], cc1 == Long.MAX_VALUE ? Long.MAX_VALUE : cc1 + zero[i]);
				cc0 = even;
				cc1 = odd;
			}
			break;
		case BUFFER:
			cc0 = 0;
			cc1 = 0;
			for(int i = 0; i < zero.length; ++i){
				cc0 += zero[i];
				cc1 += one[i];
			}
			break;
		default:
			throw new NetException("Unknown gate function: " + this);
		}
		return new long[]{cc0, cc1};
	}
	
	/**
	 * SCOAP cost the side inputs of this function add to the observability of
	 * one input. AND adds the zero cost of every other input and OR adds the one
	 * cost, each through the input's own inversion. BUFFER and XOR add nothing,
	 * so observing through them costs only the +1 of the gate. Inputs flagged
	 * in observed are skipped.
	 * 
	 * @param zero
	 * @param one
	 * @param observed
	 * @return
	 */
	public long sideInputCost(long[] zero, long[] one, boolean[] observed){
		long cost = 0;
		for(int i = 0; i < zero.length; ++i){
			if(observed[i]) continue;
			switch(this){
			case AND:
				cost += zero[i];
				break;
			case OR:
				cost += one[i];
				break;
			case XOR:
			case BUFFER:
				break;
			default:
				throw new NetException("Unknown gate function: " + this);
			}
		}
		return cost;
	}
}
