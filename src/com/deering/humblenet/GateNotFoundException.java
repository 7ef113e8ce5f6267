package com.deering.humblenet;

/**
 * Thrown when a gate, input, output or buffer is requested by an index or id
 * the network does not hold.
 * @author tdeering
 *
 */
public class GateNotFoundException extends NetException {
	private static final long serialVersionUID = -6409315785161532784L;
	
	private final int index;

	public GateNotFoundException(String what, int index){
		super("No such " + what + ": " + index);
		this.index = index;
	}
	
	/**
	 * Returns the index or id that could not be resolved.
	 * @return
	 */
	public int getIndex(){
		return index;
	}
}
