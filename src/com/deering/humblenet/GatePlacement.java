package com.deering.humblenet;

/**
 * Logical position of a gate inside a Boolean network.
 * @author tdeering
 *
 */
public enum GatePlacement {
	/**
	 * Primary input of the net
	 */
	INPUT,
	
	/**
	 * Inner node
	 */
	INNER,
	
	/**
	 * Primary output of the net
	 */
	OUTPUT;
}
