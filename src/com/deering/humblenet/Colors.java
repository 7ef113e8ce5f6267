package com.deering.humblenet;

/**
 * Bit flags used to mark subsets of a net. A gate may carry several colors at
 * once; colors are combined with bitwise OR.
 * 
 * @author tdeering
 *
 */
public final class Colors {
	/**
	 * No color. Every gate "has" this color.
	 */
	public static final int EMPTY = 0;
	
	/**
	 * Input cone of a selected gate
	 */
	public static final int IN_TREE = 1 << 0;
	
	/**
	 * Output cone of a selected gate
	 */
	public static final int OUT_TREE = 1 << 1;
	
	/**
	 * Base half of a dual-rail circuit: one gate of every complementary pair
	 */
	public static final int DUAL_BASE = 1 << 2;
	
	private Colors(){
	}
}
