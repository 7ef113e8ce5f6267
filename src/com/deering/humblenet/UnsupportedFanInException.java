package com.deering.humblenet;

/**
 * Thrown when a gate with more than two inputs reaches logic that only
 * understands two-input cells. Callers may re-normalize the net and retry.
 * @author tdeering
 *
 */
public class UnsupportedFanInException extends NetException {
	private static final long serialVersionUID = 2305912284757701486L;
	
	private final String gateName;
	private final int fanIn;

	public UnsupportedFanInException(String gateName, int fanIn){
		super("Gate " + gateName + " has fan-in " + fanIn + ", only two-input cells are supported");
		this.gateName = gateName;
		this.fanIn = fanIn;
	}
	
	public String getGateName(){
		return gateName;
	}
	
	public int getFanIn(){
		return fanIn;
	}
}
