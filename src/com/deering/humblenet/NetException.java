package com.deering.humblenet;

/**
 * Exception encountered by and thrown during operations on a Boolean network.
 * @author tdeering
 *
 */
public class NetException extends RuntimeException {
	private static final long serialVersionUID = 4179235503718810921L;

	public NetException(){
	}
	
	public NetException(String msg){
		super(msg);
	}
	
	public NetException(Throwable t){
		super(t);
	}
	
	public NetException(String msg, Throwable t){
		super(msg, t);
	}
}
