package com.platform.resilience.graph;

/**
 * One caller/callee pair observed in trace data, with how often it was seen.
 */
public record ObservedCall(String caller, String callee, Transport transport, long callCount) {
    
    public ObservedCall(String caller, String callee, Transport transport) {
        this(caller, callee, transport, 1);
    }
    
    public static ObservedCall sync(String caller, String callee) {
        return new ObservedCall(caller, callee, Transport.SYNC, 1);
    }
}
