package com.topology.core.service.probe.passive;

/**
 * A captured frame claimed to be a neighbour announcement but could not be decoded.
 */
public class MalformedFrameException extends Exception {

    public MalformedFrameException(String message) {
        super(message);
    }
}
