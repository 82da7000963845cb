package com.weave.graph.service.persistence;

/**
 * Thrown when a persistence gateway is used after it was closed.
 */
public class GatewayClosedException extends RuntimeException {

    public GatewayClosedException(String gatewayName) {
        super("Persistence gateway '" + gatewayName + "' is closed");
    }
}
