package com.devportal.health.gateway;

/**
 * The proxy call could not complete: proxy unreachable, non-2xx from the proxy itself,
 * or an unreadable body.
 */
public class ProxyGatewayException extends RuntimeException {

    public ProxyGatewayException(String message) {
        super(message);
    }

    public ProxyGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
