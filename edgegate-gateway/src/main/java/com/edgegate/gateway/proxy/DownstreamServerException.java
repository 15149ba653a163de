package com.edgegate.gateway.proxy;

/**
 * A downstream instance answered with a 5xx status. Retryable; counts as a breaker failure.
 */
public class DownstreamServerException extends RuntimeException {

    private final ProxyResponse response;

    public DownstreamServerException(String serviceName, ProxyResponse response) {
        super("Downstream " + serviceName + " responded " + response.getStatus());
        this.response = response;
    }

    public int getStatus() {
        return response.getStatus();
    }

    public ProxyResponse getResponse() {
        return response;
    }
}
