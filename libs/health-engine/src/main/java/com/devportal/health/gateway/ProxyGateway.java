package com.devportal.health.gateway;

/**
 * Port to the portal's outbound proxy ({@code GET /cis-public/proxy?url=<target>}).
 * <p>
 * The proxy performs the real request to {@code targetUrl} and answers with the upstream
 * JSON body plus two synthetic fields: {@code componentSuccess} and {@code statusCode}.
 * Implementations block until the proxy answers.
 */
@FunctionalInterface
public interface ProxyGateway {

    /**
     * Fetches {@code targetUrl} through the proxy.
     *
     * @param targetUrl fully-qualified component endpoint URL
     * @return the proxy's annotated response
     * @throws RuntimeException when the proxy call itself cannot complete,
     *         typically a {@link ProxyGatewayException}
     */
    ProxyResponse get(String targetUrl);
}
