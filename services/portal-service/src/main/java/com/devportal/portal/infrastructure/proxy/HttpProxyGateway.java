package com.devportal.portal.infrastructure.proxy;

import com.devportal.health.gateway.ProxyGateway;
import com.devportal.health.gateway.ProxyGatewayException;
import com.devportal.health.gateway.ProxyResponse;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link ProxyGateway} backed by the portal backend's proxy endpoint.
 *
 * <p>Issues {@code GET {baseUrl}{proxyPath}?url={target}} and returns the JSON body, which
 * carries the upstream payload plus {@code componentSuccess} and {@code statusCode}. Any
 * failure of the proxy call itself (unreachable, non-2xx from the proxy, unreadable or empty
 * body) surfaces as {@link ProxyGatewayException}.
 */
public class HttpProxyGateway implements ProxyGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpProxyGateway.class);

    static final String URL_PARAM = "url";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final String proxyPath;

    public HttpProxyGateway(RestClient.Builder builder, String baseUrl, String proxyPath) {
        if (builder == null) {
            throw new IllegalArgumentException("builder must not be null");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be null or blank");
        }
        if (proxyPath == null || proxyPath.isBlank()) {
            throw new IllegalArgumentException("proxyPath must not be null or blank");
        }
        this.restClient = builder.baseUrl(baseUrl).build();
        this.proxyPath = proxyPath;
    }

    @Override
    public ProxyResponse get(String targetUrl) {
        Map<String, Object> body;
        try {
            body = restClient
                    .get()
                    .uri(uriBuilder -> uriBuilder
                            .path(proxyPath)
                            .queryParam(URL_PARAM, "{target}")
                            .build(targetUrl))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(JSON_OBJECT);
        } catch (RestClientResponseException e) {
            log.debug("Proxy rejected request for {}: {}", targetUrl, e.getStatusCode());
            throw new ProxyGatewayException(
                    "Proxy returned status " + e.getStatusCode().value() + " for " + targetUrl, e);
        } catch (RestClientException e) {
            log.debug("Proxy request for {} failed: {}", targetUrl, e.getMessage());
            throw new ProxyGatewayException("Proxy request failed for " + targetUrl + ": " + e.getMessage(), e);
        }
        if (body == null) {
            throw new ProxyGatewayException("Empty response from proxy for " + targetUrl);
        }
        return new ProxyResponse(body);
    }
}
