package com.example.evcharging.provider;

import com.example.evcharging.exception.ProviderRejectedException;
import com.example.evcharging.exception.ProviderUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Base for adapters that talk JSON over HTTP. Owns the upstream base URL and translates
 * {@link RestTemplate} failures into the provider exception taxonomy:
 * 404 is "not found", other 4xx are rejections, 5xx and I/O errors mean unavailable.
 */
@Slf4j
public abstract class AbstractHttpProvider implements ChargingProvider {

    private final String providerId;
    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final Duration callTimeout;

    protected AbstractHttpProvider(String providerId, RestTemplate restTemplate, String baseUrl, Duration callTimeout) {
        this.providerId = providerId;
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.callTimeout = callTimeout;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public Duration getCallTimeout() {
        return callTimeout;
    }

    /** Adds the network-specific credential to an outgoing request. */
    protected abstract void authenticate(HttpHeaders headers);

    protected JsonNode call(HttpMethod method, String pathTemplate, Object body, Object... uriVariables) {
        return exchange(method, pathTemplate, body, uriVariables).orElseThrow(() ->
                new ProviderRejectedException(providerId, 404, "Not found upstream: " + pathTemplate, null));
    }

    protected Optional<JsonNode> callOptional(HttpMethod method, String pathTemplate, Object body, Object... uriVariables) {
        return exchange(method, pathTemplate, body, uriVariables);
    }

    protected String required(JsonNode node, String field) {
        String value = JsonFields.text(node, field);
        if (value == null || value.isBlank()) {
            throw new ProviderUnavailableException(providerId, "Malformed upstream response: missing " + field);
        }
        return value;
    }

    private Optional<JsonNode> exchange(HttpMethod method, String pathTemplate, Object body, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        authenticate(headers);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    baseUrl + pathTemplate, method, new HttpEntity<>(body, headers), JsonNode.class, uriVariables);
            JsonNode json = response.getBody();
            return Optional.of(json != null ? json : NullNode.getInstance());
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("{} {} {} -> 404", providerId, method, pathTemplate);
            return Optional.empty();
        } catch (HttpClientErrorException e) {
            throw new ProviderRejectedException(providerId, e.getStatusCode().value(),
                    "Upstream rejected " + method + " " + pathTemplate + " with " + e.getStatusCode().value(), e);
        } catch (HttpServerErrorException e) {
            throw new ProviderUnavailableException(providerId,
                    "Upstream error " + e.getStatusCode().value() + " on " + method + " " + pathTemplate, e);
        } catch (ResourceAccessException e) {
            throw new ProviderUnavailableException(providerId, "Upstream unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(providerId, "Upstream call failed: " + e.getMessage(), e);
        }
    }
}
