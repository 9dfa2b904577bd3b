package com.aera.client.offline.infrastructure;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.aera.client.offline.application.RemoteCallException;
import com.aera.client.offline.application.RemoteResourceGateway;
import com.aera.client.offline.domain.RemoteResource;

/**
 * {@link RemoteResourceGateway} over plain REST:
 * {@code GET|PUT|DELETE /{type}/{id}} and {@code POST /{type}} with the client id in the body.
 */
public class RestRemoteResourceGateway implements RemoteResourceGateway {

    private static final Logger log = LoggerFactory.getLogger(RestRemoteResourceGateway.class);

    static final String ID_FIELD = "id";
    static final String UPDATED_AT_FIELD = "updatedAt";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;

    public RestRemoteResourceGateway(String baseUrl, String bearerToken) {
        this(RestClient.builder(), baseUrl, bearerToken);
    }

    public RestRemoteResourceGateway(RestClient.Builder builder, String baseUrl, String bearerToken) {
        RestClient.Builder configured = builder
                .baseUrl(Objects.requireNonNull(baseUrl, "baseUrl"))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (bearerToken != null && !bearerToken.isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken);
        }
        this.restClient = configured.build();
    }

    @Override
    public boolean exists(String resourceType, String resourceId) {
        return fetch(resourceType, resourceId).isPresent();
    }

    @Override
    public Optional<RemoteResource> fetch(String resourceType, String resourceId) {
        try {
            Map<String, Object> body = restClient.get()
                    .uri("/{type}/{id}", resourceType, resourceId)
                    .retrieve()
                    .body(JSON_OBJECT);
            Map<String, Object> fields = body == null ? Map.of() : body;
            return Optional.of(new RemoteResource(resourceType, resourceId, fields, lastModified(fields)));
        } catch (HttpClientErrorException.NotFound ex) {
            return Optional.empty();
        } catch (RestClientException ex) {
            throw translate("GET", resourceType, resourceId, ex);
        }
    }

    @Override
    public void create(String resourceType, String resourceId, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>(payload);
        body.put(ID_FIELD, resourceId);
        try {
            restClient.post()
                    .uri("/{type}", resourceType)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException ex) {
            throw translate("POST", resourceType, resourceId, ex);
        }
    }

    @Override
    public void update(String resourceType, String resourceId, Map<String, Object> payload) {
        try {
            restClient.put()
                    .uri("/{type}/{id}", resourceType, resourceId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException ex) {
            throw translate("PUT", resourceType, resourceId, ex);
        }
    }

    @Override
    public void delete(String resourceType, String resourceId) {
        try {
            restClient.delete()
                    .uri("/{type}/{id}", resourceType, resourceId)
                    .retrieve()
                    .toBodilessEntity();
        } catch (HttpClientErrorException.NotFound ex) {
            log.debug("DELETE {}/{} returned 404, treating as deleted", resourceType, resourceId);
        } catch (RestClientException ex) {
            throw translate("DELETE", resourceType, resourceId, ex);
        }
    }

    private RemoteCallException translate(String method, String resourceType, String resourceId, RestClientException ex) {
        String target = method + " " + resourceType + "/" + resourceId;
        if (ex instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            return new RemoteCallException(isRetryable(response), status, target + " failed: " + response.getStatusText(), ex);
        }
        if (ex instanceof ResourceAccessException) {
            return new RemoteCallException(true, RemoteCallException.NO_RESPONSE, target + " unreachable: " + ex.getMessage(), ex);
        }
        return new RemoteCallException(false, RemoteCallException.NO_RESPONSE, target + " failed: " + ex.getMessage(), ex);
    }

    static boolean isRetryable(RestClientResponseException response) {
        int status = response.getStatusCode().value();
        if (response.getStatusCode().is5xxServerError()
                || status == HttpStatus.REQUEST_TIMEOUT.value()
                || status == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return true;
        }
        // lock contention is reported as 409 with Retry-After
        HttpHeaders headers = response.getResponseHeaders();
        return status == HttpStatus.CONFLICT.value()
                && headers != null
                && headers.containsKey(HttpHeaders.RETRY_AFTER);
    }

    static Instant lastModified(Map<String, Object> fields) {
        Object value = fields.get(UPDATED_AT_FIELD);
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ex) {
                log.debug("Unparseable {} value '{}', ignoring", UPDATED_AT_FIELD, text);
                return null;
            }
        }
        return null;
    }
}
