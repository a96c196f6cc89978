package com.apimonitor.anomaly.telemetry;

import com.apimonitor.anomaly.config.DetectorProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Minimal JSON-over-HTTP client for the Elasticsearch REST API. Covers only what the
 * detector needs: readiness, index existence/creation, search, and document writes/reads.
 * Every failure is reported as a {@link TelemetryStoreException}.
 */
@Slf4j
@Component
public class TelemetryStoreClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public TelemetryStoreClient(@Qualifier("storeRestTemplate") RestTemplate restTemplate,
                                DetectorProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = documentMapper();
        this.baseUrl = properties.store().baseUrl();
    }

    /**
     * Mapper for store documents: snake_case fields, ISO-8601 timestamps, nulls omitted.
     */
    public static ObjectMapper documentMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /** Readiness check against the cluster root. Never throws. */
    public boolean ping() {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(baseUrl + "/", String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.warn("Telemetry store ping failed at {}: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    /**
     * Whether an index (or, for a wildcard pattern, at least one matching index) exists.
     */
    public boolean indexExists(String index) {
        try {
            restTemplate.exchange(baseUrl + "/{index}", HttpMethod.HEAD, null, Void.class, index);
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            return false;
        } catch (RestClientException e) {
            throw translate("HEAD " + index, e);
        }
    }

    public void createIndex(String index, Object body) {
        exchange(HttpMethod.PUT, "/{index}", body, "create index " + index, index);
        log.info("Created index {}", index);
    }

    public JsonNode search(String index, Object query) {
        return exchange(HttpMethod.POST, "/{index}/_search", query, "search " + index, index);
    }

    /** Appends a document with a store-generated id. */
    public void index(String index, Object document) {
        exchange(HttpMethod.POST, "/{index}/_doc", document, "index into " + index, index);
    }

    /** Creates or overwrites the document with the given id. */
    public void put(String index, String id, Object document) {
        exchange(HttpMethod.PUT, "/{index}/_doc/{id}", document, "put " + index + "/" + id, index, id);
    }

    /**
     * Reads a document's {@code _source}; empty when the index or document does not exist.
     */
    public Optional<JsonNode> get(String index, String id) {
        try {
            JsonNode response = exchange(HttpMethod.GET, "/{index}/_doc/{id}", null, "get " + index + "/" + id, index, id);
            if (response == null || !response.path("found").asBoolean(false)) {
                return Optional.empty();
            }
            return Optional.of(response.path("_source"));
        } catch (TelemetryStoreException e) {
            if (e.getStatusCode() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private JsonNode exchange(HttpMethod method, String path, Object body, String operation, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        try {
            HttpEntity<String> entity = new HttpEntity<>(body != null ? objectMapper.writeValueAsString(body) : null, headers);
            ResponseEntity<String> response = restTemplate.exchange(baseUrl + path, method, entity, String.class, uriVariables);
            String responseBody = response.getBody();
            return responseBody == null || responseBody.isBlank() ? null : objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw TelemetryStoreException.permanent("Invalid JSON during " + operation + ": " + e.getOriginalMessage(), e);
        } catch (RestClientException e) {
            throw translate(operation, e);
        }
    }

    private static TelemetryStoreException translate(String operation, RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return new TelemetryStoreException("Telemetry store unreachable during " + operation + ": " + e.getMessage(), true, 0, e);
        }
        if (e instanceof RestClientResponseException) {
            int status = ((RestClientResponseException) e).getStatusCode().value();
            boolean retryable = e instanceof HttpServerErrorException || status == HttpStatus.TOO_MANY_REQUESTS.value();
            return new TelemetryStoreException("Telemetry store returned " + status + " during " + operation, retryable, status, e);
        }
        return TelemetryStoreException.permanent("Telemetry store call failed during " + operation + ": " + e.getMessage(), e);
    }
}
