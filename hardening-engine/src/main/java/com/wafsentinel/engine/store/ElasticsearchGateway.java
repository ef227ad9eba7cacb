package com.wafsentinel.engine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Minimal blocking Elasticsearch REST client on top of {@link WebClient}.
 *
 * <p>
 * Every call is bounded by the configured timeout. Failures are translated
 * into the pipeline's error taxonomy:
 * </p>
 * <ul>
 * <li>connection errors, timeouts, HTTP 429 and 5xx: {@link TransientIOException}</li>
 * <li>other HTTP 4xx: {@link StoreRequestException}</li>
 * <li>HTTP 409 on {@code _create}: reported as "already present"</li>
 * </ul>
 *
 * @author WAF Sentinel Team
 */
public class ElasticsearchGateway {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchGateway.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    private final Counter requestFailures;

    public ElasticsearchGateway(WebClient webClient, ObjectMapper objectMapper, Duration timeout,
            MeterRegistry meterRegistry) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.requestFailures = Counter.builder("sentinel.store.request.failures")
                .description("Failed Elasticsearch requests")
                .register(meterRegistry);
    }

    /**
     * Run a search. Missing indices yield an empty result rather than an error.
     *
     * @return the response body
     */
    public JsonNode search(String index, ObjectNode query) {
        String body = write(query);
        String response = webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/{index}/_search")
                        .queryParam("ignore_unavailable", "true")
                        .queryParam("allow_no_indices", "true")
                        .build(index))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(e -> translate("search " + index, e))
                .block();
        return read(response);
    }

    /**
     * Create a document with an explicit id.
     *
     * @return {@code true} if created, {@code false} if a document with that id already existed
     */
    public boolean create(String index, String id, JsonNode document) {
        String body = write(document);
        Boolean created = webClient.put()
                .uri("/{index}/_create/{id}", index, id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .map(response -> Boolean.TRUE)
                .onErrorResume(WebClientResponseException.Conflict.class, e -> {
                    log.debug("Document {}/{} already exists", index, id);
                    return Mono.just(Boolean.FALSE);
                })
                .timeout(timeout)
                .onErrorMap(e -> translate("create " + index + "/" + id, e))
                .block();
        return Boolean.TRUE.equals(created);
    }

    /** Index a document with a store-generated id. Used for alert documents. */
    public void index(String index, JsonNode document) {
        webClient.post()
                .uri("/{index}/_doc", index)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(write(document))
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .onErrorMap(e -> translate("index " + index, e))
                .block();
    }

    /** Create or replace a composable index template. */
    public void putIndexTemplate(String name, JsonNode template) {
        webClient.put()
                .uri("/_index_template/{name}", name)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(write(template))
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .onErrorMap(e -> translate("put index template " + name, e))
                .block();
    }

    private Throwable translate(String operation, Throwable error) {
        Throwable e = Exceptions.unwrap(error);
        if (e instanceof TransientIOException || e instanceof StoreRequestException) {
            return e;
        }
        requestFailures.increment();
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status == 429 || status >= 500) {
                return new TransientIOException("Elasticsearch " + operation + " failed with HTTP " + status, e);
            }
            return new StoreRequestException(
                    "Elasticsearch rejected " + operation + " with HTTP " + status + ": "
                            + response.getResponseBodyAsString(),
                    status, e);
        }
        if (e instanceof WebClientRequestException || e instanceof TimeoutException || e instanceof IOException) {
            return new TransientIOException("Elasticsearch " + operation + " unreachable: " + e.getMessage(), e);
        }
        return new TransientIOException("Elasticsearch " + operation + " failed: " + e.getMessage(), e);
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
    }

    private JsonNode read(String body) {
        if (body == null || body.isEmpty()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TransientIOException("Unparsable Elasticsearch response: " + e.getMessage(), e);
        }
    }
}
