package com.pipeline.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pipeline.model.HttpCall;
import com.pipeline.model.RetryPolicy;
import com.pipeline.service.api.HttpExecutor;
import com.pipeline.transform.JsonValues;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * {@link HttpExecutor} on Spring's {@link WebClient}, with resilience4j retries.
 * <p>
 * Each attempt is bounded by the call's timeout. Retryable statuses, timeouts and connection
 * failures are retried according to the call's {@link RetryPolicy}; whatever the last attempt
 * produced is then mapped to parsed data or an {@code {"error": ...}} object.
 */
@Service
@Slf4j
public class WebClientHttpExecutor implements HttpExecutor {

    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebClientHttpExecutor(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public JsonNode execute(HttpCall call) {
        URI uri = buildUri(call);
        log.debug("Sending {} request to {}", call.method(), uri);

        Mono<RawResponse> attempt = Mono.defer(() -> request(call, uri)
                        .exchangeToMono(response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new RawResponse(response.statusCode().value(), body))))
                .timeout(Duration.ofSeconds(call.timeoutSeconds()));

        RawResponse response;
        try {
            response = attempt.transformDeferred(RetryOperator.of(retryFor(call))).block();
        } catch (RuntimeException e) {
            return transportError(Exceptions.unwrap(e), call);
        }
        if (response == null) {
            return JsonValues.error("Request failed: empty response");
        }
        return toResult(response, call);
    }

    private WebClient.RequestHeadersSpec<?> request(HttpCall call, URI uri) {
        WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(call.method().toUpperCase()))
                .uri(uri)
                .headers(headers -> call.headers().forEach(headers::set));
        if (call.jsonBody() != null) {
            return spec.contentType(MediaType.APPLICATION_JSON).bodyValue(call.jsonBody());
        }
        if (call.formBody() != null) {
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            call.formBody().forEach(form::add);
            return spec.body(BodyInserters.fromFormData(form));
        }
        return spec;
    }

    /**
     * Query names and values are encoded strictly, so reserved characters such as {@code +} in an
     * API key reach the server unchanged.
     */
    private static URI buildUri(HttpCall call) {
        String base = UriComponentsBuilder.fromUriString(call.url()).build().encode().toUriString();
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(base);
        if (call.params() != null) {
            call.params().fields().forEachRemaining(param -> {
                String name = UriUtils.encode(param.getKey(), StandardCharsets.UTF_8);
                JsonNode value = param.getValue();
                if (value.isArray()) {
                    value.forEach(item -> builder.queryParam(name, encodeValue(item)));
                } else if (!JsonValues.isNull(value)) {
                    builder.queryParam(name, encodeValue(value));
                }
            });
        }
        return builder.build(true).toUri();
    }

    private static String encodeValue(JsonNode value) {
        return UriUtils.encode(JsonValues.asText(value), StandardCharsets.UTF_8);
    }

    private static Retry retryFor(HttpCall call) {
        RetryPolicy policy = call.retry();
        if (policy == null) {
            return Retry.of("pipeline-http", RetryConfig.<RawResponse>custom().maxAttempts(1).build());
        }
        Duration delay = Duration.ofMillis(Math.max(1L, Math.round(policy.getDelay() * 1000)));
        IntervalFunction interval = policy.isExponential()
                ? IntervalFunction.ofExponentialBackoff(delay, 2.0)
                : IntervalFunction.of(delay);
        List<Integer> retryOn = policy.getRetryOn() == null ? List.of() : policy.getRetryOn();
        RetryConfig config = RetryConfig.<RawResponse>custom()
                .maxAttempts(Math.max(1, policy.getMaxAttempts()))
                .intervalFunction(interval)
                .retryOnResult(response -> retryOn.contains(response.status()))
                .retryOnException(e -> e instanceof TimeoutException || e instanceof WebClientRequestException)
                .build();
        Retry retry = Retry.of("pipeline-http", config);
        retry.getEventPublisher().onRetry(event ->
                log.info("Retrying {} (attempt {}): {}", call.url(), event.getNumberOfRetryAttempts() + 1,
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "retryable status"));
        return retry;
    }

    private JsonNode toResult(RawResponse response, HttpCall call) {
        int status = response.status();
        if (status >= 200 && status < 300) {
            return parseBody(response.body(), call);
        }
        log.warn("{} {} returned HTTP {}", call.method(), call.url(), status);
        return switch (status) {
            case 400 -> JsonValues.error("Bad request: " + truncate(response.body(), 300) + " (HTTP 400)");
            case 401 -> JsonValues.error("Authentication failed (HTTP 401)");
            case 403 -> JsonValues.error("Access denied (HTTP 403)");
            case 404 -> JsonValues.error("Resource not found (HTTP 404)");
            case 429 -> JsonValues.error("Rate limit exceeded (HTTP 429)");
            default -> status >= 500
                    ? JsonValues.error("Server error (HTTP " + status + ")")
                    : JsonValues.error("API error: HTTP " + status);
        };
    }

    private JsonNode parseBody(String body, HttpCall call) {
        return switch (call.format()) {
            case RAW -> TextNode.valueOf(body);
            case XML -> XmlResponseParser.parse(body);
            case JSON -> parseJson(body);
        };
    }

    /**
     * JSON first, then a JSONP body wrapped in parentheses, then the plain text.
     */
    private JsonNode parseJson(String body) {
        JsonNode parsed = readJson(body);
        if (parsed == null) {
            String text = body.strip();
            if (text.startsWith("(") && text.endsWith(")")) {
                parsed = readJson(text.substring(1, text.length() - 1));
            }
        }
        return parsed != null ? parsed : TextNode.valueOf(body);
    }

    private JsonNode readJson(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static JsonNode transportError(Throwable error, HttpCall call) {
        if (error instanceof TimeoutException) {
            log.warn("{} {} timed out after {}s", call.method(), call.url(), call.timeoutSeconds());
            return JsonValues.error("Request timed out (" + call.timeoutSeconds() + "s)");
        }
        if (error instanceof WebClientRequestException) {
            log.warn("{} {} could not connect: {}", call.method(), call.url(), error.getMessage());
            return JsonValues.error("Network connection failed");
        }
        log.error("{} {} failed unexpectedly", call.method(), call.url(), error);
        return JsonValues.error("Request failed: " + error.getMessage());
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    record RawResponse(int status, String body) {
    }
}
