package com.mouse.odds.resilience;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.odds.config.SourceConfig;
import com.mouse.odds.exception.UpstreamHttpException;
import com.mouse.odds.interfaces.HttpTransport;
import com.mouse.odds.interfaces.SignalPublisher;
import com.mouse.odds.model.ApiResponse;
import com.mouse.odds.model.SourceStatus;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.Request;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Every outbound call of one source goes through here.
 * <p>
 * Per physical attempt: rate-limit slot, circuit-breaker check, one transport call, outcome reported
 * to the breaker. The retry policy wraps that unit, so a retry takes a fresh slot and a half-open
 * trial is exactly one network attempt.
 */
@Slf4j
public class RequestPipeline {

    private static final String API_KEY_PARAM = "apiKey";

    @Getter
    private final SourceConfig config;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final ExecutorService worker;

    public RequestPipeline(SourceConfig config, HttpTransport transport, ObjectMapper objectMapper, Clock clock,
                           Sleeper sleeper, SignalPublisher publisher) {
        this(config,
                new RateLimiter(config, clock, sleeper, publisher),
                new CircuitBreaker(config, clock, publisher),
                new RetryPolicy(config.getSourceId(), config.getBaseDelayMs(), sleeper, publisher),
                transport,
                objectMapper);
    }

    RequestPipeline(SourceConfig config, RateLimiter rateLimiter, CircuitBreaker circuitBreaker,
                    RetryPolicy retryPolicy, HttpTransport transport, ObjectMapper objectMapper) {
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "pipeline-" + config.getSourceId());
            thread.setDaemon(true);
            return thread;
        });
    }

    public String getSourceId() {
        return config.getSourceId();
    }

    /**
     * Calls a named endpoint on the calling thread.
     *
     * @throws UpstreamHttpException on a fatal status or when retries run out on a retryable one
     * @throws com.mouse.odds.exception.CircuitOpenException when the breaker rejects the call
     * @throws IOException when the last attempt got no response
     */
    public ApiResponse execute(String endpoint, Map<String, String> pathParams, Map<String, String> queryParams)
            throws IOException, InterruptedException {
        return execute(buildRequest(endpoint, pathParams, queryParams), () -> false);
    }

    /**
     * Same as {@link #execute} with the body mapped to {@code type}. A body that does not parse is
     * not retried; it surfaces as {@link com.fasterxml.jackson.core.JsonProcessingException}.
     */
    public <T> T executeForJson(String endpoint, Map<String, String> pathParams, Map<String, String> queryParams,
                                JavaType type) throws IOException, InterruptedException {
        ApiResponse response = execute(endpoint, pathParams, queryParams);
        return objectMapper.readValue(response.getBody(), type);
    }

    public <T> T executeForJson(String endpoint, Map<String, String> pathParams, Map<String, String> queryParams,
                                Class<T> type) throws IOException, InterruptedException {
        return executeForJson(endpoint, pathParams, queryParams, objectMapper.constructType(type));
    }

    /**
     * Queues the call on this source's single worker, so calls of one source never overlap.
     * Cancelling the returned future interrupts the worker and stops further retries.
     */
    public CompletableFuture<ApiResponse> executeAsync(String endpoint, Map<String, String> pathParams,
                                                       Map<String, String> queryParams) {
        Request request = buildRequest(endpoint, pathParams, queryParams);
        CompletableFuture<ApiResponse> result = new CompletableFuture<>();
        Future<?> task = worker.submit(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                result.complete(execute(request, result::isCancelled));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.completeExceptionally(e);
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    // A retry that the breaker would reject anyway is skipped so the caller sees the upstream error.
    // OkHttp clears the interrupt flag when it aborts a call, so cancellation is also checked explicitly
    private ApiResponse execute(Request request, BooleanSupplier cancelled) throws IOException, InterruptedException {
        return retryPolicy.execute(() -> {
                    if (cancelled.getAsBoolean()) {
                        throw new InterruptedException("Request to " + config.getSourceId() + " cancelled");
                    }
                    return attempt(request);
                },
                config.getMaxRetries(), config.getBackoffMultiplier(), config.getMaxBackoffMs(),
                circuitBreaker::isRejecting);
    }

    ApiResponse attempt(Request request) throws IOException, InterruptedException {
        rateLimiter.acquire();
        circuitBreaker.beforeCall();

        ApiResponse response;
        try {
            response = transport.send(request);
        } catch (IOException | RuntimeException e) {
            circuitBreaker.onFailure();
            throw e;
        }

        if (!response.isSuccessful()) {
            circuitBreaker.onFailure();
            throw new UpstreamHttpException(config.getSourceId(), response.getStatusCode(), response.getBody());
        }

        circuitBreaker.onSuccess();
        return response;
    }

    Request buildRequest(String endpoint, Map<String, String> pathParams, Map<String, String> queryParams) {
        String url = config.endpointUrl(endpoint, pathParams);
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid URL for " + config.getSourceId() + ": " + url);
        }

        HttpUrl.Builder urlBuilder = parsed.newBuilder();
        if (queryParams != null) {
            queryParams.forEach(urlBuilder::addQueryParameter);
        }
        if (config.hasApiKey()) {
            urlBuilder.addQueryParameter(API_KEY_PARAM, config.getApiKey());
        }

        return new Request.Builder()
                .url(urlBuilder.build())
                .get()
                .build();
    }

    public SourceStatus getStatus() {
        return SourceStatus.builder()
                .sourceId(config.getSourceId())
                .circuitState(circuitBreaker.getState())
                .failureCount(circuitBreaker.getFailureCount())
                .lastFailureTime(circuitBreaker.getLastFailureTime())
                .rateLimiter(rateLimiter.snapshot())
                .build();
    }

    public void resetCircuitBreaker() {
        circuitBreaker.reset();
    }

    public void shutdown() {
        worker.shutdownNow();
        log.debug("Pipeline worker for {} stopped", config.getSourceId());
    }
}
