package com.mouse.odds.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.odds.config.SourceConfig;
import com.mouse.odds.config.SourceConfigFactory;
import com.mouse.odds.exception.UnknownSourceException;
import com.mouse.odds.interceptor.SourceHeadersInterceptor;
import com.mouse.odds.interfaces.HttpTransport;
import com.mouse.odds.interfaces.SignalPublisher;
import com.mouse.odds.model.SourceStatus;
import com.mouse.odds.resilience.RequestPipeline;
import com.mouse.odds.resilience.Sleeper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Owns one {@link RequestPipeline} per configured source. Pipelines share the OkHttp connection pool
 * but nothing else: each has its own limiter, breaker and worker thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourcePipelineRegistry {

    private final SourceConfigFactory sourceConfigFactory;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Sleeper sleeper;
    private final SignalPublisher signalPublisher;

    private final Map<String, RequestPipeline> pipelines = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (SourceConfig config : sourceConfigFactory.createAll()) {
            register(new RequestPipeline(config, transportFor(config), objectMapper, clock, sleeper, signalPublisher));
        }
        log.info("Pipelines ready for {} source(s): {}", pipelines.size(), pipelines.keySet());
    }

    public void register(RequestPipeline pipeline) {
        RequestPipeline previous = pipelines.put(pipeline.getSourceId(), pipeline);
        if (previous != null) {
            previous.shutdown();
        }
    }

    /**
     * @throws UnknownSourceException if no source has this id
     */
    public RequestPipeline pipeline(String sourceId) {
        RequestPipeline pipeline = sourceId == null ? null : pipelines.get(sourceId);
        if (pipeline == null) {
            throw new UnknownSourceException(sourceId);
        }
        return pipeline;
    }

    public SourceStatus getStatus(String sourceId) {
        return pipeline(sourceId).getStatus();
    }

    public List<SourceStatus> getAllStatuses() {
        List<SourceStatus> statuses = new ArrayList<>();
        pipelines.values().forEach(p -> statuses.add(p.getStatus()));
        return statuses;
    }

    public void resetCircuitBreaker(String sourceId) {
        pipeline(sourceId).resetCircuitBreaker();
    }

    @PreDestroy
    public void shutdown() {
        pipelines.values().forEach(RequestPipeline::shutdown);
        log.info("Pipelines shut down");
    }

    HttpTransport transportFor(SourceConfig config) {
        OkHttpClient sourceClient = okHttpClient.newBuilder()
                .callTimeout(config.getRequestTimeoutMs(), TimeUnit.MILLISECONDS)
                .addInterceptor(new SourceHeadersInterceptor(config))
                .build();
        return new OkHttpTransport(sourceClient);
    }
}
