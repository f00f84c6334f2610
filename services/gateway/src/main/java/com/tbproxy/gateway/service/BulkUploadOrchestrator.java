package com.tbproxy.gateway.service;

import com.tbproxy.common.dto.bulk.BulkReport;
import com.tbproxy.common.dto.bulk.TargetOutcome;
import com.tbproxy.common.dto.bulk.UploadTarget;
import com.tbproxy.common.dto.telemetry.InvalidTelemetryException;
import com.tbproxy.common.dto.telemetry.TelemetryPayload;
import com.tbproxy.common.dto.telemetry.TelemetryPayloadReader;
import com.tbproxy.common.error.ErrorNormalizer;
import com.tbproxy.common.error.FailureCause;
import com.tbproxy.common.error.UpstreamFailure;
import com.tbproxy.common.error.ValidationFailure;
import com.tbproxy.gateway.client.UpstreamTelemetryClient;
import com.tbproxy.gateway.exception.RequestValidationException;
import com.tbproxy.gateway.exception.UpstreamException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Uploads telemetry for many devices at once.
 *
 * Each target is validated and uploaded on its own; a failing target is
 * recorded in the report and never affects the others. Uploads run
 * concurrently up to {@code maxConcurrency}, each bounded by
 * {@code perTargetTimeout}. The report lists targets in submission order
 * regardless of completion order.
 */
@Service
public class BulkUploadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BulkUploadOrchestrator.class);

    private final UpstreamTelemetryClient upstreamClient;
    private final TelemetryPayloadReader payloadReader;
    private final ErrorNormalizer errorNormalizer;
    private final Duration perTargetTimeout;
    private final int maxConcurrency;

    // Metrics
    private final Counter targetsSucceeded;
    private final Counter targetsFailed;

    public BulkUploadOrchestrator(
            UpstreamTelemetryClient upstreamClient,
            TelemetryPayloadReader payloadReader,
            ErrorNormalizer errorNormalizer,
            @Value("${app.bulk.per-target-timeout:10s}") Duration perTargetTimeout,
            @Value("${app.bulk.max-concurrency:8}") int maxConcurrency,
            MeterRegistry meterRegistry) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("max-concurrency must be positive");
        }
        this.upstreamClient = upstreamClient;
        this.payloadReader = payloadReader;
        this.errorNormalizer = errorNormalizer;
        this.perTargetTimeout = perTargetTimeout;
        this.maxConcurrency = maxConcurrency;

        this.targetsSucceeded = Counter.builder("gateway.bulk.targets.succeeded")
                .description("Number of bulk upload targets stored upstream")
                .register(meterRegistry);

        this.targetsFailed = Counter.builder("gateway.bulk.targets.failed")
                .description("Number of bulk upload targets that failed validation or upload")
                .register(meterRegistry);
    }

    /**
     * Upload every target and report one outcome per target.
     * An empty batch or repeated target ids fail the whole call.
     */
    public Mono<BulkReport> run(List<UploadTarget> targets) {
        return Mono.defer(() -> {
            checkBatch(targets);

            return Flux.fromIterable(targets)
                    .flatMap(target -> process(target)
                            .map(outcome -> Map.entry(target.targetId(), outcome)), maxConcurrency)
                    .collectMap(Map.Entry::getKey, Map.Entry::getValue)
                    .map(outcomes -> {
                        Map<String, TargetOutcome> ordered = new LinkedHashMap<>();
                        for (UploadTarget target : targets) {
                            ordered.put(target.targetId(), outcomes.get(target.targetId()));
                        }
                        BulkReport report = BulkReport.from(ordered);
                        log.info("Bulk upload completed: {}/{} devices successful, {} data points",
                                report.summary().successfulDevices(),
                                report.summary().totalDevices(),
                                report.summary().totalDataPoints());
                        return report;
                    });
        });
    }

    private void checkBatch(List<UploadTarget> targets) {
        if (targets == null || targets.isEmpty()) {
            throw new RequestValidationException("No device data provided");
        }

        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (UploadTarget target : targets) {
            String id = target.targetId();
            if (id == null || id.isBlank()) {
                errors.add("target ids must be non-blank");
            } else if (!seen.add(id)) {
                duplicates.add(id);
            }
        }
        if (!duplicates.isEmpty()) {
            errors.add("duplicate target ids: " + String.join(", ", duplicates));
        }
        if (!errors.isEmpty()) {
            throw new RequestValidationException("Invalid bulk upload request", errors);
        }
    }

    private Mono<TargetOutcome> process(UploadTarget target) {
        String targetId = target.targetId();

        TelemetryPayload payload;
        try {
            payload = payloadReader.read(target.payload());
        } catch (InvalidTelemetryException e) {
            targetsFailed.increment();
            log.warn("Rejected telemetry for device {}: {}", targetId, e.getErrors());
            return Mono.just(TargetOutcome.failed(errorNormalizer.normalize(
                    ValidationFailure.invalid("Invalid telemetry for device " + targetId, e.getErrors()))));
        }

        return Mono.defer(() -> upstreamClient.upload(targetId, payload))
                .timeout(perTargetTimeout)
                .switchIfEmpty(Mono.error(() -> new UpstreamException(null, "No acknowledgement for device " + targetId)))
                .map(ack -> {
                    targetsSucceeded.increment();
                    return TargetOutcome.success(payload.keys(), payload.dataPoints());
                })
                .onErrorResume(error -> {
                    targetsFailed.increment();
                    FailureCause failure = upstreamFailure(targetId, error);
                    log.warn("Upload failed for device {}: {}", targetId, failure.internalMessage());
                    return Mono.just(TargetOutcome.failed(errorNormalizer.normalize(failure)));
                });
    }

    private FailureCause upstreamFailure(String targetId, Throwable error) {
        if (error instanceof UpstreamException upstream) {
            return upstream.failure();
        }
        if (error instanceof TimeoutException) {
            return new UpstreamFailure(null,
                    "Upload for device " + targetId + " timed out after " + perTargetTimeout.toMillis() + " ms");
        }
        return new UpstreamFailure(null, "Upload for device " + targetId + " failed: " + error.getMessage());
    }
}
