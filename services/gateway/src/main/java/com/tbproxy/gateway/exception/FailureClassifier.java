package com.tbproxy.gateway.exception;

import com.tbproxy.common.dto.telemetry.InvalidTelemetryException;
import com.tbproxy.common.error.FailureCause;
import com.tbproxy.common.error.InternalFailure;
import com.tbproxy.common.error.NotFoundFailure;
import com.tbproxy.common.error.UpstreamFailure;
import com.tbproxy.common.error.ValidationFailure;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions raised anywhere in request handling to a {@link FailureCause}.
 * Anything not recognised is an internal error.
 */
public final class FailureClassifier {

    private FailureClassifier() {}

    public static FailureCause classify(Throwable error) {
        if (error instanceof ProxyException proxy) {
            return proxy.failure();
        }
        if (error instanceof InvalidTelemetryException invalid) {
            return ValidationFailure.invalid("Invalid telemetry payload", invalid.getErrors());
        }
        if (error instanceof ServerWebInputException input) {
            return ValidationFailure.badRequest(input.getReason() != null ? input.getReason() : "Malformed request", List.of());
        }
        if (error instanceof ResponseStatusException status && status.getStatusCode().is4xxClientError()) {
            if (status.getStatusCode().value() == 404) {
                return new NotFoundFailure(status.getReason() != null ? status.getReason() : "resource");
            }
            return new ValidationFailure(status.getStatusCode().value(),
                    status.getReason() != null ? status.getReason() : "Request rejected", List.of());
        }
        if (error instanceof TimeoutException) {
            return new UpstreamFailure(null, "Upstream call timed out");
        }
        if (error instanceof WebClientResponseException response) {
            return new UpstreamFailure(response.getStatusCode().value(), response.getMessage());
        }
        if (error instanceof WebClientRequestException request) {
            return new UpstreamFailure(null, request.getMessage());
        }
        return new InternalFailure(error);
    }
}
