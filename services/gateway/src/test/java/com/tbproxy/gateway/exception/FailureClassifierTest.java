package com.tbproxy.gateway.exception;

import com.tbproxy.common.dto.telemetry.InvalidTelemetryException;
import com.tbproxy.common.error.ErrorCode;
import com.tbproxy.common.error.FailureCause;
import com.tbproxy.common.error.UpstreamFailure;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    @Test
    void shouldUseFailureOfProxyExceptions() {
        assertEquals(ErrorCode.UPSTREAM_ERROR, FailureClassifier.classify(new UpstreamException(500, "boom")).code());
        assertEquals(ErrorCode.RESOURCE_NOT_FOUND, FailureClassifier.classify(new ResourceNotFoundException("Device x")).code());

        FailureCause badRequest = FailureClassifier.classify(new RequestValidationException("No device data provided"));
        assertEquals(ErrorCode.VALIDATION_ERROR, badRequest.code());
        assertEquals(400, badRequest.status());
    }

    @Test
    void shouldTreatInvalidTelemetryAsUnprocessable() {
        FailureCause failure = FailureClassifier.classify(
                new InvalidTelemetryException(List.of("temperature: must be a non-empty array")));

        assertEquals(422, failure.status());
        assertEquals(List.of("temperature: must be a non-empty array"), failure.internalDetails().get("validation_errors"));
    }

    @Test
    void shouldTreatUnreadableInputAsBadRequest() {
        FailureCause failure = FailureClassifier.classify(new ServerWebInputException("Failed to read HTTP message"));

        assertEquals(ErrorCode.VALIDATION_ERROR, failure.code());
        assertEquals(400, failure.status());
    }

    @Test
    void shouldKeepStatusOfOtherClientErrors() {
        FailureCause failure = FailureClassifier.classify(new ResponseStatusException(HttpStatus.METHOD_NOT_ALLOWED));

        assertEquals(ErrorCode.VALIDATION_ERROR, failure.code());
        assertEquals(405, failure.status());
    }

    @Test
    void shouldTreatClientErrorsAsUpstream() {
        FailureCause response = FailureClassifier.classify(WebClientResponseException.create(
                HttpStatus.BAD_GATEWAY, "Bad Gateway", new HttpHeaders(), new byte[0], null, null));
        assertEquals(new UpstreamFailure(502, response.internalMessage()), response);

        assertEquals(ErrorCode.UPSTREAM_ERROR, FailureClassifier.classify(new TimeoutException()).code());
    }

    @Test
    void shouldTreatAnythingElseAsInternal() {
        FailureCause failure = FailureClassifier.classify(new NullPointerException("oops"));

        assertEquals(ErrorCode.INTERNAL_ERROR, failure.code());
        assertEquals(500, failure.status());
    }
}
