package com.tbproxy.common.error;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps a {@link FailureCause} to the {@link NormalizedError} returned to callers.
 *
 * In standard mode the message is the code's generic text and details are
 * limited to the cause's public fields. In verbose mode the internal message
 * and internal details are included as well. Configured secrets and bearer
 * tokens are redacted in both modes.
 */
public final class ErrorNormalizer {

    static final String REDACTED = "***";

    private static final Pattern BEARER_TOKEN = Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._~+/=-]+");

    private final boolean verbose;
    private final List<String> secrets;
    private final Clock clock;

    public ErrorNormalizer(boolean verbose, Collection<String> secrets, Clock clock) {
        this.verbose = verbose;
        this.secrets = secrets.stream()
                .filter(secret -> secret != null && !secret.isBlank())
                .collect(Collectors.toUnmodifiableList());
        this.clock = clock;
    }

    public static ErrorNormalizer standard() {
        return new ErrorNormalizer(false, List.of(), Clock.systemUTC());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public NormalizedError normalize(FailureCause cause) {
        return normalize(cause, null);
    }

    public NormalizedError normalize(FailureCause cause, String path) {
        ErrorCode code = cause.code();

        String message = verbose && cause.internalMessage() != null
                ? redact(cause.internalMessage())
                : code.getGenericMessage();

        Map<String, Object> details = new LinkedHashMap<>(cause.publicDetails());
        if (verbose) {
            cause.internalDetails().forEach((key, value) -> details.put(key, redactValue(value)));
        }

        return new NormalizedError(
                cause.status(),
                code,
                message,
                details,
                clock.millis(),
                path
        );
    }

    String redact(String text) {
        if (text == null) {
            return null;
        }
        String result = BEARER_TOKEN.matcher(text).replaceAll("$1" + Matcher.quoteReplacement(REDACTED));
        for (String secret : secrets) {
            result = result.replace(secret, REDACTED);
        }
        return result;
    }

    private Object redactValue(Object value) {
        if (value instanceof String text) {
            return redact(text);
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(this::redactValue).collect(Collectors.toList());
        }
        return value;
    }
}
