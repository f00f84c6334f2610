package com.tbproxy.gateway.client;

import java.util.List;

/**
 * Confirmation that the platform stored a target's telemetry.
 *
 * @param acceptedKeys  metric keys that were sent
 * @param acceptedCount number of samples that were sent
 */
public record UploadAck(
    List<String> acceptedKeys,
    int acceptedCount
) {
    public UploadAck {
        acceptedKeys = List.copyOf(acceptedKeys);
    }
}
