package com.tbproxy.common.dto.attribute;

/**
 * Writable device attribute scopes on the platform.
 */
public enum AttributeScope {
    /** Managed by server applications; not visible to the device. */
    SERVER_SCOPE("server-side"),
    /** Pushed to the device, typically configuration and setpoints. */
    SHARED_SCOPE("shared");

    private final String label;

    AttributeScope(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
