package com.itsm.watchtower.models.audit;

/**
 * Logical resource addressed by a request path.
 *
 * @param resourceType collection name, {@link #UNKNOWN_TYPE} when the path is not an API path
 * @param resourceId   member id or {@code null} for collection level requests
 */
public record ResourceInfo(String resourceType, String resourceId) {

    public static final String UNKNOWN_TYPE = "unknown";

    public static ResourceInfo unknown() {
        return new ResourceInfo(UNKNOWN_TYPE, null);
    }

    public boolean hasId() {
        return resourceId != null;
    }
}
