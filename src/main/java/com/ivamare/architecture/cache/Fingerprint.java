package com.ivamare.architecture.cache;

/**
 * Deterministic cache key for a request.
 *
 * @param requestType Fully qualified request class name
 * @param digest SHA-256 hex digest of the canonical payload
 */
public record Fingerprint(String requestType, String digest) {

    public Fingerprint {
        if (requestType == null || requestType.isBlank()) {
            throw new IllegalArgumentException("requestType is required");
        }
        if (digest == null || digest.isBlank()) {
            throw new IllegalArgumentException("digest is required");
        }
    }

    @Override
    public String toString() {
        return requestType + "@" + digest.substring(0, Math.min(12, digest.length()));
    }
}
