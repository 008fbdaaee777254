package com.mingle.backend.modules.post.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a post, derived from its fixed expiry instant and the current time.
 * A post is expired from {@code expiresAt} onwards; the state is never stored.
 */
public enum PostLifecycle {
    LIVE("Live"),
    EXPIRED("Expired");

    private final String label;

    PostLifecycle(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean acceptsInteractions() {
        return this == LIVE;
    }

    public static PostLifecycle at(OffsetDateTime expiresAt, OffsetDateTime now) {
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(now, "now");
        return isExpired(expiresAt, now) ? EXPIRED : LIVE;
    }

    public static boolean isExpired(OffsetDateTime expiresAt, OffsetDateTime now) {
        return !now.isBefore(expiresAt);
    }
}
