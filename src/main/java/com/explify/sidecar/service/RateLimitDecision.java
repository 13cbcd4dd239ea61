package com.explify.sidecar.service;

public final class RateLimitDecision {
    private static final RateLimitDecision UNLIMITED = new RateLimitDecision(true, -1L, -1L, 0L);

    private final boolean allowed;
    private final long limit;
    private final long remaining;
    private final long retryAfterSeconds;

    private RateLimitDecision(boolean allowed, long limit, long remaining, long retryAfterSeconds) {
        this.allowed = allowed;
        this.limit = limit;
        this.remaining = remaining;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RateLimitDecision unlimited() {
        return UNLIMITED;
    }

    public static RateLimitDecision allowed(long limit, long remaining) {
        return new RateLimitDecision(true, limit, remaining, 0L);
    }

    public static RateLimitDecision exceeded(long limit, long retryAfterSeconds) {
        return new RateLimitDecision(false, limit, 0L, retryAfterSeconds);
    }

    public boolean isAllowed() {
        return this.allowed;
    }

    public boolean isLimited() {
        return this.limit >= 0L;
    }

    public long getLimit() {
        return this.limit;
    }

    public long getRemaining() {
        return this.remaining;
    }

    public long getRetryAfterSeconds() {
        return this.retryAfterSeconds;
    }
}
