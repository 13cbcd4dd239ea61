package com.explify.sidecar.service;

import com.explify.sidecar.config.ModeConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.TimeMeter;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Fixed-window request limits per caller key. Each key owns a Bucket4j bucket whose whole capacity
 * is restored once per window, so a caller never gets more than the limit inside one window.
 * Local mode is unlimited.
 *
 * <p>Buckets live in a bounded Caffeine cache. A key idle for longer than a window loses nothing
 * by eviction, since its bucket would be full again anyway. Once more than
 * {@code app.rate-limit.max-tracked-keys} callers are active inside one window the cache may evict
 * a live bucket, and that caller starts the window over with a full budget. Size the cap above the
 * expected number of concurrent callers.</p>
 */
@Service
public class RateLimitService {
    private static final Logger log = LoggerFactory.getLogger(RateLimitService.class);

    public enum RouteClass {
        ANALYZE,
        UNLIMITED
    }

    private final ModeConfig modeConfig;
    private final boolean enabled;
    private final long analyzeLimit;
    private final Duration analyzeWindow;
    private final List<String> analyzePaths;
    private final TimeMeter timeMeter;
    private final Cache<String, Bucket> bucketCache;

    @Autowired
    public RateLimitService(ModeConfig modeConfig,
                            @Value("${app.rate-limit.enabled:true}") boolean enabled,
                            @Value("${app.rate-limit.analyze.limit:30}") long analyzeLimit,
                            @Value("${app.rate-limit.analyze.window-seconds:60}") long analyzeWindowSeconds,
                            @Value("${app.rate-limit.analyze.paths:/analyze/}") String analyzePaths,
                            @Value("${app.rate-limit.max-tracked-keys:10000}") long maxTrackedKeys) {
        this(modeConfig, enabled, analyzeLimit, Duration.ofSeconds(analyzeWindowSeconds), analyzePaths, maxTrackedKeys, TimeMeter.SYSTEM_MILLISECONDS);
    }

    RateLimitService(ModeConfig modeConfig, boolean enabled, long analyzeLimit, Duration analyzeWindow, String analyzePaths,
                     long maxTrackedKeys, TimeMeter timeMeter) {
        if (analyzeLimit < 1L) {
            throw new IllegalArgumentException("app.rate-limit.analyze.limit must be positive");
        }
        if (maxTrackedKeys < 1L) {
            throw new IllegalArgumentException("app.rate-limit.max-tracked-keys must be positive");
        }
        Duration idleExpiry = analyzeWindow.compareTo(Duration.ofHours(1L)) > 0 ? analyzeWindow : Duration.ofHours(1L);
        this.bucketCache = Caffeine.newBuilder()
                .maximumSize(maxTrackedKeys)
                .expireAfterAccess(idleExpiry)
                .build();
        this.modeConfig = modeConfig;
        this.enabled = enabled;
        this.analyzeLimit = analyzeLimit;
        this.analyzeWindow = analyzeWindow;
        this.analyzePaths = Arrays.stream(analyzePaths.split(","))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        this.timeMeter = timeMeter;
        log.info("Rate limiting: enabled={}, mode={}, analyze={} per {}s on {}, tracking at most {} keys",
                enabled, modeConfig.getMode(), analyzeLimit, analyzeWindow.getSeconds(), this.analyzePaths, maxTrackedKeys);
    }

    public RouteClass classify(String path) {
        if (path != null) {
            for (String prefix : this.analyzePaths) {
                if (path.startsWith(prefix) || path.equals(stripTrailingSlash(prefix))) {
                    return RouteClass.ANALYZE;
                }
            }
        }
        return RouteClass.UNLIMITED;
    }

    /**
     * Consumes one request from the caller's budget for the route class.
     *
     * @param key identity when known, otherwise the client address
     */
    public RateLimitDecision check(String key, RouteClass routeClass) {
        if (!this.enabled || this.modeConfig.isLocal() || routeClass != RouteClass.ANALYZE) {
            return RateLimitDecision.unlimited();
        }
        Bucket bucket = this.bucketCache.get(routeClass.name() + ":" + key, k -> this.createBucket());
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1L);
        if (probe.isConsumed()) {
            return RateLimitDecision.allowed(this.analyzeLimit, probe.getRemainingTokens());
        }
        long retryAfter = (long)Math.ceil(probe.getNanosToWaitForRefill() / 1_000_000_000.0);
        return RateLimitDecision.exceeded(this.analyzeLimit, Math.max(1L, retryAfter));
    }

    private Bucket createBucket() {
        Bandwidth limit = Bandwidth.builder()
                .capacity(this.analyzeLimit)
                .refillIntervally(this.analyzeLimit, this.analyzeWindow)
                .build();
        return Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(this.timeMeter)
                .build();
    }

    private static String stripTrailingSlash(String prefix) {
        return prefix.endsWith("/") && prefix.length() > 1 ? prefix.substring(0, prefix.length() - 1) : prefix;
    }
}
