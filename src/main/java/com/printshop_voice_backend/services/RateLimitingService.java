package com.printshop_voice_backend.services;

import com.printshop_voice_backend.config.VoicePipelineProperties;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@RequiredArgsConstructor
@Slf4j
public class RateLimitingService {

    public static final String SESSION_LIMIT_MESSAGE = "Too many requests in this voice session. Please slow down.";

    private final VoicePipelineProperties properties;

    // Per-session rate limiting buckets
    private final Map<String, Bucket> sessionBuckets = new ConcurrentHashMap<>();

    /**
     * Consume one turn from the session's per-minute allowance.
     */
    public void checkSessionRateLimit(String sessionId) {
        if (sessionId == null) {
            return;
        }

        Bucket sessionBucket = getSessionBucket(sessionId);
        if (!sessionBucket.tryConsume(1)) {
            log.warn("Session rate limit exceeded for session: {}", sessionId);
            throw new RateLimitExceededException(SESSION_LIMIT_MESSAGE, 60);
        }
    }

    public long getAvailableTurns(String sessionId) {
        return getSessionBucket(sessionId).getAvailableTokens();
    }

    public void releaseSession(String sessionId) {
        if (sessionId != null) {
            sessionBuckets.remove(sessionId);
        }
    }

    public int getTrackedSessionCount() {
        return sessionBuckets.size();
    }

    private Bucket getSessionBucket(String sessionId) {
        return sessionBuckets.computeIfAbsent(sessionId, id -> createSessionBucket());
    }

    private Bucket createSessionBucket() {
        int turnsPerMinute = properties.getTurnsPerMinute();
        Bandwidth limit = Bandwidth.classic(turnsPerMinute,
                Refill.intervally(turnsPerMinute, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }
}
