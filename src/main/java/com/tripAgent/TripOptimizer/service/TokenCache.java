package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.exception.ExternalApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * OAuth tokens of remote candidate providers, stored in Redis under {@code <provider>:access_token}.
 * <p>
 * Several source tasks may need a token at the same moment; {@link #getOrRefresh} lets only one
 * of them go to the token endpoint. Redis failures degrade to "no cached token".
 */
@Slf4j
@Component
public class TokenCache {

    /** Tokens this close to expiry are treated as expired. */
    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final StringRedisTemplate redisTemplate;
    private final ReentrantLock lock = new ReentrantLock();

    public TokenCache(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public record IssuedToken(String accessToken, Instant expiresAt) {}

    public String getOrRefresh(String provider, Supplier<IssuedToken> issuer) {
        if (isValid(provider)) {
            return getAccessToken(provider);
        }
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalApiException("Interrupted while waiting for a " + provider + " token", e);
        }
        try {
            // another task may have refreshed while we waited
            if (isValid(provider)) {
                return getAccessToken(provider);
            }
            log.info("🔑 Fetching new {} access token...", provider);
            IssuedToken token = issuer.get();
            store(provider, token);
            return token.accessToken();
        } finally {
            lock.unlock();
        }
    }

    public void store(String provider, IssuedToken token) {
        Duration ttl = Duration.between(Instant.now(), token.expiresAt());
        if (ttl.isNegative() || ttl.isZero()) {
            log.warn("Not caching already expired {} token", provider);
            return;
        }
        try {
            redisTemplate.opsForValue().set(tokenKey(provider), token.accessToken(), ttl);
            redisTemplate.opsForValue().set(expiryKey(provider), token.expiresAt().toString(), ttl);
            log.debug("🔐 Stored {} access token in Redis with TTL {}", provider, ttl);
        } catch (Exception e) {
            log.error("❌ Failed to store {} token in Redis: {}", provider, e.getMessage());
        }
    }

    public String getAccessToken(String provider) {
        try {
            return redisTemplate.opsForValue().get(tokenKey(provider));
        } catch (Exception e) {
            log.error("⚠️ Failed to retrieve {} token from Redis: {}", provider, e.getMessage());
            return null;
        }
    }

    public boolean isValid(String provider) {
        try {
            String expiry = redisTemplate.opsForValue().get(expiryKey(provider));
            if (expiry == null || getAccessToken(provider) == null) {
                return false;
            }
            boolean valid = Instant.parse(expiry).isAfter(Instant.now().plus(EXPIRY_MARGIN));
            if (!valid) {
                log.info("🕓 {} token expired or near expiry.", provider);
            }
            return valid;
        } catch (Exception e) {
            log.error("⚠️ Failed to validate {} token: {}", provider, e.getMessage());
            return false;
        }
    }

    public void clear(String provider) {
        try {
            redisTemplate.delete(tokenKey(provider));
            redisTemplate.delete(expiryKey(provider));
            log.info("🧹 Cleared cached {} token and expiry time.", provider);
        } catch (Exception e) {
            log.error("❌ Failed to clear {} token cache: {}", provider, e.getMessage());
        }
    }

    private static String tokenKey(String provider) {
        return provider + ":access_token";
    }

    private static String expiryKey(String provider) {
        return provider + ":expiry_time";
    }
}
