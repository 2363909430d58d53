package com.flagship.job_ledger.costing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Request-key lookups for manual cost item creation.
 *
 * Redis is the fast path, {@code cost_items.request_key} the source of truth.
 * Redis failures fall back to the database and never fail the request.
 */
@Service
@Slf4j
public class CostItemIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "cost-item-request:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final CostItemRepository costItemRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public CostItemIdempotencyService(CostItemRepository costItemRepository,
                                      Optional<RedisTemplate<String, String>> redisTemplate) {
        this.costItemRepository = costItemRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Request keys are scoped to the job they were sent for.
     */
    public static String scopedKey(UUID jobId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }
        return jobId + ":" + idempotencyKey.trim();
    }

    /**
     * @return the cost item id stored under this request key, if any
     */
    public Optional<UUID> findCostItemId(String requestKey) {
        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + requestKey);
                if (cached != null) {
                    log.debug("Request key found in Redis: {}", requestKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for request key: {}. Falling back to database. Error: {}",
                        requestKey, e.getMessage());
            }
        }

        Optional<UUID> stored = costItemRepository.findByRequestKey(requestKey).map(CostItemEntity::getId);
        stored.ifPresent(id -> {
            log.debug("Request key found in database: {}", requestKey);
            cache(requestKey, id);
        });
        return stored;
    }

    public void remember(String requestKey, UUID costItemId) {
        cache(requestKey, costItemId);
    }

    /**
     * Drops a cached mapping whose item no longer exists.
     */
    public void forget(String requestKey) {
        redisTemplate.ifPresent(template -> {
            try {
                template.delete(REDIS_KEY_PREFIX + requestKey);
            } catch (RuntimeException e) {
                log.debug("Failed to evict request key from Redis: {}", e.getMessage());
            }
        });
    }

    private void cache(String requestKey, UUID costItemId) {
        redisTemplate.ifPresent(template -> {
            try {
                template.opsForValue().set(REDIS_KEY_PREFIX + requestKey, costItemId.toString(), REDIS_TTL);
            } catch (RuntimeException e) {
                log.debug("Failed to cache request key in Redis: {}", e.getMessage());
            }
        });
    }
}
