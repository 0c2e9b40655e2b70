package com.rcatrail.service;

import com.rcatrail.config.RcaTrailProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Keeps one batch id from being processed twice at the same time, or again
 * after it completed.
 *
 * HOW IT WORKS:
 *   1. Before processing, call tryAcquire(batchId)
 *   2. This SETs "rcatrail:batch:{batchId}" in Redis with the NX flag
 *   3. SET succeeded → first claim, process the batch
 *   4. SET failed    → another worker has it or it is already done, skip it
 *   5. If processing fails, release(batchId) so the batch can be retried from scratch
 *
 * The key expires after rcatrail.dedup.ttl (24h by default).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchDeduplicationService {

    static final String KEY_PREFIX = "rcatrail:batch:";

    private final StringRedisTemplate redisTemplate;
    private final RcaTrailProperties properties;

    /**
     * @return true if the caller now owns the batch, false if it was claimed already
     */
    public boolean tryAcquire(String batchId) {
        if (batchId == null || batchId.isBlank()) {
            return true; // no id, nothing to dedup on
        }
        Boolean wasSet = redisTemplate.opsForValue()
                .setIfAbsent(KEY_PREFIX + batchId, "1", properties.getDedup().getTtl());

        if (Boolean.TRUE.equals(wasSet)) {
            return true;
        }
        log.warn("Batch already claimed: batchId={}", batchId);
        return false;
    }

    public void release(String batchId) {
        if (batchId == null || batchId.isBlank()) {
            return;
        }
        redisTemplate.delete(KEY_PREFIX + batchId);
        log.info("Released batch claim for retry: batchId={}", batchId);
    }
}
