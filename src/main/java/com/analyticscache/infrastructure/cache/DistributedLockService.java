package com.analyticscache.infrastructure.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Time-bounded distributed locks on top of SET NX EX.
 *
 * Acquire never blocks: denial means another instance holds the lock.
 * Release is compare-and-delete on the owner token, so a holder whose lock
 * expired and was taken over cannot delete the new owner's lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DistributedLockService {

    private static final String INSTANCE_ID = ManagementFactory.getRuntimeMXBean().getName();

    private final CacheStore cacheStore;

    public Optional<LockHandle> tryAcquire(String lockKey, Duration ttl) {
        String token = INSTANCE_ID + ":" + UUID.randomUUID();
        if (cacheStore.setIfAbsent(lockKey, token, ttl)) {
            log.debug("Lock acquired: key={}, ttl={}s", lockKey, ttl.toSeconds());
            return Optional.of(new LockHandle(lockKey, token, Instant.now()));
        }
        log.debug("Lock held elsewhere: key={}", lockKey);
        return Optional.empty();
    }

    /**
     * @return false when the lock had already expired or changed owner
     */
    public boolean release(LockHandle handle) {
        boolean released = cacheStore.deleteIfValueEquals(handle.getKey(), handle.getOwnerToken());
        if (released) {
            log.debug("Lock released: key={}", handle.getKey());
        } else {
            log.warn("Lock ownership changed before release, skipping: key={}", handle.getKey());
        }
        return released;
    }

    public boolean isLocked(String lockKey) {
        return cacheStore.get(lockKey) != null;
    }
}
