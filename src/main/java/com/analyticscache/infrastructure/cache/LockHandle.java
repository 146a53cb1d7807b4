package com.analyticscache.infrastructure.cache;

import lombok.Value;

import java.time.Instant;

/**
 * A held distributed lock. Only the holder of the owner token may release it.
 */
@Value
public class LockHandle {

    String key;
    String ownerToken;
    Instant acquiredAt;
}
