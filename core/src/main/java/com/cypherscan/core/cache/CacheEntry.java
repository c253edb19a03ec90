package com.cypherscan.core.cache;

import java.util.concurrent.atomic.AtomicLong;

/** TTL 이 붙은 캐시 레코드. now - createdAt > ttl 이면 논리적으로 없음. */
public final class CacheEntry<T> {
    private final T payload;
    private final long createdAt;
    private final long ttlMillis;
    private final AtomicLong accessCount = new AtomicLong(0);

    CacheEntry(T payload, long createdAt, long ttlMillis) {
        this.payload = payload;
        this.createdAt = createdAt;
        this.ttlMillis = ttlMillis;
    }

    public T payload() { return payload; }
    public long createdAt() { return createdAt; }
    public long ttlMillis() { return ttlMillis; }
    public long accessCount() { return accessCount.get(); }

    public boolean isExpired(long now) {
        return now - createdAt > ttlMillis;
    }

    void touch() { accessCount.incrementAndGet(); }
}
