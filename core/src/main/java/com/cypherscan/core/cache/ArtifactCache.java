package com.cypherscan.core.cache;

import com.cypherscan.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 범용 TTL 캐시.
 *  - 용량 초과 시 접근 횟수가 가장 적은 엔트리 축출(동률이면 오래된 것)
 *  - 읽기 시 만료 엔트리는 없는 것으로 보고 제거
 *  - sweepInterval 이 주어지면 데몬 스케줄러가 주기적으로 만료 엔트리 정리
 *
 * 여러 스캔이 동시에 공유한다. 조회는 lock-free, 삽입/축출만 직렬화.
 */
public final class ArtifactCache<T> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactCache.class);

    private final String name;
    private final int capacity;
    private final long defaultTtlMillis;
    private final CacheClock clock;
    private final Map<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();
    private final ScheduledExecutorService sweeper; // nullable

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public ArtifactCache(String name, int capacity, Duration defaultTtl, Duration sweepInterval, CacheClock clock) {
        this.name = Objects.requireNonNull(name, "name");
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero())
            throw new IllegalArgumentException("defaultTtl must be > 0");
        this.capacity = capacity;
        this.defaultTtlMillis = defaultTtl.toMillis();
        this.clock = (clock == null ? CacheClock.SYSTEM : clock);

        if (sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative()) {
            long every = sweepInterval.toMillis();
            this.sweeper = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory(name + "-sweep"));
            this.sweeper.scheduleAtFixedRate(this::sweepQuietly, every, every, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }
    }

    /** 스케줄러 없이(테스트용) */
    public ArtifactCache(String name, int capacity, Duration defaultTtl, CacheClock clock) {
        this(name, capacity, defaultTtl, null, clock);
    }

    /* ===== 조회 ===== */

    public Optional<T> get(String key) {
        CacheEntry<T> e = entries.get(key);
        if (e == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (e.isExpired(clock.nowMillis())) {
            if (entries.remove(key, e)) expirations.incrementAndGet();
            misses.incrementAndGet();
            return Optional.empty();
        }
        e.touch();
        hits.incrementAndGet();
        return Optional.ofNullable(e.payload());
    }

    public boolean contains(String key) {
        CacheEntry<T> e = entries.get(key);
        return e != null && !e.isExpired(clock.nowMillis());
    }

    /** 히트면 캐시 값, 미스면 loader 결과를 저장 후 반환. loader 예외는 그대로 전파(캐시에 남기지 않음). */
    public T getOrLoad(String key, Supplier<T> loader) {
        return getOrLoad(key, loader, null);
    }

    public T getOrLoad(String key, Supplier<T> loader, Duration ttl) {
        Optional<T> cached = get(key);
        if (cached.isPresent()) {
            LOG.debug("[{}] cache hit: {}", name, key);
            return cached.get();
        }
        LOG.debug("[{}] cache miss: {}", name, key);
        T value = loader.get();
        if (value != null) put(key, value, ttl);
        return value;
    }

    /* ===== 갱신 ===== */

    public void put(String key, T value) { put(key, value, null); }

    public synchronized void put(String key, T value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long ttlMs = (ttl == null || ttl.isZero() || ttl.isNegative()) ? defaultTtlMillis : ttl.toMillis();

        if (!entries.containsKey(key) && entries.size() >= capacity) {
            evictLeastUsed();
        }
        entries.put(key, new CacheEntry<>(value, clock.nowMillis(), ttlMs));
    }

    public boolean invalidate(String key) {
        return entries.remove(key) != null;
    }

    public void clear() {
        entries.clear();
    }

    /** 만료 엔트리 제거. 제거 개수 반환. */
    public int sweep() {
        long now = clock.nowMillis();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<T>> en : entries.entrySet()) {
            if (en.getValue().isExpired(now) && entries.remove(en.getKey(), en.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            expirations.addAndGet(removed);
            LOG.debug("[{}] sweep removed {} expired entries", name, removed);
        }
        return removed;
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // 스케줄러는 예외가 나면 이후 실행을 멈추므로 여기서 기록만 한다
            LOG.warn("[{}] sweep failed: {}", name, e.toString());
        }
    }

    private void evictLeastUsed() {
        String victim = null;
        CacheEntry<T> worst = null;
        for (Map.Entry<String, CacheEntry<T>> en : entries.entrySet()) {
            CacheEntry<T> e = en.getValue();
            if (worst == null
                    || e.accessCount() < worst.accessCount()
                    || (e.accessCount() == worst.accessCount() && e.createdAt() < worst.createdAt())) {
                worst = e;
                victim = en.getKey();
            }
        }
        if (victim != null && entries.remove(victim, worst)) {
            evictions.incrementAndGet();
            LOG.debug("[{}] evicted least-used entry: {} (hits={})", name, victim, worst.accessCount());
        }
    }

    /* ===== 통계 ===== */

    public int size() { return entries.size(); }

    public Stats stats() {
        long h = hits.get();
        long m = misses.get();
        double rate = (h + m == 0) ? 0.0 : (double) h / (h + m);
        return new Stats(entries.size(), capacity, h, m, evictions.get(), expirations.get(), rate);
    }

    public record Stats(int size, int capacity, long hits, long misses,
                        long evictions, long expirations, double hitRate) {}

    @Override public void close() {
        if (sweeper != null) sweeper.shutdownNow();
    }
}
