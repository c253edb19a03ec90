package com.cypherscan.core.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactCacheTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    @Test
    void hit_within_ttl_and_miss_after_expiry() {
        FrozenClock clk = new FrozenClock(0);
        ArtifactCache<String> cache = new ArtifactCache<>("t", 10, TTL, clk);
        cache.put("k", "v");

        clk.plusMillis(TTL.toMillis()); // now - createdAt == ttl → 아직 유효
        assertThat(cache.get("k")).contains("v");

        clk.plusMillis(1);
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero(); // 읽기 시 제거
        assertThat(cache.stats().expirations()).isEqualTo(1);
    }

    @Test
    void get_or_load_calls_loader_once_within_ttl() {
        FrozenClock clk = new FrozenClock(0);
        ArtifactCache<List<String>> cache = new ArtifactCache<>("t", 10, TTL, clk);
        AtomicInteger loads = new AtomicInteger();

        List<String> first = cache.getOrLoad("repo:path", () -> { loads.incrementAndGet(); return List.of("a"); });
        List<String> second = cache.getOrLoad("repo:path", () -> { loads.incrementAndGet(); return List.of("b"); });
        assertThat(second).isSameAs(first);
        assertThat(loads.get()).isEqualTo(1);

        clk.plusMillis(TTL.toMillis() + 1);
        List<String> third = cache.getOrLoad("repo:path", () -> { loads.incrementAndGet(); return List.of("c"); });
        assertThat(third).containsExactly("c");
        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void loader_failure_is_not_cached() {
        ArtifactCache<String> cache = new ArtifactCache<>("t", 10, TTL, new FrozenClock(0));
        assertThatThrownBy(() -> cache.getOrLoad("k", () -> { throw new IllegalStateException("upstream down"); }))
                .isInstanceOf(IllegalStateException.class);
        assertThat(cache.contains("k")).isFalse();
        assertThat(cache.getOrLoad("k", () -> "ok")).isEqualTo("ok");
    }

    @Test
    void capacity_evicts_least_used_entry() {
        FrozenClock clk = new FrozenClock(0);
        ArtifactCache<String> cache = new ArtifactCache<>("t", 3, TTL, clk);
        cache.put("a", "1"); clk.plusMillis(1);
        cache.put("b", "2"); clk.plusMillis(1);
        cache.put("c", "3");
        cache.get("a"); cache.get("a");
        cache.get("c");

        cache.put("d", "4"); // b 는 한 번도 읽히지 않음

        assertThat(cache.contains("b")).isFalse();
        assertThat(cache.contains("a")).isTrue();
        assertThat(cache.contains("c")).isTrue();
        assertThat(cache.contains("d")).isTrue();
        assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    void eviction_tie_breaks_on_oldest() {
        FrozenClock clk = new FrozenClock(0);
        ArtifactCache<String> cache = new ArtifactCache<>("t", 2, TTL, clk);
        cache.put("old", "1"); clk.plusMillis(5);
        cache.put("new", "2");
        cache.put("newer", "3");

        assertThat(cache.contains("old")).isFalse();
        assertThat(cache.contains("new")).isTrue();
    }

    @Test
    void overwriting_existing_key_does_not_evict() {
        ArtifactCache<String> cache = new ArtifactCache<>("t", 2, TTL, new FrozenClock(0));
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("a", "1b");
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get("a")).contains("1b");
    }

    @Test
    void sweep_removes_expired_entries_without_reads() {
        FrozenClock clk = new FrozenClock(0);
        ArtifactCache<String> cache = new ArtifactCache<>("t", 10, TTL, clk);
        cache.put("short", "x", Duration.ofSeconds(1));
        cache.put("long", "y");

        clk.plusMillis(2_000);
        assertThat(cache.sweep()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.contains("long")).isTrue();
    }

    @Test
    void background_sweep_runs_on_interval() throws Exception {
        FrozenClock clk = new FrozenClock(0);
        try (ArtifactCache<String> cache = new ArtifactCache<>("bg", 10, Duration.ofMillis(10), Duration.ofMillis(20), clk)) {
            cache.put("k", "v");
            clk.plusMillis(1_000);

            long deadline = System.currentTimeMillis() + 2_000;
            while (cache.size() > 0 && System.currentTimeMillis() < deadline) Thread.sleep(10);
            assertThat(cache.size()).isZero();
        }
    }

    @Test
    void stats_track_hit_rate() {
        ArtifactCache<String> cache = new ArtifactCache<>("t", 10, TTL, new FrozenClock(0));
        cache.put("k", "v");
        cache.get("k");
        cache.get("k");
        cache.get("missing");

        ArtifactCache.Stats s = cache.stats();
        assertThat(s.hits()).isEqualTo(2);
        assertThat(s.misses()).isEqualTo(1);
        assertThat(s.hitRate()).isCloseTo(2.0 / 3, org.assertj.core.data.Offset.offset(1e-9));
        assertThat(s.capacity()).isEqualTo(10);
    }

    @Test
    void concurrent_puts_respect_capacity() throws Exception {
        ArtifactCache<Integer> cache = new ArtifactCache<>("t", 50, TTL, CacheClock.SYSTEM);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 8; t++) {
            final int base = t * 1000;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    cache.put("k" + (base + i), i);
                    cache.get("k" + (base + i / 2));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(cache.size()).isLessThanOrEqualTo(50);
    }
}
