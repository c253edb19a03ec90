package com.cypherscan.core.util;

import com.cypherscan.core.model.ScanConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * scan.yml → ScanConfig. 없는 키는 기본값 유지.
 *
 * dispatch:
 *   concurrency: 4
 *   analyzerTimeoutMs: 120000
 *   pipelineThreads: 2
 * consensus:
 *   quorumThreshold: 0.6
 *   minimumVotes: 0            # 0 = max(1, floor(analyzers/2))
 *   votingTimeoutMs: 300000
 *   weightingEnabled: false
 *   rejectVoteConfidence: 50
 *   weights: { static-code: 1.0, defi-risk: 0.8 }
 * fetch:
 *   extensions: [".sol"]       # "a,b" 형태도 허용
 *   githubApiBase: "https://api.github.com"
 *   httpTimeoutMs: 10000
 * cache:
 *   ttlMinutes: 10
 *   capacity: 10000
 *   sweepIntervalMinutes: 5
 * retentionMinutes: 0
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ScanConfig loadDefault() throws IOException {
        return load(Path.of("scan.yml"));
    }

    public static ScanConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scan.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** @throws IllegalArgumentException 값이 범위를 벗어나면 (ScanConfig.validate) */
    public static ScanConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ScanConfig cfg = ScanConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            cfg.validate();
            return cfg;
        }

        // 1) dispatch
        Map<?, ?> dispatch = getMap(map, "dispatch");
        if (dispatch != null) {
            setInt(dispatch, "concurrency", cfg::setConcurrency);
            setMillis(dispatch, "analyzerTimeoutMs", cfg::setAnalyzerTimeout);
            setInt(dispatch, "pipelineThreads", cfg::setPipelineThreads);
        }

        // 2) consensus
        Map<?, ?> consensus = getMap(map, "consensus");
        if (consensus != null) {
            setDouble(consensus, "quorumThreshold", cfg::setQuorumThreshold);
            setInt(consensus, "minimumVotes", cfg::setMinimumVotes);
            setMillis(consensus, "votingTimeoutMs", cfg::setVotingTimeout);
            setBoolean(consensus, "weightingEnabled", cfg::setWeightingEnabled);
            setDouble(consensus, "rejectVoteConfidence", cfg::setRejectVoteConfidence);
            Map<?, ?> weights = getMap(consensus, "weights");
            if (weights != null) {
                Map<String, Double> w = new LinkedHashMap<>();
                weights.forEach((k, v) -> w.put(String.valueOf(k), toDouble(v)));
                cfg.setAnalyzerWeights(w);
            }
        }

        // 3) fetch
        Map<?, ?> fetch = getMap(map, "fetch");
        if (fetch != null) {
            setStringList(fetch, "extensions", cfg::setSourceExtensions);
            setString(fetch, "githubApiBase", cfg::setGithubApiBase);
            setMillis(fetch, "httpTimeoutMs", cfg::setHttpTimeout);
        }

        // 4) cache
        Map<?, ?> cache = getMap(map, "cache");
        if (cache != null) {
            ScanConfig.CacheCfg c = cfg.getCache();
            setMinutes(cache, "ttlMinutes", c::setTtl);
            setInt(cache, "capacity", c::setCapacity);
            setMinutes(cache, "sweepIntervalMinutes", c::setSweepInterval);
        }

        // 5) retention
        setMinutes(map, "retentionMinutes", cfg::setRetention);

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v).trim());
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            for (String p : String.valueOf(v).split("\\s*,\\s*")) if (!p.isBlank()) out.add(p.trim());
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(toDouble(v));
    }

    private static double toDouble(Object v) {
        if (v instanceof Number n) return n.doubleValue();
        return Double.parseDouble(String.valueOf(v).trim());
    }

    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms));
    }

    private static void setMinutes(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long min = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMinutes(min));
    }
}
