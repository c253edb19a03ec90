package com.cypherscan.core.util;

import com.cypherscan.core.model.ScanConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private static ScanConfig parse(String yaml) {
        return YamlConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void loads_all_sections() throws IOException {
        Path file = tmp.resolve("scan.yml");
        Files.writeString(file, """
                dispatch:
                  concurrency: 2
                  analyzerTimeoutMs: 30000
                consensus:
                  quorumThreshold: 0.75
                  minimumVotes: 3
                  votingTimeoutMs: 60000
                  weightingEnabled: true
                  weights:
                    static-code: 1.5
                    defi-risk: 0.5
                fetch:
                  extensions: "sol, vy"
                  githubApiBase: "http://localhost:8080"
                cache:
                  ttlMinutes: 3
                  capacity: 50
                retentionMinutes: 60
                """);

        ScanConfig cfg = YamlConfigLoader.load(file);

        assertThat(cfg.getConcurrency()).isEqualTo(2);
        assertThat(cfg.getAnalyzerTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(cfg.getQuorumThreshold()).isEqualTo(0.75);
        assertThat(cfg.getMinimumVotes()).isEqualTo(3);
        assertThat(cfg.getVotingTimeout()).isEqualTo(Duration.ofMinutes(1));
        assertThat(cfg.isWeightingEnabled()).isTrue();
        assertThat(cfg.getAnalyzerWeights()).containsEntry("static-code", 1.5).containsEntry("defi-risk", 0.5);
        assertThat(cfg.getSourceExtensions()).containsExactly(".sol", ".vy");
        assertThat(cfg.getGithubApiBase()).isEqualTo("http://localhost:8080");
        assertThat(cfg.getCache().getTtl()).isEqualTo(Duration.ofMinutes(3));
        assertThat(cfg.getCache().getCapacity()).isEqualTo(50);
        assertThat(cfg.getRetention()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void missing_keys_keep_defaults() {
        ScanConfig cfg = parse("consensus:\n  quorumThreshold: 0.5\n");
        assertThat(cfg.getQuorumThreshold()).isEqualTo(0.5);
        assertThat(cfg.getConcurrency()).isEqualTo(4);
        assertThat(cfg.getSourceExtensions()).containsExactly(".sol");
    }

    @Test
    void empty_document_yields_defaults() {
        assertThat(parse("").getVotingTimeout()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void out_of_range_values_are_rejected() {
        assertThatThrownBy(() -> parse("consensus:\n  quorumThreshold: 1.5\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quorumThreshold");
    }

    @Test
    void missing_file_is_reported() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("scan.yml not found");
    }
}
