package com.cypherscan.core.model;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ScanConfigTest {

    @Test
    void defaultsAreValid() {
        ScanConfig cfg = ScanConfig.defaults();
        cfg.validate();

        assertThat(cfg.getConcurrency()).isEqualTo(4);
        assertThat(cfg.getAnalyzerTimeout()).isEqualTo(Duration.ofMinutes(2));
        assertThat(cfg.getQuorumThreshold()).isEqualTo(0.6);
        assertThat(cfg.getMinimumVotes()).isZero();
        assertThat(cfg.getVotingTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(cfg.isWeightingEnabled()).isFalse();
        assertThat(cfg.getSourceExtensions()).containsExactly(".sol");
        assertThat(cfg.getGithubApiBase()).isEqualTo("https://api.github.com");
        assertThat(cfg.getRetention()).isEqualTo(Duration.ZERO);
        assertThat(cfg.getCache().getTtl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(cfg.getCache().getCapacity()).isEqualTo(10_000);
    }

    @Test
    void setConcurrencyHasLowerBoundOne() {
        ScanConfig cfg = ScanConfig.defaults().setConcurrency(0);
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        cfg.validate();
    }

    @Test
    void effectiveMinimumVotesFallsBackToHalfTheAnalyzers() {
        ScanConfig cfg = ScanConfig.defaults();
        assertThat(cfg.effectiveMinimumVotes(4)).isEqualTo(2);
        assertThat(cfg.effectiveMinimumVotes(5)).isEqualTo(2);
        assertThat(cfg.effectiveMinimumVotes(1)).isEqualTo(1);

        cfg.setMinimumVotes(3);
        assertThat(cfg.effectiveMinimumVotes(10)).isEqualTo(3);
    }

    @Test
    void extensionsAreNormalized() {
        ScanConfig cfg = ScanConfig.defaults().setSourceExtensions(List.of("SOL", ".Vy", " .sol "));
        assertThat(cfg.getSourceExtensions()).containsExactly(".sol", ".vy");
    }

    @Test
    void validateRejectsOutOfRangeQuorum() {
        assertThrows(IllegalArgumentException.class, () -> ScanConfig.defaults().setQuorumThreshold(0).validate());
        assertThrows(IllegalArgumentException.class, () -> ScanConfig.defaults().setQuorumThreshold(1.01).validate());
        ScanConfig.defaults().setQuorumThreshold(1.0).validate();
    }

    @Test
    void validateRejectsBadValues() {
        assertThatThrownBy(() -> ScanConfig.defaults().setMinimumVotes(-1).validate())
                .hasMessageContaining("minimumVotes");
        assertThatThrownBy(() -> ScanConfig.defaults().setVotingTimeout(Duration.ZERO).validate())
                .hasMessageContaining("votingTimeout");
        assertThatThrownBy(() -> ScanConfig.defaults().setRejectVoteConfidence(101).validate())
                .hasMessageContaining("rejectVoteConfidence");
        assertThatThrownBy(() -> ScanConfig.defaults().setAnalyzerWeights(Map.of("a", -0.5)).validate())
                .hasMessageContaining("analyzerWeights.a");
        assertThatThrownBy(() -> ScanConfig.defaults().setGithubApiBase("ftp://x").validate())
                .hasMessageContaining("githubApiBase");
        assertThatThrownBy(() -> ScanConfig.defaults().setRetention(Duration.ofMinutes(-1)).validate())
                .hasMessageContaining("retention");
        assertThatThrownBy(() -> {
            ScanConfig c = ScanConfig.defaults();
            c.getCache().setCapacity(0);
            c.validate();
        }).hasMessageContaining("cache.capacity");
    }
}
