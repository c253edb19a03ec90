package com.cypherscan.core.service;

import com.cypherscan.core.api.IAnalyzer;
import com.cypherscan.core.cache.ArtifactCache;
import com.cypherscan.core.cache.FrozenClock;
import com.cypherscan.core.exception.UpstreamException;
import com.cypherscan.core.exception.ValidationException;
import com.cypherscan.core.fetch.ArtifactFetcher;
import com.cypherscan.core.fetch.FakeSourceClient;
import com.cypherscan.core.fetch.SourceFileFilter;
import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.ScanConfig;
import com.cypherscan.core.model.ScanRequest;
import com.cypherscan.core.model.ScanSnapshot;
import com.cypherscan.core.model.ScanStatus;
import com.cypherscan.core.model.Severity;
import com.cypherscan.core.model.SourceFile;
import com.cypherscan.core.model.Vote;
import com.cypherscan.core.model.VoteDecision;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanOrchestratorTest {

    private static final String GROUP = "reentrancy:HIGH";

    private ScanOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) orchestrator.close();
    }

    /* ---------- helpers ---------- */

    /** categories 를 다루고, reportConfidence > 0 이면 reentrancy HIGH 하나를 보고 */
    private static IAnalyzer analyzer(String id, Set<String> categories, double reportConfidence) {
        return new IAnalyzer() {
            @Override public String id() { return id; }
            @Override public Set<String> categories() { return categories; }
            @Override public List<Finding> analyze(List<SourceFile> files) {
                if (reportConfidence <= 0) return List.of();
                SourceFile f = files.get(0);
                return List.of(Finding.builder()
                        .id(id + "-1").category("reentrancy").severity(Severity.HIGH)
                        .title("Reentrancy").file(f.path()).line(7)
                        .confidence(reportConfidence).build());
            }
        };
    }

    private static IAnalyzer crashing(String id) {
        return new IAnalyzer() {
            @Override public String id() { return id; }
            @Override public List<Finding> analyze(List<SourceFile> files) {
                throw new IllegalStateException("analyzer crashed");
            }
        };
    }

    private static ArtifactFetcher fetcher(FakeSourceClient client) {
        ArtifactCache<List<SourceFile>> cache = new ArtifactCache<>("test", 16, Duration.ofMinutes(10), new FrozenClock(0));
        return new ArtifactFetcher(client, cache, SourceFileFilter.solidity());
    }

    private static FakeSourceClient vaultRepo() {
        return new FakeSourceClient().file("contracts/Vault.sol", "contract Vault { function w() { msg.sender.call{value: 1}(\"\"); } }");
    }

    private static ScanRequest vaultRequest() {
        return ScanRequest.github("acme/vault").build();
    }

    private ScanSnapshot await(String scanId, Predicate<ScanSnapshot> until) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        ScanSnapshot s = orchestrator.getStatus(scanId).orElseThrow();
        while (!until.test(s) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            s = orchestrator.getStatus(scanId).orElseThrow();
        }
        return s;
    }

    private ScanSnapshot awaitTerminal(String scanId) throws InterruptedException {
        return await(scanId, ScanSnapshot::isTerminal);
    }

    /* ---------- tests ---------- */

    @Test
    @DisplayName("정상 흐름: PENDING → … → COMPLETED, 확정 finding 에 합의 점수 반영")
    void full_lifecycle_completes_with_confirmed_findings() throws Exception {
        ScanConfig cfg = ScanConfig.defaults().setMinimumVotes(3);
        orchestrator = new ScanOrchestrator(cfg, fetcher(vaultRepo()), List.of(
                analyzer("a", Set.of("reentrancy"), 90),
                analyzer("b", Set.of("reentrancy"), 60),
                analyzer("c", Set.of("reentrancy"), 0),
                crashing("d")));

        String id = orchestrator.submit(vaultRequest());
        assertThat(id).matches("scan_\\d+_[0-9a-z]{9}");

        ScanSnapshot s = awaitTerminal(id);

        assertThat(s.status()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(s.progress()).isEqualTo(100);
        assertThat(s.consensusReached()).isTrue();
        assertThat(s.totalVotes()).isEqualTo(3); // crashing analyzer 는 투표 제외
        assertThat(s.findings()).hasSize(1);

        Finding f = s.findings().get(0);
        assertThat(f.getId()).isEqualTo(id + "-F1");
        assertThat(f.getConfidence()).isEqualTo(50.0); // round(75 × 2/3)
        assertThat(f.getFile()).isEqualTo("contracts/Vault.sol");
        assertThat(f.getAnalyzerId()).isNull();
        assertThat(s.finalConfidenceScore()).isEqualTo(50.0);
        assertThat(s.completedAt()).isNotNull();
        assertThat(orchestrator.dispatchStats().failures()).isEqualTo(1);
    }

    @Test
    void upstream_error_fails_scan_without_findings() throws Exception {
        FakeSourceClient client = new FakeSourceClient().failWith(new UpstreamException("GitHub returned 502", 502));
        orchestrator = new ScanOrchestrator(ScanConfig.defaults(), fetcher(client),
                List.of(analyzer("a", Set.of("reentrancy"), 90)));

        ScanSnapshot s = awaitTerminal(orchestrator.submit(vaultRequest()));

        assertThat(s.status()).isEqualTo(ScanStatus.FAILED);
        assertThat(s.failureReason()).contains("502");
        assertThat(s.findings()).isEmpty();
        assertThat(s.progress()).isEqualTo(100);
    }

    @Test
    void repository_without_sources_fails_as_not_found() throws Exception {
        FakeSourceClient client = new FakeSourceClient().file("README.md", "# docs only");
        orchestrator = new ScanOrchestrator(ScanConfig.defaults(), fetcher(client),
                List.of(analyzer("a", Set.of("reentrancy"), 90)));

        ScanSnapshot s = awaitTerminal(orchestrator.submit(vaultRequest()));

        assertThat(s.status()).isEqualTo(ScanStatus.FAILED);
        assertThat(s.failureReason()).contains("404");
    }

    @Test
    void invalid_request_is_rejected_synchronously() {
        orchestrator = new ScanOrchestrator(ScanConfig.defaults(), fetcher(vaultRepo()),
                List.of(analyzer("a", Set.of("reentrancy"), 90)));

        assertThatThrownBy(() -> orchestrator.submit(ScanRequest.github("not a repo").build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> orchestrator.submit(null))
                .isInstanceOf(ValidationException.class);
        assertThat(orchestrator.listScans()).isEmpty();
    }

    @Test
    @DisplayName("표가 minimumVotes 에 못 미치면 타임아웃 후 현재 표로 강제 판정")
    void voting_timeout_finalizes_with_partial_votes() throws Exception {
        ScanConfig cfg = ScanConfig.defaults()
                .setMinimumVotes(2)
                .setVotingTimeout(Duration.ofMillis(200));
        orchestrator = new ScanOrchestrator(cfg, fetcher(vaultRepo()), List.of(
                analyzer("solo", Set.of("reentrancy"), 90),
                analyzer("defi", Set.of("flashloan"), 0))); // 기권

        String id = orchestrator.submit(vaultRequest());
        ScanSnapshot voting = await(id, s -> s.status() == ScanStatus.VOTING || s.isTerminal());
        assertThat(voting.status()).isIn(ScanStatus.VOTING, ScanStatus.COMPLETED);

        ScanSnapshot s = awaitTerminal(id);
        assertThat(s.status()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(s.totalVotes()).isEqualTo(1);
        assertThat(s.findings()).singleElement()
                .satisfies(f -> assertThat(f.getConfidence()).isEqualTo(90.0));
    }

    @Test
    @DisplayName("기본 minimumVotes 에서 2:2 로 갈린 그룹은 확정되지 않는다")
    void split_group_below_quorum_is_never_confirmed() throws Exception {
        ScanConfig cfg = ScanConfig.defaults().setVotingTimeout(Duration.ofMillis(200));
        assertThat(cfg.getMinimumVotes()).isZero(); // 4 analyzer → 2 로 유도
        orchestrator = new ScanOrchestrator(cfg, fetcher(vaultRepo()), List.of(
                analyzer("a", Set.of("reentrancy"), 80),
                analyzer("b", Set.of("reentrancy"), 80),
                analyzer("c", Set.of("reentrancy"), 0),
                analyzer("d", Set.of("reentrancy"), 0)));

        ScanSnapshot s = awaitTerminal(orchestrator.submit(vaultRequest()));

        assertThat(s.status()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(s.totalVotes()).isEqualTo(4);
        assertThat(s.findings()).isEmpty(); // 2/4 = 0.5 < 0.6
        assertThat(s.consensusReached()).isFalse();
    }

    @Test
    @DisplayName("외부 표가 합의를 깨면 그룹은 다시 미결이 되고 타임아웃 때 전체 표로 판정")
    void external_vote_can_withdraw_a_group_decision() throws Exception {
        ScanConfig cfg = ScanConfig.defaults()
                .setMinimumVotes(2)
                .setVotingTimeout(Duration.ofSeconds(1));
        IAnalyzer origin = new IAnalyzer() {
            @Override public String id() { return "origin"; }
            @Override public Set<String> categories() { return Set.of("tx_origin"); }
            @Override public List<Finding> analyze(List<SourceFile> files) {
                return List.of(Finding.builder().id("origin-1").category("tx_origin").severity(Severity.HIGH)
                        .title("tx.origin auth").file(files.get(0).path()).line(3).confidence(70).build());
            }
        };
        orchestrator = new ScanOrchestrator(cfg, fetcher(vaultRepo()), List.of(
                analyzer("a", Set.of("reentrancy"), 90), origin));

        String id = orchestrator.submit(vaultRequest());
        ScanSnapshot voting = await(id, s -> s.status() == ScanStatus.VOTING && s.progress() >= 90);
        assertThat(voting.status()).isEqualTo(ScanStatus.VOTING);

        orchestrator.submitVote(id, Vote.of("auditor-1", GROUP, VoteDecision.CONFIRMED, 90)); // 2/2
        orchestrator.submitVote(id, Vote.of("auditor-2", GROUP, VoteDecision.REJECTED, 60));  // 2/3
        orchestrator.submitVote(id, Vote.of("auditor-3", GROUP, VoteDecision.REJECTED, 60));  // 2/4 → 철회
        assertThat(orchestrator.getStatus(id).orElseThrow().status()).isEqualTo(ScanStatus.VOTING);

        ScanSnapshot s = awaitTerminal(id);
        assertThat(s.status()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(s.totalVotes()).isEqualTo(5);
        assertThat(s.findings()).singleElement()
                .satisfies(f -> assertThat(f.getCategory()).isEqualTo("tx_origin"));
    }

    @Test
    @DisplayName("VOTING 중 외부 표로 합의 도달 → 즉시 종결, 이후 표는 거부")
    void external_votes_reach_consensus_during_voting() throws Exception {
        ScanConfig cfg = ScanConfig.defaults()
                .setMinimumVotes(3)
                .setVotingTimeout(Duration.ofSeconds(30));
        orchestrator = new ScanOrchestrator(cfg, fetcher(vaultRepo()), List.of(
                analyzer("a", Set.of("reentrancy"), 90),
                analyzer("b", Set.of("flashloan"), 0)));

        String id = orchestrator.submit(vaultRequest());
        ScanSnapshot voting = await(id, s -> s.status() == ScanStatus.VOTING && s.progress() >= 90);
        assertThat(voting.status()).isEqualTo(ScanStatus.VOTING);

        assertThatThrownBy(() -> orchestrator.submitVote(id, Vote.of("auditor-1", "overflow:LOW", VoteDecision.CONFIRMED, 80)))
                .isInstanceOf(IllegalArgumentException.class);

        orchestrator.submitVote(id, Vote.of("auditor-1", GROUP, VoteDecision.CONFIRMED, 80));
        orchestrator.submitVote(id, Vote.of("auditor-2", GROUP, VoteDecision.CONFIRMED, 70));

        ScanSnapshot s = awaitTerminal(id);
        assertThat(s.status()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(s.totalVotes()).isEqualTo(3);
        assertThat(s.findings()).singleElement()
                .satisfies(f -> assertThat(f.getConfidence()).isEqualTo(80.0));

        assertThatThrownBy(() -> orchestrator.submitVote(id, Vote.of("late", GROUP, VoteDecision.REJECTED, 99)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void no_findings_completes_without_consensus() throws Exception {
        orchestrator = new ScanOrchestrator(ScanConfig.defaults(), fetcher(vaultRepo()), List.of(
                analyzer("a", Set.of("reentrancy"), 0),
                analyzer("b", Set.of("reentrancy"), 0)));

        ScanSnapshot s = awaitTerminal(orchestrator.submit(vaultRequest()));

        assertThat(s.status()).isEqualTo(ScanStatus.COMPLETED);
        assertThat(s.findings()).isEmpty();
        assertThat(s.consensusReached()).isFalse();
        assertThat(s.finalConfidenceScore()).isZero();
    }

    @Test
    void unknown_scan_ids() {
        orchestrator = new ScanOrchestrator(ScanConfig.defaults(), fetcher(vaultRepo()),
                List.of(analyzer("a", Set.of("reentrancy"), 90)));

        assertThat(orchestrator.getStatus("scan_0_missing")).isEmpty();
        assertThat(orchestrator.getStatus(null)).isEmpty();
        assertThatThrownBy(() -> orchestrator.submitVote("scan_0_missing", Vote.of("x", GROUP, VoteDecision.CONFIRMED, 1)))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void finished_scans_are_evicted_after_retention() throws Exception {
        Clock fixed = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        orchestrator = new ScanOrchestrator(ScanConfig.defaults(), fetcher(vaultRepo()),
                List.of(analyzer("a", Set.of("reentrancy"), 0)), fixed);

        String id = orchestrator.submit(vaultRequest());
        awaitTerminal(id);

        assertThat(orchestrator.evictFinished(Duration.ofMinutes(1))).isZero();
        assertThat(orchestrator.evictFinished(Duration.ZERO)).isEqualTo(1);
        assertThat(orchestrator.getStatus(id)).isEmpty();
    }

    @Test
    void constructor_rejects_bad_analyzer_sets() {
        FakeSourceClient client = vaultRepo();
        assertThatThrownBy(() -> new ScanOrchestrator(ScanConfig.defaults(), fetcher(client), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScanOrchestrator(ScanConfig.defaults(), fetcher(client), List.of(
                analyzer("dup", Set.of(), 0), analyzer("dup", Set.of(), 0))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dup");
    }

    @Test
    void closed_orchestrator_refuses_new_scans() {
        orchestrator = new ScanOrchestrator(ScanConfig.defaults(), fetcher(vaultRepo()),
                List.of(analyzer("a", Set.of("reentrancy"), 90)));
        orchestrator.close();

        assertThatThrownBy(() -> orchestrator.submit(vaultRequest()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(orchestrator.listScans()).isEmpty();
    }
}
