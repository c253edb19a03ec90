package com.cypherscan.app;

import com.cypherscan.app.logging.LogSetup;
import com.cypherscan.app.report.ScanReportWriter;
import com.cypherscan.core.analyzer.BuiltinAnalyzers;
import com.cypherscan.core.exception.ValidationException;
import com.cypherscan.core.fetch.GitHubSourceClient;
import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.ScanConfig;
import com.cypherscan.core.model.ScanRequest;
import com.cypherscan.core.model.ScanSnapshot;
import com.cypherscan.core.model.ScanStatus;
import com.cypherscan.core.service.ScanOrchestrator;
import com.cypherscan.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * 명령행 진입점: 스캔 1건 제출 → 상태 폴링 → JSON 리포트 저장.
 * 종료 코드: 0 COMPLETED, 2 FAILED/시간 초과, 1 사용법/설정 오류.
 */
public final class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    private static final Duration POLL = Duration.ofMillis(500);

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.getenv("GITHUB_TOKEN"), System.out));
    }

    static int run(String[] args, String envToken, PrintStream out) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args, envToken);
        } catch (IllegalArgumentException e) {
            out.println("error: " + e.getMessage());
            out.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }

        LogSetup.init(opts.outDir().resolve("logs"));
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        ScanConfig cfg;
        try {
            cfg = loadConfig(opts.config());
        } catch (IOException | IllegalArgumentException e) {
            out.println("error: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        GitHubSourceClient github = new GitHubSourceClient(cfg.getGithubApiBase(), cfg.getHttpTimeout());
        try (ScanOrchestrator orchestrator = ScanOrchestrator.create(cfg, github, null, BuiltinAnalyzers.all())) {
            return scan(orchestrator, opts, out);
        }
    }

    static int scan(ScanOrchestrator orchestrator, CliOptions opts, PrintStream out) {
        ScanRequest request = opts.isOnChain()
                ? ScanRequest.onChain(opts.contractAddress(), opts.chain()).build()
                : ScanRequest.github(opts.repository()).path(opts.path()).accessToken(opts.token()).build();

        String scanId;
        try {
            scanId = orchestrator.submit(request);
        } catch (ValidationException e) {
            out.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
        out.println("scan " + scanId + " submitted: " + request.locator());

        ScanSnapshot snap = await(orchestrator, scanId, opts.waitLimit(), out);
        if (snap == null) {
            out.println("scan " + scanId + " did not finish within " + opts.waitLimit().toMinutes() + " minutes");
            return EXIT_FAILED;
        }

        try {
            Path report = new ScanReportWriter().write(snap, opts.outDir());
            out.println("report: " + report.toAbsolutePath());
        } catch (IOException e) {
            LOG.error("Failed to write report for {}", scanId, e);
            out.println("warning: report not written: " + e.getMessage());
        }

        if (snap.status() == ScanStatus.FAILED) {
            out.println("FAILED: " + snap.failureReason());
            return EXIT_FAILED;
        }
        printSummary(snap, out);
        return EXIT_OK;
    }

    private static ScanSnapshot await(ScanOrchestrator orchestrator, String scanId, Duration limit, PrintStream out) {
        Instant deadline = Instant.now().plus(limit);
        int lastProgress = -1;
        ScanStatus lastStatus = null;
        while (Instant.now().isBefore(deadline)) {
            ScanSnapshot s = orchestrator.getStatus(scanId).orElse(null);
            if (s == null) return null;
            if (s.progress() != lastProgress || s.status() != lastStatus) {
                out.printf("  [%3d%%] %s%n", s.progress(), s.status());
                lastProgress = s.progress();
                lastStatus = s.status();
            }
            if (s.isTerminal()) return s;
            try {
                Thread.sleep(POLL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
        return null;
    }

    private static void printSummary(ScanSnapshot snap, PrintStream out) {
        out.printf("COMPLETED: %d confirmed finding(s), %d vote(s), avg confidence %.1f%n",
                snap.findings().size(), snap.totalVotes(), snap.finalConfidenceScore());
        for (Finding f : snap.findings()) {
            out.printf("  %-8s %-22s %s:%d (%.0f) %s%n", f.getSeverity(), f.getCategory(),
                    f.getFile(), f.getLine(), f.getConfidence(), f.getTitle());
        }
    }

    static ScanConfig loadConfig(Path explicit) throws IOException {
        if (explicit != null) return YamlConfigLoader.load(explicit);
        Path local = Path.of("scan.yml");
        if (Files.exists(local)) return YamlConfigLoader.load(local);
        ScanConfig cfg = ScanConfig.defaults();
        cfg.validate();
        return cfg;
    }
}
