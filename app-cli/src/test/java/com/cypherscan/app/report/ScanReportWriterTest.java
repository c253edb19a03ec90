package com.cypherscan.app.report;

import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.ScanRequest;
import com.cypherscan.core.model.ScanSnapshot;
import com.cypherscan.core.model.ScanStatus;
import com.cypherscan.core.model.Severity;
import com.cypherscan.core.model.Vote;
import com.cypherscan.core.model.VoteDecision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanReportWriterTest {

    @TempDir
    Path tmp;

    private static ScanSnapshot completed() {
        Finding f = Finding.builder()
                .id("scan_1_abc-F1").category("reentrancy").severity(Severity.HIGH)
                .title("Potential Reentrancy").file("contracts/Vault.sol").line(12)
                .confidence(62).codeSnippet("msg.sender.call{value: x}(\"\");")
                .build();
        return new ScanSnapshot("scan_1_abc", ScanRequest.SourceType.GITHUB, "acme/vault", ScanStatus.COMPLETED, 100,
                List.of(f), List.of(Vote.of("a", "reentrancy:HIGH", VoteDecision.CONFIRMED, 90)),
                62.0, 1, true,
                Instant.parse("2026-03-01T10:00:00Z"), Instant.parse("2026-03-01T10:00:07Z"), null);
    }

    @Test
    void writes_pretty_json_with_iso_timestamps() throws Exception {
        Path file = new ScanReportWriter().write(completed(), tmp.resolve("reports"));

        assertThat(file.getFileName().toString()).isEqualTo("scan-scan_1_abc.json");
        String json = Files.readString(file);
        assertThat(json).contains("\"createdAt\" : \"2026-03-01T10:00:00Z\"");
        assertThat(json).contains("\"status\" : \"COMPLETED\"");
        assertThat(json).doesNotContain("analyzerId");
    }

    @Test
    void report_can_be_read_back() throws Exception {
        ScanReportWriter w = new ScanReportWriter();
        ScanReport r = w.read(w.write(completed(), tmp));

        assertThat(r.v()).isEqualTo(ScanReport.VERSION);
        assertThat(r.consensusReached()).isTrue();
        assertThat(r.completedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:07Z"));
        assertThat(r.findings()).singleElement().satisfies(f -> {
            assertThat(f.severity()).isEqualTo("HIGH");
            assertThat(f.line()).isEqualTo(12);
            assertThat(f.confidence()).isEqualTo(62.0);
        });
    }

    @Test
    void unknown_report_version_is_rejected() throws Exception {
        Path file = tmp.resolve("old.json");
        Files.writeString(file, "{\"v\":\"0\",\"scanId\":\"x\",\"findings\":[]}");

        assertThatThrownBy(() -> new ScanReportWriter().read(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported report version");
    }
}
