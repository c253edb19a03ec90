package com.cypherscan.app.logging;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void level_names_map_to_jul_levels() {
        assertThat(LogSetup.levelOf("debug")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf("TRACE")).isEqualTo(Level.FINEST);
        assertThat(LogSetup.levelOf("warn")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("ERROR")).isEqualTo(Level.SEVERE);
        assertThat(LogSetup.levelOf("fine")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf("loud")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void line_formatter_uses_short_logger_name() {
        LogRecord r = new LogRecord(Level.WARNING, "Scan {0} FAILED");
        r.setParameters(new Object[]{"scan_1_x"});
        r.setLoggerName("com.cypherscan.core.service.ScanOrchestrator");

        String line = new LogSetup.LineFormatter().format(r);

        assertThat(line).contains("[WARNING]").contains("ScanOrchestrator - Scan scan_1_x FAILED");
        assertThat(line).endsWith(System.lineSeparator());
    }
}
