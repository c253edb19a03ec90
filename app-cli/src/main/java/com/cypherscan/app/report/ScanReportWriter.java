package com.cypherscan.app.report;

import com.cypherscan.core.model.ScanSnapshot;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** 스캔 스냅샷 → {outDir}/scan-{scanId}.json (ISO-8601 시각, pretty print) */
public final class ScanReportWriter {
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public Path write(ScanSnapshot snapshot, Path outDir) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(outDir, "outDir");
        Files.createDirectories(outDir);
        Path file = outDir.resolve("scan-" + snapshot.scanId() + ".json");
        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), ScanReport.of(snapshot));
        return file;
    }

    public ScanReport read(Path file) throws IOException {
        ScanReport r = om.readValue(file.toFile(), ScanReport.class);
        if (!ScanReport.VERSION.equals(r.v())) {
            throw new IllegalArgumentException("Unsupported report version: " + r.v());
        }
        return r;
    }
}
