package com.cypherscan.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * 결함 후보(raw) 또는 합의로 확정된(confirmed) 결함.
 * raw finding 은 analyzerId 를 갖고, 확정 finding 은 스캔 단위 id 를 새로 받는다.
 */
public final class Finding {
    private final String id;
    private final String category;       // 소문자 정규화된 타입 태그 (예: reentrancy)
    private final Severity severity;
    private final String title;
    private final String description;
    private final String file;
    private final int line;              // 1부터. 모르면 0
    private final String recommendation;
    private final double confidence;     // 0..100
    private final String codeSnippet;    // nullable
    private final String analyzerId;     // raw 일 때만

    private Finding(Builder b) {
        this.id = b.id;
        this.category = b.category.trim().toLowerCase(Locale.ROOT);
        this.severity = b.severity;
        this.title = (b.title == null ? this.category : b.title);
        this.description = (b.description == null ? "" : b.description);
        this.file = b.file;
        this.line = Math.max(0, b.line);
        this.recommendation = (b.recommendation == null ? "" : b.recommendation);
        this.confidence = clamp(b.confidence);
        this.codeSnippet = b.codeSnippet;
        this.analyzerId = b.analyzerId;
    }

    public String getId() { return id; }
    public String getCategory() { return category; }
    public Severity getSeverity() { return severity; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getFile() { return file; }
    public int getLine() { return line; }
    public String getRecommendation() { return recommendation; }
    public double getConfidence() { return confidence; }
    public String getCodeSnippet() { return codeSnippet; }
    public String getAnalyzerId() { return analyzerId; }

    public Finding withConfidence(double confidence) {
        return toBuilder().confidence(confidence).build();
    }

    /** 확정 finding 으로 변환: 새 id, 합의 점수, analyzerId 제거 */
    public Finding confirmedAs(String newId, double consensusScore) {
        return toBuilder().id(newId).confidence(consensusScore).analyzerId(null).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).category(category).severity(severity).title(title)
                .description(description).file(file).line(line)
                .recommendation(recommendation).confidence(confidence)
                .codeSnippet(codeSnippet).analyzerId(analyzerId);
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return 0;
        return Math.max(0, Math.min(100, v));
    }

    @Override public String toString() {
        return "Finding{" + id + ", " + category + "/" + severity + " @" + file + ":" + line
                + ", conf=" + confidence + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private String category;
        private Severity severity;
        private String title;
        private String description;
        private String file;
        private int line;
        private String recommendation;
        private double confidence = 50;
        private String codeSnippet;
        private String analyzerId;

        public Builder id(String id) { this.id = id; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder file(String file) { this.file = file; return this; }
        public Builder line(int line) { this.line = line; return this; }
        public Builder recommendation(String recommendation) { this.recommendation = recommendation; return this; }
        public Builder confidence(double confidence) { this.confidence = confidence; return this; }
        public Builder codeSnippet(String codeSnippet) { this.codeSnippet = codeSnippet; return this; }
        public Builder analyzerId(String analyzerId) { this.analyzerId = analyzerId; return this; }

        public Finding build() {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(severity, "severity");
            if (category.isBlank()) throw new IllegalArgumentException("category must not be blank");
            return new Finding(this);
        }
    }
}
