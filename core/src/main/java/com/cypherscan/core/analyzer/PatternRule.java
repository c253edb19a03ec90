package com.cypherscan.core.analyzer;

import com.cypherscan.core.model.Severity;

import java.util.Objects;
import java.util.regex.Pattern;

/** 한 줄 단위 정규식 규칙 */
public record PatternRule(String category,
                          Severity severity,
                          Pattern pattern,
                          String title,
                          String description,
                          String recommendation,
                          double confidence) {

    public PatternRule {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(title, "title");
    }

    public static PatternRule of(String category, Severity severity, String regex, double confidence,
                                 String title, String description, String recommendation) {
        return new PatternRule(category, severity, Pattern.compile(regex), title, description, recommendation, confidence);
    }

    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }
}
