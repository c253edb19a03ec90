package com.cypherscan.core.analyzer;

import com.cypherscan.core.api.IAnalyzer;
import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.SourceFile;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 규칙 기반 analyzer: 파일의 각 줄에 규칙을 적용해 매치마다 finding 하나.
 * id = {category}-{path}-{line}, 주석 전용 줄은 건너뛴다.
 */
public class PatternAnalyzer implements IAnalyzer {

    private final String id;
    private final List<PatternRule> rules;
    private final Set<String> categories;

    public PatternAnalyzer(String id, List<PatternRule> rules) {
        this.id = Objects.requireNonNull(id, "id");
        this.rules = List.copyOf(rules);
        if (this.rules.isEmpty()) throw new IllegalArgumentException("rules must not be empty");
        Set<String> cats = new LinkedHashSet<>();
        for (PatternRule r : this.rules) cats.add(r.category().toLowerCase(Locale.ROOT));
        this.categories = Set.copyOf(cats);
    }

    @Override public String id() { return id; }

    @Override public Set<String> categories() { return categories; }

    public List<PatternRule> rules() { return rules; }

    @Override
    public List<Finding> analyze(List<SourceFile> files) {
        List<Finding> out = new ArrayList<>();
        for (SourceFile file : files) {
            String[] lines = file.lines();
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                if (isCommentOnly(line)) continue;
                for (PatternRule rule : rules) {
                    if (!rule.matches(line)) continue;
                    int lineNo = i + 1;
                    out.add(Finding.builder()
                            .id(rule.category() + "-" + file.path() + "-" + lineNo)
                            .category(rule.category())
                            .severity(rule.severity())
                            .title(rule.title())
                            .description(rule.description())
                            .recommendation(rule.recommendation())
                            .file(file.path())
                            .line(lineNo)
                            .confidence(rule.confidence())
                            .codeSnippet(line.trim())
                            .analyzerId(id)
                            .build());
                }
            }
        }
        return out;
    }

    private static boolean isCommentOnly(String line) {
        String t = line.trim();
        return t.startsWith("//") || t.startsWith("/*") || t.startsWith("*");
    }
}
