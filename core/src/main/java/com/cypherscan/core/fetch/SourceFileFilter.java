package com.cypherscan.core.fetch;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** 확장자 허용 목록 기반 소스 파일 필터 (대소문자 무시) */
public final class SourceFileFilter {
    private final List<String> extensions;

    public SourceFileFilter(List<String> extensions) {
        Objects.requireNonNull(extensions, "extensions");
        if (extensions.isEmpty()) throw new IllegalArgumentException("extensions must not be empty");
        this.extensions = extensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
    }

    public static SourceFileFilter solidity() {
        return new SourceFileFilter(List.of(".sol"));
    }

    public boolean accepts(String path) {
        if (path == null) return false;
        String p = path.toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (p.endsWith(ext)) return true;
        }
        return false;
    }

    public List<String> extensions() { return extensions; }
}
