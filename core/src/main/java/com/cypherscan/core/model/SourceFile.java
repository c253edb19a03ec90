package com.cypherscan.core.model;

import java.util.Objects;

/** 분석 입력 단위: (경로, 내용) */
public record SourceFile(String path, String content) {
    public SourceFile {
        Objects.requireNonNull(path, "path");
        content = (content == null ? "" : content);
    }

    public String[] lines() {
        return content.split("\\r?\\n", -1);
    }
}
