package com.cypherscan.core.api;

import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.SourceFile;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/** 분석기 최소 계약: 파일 목록을 받아 결함 후보를 돌려준다. 입력은 변경하지 않는다. */
public interface IAnalyzer {

    String id();

    List<Finding> analyze(List<SourceFile> files) throws Exception;

    /** 이 analyzer 가 판단할 수 있는 카테고리(소문자). 비어 있으면 전 카테고리. */
    default Set<String> categories() { return Set.of(); }

    default boolean covers(String category) {
        Set<String> c = categories();
        return c.isEmpty() || (category != null && c.contains(category.toLowerCase(Locale.ROOT)));
    }
}
