package com.cypherscan.core.consensus;

import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.Severity;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/** 합의 단위 키: (category, severity). 표는 이 키의 문자열 형태로 그룹을 가리킨다. */
public record FindingGroupKey(String category, Severity severity) {

    /** 심각도 높은 순 → 카테고리 사전순 */
    public static final Comparator<FindingGroupKey> ORDER =
            Comparator.comparing((FindingGroupKey k) -> -k.severity().rank())
                    .thenComparing(FindingGroupKey::category);

    public FindingGroupKey {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        category = category.trim().toLowerCase(Locale.ROOT);
    }

    public static FindingGroupKey of(Finding f) {
        return new FindingGroupKey(f.getCategory(), f.getSeverity());
    }

    /** "reentrancy:HIGH" */
    public String asString() {
        return category + ":" + severity.name();
    }

    public static FindingGroupKey parse(String s) {
        int idx = (s == null ? -1 : s.lastIndexOf(':'));
        if (idx <= 0 || idx == s.length() - 1) throw new IllegalArgumentException("bad group key: " + s);
        return new FindingGroupKey(s.substring(0, idx), Severity.valueOf(s.substring(idx + 1)));
    }

    @Override public String toString() { return asString(); }
}
