package com.cypherscan.core.model;

import com.cypherscan.core.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * 불변 스캔 요청. submit 시점에 {@link #validate()} 로 검증되고 이후 바뀌지 않는다.
 * accessToken 은 그대로 fetch 계층에 전달만 하며 로그/스냅샷에 노출하지 않는다.
 */
public final class ScanRequest {

    public enum SourceType { GITHUB, ONCHAIN }

    /** 분석 옵션 (현재는 analyzer 힌트 용도) */
    public record Options(boolean deepScan, boolean includeDependencies) {
        public static final Options DEFAULT = new Options(false, false);
    }

    private static final Pattern REPO = Pattern.compile("[A-Za-z0-9_.-]+/[A-Za-z0-9_.-]+");
    private static final Pattern ADDRESS = Pattern.compile("0x[0-9a-fA-F]{40}");

    private final SourceType type;
    private final String repository;       // owner/name
    private final String path;             // "" = 루트
    private final String contractAddress;
    private final String chain;
    private final String accessToken;      // nullable, opaque
    private final Options options;
    private final String requestedBy;      // nullable

    private ScanRequest(Builder b) {
        this.type = b.type;
        this.repository = trimToNull(b.repository);
        this.path = normalizePath(b.path);
        this.contractAddress = trimToNull(b.contractAddress);
        this.chain = trimToNull(b.chain);
        this.accessToken = trimToNull(b.accessToken);
        this.options = (b.options == null ? Options.DEFAULT : b.options);
        this.requestedBy = trimToNull(b.requestedBy);
    }

    public SourceType getType() { return type; }
    public String getRepository() { return repository; }
    public String getPath() { return path; }
    public String getContractAddress() { return contractAddress; }
    public String getChain() { return chain; }
    public String getAccessToken() { return accessToken; }
    public Options getOptions() { return options; }
    public String getRequestedBy() { return requestedBy; }

    /** 로그/스냅샷용 위치 문자열. 자격증명은 포함하지 않는다. */
    public String locator() {
        if (type == SourceType.ONCHAIN) return chain + ":" + contractAddress;
        return path.isEmpty() ? repository : repository + "/" + path;
    }

    public void validate() {
        if (type == null) throw new ValidationException("type is required");
        switch (type) {
            case GITHUB -> {
                if (repository == null) throw new ValidationException("repository is required for GITHUB scans");
                if (!REPO.matcher(repository).matches())
                    throw new ValidationException("repository must look like owner/name: " + repository);
                if (path.contains(".."))
                    throw new ValidationException("path must not contain '..'");
            }
            case ONCHAIN -> {
                if (contractAddress == null) throw new ValidationException("contractAddress is required for ONCHAIN scans");
                if (!ADDRESS.matcher(contractAddress).matches())
                    throw new ValidationException("contractAddress must be a 0x-prefixed 20-byte hex address");
                if (chain == null) throw new ValidationException("chain is required for ONCHAIN scans");
            }
        }
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizePath(String p) {
        if (p == null) return "";
        String t = p.trim();
        while (t.startsWith("/")) t = t.substring(1);
        while (t.endsWith("/")) t = t.substring(0, t.length() - 1);
        return t;
    }

    public static Builder github(String repository) {
        return new Builder().type(SourceType.GITHUB).repository(repository);
    }

    public static Builder onChain(String contractAddress, String chain) {
        return new Builder().type(SourceType.ONCHAIN).contractAddress(contractAddress).chain(chain);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private SourceType type;
        private String repository;
        private String path;
        private String contractAddress;
        private String chain;
        private String accessToken;
        private Options options;
        private String requestedBy;

        public Builder type(SourceType type) { this.type = type; return this; }
        public Builder repository(String repository) { this.repository = repository; return this; }
        public Builder path(String path) { this.path = path; return this; }
        public Builder contractAddress(String contractAddress) { this.contractAddress = contractAddress; return this; }
        public Builder chain(String chain) { this.chain = chain; return this; }
        public Builder accessToken(String accessToken) { this.accessToken = accessToken; return this; }
        public Builder options(Options options) { this.options = options; return this; }
        public Builder requestedBy(String requestedBy) { this.requestedBy = requestedBy; return this; }

        /** 검증은 하지 않는다. submit 이 validate() 를 호출한다. */
        public ScanRequest build() { return new ScanRequest(this); }
    }
}
