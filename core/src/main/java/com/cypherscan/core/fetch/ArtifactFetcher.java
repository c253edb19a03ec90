package com.cypherscan.core.fetch;

import com.cypherscan.core.api.IContractSourceProvider;
import com.cypherscan.core.api.ISourceClient;
import com.cypherscan.core.cache.ArtifactCache;
import com.cypherscan.core.exception.ArtifactNotFoundException;
import com.cypherscan.core.exception.UpstreamException;
import com.cypherscan.core.model.RemoteEntry;
import com.cypherscan.core.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 원격 저장소의 디렉터리 트리를 (경로, 내용) 평면 목록으로 풀어낸다.
 * 결과는 ArtifactCache 에 TTL 로 memoize 되며, 캐시는 정답의 원천이 아니다(콜드/웜 결과 동일).
 */
public final class ArtifactFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactFetcher.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
    private static final int MAX_DEPTH = 32;

    private final ISourceClient client;
    private final ArtifactCache<List<SourceFile>> cache;
    private final SourceFileFilter filter;
    private final Duration ttl;
    private final IContractSourceProvider contractProvider; // nullable

    public ArtifactFetcher(ISourceClient client, ArtifactCache<List<SourceFile>> cache, SourceFileFilter filter) {
        this(client, cache, filter, DEFAULT_TTL, null);
    }

    public ArtifactFetcher(ISourceClient client,
                           ArtifactCache<List<SourceFile>> cache,
                           SourceFileFilter filter,
                           Duration ttl,
                           IContractSourceProvider contractProvider) {
        this.client = Objects.requireNonNull(client, "client");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.ttl = (ttl == null ? DEFAULT_TTL : ttl);
        this.contractProvider = contractProvider;
    }

    static String treeKey(String repository, String path) {
        return "github:" + repository + ":" + (path == null ? "" : path);
    }

    static String contractKey(String address, String chain) {
        return "chain:" + chain + ":" + address.toLowerCase(Locale.ROOT);
    }

    /**
     * @throws ArtifactNotFoundException 조건에 맞는 파일이 하나도 없을 때
     * @throws UpstreamException         원격 provider 오류
     */
    public List<SourceFile> fetchTree(String repository, String path, String credential) {
        Objects.requireNonNull(repository, "repository");
        String p = (path == null ? "" : path);
        return cache.getOrLoad(treeKey(repository, p), () -> loadTree(repository, p, credential), ttl);
    }

    public List<SourceFile> fetchContract(String address, String chain) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(chain, "chain");
        if (contractProvider == null) {
            throw new UpstreamException("on-chain source retrieval is not configured", 501);
        }
        return cache.getOrLoad(contractKey(address, chain), () -> {
            List<SourceFile> files = contractProvider.fetch(address, chain);
            if (files == null || files.isEmpty()) {
                throw new ArtifactNotFoundException("No verified source for " + address + " on " + chain);
            }
            return List.copyOf(files);
        }, ttl);
    }

    /* ===== 원격 조회 ===== */

    private List<SourceFile> loadTree(String repository, String path, String credential) {
        long t0 = System.nanoTime();
        List<RemoteEntry> top = client.listDirectory(repository, path, credential);

        // 단일 파일 경로
        if (isSingleFile(path, top)) {
            RemoteEntry only = top.get(0);
            if (!filter.accepts(only.path())) {
                throw new ArtifactNotFoundException("Not a supported source file: " + only.path()
                        + " (allowed " + filter.extensions() + ")");
            }
            List<SourceFile> one = List.of(download(only, credential));
            LOG.info("Fetched single file {}:{}", repository, only.path());
            return one;
        }

        List<SourceFile> out = new ArrayList<>();
        collect(repository, top, credential, out, 0);
        if (out.isEmpty()) {
            throw new ArtifactNotFoundException("No source files matching " + filter.extensions()
                    + " found in " + repository + (path.isEmpty() ? "" : "/" + path));
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;
        LOG.info("Fetched {} source files from {}:{} in {}ms", out.size(), repository, path, ms);
        return List.copyOf(out);
    }

    private void collect(String repository, List<RemoteEntry> entries, String credential,
                         List<SourceFile> out, int depth) {
        if (depth > MAX_DEPTH) {
            throw new UpstreamException("directory tree too deep under " + repository, -1);
        }
        for (RemoteEntry e : entries) {
            if (e.isDir()) {
                collect(repository, client.listDirectory(repository, e.path(), credential), credential, out, depth + 1);
            } else if (e.isFile() && filter.accepts(e.path())) {
                out.add(download(e, credential));
            }
        }
    }

    private SourceFile download(RemoteEntry e, String credential) {
        String url = (e.url() != null ? e.url() : e.downloadUrl());
        if (url == null) {
            throw new UpstreamException("no content url for " + e.path(), -1);
        }
        byte[] bytes = client.getFileContent(url, credential);
        return new SourceFile(e.path(), new String(bytes, StandardCharsets.UTF_8));
    }

    private static boolean isSingleFile(String path, List<RemoteEntry> entries) {
        return !path.isEmpty()
                && entries.size() == 1
                && entries.get(0).isFile()
                && entries.get(0).path().equals(path);
    }
}
