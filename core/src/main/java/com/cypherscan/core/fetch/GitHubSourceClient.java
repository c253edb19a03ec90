package com.cypherscan.core.fetch;

import com.cypherscan.core.api.ISourceClient;
import com.cypherscan.core.exception.ArtifactNotFoundException;
import com.cypherscan.core.exception.UpstreamException;
import com.cypherscan.core.http.DefaultRetryPolicy;
import com.cypherscan.core.http.RetryPolicy;
import com.cypherscan.core.model.RemoteEntry;
import com.cypherscan.core.util.DefaultSleeper;
import com.cypherscan.core.util.Sleeper;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * GitHub contents API 클라이언트.
 *  - GET {api}/repos/{owner}/{name}/contents/{path}
 *  - 디렉터리 → JSON 배열, 파일 → JSON 객체(base64 content)
 *  - 429/5xx/네트워크 오류는 RetryPolicy 로 재시도, Retry-After 우선(상한 30s)
 */
public final class GitHubSourceClient implements ISourceClient {

    private static final Logger LOG = LoggerFactory.getLogger(GitHubSourceClient.class);
    private static final String ACCEPT = "application/vnd.github.v3+json";
    private static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    /** 테스트 훅: 실제 전송 대체 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String apiBase;
    private final Duration timeout;
    private final HttpSender sender;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public GitHubSourceClient(String apiBase, Duration timeout) {
        this(apiBase, timeout, defaultSender(timeout), new DefaultRetryPolicy(), DefaultSleeper.INSTANCE);
    }

    public GitHubSourceClient(String apiBase, Duration timeout, HttpSender sender,
                              RetryPolicy retryPolicy, Sleeper sleeper) {
        String base = Objects.requireNonNull(apiBase, "apiBase");
        this.apiBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.retryPolicy = (retryPolicy == null ? RetryPolicy.NEVER : retryPolicy);
        this.sleeper = (sleeper == null ? DefaultSleeper.INSTANCE : sleeper);
    }

    private static HttpSender defaultSender(Duration timeout) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    /* ===== ISourceClient ===== */

    @Override
    public List<RemoteEntry> listDirectory(String repository, String path, String credential) {
        URI uri = contentsUri(repository, path);
        HttpResponse<byte[]> resp = sendWithRetry(uri, credential, repository + "/" + path);
        JsonNode root = readJson(resp.body(), uri);

        List<RemoteEntry> out = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode n : root) out.add(toEntry(n));
        } else if (root.isObject()) {
            out.add(toEntry(root));
        } else {
            throw new UpstreamException("Unexpected contents response for " + uri, resp.statusCode());
        }
        return out;
    }

    @Override
    public byte[] getFileContent(String url, String credential) {
        URI uri = URI.create(url);
        HttpResponse<byte[]> resp = sendWithRetry(uri, credential, url);
        String ct = resp.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        if (!ct.contains("json")) {
            return resp.body(); // raw(download_url)
        }

        JsonNode node = readJson(resp.body(), uri);
        String encoding = text(node, "encoding");
        String content = text(node, "content");
        if ("base64".equalsIgnoreCase(encoding) && content != null) {
            return Base64.getMimeDecoder().decode(content);
        }
        // 1MB 초과 파일은 content 가 비어 오므로 download_url 로 재요청
        String raw = text(node, "download_url");
        if (raw != null) {
            return sendWithRetry(URI.create(raw), credential, raw).body();
        }
        throw new UpstreamException("No file content in response for " + url, resp.statusCode());
    }

    /* ===== 내부 ===== */

    URI contentsUri(String repository, String path) {
        StringBuilder sb = new StringBuilder(apiBase).append("/repos/").append(repository).append("/contents");
        if (path != null && !path.isEmpty()) {
            for (String seg : path.split("/")) {
                if (seg.isEmpty()) continue;
                sb.append('/').append(URLEncoder.encode(seg, StandardCharsets.UTF_8).replace("+", "%20"));
            }
        }
        return URI.create(sb.toString());
    }

    private HttpResponse<byte[]> sendWithRetry(URI uri, String credential, String what) {
        HttpRequest.Builder rb = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", ACCEPT)
                .header("User-Agent", "cypherscan")
                .GET();
        if (credential != null && !credential.isBlank()) {
            rb.header("Authorization", "token " + credential);
        }
        HttpRequest req = rb.build();

        int attempt = 1;
        while (true) {
            HttpResponse<byte[]> resp = null;
            IOException ioError = null;
            int status;
            try {
                resp = sender.send(req);
                status = resp.statusCode();
            } catch (IOException e) {
                ioError = e;
                status = -1;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamException("Interrupted while fetching " + what, -1, e);
            }

            if (status >= 200 && status < 300) {
                return resp;
            }
            if (!retryPolicy.shouldRetry(status, attempt)) {
                throw toUpstream(status, what, ioError);
            }

            Duration delay = retryAfterOr(retryPolicy.backoff(attempt), resp);
            LOG.warn("GitHub request failed (status={}, attempt={}/{}), retrying in {}ms: {}",
                    status, attempt, retryPolicy.maxAttempts(), delay.toMillis(), uri);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamException("Interrupted while waiting to retry " + what, status, e);
            }
            attempt++;
        }
    }

    private static UpstreamException toUpstream(int status, String what, IOException cause) {
        if (status == 404) return new ArtifactNotFoundException("Not found: " + what);
        if (status == -1) return new UpstreamException("Network error fetching " + what, -1, cause);
        if (status == 401 || status == 403) return new UpstreamException("Access denied for " + what, status);
        return new UpstreamException("GitHub returned " + status + " for " + what, status);
    }

    private static Duration retryAfterOr(Duration fallback, HttpResponse<byte[]> resp) {
        if (resp == null) return fallback;
        String v = resp.headers().firstValue("Retry-After").orElse(null);
        if (v == null) return fallback;
        try {
            long sec = Long.parseLong(v.trim());
            Duration d = Duration.ofSeconds(Math.max(0, sec));
            return d.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : d;
        } catch (NumberFormatException e) {
            return fallback; // HTTP-date 형태는 기본 backoff 사용
        }
    }

    private JsonNode readJson(byte[] body, URI uri) {
        try {
            return om.readTree(body == null ? new byte[0] : body);
        } catch (IOException e) {
            throw new UpstreamException("Malformed JSON from " + uri + ": " + e.getMessage(), 200, e);
        }
    }

    private static RemoteEntry toEntry(JsonNode n) {
        String type = text(n, "type");
        RemoteEntry.Type t = "file".equals(type) ? RemoteEntry.Type.FILE
                : "dir".equals(type) ? RemoteEntry.Type.DIR
                : RemoteEntry.Type.OTHER;
        String path = text(n, "path");
        if (path == null) throw new UpstreamException("contents entry without path", 200);
        return new RemoteEntry(text(n, "name"), path, t, text(n, "url"), text(n, "download_url"));
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }
}
