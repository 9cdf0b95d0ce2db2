package kohost.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 终端节点内部鉴权（/api/kohost/terminal/**，包括 WebSocket 握手）：
 * - 来源 IP：本机 loopback + 配置的允许 IP（API 服务器 / 网关）
 * - 可选：HMAC-SHA256 签名与 nonce 防重放
 * <p>
 * 用户身份由前置层通过头部或请求体传入，所以调用方本身必须可信。
 */
public class TerminalInternalAuthFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(TerminalInternalAuthFilter.class);

    static final String HDR_SIG = "X-Kohost-Signature";
    static final String HDR_TS = "X-Kohost-Timestamp";
    static final String HDR_NONCE = "X-Kohost-Nonce";

    private static final String PATH_PREFIX = "/api/kohost/terminal/";
    private static final String DEFAULT_SECRET = "CHANGE_ME_STRONG_SECRET";
    private static final int NONCE_SWEEP_THRESHOLD = 5000;

    private final TerminalInternalAuthProperties props;
    private final Map<String, Long> nonceSeenAtSec = new ConcurrentHashMap<>();

    public TerminalInternalAuthFilter(TerminalInternalAuthProperties props) {
        this.props = props;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri == null || !uri.startsWith(PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String remote = request.getRemoteAddr();
        if (!isAllowedIp(remote, props.allowedIpList())) {
            log.warn("terminal request denied: remote={}, uri={}", remote, request.getRequestURI());
            deny(response, HttpServletResponse.SC_FORBIDDEN, "forbidden");
            return;
        }
        if (!props.isRequireSignature()) {
            filterChain.doFilter(request, response);
            return;
        }

        byte[] body = StreamUtils.copyToByteArray(request.getInputStream());
        if (!verifySignature(request, body)) {
            log.warn("terminal request signature rejected: remote={}, uri={}", remote, request.getRequestURI());
            deny(response, HttpServletResponse.SC_UNAUTHORIZED, "unauthorized");
            return;
        }
        // 没有 body 的请求（包括 WebSocket 握手）原样放行，升级需要原始请求
        filterChain.doFilter(body.length == 0 ? request : new CachedBodyRequest(request, body), response);
    }

    private static boolean isAllowedIp(String remoteAddr, List<String> allow) {
        if (remoteAddr == null || remoteAddr.isBlank()) return false;
        if ("127.0.0.1".equals(remoteAddr) || "::1".equals(remoteAddr) || "0:0:0:0:0:0:0:1".equals(remoteAddr)) {
            return true;
        }
        return allow.contains(remoteAddr);
    }

    private boolean verifySignature(HttpServletRequest req, byte[] body) {
        String secret = props.getSharedSecret();
        if (secret == null || secret.isBlank() || DEFAULT_SECRET.equals(secret)) {
            log.warn("terminal requireSignature=true but sharedSecret is empty/default");
            return false;
        }
        String tsStr = req.getHeader(HDR_TS);
        String nonce = req.getHeader(HDR_NONCE);
        String sig = req.getHeader(HDR_SIG);
        if (tsStr == null || nonce == null || sig == null) return false;

        long ts;
        try {
            ts = Long.parseLong(tsStr.trim());
        } catch (NumberFormatException e) {
            log.debug("bad signature timestamp: {}", tsStr);
            return false;
        }
        long now = Instant.now().getEpochSecond();
        if (Math.abs(now - ts) > Math.max(5, props.getMaxSkewSeconds())) return false;

        // nonce 在 TTL 内只能用一次
        sweepNonces(now, props.getNonceTtlSeconds());
        if (nonceSeenAtSec.putIfAbsent(nonce, now) != null) return false;

        String expect = sign(secret, canonical(req.getMethod(), req.getRequestURI(), req.getQueryString(), body, ts, nonce));
        return MessageDigest.isEqual(expect.getBytes(StandardCharsets.UTF_8), sig.trim().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * method \n path \n query \n sha256(body) \n timestamp \n nonce
     */
    static String canonical(String method, String path, String query, byte[] body, long ts, String nonce) {
        return (method == null ? "" : method) + "\n"
                + (path == null ? "" : path) + "\n"
                + (query == null ? "" : query) + "\n"
                + sha256Hex(body == null ? new byte[0] : body) + "\n"
                + ts + "\n"
                + nonce;
    }

    static String sign(String secret, String canonical) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return Base64.getEncoder().encodeToString(mac.doFinal(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    private static String sha256Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void sweepNonces(long nowSec, long ttlSec) {
        if (nonceSeenAtSec.size() < NONCE_SWEEP_THRESHOLD) return;
        long ttl = Math.max(10, ttlSec);
        for (Iterator<Map.Entry<String, Long>> it = nonceSeenAtSec.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, Long> e = it.next();
            if (nowSec - e.getValue() > ttl) {
                it.remove();
            }
        }
    }

    private static void deny(HttpServletResponse resp, int code, String msg) throws IOException {
        resp.setStatus(code);
        resp.setContentType(MediaType.TEXT_PLAIN_VALUE);
        resp.getWriter().write(msg);
    }

    /**
     * 签名校验读过 body 之后，让 @RequestBody 还能再读一次
     */
    private static final class CachedBodyRequest extends HttpServletRequestWrapper {
        private final byte[] body;

        CachedBodyRequest(HttpServletRequest request, byte[] body) {
            super(request);
            this.body = body;
        }

        @Override
        public ServletInputStream getInputStream() {
            ByteArrayInputStream in = new ByteArrayInputStream(body);
            return new ServletInputStream() {
                @Override
                public int read() {
                    return in.read();
                }

                @Override
                public boolean isFinished() {
                    return in.available() <= 0;
                }

                @Override
                public boolean isReady() {
                    return true;
                }

                @Override
                public void setReadListener(ReadListener readListener) {
                    throw new UnsupportedOperationException("async read is not supported");
                }
            };
        }

        @Override
        public BufferedReader getReader() {
            return new BufferedReader(new InputStreamReader(getInputStream(), StandardCharsets.UTF_8));
        }
    }
}
