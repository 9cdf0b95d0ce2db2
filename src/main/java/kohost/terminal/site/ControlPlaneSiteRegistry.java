package kohost.terminal.site;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kohost.terminal.TerminalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * 通过控制面 API 查询站点目录名：
 * GET {baseUrl}/api/kohost/internal/sites/{siteId}?userId=..，返回 {code:200, data:{name:"my-site"}}
 */
@Component
public class ControlPlaneSiteRegistry implements SiteRegistry {
    private static final Logger log = LoggerFactory.getLogger(ControlPlaneSiteRegistry.class);

    private final TerminalProperties props;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public ControlPlaneSiteRegistry(TerminalProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    }

    @Override
    public Optional<String> findSiteFolder(String userId, String siteId) {
        TerminalProperties.SiteRegistry cfg = props.getSiteRegistry();
        if (cfg == null || !cfg.isEnabled() || !StringUtils.hasText(siteId)) {
            return Optional.empty();
        }
        if (!StringUtils.hasText(cfg.getBaseUrl())) {
            log.debug("site registry skipped: missing baseUrl");
            return Optional.empty();
        }

        String url = joinUrl(cfg.getBaseUrl(), "/api/kohost/internal/sites/" + encode(siteId.trim()))
                + "?userId=" + encode(userId == null ? "" : userId);
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(Math.max(500, cfg.getTimeoutMs())))
                .header("Accept", "application/json")
                .GET();
        if (StringUtils.hasText(cfg.getToken())) {
            b.header("X-Kohost-Node-Token", cfg.getToken());
        }

        try {
            HttpResponse<byte[]> resp = httpClient.send(b.build(), HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() / 100 != 2) {
                log.warn("site lookup failed: http={}, siteId={}", resp.statusCode(), siteId);
                return Optional.empty();
            }
            JsonNode root = objectMapper.readTree(resp.body());
            JsonNode code = root.get("code");
            if (code != null && code.asInt() != 200) {
                log.debug("site lookup rejected: siteId={}, code={}", siteId, code.asInt());
                return Optional.empty();
            }
            JsonNode name = root.path("data").path("name");
            if (name.isMissingNode() || !StringUtils.hasText(name.asText(null))) {
                return Optional.empty();
            }
            return Optional.of(name.asText());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            log.warn("site lookup request failed: siteId={}, error={}", siteId, e.getMessage());
            return Optional.empty();
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private String joinUrl(String baseUrl, String path) {
        String b = baseUrl.trim();
        if (b.endsWith("/")) b = b.substring(0, b.length() - 1);
        String p = (path == null ? "" : path.trim());
        if (!p.startsWith("/")) p = "/" + p;
        return b + p;
    }
}
