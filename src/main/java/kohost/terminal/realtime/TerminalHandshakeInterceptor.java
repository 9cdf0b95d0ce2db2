package kohost.terminal.realtime;

import kohost.terminal.TerminalUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * 握手时解析用户身份：前置身份层注入的 X-User-Id/X-Username 头优先；
 * query 里的 userId/username 只在 allowQueryIdentity 打开时作为兜底。缺少 userId 时返回 401
 */
public class TerminalHandshakeInterceptor implements HandshakeInterceptor {
    private static final Logger log = LoggerFactory.getLogger(TerminalHandshakeInterceptor.class);

    static final String USER_ATTR = "TERMINAL_USER";

    private final boolean allowQueryIdentity;

    public TerminalHandshakeInterceptor(boolean allowQueryIdentity) {
        this.allowQueryIdentity = allowQueryIdentity;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String userId = trimToNull(request.getHeaders().getFirst("X-User-Id"));
        String username = trimToNull(request.getHeaders().getFirst("X-Username"));
        if (userId == null && allowQueryIdentity) {
            MultiValueMap<String, String> q = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
            userId = trimToNull(q.getFirst("userId"));
            username = trimToNull(q.getFirst("username"));
        }
        if (userId == null) {
            log.debug("terminal handshake rejected: missing userId, remote={}", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(USER_ATTR, new TerminalUser(userId, username));
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    private static String trimToNull(String s) {
        return StringUtils.hasText(s) ? s.trim() : null;
    }
}
