package kohost.terminal.realtime;

import kohost.terminal.TerminalUser;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TerminalHandshakeInterceptorTest {

    @Test
    void testUserFromHeaders() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/kohost/terminal/ws");
        req.addHeader("X-User-Id", "7");
        Map<String, Object> attrs = new HashMap<>();

        assertTrue(handshake(new TerminalHandshakeInterceptor(false), req, new MockHttpServletResponse(), attrs));
        TerminalUser user = (TerminalUser) attrs.get(TerminalHandshakeInterceptor.USER_ATTR);
        assertEquals("7", user.getUserId());
        assertNull(user.getUsername());
    }

    @Test
    void testQueryIdentityIgnoredByDefault() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/kohost/terminal/ws");
        req.setQueryString("userId=42&username=alice");
        MockHttpServletResponse resp = new MockHttpServletResponse();
        Map<String, Object> attrs = new HashMap<>();

        assertFalse(handshake(new TerminalHandshakeInterceptor(false), req, resp, attrs));
        assertEquals(401, resp.getStatus());
        assertTrue(attrs.isEmpty());
    }

    @Test
    void testHeaderWinsOverQuery() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/kohost/terminal/ws");
        req.setQueryString("userId=99&username=mallory");
        req.addHeader("X-User-Id", "42");
        req.addHeader("X-Username", "alice");
        Map<String, Object> attrs = new HashMap<>();

        assertTrue(handshake(new TerminalHandshakeInterceptor(true), req, new MockHttpServletResponse(), attrs));
        assertEquals(new TerminalUser("42", "alice"), attrs.get(TerminalHandshakeInterceptor.USER_ATTR));
    }

    @Test
    void testQueryIdentityWhenEnabled() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/kohost/terminal/ws");
        req.setQueryString("userId=42&username=alice");
        Map<String, Object> attrs = new HashMap<>();

        assertTrue(handshake(new TerminalHandshakeInterceptor(true), req, new MockHttpServletResponse(), attrs));
        assertEquals(new TerminalUser("42", "alice"), attrs.get(TerminalHandshakeInterceptor.USER_ATTR));
    }

    @Test
    void testMissingUserIsUnauthorized() {
        MockHttpServletResponse resp = new MockHttpServletResponse();
        Map<String, Object> attrs = new HashMap<>();

        assertFalse(handshake(new TerminalHandshakeInterceptor(true),
                new MockHttpServletRequest("GET", "/api/kohost/terminal/ws"), resp, attrs));
        assertEquals(401, resp.getStatus());
        assertTrue(attrs.isEmpty());
    }

    private static boolean handshake(TerminalHandshakeInterceptor interceptor, MockHttpServletRequest req,
                                     MockHttpServletResponse resp, Map<String, Object> attrs) {
        return interceptor.beforeHandshake(new ServletServerHttpRequest(req),
                new ServletServerHttpResponse(resp), null, attrs);
    }
}
