package kohost.terminal.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import kohost.service.TerminalCommandService;
import kohost.terminal.TerminalUser;
import kohost.terminal.session.TerminalSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class TerminalWebSocketHandlerTest {

    private TerminalCommandService commandService;
    private TerminalWebSocketHandler handler;
    private WebSocketSession session;
    private final Map<String, Object> attributes = new HashMap<>();
    private final TerminalUser user = new TerminalUser("42", "alice");

    @BeforeEach
    void setUp() throws Exception {
        commandService = mock(TerminalCommandService.class);
        handler = new TerminalWebSocketHandler(commandService, new ObjectMapper());
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws1");
        when(session.isOpen()).thenReturn(true);
        when(session.getAttributes()).thenReturn(attributes);
        when(commandService.openSession(eq("ws1"), any())).thenReturn(new TerminalSession("ws1", user, "/workspace"));
        when(commandService.backendName()).thenReturn("docker");
    }

    private void connect() throws Exception {
        attributes.put(TerminalHandshakeInterceptor.USER_ATTR, user);
        handler.afterConnectionEstablished(session);
    }

    @Test
    void testConnectOpensSessionAndSendsReady() throws Exception {
        connect();
        verify(commandService).openSession("ws1", user);
        verify(session).sendMessage(argThat(m -> m instanceof TextMessage
                && ((TextMessage) m).getPayload().contains("\"event\":\"terminal_ready\"")
                && ((TextMessage) m).getPayload().contains("\"cwd\":\"/workspace\"")));
        assertInstanceOf(WebSocketTerminalEventSink.class, attributes.get(TerminalWebSocketHandler.SINK_ATTR));
    }

    @Test
    void testConnectWithoutUserIsClosed() throws Exception {
        handler.afterConnectionEstablished(session);
        verify(session).close(CloseStatus.POLICY_VIOLATION);
        verify(commandService, never()).openSession(any(), any());
    }

    @Test
    void testExecuteCommandEvent() throws Exception {
        connect();
        handler.handleTextMessage(session, new TextMessage("{\"event\":\"execute_command\",\"command\":\"npm install\",\"siteId\":\"7\"}"));
        verify(commandService).submit(eq("ws1"), eq("npm install"), eq("7"), any(WebSocketTerminalEventSink.class));
    }

    @Test
    void testPlainTextIsTreatedAsCommand() throws Exception {
        connect();
        handler.handleTextMessage(session, new TextMessage("ls -la"));
        verify(commandService).submit(eq("ws1"), eq("ls -la"), isNull(), any(WebSocketTerminalEventSink.class));
    }

    @Test
    void testCancelAndPing() throws Exception {
        connect();
        handler.handleTextMessage(session, new TextMessage("{\"event\":\"cancel_command\"}"));
        verify(commandService).cancel("ws1");

        handler.handleTextMessage(session, new TextMessage("{\"event\":\"ping\"}"));
        verify(session).sendMessage(argThat(m -> m instanceof TextMessage
                && ((TextMessage) m).getPayload().contains("\"event\":\"pong\"")));
    }

    @Test
    void testUnknownEventIsIgnored() throws Exception {
        connect();
        handler.handleTextMessage(session, new TextMessage("{\"event\":\"resize\",\"cols\":80}"));
        verify(commandService, never()).submit(any(), any(), any(), any());
        verify(commandService, never()).cancel(any());
    }

    @Test
    void testDisconnectClosesSession() throws Exception {
        connect();
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);
        verify(commandService).closeSession("ws1");
    }
}
