package kohost.terminal.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kohost.service.TerminalCommandService;
import kohost.terminal.TerminalUser;
import kohost.terminal.exec.InvocationOutcome;
import kohost.terminal.session.TerminalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 终端实时通道：
 * - 连接：ws://host/api/kohost/terminal/ws?userId=..&amp;username=..
 * - 入站(JSON)：{event:"execute_command", command:"npm install", siteId:"12"} / {event:"cancel_command"} / {event:"ping"}
 * - 出站(JSON)：terminal_ready / command_started / command_output / command_completed / command_error / terminal_clear / pong
 * <p>
 * 非 TTY：每条命令都是一次性执行，会话只保存逻辑 cwd。
 */
@Component
public class TerminalWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(TerminalWebSocketHandler.class);

    static final String SINK_ATTR = "TERMINAL_SINK";

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final TerminalCommandService commandService;
    private final ObjectMapper objectMapper;

    public TerminalWebSocketHandler(TerminalCommandService commandService, ObjectMapper objectMapper) {
        this.commandService = commandService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        WebSocketTerminalEventSink sink = new WebSocketTerminalEventSink(safe, objectMapper);

        Object u = session.getAttributes().get(TerminalHandshakeInterceptor.USER_ATTR);
        if (!(u instanceof TerminalUser)) {
            sink.commandError("missing user identity", InvocationOutcome.REJECTED, null);
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        TerminalUser user = (TerminalUser) u;
        TerminalSession ts;
        try {
            ts = commandService.openSession(session.getId(), user);
        } catch (IllegalStateException e) {
            sink.commandError(e.getMessage(), InvocationOutcome.REJECTED, null);
            session.close(CloseStatus.SERVICE_OVERLOAD);
            return;
        }
        session.getAttributes().put(SINK_ATTR, sink);
        log.info("terminal connected: sessionId={}, userId={}", session.getId(), user.getUserId());
        sink.ready(commandService.backendName(), ts.getCwd());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketTerminalEventSink sink = (WebSocketTerminalEventSink) session.getAttributes().get(SINK_ATTR);
        if (sink == null) return;

        JsonNode m;
        try {
            m = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            // 兼容直接发纯文本：整行当作命令
            commandService.submit(session.getId(), message.getPayload(), null, sink);
            return;
        }
        if (m == null || !m.isObject()) {
            commandService.submit(session.getId(), message.getPayload(), null, sink);
            return;
        }

        String event = text(m, "event");
        switch (event == null ? "" : event) {
            case "execute_command" -> commandService.submit(session.getId(), text(m, "command"), text(m, "siteId"), sink);
            case "cancel_command" -> {
                boolean canceled = commandService.cancel(session.getId());
                log.debug("cancel_command: sessionId={}, canceled={}", session.getId(), canceled);
            }
            case "ping" -> sink.pong();
            default -> log.debug("ignore unknown terminal event: sessionId={}, event={}", session.getId(), event);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("terminal transport error: sessionId={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        commandService.closeSession(session.getId());
        log.info("terminal disconnected: sessionId={}, status={}", session.getId(), status.getCode());
    }

    private static String text(JsonNode m, String field) {
        JsonNode n = m.get(field);
        if (n == null || n.isNull()) return null;
        return n.isValueNode() ? n.asText() : n.toString();
    }
}
