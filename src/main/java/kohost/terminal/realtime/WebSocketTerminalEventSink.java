package kohost.terminal.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import kohost.terminal.TerminalEventSink;
import kohost.terminal.exec.InvocationOutcome;
import kohost.terminal.exec.OutputType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把终端事件编码为 JSON 帧：{event:"command_output", type:"stdout", data:"..."}。
 * session 需要是线程安全的（ConcurrentWebSocketSessionDecorator），输出泵和分发线程会并发发送。
 */
public class WebSocketTerminalEventSink implements TerminalEventSink {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTerminalEventSink.class);

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketTerminalEventSink(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public void ready(String backend, String cwd) {
        Map<String, Object> m = event("terminal_ready");
        m.put("backend", backend);
        m.put("cwd", cwd);
        send(m);
    }

    @Override
    public void commandStarted(String command, String backend, String site) {
        Map<String, Object> m = event("command_started");
        m.put("command", command);
        m.put("backend", backend);
        m.put("site", site);
        send(m);
    }

    @Override
    public void output(OutputType type, String data) {
        Map<String, Object> m = event("command_output");
        m.put("type", type.getWireName());
        m.put("data", data);
        send(m);
    }

    @Override
    public void completed(int exitCode, InvocationOutcome outcome) {
        Map<String, Object> m = event("command_completed");
        m.put("exitCode", exitCode);
        m.put("outcome", outcome.getWireName());
        send(m);
    }

    @Override
    public void commandError(String error, InvocationOutcome outcome, Integer exitCode) {
        Map<String, Object> m = event("command_error");
        m.put("error", error);
        m.put("outcome", outcome.getWireName());
        if (exitCode != null) {
            m.put("exitCode", exitCode);
        }
        send(m);
    }

    @Override
    public void clear() {
        send(event("terminal_clear"));
    }

    public void pong() {
        send(event("pong"));
    }

    private Map<String, Object> event(String name) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("event", name);
        return m;
    }

    private void send(Map<String, Object> payload) {
        if (!session.isOpen()) {
            log.debug("drop event, session closed: sessionId={}, event={}", session.getId(), payload.get("event"));
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
        } catch (JsonProcessingException e) {
            log.warn("encode event failed: sessionId={}, event={}, error={}", session.getId(), payload.get("event"), e.getMessage());
        } catch (IOException | IllegalStateException e) {
            // 连接已断开，会话由 afterConnectionClosed 清理
            log.debug("send event failed: sessionId={}, event={}, error={}", session.getId(), payload.get("event"), e.getMessage());
        }
    }
}
