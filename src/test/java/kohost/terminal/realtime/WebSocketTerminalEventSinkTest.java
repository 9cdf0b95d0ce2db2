package kohost.terminal.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kohost.terminal.exec.InvocationOutcome;
import kohost.terminal.exec.OutputType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WebSocketTerminalEventSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private WebSocketSession session;
    private WebSocketTerminalEventSink sink;

    @BeforeEach
    void setUp() {
        session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);
        when(session.getId()).thenReturn("ws1");
        sink = new WebSocketTerminalEventSink(session, objectMapper);
    }

    @Test
    void testEventsAreEncodedAsJsonFrames() throws Exception {
        sink.commandStarted("npm install", "docker", "7");
        sink.output(OutputType.STDOUT, "added 1 package\n");
        sink.completed(0, InvocationOutcome.SUCCESS);
        sink.commandError("Command timed out after 300s and was terminated", InvocationOutcome.TIMEOUT, null);

        List<JsonNode> frames = frames(4);
        assertEquals("command_started", frames.get(0).get("event").asText());
        assertEquals("npm install", frames.get(0).get("command").asText());
        assertEquals("7", frames.get(0).get("site").asText());

        assertEquals("command_output", frames.get(1).get("event").asText());
        assertEquals("stdout", frames.get(1).get("type").asText());
        assertEquals("added 1 package\n", frames.get(1).get("data").asText());

        assertEquals("command_completed", frames.get(2).get("event").asText());
        assertEquals(0, frames.get(2).get("exitCode").asInt());
        assertEquals("success", frames.get(2).get("outcome").asText());

        assertEquals("command_error", frames.get(3).get("event").asText());
        assertEquals("timeout", frames.get(3).get("outcome").asText());
        assertFalse(frames.get(3).has("exitCode"));
    }

    @Test
    void testClosedSessionDropsEvents() throws Exception {
        when(session.isOpen()).thenReturn(false);
        sink.output(OutputType.STDOUT, "x");
        verify(session, never()).sendMessage(any());
    }

    @Test
    void testSendFailureIsNotPropagated() throws Exception {
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());
        assertDoesNotThrow(() -> sink.completed(1, InvocationOutcome.FAILURE));
    }

    private List<JsonNode> frames(int n) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(n)).sendMessage(captor.capture());
        List<JsonNode> out = new ArrayList<>();
        for (TextMessage m : captor.getAllValues()) {
            out.add(objectMapper.readTree(m.getPayload()));
        }
        return out;
    }
}
