package kohost.terminal.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesAuditSinkTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testAppendsOneJsonObjectPerLineIntoDailyFile() throws Exception {
        JsonLinesAuditSink sink = new JsonLinesAuditSink(dir.resolve("audit"), objectMapper, ZoneOffset.UTC);
        Instant at = Instant.parse("2024-05-01T23:30:00Z");

        sink.append(AuditRecord.builder().userId("42").siteId("7").sessionId("s1").invocationId("i1")
                .command("npm install").backend("docker").status("success").exitCode(0).durationMs(1200L)
                .executedAt(at).build());
        sink.append(AuditRecord.builder().userId("42").sessionId("s1").invocationId("i2")
                .command("rm -rf /").backend("docker").status("rejected").error("Command \"rm\" is blocked for system security")
                .durationMs(1L).executedAt(at).build());

        Path file = dir.resolve("audit").resolve("terminal-audit-2024-05-01.jsonl");
        assertEquals(file, sink.fileFor(AuditRecord.builder().executedAt(at).build()));
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());

        JsonNode first = objectMapper.readTree(lines.get(0));
        assertEquals("npm install", first.get("command").asText());
        assertEquals("success", first.get("status").asText());
        assertEquals(0, first.get("exitCode").asInt());
        assertEquals("2024-05-01T23:30:00Z", first.get("executedAt").asText());

        JsonNode second = objectMapper.readTree(lines.get(1));
        assertEquals("rejected", second.get("status").asText());
        assertTrue(second.get("exitCode").isNull());
    }
}
