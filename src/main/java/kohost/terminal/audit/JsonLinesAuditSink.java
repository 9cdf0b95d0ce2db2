package kohost.terminal.audit;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 审计落盘：每天一个文件 {dir}/terminal-audit-yyyy-MM-dd.jsonl，每行一个 JSON 对象
 */
public class JsonLinesAuditSink implements AuditSink {
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final Path dir;
    private final ObjectMapper objectMapper;
    private final ZoneId zone;

    public JsonLinesAuditSink(Path dir, ObjectMapper objectMapper) {
        this(dir, objectMapper, ZoneId.systemDefault());
    }

    public JsonLinesAuditSink(Path dir, ObjectMapper objectMapper, ZoneId zone) {
        this.dir = dir;
        this.objectMapper = objectMapper;
        this.zone = zone;
    }

    @Override
    public synchronized void append(AuditRecord record) throws IOException {
        Files.createDirectories(dir);
        Path file = fileFor(record);
        byte[] line = (objectMapper.writeValueAsString(toMap(record)) + "\n").getBytes(StandardCharsets.UTF_8);
        Files.write(file, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    Path fileFor(AuditRecord record) {
        return dir.resolve("terminal-audit-" + DAY.format(record.getExecutedAt().atZone(zone)) + ".jsonl");
    }

    private Map<String, Object> toMap(AuditRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("executedAt", r.getExecutedAt().toString());
        m.put("userId", r.getUserId());
        m.put("siteId", r.getSiteId());
        m.put("sessionId", r.getSessionId());
        m.put("invocationId", r.getInvocationId());
        m.put("command", r.getCommand());
        m.put("backend", r.getBackend());
        m.put("status", r.getStatus());
        m.put("exitCode", r.getExitCode());
        m.put("error", r.getError());
        m.put("durationMs", r.getDurationMs());
        return m;
    }
}
