package kohost.terminal.audit;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 命令审计：异步写入（单线程，保持顺序），写入失败只记日志，不影响用户反馈
 */
@Component
public class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final AuditSink sink;

    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "terminal-audit");
        t.setDaemon(true);
        return t;
    });

    public AuditLogger(AuditSink sink) {
        this.sink = sink;
    }

    public void record(AuditRecord record) {
        if (record == null) return;
        try {
            writer.execute(() -> write(record));
        } catch (RejectedExecutionException e) {
            log.warn("audit dropped (shutting down): userId={}, command={}", record.getUserId(), record.getCommand());
        }
    }

    private void write(AuditRecord record) {
        try {
            sink.append(record);
        } catch (Exception e) {
            log.warn("audit write failed: userId={}, invocationId={}, error={}",
                    record.getUserId(), record.getInvocationId(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("audit writer did not drain in time");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
