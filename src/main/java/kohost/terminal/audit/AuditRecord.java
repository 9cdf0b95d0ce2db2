package kohost.terminal.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 一条审计记录（只追加，不修改）
 */
@Value
@Builder
public class AuditRecord {
    String userId;
    String siteId;
    String sessionId;
    String invocationId;
    String command;
    String backend;
    /**
     * success / failure / rejected / timeout / canceled
     */
    String status;
    Integer exitCode;
    String error;
    Long durationMs;
    @Builder.Default
    Instant executedAt = Instant.now();
}
