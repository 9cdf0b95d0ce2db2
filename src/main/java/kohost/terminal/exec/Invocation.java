package kohost.terminal.exec;

import java.time.Instant;
import java.util.UUID;

/**
 * 一次 execute_command 对应一个 Invocation，归属于唯一的会话
 */
public class Invocation {
    private final String id;
    private final String sessionId;
    private final String userId;
    private final String siteId;
    private final String command;
    private final Instant startedAt;

    private volatile String resolvedCommand;
    private volatile String backend;
    private volatile Integer exitCode;
    private volatile InvocationOutcome outcome = InvocationOutcome.RUNNING;

    public Invocation(String sessionId, String userId, String siteId, String command) {
        this(UUID.randomUUID().toString(), sessionId, userId, siteId, command, Instant.now());
    }

    public Invocation(String id, String sessionId, String userId, String siteId, String command, Instant startedAt) {
        this.id = id;
        this.sessionId = sessionId;
        this.userId = userId;
        this.siteId = siteId;
        this.command = command;
        this.startedAt = startedAt;
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getSiteId() {
        return siteId;
    }

    public String getCommand() {
        return command;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public String getResolvedCommand() {
        return resolvedCommand;
    }

    public void setResolvedCommand(String resolvedCommand) {
        this.resolvedCommand = resolvedCommand;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public InvocationOutcome getOutcome() {
        return outcome;
    }

    /**
     * 只允许从 RUNNING 迁移一次
     */
    public synchronized boolean finish(InvocationOutcome outcome, Integer exitCode) {
        if (this.outcome.isTerminal()) {
            return false;
        }
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalArgumentException("terminal outcome required: " + outcome);
        }
        this.exitCode = exitCode;
        this.outcome = outcome;
        return true;
    }

    @Override
    public String toString() {
        return "Invocation{id=" + id + ", sessionId=" + sessionId + ", command=" + command + ", outcome=" + outcome + "}";
    }
}
