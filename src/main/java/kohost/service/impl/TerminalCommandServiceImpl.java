package kohost.service.impl;

import kohost.entity.request.TerminalExecRequest;
import kohost.entity.response.TerminalCommandCatalogResponse;
import kohost.entity.response.TerminalExecResponse;
import kohost.service.TerminalCommandService;
import kohost.terminal.InfrastructureException;
import kohost.terminal.TerminalActivityTracker;
import kohost.terminal.TerminalEventSink;
import kohost.terminal.TerminalProperties;
import kohost.terminal.TerminalUser;
import kohost.terminal.audit.AuditLogger;
import kohost.terminal.audit.AuditRecord;
import kohost.terminal.backend.ContainerLifecycleManager;
import kohost.terminal.backend.ExecutionBackend;
import kohost.terminal.exec.ExecHandle;
import kohost.terminal.exec.Invocation;
import kohost.terminal.exec.InvocationListener;
import kohost.terminal.exec.InvocationOutcome;
import kohost.terminal.exec.OutputType;
import kohost.terminal.exec.StreamingExecutor;
import kohost.terminal.policy.CommandValidator;
import kohost.terminal.policy.CommandVerdict;
import kohost.terminal.session.CdResult;
import kohost.terminal.session.TerminalSession;
import kohost.terminal.session.TerminalSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * 命令编排：会话 cwd / 站点绑定 -> 安全校验 -> 确保容器运行 -> 流式执行 -> 审计。
 * <p>
 * WebSocket 线程只负责解析和占用会话槽位，其余 I/O 都在 dispatch 线程池里执行。
 */
@Service
public class TerminalCommandServiceImpl implements TerminalCommandService {
    private static final Logger log = LoggerFactory.getLogger(TerminalCommandServiceImpl.class);

    static final List<String> BUILTINS = List.of("help", "clear", "pwd");

    private static final Pattern PWD_WITH_FLAGS = Pattern.compile("^pwd(\\s+-[LP]+)+$");

    /**
     * HTTP 一次性执行：在命令超时之外再多等一会儿（容器创建、审计）
     */
    private static final long HTTP_EXTRA_WAIT_SECONDS = 30L;

    private final TerminalProperties props;
    private final CommandValidator validator;
    private final TerminalSessionStore sessions;
    private final ContainerLifecycleManager lifecycleManager;
    private final StreamingExecutor executor;
    private final AuditLogger auditLogger;
    private final TerminalActivityTracker activityTracker;
    private final Executor dispatcher;

    public TerminalCommandServiceImpl(TerminalProperties props,
                                      CommandValidator validator,
                                      TerminalSessionStore sessions,
                                      ContainerLifecycleManager lifecycleManager,
                                      StreamingExecutor executor,
                                      AuditLogger auditLogger,
                                      TerminalActivityTracker activityTracker,
                                      @Qualifier("terminalDispatchExecutor") Executor dispatcher) {
        this.props = props;
        this.validator = validator;
        this.sessions = sessions;
        this.lifecycleManager = lifecycleManager;
        this.executor = executor;
        this.auditLogger = auditLogger;
        this.activityTracker = activityTracker;
        this.dispatcher = dispatcher;
    }

    @Override
    public TerminalSession openSession(String sessionId, TerminalUser user) {
        assertEnabled();
        activityTracker.touch(user.getUserId());
        return sessions.open(sessionId, user);
    }

    @Override
    public void closeSession(String sessionId) {
        sessions.close(sessionId);
    }

    @Override
    public void submit(String sessionId, String command, String siteId, TerminalEventSink sink) {
        TerminalSession session = sessions.find(sessionId).orElse(null);
        if (session == null) {
            sink.commandError("Terminal session is closed, reconnect and retry", InvocationOutcome.REJECTED, null);
            return;
        }
        String raw = command == null ? "" : command.trim();
        TerminalUser user = session.getUser();
        activityTracker.touch(user.getUserId());

        Invocation inv = new Invocation(sessionId, user.getUserId(), trimToNull(siteId), raw);
        if (!session.tryBegin(inv)) {
            // 同一会话不排队：输出不会交错
            log.debug("command rejected, session busy: sessionId={}, command={}", sessionId, raw);
            sink.commandError("Another command is still running, wait for it to finish or send cancel_command first",
                    InvocationOutcome.REJECTED, null);
            return;
        }
        try {
            dispatcher.execute(() -> process(session, inv, sink));
        } catch (RejectedExecutionException e) {
            log.warn("dispatch rejected: sessionId={}, error={}", sessionId, e.getMessage());
            inv.finish(InvocationOutcome.FAILURE, null);
            session.end(inv, () -> sink.commandError("Terminal is busy, retry in a moment", InvocationOutcome.FAILURE, null));
        }
    }

    @Override
    public boolean cancel(String sessionId) {
        return executor.cancel(sessionId);
    }

    @Override
    public TerminalExecResponse executeOnce(TerminalExecRequest request) {
        if (request == null || !StringUtils.hasText(request.getUserId())) {
            throw new IllegalArgumentException("userId must not be empty");
        }
        if (!StringUtils.hasText(request.getCommand())) {
            throw new IllegalArgumentException("command must not be empty");
        }
        TerminalUser user = new TerminalUser(request.getUserId(), request.getUsername());
        String sessionId = "http-" + UUID.randomUUID();
        TerminalSession session = openSession(sessionId, user);
        CollectingEventSink sink = new CollectingEventSink();
        try {
            submit(sessionId, request.getCommand(), request.getSiteId(), sink);
            long waitSeconds = props.getExecTimeoutSeconds() + HTTP_EXTRA_WAIT_SECONDS;
            if (!sink.await(waitSeconds, TimeUnit.SECONDS)) {
                log.warn("http exec did not finish in time: userId={}, command={}", user.getUserId(), request.getCommand());
                executor.cancel(sessionId);
                sink.await(2, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.cancel(sessionId);
        } finally {
            sessions.close(sessionId);
        }

        TerminalExecResponse resp = new TerminalExecResponse();
        resp.setCommand(request.getCommand().trim());
        resp.setBackend(lifecycleManager.getBackend().name());
        InvocationOutcome outcome = sink.getOutcome();
        resp.setOutcome(outcome == null ? InvocationOutcome.RUNNING.getWireName() : outcome.getWireName());
        resp.setExitCode(sink.getExitCode());
        resp.setOutput(sink.getOutput());
        resp.setTruncated(sink.isTruncated());
        resp.setError(sink.getError());
        resp.setCwd(session.getCwd());
        return resp;
    }

    @Override
    public TerminalCommandCatalogResponse commandCatalog() {
        TerminalCommandCatalogResponse resp = new TerminalCommandCatalogResponse();
        resp.setCategories(validator.getPolicy().catalog());
        resp.setBuiltins(BUILTINS);
        resp.setBlockedOperators(validator.getPolicy().getBlockedOperators());
        resp.setMaxCommandLength(validator.getPolicy().getMaxLength());
        return resp;
    }

    @Override
    public String backendName() {
        return lifecycleManager.getBackend().name();
    }

    private void process(TerminalSession session, Invocation inv, TerminalEventSink sink) {
        String sessionId = session.getSessionId();
        TerminalUser user = session.getUser();
        ExecutionBackend backend = lifecycleManager.getBackend();
        inv.setBackend(backend.name());
        boolean acquired = false;
        try {
            String cwd = sessions.setSiteBinding(sessionId, inv.getSiteId());
            String raw = inv.getCommand();

            String builtin = builtinName(raw);
            if (builtin != null) {
                runBuiltin(session, inv, builtin, sink);
                return;
            }

            CommandVerdict verdict = validator.evaluate(raw);
            if (!verdict.isAllowed()) {
                reject(session, inv, verdict.getReason(), sink);
                return;
            }
            // cd 的目标由会话按逻辑路径解析，不经过后端参数检查
            if (!"cd".equals(verdict.getPrimaryCommand())) {
                Optional<String> denied = backend.checkArguments(user, raw);
                if (denied.isPresent()) {
                    reject(session, inv, denied.get(), sink);
                    return;
                }
            }

            sink.commandStarted(raw, backend.name(), inv.getSiteId());
            lifecycleManager.acquire(user.getUserId());
            acquired = true;
            lifecycleManager.ensureRunning(user, line -> sink.output(OutputType.INFO, line + "\n"));

            if ("cd".equals(verdict.getPrimaryCommand())) {
                changeDir(session, inv, raw.substring(2).trim(), sink);
                return;
            }

            inv.setResolvedCommand(backend.describeCommand(user, cwd, raw));
            log.info("exec command: userId={}, sessionId={}, invocationId={}, backend={}, cwd={}, command={}",
                    user.getUserId(), sessionId, inv.getId(), backend.name(), cwd, raw);
            ExecHandle handle = backend.exec(user, cwd, raw, inv.getId());
            executor.run(sessionId, inv, handle, Duration.ofSeconds(props.getExecTimeoutSeconds()),
                    new SessionBridge(session, sink));
            // 执行期间连接可能已断开：close 时还没注册到执行器，这里补一次取消
            if (session.isClosed()) {
                executor.cancel(sessionId);
            }
        } catch (InfrastructureException e) {
            log.warn("command aborted, execution environment unavailable: userId={}, sessionId={}, error={}",
                    user.getUserId(), sessionId, e.getMessage());
            abort(session, inv, acquired, e.getUserMessage(), e.getMessage(), sink);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("command aborted: userId={}, sessionId={}, error={}", user.getUserId(), sessionId, e.getMessage());
            abort(session, inv, acquired, e.getMessage(), e.getMessage(), sink);
        } catch (RuntimeException e) {
            log.error("command failed: userId={}, sessionId={}, error={}", user.getUserId(), sessionId, e.getMessage(), e);
            abort(session, inv, acquired, "Failed to execute command", e.getMessage(), sink);
        }
    }

    private void reject(TerminalSession session, Invocation inv, String reason, TerminalEventSink sink) {
        log.info("command rejected: userId={}, sessionId={}, command={}, reason={}",
                inv.getUserId(), session.getSessionId(), inv.getCommand(), reason);
        inv.finish(InvocationOutcome.REJECTED, null);
        audit(inv, session, reason);
        session.end(inv, () -> sink.commandError(reason, InvocationOutcome.REJECTED, null));
    }

    /**
     * help / clear 只认整条命令；pwd 的 -P/-L 等参数忽略，始终输出逻辑路径
     */
    static String builtinName(String raw) {
        if (BUILTINS.contains(raw)) {
            return raw;
        }
        if (PWD_WITH_FLAGS.matcher(raw).matches()) {
            return "pwd";
        }
        return null;
    }

    private void runBuiltin(TerminalSession session, Invocation inv, String name, TerminalEventSink sink) {
        inv.finish(InvocationOutcome.SUCCESS, 0);
        session.end(inv, () -> {
            switch (name) {
                case "help" -> sink.output(OutputType.STDOUT, helpText());
                case "clear" -> sink.clear();
                case "pwd" -> sink.output(OutputType.STDOUT, session.getCwd() + "\n");
                default -> throw new IllegalStateException("unknown builtin: " + name);
            }
            sink.completed(0, InvocationOutcome.SUCCESS);
        });
    }

    private void changeDir(TerminalSession session, Invocation inv, String target, TerminalEventSink sink) {
        TerminalUser user = session.getUser();
        ExecutionBackend backend = lifecycleManager.getBackend();
        CdResult r = sessions.changeDir(session.getSessionId(), target, p -> backend.isDirectory(user, p));
        lifecycleManager.release(user.getUserId());
        if (r.isChanged()) {
            inv.finish(InvocationOutcome.SUCCESS, 0);
            audit(inv, session, null);
            session.end(inv, () -> {
                sink.output(OutputType.STDOUT, r.getPath() + "\n");
                sink.completed(0, InvocationOutcome.SUCCESS);
            });
        } else {
            inv.finish(InvocationOutcome.FAILURE, 1);
            audit(inv, session, r.getReason());
            session.end(inv, () -> sink.commandError(r.getReason(), InvocationOutcome.FAILURE, 1));
        }
    }

    private void abort(TerminalSession session, Invocation inv, boolean acquired,
                       String userMessage, String auditError, TerminalEventSink sink) {
        if (acquired) {
            lifecycleManager.release(session.getUser().getUserId());
        }
        if (inv.finish(InvocationOutcome.FAILURE, null)) {
            audit(inv, session, auditError);
        }
        session.end(inv, () -> sink.commandError(userMessage, InvocationOutcome.FAILURE, null));
    }

    private void audit(Invocation inv, TerminalSession session, String error) {
        long durationMs = Duration.between(inv.getStartedAt(), Instant.now()).toMillis();
        auditLogger.record(AuditRecord.builder()
                .userId(inv.getUserId())
                .siteId(inv.getSiteId())
                .sessionId(session.getSessionId())
                .invocationId(inv.getId())
                .command(inv.getCommand())
                .backend(inv.getBackend())
                .status(inv.getOutcome().getWireName())
                .exitCode(inv.getExitCode())
                .error(error)
                .durationMs(durationMs)
                .executedAt(inv.getStartedAt())
                .build());
    }

    private String helpText() {
        StringBuilder sb = new StringBuilder("\nAvailable commands:\n");
        for (Map.Entry<String, List<String>> e : validator.getPolicy().catalog().entrySet()) {
            sb.append("  ").append(String.format("%-20s", e.getKey())).append(String.join(", ", e.getValue())).append('\n');
        }
        sb.append("  ").append(String.format("%-20s", "Built-in")).append(String.join(", ", BUILTINS)).append('\n');
        sb.append("\nTip: use \"cd folder\" to change directory persistently\n\n");
        return sb.toString();
    }

    private void assertEnabled() {
        if (!props.isEnabled()) {
            throw new IllegalStateException("terminal is disabled");
        }
    }

    private static String trimToNull(String s) {
        return StringUtils.hasText(s) ? s.trim() : null;
    }

    /**
     * 执行器回调 -> 会话 / 审计 / 客户端事件。终态事件在槽位释放之前推送完，
     * 客户端收到 command_completed 时槽位已空，可以立即提交下一条命令。
     */
    private final class SessionBridge implements InvocationListener {
        private final TerminalSession session;
        private final TerminalEventSink sink;
        private volatile boolean hasOutput;

        private SessionBridge(TerminalSession session, TerminalEventSink sink) {
            this.session = session;
            this.sink = sink;
        }

        @Override
        public void onOutput(Invocation invocation, OutputType type, String chunk) {
            hasOutput = true;
            sink.output(type, chunk);
        }

        @Override
        public void onCompleted(Invocation invocation, int exitCode) {
            settle(invocation, exitCode == 0 ? null : "exit code " + exitCode, () -> {
                if (exitCode != 0 && !hasOutput) {
                    sink.output(OutputType.INFO, "Command finished with no output (exit code: " + exitCode + ")\n");
                }
                sink.completed(exitCode, invocation.getOutcome());
            });
        }

        @Override
        public void onError(Invocation invocation, InvocationOutcome outcome, String message) {
            settle(invocation, message, () -> sink.commandError(message, outcome, invocation.getExitCode()));
        }

        private void settle(Invocation invocation, String error, Runnable finalEvents) {
            lifecycleManager.release(session.getUser().getUserId());
            audit(invocation, session, error);
            session.end(invocation, finalEvents);
        }
    }

    /**
     * HTTP 一次性执行时的事件收集器
     */
    static final class CollectingEventSink implements TerminalEventSink {
        private static final int MAX_OUTPUT_CHARS = 256 * 1024;

        private final StringBuilder output = new StringBuilder();
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile boolean truncated;
        private volatile InvocationOutcome outcome;
        private volatile Integer exitCode;
        private volatile String error;

        @Override
        public void commandStarted(String command, String backend, String site) {
        }

        @Override
        public synchronized void output(OutputType type, String data) {
            if (data == null) return;
            int room = MAX_OUTPUT_CHARS - output.length();
            if (room <= 0) {
                truncated = true;
                return;
            }
            if (data.length() > room) {
                output.append(data, 0, room);
                truncated = true;
            } else {
                output.append(data);
            }
        }

        @Override
        public void completed(int exitCode, InvocationOutcome outcome) {
            this.exitCode = exitCode;
            this.outcome = outcome;
            done.countDown();
        }

        @Override
        public void commandError(String error, InvocationOutcome outcome, Integer exitCode) {
            this.error = error;
            this.outcome = outcome;
            this.exitCode = exitCode;
            done.countDown();
        }

        boolean await(long timeout, TimeUnit unit) throws InterruptedException {
            return done.await(timeout, unit);
        }

        synchronized String getOutput() {
            return output.toString();
        }

        boolean isTruncated() {
            return truncated;
        }

        InvocationOutcome getOutcome() {
            return outcome;
        }

        Integer getExitCode() {
            return exitCode;
        }

        String getError() {
            return error;
        }
    }
}
