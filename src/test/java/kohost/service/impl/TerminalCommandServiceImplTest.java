package kohost.service.impl;

import kohost.entity.request.TerminalExecRequest;
import kohost.entity.response.TerminalCommandCatalogResponse;
import kohost.entity.response.TerminalExecResponse;
import kohost.terminal.InfrastructureException;
import kohost.terminal.TerminalActivityTracker;
import kohost.terminal.TerminalProperties;
import kohost.terminal.TerminalUser;
import kohost.terminal.audit.AuditLogger;
import kohost.terminal.audit.AuditRecord;
import kohost.terminal.backend.ContainerLifecycleManager;
import kohost.terminal.backend.ContainerStatus;
import kohost.terminal.backend.FakeExecutionBackend;
import kohost.terminal.exec.InvocationOutcome;
import kohost.terminal.exec.OutputType;
import kohost.terminal.exec.ScriptedExecHandle;
import kohost.terminal.exec.StreamingExecutor;
import kohost.terminal.policy.CommandPolicy;
import kohost.terminal.policy.CommandValidator;
import kohost.terminal.session.TerminalSessionStore;
import kohost.terminal.site.SiteRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TerminalCommandServiceImplTest {

    private FakeExecutionBackend backend;
    private TerminalActivityTracker tracker;
    private StreamingExecutor executor;
    private AuditLogger auditLogger;
    private final List<AuditRecord> audits = new CopyOnWriteArrayList<>();
    private TerminalCommandServiceImpl service;
    private RecordingEventSink sink;

    @BeforeEach
    void setUp() {
        TerminalProperties props = new TerminalProperties();
        SiteRegistry siteRegistry = mock(SiteRegistry.class);
        when(siteRegistry.findSiteFolder(anyString(), anyString())).thenReturn(Optional.empty());
        when(siteRegistry.findSiteFolder("42", "7")).thenReturn(Optional.of("blog"));

        backend = new FakeExecutionBackend();
        backend.directories.add("/workspace/blog");
        backend.handles = cmd -> ScriptedExecHandle.finished("", "", 0);
        tracker = new TerminalActivityTracker();
        executor = new StreamingExecutor();
        auditLogger = new AuditLogger(audits::add);
        TerminalSessionStore sessions = new TerminalSessionStore(props, siteRegistry, executor);
        ContainerLifecycleManager manager = new ContainerLifecycleManager(backend, tracker, props);

        service = new TerminalCommandServiceImpl(props, new CommandValidator(CommandPolicy.defaults(1000)),
                sessions, manager, executor, auditLogger, tracker, Runnable::run);
        service.openSession("s1", new TerminalUser("42", "alice"));
        sink = new RecordingEventSink();
    }

    @AfterEach
    void tearDown() {
        auditLogger.shutdown();
        executor.shutdown();
    }

    @Test
    void testFirstCommandProvisionsEnvironmentAndStreamsOutput() throws Exception {
        backend.handles = cmd -> ScriptedExecHandle.finished("added 120 packages\n", "", 0);

        service.submit("s1", "npm install", null, sink);
        assertTrue(sink.awaitTerminal());

        assertEquals(List.of(
                "started:npm install",
                "info:Preparing your terminal environment, the first run may take a moment...\n",
                "info:Terminal environment is ready\n",
                "stdout:added 120 packages\n",
                "completed:0:success"), sink.events);
        assertEquals(1, backend.creates.get());
        assertEquals(List.of("/workspace"), backend.execCwds);
        assertEquals(0, tracker.inFlight("42"));

        auditLogger.shutdown();
        assertEquals(1, audits.size());
        assertEquals("success", audits.get(0).getStatus());
        assertEquals("npm install", audits.get(0).getCommand());
        assertEquals("fake", audits.get(0).getBackend());
    }

    @Test
    void testSecondCommandWhileBusyIsRejectedThenCancel() throws Exception {
        backend.statuses.put("42", ContainerStatus.RUNNING);
        backend.handles = cmd -> ScriptedExecHandle.blocking("");

        service.submit("s1", "npm run dev", null, sink);
        service.submit("s1", "ls", null, sink);
        assertTrue(sink.awaitTerminal());
        assertEquals("error:rejected", sink.last());
        assertTrue(sink.lastError.startsWith("Another command is still running"));
        assertEquals(List.of("npm run dev"), backend.execCommands);

        assertTrue(service.cancel("s1"));
        assertTrue(sink.awaitTerminal());
        assertEquals(InvocationOutcome.CANCELED, sink.lastOutcome);
        assertFalse(service.cancel("s1"));
    }

    @Test
    void testRejectedCommandNeverReachesBackend() throws Exception {
        service.submit("s1", "rm -rf /", null, sink);
        assertTrue(sink.awaitTerminal());

        assertEquals(List.of("error:rejected"), sink.events);
        assertEquals("Command \"rm\" is blocked for system security", sink.lastError);
        assertEquals(0, backend.creates.get());
        assertTrue(backend.execCommands.isEmpty());

        auditLogger.shutdown();
        assertEquals("rejected", audits.get(0).getStatus());
    }

    @Test
    void testCdPersistsAndIsUsedAsCwd() throws Exception {
        backend.statuses.put("42", ContainerStatus.RUNNING);

        service.submit("s1", "cd blog", null, sink);
        assertTrue(sink.awaitTerminal());
        assertEquals(List.of("started:cd blog", "stdout:/workspace/blog\n", "completed:0:success"), sink.events);

        service.submit("s1", "pwd", null, sink);
        assertTrue(sink.awaitTerminal());
        assertTrue(sink.events.contains("stdout:/workspace/blog\n"));

        service.submit("s1", "composer install", null, sink);
        assertTrue(sink.awaitTerminal());
        assertEquals(List.of("/workspace/blog"), backend.execCwds);

        service.submit("s1", "cd /etc", null, sink);
        assertTrue(sink.awaitTerminal());
        assertEquals("Access denied: can only navigate within /workspace", sink.lastError);
        assertEquals(InvocationOutcome.FAILURE, sink.lastOutcome);
        assertEquals(1, sink.lastExitCode);
    }

    @Test
    void testSiteBindingSetsInitialCwd() throws Exception {
        backend.statuses.put("42", ContainerStatus.RUNNING);
        service.submit("s1", "ls", "7", sink);
        assertTrue(sink.awaitTerminal());
        assertEquals(List.of("/workspace/blog"), backend.execCwds);
    }

    @Test
    void testUnavailableRuntimeAbortsWithRemediation() throws Exception {
        backend.unavailable = new InfrastructureException("Container runtime is not available", "Start Docker and retry");

        service.submit("s1", "ls", null, sink);
        assertTrue(sink.awaitTerminal());

        assertEquals("error:failure", sink.last());
        assertEquals("Container runtime is not available. Start Docker and retry", sink.lastError);
        assertEquals(0, tracker.inFlight("42"));

        // 会话槽位已释放，下一条命令可以执行
        backend.unavailable = null;
        service.submit("s1", "ls", null, sink);
        assertTrue(sink.awaitTerminal());
        assertEquals("completed:0:success", sink.last());
    }

    @Test
    void testNonZeroExitWithoutOutputAddsInfoLine() throws Exception {
        backend.statuses.put("42", ContainerStatus.RUNNING);
        backend.handles = cmd -> ScriptedExecHandle.finished("", "", 2);

        service.submit("s1", "php artisan", null, sink);
        assertTrue(sink.awaitTerminal());

        assertEquals(List.of(
                "started:php artisan",
                "info:Command finished with no output (exit code: 2)\n",
                "completed:2:failure"), sink.events);
    }

    @Test
    void testSubmitDuringFinalEventsWaitsForTerminalEvent() throws Exception {
        backend.statuses.put("42", ContainerStatus.RUNNING);
        backend.handles = cmd -> "npm test".equals(cmd)
                ? ScriptedExecHandle.finished("", "", 1)
                : ScriptedExecHandle.finished("a.txt\n", "", 0);
        // 收到收尾的提示行时立刻再提交一条：上一条的终态事件还没发出，必须被拒绝
        RecordingEventSink eager = new RecordingEventSink() {
            @Override
            public void output(OutputType type, String data) {
                super.output(type, data);
                if (data.startsWith("Command finished with no output")) {
                    service.submit("s1", "ls", null, this);
                }
            }
        };

        service.submit("s1", "npm test", null, eager);
        assertTrue(eager.awaitTerminal());
        assertTrue(eager.awaitTerminal());
        assertEquals(List.of(
                "started:npm test",
                "info:Command finished with no output (exit code: 1)\n",
                "error:rejected",
                "completed:1:failure"), eager.events);
        assertEquals(List.of("npm test"), backend.execCommands);

        service.submit("s1", "ls", null, eager);
        assertTrue(eager.awaitTerminal());
        assertEquals("completed:0:success", eager.last());
    }

    @Test
    void testBackendArgumentCheckRejectsBeforeExec() throws Exception {
        backend.statuses.put("42", ContainerStatus.RUNNING);
        backend.directories.add("/workspace/blog");
        backend.argumentCheck = cmd -> cmd.contains("..")
                ? Optional.of("Access to \"..\" is not allowed on this terminal") : Optional.empty();

        service.submit("s1", "grep -r DB_PASSWORD ..", null, sink);
        assertTrue(sink.awaitTerminal());
        assertEquals(List.of("error:rejected"), sink.events);
        assertEquals("Access to \"..\" is not allowed on this terminal", sink.lastError);
        assertTrue(backend.execCommands.isEmpty());

        // cd 按逻辑路径解析，不经过后端参数检查
        service.submit("s1", "cd blog", null, sink);
        assertTrue(sink.awaitTerminal());
        service.submit("s1", "cd ..", null, sink);
        assertTrue(sink.awaitTerminal());
        assertEquals("completed:0:success", sink.last());
        assertTrue(sink.events.contains("stdout:/workspace\n"));

        auditLogger.shutdown();
        assertEquals("rejected", audits.get(0).getStatus());
    }

    @Test
    void testPwdFlagsStillPrintLogicalPath() throws Exception {
        service.submit("s1", "pwd -P", null, sink);
        assertTrue(sink.awaitTerminal());
        assertEquals(List.of("stdout:/workspace\n", "completed:0:success"), sink.events);
        assertTrue(backend.execCommands.isEmpty());
        assertEquals("pwd", TerminalCommandServiceImpl.builtinName("pwd -L"));
        assertNull(TerminalCommandServiceImpl.builtinName("pwd; ls"));
        assertNull(TerminalCommandServiceImpl.builtinName("help me"));
    }

    @Test
    void testBuiltinsRunWithoutBackend() throws Exception {
        service.submit("s1", "help", null, sink);
        assertTrue(sink.awaitTerminal());
        assertTrue(sink.events.get(0).contains("Available commands"));
        assertTrue(sink.events.get(0).contains("git status"));

        service.submit("s1", "clear", null, sink);
        assertTrue(sink.awaitTerminal());
        assertTrue(sink.events.contains("clear"));

        assertEquals(0, backend.creates.get());
    }

    @Test
    void testSubmitToUnknownSessionIsRejected() throws Exception {
        service.submit("nope", "ls", null, sink);
        assertTrue(sink.awaitTerminal());
        assertEquals(InvocationOutcome.REJECTED, sink.lastOutcome);
    }

    @Test
    void testExecuteOnceCollectsOutput() {
        backend.statuses.put("42", ContainerStatus.RUNNING);
        backend.handles = cmd -> ScriptedExecHandle.finished("v20.11.0\n", "", 0);

        TerminalExecRequest req = new TerminalExecRequest();
        req.setUserId("42");
        req.setUsername("alice");
        req.setCommand("node -v");
        TerminalExecResponse resp = service.executeOnce(req);

        assertEquals("success", resp.getOutcome());
        assertEquals(0, resp.getExitCode());
        assertEquals("v20.11.0\n", resp.getOutput());
        assertEquals("/workspace", resp.getCwd());
        assertEquals("fake", resp.getBackend());
        assertNull(resp.getError());
    }

    @Test
    void testExecuteOnceRejectedCommand() {
        TerminalExecRequest req = new TerminalExecRequest();
        req.setUserId("42");
        req.setCommand("curl http://example.com");
        TerminalExecResponse resp = service.executeOnce(req);

        assertEquals("rejected", resp.getOutcome());
        assertEquals("Command \"curl\" is blocked for system security", resp.getError());
    }

    @Test
    void testExecuteOnceRequiresUserAndCommand() {
        TerminalExecRequest req = new TerminalExecRequest();
        req.setCommand("ls");
        assertThrows(IllegalArgumentException.class, () -> service.executeOnce(req));
        req.setUserId("42");
        req.setCommand(" ");
        assertThrows(IllegalArgumentException.class, () -> service.executeOnce(req));
    }

    @Test
    void testCommandCatalog() {
        TerminalCommandCatalogResponse catalog = service.commandCatalog();
        assertEquals(List.of("help", "clear", "pwd"), catalog.getBuiltins());
        assertEquals(1000, catalog.getMaxCommandLength());
        assertTrue(catalog.getBlockedOperators().contains("&&"));
        assertTrue(catalog.getCategories().containsKey("Node.js"));
        assertEquals("fake", service.backendName());
    }
}
