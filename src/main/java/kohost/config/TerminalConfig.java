package kohost.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import kohost.terminal.CommandRunner;
import kohost.terminal.TerminalProperties;
import kohost.terminal.audit.AuditSink;
import kohost.terminal.audit.JsonLinesAuditSink;
import kohost.terminal.backend.DockerExecutionBackend;
import kohost.terminal.backend.ExecutionBackend;
import kohost.terminal.backend.LocalProcessExecutionBackend;
import kohost.terminal.backend.SshExecutionBackend;
import kohost.terminal.policy.CommandPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class TerminalConfig {
    private static final Logger log = LoggerFactory.getLogger(TerminalConfig.class);

    @Bean
    public CommandPolicy commandPolicy(TerminalProperties props) {
        return CommandPolicy.defaults(props.getMaxCommandLength());
    }

    /**
     * kohost.terminal.backend=docker（默认）/ local / ssh
     */
    @Bean
    public ExecutionBackend executionBackend(TerminalProperties props, CommandRunner commandRunner) {
        String name = props.getBackend() == null ? "docker" : props.getBackend().trim().toLowerCase(Locale.ROOT);
        log.info("terminal execution backend: {}", name);
        return switch (name) {
            case "docker" -> new DockerExecutionBackend(props, commandRunner);
            case "local" -> new LocalProcessExecutionBackend(props);
            case "ssh" -> new SshExecutionBackend(props);
            default -> throw new IllegalArgumentException("unknown kohost.terminal.backend: " + props.getBackend());
        };
    }

    @Bean
    public AuditSink auditSink(TerminalProperties props, ObjectMapper objectMapper) {
        Path dir;
        if (StringUtils.hasText(props.getAuditDir())) {
            dir = Paths.get(props.getAuditDir());
        } else if (StringUtils.hasText(props.getHostRoot())) {
            dir = Paths.get(props.getHostRoot(), ".audit");
        } else {
            dir = Paths.get("logs", "audit");
        }
        log.info("terminal audit dir: {}", dir.toAbsolutePath());
        return new JsonLinesAuditSink(dir, objectMapper);
    }

    /**
     * 命令分发线程池（容器 ensure、site 查询、进程启动都在这里，不占用 WebSocket 线程）
     */
    @Bean(name = "terminalDispatchExecutor", destroyMethod = "shutdown")
    public ExecutorService terminalDispatchExecutor() {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "terminal-dispatch");
            t.setDaemon(true);
            return t;
        });
    }
}
