package kohost.terminal.backend;

import kohost.terminal.InfrastructureException;
import kohost.terminal.SandboxPaths;
import kohost.terminal.TerminalProperties;
import kohost.terminal.TerminalUser;
import kohost.terminal.exec.ExecHandle;
import kohost.terminal.exec.ProcessExecHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * local 后端：直接在宿主机用户目录 {hostRoot}/{storageKey} 下执行 /bin/sh -c。
 * 所有用户共用一个系统账号，参数里的路径由 {@link HostPathGuard} 限制在用户目录内；
 * 没有进程级隔离，多租户部署请用 docker 后端。
 */
public class LocalProcessExecutionBackend implements ExecutionBackend {
    private static final Logger log = LoggerFactory.getLogger(LocalProcessExecutionBackend.class);

    private final TerminalProperties props;

    public LocalProcessExecutionBackend(TerminalProperties props) {
        this.props = props;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public String containerName(TerminalUser user) {
        return "local:" + user.storageKey();
    }

    @Override
    public void checkAvailable() {
        if (!StringUtils.hasText(props.getHostRoot())) {
            throw new InfrastructureException("Terminal storage is not configured",
                    "Set kohost.terminal.host-root on the terminal host");
        }
        if (!Files.isExecutable(Paths.get("/bin/sh"))) {
            throw new InfrastructureException("Shell is not available on this host",
                    "The local backend needs /bin/sh; use the docker backend instead");
        }
    }

    @Override
    public ContainerStatus status(TerminalUser user) {
        if (!StringUtils.hasText(props.getHostRoot())) {
            return ContainerStatus.ABSENT;
        }
        return Files.isDirectory(userDir(user)) ? ContainerStatus.RUNNING : ContainerStatus.ABSENT;
    }

    @Override
    public void create(TerminalUser user) {
        start(user);
    }

    @Override
    public void start(TerminalUser user) {
        try {
            Files.createDirectories(userDir(user));
        } catch (IOException e) {
            log.error("create user dir failed: userId={}, error={}", user.getUserId(), e.getMessage());
            throw new InfrastructureException("User storage is not available", "Contact support", e);
        }
    }

    @Override
    public void stop(TerminalUser user) {
        log.debug("local backend has nothing to stop: userId={}", user.getUserId());
    }

    @Override
    public boolean isDirectory(TerminalUser user, String logicalPath) {
        Path p = resolve(user, logicalPath);
        if (!Files.isDirectory(p)) {
            return false;
        }
        // 软链接可能指向用户目录之外
        try {
            Path real = p.toRealPath();
            Path root = userDir(user).toRealPath();
            return real.startsWith(root);
        } catch (IOException e) {
            log.debug("realpath failed: userId={}, error={}", user.getUserId(), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<String> checkArguments(TerminalUser user, String command) {
        return HostPathGuard.check(command, userDir(user).toString());
    }

    @Override
    public ExecHandle exec(TerminalUser user, String logicalCwd, String command, String invocationId) {
        Path cwd = resolve(user, logicalCwd);
        if (!Files.isDirectory(cwd)) {
            throw new InfrastructureException("Working directory is not available", "Run cd ~ and retry");
        }
        ProcessBuilder pb = new ProcessBuilder(List.of("/bin/sh", "-c", describeCommand(user, logicalCwd, command)));
        pb.directory(userDir(user).toFile());
        pb.environment().put("TERM", "xterm-256color");
        pb.environment().put(InvocationSignals.ENV, invocationId);
        // 不让 git checkout 出指向用户目录之外的软链接
        pb.environment().put("GIT_CONFIG_COUNT", "1");
        pb.environment().put("GIT_CONFIG_KEY_0", "core.symlinks");
        pb.environment().put("GIT_CONFIG_VALUE_0", "false");
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        try {
            Process p = pb.start();
            p.getOutputStream().close();
            return new ProcessExecHandle(p);
        } catch (IOException e) {
            log.error("local exec failed to start: userId={}, error={}", user.getUserId(), e.getMessage());
            throw new InfrastructureException("Failed to run command", "Contact support", e);
        }
    }

    @Override
    public String describeCommand(TerminalUser user, String logicalCwd, String command) {
        return "cd " + SandboxPaths.shellQuote(resolve(user, logicalCwd).toString()) + " && " + command;
    }

    Path userDir(TerminalUser user) {
        return Paths.get(props.getHostRoot(), user.storageKey()).toAbsolutePath().normalize();
    }

    private Path resolve(TerminalUser user, String logicalPath) {
        String rel = SandboxPaths.relativize(props.getSandboxRoot(), logicalPath);
        Path base = userDir(user);
        Path p = rel.isEmpty() ? base : base.resolve(rel).normalize();
        if (!p.startsWith(base)) {
            throw new IllegalArgumentException("path is outside the sandbox");
        }
        return p;
    }
}
