package kohost.terminal.backend;

import kohost.terminal.CommandResult;
import kohost.terminal.CommandRunner;
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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * docker 后端：每个用户一个长驻容器（kohost_terminal_{userId}），用户存储目录 bind mount 到沙箱根，
 * 每条命令都是一次性的 docker exec -i ... /bin/sh -c "cd '&lt;cwd&gt;' &amp;&amp; &lt;command&gt;"。
 * <p>
 * 容器创建/启动失败不自动重试，也不会删除任何容器（用户数据只在 bind mount 里，但容器可能被运维手工调整过）。
 */
public class DockerExecutionBackend implements ExecutionBackend {
    private static final Logger log = LoggerFactory.getLogger(DockerExecutionBackend.class);

    private final TerminalProperties props;
    private final CommandRunner commandRunner;

    public DockerExecutionBackend(TerminalProperties props, CommandRunner commandRunner) {
        this.props = props;
        this.commandRunner = commandRunner;
    }

    @Override
    public String name() {
        return "docker";
    }

    @Override
    public boolean hasLifecycle() {
        return true;
    }

    @Override
    public String containerName(TerminalUser user) {
        return props.getContainerNamePrefix() + user.storageKey();
    }

    @Override
    public void checkAvailable() {
        CommandResult info = docker("info", "--format", "{{.ServerVersion}}");
        if (!info.isSuccess()) {
            log.error("docker daemon not available: exitCode={}, out={}", info.getExitCode(), info.lastLine());
            throw new InfrastructureException("Container runtime is not available",
                    "Make sure the Docker daemon is running on the terminal host (systemctl start docker), then retry");
        }
        CommandResult image = docker("image", "inspect", "--format", "{{.Id}}", props.getImage());
        if (!image.isSuccess()) {
            log.error("terminal image missing: image={}, out={}", props.getImage(), image.lastLine());
            throw new InfrastructureException("Terminal image " + props.getImage() + " is not available",
                    "Build it on the terminal host: docker build -t " + props.getImage() + " -f docker/terminal.Dockerfile .");
        }
    }

    @Override
    public ContainerStatus status(TerminalUser user) {
        CommandResult r = docker("inspect", "-f", "{{.State.Status}}", containerName(user));
        if (!r.isSuccess()) {
            return ContainerStatus.ABSENT;
        }
        // podman-docker 会把告警打印到 stdout，只取最后一个非空行
        String s = r.lastLine();
        if ("running".equalsIgnoreCase(s)) {
            return ContainerStatus.RUNNING;
        }
        return ContainerStatus.STOPPED;
    }

    @Override
    public void create(TerminalUser user) {
        String name = containerName(user);
        Path hostUserDir = ensureHostUserDir(user);

        List<String> cmd = new ArrayList<>();
        cmd.add("docker");
        cmd.add("run");
        cmd.add("-d");
        cmd.add("--name");
        cmd.add(name);
        if (props.getDockerCpus() != null && props.getDockerCpus() > 0) {
            cmd.add("--cpus");
            cmd.add(String.valueOf(props.getDockerCpus()));
        }
        if (StringUtils.hasText(props.getDockerMemory())) {
            cmd.add("--memory");
            cmd.add(props.getDockerMemory().trim());
        }
        if (StringUtils.hasText(props.getDockerMemorySwap())) {
            cmd.add("--memory-swap");
            cmd.add(props.getDockerMemorySwap().trim());
        }
        if (props.getPidsLimit() != null && props.getPidsLimit() > 0) {
            cmd.add("--pids-limit");
            cmd.add(String.valueOf(props.getPidsLimit()));
        }
        if (StringUtils.hasText(props.getNetworkName())) {
            cmd.add("--network");
            cmd.add(props.getNetworkName().trim());
        }
        cmd.add("--security-opt");
        cmd.add("no-new-privileges");
        cmd.add("-v");
        cmd.add(hostUserDir + ":" + sandboxRoot());
        cmd.add("-w");
        cmd.add(sandboxRoot());
        cmd.add("--label");
        cmd.add("kohost.terminal.user=" + user.storageKey());
        cmd.add(props.getImage());
        // keep-alive，命令都通过 docker exec 进入
        cmd.add("tail");
        cmd.add("-f");
        cmd.add("/dev/null");

        CommandResult r = commandRunner.run(Duration.ofSeconds(props.getContainerCreateTimeoutSeconds()), cmd);
        if (!r.isSuccess()) {
            log.error("docker run failed: userId={}, name={}, exitCode={}, out={}",
                    user.getUserId(), name, r.getExitCode(), r.getOutput());
            throw new InfrastructureException("Failed to create terminal container",
                    "Retry in a moment; if the problem persists contact support");
        }
        log.info("terminal container created: userId={}, name={}", user.getUserId(), name);
    }

    @Override
    public void start(TerminalUser user) {
        String name = containerName(user);
        CommandResult r = docker("start", name);
        if (!r.isSuccess()) {
            log.error("docker start failed: userId={}, name={}, out={}", user.getUserId(), name, r.getOutput());
            throw new InfrastructureException("Failed to start terminal container",
                    "Retry in a moment; if the problem persists contact support");
        }
        log.info("terminal container started: userId={}, name={}", user.getUserId(), name);
    }

    @Override
    public void stop(TerminalUser user) {
        String name = containerName(user);
        CommandResult r = docker("stop", "-t", "5", name);
        if (!r.isSuccess()) {
            log.warn("docker stop failed: userId={}, name={}, out={}", user.getUserId(), name, r.lastLine());
            throw new InfrastructureException("Failed to stop terminal container", "Retry in a moment");
        }
        log.info("terminal container stopped: userId={}, name={}", user.getUserId(), name);
    }

    @Override
    public boolean isDirectory(TerminalUser user, String logicalPath) {
        SandboxPaths.relativize(sandboxRoot(), logicalPath);
        CommandResult r = docker("exec", containerName(user), "test", "-d", logicalPath);
        return r.isSuccess();
    }

    @Override
    public ExecHandle exec(TerminalUser user, String logicalCwd, String command, String invocationId) {
        String name = containerName(user);
        List<String> cmd = new ArrayList<>();
        cmd.add("docker");
        cmd.add("exec");
        cmd.add("-i");
        cmd.add("-e");
        cmd.add("TERM=xterm-256color");
        cmd.add("-e");
        cmd.add(InvocationSignals.marker(invocationId));
        cmd.add(name);
        cmd.add("/bin/sh");
        cmd.add("-c");
        cmd.add(describeCommand(user, logicalCwd, command));
        try {
            Process p = startProcess(cmd);
            // 客户端进程不会把信号转发进容器，按环境变量找到容器内这次调用的进程
            return new ProcessExecHandle(p, sig -> killInContainer(name, invocationId, sig));
        } catch (IOException e) {
            log.error("docker exec failed to start: userId={}, name={}, error={}", user.getUserId(), name, e.getMessage());
            throw new InfrastructureException("Failed to run command in terminal container",
                    "Make sure the Docker CLI is installed on the terminal host", e);
        }
    }

    @Override
    public String describeCommand(TerminalUser user, String logicalCwd, String command) {
        SandboxPaths.relativize(sandboxRoot(), logicalCwd);
        return "cd " + SandboxPaths.shellQuote(SandboxPaths.trimTrailingSlash(logicalCwd)) + " && " + command;
    }

    protected Process startProcess(List<String> cmd) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        Process p = pb.start();
        // 非交互：立即关闭 stdin，避免命令等待输入直到超时
        p.getOutputStream().close();
        return p;
    }

    void killInContainer(String containerName, String invocationId, String signal) {
        String script = InvocationSignals.killScript(invocationId, signal);
        CommandResult r = docker("exec", containerName, "/bin/sh", "-c", script);
        if (!r.isSuccess()) {
            log.warn("kill in container failed: name={}, invocationId={}, signal={}, out={}",
                    containerName, invocationId, signal, r.lastLine());
        }
    }

    private Path ensureHostUserDir(TerminalUser user) {
        if (!StringUtils.hasText(props.getHostRoot())) {
            throw new InfrastructureException("Terminal storage is not configured",
                    "Set kohost.terminal.host-root on the terminal host");
        }
        Path dir = Paths.get(props.getHostRoot(), user.storageKey()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("create user dir failed: userId={}, error={}", user.getUserId(), e.getMessage());
            throw new InfrastructureException("User storage is not available", "Contact support", e);
        }
        return dir;
    }

    private String sandboxRoot() {
        return SandboxPaths.trimTrailingSlash(props.getSandboxRoot());
    }

    private CommandResult docker(String... args) {
        List<String> cmd = new ArrayList<>();
        cmd.add("docker");
        for (String a : args) cmd.add(a);
        return commandRunner.run(Duration.ofSeconds(props.getDockerCommandTimeoutSeconds()), cmd);
    }
}
