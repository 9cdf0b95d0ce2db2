package kohost.terminal.backend;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import kohost.terminal.InfrastructureException;
import kohost.terminal.SandboxPaths;
import kohost.terminal.TerminalProperties;
import kohost.terminal.TerminalUser;
import kohost.terminal.exec.ExecHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * ssh 后端：通过一个共享的 JSch Session 在远端主机的 {rootPath}/{storageKey} 下执行命令（ChannelExec，非 TTY）。
 * 所有用户共用一个远端账号，参数里的路径由 {@link HostPathGuard} 限制在用户目录内。
 */
public class SshExecutionBackend implements ExecutionBackend, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SshExecutionBackend.class);

    private static final long PROBE_TIMEOUT_MS = 10_000L;

    private final TerminalProperties props;
    private final Object sessionLock = new Object();
    private Session session;

    public SshExecutionBackend(TerminalProperties props) {
        this.props = props;
    }

    @Override
    public String name() {
        return "ssh";
    }

    @Override
    public String containerName(TerminalUser user) {
        return "ssh:" + user.storageKey();
    }

    @Override
    public void checkAvailable() {
        session();
    }

    @Override
    public ContainerStatus status(TerminalUser user) {
        return runQuiet("test -d " + SandboxPaths.shellQuote(userDir(user))) == 0
                ? ContainerStatus.RUNNING : ContainerStatus.ABSENT;
    }

    @Override
    public void create(TerminalUser user) {
        start(user);
    }

    @Override
    public void start(TerminalUser user) {
        int code = runQuiet("mkdir -p " + SandboxPaths.shellQuote(userDir(user)));
        if (code != 0) {
            log.error("create remote user dir failed: userId={}, exitCode={}", user.getUserId(), code);
            throw new InfrastructureException("User storage is not available", "Contact support");
        }
    }

    @Override
    public void stop(TerminalUser user) {
        log.debug("ssh backend has nothing to stop: userId={}", user.getUserId());
    }

    @Override
    public boolean isDirectory(TerminalUser user, String logicalPath) {
        String remote = resolve(user, logicalPath);
        // 软链接可能指向用户目录之外：比较 realpath
        String base = SandboxPaths.shellQuote(userDir(user));
        String target = SandboxPaths.shellQuote(remote);
        String script = "test -d " + target + " && r=$(cd " + target + " && pwd -P) && b=$(cd " + base + " && pwd -P)"
                + " && case \"$r/\" in \"$b\"/*) exit 0;; *) exit 1;; esac";
        return runQuiet(script) == 0;
    }

    @Override
    public Optional<String> checkArguments(TerminalUser user, String command) {
        return HostPathGuard.check(command, userDir(user));
    }

    @Override
    public ExecHandle exec(TerminalUser user, String logicalCwd, String command, String invocationId) {
        ChannelExec ch = null;
        try {
            ch = (ChannelExec) session().openChannel("exec");
            ch.setCommand(describeCommand(user, logicalCwd, command, invocationId));
            ch.setInputStream(null);
            InputStream out = ch.getInputStream();
            InputStream err = ch.getErrStream();
            ch.connect(props.getSsh().getConnectTimeoutMs());
            return new SshExecHandle(ch, out, err, sig -> signal(invocationId, sig));
        } catch (JSchException | IOException e) {
            if (ch != null) ch.disconnect();
            log.error("ssh exec failed: userId={}, host={}, error={}", user.getUserId(), props.getSsh().getHost(), e.getMessage());
            throw new InfrastructureException("Remote execution host is not reachable", "Retry in a moment; if the problem persists contact support", e);
        }
    }

    @Override
    public String describeCommand(TerminalUser user, String logicalCwd, String command) {
        return "cd " + SandboxPaths.shellQuote(resolve(user, logicalCwd)) + " && " + command;
    }

    private String describeCommand(TerminalUser user, String logicalCwd, String command, String invocationId) {
        // 远端 sshd 通常不接受 setEnv，用 export 带上调用标记
        return "export " + InvocationSignals.marker(invocationId)
                + " GIT_CONFIG_COUNT=1 GIT_CONFIG_KEY_0=core.symlinks GIT_CONFIG_VALUE_0=false; "
                + describeCommand(user, logicalCwd, command);
    }

    @Override
    public void close() {
        synchronized (sessionLock) {
            if (session != null) {
                session.disconnect();
                session = null;
            }
        }
    }

    String userDir(TerminalUser user) {
        return SandboxPaths.trimTrailingSlash(props.getSsh().getRootPath()) + "/" + user.storageKey();
    }

    private String resolve(TerminalUser user, String logicalPath) {
        String rel = SandboxPaths.relativize(props.getSandboxRoot(), logicalPath);
        return rel.isEmpty() ? userDir(user) : userDir(user) + "/" + rel;
    }

    private void signal(String invocationId, String sig) {
        try {
            int code = runQuiet(InvocationSignals.killScript(invocationId, sig));
            if (code != 0) {
                log.warn("ssh signal failed: invocationId={}, signal={}, exitCode={}", invocationId, sig, code);
            }
        } catch (InfrastructureException e) {
            log.warn("ssh signal failed: invocationId={}, signal={}, error={}", invocationId, sig, e.getMessage());
        }
    }

    /**
     * 执行一条内部命令，只关心退出码；连接失败抛 InfrastructureException
     */
    private int runQuiet(String command) {
        ChannelExec ch = null;
        try {
            ch = (ChannelExec) session().openChannel("exec");
            ch.setCommand(command);
            ch.setInputStream(null);
            ch.connect(props.getSsh().getConnectTimeoutMs());
            SshExecHandle h = new SshExecHandle(ch, null, null, s -> { });
            if (!h.waitFor(PROBE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("ssh probe timeout: command={}", command);
                return 124;
            }
            return h.exitCode();
        } catch (JSchException e) {
            log.error("ssh channel failed: host={}, error={}", props.getSsh().getHost(), e.getMessage());
            throw new InfrastructureException("Remote execution host is not reachable", "Retry in a moment; if the problem persists contact support", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 130;
        } finally {
            if (ch != null) ch.disconnect();
        }
    }

    private Session session() {
        synchronized (sessionLock) {
            if (session != null && session.isConnected()) {
                return session;
            }
            TerminalProperties.Ssh cfg = props.getSsh();
            if (!StringUtils.hasText(cfg.getHost()) || !StringUtils.hasText(cfg.getUsername())) {
                throw new InfrastructureException("Remote execution host is not configured",
                        "Set kohost.terminal.ssh.host and kohost.terminal.ssh.username");
            }
            // 必须校验主机密钥：未配置 known_hosts 时不连接
            if (!StringUtils.hasText(cfg.getKnownHostsPath())) {
                log.error("ssh known_hosts not configured, refusing to connect: host={}", cfg.getHost());
                throw new InfrastructureException("Remote host key cannot be verified",
                        "Set kohost.terminal.ssh.known-hosts-path to a known_hosts file that contains the host key");
            }
            try {
                JSch jsch = new JSch();
                if (StringUtils.hasText(cfg.getPrivateKeyPath())) {
                    jsch.addIdentity(cfg.getPrivateKeyPath());
                }
                jsch.setKnownHosts(cfg.getKnownHostsPath());
                Session s = jsch.getSession(cfg.getUsername(), cfg.getHost(), cfg.getPort());
                if (StringUtils.hasText(cfg.getPassword())) {
                    s.setPassword(cfg.getPassword());
                }
                s.setConfig("StrictHostKeyChecking", "yes");
                s.setServerAliveInterval(30_000);
                s.connect(cfg.getConnectTimeoutMs());
                log.info("ssh session connected: host={}, port={}", cfg.getHost(), cfg.getPort());
                session = s;
                return s;
            } catch (JSchException e) {
                log.error("ssh connect failed: host={}, port={}, error={}", cfg.getHost(), cfg.getPort(), e.getMessage());
                throw new InfrastructureException("Remote execution host is not reachable",
                        "Check the ssh host, credentials and network, then retry", e);
            }
        }
    }
}
