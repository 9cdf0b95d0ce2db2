package kohost.terminal.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 基于本地 {@link Process} 的执行句柄。
 * <p>
 * docker 后端下本地进程只是 docker exec 客户端，杀掉它不会结束容器里的进程，
 * 所以允许额外传入一个 signalHook（参数为 TERM / KILL）去终止容器内进程。
 */
public class ProcessExecHandle implements ExecHandle {
    private static final Logger log = LoggerFactory.getLogger(ProcessExecHandle.class);

    private final Process process;
    private final Consumer<String> signalHook;

    public ProcessExecHandle(Process process) {
        this(process, null);
    }

    public ProcessExecHandle(Process process, Consumer<String> signalHook) {
        this.process = process;
        this.signalHook = signalHook;
    }

    @Override
    public InputStream stdout() {
        return process.getInputStream();
    }

    @Override
    public InputStream stderr() {
        return process.getErrorStream();
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        return process.waitFor(timeout, unit);
    }

    @Override
    public int exitCode() {
        return process.exitValue();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void terminate() {
        signal("TERM");
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }

    @Override
    public void forceTerminate() {
        signal("KILL");
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private void signal(String sig) {
        if (signalHook == null) return;
        try {
            signalHook.accept(sig);
        } catch (RuntimeException e) {
            log.warn("signal hook failed: pid={}, signal={}, error={}", process.pid(), sig, e.getMessage());
        }
    }
}
