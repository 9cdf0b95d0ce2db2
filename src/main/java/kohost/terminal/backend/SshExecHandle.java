package kohost.terminal.backend;

import com.jcraft.jsch.ChannelExec;
import kohost.terminal.exec.ExecHandle;

import java.io.InputStream;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 基于 JSch ChannelExec 的执行句柄
 */
class SshExecHandle implements ExecHandle {
    private static final long POLL_MS = 50L;

    private final ChannelExec channel;
    private final InputStream stdout;
    private final InputStream stderr;
    private final Consumer<String> signalHook;

    SshExecHandle(ChannelExec channel, InputStream stdout, InputStream stderr, Consumer<String> signalHook) {
        this.channel = channel;
        this.stdout = stdout;
        this.stderr = stderr;
        this.signalHook = signalHook;
    }

    @Override
    public InputStream stdout() {
        return stdout;
    }

    @Override
    public InputStream stderr() {
        return stderr;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (!channel.isClosed()) {
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                return false;
            }
            Thread.sleep(Math.min(POLL_MS, TimeUnit.NANOSECONDS.toMillis(left) + 1));
        }
        return true;
    }

    @Override
    public int exitCode() {
        if (!channel.isClosed()) {
            throw new IllegalStateException("channel is still open");
        }
        return channel.getExitStatus();
    }

    @Override
    public boolean isAlive() {
        return !channel.isClosed();
    }

    @Override
    public void terminate() {
        signalHook.accept("TERM");
    }

    @Override
    public void forceTerminate() {
        signalHook.accept("KILL");
        channel.disconnect();
    }
}
