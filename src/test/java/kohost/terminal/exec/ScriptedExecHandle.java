package kohost.terminal.exec;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用执行句柄：输出预先写好，blocking 模式下直到 release/terminate 才退出
 */
public class ScriptedExecHandle implements ExecHandle {
    private final InputStream stdout;
    private final InputStream stderr;
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile int exitCode;

    public final AtomicInteger terminateCalls = new AtomicInteger();
    public final AtomicInteger forceTerminateCalls = new AtomicInteger();

    private ScriptedExecHandle(String stdout, String stderr, int exitCode, boolean blocking) {
        this.stdout = new ByteArrayInputStream(stdout.getBytes(StandardCharsets.UTF_8));
        this.stderr = stderr == null ? null : new ByteArrayInputStream(stderr.getBytes(StandardCharsets.UTF_8));
        this.exitCode = exitCode;
        if (!blocking) {
            exited.countDown();
        }
    }

    public static ScriptedExecHandle finished(String stdout, String stderr, int exitCode) {
        return new ScriptedExecHandle(stdout, stderr, exitCode, false);
    }

    public static ScriptedExecHandle blocking(String stdout) {
        return new ScriptedExecHandle(stdout, null, 0, true);
    }

    public void release(int code) {
        this.exitCode = code;
        exited.countDown();
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
        return exited.await(timeout, unit);
    }

    @Override
    public int exitCode() {
        if (exited.getCount() > 0) {
            throw new IllegalThreadStateException("still running");
        }
        return exitCode;
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }

    @Override
    public void terminate() {
        terminateCalls.incrementAndGet();
        release(143);
    }

    @Override
    public void forceTerminate() {
        forceTerminateCalls.incrementAndGet();
        release(137);
    }
}
