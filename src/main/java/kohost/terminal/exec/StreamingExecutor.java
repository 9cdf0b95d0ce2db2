package kohost.terminal.exec;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 流式执行器：把一个已启动的 {@link ExecHandle} 的 stdout/stderr 实时推给 listener，
 * 负责墙钟超时、取消，以及“活跃进程表”（按会话 key 索引，每个 key 最多一个）。
 * <ul>
 *     <li>onStarted 先于任何 onOutput；同一条流内顺序不变</li>
 *     <li>onCompleted/onError 恰好一次，之后不再投递任何输出</li>
 *     <li>终态回调触发前，活跃表里已经移除该调用</li>
 * </ul>
 */
@Component
public class StreamingExecutor {
    private static final Logger log = LoggerFactory.getLogger(StreamingExecutor.class);

    private static final long CANCEL_GRACE_MS = 500L;
    private static final long DRAIN_MS = 2_000L;

    private final ConcurrentHashMap<String, Running> active = new ConcurrentHashMap<>();

    private final ExecutorService ioPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "terminal-exec-io");
        t.setDaemon(true);
        return t;
    });

    /**
     * 开始流式执行。key 通常是会话 id，同一个 key 同时只允许一个调用。
     *
     * @throws IllegalStateException key 上已有调用在执行
     */
    public RunningInvocation run(String key, Invocation invocation, ExecHandle handle,
                                 Duration timeout, InvocationListener listener) {
        if (key == null || invocation == null || handle == null || listener == null) {
            throw new IllegalArgumentException("key/invocation/handle/listener must not be null");
        }
        Running running = new Running(key, invocation, handle, listener);
        if (active.putIfAbsent(key, running) != null) {
            handle.forceTerminate();
            throw new IllegalStateException("another command is running");
        }
        running.safeCall(() -> listener.onStarted(invocation));

        List<Future<?>> pumps = new ArrayList<>(2);
        pumps.add(ioPool.submit(() -> pump(running, handle.stdout(), OutputType.STDOUT)));
        InputStream err = handle.stderr();
        if (err != null) {
            pumps.add(ioPool.submit(() -> pump(running, err, OutputType.STDERR)));
        }
        long timeoutMs = timeout == null || timeout.isZero() || timeout.isNegative() ? 0 : timeout.toMillis();
        ioPool.submit(() -> watch(running, pumps, timeoutMs));
        return running;
    }

    /**
     * 取消 key 上正在执行的调用；没有时什么也不做
     */
    public boolean cancel(String key) {
        if (key == null) return false;
        Running r = active.get(key);
        return r != null && r.cancel();
    }

    public boolean isActive(String key) {
        return key != null && active.containsKey(key);
    }

    public int activeCount() {
        return active.size();
    }

    @PreDestroy
    public void shutdown() {
        for (Running r : active.values()) {
            r.handle.forceTerminate();
        }
        ioPool.shutdownNow();
    }

    private void pump(Running running, InputStream in, OutputType type) {
        if (in == null) return;
        char[] buf = new char[4096];
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = r.read(buf)) >= 0) {
                if (n == 0) continue;
                if (!running.deliver(type, new String(buf, 0, n))) {
                    break;
                }
            }
        } catch (IOException e) {
            // 进程被强制终止时流会被关闭
            log.debug("output stream closed: invocationId={}, type={}, error={}",
                    running.invocation.getId(), type.getWireName(), e.getMessage());
        }
    }

    private void watch(Running running, List<Future<?>> pumps, long timeoutMs) {
        ExecHandle handle = running.handle;
        boolean exited;
        try {
            if (timeoutMs <= 0) {
                while (!handle.waitFor(1, TimeUnit.HOURS)) {
                    log.debug("invocation still running: invocationId={}", running.invocation.getId());
                }
                exited = true;
            } else {
                exited = handle.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            }
            if (!exited) {
                running.timedOut.set(true);
                log.warn("invocation timeout, force terminate: invocationId={}, timeoutMs={}",
                        running.invocation.getId(), timeoutMs);
                handle.forceTerminate();
                handle.waitFor(DRAIN_MS, TimeUnit.MILLISECONDS);
            }
            for (Future<?> f : pumps) {
                awaitPump(f);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.forceTerminate();
            running.finish(InvocationOutcome.FAILURE, null, "Command interrupted");
            return;
        }

        if (running.canceled.get()) {
            running.finish(InvocationOutcome.CANCELED, exitCodeOrNull(handle), "Command canceled");
        } else if (running.timedOut.get()) {
            running.finish(InvocationOutcome.TIMEOUT, null,
                    "Command timed out after " + (timeoutMs / 1000) + "s and was terminated");
        } else {
            int code = handle.exitCode();
            running.finish(code == 0 ? InvocationOutcome.SUCCESS : InvocationOutcome.FAILURE, code, null);
        }
    }

    private void awaitPump(Future<?> f) throws InterruptedException {
        try {
            f.get(DRAIN_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 孤儿子进程可能还握着管道，这里不再等
            f.cancel(true);
        } catch (ExecutionException e) {
            log.warn("output pump failed: error={}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        }
    }

    private static Integer exitCodeOrNull(ExecHandle handle) {
        if (handle.isAlive()) return null;
        try {
            return handle.exitCode();
        } catch (IllegalThreadStateException | IllegalStateException e) {
            return null;
        }
    }

    private final class Running implements RunningInvocation {
        private final String key;
        private final Invocation invocation;
        private final ExecHandle handle;
        private final InvocationListener listener;

        private final Object deliveryLock = new Object();
        private boolean finished;
        private final AtomicBoolean canceled = new AtomicBoolean(false);
        private final AtomicBoolean timedOut = new AtomicBoolean(false);

        private Running(String key, Invocation invocation, ExecHandle handle, InvocationListener listener) {
            this.key = key;
            this.invocation = invocation;
            this.handle = handle;
            this.listener = listener;
        }

        @Override
        public Invocation getInvocation() {
            return invocation;
        }

        @Override
        public boolean isFinished() {
            synchronized (deliveryLock) {
                return finished;
            }
        }

        @Override
        public boolean cancel() {
            if (isFinished() || !canceled.compareAndSet(false, true)) {
                return false;
            }
            log.info("cancel invocation: invocationId={}, sessionId={}", invocation.getId(), invocation.getSessionId());
            handle.terminate();
            ioPool.submit(() -> {
                try {
                    if (!handle.waitFor(CANCEL_GRACE_MS, TimeUnit.MILLISECONDS)) {
                        handle.forceTerminate();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    handle.forceTerminate();
                }
            });
            return true;
        }

        /**
         * @return false 表示已结束，pump 应停止
         */
        boolean deliver(OutputType type, String chunk) {
            synchronized (deliveryLock) {
                if (finished) return false;
                safeCall(() -> listener.onOutput(invocation, type, chunk));
                return true;
            }
        }

        void finish(InvocationOutcome outcome, Integer exitCode, String message) {
            synchronized (deliveryLock) {
                if (finished) return;
                finished = true;
            }
            active.remove(key, this);
            invocation.finish(outcome, exitCode);
            log.info("invocation finished: invocationId={}, sessionId={}, outcome={}, exitCode={}",
                    invocation.getId(), invocation.getSessionId(), outcome.getWireName(), exitCode);
            if (outcome == InvocationOutcome.SUCCESS || (outcome == InvocationOutcome.FAILURE && exitCode != null)) {
                safeCall(() -> listener.onCompleted(invocation, exitCode));
            } else {
                safeCall(() -> listener.onError(invocation, outcome, message));
            }
        }

        void safeCall(Runnable r) {
            try {
                r.run();
            } catch (RuntimeException e) {
                log.warn("invocation listener failed: invocationId={}, error={}", invocation.getId(), e.getMessage(), e);
            }
        }
    }
}
