package kohost.terminal.backend;

import kohost.terminal.TerminalActivityTracker;
import kohost.terminal.TerminalProperties;
import kohost.terminal.TerminalUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 用户执行环境生命周期：ABSENT -> (create) -> RUNNING -> (idle / 显式 stop) -> STOPPED -> (start) -> RUNNING。
 * <p>
 * 同一用户的 ensureRunning / stop / idle 回收串行执行（每个 userId 一把锁），
 * 并发的 ensureRunning 最终只会创建一个容器。容器从不被隐式删除。
 */
@Component
public class ContainerLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(ContainerLifecycleManager.class);

    private final ExecutionBackend backend;
    private final TerminalActivityTracker tracker;
    private final TerminalProperties props;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TerminalUser> knownUsers = new ConcurrentHashMap<>();

    public ContainerLifecycleManager(ExecutionBackend backend, TerminalActivityTracker tracker, TerminalProperties props) {
        this.backend = backend;
        this.tracker = tracker;
        this.props = props;
    }

    public ExecutionBackend getBackend() {
        return backend;
    }

    /**
     * 确保用户执行环境处于 RUNNING（幂等）。需要创建/启动时通过 progress 推送提示行。
     *
     * @throws kohost.terminal.InfrastructureException 运行时不可用 / 镜像缺失 / 创建或启动失败
     */
    public ContainerRecord ensureRunning(TerminalUser user, Consumer<String> progress) {
        String userId = user.getUserId();
        knownUsers.put(userId, user);
        tracker.touch(userId);
        ReentrantLock lock = lockOf(userId);
        lock.lock();
        try {
            ContainerStatus status = backend.status(user);
            if (status == ContainerStatus.RUNNING) {
                return record(user, status);
            }
            backend.checkAvailable();
            if (status == ContainerStatus.ABSENT) {
                notify(progress, "Preparing your terminal environment, the first run may take a moment...");
                log.info("terminal environment absent, create: userId={}, backend={}", userId, backend.name());
                backend.create(user);
            } else {
                notify(progress, "Starting your terminal environment...");
                log.info("terminal environment stopped, start: userId={}, backend={}", userId, backend.name());
                backend.start(user);
            }
            notify(progress, "Terminal environment is ready");
            return record(user, ContainerStatus.RUNNING);
        } finally {
            lock.unlock();
        }
    }

    public ContainerRecord status(TerminalUser user) {
        return record(user, backend.status(user));
    }

    /**
     * 显式停止；仍有命令在执行时拒绝
     */
    public ContainerRecord stop(TerminalUser user) {
        String userId = user.getUserId();
        ReentrantLock lock = lockOf(userId);
        lock.lock();
        try {
            if (tracker.inFlight(userId) > 0) {
                throw new IllegalStateException("A command is still running, cancel it first");
            }
            ContainerStatus status = backend.status(user);
            if (status == ContainerStatus.RUNNING) {
                backend.stop(user);
            }
            return record(user, backend.status(user));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 记一次进行中的命令（idle 回收会跳过有进行中命令的用户）
     */
    public void acquire(String userId) {
        tracker.begin(userId);
    }

    public void release(String userId) {
        tracker.end(userId);
    }

    /**
     * 停止 idle 超时的执行环境
     *
     * @return 本次停止的数量
     */
    public int reclaimIdle() {
        return reclaimIdle(System.nanoTime());
    }

    int reclaimIdle(long nowNs) {
        if (!backend.hasLifecycle()) return 0;
        int minutes = props.getIdleStopContainerMinutes();
        // 约定：<=0 表示禁用
        if (minutes <= 0) return 0;
        long thresholdNs = minutes * 60_000_000_000L;

        int stopped = 0;
        Map<String, Long> snap = tracker.snapshotTouchNs();
        for (Map.Entry<String, Long> e : snap.entrySet()) {
            String userId = e.getKey();
            if (e.getValue() == null || nowNs - e.getValue() < thresholdNs) continue;
            TerminalUser user = knownUsers.get(userId);
            if (user == null) continue;

            ReentrantLock lock = lockOf(userId);
            lock.lock();
            try {
                // 拿到锁后重新判断：期间可能有新命令进来
                Long lastTouch = tracker.getLastTouchNs(userId);
                if (tracker.inFlight(userId) > 0 || lastTouch == null || nowNs - lastTouch < thresholdNs) {
                    continue;
                }
                if (backend.status(user) == ContainerStatus.RUNNING) {
                    log.info("idle reaper: stop container: userId={}, idleMs={}, thresholdMs={}",
                            userId, (nowNs - lastTouch) / 1_000_000L, thresholdNs / 1_000_000L);
                    backend.stop(user);
                    stopped++;
                }
                // 停止期间有新的 touch 时保留记录，重新启动的环境之后仍会被回收
                tracker.removeIfUnchanged(userId, lastTouch);
            } catch (RuntimeException ex) {
                log.warn("idle reaper failed: userId={}, error={}", userId, ex.getMessage());
            } finally {
                lock.unlock();
            }
        }
        return stopped;
    }

    private ContainerRecord record(TerminalUser user, ContainerStatus status) {
        String userId = user.getUserId();
        return new ContainerRecord(user, backend.containerName(user), backend.name(), status,
                tracker.getLastActiveAtMs(userId), tracker.inFlight(userId));
    }

    private ReentrantLock lockOf(String userId) {
        return locks.computeIfAbsent(userId, k -> new ReentrantLock());
    }

    private static void notify(Consumer<String> progress, String line) {
        if (progress != null) {
            progress.accept(line);
        }
    }
}
