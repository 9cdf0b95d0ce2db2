package kohost.terminal;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 记录用户最近活跃时间和进行中的命令数（idle 回收依据）
 */
@Component
public class TerminalActivityTracker {

    /**
     * wall clock（用于展示/诊断），可能受 NTP/时间跳变影响，不要用于 idle 判定。
     */
    private final ConcurrentHashMap<String, Long> lastActiveAtMs = new ConcurrentHashMap<>();

    /**
     * monotonic clock（用于 idle 判定），不受系统时间跳变影响。
     */
    private final ConcurrentHashMap<String, Long> lastTouchNs = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();

    public void touch(String userId) {
        if (userId == null) return;
        lastActiveAtMs.put(userId, System.currentTimeMillis());
        lastTouchNs.put(userId, System.nanoTime());
    }

    public int begin(String userId) {
        touch(userId);
        return inFlight.computeIfAbsent(userId, k -> new AtomicInteger()).incrementAndGet();
    }

    public int end(String userId) {
        touch(userId);
        AtomicInteger c = inFlight.get(userId);
        if (c == null) return 0;
        return c.updateAndGet(v -> Math.max(0, v - 1));
    }

    public int inFlight(String userId) {
        AtomicInteger c = userId == null ? null : inFlight.get(userId);
        return c == null ? 0 : c.get();
    }

    public Long getLastActiveAtMs(String userId) {
        return userId == null ? null : lastActiveAtMs.get(userId);
    }

    public Long getLastTouchNs(String userId) {
        return userId == null ? null : lastTouchNs.get(userId);
    }

    public Map<String, Long> snapshotTouchNs() {
        return new ConcurrentHashMap<>(lastTouchNs);
    }

    /**
     * 容器被回收后不再参与 idle 判定（下次命令会重新 touch）。
     * 只有 lastTouchNs 仍等于 expectedTouchNs 时才移除；期间有新的 touch 则保留
     *
     * @return 是否移除
     */
    public boolean removeIfUnchanged(String userId, long expectedTouchNs) {
        if (userId == null) return false;
        if (!lastTouchNs.remove(userId, expectedTouchNs)) {
            return false;
        }
        lastActiveAtMs.remove(userId);
        return true;
    }
}
