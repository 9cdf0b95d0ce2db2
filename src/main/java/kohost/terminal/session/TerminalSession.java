package kohost.terminal.session;

import kohost.terminal.TerminalUser;
import kohost.terminal.exec.Invocation;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一个实时连接对应一个会话：逻辑 cwd、站点绑定、进行中的调用（至多一个）
 */
public class TerminalSession {
    private final String sessionId;
    private final TerminalUser user;
    private final Instant openedAt = Instant.now();

    private volatile String siteId;
    private volatile String cwd;
    private volatile Invocation activeInvocation;

    /**
     * 槽位的占用、收尾事件推送和释放都在这把锁下进行
     */
    private final Object slotLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TerminalSession(String sessionId, TerminalUser user, String cwd) {
        this.sessionId = sessionId;
        this.user = user;
        this.cwd = cwd;
    }

    public String getSessionId() {
        return sessionId;
    }

    public TerminalUser getUser() {
        return user;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public String getSiteId() {
        return siteId;
    }

    void setSiteId(String siteId) {
        this.siteId = siteId;
    }

    public String getCwd() {
        return cwd;
    }

    void setCwd(String cwd) {
        this.cwd = cwd;
    }

    public Invocation getActiveInvocation() {
        return activeInvocation;
    }

    /**
     * 占用会话的执行槽位；已被占用时返回 false
     */
    public boolean tryBegin(Invocation invocation) {
        synchronized (slotLock) {
            if (closed.get() || activeInvocation != null) {
                return false;
            }
            this.activeInvocation = invocation;
            return true;
        }
    }

    /**
     * 释放执行槽位（只释放属于该调用的槽位）
     */
    public void end(Invocation invocation) {
        end(invocation, null);
    }

    /**
     * 先推送该调用最后的输出和终态事件，再释放槽位。
     * 推送期间到达的 tryBegin 会等到释放之后，所以下一条命令的事件一定排在本条终态事件之后。
     */
    public void end(Invocation invocation, Runnable finalEvents) {
        synchronized (slotLock) {
            try {
                if (finalEvents != null) {
                    finalEvents.run();
                }
            } finally {
                if (activeInvocation == invocation) {
                    activeInvocation = null;
                }
            }
        }
    }

    public boolean isBusy() {
        return activeInvocation != null;
    }

    public boolean isClosed() {
        return closed.get();
    }

    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }
}
