package kohost.terminal.exec;

import java.io.InputStream;
import java.util.concurrent.TimeUnit;

/**
 * 已启动的一次命令执行（本地进程 / docker exec 客户端进程 / ssh channel）
 */
public interface ExecHandle {

    InputStream stdout();

    /**
     * stderr 与 stdout 合并时返回 null
     */
    InputStream stderr();

    boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 仅在进程已退出后有效
     */
    int exitCode();

    boolean isAlive();

    /**
     * 温和终止（SIGTERM 或等价操作）
     */
    void terminate();

    /**
     * 强制终止进程及其子进程
     */
    void forceTerminate();
}
