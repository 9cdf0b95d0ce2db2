package kohost.terminal.backend;

import kohost.terminal.TerminalUser;
import kohost.terminal.exec.ExecHandle;

import java.util.Optional;

/**
 * 用户命令的执行后端（docker / local / ssh）。
 * <p>
 * 上层只看到逻辑路径（沙箱根，默认 /workspace），由各实现映射到真实位置；
 * 执行环境不可用时抛 {@link kohost.terminal.InfrastructureException}。
 */
public interface ExecutionBackend {

    String name();

    /**
     * 用户执行环境的标识（docker 为容器名）
     */
    String containerName(TerminalUser user);

    /**
     * 是否有需要 start/stop 的长驻环境；没有时 idle 回收直接跳过
     */
    default boolean hasLifecycle() {
        return false;
    }

    void checkAvailable();

    ContainerStatus status(TerminalUser user);

    /**
     * 创建并启动执行环境
     */
    void create(TerminalUser user);

    void start(TerminalUser user);

    void stop(TerminalUser user);

    /**
     * 已通过 CommandValidator 的命令在本后端上的额外参数检查，返回拒绝原因。
     * docker 后端靠容器挂载隔离，默认不检查。
     */
    default Optional<String> checkArguments(TerminalUser user, String command) {
        return Optional.empty();
    }

    /**
     * 在执行环境内部检查逻辑路径是否为目录
     */
    boolean isDirectory(TerminalUser user, String logicalPath);

    /**
     * 在逻辑 cwd 下启动命令（命令已通过校验）
     */
    ExecHandle exec(TerminalUser user, String logicalCwd, String command, String invocationId);

    /**
     * 实际交给 /bin/sh -c 的命令：cd '&lt;真实 cwd&gt;' &amp;&amp; &lt;command&gt;
     */
    String describeCommand(TerminalUser user, String logicalCwd, String command);
}
