package kohost.terminal;

import kohost.terminal.exec.InvocationOutcome;
import kohost.terminal.exec.OutputType;

/**
 * 推给客户端的终端事件（WebSocket 或 HTTP 一次性执行的收集器）
 */
public interface TerminalEventSink {

    /**
     * terminal_ready
     */
    default void ready(String backend, String cwd) {
    }

    /**
     * command_started
     */
    void commandStarted(String command, String backend, String site);

    /**
     * command_output
     */
    void output(OutputType type, String data);

    /**
     * command_completed：进程自然退出（exitCode 可能非 0）
     */
    void completed(int exitCode, InvocationOutcome outcome);

    /**
     * command_error：拒绝 / 超时 / 取消 / 执行环境不可用
     */
    void commandError(String error, InvocationOutcome outcome, Integer exitCode);

    /**
     * terminal_clear
     */
    default void clear() {
    }
}
