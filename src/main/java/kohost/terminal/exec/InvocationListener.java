package kohost.terminal.exec;

/**
 * 一次调用的事件回调：onStarted 先于任何 onOutput；onCompleted/onError 二者恰好触发一次，之后不再有回调
 */
public interface InvocationListener {

    default void onStarted(Invocation invocation) {
    }

    void onOutput(Invocation invocation, OutputType type, String chunk);

    /**
     * 进程自然退出（exitCode 可能非 0）
     */
    void onCompleted(Invocation invocation, int exitCode);

    /**
     * 超时 / 取消 / 执行环境异常
     */
    void onError(Invocation invocation, InvocationOutcome outcome, String message);
}
