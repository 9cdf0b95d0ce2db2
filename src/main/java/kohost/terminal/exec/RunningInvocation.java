package kohost.terminal.exec;

/**
 * 正在执行的一次调用，可取消
 */
public interface RunningInvocation {

    Invocation getInvocation();

    /**
     * 幂等：已结束或已取消时什么也不做
     *
     * @return 本次调用是否触发了取消
     */
    boolean cancel();

    boolean isFinished();
}
