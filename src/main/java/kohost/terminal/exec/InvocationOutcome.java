package kohost.terminal.exec;

public enum InvocationOutcome {
    RUNNING("running"),
    SUCCESS("success"),
    /**
     * 进程正常退出但 exitCode != 0，或执行环境不可用
     */
    FAILURE("failure"),
    TIMEOUT("timeout"),
    CANCELED("canceled"),
    REJECTED("rejected");

    private final String wireName;

    InvocationOutcome(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
