package kohost.terminal.policy;

/**
 * 校验结果：allowed 或 rejected(reason)
 */
public final class CommandVerdict {
    private final boolean allowed;
    private final String reason;
    private final String primaryCommand;

    private CommandVerdict(boolean allowed, String reason, String primaryCommand) {
        this.allowed = allowed;
        this.reason = reason;
        this.primaryCommand = primaryCommand;
    }

    public static CommandVerdict allowed(String primaryCommand) {
        return new CommandVerdict(true, null, primaryCommand);
    }

    public static CommandVerdict rejected(String reason) {
        return new CommandVerdict(false, reason, null);
    }

    public static CommandVerdict rejected(String reason, String primaryCommand) {
        return new CommandVerdict(false, reason, primaryCommand);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getReason() {
        return reason;
    }

    /**
     * 小写的主命令；空命令/含非法操作符时为 null
     */
    public String getPrimaryCommand() {
        return primaryCommand;
    }

    @Override
    public String toString() {
        return allowed ? "allowed(" + primaryCommand + ")" : "rejected(" + reason + ")";
    }
}
