package kohost.terminal.policy;

/**
 * 命令未通过安全校验
 */
public class CommandRejectedException extends IllegalArgumentException {
    private final CommandVerdict verdict;

    public CommandRejectedException(CommandVerdict verdict) {
        super(verdict.getReason());
        this.verdict = verdict;
    }

    public CommandVerdict getVerdict() {
        return verdict;
    }
}
