package kohost.terminal.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 终端命令安全校验器（严格白名单）。
 * <p>
 * 纯函数：结果只取决于输入和策略表，不做任何 I/O。检查顺序固定，命中第一条即拒绝：
 * <ol>
 *     <li>空命令 / 超长</li>
 *     <li>链式/重定向/命令替换操作符（出现即拒绝，不管主命令是什么）</li>
 *     <li>提取主命令（第一个空白分隔的 token，小写）</li>
 *     <li>绝对黑名单（优先于白名单）</li>
 *     <li>不在白名单</li>
 *     <li>git 子命令白名单（单独的 git 允许）</li>
 *     <li>越界路径 / 变量展开 / 控制字符 / hex 转义 / fork 炸弹</li>
 * </ol>
 */
@Component
public class CommandValidator {
    private static final Logger log = LoggerFactory.getLogger(CommandValidator.class);

    private final CommandPolicy policy;

    public CommandValidator(CommandPolicy policy) {
        this.policy = policy;
    }

    public CommandPolicy getPolicy() {
        return policy;
    }

    /**
     * 校验命令，返回 verdict（不抛异常）
     */
    public CommandVerdict evaluate(String raw) {
        if (raw == null) {
            return CommandVerdict.rejected("Invalid command: empty");
        }
        String cmd = raw.trim();
        if (cmd.isEmpty()) {
            return CommandVerdict.rejected("Invalid command: empty");
        }
        if (cmd.length() > policy.getMaxLength()) {
            return CommandVerdict.rejected("Command too long (max " + policy.getMaxLength() + " chars)");
        }

        for (String op : policy.getBlockedOperators()) {
            if (cmd.contains(op)) {
                log.debug("command rejected: operator={}", op);
                return CommandVerdict.rejected("Operator \"" + op + "\" is not allowed: command chaining and redirection are disabled");
            }
        }

        String[] parts = cmd.split("\\s+");
        String primary = parts[0].toLowerCase(Locale.ROOT);

        if (policy.getAbsoluteBlocklist().contains(primary)) {
            log.debug("command rejected: blocked primary={}", primary);
            return CommandVerdict.rejected("Command \"" + primary + "\" is blocked for system security", primary);
        }

        AllowedCommand entry = policy.getAllowlist().get(primary);
        if (entry == null) {
            return CommandVerdict.rejected("Command \"" + primary + "\" is not in the allowed list. Type \"help\" to see available commands", primary);
        }

        if (entry.isValidateSubcommand() && parts.length > 1) {
            String sub = parts[1].toLowerCase(Locale.ROOT);
            if (!policy.getAllowedGitSubcommands().contains(sub)) {
                return CommandVerdict.rejected("Git subcommand \"" + sub + "\" is not allowed. Use: "
                        + String.join(", ", policy.getAllowedGitSubcommands()), primary);
            }
        }

        String lower = cmd.toLowerCase(Locale.ROOT);
        for (String p : policy.getBlockedPathPatterns()) {
            if (lower.contains(p.toLowerCase(Locale.ROOT))) {
                log.debug("command rejected: path pattern={}", p);
                return CommandVerdict.rejected("Access to path \"" + p + "\" is not allowed: stay inside your project folder", primary);
            }
        }

        for (Pattern p : policy.getDangerousPatterns()) {
            if (p.matcher(cmd).find()) {
                log.debug("command rejected: dangerous pattern={}", p.pattern());
                return CommandVerdict.rejected("Command contains a dangerous pattern", primary);
            }
        }

        return CommandVerdict.allowed(primary);
    }

    /**
     * 校验命令，不通过时抛出 {@link CommandRejectedException}
     */
    public CommandVerdict validate(String raw) {
        CommandVerdict v = evaluate(raw);
        if (!v.isAllowed()) {
            throw new CommandRejectedException(v);
        }
        return v;
    }
}
