package kohost.terminal.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 命令安全策略表（进程级，只读，启动时构建一次）。
 * <p>
 * 采用“严格白名单”：只有 allowlist 中的主命令可以执行，absoluteBlocklist 优先级高于 allowlist。
 */
public final class CommandPolicy {

    private final int maxLength;
    private final Map<String, AllowedCommand> allowlist;
    private final Set<String> absoluteBlocklist;
    private final List<String> blockedOperators;
    private final List<String> blockedPathPatterns;
    private final Set<String> allowedGitSubcommands;
    private final List<Pattern> dangerousPatterns;

    public CommandPolicy(int maxLength,
                         Map<String, AllowedCommand> allowlist,
                         Set<String> absoluteBlocklist,
                         List<String> blockedOperators,
                         List<String> blockedPathPatterns,
                         Set<String> allowedGitSubcommands,
                         List<Pattern> dangerousPatterns) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        this.maxLength = maxLength;
        this.allowlist = Collections.unmodifiableMap(new LinkedHashMap<>(allowlist));
        this.absoluteBlocklist = Collections.unmodifiableSet(new LinkedHashSet<>(absoluteBlocklist));
        this.blockedOperators = List.copyOf(blockedOperators);
        this.blockedPathPatterns = List.copyOf(blockedPathPatterns);
        this.allowedGitSubcommands = Collections.unmodifiableSet(new LinkedHashSet<>(allowedGitSubcommands));
        this.dangerousPatterns = List.copyOf(dangerousPatterns);
    }

    /**
     * 默认策略（容器版）：允许 cp/mv/mkdir/touch，绝对禁止 rm/curl/wget/各类 shell/提权/容器工具。
     * 交互式编辑器（nano/vim/vi/less）和 Windows 等价命令不在列表中：执行是非 TTY 的 /bin/sh -c。
     */
    public static CommandPolicy defaults(int maxLength) {
        Map<String, AllowedCommand> allow = new LinkedHashMap<>();
        String nav = "Navigation & Files";
        add(allow, "ls", nav, "List directory");
        add(allow, "pwd", nav, "Print working directory");
        add(allow, "cd", nav, "Change directory (restricted to project)");
        add(allow, "cat", nav, "Display file content");
        add(allow, "head", nav, "Display first lines");
        add(allow, "tail", nav, "Display last lines");
        add(allow, "grep", nav, "Search pattern in files");
        add(allow, "find", nav, "Find files");

        String archive = "Archive";
        add(allow, "zip", archive, "Create zip archive");
        add(allow, "unzip", archive, "Extract zip archive");
        add(allow, "tar", archive, "Archive utility");

        String php = "PHP/Laravel";
        add(allow, "php", php, "PHP interpreter");
        add(allow, "composer", php, "PHP package manager");

        String node = "Node.js";
        add(allow, "node", node, "Node.js runtime");
        add(allow, "npm", node, "Node package manager");
        add(allow, "npx", node, "Node package executor");
        add(allow, "yarn", node, "Yarn package manager");
        add(allow, "pnpm", node, "PNPM package manager");

        allow.put("git", new AllowedCommand("git", "Git", "Version control", true));

        String util = "Utility";
        add(allow, "echo", util, "Print text");
        add(allow, "clear", util, "Clear terminal");
        add(allow, "whoami", util, "Show current user");
        add(allow, "date", util, "Show date/time");
        add(allow, "which", util, "Locate command");
        add(allow, "mkdir", util, "Create directory");
        add(allow, "touch", util, "Create empty file");
        add(allow, "cp", util, "Copy files");
        add(allow, "mv", util, "Move/rename files");

        Set<String> blocked = new LinkedHashSet<>(List.of(
                // destructive
                "rm", "rmdir", "del", "erase", "shred", "dd",
                // privilege
                "sudo", "su", "runas", "login", "logout", "passwd", "chown", "chmod",
                // system/service
                "systemctl", "service", "reboot", "shutdown", "poweroff", "halt", "init",
                // container/vm
                "docker", "docker-compose", "kubectl", "podman", "containerd",
                "vagrant", "virtualbox", "vmware",
                // network
                "nmap", "nc", "netcat", "ncat", "telnet", "tcpdump", "wireshark",
                // resource abuse
                "yes", "stress", "stress-ng", "fork",
                // background/daemon
                "nohup", "screen", "tmux", "bg", "fg", "disown", "at", "cron", "crontab",
                // filesystem
                "mount", "umount", "fdisk", "mkfs", "parted", "lsblk",
                // download & execute
                "wget", "curl",
                // shell bypass
                "bash", "sh", "zsh", "fish", "csh", "ksh", "eval", "exec",
                "powershell", "pwsh", "cmd"
        ));

        // 单独的 & 不拦截：URL/字符串里很常见，后台任务由执行超时兜底
        List<String> operators = List.of(
                ";", "&&", "||", "|", ">", ">>", "<", "2>", "2>>", "&>", "`", "$(", "${"
        );

        List<String> paths = List.of(
                "../", "..\\", "/etc/passwd", "/etc/shadow", "/root", "/proc", "/sys", "/dev", "/boot",
                "C:\\Windows", "C:\\Program", "C:\\Users\\Administrator"
        );

        Set<String> git = new LinkedHashSet<>(List.of(
                "status", "log", "pull", "fetch", "checkout",
                "branch", "diff", "add", "commit", "stash",
                "push", "clone", "init", "remote", "merge",
                "rebase", "reset", "show", "tag", "config"
        ));

        List<Pattern> dangerous = List.of(
                Pattern.compile("\\$\\w+"),               // $VAR
                Pattern.compile("[\\x00-\\x1F]"),          // control characters
                Pattern.compile("\\\\x[0-9a-fA-F]{2}"),    // \xNN
                Pattern.compile(":+\\(\\)\\s*\\{")         // fork bomb
        );

        return new CommandPolicy(maxLength, allow, blocked, operators, paths, git, dangerous);
    }

    private static void add(Map<String, AllowedCommand> allow, String name, String category, String description) {
        allow.put(name, new AllowedCommand(name, category, description, false));
    }

    public int getMaxLength() {
        return maxLength;
    }

    public Map<String, AllowedCommand> getAllowlist() {
        return allowlist;
    }

    public Set<String> getAbsoluteBlocklist() {
        return absoluteBlocklist;
    }

    public List<String> getBlockedOperators() {
        return blockedOperators;
    }

    public List<String> getBlockedPathPatterns() {
        return blockedPathPatterns;
    }

    public Set<String> getAllowedGitSubcommands() {
        return allowedGitSubcommands;
    }

    public List<Pattern> getDangerousPatterns() {
        return dangerousPatterns;
    }

    /**
     * help / GET /commands 使用的命令目录：分类 -> 命令（git 展开为允许的子命令）
     */
    public Map<String, List<String>> catalog() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (AllowedCommand c : allowlist.values()) {
            List<String> list = out.computeIfAbsent(c.getCategory(), k -> new ArrayList<>());
            if (c.isValidateSubcommand() && "git".equals(c.getName())) {
                for (String sub : allowedGitSubcommands) {
                    list.add("git " + sub);
                }
            } else {
                list.add(c.getName());
            }
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(out);
    }
}
