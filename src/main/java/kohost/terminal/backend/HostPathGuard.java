package kohost.terminal.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * local / ssh 后端的参数检查：这两种后端所有用户都是同一个系统账号下的兄弟目录，
 * 命令参数里的路径必须留在当前用户目录内。
 * <p>
 * 拒绝：任何 ".." 路径段、"~" 开头的路径、file: URL、以及不在用户真实目录下的绝对路径。
 * 按空白切分 token，去掉引号后检查 token 本身、"=" 之后的值、以及 "-X/path" 这种粘连选项里的路径。
 */
public final class HostPathGuard {

    static final String PARENT_REJECTED = "Access to \"..\" is not allowed on this terminal: use paths inside your project folder";
    static final String HOME_REJECTED = "Access to \"~\" is not allowed on this terminal: use paths inside your project folder";
    static final String URL_REJECTED = "file: URLs are not allowed on this terminal";
    static final String ABSOLUTE_REJECTED = "Absolute paths are not allowed on this terminal: use paths relative to the current folder";

    private HostPathGuard() {
    }

    /**
     * @param command     已通过 CommandValidator 的命令
     * @param realUserDir 用户目录在宿主机/远端的真实绝对路径
     * @return 拒绝原因；允许时为空
     */
    public static Optional<String> check(String command, String realUserDir) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        String base = trimTrailingSlash(realUserDir);
        for (String raw : command.trim().split("\\s+")) {
            String token = raw.replace("\"", "").replace("'", "");
            if (token.toLowerCase(Locale.ROOT).contains("file:")) {
                return Optional.of(URL_REJECTED);
            }
            for (String value : candidates(token)) {
                if (hasParentSegment(value)) {
                    return Optional.of(PARENT_REJECTED);
                }
                if (value.startsWith("~")) {
                    return Optional.of(HOME_REJECTED);
                }
                if (value.startsWith("/") && !isUnder(value, base)) {
                    return Optional.of(ABSOLUTE_REJECTED);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> candidates(String token) {
        List<String> out = new ArrayList<>();
        out.add(token);
        int eq = token.indexOf('=');
        if (eq >= 0) {
            out.add(token.substring(eq + 1));
        }
        if (token.startsWith("-")) {
            int slash = token.indexOf('/');
            if (slash > 0) {
                out.add(token.substring(slash));
            }
        }
        // PATH 风格的列表：a:b:/c（URL 除外）
        String separators = token.contains("://") ? "," : "[:,]";
        for (String part : token.split(separators)) {
            if (!part.equals(token)) {
                out.add(part);
            }
        }
        return out;
    }

    private static boolean hasParentSegment(String value) {
        for (String seg : value.split("[/\\\\]")) {
            if ("..".equals(seg)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isUnder(String path, String base) {
        String p = trimTrailingSlash(path);
        return p.equals(base) || p.startsWith(base + "/");
    }

    private static String trimTrailingSlash(String s) {
        String out = s;
        while (out.length() > 1 && out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
