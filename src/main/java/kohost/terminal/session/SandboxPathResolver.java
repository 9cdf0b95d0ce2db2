package kohost.terminal.session;

import kohost.terminal.SandboxPaths;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * cd 目标的纯字符串解析（不访问文件系统）：
 * <ul>
 *     <li>空 / ~ 回到沙箱根，~/x 相对沙箱根</li>
 *     <li>.. 上移一级，到沙箱根为止（不会越界）；. 忽略；重复的 / 合并</li>
 *     <li>绝对路径必须以沙箱根开头，否则拒绝</li>
 * </ul>
 */
public final class SandboxPathResolver {

    private SandboxPathResolver() {
    }

    /**
     * @return 规范化后的逻辑绝对路径；绝对路径不在沙箱内时为空
     */
    public static Optional<String> resolve(String sandboxRoot, String cwd, String target) {
        String root = SandboxPaths.trimTrailingSlash(sandboxRoot);
        String t = unquote(target == null ? "" : target.trim());

        String base;
        String rest;
        if (t.isEmpty() || "~".equals(t)) {
            return Optional.of(root);
        } else if (t.startsWith("~/")) {
            base = root;
            rest = t.substring(2);
        } else if (t.startsWith("/")) {
            String abs = SandboxPaths.trimTrailingSlash(t.replaceAll("/+", "/"));
            if (!abs.equals(root) && !abs.startsWith(root + "/")) {
                return Optional.empty();
            }
            base = root;
            rest = abs.substring(root.length());
        } else {
            base = isInside(root, cwd) ? SandboxPaths.trimTrailingSlash(cwd) : root;
            rest = t;
        }

        Deque<String> segs = new ArrayDeque<>();
        String baseRel = base.equals(root) ? "" : base.substring(root.length() + 1);
        push(segs, baseRel);
        push(segs, rest);

        if (segs.isEmpty()) {
            return Optional.of(root);
        }
        return Optional.of(root + "/" + String.join("/", segs));
    }

    public static boolean isInside(String sandboxRoot, String path) {
        if (path == null) return false;
        String root = SandboxPaths.trimTrailingSlash(sandboxRoot);
        String p = SandboxPaths.trimTrailingSlash(path);
        return p.equals(root) || p.startsWith(root + "/");
    }

    private static void push(Deque<String> segs, String path) {
        for (String seg : path.split("/")) {
            if (seg.isEmpty() || ".".equals(seg)) continue;
            if ("..".equals(seg)) {
                // 到根为止
                segs.pollLast();
                continue;
            }
            segs.addLast(seg);
        }
    }

    private static String unquote(String s) {
        if (s.length() >= 2) {
            char a = s.charAt(0);
            char b = s.charAt(s.length() - 1);
            if ((a == '"' || a == '\'') && a == b) {
                return s.substring(1, s.length() - 1).trim();
            }
        }
        return s;
    }
}
