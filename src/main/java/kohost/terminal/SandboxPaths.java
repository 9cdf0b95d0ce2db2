package kohost.terminal;

/**
 * 逻辑沙箱路径 / shell 拼接的小工具
 */
public final class SandboxPaths {

    private SandboxPaths() {
    }

    /**
     * 单引号 escape：'a'"'"'b'
     */
    public static String shellQuote(String s) {
        if (s == null) return "''";
        return "'" + s.replace("'", "'\"'\"'") + "'";
    }

    /**
     * 逻辑路径相对沙箱根的部分（不含前导 /）；根本身返回空串。
     *
     * @throws IllegalArgumentException 路径不在沙箱内或含 ..
     */
    public static String relativize(String sandboxRoot, String logicalPath) {
        String root = trimTrailingSlash(sandboxRoot);
        String p = logicalPath == null ? root : trimTrailingSlash(logicalPath);
        if (p.equals(root)) {
            return "";
        }
        if (!p.startsWith(root + "/")) {
            throw new IllegalArgumentException("path is outside the sandbox");
        }
        String rel = p.substring(root.length() + 1);
        for (String seg : rel.split("/")) {
            if ("..".equals(seg)) {
                throw new IllegalArgumentException("path is outside the sandbox");
            }
        }
        return rel;
    }

    public static String trimTrailingSlash(String p) {
        if (p == null || p.isEmpty()) return "/";
        String s = p;
        while (s.length() > 1 && s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
