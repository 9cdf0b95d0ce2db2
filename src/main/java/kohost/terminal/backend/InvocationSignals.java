package kohost.terminal.backend;

import kohost.terminal.SandboxPaths;

/**
 * 按调用 id 给远端/容器内进程发信号。
 * <p>
 * 每次调用都带环境变量 KOHOST_INVOCATION=&lt;id&gt;，子进程会继承它，扫描 /proc/&lt;pid&gt;/environ 即可找到整棵进程树。
 */
final class InvocationSignals {

    static final String ENV = "KOHOST_INVOCATION";

    private InvocationSignals() {
    }

    static String marker(String invocationId) {
        return ENV + "=" + invocationId;
    }

    static String killScript(String invocationId, String signal) {
        if (!"TERM".equals(signal) && !"KILL".equals(signal)) {
            throw new IllegalArgumentException("unsupported signal: " + signal);
        }
        return "for p in /proc/[0-9]*; do "
                + "if tr '\\0' '\\n' < \"$p/environ\" 2>/dev/null | grep -qx " + SandboxPaths.shellQuote(marker(invocationId)) + "; then "
                + "kill -" + signal + " \"${p#/proc/}\" 2>/dev/null; fi; done; true";
    }
}
