package kohost.terminal.session;

import kohost.terminal.SandboxPaths;
import kohost.terminal.TerminalProperties;
import kohost.terminal.TerminalUser;
import kohost.terminal.exec.StreamingExecutor;
import kohost.terminal.site.SiteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 会话表（按连接 id 索引）：连接建立时插入，断开时移除并强制终止进行中的调用。
 * <p>
 * 会话的 cwd 永远是沙箱根下的逻辑路径，每次 cd 都会重新校验。
 */
@Component
public class TerminalSessionStore {
    private static final Logger log = LoggerFactory.getLogger(TerminalSessionStore.class);

    private static final Pattern SAFE_FOLDER = Pattern.compile("^[A-Za-z0-9._-]+$");

    private final TerminalProperties props;
    private final SiteRegistry siteRegistry;
    private final StreamingExecutor executor;

    private final ConcurrentHashMap<String, TerminalSession> sessions = new ConcurrentHashMap<>();

    public TerminalSessionStore(TerminalProperties props, SiteRegistry siteRegistry, StreamingExecutor executor) {
        this.props = props;
        this.siteRegistry = siteRegistry;
        this.executor = executor;
    }

    public TerminalSession open(String sessionId, TerminalUser user) {
        if (!StringUtils.hasText(sessionId) || user == null) {
            throw new IllegalArgumentException("sessionId/user must not be empty");
        }
        TerminalSession s = new TerminalSession(sessionId, user, root());
        if (sessions.putIfAbsent(sessionId, s) != null) {
            throw new IllegalStateException("session already open: " + sessionId);
        }
        log.info("terminal session opened: sessionId={}, userId={}", sessionId, user.getUserId());
        return s;
    }

    /**
     * 关闭会话并强制终止进行中的调用（幂等）
     */
    public void close(String sessionId) {
        if (sessionId == null) return;
        TerminalSession s = sessions.remove(sessionId);
        if (s == null || !s.markClosed()) return;
        boolean canceled = executor.cancel(sessionId);
        log.info("terminal session closed: sessionId={}, userId={}, canceledRunning={}",
                sessionId, s.getUser().getUserId(), canceled);
    }

    public Optional<TerminalSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public TerminalSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new IllegalArgumentException("session not found"));
    }

    public String getCwd(String sessionId) {
        return get(sessionId).getCwd();
    }

    public int size() {
        return sessions.size();
    }

    /**
     * 绑定站点：siteId 变化时把 cwd 重置为站点目录（查不到或目录名不安全时为沙箱根）
     *
     * @return 绑定后的 cwd
     */
    public String setSiteBinding(String sessionId, String siteId) {
        TerminalSession s = get(sessionId);
        if (!StringUtils.hasText(siteId) || Objects.equals(s.getSiteId(), siteId.trim())) {
            return s.getCwd();
        }
        String sid = siteId.trim();
        s.setSiteId(sid);
        String folder = siteRegistry.findSiteFolder(s.getUser().getUserId(), sid)
                .filter(TerminalSessionStore::isSafeFolder)
                .orElse(null);
        String cwd = folder == null ? root() : root() + "/" + folder;
        s.setCwd(cwd);
        log.debug("site bound: sessionId={}, siteId={}, cwd={}", sessionId, sid, cwd);
        return cwd;
    }

    /**
     * cd：先做纯字符串解析（不越过沙箱根），再到执行环境里确认目录存在；失败时 cwd 不变
     */
    public CdResult changeDir(String sessionId, String target, DirectoryProbe probe) {
        TerminalSession s = get(sessionId);
        Optional<String> resolved = SandboxPathResolver.resolve(root(), s.getCwd(), target);
        if (resolved.isEmpty()) {
            return CdResult.rejected("Access denied: can only navigate within " + root());
        }
        String path = resolved.get();
        if (!SandboxPathResolver.isInside(root(), path)) {
            return CdResult.rejected("Access denied: can only navigate within " + root());
        }
        if (!probe.isDirectory(path)) {
            return CdResult.rejected("Directory not found: " + (target == null ? "" : target.trim()));
        }
        s.setCwd(path);
        return CdResult.changed(path);
    }

    private String root() {
        return SandboxPaths.trimTrailingSlash(props.getSandboxRoot());
    }

    private static boolean isSafeFolder(String folder) {
        return folder != null && SAFE_FOLDER.matcher(folder).matches() && !".".equals(folder) && !"..".equals(folder);
    }
}
