package kohost.terminal.session;

public final class CdResult {
    private final boolean changed;
    private final String path;
    private final String reason;

    private CdResult(boolean changed, String path, String reason) {
        this.changed = changed;
        this.path = path;
        this.reason = reason;
    }

    public static CdResult changed(String path) {
        return new CdResult(true, path, null);
    }

    public static CdResult rejected(String reason) {
        return new CdResult(false, null, reason);
    }

    public boolean isChanged() {
        return changed;
    }

    /**
     * 新的逻辑 cwd（仅 changed 时有值）
     */
    public String getPath() {
        return path;
    }

    public String getReason() {
        return reason;
    }
}
