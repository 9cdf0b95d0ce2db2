package kohost.terminal;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 由外部身份层解析出的终端用户
 */
public final class TerminalUser {
    private static final Pattern PLAIN_ID = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");
    private static final int PREFIX_MAX = 32;
    private static final int HASH_HEX_CHARS = 16;

    private final String userId;
    private final String username;
    private final String storageKey;

    public TerminalUser(String userId, String username) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be empty");
        }
        this.userId = userId.trim();
        this.username = username == null || username.isBlank() ? null : username.trim();
        this.storageKey = encode(this.userId);
    }

    public String getUserId() {
        return userId;
    }

    /**
     * 只用于展示和审计，不参与目录名/容器名
     */
    public String getUsername() {
        return username;
    }

    /**
     * 用户目录名和容器名后缀，只由 userId 决定。
     * <p>
     * 普通 id（字母数字 _ -）原样使用；其它 id 编码为 "清洗后的前缀.sha256 前 16 位"。
     * 普通 id 不含 '.'，两类结果不会重叠；编码结果不会以 '.' 开头。
     */
    public String storageKey() {
        return storageKey;
    }

    static String encode(String id) {
        if (PLAIN_ID.matcher(id).matches()) {
            return id;
        }
        String prefix = id.replaceAll("[^A-Za-z0-9_-]", "_");
        if (prefix.length() > PREFIX_MAX) {
            prefix = prefix.substring(0, PREFIX_MAX);
        }
        return prefix + "." + sha256Hex(id).substring(0, HASH_HEX_CHARS);
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TerminalUser)) return false;
        TerminalUser that = (TerminalUser) o;
        return userId.equals(that.userId) && Objects.equals(username, that.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, username);
    }

    @Override
    public String toString() {
        return "TerminalUser{userId=" + userId + ", username=" + username + "}";
    }
}
