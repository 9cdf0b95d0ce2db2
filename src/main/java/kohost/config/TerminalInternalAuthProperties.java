package kohost.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 终端节点内部鉴权配置：
 * - 仅允许来自指定来源 IP（以及本机 loopback）的请求
 * - 可选开启签名校验（HMAC）
 * - 用户身份默认只信任前置层注入的 X-User-Id / X-Username 头
 */
@Component
@ConfigurationProperties(prefix = "kohost.terminal.internal")
public class TerminalInternalAuthProperties {
    /**
     * 允许的来源 IP（单个值或逗号分隔列表），通常是 API 服务器 / 网关的地址。
     * loopback(127.0.0.1/::1) 永远允许（本机反向代理）。
     */
    private String allowedSourceIp;

    /**
     * HMAC shared secret（requireSignature=true 时启用）
     */
    private String sharedSecret;

    /**
     * 是否强制签名校验
     */
    private boolean requireSignature = false;

    /**
     * 签名允许的最大时间偏移（秒）
     */
    private long maxSkewSeconds = 60;

    /**
     * nonce 缓存的保留时间（秒）
     */
    private long nonceTtlSeconds = 120;

    /**
     * 是否接受 WebSocket 握手 query 里的 userId/username（只在没有前置身份层的开发环境打开）。
     * 打开后头部仍然优先。
     */
    private boolean allowQueryIdentity = false;

    public String getAllowedSourceIp() {
        return allowedSourceIp;
    }

    public void setAllowedSourceIp(String allowedSourceIp) {
        this.allowedSourceIp = allowedSourceIp;
    }

    public String getSharedSecret() {
        return sharedSecret;
    }

    public void setSharedSecret(String sharedSecret) {
        this.sharedSecret = sharedSecret;
    }

    public boolean isRequireSignature() {
        return requireSignature;
    }

    public void setRequireSignature(boolean requireSignature) {
        this.requireSignature = requireSignature;
    }

    public long getMaxSkewSeconds() {
        return maxSkewSeconds;
    }

    public void setMaxSkewSeconds(long maxSkewSeconds) {
        this.maxSkewSeconds = maxSkewSeconds;
    }

    public long getNonceTtlSeconds() {
        return nonceTtlSeconds;
    }

    public void setNonceTtlSeconds(long nonceTtlSeconds) {
        this.nonceTtlSeconds = nonceTtlSeconds;
    }

    public boolean isAllowQueryIdentity() {
        return allowQueryIdentity;
    }

    public void setAllowQueryIdentity(boolean allowQueryIdentity) {
        this.allowQueryIdentity = allowQueryIdentity;
    }

    /**
     * 解析允许 IP 列表（不包含 loopback；loopback 在 filter 内固定允许）
     */
    public List<String> allowedIpList() {
        List<String> out = new ArrayList<>();
        if (allowedSourceIp == null || allowedSourceIp.isBlank()) return out;
        for (String part : allowedSourceIp.split(",")) {
            String ip = part.trim();
            if (!ip.isEmpty()) out.add(ip);
        }
        return out;
    }
}
