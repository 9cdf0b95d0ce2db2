package kohost.terminal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Terminal（用户受限命令执行）配置
 */
@Component
@ConfigurationProperties(prefix = "kohost.terminal")
public class TerminalProperties {

    /**
     * 是否启用终端功能（关闭后 idle 回收也不再运行）
     */
    private boolean enabled = true;

    /**
     * 执行后端：docker（默认）/ local / ssh
     */
    private String backend = "docker";

    /**
     * 用户存储宿主机根目录：{hostRoot}/{storageKey}，docker 模式下 bind mount 到 sandboxRoot
     */
    private String hostRoot;

    /**
     * 终端镜像（由 docker/terminal.Dockerfile 构建）
     */
    private String image = "kohost-terminal:latest";

    /**
     * 容器名前缀：kohost_terminal_{userId}
     */
    private String containerNamePrefix = "kohost_terminal_";

    /**
     * 逻辑沙箱根目录（也是容器内挂载目录），用户可见的 cwd 永远以它为前缀
     */
    private String sandboxRoot = "/workspace";

    /**
     * 容器网络模式：npm/composer install 需要出网，默认 bridge
     */
    private String networkName = "bridge";

    /**
     * docker run --memory
     */
    private String dockerMemory = "512m";

    /**
     * docker run --memory-swap（可选）
     */
    private String dockerMemorySwap;

    /**
     * docker run --cpus
     */
    private Double dockerCpus = 0.5;

    /**
     * docker run --pids-limit（防止 fork 炸弹拖垮宿主机）
     */
    private Integer pidsLimit = 256;

    /**
     * 单条命令的墙钟超时（秒），超时后强制终止进程
     */
    private int execTimeoutSeconds = 300;

    /**
     * docker inspect/start/stop 等管理命令的超时（秒）
     */
    private int dockerCommandTimeoutSeconds = 10;

    /**
     * docker run 创建容器的超时（秒）
     */
    private int containerCreateTimeoutSeconds = 30;

    /**
     * 无操作多少分钟后自动 stop 容器（<=0 表示禁用）
     */
    private int idleStopContainerMinutes = 30;

    /**
     * 命令最大长度
     */
    private int maxCommandLength = 1000;

    /**
     * 审计日志目录（JSON lines），为空时使用 {hostRoot}/.audit
     */
    private String auditDir;

    /**
     * WebSocket 允许的 Origin pattern
     */
    private String allowedOriginPatterns = "*";

    private Ssh ssh = new Ssh();

    private SiteRegistry siteRegistry = new SiteRegistry();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getHostRoot() {
        return hostRoot;
    }

    public void setHostRoot(String hostRoot) {
        this.hostRoot = hostRoot;
    }

    public String getImage() {
        return image;
    }

    public void setImage(String image) {
        this.image = image;
    }

    public String getContainerNamePrefix() {
        return containerNamePrefix;
    }

    public void setContainerNamePrefix(String containerNamePrefix) {
        this.containerNamePrefix = containerNamePrefix;
    }

    public String getSandboxRoot() {
        return sandboxRoot;
    }

    public void setSandboxRoot(String sandboxRoot) {
        this.sandboxRoot = sandboxRoot;
    }

    public String getNetworkName() {
        return networkName;
    }

    public void setNetworkName(String networkName) {
        this.networkName = networkName;
    }

    public String getDockerMemory() {
        return dockerMemory;
    }

    public void setDockerMemory(String dockerMemory) {
        this.dockerMemory = dockerMemory;
    }

    public String getDockerMemorySwap() {
        return dockerMemorySwap;
    }

    public void setDockerMemorySwap(String dockerMemorySwap) {
        this.dockerMemorySwap = dockerMemorySwap;
    }

    public Double getDockerCpus() {
        return dockerCpus;
    }

    public void setDockerCpus(Double dockerCpus) {
        this.dockerCpus = dockerCpus;
    }

    public Integer getPidsLimit() {
        return pidsLimit;
    }

    public void setPidsLimit(Integer pidsLimit) {
        this.pidsLimit = pidsLimit;
    }

    public int getExecTimeoutSeconds() {
        return execTimeoutSeconds;
    }

    public void setExecTimeoutSeconds(int execTimeoutSeconds) {
        this.execTimeoutSeconds = execTimeoutSeconds;
    }

    public int getDockerCommandTimeoutSeconds() {
        return dockerCommandTimeoutSeconds;
    }

    public void setDockerCommandTimeoutSeconds(int dockerCommandTimeoutSeconds) {
        this.dockerCommandTimeoutSeconds = dockerCommandTimeoutSeconds;
    }

    public int getContainerCreateTimeoutSeconds() {
        return containerCreateTimeoutSeconds;
    }

    public void setContainerCreateTimeoutSeconds(int containerCreateTimeoutSeconds) {
        this.containerCreateTimeoutSeconds = containerCreateTimeoutSeconds;
    }

    public int getIdleStopContainerMinutes() {
        return idleStopContainerMinutes;
    }

    public void setIdleStopContainerMinutes(int idleStopContainerMinutes) {
        this.idleStopContainerMinutes = idleStopContainerMinutes;
    }

    public int getMaxCommandLength() {
        return maxCommandLength;
    }

    public void setMaxCommandLength(int maxCommandLength) {
        this.maxCommandLength = maxCommandLength;
    }

    public String getAuditDir() {
        return auditDir;
    }

    public void setAuditDir(String auditDir) {
        this.auditDir = auditDir;
    }

    public String getAllowedOriginPatterns() {
        return allowedOriginPatterns;
    }

    public void setAllowedOriginPatterns(String allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    public Ssh getSsh() {
        return ssh;
    }

    public void setSsh(Ssh ssh) {
        this.ssh = ssh;
    }

    public SiteRegistry getSiteRegistry() {
        return siteRegistry;
    }

    public void setSiteRegistry(SiteRegistry siteRegistry) {
        this.siteRegistry = siteRegistry;
    }

    /**
     * ssh 后端：命令在远端主机 {rootPath}/{storageKey} 下执行
     */
    public static class Ssh {
        private String host;
        private int port = 22;
        private String username;
        private String password;
        /**
         * 私钥文件（可选，优先于密码）
         */
        private String privateKeyPath;
        /**
         * known_hosts 文件（必填）；未配置时 ssh 后端拒绝连接
         */
        private String knownHostsPath;
        private String rootPath = "/volume1/web/project/kohost_users";
        private int connectTimeoutMs = 10_000;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getPrivateKeyPath() {
            return privateKeyPath;
        }

        public void setPrivateKeyPath(String privateKeyPath) {
            this.privateKeyPath = privateKeyPath;
        }

        public String getKnownHostsPath() {
            return knownHostsPath;
        }

        public void setKnownHostsPath(String knownHostsPath) {
            this.knownHostsPath = knownHostsPath;
        }

        public String getRootPath() {
            return rootPath;
        }

        public void setRootPath(String rootPath) {
            this.rootPath = rootPath;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }
    }

    /**
     * 站点注册表（控制面 API）：按 siteId 查询站点目录名，用于初始化 cwd
     *
     * <pre>
     * kohost.terminal.site-registry.enabled=true
     * kohost.terminal.site-registry.base-url=http://panel-api:8080
     * kohost.terminal.site-registry.token=CHANGE_ME
     * </pre>
     */
    public static class SiteRegistry {
        private boolean enabled = false;
        private String baseUrl;
        private String token;
        private int timeoutMs = 3000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
