package kohost.terminal;

/**
 * 执行环境本身不可用（容器运行时未启动、镜像缺失、容器启动失败、SSH 连接失败等）。
 * <p>
 * message 面向终端用户（不包含宿主机路径/容器内部信息），remediation 为修复建议；
 * 原始错误细节只写服务端日志。此类错误不做自动重试，只中止当前这一次命令。
 */
public class InfrastructureException extends RuntimeException {
    private final String remediation;

    public InfrastructureException(String message, String remediation) {
        super(message);
        this.remediation = remediation;
    }

    public InfrastructureException(String message, String remediation, Throwable cause) {
        super(message, cause);
        this.remediation = remediation;
    }

    public String getRemediation() {
        return remediation;
    }

    /**
     * 推送给用户的完整提示：错误 + 修复建议
     */
    public String getUserMessage() {
        if (remediation == null || remediation.isBlank()) {
            return getMessage();
        }
        return getMessage() + ". " + remediation;
    }
}
