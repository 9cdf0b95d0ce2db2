package kohost.entity.response;

import lombok.Data;

@Data
public class TerminalExecResponse {
    private String command;
    private String backend;
    /**
     * success / failure / timeout / canceled / rejected
     */
    private String outcome;
    private Integer exitCode;
    /**
     * stdout/stderr/info 按到达顺序合并（最多 256KB）
     */
    private String output;
    private Boolean truncated;
    private String error;
    /**
     * 执行后的逻辑 cwd（cd 生效后为新目录）
     */
    private String cwd;
}
