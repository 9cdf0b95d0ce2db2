package kohost.entity.request;

import lombok.Data;

@Data
public class TerminalExecRequest {
    private String userId;
    /**
     * 用户名（决定用户存储目录），可为空
     */
    private String username;
    /**
     * 站点 id：命令在站点目录下执行，为空时在沙箱根执行
     */
    private String siteId;
    private String command;
}
