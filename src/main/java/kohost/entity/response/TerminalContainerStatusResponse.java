package kohost.entity.response;

import lombok.Data;

@Data
public class TerminalContainerStatusResponse {
    private String userId;
    private String containerName;
    /**
     * docker / local / ssh
     */
    private String backend;
    /**
     * ABSENT / STOPPED / RUNNING
     */
    private String status;
    private Long lastActiveAtMs;
    /**
     * 正在执行的命令数
     */
    private Integer inFlight;
}
