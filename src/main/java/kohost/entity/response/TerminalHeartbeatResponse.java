package kohost.entity.response;

import lombok.Data;

@Data
public class TerminalHeartbeatResponse {
    private String userId;
    private Long serverTimeMs;
}
