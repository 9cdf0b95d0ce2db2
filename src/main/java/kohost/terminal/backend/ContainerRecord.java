package kohost.terminal.backend;

import kohost.terminal.TerminalUser;

/**
 * 用户执行环境的快照（容器名、状态、最近活跃时间、进行中的命令数）
 */
public class ContainerRecord {
    private final TerminalUser user;
    private final String containerName;
    private final String backend;
    private final ContainerStatus status;
    private final Long lastActivityAtMs;
    private final int inFlight;

    public ContainerRecord(TerminalUser user, String containerName, String backend,
                           ContainerStatus status, Long lastActivityAtMs, int inFlight) {
        this.user = user;
        this.containerName = containerName;
        this.backend = backend;
        this.status = status;
        this.lastActivityAtMs = lastActivityAtMs;
        this.inFlight = inFlight;
    }

    public String getUserId() {
        return user.getUserId();
    }

    public TerminalUser getUser() {
        return user;
    }

    public String getContainerName() {
        return containerName;
    }

    public String getBackend() {
        return backend;
    }

    public ContainerStatus getStatus() {
        return status;
    }

    public Long getLastActivityAtMs() {
        return lastActivityAtMs;
    }

    public int getInFlight() {
        return inFlight;
    }
}
