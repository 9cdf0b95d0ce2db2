package kohost.terminal.backend;

public enum ContainerStatus {
    /**
     * 从未创建（或被外部删除）
     */
    ABSENT,
    STOPPED,
    RUNNING
}
