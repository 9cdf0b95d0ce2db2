package kohost.service;

import kohost.entity.response.TerminalContainerStatusResponse;
import kohost.terminal.TerminalUser;

public interface TerminalContainerService {

    /**
     * 确保用户执行环境运行（不存在则创建）
     */
    TerminalContainerStatusResponse ensure(TerminalUser user);

    TerminalContainerStatusResponse status(TerminalUser user);

    /**
     * 停止用户执行环境（保留容器与数据）；仍有命令在执行时拒绝
     */
    TerminalContainerStatusResponse stop(TerminalUser user);

    /**
     * 前端心跳：刷新活跃时间，避免被 idle 回收
     */
    void touch(String userId);
}
