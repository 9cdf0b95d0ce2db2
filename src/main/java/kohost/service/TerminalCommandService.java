package kohost.service;

import kohost.entity.request.TerminalExecRequest;
import kohost.entity.response.TerminalCommandCatalogResponse;
import kohost.entity.response.TerminalExecResponse;
import kohost.terminal.TerminalEventSink;
import kohost.terminal.TerminalUser;
import kohost.terminal.session.TerminalSession;

public interface TerminalCommandService {

    /**
     * 连接建立：创建会话，cwd 初始化为沙箱根
     */
    TerminalSession openSession(String sessionId, TerminalUser user);

    /**
     * 连接断开：移除会话并强制终止进行中的命令
     */
    void closeSession(String sessionId);

    /**
     * 提交一条命令（异步执行）。
     * <p>
     * 会话已有命令在执行时直接拒绝（command_error{outcome:rejected}），不排队。
     * 所有结果都通过 sink 推送，不抛异常。
     */
    void submit(String sessionId, String command, String siteId, TerminalEventSink sink);

    /**
     * 取消会话上正在执行的命令；没有时什么也不做
     */
    boolean cancel(String sessionId);

    /**
     * HTTP 一次性执行：走同一条管线（校验/容器/审计），等待结束后返回收集到的输出
     */
    TerminalExecResponse executeOnce(TerminalExecRequest request);

    TerminalCommandCatalogResponse commandCatalog();

    /**
     * 当前执行后端名（docker / local / ssh）
     */
    String backendName();
}
