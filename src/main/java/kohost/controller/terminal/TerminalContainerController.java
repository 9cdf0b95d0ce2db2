package kohost.controller.terminal;

import kohost.common.Result;
import kohost.entity.response.TerminalContainerStatusResponse;
import kohost.entity.response.TerminalHeartbeatResponse;
import kohost.service.TerminalContainerService;
import kohost.terminal.InfrastructureException;
import kohost.terminal.TerminalUser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 终端执行环境（容器）接口：ensure/status/stop/heartbeat
 */
@RestController
@RequestMapping("/api/kohost/terminal/container")
@Tag(name = "KoHost 终端执行环境", description = "用户级执行环境：ensure/status/stop/heartbeat（不执行命令）")
public class TerminalContainerController {
    private static final Logger log = LoggerFactory.getLogger(TerminalContainerController.class);

    private final TerminalContainerService containerService;

    public TerminalContainerController(TerminalContainerService containerService) {
        this.containerService = containerService;
    }

    @PostMapping("/ensure")
    @Operation(summary = "确保终端执行环境运行", description = "不存在则创建 kohost_terminal_{userId} 容器，已停止则启动；用户目录挂载到 /workspace")
    public Result<TerminalContainerStatusResponse> ensure(
            @Parameter(description = "用户ID", required = true) @RequestParam String userId,
            @Parameter(description = "用户名（决定存储目录）") @RequestParam(required = false) String username
    ) {
        try {
            containerService.touch(userId);
            return Result.success(containerService.ensure(new TerminalUser(userId, username)));
        } catch (IllegalArgumentException e) {
            return Result.error(400, e.getMessage());
        } catch (InfrastructureException e) {
            log.warn("ensure terminal environment failed: userId={}, error={}", userId, e.getMessage());
            return Result.error(503, e.getUserMessage());
        }
    }

    @GetMapping("/status")
    @Operation(summary = "查询终端执行环境状态", description = "状态值：ABSENT / STOPPED / RUNNING")
    public Result<TerminalContainerStatusResponse> status(
            @Parameter(description = "用户ID", required = true) @RequestParam String userId,
            @Parameter(description = "用户名（决定存储目录）") @RequestParam(required = false) String username
    ) {
        try {
            return Result.success(containerService.status(new TerminalUser(userId, username)));
        } catch (IllegalArgumentException e) {
            return Result.error(400, e.getMessage());
        }
    }

    @PostMapping("/stop")
    @Operation(summary = "停止终端执行环境", description = "docker stop，保留容器与用户数据；仍有命令在执行时返回 409")
    public Result<TerminalContainerStatusResponse> stop(
            @Parameter(description = "用户ID", required = true) @RequestParam String userId,
            @Parameter(description = "用户名（决定存储目录）") @RequestParam(required = false) String username
    ) {
        try {
            return Result.success(containerService.stop(new TerminalUser(userId, username)));
        } catch (IllegalArgumentException e) {
            return Result.error(400, e.getMessage());
        } catch (IllegalStateException e) {
            return Result.error(409, e.getMessage());
        } catch (InfrastructureException e) {
            log.warn("stop terminal environment failed: userId={}, error={}", userId, e.getMessage());
            return Result.error(503, e.getUserMessage());
        }
    }

    @PostMapping("/heartbeat")
    @Operation(summary = "终端心跳", description = "前端定时调用，刷新活跃时间，用于 idle 回收")
    public Result<TerminalHeartbeatResponse> heartbeat(
            @Parameter(description = "用户ID", required = true) @RequestParam String userId
    ) {
        containerService.touch(userId);
        TerminalHeartbeatResponse resp = new TerminalHeartbeatResponse();
        resp.setUserId(userId);
        resp.setServerTimeMs(System.currentTimeMillis());
        return Result.success(resp);
    }
}
