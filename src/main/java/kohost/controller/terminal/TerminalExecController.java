package kohost.controller.terminal;

import kohost.common.Result;
import kohost.entity.request.TerminalExecRequest;
import kohost.entity.response.TerminalCommandCatalogResponse;
import kohost.entity.response.TerminalExecResponse;
import kohost.service.TerminalCommandService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 终端 HTTP 接口：一次性执行 + 命令目录。实时交互走 WebSocket（/api/kohost/terminal/ws）
 */
@RestController
@RequestMapping("/api/kohost/terminal")
@Tag(name = "KoHost 终端命令", description = "受限命令一次性执行（非流式）与允许命令目录")
public class TerminalExecController {
    private static final Logger log = LoggerFactory.getLogger(TerminalExecController.class);

    private final TerminalCommandService commandService;

    public TerminalExecController(TerminalCommandService commandService) {
        this.commandService = commandService;
    }

    @PostMapping("/exec")
    @Operation(summary = "执行一条受限命令并等待结束",
            description = "与 WebSocket 走同一条管线（校验/容器/审计），返回合并后的输出；输出超过 256KB 时截断")
    public Result<TerminalExecResponse> exec(@RequestBody TerminalExecRequest request) {
        try {
            return Result.success(commandService.executeOnce(request));
        } catch (IllegalArgumentException e) {
            return Result.error(400, e.getMessage());
        } catch (IllegalStateException e) {
            log.warn("terminal exec refused: userId={}, error={}", request.getUserId(), e.getMessage());
            return Result.error(409, e.getMessage());
        }
    }

    @GetMapping("/commands")
    @Operation(summary = "允许的命令目录", description = "按分类列出允许的命令、内置命令和被禁止的 shell 操作符")
    public Result<TerminalCommandCatalogResponse> commands() {
        return Result.success(commandService.commandCatalog());
    }
}
