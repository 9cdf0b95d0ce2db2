package kohost.terminal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 轻量命令执行器（用于调用 docker info/inspect/run/start/stop 等管理命令）。
 * <p>
 * 用户命令不走这里（需要实时流式输出），见 {@link kohost.terminal.exec.StreamingExecutor}。
 */
@Component
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private static final int MAX_OUTPUT_CHARS = 32_000;

    // 读取子进程输出，避免阻塞调用线程
    private final ExecutorService ioPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "cmd-io");
        t.setDaemon(true);
        return t;
    });

    public CommandResult run(Duration timeout, String... args) {
        return run(timeout, Arrays.asList(args));
    }

    public CommandResult run(Duration timeout, List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        Process p;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            p = pb.start();
        } catch (IOException e) {
            // 可执行文件不存在（例如宿主机没装 docker）
            log.warn("start command failed: cmd={}, error={}", command.get(0), e.getMessage());
            return new CommandResult(127, "start command failed: " + e.getMessage());
        }

        StringBuilder out = new StringBuilder();
        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> {
            try (BufferedReader r = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = r.readLine()) != null) {
                    // 只保留前 32k，调用方只需要状态值或错误上下文
                    synchronized (out) {
                        if (out.length() < MAX_OUTPUT_CHARS) {
                            out.append(line).append('\n');
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("read command output interrupted: cmd={}, error={}", command.get(0), e.getMessage());
            }
        }, ioPool);

        long ms = timeout == null ? 0 : timeout.toMillis();
        try {
            boolean finished;
            if (ms <= 0) {
                p.waitFor();
                finished = true;
            } else {
                finished = p.waitFor(ms, TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                p.destroyForcibly();
                p.waitFor(200, TimeUnit.MILLISECONDS);
                drain(reader, 200);
                log.warn("command timeout: cmd={}, timeoutMs={}", command, ms);
                return new CommandResult(124, snapshot(out) + "\n[timeout]", true);
            }
            // 进程退出后给 reader 一个很短的窗口把剩余输出读完
            drain(reader, 500);
            return new CommandResult(p.exitValue(), snapshot(out));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            return new CommandResult(130, snapshot(out) + "\n[interrupted]");
        }
    }

    private void drain(CompletableFuture<Void> reader, long ms) throws InterruptedException {
        try {
            reader.get(ms, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("command output not fully drained: {}", e.toString());
        }
    }

    private static String snapshot(StringBuilder out) {
        synchronized (out) {
            return out.toString();
        }
    }
}
