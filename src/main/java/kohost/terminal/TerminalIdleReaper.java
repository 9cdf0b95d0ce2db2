package kohost.terminal;

import kohost.terminal.backend.ContainerLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时回收 idle 的终端容器（默认 30 分钟无操作 stop，容器和数据都保留）
 */
@Component
public class TerminalIdleReaper {
    private static final Logger log = LoggerFactory.getLogger(TerminalIdleReaper.class);

    private final ContainerLifecycleManager lifecycleManager;
    private final TerminalProperties props;

    public TerminalIdleReaper(ContainerLifecycleManager lifecycleManager, TerminalProperties props) {
        this.lifecycleManager = lifecycleManager;
        this.props = props;
    }

    @Scheduled(fixedDelay = 60_000L)
    public void sweep() {
        if (!props.isEnabled()) return;
        int stopped = lifecycleManager.reclaimIdle();
        if (stopped > 0) {
            log.info("idle reaper: stopped containers={}", stopped);
        }
    }
}
