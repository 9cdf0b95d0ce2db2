package kohost.service.impl;

import kohost.entity.response.TerminalContainerStatusResponse;
import kohost.service.TerminalContainerService;
import kohost.terminal.TerminalActivityTracker;
import kohost.terminal.TerminalProperties;
import kohost.terminal.TerminalUser;
import kohost.terminal.backend.ContainerLifecycleManager;
import kohost.terminal.backend.ContainerRecord;
import org.springframework.stereotype.Service;

@Service
public class TerminalContainerServiceImpl implements TerminalContainerService {

    private final ContainerLifecycleManager lifecycleManager;
    private final TerminalActivityTracker activityTracker;
    private final TerminalProperties props;

    public TerminalContainerServiceImpl(ContainerLifecycleManager lifecycleManager,
                                        TerminalActivityTracker activityTracker,
                                        TerminalProperties props) {
        this.lifecycleManager = lifecycleManager;
        this.activityTracker = activityTracker;
        this.props = props;
    }

    @Override
    public TerminalContainerStatusResponse ensure(TerminalUser user) {
        assertEnabled();
        return toResponse(lifecycleManager.ensureRunning(user, null));
    }

    @Override
    public TerminalContainerStatusResponse status(TerminalUser user) {
        return toResponse(lifecycleManager.status(user));
    }

    @Override
    public TerminalContainerStatusResponse stop(TerminalUser user) {
        return toResponse(lifecycleManager.stop(user));
    }

    @Override
    public void touch(String userId) {
        activityTracker.touch(userId);
    }

    private TerminalContainerStatusResponse toResponse(ContainerRecord r) {
        TerminalContainerStatusResponse resp = new TerminalContainerStatusResponse();
        resp.setUserId(r.getUserId());
        resp.setContainerName(r.getContainerName());
        resp.setBackend(r.getBackend());
        resp.setStatus(r.getStatus().name());
        resp.setLastActiveAtMs(r.getLastActivityAtMs());
        resp.setInFlight(r.getInFlight());
        return resp;
    }

    private void assertEnabled() {
        if (!props.isEnabled()) {
            throw new IllegalStateException("terminal is disabled");
        }
    }
}
