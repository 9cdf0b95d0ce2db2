package kohost.terminal.backend;

import kohost.terminal.InfrastructureException;
import kohost.terminal.TerminalProperties;
import kohost.terminal.TerminalUser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SshExecutionBackendTest {

    private final TerminalUser user = new TerminalUser("42", "alice");

    @Test
    void testLogicalPathsMapUnderRemoteRoot() {
        TerminalProperties props = new TerminalProperties();
        props.getSsh().setRootPath("/volume1/web/project/kohost_users/");
        SshExecutionBackend backend = new SshExecutionBackend(props);

        assertEquals("/volume1/web/project/kohost_users/42", backend.userDir(user));
        assertEquals("cd '/volume1/web/project/kohost_users/42/blog' && npm install",
                backend.describeCommand(user, "/workspace/blog", "npm install"));
        assertEquals("cd '/volume1/web/project/kohost_users/42' && ls",
                backend.describeCommand(user, "/workspace", "ls"));
        assertThrows(IllegalArgumentException.class, () -> backend.describeCommand(user, "/workspace/../etc", "ls"));
    }

    @Test
    void testUnconfiguredHostIsInfrastructureError() {
        SshExecutionBackend backend = new SshExecutionBackend(new TerminalProperties());
        InfrastructureException e = assertThrows(InfrastructureException.class, backend::checkAvailable);
        assertEquals("Remote execution host is not configured", e.getMessage());
        backend.close();
    }

    @Test
    void testMissingKnownHostsFailsClosed() {
        TerminalProperties props = new TerminalProperties();
        props.getSsh().setHost("10.0.0.5");
        props.getSsh().setUsername("kohost");
        props.getSsh().setPassword("secret");
        SshExecutionBackend backend = new SshExecutionBackend(props);

        InfrastructureException e = assertThrows(InfrastructureException.class, backend::checkAvailable);
        assertEquals("Remote host key cannot be verified", e.getMessage());
        assertTrue(e.getRemediation().contains("known-hosts-path"));
        assertThrows(InfrastructureException.class, () -> backend.status(user));
        backend.close();
    }

    @Test
    void testArgumentsAreConfinedToRemoteUserDir() {
        TerminalProperties props = new TerminalProperties();
        props.getSsh().setRootPath("/volume1/web/project/kohost_users");
        SshExecutionBackend backend = new SshExecutionBackend(props);

        assertTrue(backend.checkArguments(user, "cat ../7/.env").isPresent());
        assertTrue(backend.checkArguments(user, "cat /volume1/web/project/kohost_users/7/.env").isPresent());
        assertFalse(backend.checkArguments(user, "cat /volume1/web/project/kohost_users/42/.env").isPresent());
        assertFalse(backend.checkArguments(user, "npm run build").isPresent());
    }
}
