package kohost.terminal.session;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SandboxPathResolverTest {

    private static final String ROOT = "/workspace";

    @Test
    void testRelativeAndHome() {
        assertEquals(Optional.of("/workspace/blog"), SandboxPathResolver.resolve(ROOT, ROOT, "blog"));
        assertEquals(Optional.of("/workspace/blog/public"), SandboxPathResolver.resolve(ROOT, "/workspace/blog", "public/"));
        assertEquals(Optional.of(ROOT), SandboxPathResolver.resolve(ROOT, "/workspace/blog", ""));
        assertEquals(Optional.of(ROOT), SandboxPathResolver.resolve(ROOT, "/workspace/blog", "~"));
        assertEquals(Optional.of("/workspace/shop"), SandboxPathResolver.resolve(ROOT, "/workspace/blog", "~/shop"));
        assertEquals(Optional.of("/workspace/my site"), SandboxPathResolver.resolve(ROOT, ROOT, "\"my site\""));
    }

    @Test
    void testDotDotIsClampedAtRoot() {
        assertEquals(Optional.of(ROOT), SandboxPathResolver.resolve(ROOT, "/workspace/blog", ".."));
        assertEquals(Optional.of(ROOT), SandboxPathResolver.resolve(ROOT, ROOT, ".."));
        assertEquals(Optional.of(ROOT), SandboxPathResolver.resolve(ROOT, ROOT, "../../.."));
        assertEquals(Optional.of("/workspace/a/c"), SandboxPathResolver.resolve(ROOT, "/workspace/a/b", "./../c"));
    }

    @Test
    void testAbsolutePaths() {
        assertEquals(Optional.of("/workspace/blog"), SandboxPathResolver.resolve(ROOT, ROOT, "/workspace//blog/"));
        assertEquals(Optional.empty(), SandboxPathResolver.resolve(ROOT, ROOT, "/etc"));
        assertEquals(Optional.empty(), SandboxPathResolver.resolve(ROOT, ROOT, "/workspace2"));
        assertEquals(Optional.of(ROOT), SandboxPathResolver.resolve(ROOT, ROOT, "/workspace/../.."));
    }

    @Test
    void testCwdOutsideRootFallsBackToRoot() {
        assertEquals(Optional.of("/workspace/x"), SandboxPathResolver.resolve(ROOT, "/tmp", "x"));
    }

    @Test
    void testIsInside() {
        assertTrue(SandboxPathResolver.isInside(ROOT, "/workspace"));
        assertTrue(SandboxPathResolver.isInside(ROOT, "/workspace/a/"));
        assertFalse(SandboxPathResolver.isInside(ROOT, "/workspacex"));
        assertFalse(SandboxPathResolver.isInside(ROOT, null));
    }
}
