package kohost.terminal.backend;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HostPathGuardTest {

    private static final String HOME = "/data/kohost/users/42";

    @Test
    void testRelativePathsAndUrlsAreAllowed() {
        assertAllowed("ls -la");
        assertAllowed("cat src/app.js");
        assertAllowed("grep -r TODO ./src");
        assertAllowed("git clone https://github.com/laravel/laravel.git blog");
        assertAllowed("git clone git@github.com:laravel/laravel.git");
        assertAllowed("npm install --save lodash");
        assertAllowed("echo a..b");
        assertAllowed("cat " + HOME + "/blog/.env");
        assertAllowed("tar -C " + HOME + "/blog -xf site.tar");
    }

    @Test
    void testParentSegmentsAreRejected() {
        assertEquals(HostPathGuard.PARENT_REJECTED, check("grep -r DB_PASSWORD .."));
        assertEquals(HostPathGuard.PARENT_REJECTED, check("cat blog/../../bob/.env"));
        assertEquals(HostPathGuard.PARENT_REJECTED, check("cp a.txt \"..\""));
        assertEquals(HostPathGuard.PARENT_REJECTED, check("npm install --prefix=.."));
        assertEquals(HostPathGuard.PARENT_REJECTED, check("find .. -name .env"));
    }

    @Test
    void testAbsolutePathsOutsideUserDirAreRejected() {
        assertEquals(HostPathGuard.ABSOLUTE_REJECTED, check("cat /data/kohost/users/bob/.env"));
        assertEquals(HostPathGuard.ABSOLUTE_REJECTED, check("cat /data/kohost/users/42x/.env"));
        assertEquals(HostPathGuard.ABSOLUTE_REJECTED, check("ls '/home'"));
        assertEquals(HostPathGuard.ABSOLUTE_REJECTED, check("tar -C/data -cf x.tar ."));
        assertEquals(HostPathGuard.ABSOLUTE_REJECTED, check("npm run build --out-dir=/tmp/x"));
        assertEquals(HostPathGuard.ABSOLUTE_REJECTED, check("ls /workspace"));
    }

    @Test
    void testHomeAndFileUrlsAreRejected() {
        assertEquals(HostPathGuard.HOME_REJECTED, check("cat ~/.ssh/id_rsa"));
        assertEquals(HostPathGuard.HOME_REJECTED, check("ls ~bob"));
        assertEquals(HostPathGuard.URL_REJECTED, check("git clone file:///data/kohost/users/bob/repo"));
    }

    private static String check(String command) {
        Optional<String> r = HostPathGuard.check(command, HOME);
        assertTrue(r.isPresent(), command);
        return r.get();
    }

    private static void assertAllowed(String command) {
        assertEquals(Optional.empty(), HostPathGuard.check(command, HOME), command);
    }
}
