package kohost.terminal.policy;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandPolicyTest {

    @Test
    void testCatalogGroupsByCategoryAndExpandsGit() {
        Map<String, List<String>> catalog = CommandPolicy.defaults(1000).catalog();

        assertTrue(catalog.get("Node.js").contains("npm"));
        assertTrue(catalog.get("PHP/Laravel").contains("composer"));
        assertTrue(catalog.get("Git").contains("git status"));
        assertFalse(catalog.get("Git").contains("git"));
        assertTrue(catalog.get("Utility").contains("cp"));
        assertThrows(UnsupportedOperationException.class, () -> catalog.get("Utility").add("rm"));
    }

    @Test
    void testBlocklistAndAllowlistAreDisjoint() {
        CommandPolicy p = CommandPolicy.defaults(1000);
        for (String blocked : p.getAbsoluteBlocklist()) {
            assertFalse(p.getAllowlist().containsKey(blocked), blocked);
        }
    }

    @Test
    void testRejectsNonPositiveMaxLength() {
        assertThrows(IllegalArgumentException.class, () -> CommandPolicy.defaults(0));
    }
}
