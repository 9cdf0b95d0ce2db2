package kohost.terminal.audit;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class AuditLoggerTest {

    @Test
    void testRecordsInOrderAndDrainsOnShutdown() {
        List<String> written = new CopyOnWriteArrayList<>();
        AuditLogger logger = new AuditLogger(r -> written.add(r.getCommand()));

        logger.record(AuditRecord.builder().command("ls").build());
        logger.record(AuditRecord.builder().command("pwd").build());
        logger.record(null);
        logger.shutdown();

        assertEquals(List.of("ls", "pwd"), written);
    }

    @Test
    void testSinkFailureDoesNotStopLaterRecords() {
        List<String> written = new CopyOnWriteArrayList<>();
        AuditLogger logger = new AuditLogger(r -> {
            if ("bad".equals(r.getCommand())) {
                throw new IOException("disk full");
            }
            written.add(r.getCommand());
        });

        logger.record(AuditRecord.builder().command("bad").build());
        logger.record(AuditRecord.builder().command("good").build());
        logger.shutdown();

        assertEquals(List.of("good"), written);
    }

    @Test
    void testRecordAfterShutdownIsDropped() {
        List<String> written = new CopyOnWriteArrayList<>();
        AuditLogger logger = new AuditLogger(r -> written.add(r.getCommand()));
        logger.shutdown();
        assertDoesNotThrow(() -> logger.record(AuditRecord.builder().command("late").build()));
        assertTrue(written.isEmpty());
    }
}
