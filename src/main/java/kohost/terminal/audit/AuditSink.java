package kohost.terminal.audit;

import java.io.IOException;

public interface AuditSink {

    void append(AuditRecord record) throws IOException;
}
