package kohost.service.impl;

import kohost.terminal.TerminalEventSink;
import kohost.terminal.exec.InvocationOutcome;
import kohost.terminal.exec.OutputType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 把事件记成字符串，便于断言顺序；每个终态事件 release 一次
 */
class RecordingEventSink implements TerminalEventSink {
    final List<String> events = new CopyOnWriteArrayList<>();
    private final Semaphore terminal = new Semaphore(0);

    volatile String lastError;
    volatile InvocationOutcome lastOutcome;
    volatile Integer lastExitCode;

    @Override
    public void commandStarted(String command, String backend, String site) {
        events.add("started:" + command);
    }

    @Override
    public void output(OutputType type, String data) {
        events.add(type.getWireName() + ":" + data);
    }

    @Override
    public void completed(int exitCode, InvocationOutcome outcome) {
        events.add("completed:" + exitCode + ":" + outcome.getWireName());
        lastOutcome = outcome;
        lastExitCode = exitCode;
        terminal.release();
    }

    @Override
    public void commandError(String error, InvocationOutcome outcome, Integer exitCode) {
        events.add("error:" + outcome.getWireName());
        lastError = error;
        lastOutcome = outcome;
        lastExitCode = exitCode;
        terminal.release();
    }

    @Override
    public void clear() {
        events.add("clear");
    }

    boolean awaitTerminal() throws InterruptedException {
        return terminal.tryAcquire(5, TimeUnit.SECONDS);
    }

    String last() {
        return events.get(events.size() - 1);
    }
}
