package kohost.terminal;

public class CommandResult {
    private final int exitCode;
    private final String output;
    private final boolean timedOut;

    public CommandResult(int exitCode, String output) {
        this(exitCode, output, false);
    }

    public CommandResult(int exitCode, String output, boolean timedOut) {
        this.exitCode = exitCode;
        this.output = output == null ? "" : output;
        this.timedOut = timedOut;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }

    /**
     * docker CLI 输出通常带尾部换行，这里取最后一个非空行作为结果值/错误摘要
     */
    public String lastLine() {
        String[] lines = output.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String l = lines[i].trim();
            if (!l.isEmpty()) {
                return l;
            }
        }
        return "";
    }
}
