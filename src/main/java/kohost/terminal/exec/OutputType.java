package kohost.terminal.exec;

/**
 * command_output 的 type 字段
 */
public enum OutputType {
    STDOUT("stdout"),
    STDERR("stderr"),
    INFO("info"),
    ERROR("error");

    private final String wireName;

    OutputType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
