package kohost.terminal.policy;

/**
 * 白名单条目：主命令 + 分类 + 说明，validateSubcommand=true 时第二个 token 还要过子命令白名单（git）
 */
public final class AllowedCommand {
    private final String name;
    private final String category;
    private final String description;
    private final boolean validateSubcommand;

    public AllowedCommand(String name, String category, String description, boolean validateSubcommand) {
        this.name = name;
        this.category = category;
        this.description = description;
        this.validateSubcommand = validateSubcommand;
    }

    public String getName() {
        return name;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public boolean isValidateSubcommand() {
        return validateSubcommand;
    }
}
