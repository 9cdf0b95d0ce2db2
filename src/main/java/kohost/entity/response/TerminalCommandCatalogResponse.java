package kohost.entity.response;

import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class TerminalCommandCatalogResponse {
    /**
     * 分类 -> 命令
     */
    private Map<String, List<String>> categories;
    private List<String> builtins;
    private List<String> blockedOperators;
    private Integer maxCommandLength;
}
