package kohost.terminal.site;

import java.util.Optional;

/**
 * 站点注册表（由控制面维护）：siteId -> 站点目录名
 */
public interface SiteRegistry {

    /**
     * @return 站点目录名（相对用户存储根）；站点不存在、不属于该用户或注册表不可用时为空
     */
    Optional<String> findSiteFolder(String userId, String siteId);
}
