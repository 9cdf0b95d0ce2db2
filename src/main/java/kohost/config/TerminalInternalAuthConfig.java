package kohost.config;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 注册终端节点内部鉴权 filter（HTTP 接口和 WebSocket 握手都经过它）
 */
@Configuration
public class TerminalInternalAuthConfig {

    @Bean
    public FilterRegistrationBean<TerminalInternalAuthFilter> terminalInternalAuthFilterRegistration(
            TerminalInternalAuthProperties props) {
        FilterRegistrationBean<TerminalInternalAuthFilter> reg = new FilterRegistrationBean<>();
        reg.setFilter(new TerminalInternalAuthFilter(props));
        reg.addUrlPatterns("/api/kohost/terminal/*");
        reg.setOrder(1);
        return reg;
    }
}
