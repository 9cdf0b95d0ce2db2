package kohost.terminal.realtime;

import kohost.config.TerminalInternalAuthProperties;
import kohost.terminal.TerminalProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class TerminalWebSocketConfig implements WebSocketConfigurer {
    private final TerminalWebSocketHandler handler;
    private final TerminalProperties props;
    private final TerminalInternalAuthProperties authProps;

    public TerminalWebSocketConfig(TerminalWebSocketHandler handler, TerminalProperties props,
                                   TerminalInternalAuthProperties authProps) {
        this.handler = handler;
        this.props = props;
        this.authProps = authProps;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String origins = props.getAllowedOriginPatterns() == null ? "*" : props.getAllowedOriginPatterns();
        registry.addHandler(handler, "/api/kohost/terminal/ws")
                .addInterceptors(new TerminalHandshakeInterceptor(authProps.isAllowQueryIdentity()))
                .setAllowedOriginPatterns(origins.split("\\s*,\\s*"));
    }
}
