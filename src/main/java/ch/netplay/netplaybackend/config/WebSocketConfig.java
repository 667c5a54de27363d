package ch.netplay.netplaybackend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for netplay clients.
 *
 * <ul>
 *   <li>Endpoint: {@code /netplay} (plus SockJS fallback)</li>
 *   <li>Client to server: {@code /app/netplay.*}</li>
 *   <li>Server to one connection: {@code /user/queue/netplay.*}</li>
 * </ul>
 *
 * <p>Inbound and outbound order is preserved per session, so one client's requests are
 * handled in the order it sent them.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final TaskScheduler taskScheduler;
    private final String[] allowedOrigins;

    public WebSocketConfig(@Lazy @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                           @Value("${netplay.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.taskScheduler = taskScheduler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        // per-connection queues; heartbeats let the broker notice dead peers
        config.enableSimpleBroker("/queue")
                .setHeartbeatValue(new long[]{10000, 10000})
                .setTaskScheduler(taskScheduler);
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
        config.setPreservePublishOrder(true);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/netplay")
                .setAllowedOriginPatterns(allowedOrigins);

        registry.addEndpoint("/netplay")
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        registry.setPreserveReceiveOrder(true);
    }
}
