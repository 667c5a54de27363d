package ch.netplay.netplaybackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the OpenAPI / Swagger documentation.
 *
 * <p>Covers the REST side only (room listing, health, dev tools). The STOMP destinations
 * are described on {@link WebSocketConfig}.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI netplayOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Netplay Signaling API")
                        .description("Room discovery and diagnostics for the netplay signaling server")
                        .version("v1.0.0"));
    }
}
