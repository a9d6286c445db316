package ch.wordchain.wordchainbackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the OpenAPI / Swagger documentation.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI wordChainOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Word Chain Game API")
                        .description("Concurrent word chain rooms: joining, turns, word submissions and system status")
                        .version("v1.0.0"));
    }
}
