package com.basketbot.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger/OpenAPI Configuration
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI basketBotOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Options Basket Bot API")
                        .description("""
                                Operator endpoints for the running basket strategy.

                                • Engine state, open basket and last exit decision
                                • Manual exit request
                                • Realtime feed status and subscriptions
                                """)
                        .version("1.0.0"))
                .servers(List.of(new Server()
                        .url("http://localhost:8080")
                        .description("Local")))
                .tags(List.of(
                        new Tag().name("Strategy").description("Basket strategy engine"),
                        new Tag().name("Streaming").description("Realtime market and order feed")));
    }
}
