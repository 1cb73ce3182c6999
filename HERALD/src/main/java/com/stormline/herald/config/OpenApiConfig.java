package com.stormline.herald.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for HERALD service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI heraldOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HERALD API")
                        .description("""
                                HERALD - tool-using agents over a chat-completion reasoning engine.

                                ## Agents
                                - **weather**: answers questions about active US weather alerts by state

                                Execution failures are reported in the response body, never as 5xx.
                                """)
                        .version("0.1.0"))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
