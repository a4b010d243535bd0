package com.z254.butterfly.concierge.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for CONCIERGE service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI conciergeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CONCIERGE API")
                        .description("""
                                CONCIERGE - Conversational request router for the BUTTERFLY Ecosystem.

                                Classifies each message and routes it to the capability that can answer it.

                                ## Features
                                - **Intent Routing**: recommendation, comparison, review, price, policy and general
                                - **Failure Isolation**: per-capability circuit breakers with rerouting to general
                                - **Sessions**: bounded conversation history used to enrich follow-up queries
                                - **Caching**: Redis when reachable, in-process otherwise
                                """)
                        .version("0.1.0")
                        .contact(new Contact()
                                .name("254STUDIOZ Engineering")
                                .email("engineering@254carbon.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://254carbon.com/licenses")))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
