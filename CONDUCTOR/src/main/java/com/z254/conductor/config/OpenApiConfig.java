package com.z254.conductor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for CONDUCTOR service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI conductorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CONDUCTOR API")
                        .description("""
                                CONDUCTOR - content workflow orchestration for online support programs.

                                Plans content workflows, delegates their tasks to specialized agents and
                                grounds them in knowledge retrieved from several sources.

                                ## Features
                                - **Workflow Engine**: parallel and sequential phases, critical-phase abort
                                - **Quality Gate**: a single refinement pass below the quality threshold
                                - **Knowledge Retrieval**: multi-strategy search with ranking and caching
                                """)
                        .version("1.0.0")
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
