package com.flow.mapper.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI flowMapperServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Flow Mapper Service API")
                        .description("Builds and edits process graphs. Translates semantic process intents " +
                                "into patches and applies them while keeping the graph's topology rules.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Flow Team")
                                .email("flow-team@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .tags(List.of(
                        new Tag().name("Flows").description("Flow snapshots, validation and relabeling"),
                        new Tag().name("Patches").description("Patch application, preview, history and rollback"),
                        new Tag().name("Intent").description("Intent to patch translation")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
