package com.haulage.tickets.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI ticketResolutionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Ticket Resolution Service API")
                        .description("REST API for batch processing of scanned haul tickets: run control, the review queue, manual field corrections and the reporting view.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Haulage Data Team")
                                .email("haulage-data@example.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:" + serverPort).description("Development server")
                ));
    }
}
