package com.example.datalake.kbscore.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "KB Score API",
        version = "v1",
        description = "Knowledge base completeness scoring, status summaries and field catalog lookups.",
        contact = @Contact(name = "KB Score Team", email = "support@kbscore.local")
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("KB Score API")
            .version("v1")
            .description("Swagger UI for scoring knowledge base snapshots per business vertical.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi scoringApi() {
    return GroupedOpenApi.builder()
        .group("kb-score")
        .packagesToScan("com.example.datalake.kbscore.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
