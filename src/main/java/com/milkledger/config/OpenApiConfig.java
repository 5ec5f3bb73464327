package com.milkledger.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI milkLedgerOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8080/api");
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("MilkLedger API")
                .version("1.0.0")
                .description("Daily milk delivery tracking with monthly cost totals. "
                        + "Authenticate with POST /auth/login and send the access token as a Bearer token.");

        String securitySchemeName = "bearerAuth";

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer))
                .addSecurityItem(new SecurityRequirement().addList(securitySchemeName))
                .components(new Components()
                        .addSecuritySchemes(securitySchemeName,
                                new SecurityScheme()
                                        .name(securitySchemeName)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                        )
                );
    }
}
