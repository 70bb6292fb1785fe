package com.dailyresearch.pipeline.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme adminKeyScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("x-admin-key");

        return new OpenAPI()
                .info(new Info()
                        .title("Daily Research API")
                        .version("0.1.0")
                        .description("Triggers and inspects daily research runs: promotion sweep, aggregation, dedup, scoring and note writing."))
                .components(new Components().addSecuritySchemes("adminKey", adminKeyScheme));
    }

    /** Every POST under /runs needs the admin key; reads stay open. */
    @Bean
    public OpenApiCustomizer adminSecurityCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            SecurityRequirement adminRequirement = new SecurityRequirement().addList("adminKey");
            openAPI.getPaths().forEach((path, item) -> {
                if (path.startsWith("/runs") && item.getPost() != null) {
                    item.getPost().addSecurityItem(adminRequirement);
                }
            });
        };
    }
}
