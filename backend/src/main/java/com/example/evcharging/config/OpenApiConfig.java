package com.example.evcharging.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI evChargingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("EV Charging Aggregator API")
                        .version("1.0.0")
                        .description("Station discovery across charging networks and session control"))
                .components(new Components().addSecuritySchemes("bearer",
                        new SecurityScheme().type(SecurityScheme.Type.HTTP).scheme("bearer")))
                .addSecurityItem(new SecurityRequirement().addList("bearer"));
    }

    @Bean
    public GroupedOpenApi allApi() {
        return GroupedOpenApi.builder()
                .group("all")
                .pathsToMatch("/api/**")
                .build();
    }

    @Bean
    public GroupedOpenApi stationsApi() {
        return GroupedOpenApi.builder()
                .group("stations")
                .pathsToMatch("/api/stations/**")
                .build();
    }

    @Bean
    public GroupedOpenApi sessionsApi() {
        return GroupedOpenApi.builder()
                .group("sessions")
                .pathsToMatch("/api/sessions/**")
                .build();
    }

    @Bean
    public GroupedOpenApi placesApi() {
        return GroupedOpenApi.builder()
                .group("places")
                .pathsToMatch("/api/places/**")
                .build();
    }

    @Bean
    public GroupedOpenApi providersApi() {
        return GroupedOpenApi.builder()
                .group("providers")
                .pathsToMatch("/api/providers/**")
                .build();
    }
}
