package com.peptide_toxicity.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Value("${server.port:3001}")
    private int serverPort;

    @Bean
    public OpenAPI peptideToxicityOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Peptide Toxicity Prediction API")
                        .version("1.0.0")
                        .description("Predict peptide toxicity from amino-acid sequences, analyze sequence features and browse the prediction history.")
                        .license(new License()
                                .name("MIT")
                                .url("https://opensource.org/licenses/MIT"))
                )
                .servers(List.of(
                        new Server().url("http://localhost:" + serverPort).description("Local server")
                ));
    }


    @Bean
    public GroupedOpenApi publicApi() {
        return GroupedOpenApi.builder()
                .group("Peptide Toxicity APIs")
                .pathsToMatch("/api/**")
                .build();
    }
}
