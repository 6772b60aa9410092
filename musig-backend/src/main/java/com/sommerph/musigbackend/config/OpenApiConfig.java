package com.sommerph.musigbackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI musigBackendOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Multisig Wallet API")
                        .version("1.0.0")
                        .description("API for building m-of-n multisig wallets, assembling spending transactions and collecting threshold signatures."));
    }

    @Bean
    public GroupedOpenApi multisigGroup() {
        return GroupedOpenApi.builder()
                .group("multisig")
                .pathsToMatch("/api/multisig/**")
                .build();
    }

}
