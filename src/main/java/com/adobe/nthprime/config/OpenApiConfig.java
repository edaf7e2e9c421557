package com.adobe.nthprime.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI metadata served by springdoc at {@code /v3/api-docs} and
 * rendered under {@code /swagger-ui.html}.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI nthPrimeOpenApi() {
        return new OpenAPI()
            .info(new Info()
                .title("nth-Prime Prediction API")
                .version("v1")
                .description("Predicts the nth prime using calibrated asymptotics, "
                    + "Riemann R inversion and local primality search, and lists consecutive primes")
                .contact(new Contact().name("AEM Engineering Assessment"))
                .license(new License().name("MIT")))
            .servers(List.of(new Server().url("/")));
    }
}
