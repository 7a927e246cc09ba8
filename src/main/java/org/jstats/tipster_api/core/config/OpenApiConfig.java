package org.jstats.tipster_api.core.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI apiInfo() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tipster API")
                        .description("Match predictions from the registered models, premium entitlements and prediction history.")
                        .version("v1")
                        .contact(new Contact().name("JStats"))
                        .license(new License().name("Apache 2.0")));
    }
}
