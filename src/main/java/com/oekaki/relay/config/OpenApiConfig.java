package com.oekaki.relay.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Swagger / OpenAPI UI config. Visit /swagger-ui/index.html after startup. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI oekakiOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Oekaki Relay API")
                        .description("Submit drawing revisions, browse recent drawings and their revision history.")
                        .version("v1"));
    }
}
