package com.demo.policy.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI policyConsentOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("Policy Consent API")
                .description("Privacy policy consent: verify, check, revoke, admin stats and cleanup")
                .version("v1"));
    }
}
