package com.cgi.piiscan.dbscanner.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Configuration for OpenAPI documentation (Swagger) and CORS.
 */
@Configuration
public class OpenAPIConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PII Scan API")
                        .version("1.0")
                        .description("Intelligent scanning of relational and non-relational databases for personal data")
                        .contact(new Contact().name("CGI").url("https://www.cgi.com")))
                .addTagsItem(new Tag().name("Database Scans").description("Run scans and list supported engines"));
    }

    /**
     * Allows the front end to call the API.
     *
     * @param allowedOrigin Origin of the front end
     * @return CORS configurer
     */
    @Bean
    public WebMvcConfigurer corsConfigurer(@Value("${dbscanner.cors.allowed-origin:http://localhost:3000}") String allowedOrigin) {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins(allowedOrigin)
                        .allowedMethods("GET", "POST", "OPTIONS")
                        .allowedHeaders("*")
                        .allowCredentials(true);
            }
        };
    }
}
