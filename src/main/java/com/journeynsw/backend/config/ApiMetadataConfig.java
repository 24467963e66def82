package com.journeynsw.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class ApiMetadataConfig implements WebMvcConfigurer {

        /**
         * Maps "/docs" to the Swagger UI.
         */
        @Override
        public void addViewControllers(ViewControllerRegistry registry) {
                registry.addRedirectViewController("/docs", "/swagger-ui/index.html");
                registry.addRedirectViewController("/docs/", "/swagger-ui/index.html");
        }

        @Bean
        public OpenAPI journeyNswOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("JourneyNSW API documentation")
                                                .description(
                                                                "Upcoming journeys between configured stops from the Transport for NSW trip planner, with live vehicle positions from the GTFS realtime feeds.\n\nData provided by Transport for NSW.")
                                                .version("v1.0.0")
                                                .license(new License().name("Apache 2.0").url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080")
                                                                .description("Local Development")));
        }
}
