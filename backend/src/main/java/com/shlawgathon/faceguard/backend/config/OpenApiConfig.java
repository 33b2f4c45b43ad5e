package com.shlawgathon.faceguard.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI faceguardOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("FaceGuard Backend API")
                        .description("Face identity resolution, alert decisions and realtime dashboard feed")
                        .version("2.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development Server")));
    }
}
