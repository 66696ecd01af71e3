package com.xksgroup.vodpipeline.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${server.port:8080}") int serverPort) {

        Server localDev = new Server()
                .url("http://localhost:" + serverPort)
                .description("Développement local");

        return new OpenAPI()
                .info(new Info()
                        .title("API VOD Pipeline")
                        .version("v1")
                        .description("Documentation de l'API du pipeline de transcodage vidéo (HLS)"))
                .servers(List.of(localDev));
    }
}
