package com.wxplot.plotapi.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo(@Value("${wxplot.api.version:v1}") String version) {
    return new OpenAPI()
        .info(new Info()
            .title("Weather Plot Data API")
            .version(version)
            .description("Aggregated weather station observations as dense value arrays "
                + "for plotting clients")
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
