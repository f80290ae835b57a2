package com.boardgame.gamegraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "gamegraph.output")
public class OutputProperties {
    private String directory = "data";
}
