package com.boardgame.gamegraph.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * The OkHttp client shared by all BGG requests.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient bggHttpClient(BggProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(properties.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(properties.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }
}
