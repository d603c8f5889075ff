package com.itemhub.backend.security;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * app.cors.allowed-origins: 브라우저 클라이언트 origin 목록 (비어 있으면 CORS 허용 없음)
 */
@ConfigurationProperties(prefix = "app.cors")
public record CorsProperties(List<String> allowedOrigins) {

    public CorsProperties {
        allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    }
}
