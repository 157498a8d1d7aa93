package com.oekaki.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private S3 s3 = new S3();

    private Preview preview = new Preview();

    @Data
    public static class S3 {
        private String region = "us-east-1";
        private String bucket;
        private String endpoint;         // optional, for S3-compatible stores
        private String accessKey;        // blank -> default credentials chain
        private String secretKey;
        private boolean pathStyleAccess = false;
    }

    @Data
    public static class Preview {
        private String baseUrl = "https://api.imgur.com";
        private String clientId;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration responseTimeout = Duration.ofSeconds(20);
    }
}
