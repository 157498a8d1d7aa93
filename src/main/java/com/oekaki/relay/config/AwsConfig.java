package com.oekaki.relay.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.utils.StringUtils;

import java.net.URI;

@Configuration
@RequiredArgsConstructor
public class AwsConfig {

    private final AppProperties props;

    private Region resolveRegion() {
        String r = props.getS3().getRegion();
        if (r == null || r.isBlank()) {
            return Region.US_EAST_1;
        }
        return Region.of(r);
    }

    private AwsCredentialsProvider credentialsProvider() {
        AppProperties.S3 s3 = props.getS3();
        if (StringUtils.isBlank(s3.getAccessKey()) || StringUtils.isBlank(s3.getSecretKey())) {
            return DefaultCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(
                AwsBasicCredentials.create(s3.getAccessKey(), s3.getSecretKey()));
    }

    @Bean
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder()
                .region(resolveRegion())
                .credentialsProvider(credentialsProvider())
                .forcePathStyle(props.getS3().isPathStyleAccess());

        String endpoint = props.getS3().getEndpoint();
        if (!StringUtils.isBlank(endpoint)) {
            builder = builder.endpointOverride(URI.create(endpoint));
        }

        return builder.build();
    }
}
