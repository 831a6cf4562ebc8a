package com.sessionhub.ingestion.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.time.Duration;

@Configuration
public class AwsClientConfiguration {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.s3.api-timeout-seconds:120}")
    private long apiTimeoutSeconds;

    @Bean
    public S3Client s3Client() {
        return S3Client.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofSeconds(apiTimeoutSeconds))
                        .build())
                .build();
    }

    @Bean
    @Primary
    public S3Presigner s3Presigner() {
        return S3Presigner.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * Presigner bound to the configured alternate signing credentials; used when the
     * ambient credentials cannot sign.
     */
    @Bean("fallbackS3Presigner")
    @ConditionalOnExpression("!'${app.storage.signing.access-key-id:}'.isEmpty()")
    public S3Presigner fallbackS3Presigner(@Value("${app.storage.signing.access-key-id}") String accessKeyId,
                                           @Value("${app.storage.signing.secret-access-key}") String secretAccessKey) {
        return S3Presigner.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKeyId, secretAccessKey)))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "app.acquisition.dispatch-mode", havingValue = "sqs")
    public SqsClient sqsClient() {
        return SqsClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }
}
