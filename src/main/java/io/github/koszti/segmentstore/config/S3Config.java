package io.github.koszti.segmentstore.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

@Configuration
@ConditionalOnProperty(prefix = "store.blob", name = "type", havingValue = "s3", matchIfMissing = true)
public class S3Config {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(StoreBlobS3Properties s3Props) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3Props.getRegion()))
                .credentialsProvider(credentialsProvider(s3Props))
                .forcePathStyle(s3Props.isPathStyleAccess());

        if (s3Props.getEndpoint() != null && !s3Props.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3Props.getEndpoint()));
        }
        return builder.build();
    }

    private static AwsCredentialsProvider credentialsProvider(StoreBlobS3Properties s3Props) {
        if (s3Props.hasStaticCredentials()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(s3Props.getAccessKey(), s3Props.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
