package io.github.koszti.segmentstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "store.blob.s3")
public class StoreBlobS3Properties {

    /**
     * Bucket holding segment objects. Must already exist.
     */
    private String bucket = "segment-store";

    /**
     * Region of the bucket, e.g. eu-central-1. MinIO accepts any value.
     */
    private String region = "us-east-1";

    /**
     * Optional endpoint override for S3 compatible stores, e.g. http://localhost:9000 for MinIO.
     */
    private String endpoint;

    /**
     * Use path-style addressing (required by most MinIO setups).
     */
    private boolean pathStyleAccess = false;

    /**
     * Optional static credentials. When unset the default AWS credentials chain is used.
     */
    private String accessKey;

    private String secretKey;

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public boolean isPathStyleAccess() {
        return pathStyleAccess;
    }

    public void setPathStyleAccess(boolean pathStyleAccess) {
        this.pathStyleAccess = pathStyleAccess;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public void setAccessKey(String accessKey) {
        this.accessKey = accessKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    public boolean hasStaticCredentials() {
        return accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank();
    }
}
