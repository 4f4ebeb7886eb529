package io.github.koszti.segmentstore.blob;

import io.github.koszti.segmentstore.config.StoreBlobS3Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;

/**
 * S3-backed implementation of BlobStore.
 * Keys are used verbatim inside the configured bucket; works against MinIO with an endpoint override.
 */
@Component
@ConditionalOnProperty(prefix = "store.blob", name = "type", havingValue = "s3", matchIfMissing = true)
public class S3BlobStore
        implements BlobStore
{
    private static final Logger log = LoggerFactory.getLogger(S3BlobStore.class);

    private static final String CONTENT_TYPE = "application/octet-stream";

    private final S3Client s3Client;
    private final StoreBlobS3Properties s3Props;

    public S3BlobStore(S3Client s3Client,
            StoreBlobS3Properties s3Props) {
        this.s3Client = s3Client;
        this.s3Props = s3Props;
    }

    @Override
    public void put(String key, byte[] data) throws IOException
    {
        log.debug("Uploading S3 object: bucket={}, key={}, bytes={}", s3Props.getBucket(), key, data.length);

        PutObjectRequest req = PutObjectRequest.builder()
                .bucket(s3Props.getBucket())
                .key(key)
                .contentType(CONTENT_TYPE)
                .contentLength((long) data.length)
                .build();

        try {
            s3Client.putObject(req, RequestBody.fromBytes(data));
        }
        catch (SdkException e) {
            throw new IOException("Failed to upload S3 object " + key, e);
        }
    }

    @Override
    public byte[] get(String key) throws IOException
    {
        log.debug("Downloading S3 object: bucket={}, key={}", s3Props.getBucket(), key);

        GetObjectRequest req = GetObjectRequest.builder()
                .bucket(s3Props.getBucket())
                .key(key)
                .build();

        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(req);
            return bytes.asByteArray();
        }
        catch (NoSuchKeyException e) {
            throw new BlobNotFoundException(key, e);
        }
        catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new BlobNotFoundException(key, e);
            }
            throw new IOException("Failed to download S3 object " + key, e);
        }
        catch (SdkException e) {
            throw new IOException("Failed to download S3 object " + key, e);
        }
    }

    @Override
    public void delete(String key) throws IOException
    {
        log.debug("Deleting S3 object: bucket={}, key={}", s3Props.getBucket(), key);

        DeleteObjectRequest req = DeleteObjectRequest.builder()
                .bucket(s3Props.getBucket())
                .key(key)
                .build();

        try {
            s3Client.deleteObject(req);
        }
        catch (SdkException e) {
            throw new IOException("Failed to delete S3 object " + key, e);
        }
    }
}
