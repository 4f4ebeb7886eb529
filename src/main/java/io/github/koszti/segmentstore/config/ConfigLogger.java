package io.github.koszti.segmentstore.config;

import io.github.koszti.segmentstore.blob.BlobStore;
import io.github.koszti.segmentstore.metadata.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class ConfigLogger
        implements CommandLineRunner
{
    private static final Logger log = LoggerFactory.getLogger(ConfigLogger.class);

    private final StoreSegmentProperties segmentProps;
    private final StoreFetchProperties fetchProps;
    private final StoreWriteProperties writeProps;
    private final StoreCacheProperties cacheProps;
    private final StoreBlobS3Properties s3Props;
    private final BlobStore blobStore;
    private final MetadataStore metadataStore;

    public ConfigLogger(StoreSegmentProperties segmentProps,
            StoreFetchProperties fetchProps,
            StoreWriteProperties writeProps,
            StoreCacheProperties cacheProps,
            StoreBlobS3Properties s3Props,
            BlobStore blobStore,
            MetadataStore metadataStore) {
        this.segmentProps = segmentProps;
        this.fetchProps = fetchProps;
        this.writeProps = writeProps;
        this.cacheProps = cacheProps;
        this.s3Props = s3Props;
        this.blobStore = blobStore;
        this.metadataStore = metadataStore;
    }

    @Override
    public void run(String... args)
    {
        log.info("Segment size        : {} bytes", segmentProps.getSizeBytes());
        log.info("Blob store          : {}", blobStore.getClass().getSimpleName());
        log.info("S3 bucket/endpoint  : {} / {}", s3Props.getBucket(),
                s3Props.getEndpoint() != null ? s3Props.getEndpoint() : "(aws default)");
        log.info("Metadata store      : {}", metadataStore.getClass().getSimpleName());
        log.info("Cache TTL / size    : {} / {}", cacheProps.getTtl(), cacheProps.getMaximumSize());
        log.info("Fetch threads       : {}", fetchProps.getParallelism());
        log.info("In-flight segments  : {}", fetchProps.getMaxInFlightSegments());
        log.info("Cleanup on failure  : {}", writeProps.isCleanupOnFailure());
    }
}
