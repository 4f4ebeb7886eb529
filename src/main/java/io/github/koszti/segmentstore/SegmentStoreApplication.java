package io.github.koszti.segmentstore;

import io.github.koszti.segmentstore.config.StoreBlobS3Properties;
import io.github.koszti.segmentstore.config.StoreCacheProperties;
import io.github.koszti.segmentstore.config.StoreFetchProperties;
import io.github.koszti.segmentstore.config.StoreSegmentProperties;
import io.github.koszti.segmentstore.config.StoreWriteProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
		StoreSegmentProperties.class,
		StoreFetchProperties.class,
		StoreWriteProperties.class,
		StoreBlobS3Properties.class,
		StoreCacheProperties.class
})
public class SegmentStoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(SegmentStoreApplication.class, args);
	}

}
