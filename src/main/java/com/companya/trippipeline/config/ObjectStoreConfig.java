package com.companya.trippipeline.config;

import com.companya.trippipeline.storage.FileSystemObjectStore;
import com.companya.trippipeline.storage.ObjectStore;
import com.companya.trippipeline.storage.S3ObjectStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.nio.file.Path;

@Configuration
public class ObjectStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "pipeline.object-store.type", havingValue = "filesystem", matchIfMissing = true)
    public ObjectStore fileSystemObjectStore(@Value("${pipeline.object-store.root:buckets}") String root) {
        return new FileSystemObjectStore(Path.of(root));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "pipeline.object-store.type", havingValue = "s3")
    public S3Client s3Client(@Value("${pipeline.object-store.region:us-east-1}") String region) {
        return S3Client.builder()
                .region(Region.of(region))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "pipeline.object-store.type", havingValue = "s3")
    public ObjectStore s3ObjectStore(S3Client s3Client) {
        return new S3ObjectStore(s3Client);
    }
}
