package com.companya.trippipeline.storage;

import com.companya.trippipeline.exception.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

public class S3ObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

    private final S3Client s3Client;

    public S3ObjectStore(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public byte[] get(String bucket, String key) {
        try {
            return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .build())
                    .asByteArray();
        } catch (SdkException ex) {
            throw new ObjectStoreException("Failed to read s3://" + bucket + "/" + key, ex);
        }
    }

    @Override
    public void put(String bucket, String key, byte[] content, String contentType) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentType)
                            .build(),
                    RequestBody.fromBytes(content));
            log.debug("Uploaded {} bytes to s3://{}/{}", content.length, bucket, key);
        } catch (SdkException ex) {
            throw new ObjectStoreException("Failed to write s3://" + bucket + "/" + key, ex);
        }
    }
}
