package io.github.hongjungwan.ledger.core.storage;

import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.exception.BlobNotFoundException;
import io.github.hongjungwan.ledger.api.exception.OperationTimeoutException;
import io.github.hongjungwan.ledger.api.exception.StorageReadException;
import io.github.hongjungwan.ledger.api.exception.StorageWriteException;
import io.github.hongjungwan.ledger.spi.BlobStore;
import io.github.hongjungwan.ledger.spi.StoredBlob;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Amazon S3 Blob 저장소. 속성은 S3 사용자 메타데이터로 저장.
 *
 * <p>S3 메타데이터 헤더는 ASCII만 허용하므로 값은 URL 인코딩해서 저장하고 읽을 때 복원.
 * {@link #reconnect()}는 클라이언트를 새로 만들어 교체.
 */
@Slf4j
public class S3BlobStore implements BlobStore, AutoCloseable {

    private static final String SERVER_SIDE_ENCRYPTION = "AES256";

    private final String bucket;
    private final Supplier<S3Client> clientFactory;
    private volatile S3Client s3Client;

    public S3BlobStore(LedgerConfig config) {
        this(config.getBlobBucket(), () -> createS3Client(config));
        log.info("S3 blob store initialized: bucket={}, region={}", bucket, config.getKmsRegion());
    }

    /** 외부 클라이언트 팩토리 사용 (LocalStack 등) */
    public S3BlobStore(String bucket, Supplier<S3Client> clientFactory) {
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("S3 bucket must be configured");
        }
        this.bucket = bucket;
        this.clientFactory = clientFactory;
        this.s3Client = clientFactory.get();
    }

    private static S3Client createS3Client(LedgerConfig config) {
        Duration timeout = Duration.ofMillis(config.getOperationTimeoutMs());
        return S3Client.builder()
                .region(Region.of(config.getKmsRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(timeout)
                        .build())
                .httpClientBuilder(UrlConnectionHttpClient.builder()
                        .connectionTimeout(timeout)
                        .socketTimeout(timeout))
                .build();
    }

    @Override
    public void put(String name, byte[] content, Map<String, String> attributes) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(name)
                .contentType("application/octet-stream")
                .contentLength((long) content.length)
                .serverSideEncryption(SERVER_SIDE_ENCRYPTION)
                .metadata(encode(attributes))
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.debug("Uploaded s3://{}/{} ({} bytes)", bucket, name, content.length);
        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            throw new OperationTimeoutException("S3 upload timed out: " + name, e);
        } catch (SdkException e) {
            throw new StorageWriteException("S3 upload failed: " + name, e);
        }
    }

    @Override
    public StoredBlob get(String name) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(name)
                .build();
        try {
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
            return new StoredBlob(response.asByteArray(), decode(response.response().metadata()));
        } catch (NoSuchKeyException e) {
            throw new BlobNotFoundException(name);
        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            throw new OperationTimeoutException("S3 download timed out: " + name, e);
        } catch (SdkException e) {
            throw new StorageReadException("S3 download failed: " + name, e);
        }
    }

    @Override
    public boolean exists(String name) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(name).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new StorageReadException("S3 head failed: " + name, e);
        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            throw new OperationTimeoutException("S3 head timed out: " + name, e);
        } catch (SdkException e) {
            throw new StorageReadException("S3 head failed: " + name, e);
        }
    }

    @Override
    public synchronized void reconnect() {
        S3Client previous = s3Client;
        s3Client = clientFactory.get();
        try {
            previous.close();
        } catch (RuntimeException e) {
            log.warn("Error closing previous S3 client: {}", e.getMessage());
        }
        log.info("S3 client reconnected: bucket={}", bucket);
    }

    @Override
    public String getName() {
        return "s3";
    }

    @Override
    public void close() {
        s3Client.close();
    }

    private static Map<String, String> encode(Map<String, String> attributes) {
        Map<String, String> encoded = new LinkedHashMap<>();
        attributes.forEach((key, value) ->
                encoded.put(key, URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8)));
        return encoded;
    }

    private static Map<String, String> decode(Map<String, String> metadata) {
        Map<String, String> decoded = new LinkedHashMap<>();
        metadata.forEach((key, value) -> decoded.put(key, URLDecoder.decode(value, StandardCharsets.UTF_8)));
        return decoded;
    }
}
