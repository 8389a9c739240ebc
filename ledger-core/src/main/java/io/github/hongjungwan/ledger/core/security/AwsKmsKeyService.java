package io.github.hongjungwan.ledger.core.security;

import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.exception.KeyServiceUnavailableException;
import io.github.hongjungwan.ledger.api.exception.KeySigningException;
import io.github.hongjungwan.ledger.api.exception.KeyUnwrapException;
import io.github.hongjungwan.ledger.api.exception.KeyWrapException;
import io.github.hongjungwan.ledger.api.exception.LedgerException;
import io.github.hongjungwan.ledger.api.exception.OperationTimeoutException;
import io.github.hongjungwan.ledger.spi.KeyService;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.KmsClientBuilder;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.EncryptRequest;
import software.amazon.awssdk.services.kms.model.KmsException;
import software.amazon.awssdk.services.kms.model.KmsInvalidSignatureException;
import software.amazon.awssdk.services.kms.model.MessageType;
import software.amazon.awssdk.services.kms.model.SignRequest;
import software.amazon.awssdk.services.kms.model.SigningAlgorithmSpec;
import software.amazon.awssdk.services.kms.model.VerifyRequest;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * AWS KMS 키 서비스. 데이터 키 래핑(Encrypt/Decrypt)과 다이제스트 서명(Sign/Verify).
 * 호출마다 apiCallTimeout 적용, 타임아웃은 별도 예외로 구분.
 */
@Slf4j
public class AwsKmsKeyService implements KeyService, AutoCloseable {

    private final KmsClient kmsClient;
    private final SigningAlgorithmSpec signingAlgorithm;

    public AwsKmsKeyService(LedgerConfig config) {
        this(createKmsClient(config), SigningAlgorithmSpec.fromValue(config.getKmsSigningAlgorithm()));
        log.info("AWS KMS key service initialized: region={}, encryptionKey={}, signingKey={}",
                config.getKmsRegion(), maskKeyId(config.getEncryptionKeyRef()), maskKeyId(config.getSigningKeyRef()));
    }

    /** 외부에서 생성한 클라이언트 사용 (LocalStack 등) */
    public AwsKmsKeyService(KmsClient kmsClient, SigningAlgorithmSpec signingAlgorithm) {
        this.kmsClient = kmsClient;
        this.signingAlgorithm = signingAlgorithm;
    }

    private static KmsClient createKmsClient(LedgerConfig config) {
        Duration timeout = Duration.ofMillis(config.getOperationTimeoutMs());
        KmsClientBuilder builder = KmsClient.builder()
                .region(Region.of(config.getKmsRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(timeout)
                        .build())
                .httpClientBuilder(UrlConnectionHttpClient.builder()
                        .connectionTimeout(timeout)
                        .socketTimeout(timeout));

        // 크로스 계정 접근을 위한 역할 위임
        if (config.getKmsRoleArn() != null && !config.getKmsRoleArn().isBlank()) {
            builder.credentialsProvider(createAssumedRoleCredentials(config));
        }

        return builder.build();
    }

    /** STS AssumeRole로 임시 자격 증명 생성. */
    private static StaticCredentialsProvider createAssumedRoleCredentials(LedgerConfig config) {
        try (StsClient stsClient = StsClient.builder()
                .region(Region.of(config.getKmsRegion()))
                .build()) {

            AssumeRoleResponse response = stsClient.assumeRole(AssumeRoleRequest.builder()
                    .roleArn(config.getKmsRoleArn())
                    .roleSessionName("DocumentLedger")
                    .durationSeconds(3600)
                    .build());

            return StaticCredentialsProvider.create(
                    AwsSessionCredentials.create(
                            response.credentials().accessKeyId(),
                            response.credentials().secretAccessKey(),
                            response.credentials().sessionToken()));
        }
    }

    @Override
    public byte[] wrapKey(String keyRef, byte[] plaintext) {
        return call("wrapKey", KeyWrapException::new, () -> kmsClient.encrypt(EncryptRequest.builder()
                        .keyId(keyRef)
                        .plaintext(SdkBytes.fromByteArray(plaintext))
                        .build())
                .ciphertextBlob()
                .asByteArray());
    }

    @Override
    public byte[] unwrapKey(String keyRef, byte[] ciphertext) {
        return call("unwrapKey", KeyUnwrapException::new, () -> kmsClient.decrypt(DecryptRequest.builder()
                        .keyId(keyRef)
                        .ciphertextBlob(SdkBytes.fromByteArray(ciphertext))
                        .build())
                .plaintext()
                .asByteArray());
    }

    @Override
    public byte[] sign(String keyVersionRef, byte[] digest) {
        return call("sign", KeySigningException::new, () -> kmsClient.sign(SignRequest.builder()
                        .keyId(keyVersionRef)
                        .message(SdkBytes.fromByteArray(digest))
                        .messageType(MessageType.DIGEST)
                        .signingAlgorithm(signingAlgorithm)
                        .build())
                .signature()
                .asByteArray());
    }

    @Override
    public boolean verify(String keyVersionRef, byte[] digest, byte[] signature) {
        try {
            return call("verify", KeySigningException::new, () -> kmsClient.verify(VerifyRequest.builder()
                            .keyId(keyVersionRef)
                            .message(SdkBytes.fromByteArray(digest))
                            .messageType(MessageType.DIGEST)
                            .signature(SdkBytes.fromByteArray(signature))
                            .signingAlgorithm(signingAlgorithm)
                            .build())
                    .signatureValid());
        } catch (KeySigningException e) {
            // KMS는 서명 불일치를 예외로 알림
            if (e.getCause() instanceof KmsInvalidSignatureException) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public String getName() {
        return "aws-kms";
    }

    /**
     * KMS 호출 및 예외 분류. 타임아웃, 연결 실패, KMS 거부를 서로 다른 예외로 변환.
     */
    private <T> T call(String operation, ExceptionFactory failure, Supplier<T> request) {
        try {
            return request.get();
        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            log.error("KMS {} timed out", operation);
            throw new OperationTimeoutException("KMS " + operation + " timed out", e);
        } catch (KmsException e) {
            log.error("KMS {} rejected: {}", operation, e.awsErrorDetails() != null
                    ? e.awsErrorDetails().errorCode() : e.getMessage());
            throw failure.create("KMS " + operation + " failed", e);
        } catch (SdkClientException e) {
            log.error("KMS {} unavailable: {}", operation, e.getMessage());
            throw new KeyServiceUnavailableException("KMS unavailable during " + operation, e);
        }
    }

    @FunctionalInterface
    private interface ExceptionFactory {
        LedgerException create(String message, Throwable cause);
    }

    static String maskKeyId(String keyId) {
        if (keyId == null || keyId.length() < 8) {
            return "***";
        }
        return keyId.substring(0, 4) + "..." + keyId.substring(keyId.length() - 4);
    }

    @Override
    public void close() {
        try {
            kmsClient.close();
            log.info("AWS KMS client closed");
        } catch (Exception e) {
            log.warn("Error closing AWS KMS client: {}", e.getMessage());
        }
    }
}
