package io.github.hongjungwan.ledger.core.security;

import io.github.hongjungwan.ledger.api.exception.KeyServiceUnavailableException;
import io.github.hongjungwan.ledger.api.exception.KeySigningException;
import io.github.hongjungwan.ledger.api.exception.KeyUnwrapException;
import io.github.hongjungwan.ledger.api.exception.KeyWrapException;
import io.github.hongjungwan.ledger.api.exception.OperationTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.DecryptResponse;
import software.amazon.awssdk.services.kms.model.EncryptRequest;
import software.amazon.awssdk.services.kms.model.EncryptResponse;
import software.amazon.awssdk.services.kms.model.KmsException;
import software.amazon.awssdk.services.kms.model.KmsInvalidSignatureException;
import software.amazon.awssdk.services.kms.model.MessageType;
import software.amazon.awssdk.services.kms.model.SignRequest;
import software.amazon.awssdk.services.kms.model.SignResponse;
import software.amazon.awssdk.services.kms.model.SigningAlgorithmSpec;
import software.amazon.awssdk.services.kms.model.VerifyRequest;
import software.amazon.awssdk.services.kms.model.VerifyResponse;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AwsKmsKeyService 테스트")
class AwsKmsKeyServiceTest {

    private static final String KEY_ID = "arn:aws:kms:ap-northeast-2:123456789012:key/abcd-1234";

    @Mock
    private KmsClient kmsClient;

    private AwsKmsKeyService keyService;

    @BeforeEach
    void setUp() {
        keyService = new AwsKmsKeyService(kmsClient, SigningAlgorithmSpec.ECDSA_SHA_256);
    }

    @Nested
    @DisplayName("정상 호출")
    class SuccessTests {

        @Test
        @DisplayName("Encrypt 결과를 래핑된 키로 반환해야 한다")
        void shouldWrapWithEncrypt() {
            when(kmsClient.encrypt(any(EncryptRequest.class))).thenReturn(EncryptResponse.builder()
                    .ciphertextBlob(SdkBytes.fromByteArray(new byte[]{9, 9, 9}))
                    .build());

            assertThat(keyService.wrapKey(KEY_ID, new byte[32])).containsExactly(9, 9, 9);
        }

        @Test
        @DisplayName("Decrypt 결과를 원래 키로 반환해야 한다")
        void shouldUnwrapWithDecrypt() {
            when(kmsClient.decrypt(any(DecryptRequest.class))).thenReturn(DecryptResponse.builder()
                    .plaintext(SdkBytes.fromByteArray(new byte[]{1, 2}))
                    .build());

            assertThat(keyService.unwrapKey(KEY_ID, new byte[]{5})).containsExactly(1, 2);
        }

        @Test
        @DisplayName("서명은 DIGEST 메시지 타입으로 요청해야 한다")
        void shouldSignDigest() {
            when(kmsClient.sign(any(SignRequest.class))).thenReturn(SignResponse.builder()
                    .signature(SdkBytes.fromByteArray(new byte[]{4}))
                    .build());

            byte[] signature = keyService.sign(KEY_ID, new byte[32]);

            ArgumentCaptor<SignRequest> captor = ArgumentCaptor.forClass(SignRequest.class);
            verify(kmsClient).sign(captor.capture());
            assertThat(signature).containsExactly(4);
            assertThat(captor.getValue().messageType()).isEqualTo(MessageType.DIGEST);
            assertThat(captor.getValue().signingAlgorithm()).isEqualTo(SigningAlgorithmSpec.ECDSA_SHA_256);
            assertThat(captor.getValue().keyId()).isEqualTo(KEY_ID);
        }

        @Test
        @DisplayName("Verify 결과를 그대로 반환해야 한다")
        void shouldVerify() {
            when(kmsClient.verify(any(VerifyRequest.class)))
                    .thenReturn(VerifyResponse.builder().signatureValid(true).build());

            assertThat(keyService.verify(KEY_ID, new byte[32], new byte[]{1})).isTrue();
        }
    }

    @Nested
    @DisplayName("오류 분류")
    class ErrorMappingTests {

        @Test
        @DisplayName("호출 타임아웃은 OperationTimeoutException이어야 한다")
        void shouldMapTimeout() {
            when(kmsClient.encrypt(any(EncryptRequest.class)))
                    .thenThrow(ApiCallTimeoutException.builder().message("timed out").build());

            assertThatThrownBy(() -> keyService.wrapKey(KEY_ID, new byte[32]))
                    .isInstanceOf(OperationTimeoutException.class);
        }

        @Test
        @DisplayName("연결 실패는 KeyServiceUnavailableException이어야 한다")
        void shouldMapClientFailure() {
            when(kmsClient.encrypt(any(EncryptRequest.class)))
                    .thenThrow(SdkClientException.create("Connection refused"));

            assertThatThrownBy(() -> keyService.wrapKey(KEY_ID, new byte[32]))
                    .isInstanceOf(KeyServiceUnavailableException.class);
        }

        @Test
        @DisplayName("KMS 거부는 작업별 예외여야 한다")
        void shouldMapServiceRejection() {
            when(kmsClient.encrypt(any(EncryptRequest.class)))
                    .thenThrow(KmsException.builder().message("AccessDenied").build());
            when(kmsClient.decrypt(any(DecryptRequest.class)))
                    .thenThrow(KmsException.builder().message("InvalidCiphertext").build());

            assertThatThrownBy(() -> keyService.wrapKey(KEY_ID, new byte[32]))
                    .isInstanceOf(KeyWrapException.class);
            assertThatThrownBy(() -> keyService.unwrapKey(KEY_ID, new byte[]{1}))
                    .isInstanceOf(KeyUnwrapException.class);
        }

        @Test
        @DisplayName("서명 불일치는 예외가 아니라 false여야 한다")
        void shouldReturnFalseOnInvalidSignature() {
            when(kmsClient.verify(any(VerifyRequest.class)))
                    .thenThrow(KmsInvalidSignatureException.builder().message("invalid").build());

            assertThat(keyService.verify(KEY_ID, new byte[32], new byte[]{1})).isFalse();
        }

        @Test
        @DisplayName("그 외 검증 오류는 KeySigningException이어야 한다")
        void shouldPropagateOtherVerifyErrors() {
            when(kmsClient.verify(any(VerifyRequest.class)))
                    .thenThrow(KmsException.builder().message("Disabled").build());

            assertThatThrownBy(() -> keyService.verify(KEY_ID, new byte[32], new byte[]{1}))
                    .isInstanceOf(KeySigningException.class);
        }
    }

    @Test
    @DisplayName("로그용 키 ID는 마스킹되어야 한다")
    void shouldMaskKeyId() {
        assertThat(AwsKmsKeyService.maskKeyId(KEY_ID)).isEqualTo("arn:...1234");
        assertThat(AwsKmsKeyService.maskKeyId("short")).isEqualTo("***");
        assertThat(AwsKmsKeyService.maskKeyId(null)).isEqualTo("***");
    }
}
