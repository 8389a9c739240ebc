package io.github.hongjungwan.ledger.core.security;

import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.domain.DocumentMetadata;
import io.github.hongjungwan.ledger.api.domain.EncryptedDocument;
import io.github.hongjungwan.ledger.api.exception.BlobNotFoundException;
import io.github.hongjungwan.ledger.api.exception.DecryptionException;
import io.github.hongjungwan.ledger.api.exception.KeyServiceUnavailableException;
import io.github.hongjungwan.ledger.api.exception.KeyUnwrapException;
import io.github.hongjungwan.ledger.api.exception.KeyWrapException;
import io.github.hongjungwan.ledger.api.exception.OperationTimeoutException;
import io.github.hongjungwan.ledger.api.exception.StorageWriteException;
import io.github.hongjungwan.ledger.core.storage.InMemoryBlobStore;
import io.github.hongjungwan.ledger.spi.BlobStore;
import io.github.hongjungwan.ledger.spi.KeyService;
import io.github.hongjungwan.ledger.spi.StoredBlob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("EnvelopeCodec 테스트")
class EnvelopeCodecTest {

    private static final String KEY_REF = "local-encryption-key";

    private LedgerConfig config;
    private LocalKeyService keyService;
    private InMemoryBlobStore blobStore;
    private EnvelopeCodec codec;

    @BeforeEach
    void setUp() {
        config = LedgerConfig.defaultConfig();
        keyService = new LocalKeyService();
        blobStore = new InMemoryBlobStore();
        codec = new EnvelopeCodec(config, keyService, blobStore);
    }

    private static DocumentMetadata metadata() {
        return DocumentMetadata.builder()
                .fileName("근로계약서.pdf")
                .mimeType("application/pdf")
                .userId("user-1")
                .build();
    }

    @Nested
    @DisplayName("암호화/복호화 왕복")
    class RoundTripTests {

        @Test
        @DisplayName("암호화한 문서를 원본 그대로 복호화할 수 있어야 한다")
        void shouldRoundTrip() {
            // given
            byte[] content = "Sensitive contract body".getBytes(StandardCharsets.UTF_8);

            // when
            EncryptedDocument document = codec.encrypt(content, metadata());
            byte[] decrypted = codec.decrypt(document.blobName());

            // then
            assertThat(decrypted).isEqualTo(content);
        }

        @Test
        @DisplayName("빈 문서도 왕복해야 한다")
        void shouldRoundTripEmptyContent() {
            EncryptedDocument document = codec.encrypt(new byte[0], metadata());

            assertThat(document.envelopeMetadata().getEncryptedSize()).isEqualTo(28);
            assertThat(codec.decrypt(document.blobName())).isEmpty();
        }

        @Test
        @DisplayName("큰 문서도 왕복해야 한다")
        void shouldRoundTripLargeContent() {
            byte[] content = new byte[3 * 1024 * 1024];
            for (int i = 0; i < content.length; i++) {
                content[i] = (byte) (i % 251);
            }

            EncryptedDocument document = codec.encrypt(content, metadata());

            assertThat(codec.decrypt(document.blobName())).isEqualTo(content);
        }

        @Test
        @DisplayName("같은 내용도 매번 다른 암호문이 나와야 한다")
        void shouldUseFreshKeyAndIv() {
            byte[] content = "same".getBytes(StandardCharsets.UTF_8);

            EncryptedDocument first = codec.encrypt(content, metadata());
            EncryptedDocument second = codec.encrypt(content, metadata());

            assertThat(blobStore.get(first.blobName()).content())
                    .isNotEqualTo(blobStore.get(second.blobName()).content());
            assertThat(first.envelopeMetadata().getWrappedKey())
                    .isNotEqualTo(second.envelopeMetadata().getWrappedKey());
        }
    }

    @Nested
    @DisplayName("저장 형식")
    class StorageFormatTests {

        @Test
        @DisplayName("Blob 이름과 속성이 봉투 형식을 따라야 한다")
        void shouldWriteEnvelopeAttributes() {
            // given
            byte[] content = "hello".getBytes(StandardCharsets.UTF_8);

            // when
            EncryptedDocument document = codec.encrypt(content, metadata());
            StoredBlob blob = blobStore.get(document.blobName());

            // then
            assertThat(document.blobName()).matches("encrypted/[0-9a-f\\-]{36}\\.enc");
            assertThat(blob.content()).hasSize(content.length + 28);
            assertThat(blob.attributes())
                    .containsEntry(EnvelopeCodec.ATTR_ENCRYPTED_WITH, EnvelopeCodec.ENVELOPE_MARKER)
                    .containsEntry(EnvelopeCodec.ATTR_KEY_NAME, KEY_REF)
                    .containsEntry(EnvelopeCodec.ATTR_ORIGINAL_FILENAME, "근로계약서.pdf")
                    .containsEntry(EnvelopeCodec.ATTR_FILE_TYPE, "application/pdf")
                    .containsEntry(EnvelopeCodec.ATTR_USER_ID, "user-1")
                    .containsEntry(EnvelopeCodec.ATTR_ORIGINAL_SIZE, "5")
                    .containsEntry(EnvelopeCodec.ATTR_ENCRYPTED_SIZE, "33")
                    .containsEntry(EnvelopeCodec.ATTR_ALGORITHM, EnvelopeCodec.ALGORITHM_TAG)
                    .containsEntry(EnvelopeCodec.ATTR_WRAPPED_KEY, document.envelopeMetadata().getWrappedKeyBase64());
        }

        @Test
        @DisplayName("메타데이터가 없으면 기본값을 기록해야 한다")
        void shouldUseDefaultMetadata() {
            EncryptedDocument document = codec.encrypt("x".getBytes(StandardCharsets.UTF_8), null);

            assertThat(blobStore.get(document.blobName()).attributes())
                    .containsEntry(EnvelopeCodec.ATTR_ORIGINAL_FILENAME, DocumentMetadata.UNKNOWN)
                    .containsEntry(EnvelopeCodec.ATTR_FILE_TYPE, DocumentMetadata.DEFAULT_MIME_TYPE);
        }

        @Test
        @DisplayName("메타데이터 필드에 null을 넘겨도 기본값으로 한 번에 저장해야 한다")
        void shouldStoreNullFieldsAsDefaults() {
            // given
            BlobStore spyStore = spy(blobStore);
            EnvelopeCodec spyCodec = new EnvelopeCodec(config, keyService, spyStore);
            DocumentMetadata nulls = DocumentMetadata.builder()
                    .fileName(null)
                    .mimeType(null)
                    .userId(null)
                    .attributes(null)
                    .build();

            // when
            EncryptedDocument document = spyCodec.encrypt("x".getBytes(StandardCharsets.UTF_8), nulls);

            // then
            assertThat(blobStore.get(document.blobName()).attributes())
                    .containsEntry(EnvelopeCodec.ATTR_ORIGINAL_FILENAME, DocumentMetadata.UNKNOWN)
                    .containsEntry(EnvelopeCodec.ATTR_FILE_TYPE, DocumentMetadata.DEFAULT_MIME_TYPE)
                    .containsEntry(EnvelopeCodec.ATTR_USER_ID, DocumentMetadata.UNKNOWN);
            verify(spyStore, times(1)).put(anyString(), any(byte[].class), anyMap());
            verify(spyStore, never()).reconnect();
        }
    }

    @Nested
    @DisplayName("업로드 재시도")
    class UploadRetryTests {

        @Test
        @DisplayName("첫 업로드 실패 시 재연결 후 한 번 더 시도해야 한다")
        void shouldReconnectAndRetryOnce() {
            // given
            BlobStore flaky = mock(BlobStore.class);
            when(flaky.getName()).thenReturn("flaky");
            doThrow(new StorageWriteException("connection reset"))
                    .doNothing()
                    .when(flaky).put(anyString(), any(byte[].class), anyMap());
            EnvelopeCodec flakyCodec = new EnvelopeCodec(config, keyService, flaky);

            // when
            EncryptedDocument document = flakyCodec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata());

            // then
            assertThat(document.blobName()).startsWith("encrypted/");
            verify(flaky, times(1)).reconnect();
            verify(flaky, times(2)).put(eq(document.blobName()), any(byte[].class), anyMap());
        }

        @Test
        @DisplayName("재시도도 실패하면 최초 오류를 담은 StorageWriteException이어야 한다")
        void shouldFailWithOriginalCause() {
            // given
            StorageWriteException first = new StorageWriteException("first failure");
            StorageWriteException second = new StorageWriteException("second failure");
            BlobStore broken = mock(BlobStore.class);
            when(broken.getName()).thenReturn("broken");
            doThrow(first).doThrow(second).when(broken).put(anyString(), any(byte[].class), anyMap());
            EnvelopeCodec brokenCodec = new EnvelopeCodec(config, keyService, broken);

            // when
            Throwable thrown = catchThrowable(() ->
                    brokenCodec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata()));

            // then
            assertThat(thrown).isInstanceOf(StorageWriteException.class);
            assertThat(thrown.getCause()).isSameAs(first);
            assertThat(first.getSuppressed()).containsExactly(second);
            verify(broken, times(1)).reconnect();
            verify(broken, times(2)).put(anyString(), any(byte[].class), anyMap());
        }

        @Test
        @DisplayName("업로드 타임아웃은 재시도 후에도 OperationTimeoutException으로 전달해야 한다")
        void shouldSurfaceTimeout() {
            // given
            OperationTimeoutException timeout = new OperationTimeoutException("S3 upload timed out");
            BlobStore slow = mock(BlobStore.class);
            when(slow.getName()).thenReturn("slow");
            doThrow(timeout).when(slow).put(anyString(), any(byte[].class), anyMap());
            EnvelopeCodec slowCodec = new EnvelopeCodec(config, keyService, slow);

            // when
            Throwable thrown = catchThrowable(() ->
                    slowCodec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata()));

            // then
            assertThat(thrown).isSameAs(timeout);
            verify(slow, times(1)).reconnect();
            verify(slow, times(2)).put(anyString(), any(byte[].class), anyMap());
        }

        @Test
        @DisplayName("저장소 오류가 아닌 실패는 재시도하지 않아야 한다")
        void shouldNotRetryProgrammingErrors() {
            // given
            BlobStore rejecting = mock(BlobStore.class);
            when(rejecting.getName()).thenReturn("rejecting");
            IllegalArgumentException invalid = new IllegalArgumentException("Blob name escapes store root");
            doThrow(invalid).when(rejecting).put(anyString(), any(byte[].class), anyMap());
            EnvelopeCodec rejectingCodec = new EnvelopeCodec(config, keyService, rejecting);

            // when
            Throwable thrown = catchThrowable(() ->
                    rejectingCodec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata()));

            // then
            assertThat(thrown).isInstanceOf(StorageWriteException.class).hasCause(invalid);
            verify(rejecting, never()).reconnect();
            verify(rejecting, times(1)).put(anyString(), any(byte[].class), anyMap());
        }
    }

    @Nested
    @DisplayName("키 서비스 오류")
    class KeyServiceFailureTests {

        @Test
        @DisplayName("키 서비스 장애는 그대로 전파되고 업로드하지 않아야 한다")
        void shouldPropagateUnavailable() {
            KeyService down = mock(KeyService.class);
            when(down.wrapKey(anyString(), any())).thenThrow(new KeyServiceUnavailableException("KMS down"));
            EnvelopeCodec downCodec = new EnvelopeCodec(config, down, blobStore);

            assertThatThrownBy(() -> downCodec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata()))
                    .isInstanceOf(KeyServiceUnavailableException.class);
            assertThat(blobStore.size()).isZero();
        }

        @Test
        @DisplayName("예상치 못한 래핑 오류는 KeyWrapException으로 변환해야 한다")
        void shouldWrapUnexpectedErrors() {
            KeyService faulty = mock(KeyService.class);
            when(faulty.wrapKey(anyString(), any())).thenThrow(new IllegalStateException("boom"));
            EnvelopeCodec faultyCodec = new EnvelopeCodec(config, faulty, blobStore);

            assertThatThrownBy(() -> faultyCodec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata()))
                    .isInstanceOf(KeyWrapException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("복호화 오류 구분")
    class DecryptFailureTests {

        @Test
        @DisplayName("없는 Blob은 BlobNotFoundException이어야 한다")
        void shouldReportMissingBlob() {
            assertThatThrownBy(() -> codec.decrypt("encrypted/missing.enc"))
                    .isInstanceOf(BlobNotFoundException.class)
                    .satisfies(e -> assertThat(((BlobNotFoundException) e).getBlobName())
                            .isEqualTo("encrypted/missing.enc"));
        }

        @Test
        @DisplayName("다른 키로 래핑된 데이터 키는 KeyUnwrapException이어야 한다")
        void shouldReportUnwrapFailure() {
            EncryptedDocument document = codec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata());
            EnvelopeCodec otherKeys = new EnvelopeCodec(config, new LocalKeyService(), blobStore);

            assertThatThrownBy(() -> otherKeys.decrypt(document.blobName()))
                    .isInstanceOf(KeyUnwrapException.class);
        }

        @Test
        @DisplayName("변조된 암호문은 DecryptionException이어야 한다")
        void shouldReportTamperedCiphertext() {
            // given
            EncryptedDocument document = codec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata());
            StoredBlob blob = blobStore.get(document.blobName());
            byte[] tampered = blob.content();
            tampered[tampered.length - 1] ^= 0x01;
            blobStore.put(document.blobName(), tampered, blob.attributes());

            // when / then
            assertThatThrownBy(() -> codec.decrypt(document.blobName()))
                    .isInstanceOf(DecryptionException.class);
        }

        @Test
        @DisplayName("잘린 암호문은 DecryptionException이어야 한다")
        void shouldReportTruncatedCiphertext() {
            EncryptedDocument document = codec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata());
            StoredBlob blob = blobStore.get(document.blobName());
            blobStore.put(document.blobName(), new byte[10], blob.attributes());

            assertThatThrownBy(() -> codec.decrypt(document.blobName()))
                    .isInstanceOf(DecryptionException.class)
                    .hasMessageContaining("too short");
        }

        @Test
        @DisplayName("봉투 메타데이터가 없으면 DecryptionException이어야 한다")
        void shouldReportMissingEnvelopeMetadata() {
            EncryptedDocument document = codec.encrypt("hello".getBytes(StandardCharsets.UTF_8), metadata());
            StoredBlob blob = blobStore.get(document.blobName());
            Map<String, String> attributes = new HashMap<>(blob.attributes());
            attributes.remove(EnvelopeCodec.ATTR_WRAPPED_KEY);
            blobStore.put(document.blobName(), blob.content(), attributes);

            assertThatThrownBy(() -> codec.decrypt(document.blobName()))
                    .isInstanceOf(DecryptionException.class);
        }
    }

    @Nested
    @DisplayName("레거시 형식")
    class LegacyFormatTests {

        @Test
        @DisplayName("봉투 표시가 없는 Blob은 키 서비스로 직접 복호화해야 한다")
        void shouldDecryptLegacyBlob() {
            // given
            byte[] plaintext = "legacy document".getBytes(StandardCharsets.UTF_8);
            byte[] directCiphertext = keyService.wrapKey(KEY_REF, plaintext);
            blobStore.put("encrypted/legacy.enc", directCiphertext, Map.of(EnvelopeCodec.ATTR_KEY_NAME, KEY_REF));

            // when
            byte[] decrypted = codec.decrypt("encrypted/legacy.enc");

            // then
            assertThat(decrypted).isEqualTo(plaintext);
        }
    }
}
