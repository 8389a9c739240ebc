package io.github.hongjungwan.ledger.api;

import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.domain.DocumentMetadata;
import io.github.hongjungwan.ledger.api.domain.EncryptedDocument;
import io.github.hongjungwan.ledger.api.domain.VerificationResult;
import io.github.hongjungwan.ledger.api.domain.VerificationStatus;
import io.github.hongjungwan.ledger.core.internal.DefaultDocumentLedger;
import io.github.hongjungwan.ledger.core.security.AwsKmsKeyService;
import io.github.hongjungwan.ledger.core.security.LocalKeyService;
import io.github.hongjungwan.ledger.core.storage.FileLedgerStore;
import io.github.hongjungwan.ledger.core.storage.FileSystemBlobStore;
import io.github.hongjungwan.ledger.core.storage.S3BlobStore;
import io.github.hongjungwan.ledger.spi.BlobStore;
import io.github.hongjungwan.ledger.spi.KeyService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DocumentLedgerFactory 테스트")
class DocumentLedgerFactoryTest {

    @TempDir
    Path tempDir;

    private LedgerConfig localConfig() {
        return LedgerConfig.builder()
                .encryptionKeyRef("local-encryption-key")
                .signingKeyRef("local-signing-key")
                .localKeysEnabled(true)
                .keyDirectory(tempDir.resolve("keys").toString())
                .blobDirectory(tempDir.resolve("blobs").toString())
                .ledgerDirectory(tempDir.resolve("chain").toString())
                .build();
    }

    @Nested
    @DisplayName("구성요소 선택")
    class ComponentSelectionTests {

        @Test
        @DisplayName("로컬 키 허용 시 LocalKeyService를 생성해야 한다")
        void shouldCreateLocalKeyService() {
            KeyService keyService = DocumentLedgerFactory.createKeyService(localConfig());

            assertThat(keyService).isInstanceOf(LocalKeyService.class);
            assertThat(tempDir.resolve("keys").resolve(".ledger-kek")).exists();
        }

        @Test
        @DisplayName("로컬 키 비허용에 키 참조가 없으면 IllegalStateException이어야 한다")
        void shouldRejectMissingKeyRefs() {
            LedgerConfig config = LedgerConfig.builder().localKeysEnabled(false).build();

            assertThatThrownBy(() -> DocumentLedgerFactory.createKeyService(config))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("encryptionKeyRef");
        }

        @Test
        @DisplayName("키 참조가 있으면 AwsKmsKeyService를 생성해야 한다")
        void shouldCreateKmsKeyService() throws Exception {
            LedgerConfig config = LedgerConfig.productionConfig("alias/enc", "alias/sign", "bucket");

            KeyService keyService = DocumentLedgerFactory.createKeyService(config);

            assertThat(keyService).isInstanceOf(AwsKmsKeyService.class);
            ((AwsKmsKeyService) keyService).close();
        }

        @Test
        @DisplayName("버킷이 없으면 파일 시스템 저장소를 사용해야 한다")
        void shouldDefaultToFileSystemBlobStore() {
            BlobStore blobStore = DocumentLedgerFactory.createBlobStore(localConfig());

            assertThat(blobStore).isInstanceOf(FileSystemBlobStore.class);
            assertThat(tempDir.resolve("blobs")).isDirectory();
        }

        @Test
        @DisplayName("버킷이 있으면 S3 저장소를 사용해야 한다")
        void shouldUseS3WhenBucketConfigured() {
            LedgerConfig config = LedgerConfig.productionConfig("alias/enc", "alias/sign", "documents");

            BlobStore blobStore = DocumentLedgerFactory.createBlobStore(config);

            assertThat(blobStore).isInstanceOf(S3BlobStore.class);
            ((S3BlobStore) blobStore).close();
        }

        @Test
        @DisplayName("원장은 파일 원장을 사용해야 한다")
        void shouldCreateFileLedgerStore() {
            assertThat(DocumentLedgerFactory.createLedgerStore(localConfig())).isInstanceOf(FileLedgerStore.class);
        }
    }

    @Test
    @DisplayName("재시작 후에도 기록과 문서를 검증하고 복호화할 수 있어야 한다")
    void shouldSurviveRestart() {
        // given
        byte[] content = "계약서 v1".getBytes(StandardCharsets.UTF_8);
        EncryptedDocument stored;
        try (DefaultDocumentLedger ledger = DocumentLedgerFactory.builder().config(localConfig()).build()) {
            stored = ledger.storeDocument(content, DocumentMetadata.empty());
            ledger.recordHash("contract-1", content, "계약서 v1", "user-1", DocumentMetadata.empty());
        }

        // when
        try (DefaultDocumentLedger reopened = DocumentLedgerFactory.builder().config(localConfig()).build()) {
            VerificationResult result = reopened.verify("contract-1", content);

            // then
            assertThat(result.getStatus()).isEqualTo(VerificationStatus.VERIFIED);
            assertThat(result.isSignatureValid()).isTrue();
            assertThat(reopened.retrieveDocument(stored.blobName())).isEqualTo(content);
            assertThat(reopened.verifyChain().isValid()).isTrue();
        }
    }
}
