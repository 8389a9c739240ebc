package io.github.hongjungwan.ledger.core.security;

import io.github.hongjungwan.ledger.api.exception.KeySigningException;
import io.github.hongjungwan.ledger.api.exception.KeyUnwrapException;
import io.github.hongjungwan.ledger.api.exception.KeyWrapException;
import io.github.hongjungwan.ledger.spi.KeyService;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.EnumSet;
import java.util.Set;

/**
 * 프로세스 내부 키 서비스. AES-256 KEK로 래핑하고 EC P-256 키로 다이제스트 서명.
 *
 * <p>keyDirectory 지정 시 키를 파일로 영속화하여 재시작 후에도 기존 데이터 복호화와
 * 서명 검증이 가능. 개발/테스트용 - 프로덕션에서는 KMS 사용.
 */
@Slf4j
public class LocalKeyService implements KeyService {

    private static final String KEK_FILENAME = ".ledger-kek";
    private static final String SIGNING_KEY_FILENAME = ".ledger-signing-key";
    private static final String VERIFY_KEY_FILENAME = ".ledger-verify-key";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128;
    private static final int GCM_IV_LENGTH = 12;
    private static final int DIGEST_LENGTH = 32;
    private static final String EC_CURVE = "secp256r1";
    private static final String SIGNATURE_ALGORITHM = "NONEwithECDSA";

    private final SecretKey kek;
    private final KeyPair signingKeyPair;
    private final SecureRandom secureRandom = new SecureRandom();

    /** 휘발성 키 (재시작 시 소실) */
    public LocalKeyService() {
        this.kek = generateKek();
        this.signingKeyPair = generateSigningKeyPair();
        log.warn("LocalKeyService initialized with ephemeral keys - NOT for production");
    }

    /** 디렉토리에 키를 영속화 */
    public LocalKeyService(Path keyDirectory) {
        try {
            Files.createDirectories(keyDirectory);
            this.kek = loadOrGenerateKek(keyDirectory.resolve(KEK_FILENAME));
            this.signingKeyPair = loadOrGenerateSigningKeyPair(
                    keyDirectory.resolve(SIGNING_KEY_FILENAME), keyDirectory.resolve(VERIFY_KEY_FILENAME));
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize local keys in " + keyDirectory, e);
        }
        log.warn("LocalKeyService initialized from {} - NOT for production", keyDirectory);
    }

    /**
     * KEK로 키 래핑. keyRef를 AAD로 묶어 다른 키 참조로는 복원 불가.
     */
    @Override
    public byte[] wrapKey(String keyRef, byte[] plaintext) {
        byte[] iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, kek, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(aad(keyRef));
            byte[] wrapped = cipher.doFinal(plaintext);

            byte[] result = new byte[GCM_IV_LENGTH + wrapped.length];
            System.arraycopy(iv, 0, result, 0, GCM_IV_LENGTH);
            System.arraycopy(wrapped, 0, result, GCM_IV_LENGTH, wrapped.length);
            return result;
        } catch (GeneralSecurityException e) {
            throw new KeyWrapException("Local key wrap failed", e);
        }
    }

    @Override
    public byte[] unwrapKey(String keyRef, byte[] ciphertext) {
        if (ciphertext == null || ciphertext.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new KeyUnwrapException("Wrapped key too short (possible corruption)");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, kek, new GCMParameterSpec(GCM_TAG_LENGTH, ciphertext, 0, GCM_IV_LENGTH));
            cipher.updateAAD(aad(keyRef));
            return cipher.doFinal(ciphertext, GCM_IV_LENGTH, ciphertext.length - GCM_IV_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new KeyUnwrapException("Local key unwrap failed", e);
        }
    }

    @Override
    public byte[] sign(String keyVersionRef, byte[] digest) {
        requireDigest(digest);
        try {
            Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
            signature.initSign(signingKeyPair.getPrivate(), secureRandom);
            signature.update(digest);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new KeySigningException("Local signing failed", e);
        }
    }

    @Override
    public boolean verify(String keyVersionRef, byte[] digest, byte[] signatureBytes) {
        requireDigest(digest);
        if (signatureBytes == null || signatureBytes.length == 0) {
            return false;
        }
        try {
            Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
            signature.initVerify(signingKeyPair.getPublic());
            signature.update(digest);
            return signature.verify(signatureBytes);
        } catch (java.security.SignatureException e) {
            log.debug("Malformed signature: {}", e.getMessage());
            return false;
        } catch (GeneralSecurityException e) {
            throw new KeySigningException("Local signature verification failed", e);
        }
    }

    @Override
    public String getName() {
        return "local";
    }

    public PublicKey getVerificationKey() {
        return signingKeyPair.getPublic();
    }

    private static byte[] aad(String keyRef) {
        return (keyRef == null ? "" : keyRef).getBytes(StandardCharsets.UTF_8);
    }

    private static void requireDigest(byte[] digest) {
        if (digest == null || digest.length != DIGEST_LENGTH) {
            throw new KeySigningException("Expected a 32-byte SHA-256 digest");
        }
    }

    private static SecretKey generateKek() {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance("AES");
            keyGen.init(256);
            return keyGen.generateKey();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate local KEK", e);
        }
    }

    private static KeyPair generateSigningKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec(EC_CURVE));
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to generate local signing key", e);
        }
    }

    /** 파일에서 KEK 로드, 없거나 크기가 잘못되면 새로 생성. */
    private static SecretKey loadOrGenerateKek(Path kekPath) throws IOException {
        if (Files.exists(kekPath)) {
            byte[] keyBytes = Files.readAllBytes(kekPath);
            if (keyBytes.length == 32) {
                log.info("Loaded existing KEK from file");
                return new SecretKeySpec(keyBytes, "AES");
            }
            log.warn("Invalid KEK file size (expected 32 bytes), will regenerate");
        }

        SecretKey key = generateKek();
        writeFileWithRestrictivePermissions(kekPath, key.getEncoded());
        log.info("Generated and persisted new KEK to: {}", kekPath);
        return key;
    }

    private static KeyPair loadOrGenerateSigningKeyPair(Path privatePath, Path publicPath)
            throws IOException, GeneralSecurityException {
        if (Files.exists(privatePath) && Files.exists(publicPath)) {
            KeyFactory keyFactory = KeyFactory.getInstance("EC");
            PrivateKey privateKey = keyFactory.generatePrivate(new PKCS8EncodedKeySpec(Files.readAllBytes(privatePath)));
            PublicKey publicKey = keyFactory.generatePublic(new X509EncodedKeySpec(Files.readAllBytes(publicPath)));
            log.info("Loaded existing signing key pair from file");
            return new KeyPair(publicKey, privateKey);
        }

        KeyPair keyPair = generateSigningKeyPair();
        writeFileWithRestrictivePermissions(privatePath, keyPair.getPrivate().getEncoded());
        writeFileWithRestrictivePermissions(publicPath, keyPair.getPublic().getEncoded());
        log.info("Generated and persisted new signing key pair to: {}", privatePath.getParent());
        return keyPair;
    }

    /** 제한적 권한(chmod 600)으로 파일 쓰기. */
    private static void writeFileWithRestrictivePermissions(Path path, byte[] content) throws IOException {
        Files.write(path, content,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
        try {
            Set<PosixFilePermission> permissions = EnumSet.of(
                    PosixFilePermission.OWNER_READ,
                    PosixFilePermission.OWNER_WRITE
            );
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            log.warn("Cannot set POSIX file permissions on {} - OS does not support", path);
        }
    }
}
