package io.github.hongjungwan.ledger.api.exception;

/**
 * 요청한 Blob이 존재하지 않는 경우.
 */
public class BlobNotFoundException extends StorageReadException {

    private final String blobName;

    public BlobNotFoundException(String blobName) {
        super(ErrorCode.BLOB_NOT_FOUND, "Encrypted blob not found: " + blobName);
        this.blobName = blobName;
    }

    public String getBlobName() {
        return blobName;
    }
}
