package io.github.hongjungwan.ledger.api.exception;

/**
 * 해시 체인 재계산 결과가 저장된 값과 다른 경우.
 */
public class ChainCorruptionException extends LedgerException {

    private final long blockNumber;

    public ChainCorruptionException(long blockNumber, String reason) {
        super(ErrorCode.CHAIN_CORRUPTION, "Hash chain corrupted at block " + blockNumber + ": " + reason);
        this.blockNumber = blockNumber;
    }

    public long getBlockNumber() {
        return blockNumber;
    }
}
