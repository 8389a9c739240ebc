package io.github.hongjungwan.ledger.spi;

import io.github.hongjungwan.ledger.api.domain.ChainBlock;
import io.github.hongjungwan.ledger.api.domain.HashRecord;

import java.util.List;

/**
 * 일관된 시점의 원장 읽기 뷰. {@link LedgerStore#readSnapshot} 콜백 안에서만 유효.
 */
public interface LedgerSnapshot {

    /** 문서의 모든 해시 레코드 (timestamp 오름차순) */
    List<HashRecord> hashRecordsFor(String documentId);

    /** 최근 블록 (blockNumber 내림차순, 최대 limit개) */
    List<ChainBlock> latestBlocks(int limit);

    /** 전체 블록 (blockNumber 오름차순) */
    List<ChainBlock> allBlocks();

    /** 전체 해시 레코드 (삽입 순서) */
    List<HashRecord> allHashRecords();
}
