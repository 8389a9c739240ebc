package io.github.hongjungwan.ledger.api.domain;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 문서 감사 추적. 문서의 전체 해시 레코드(시간 오름차순)와
 * 전역 체인의 최근 블록(블록 번호 내림차순) 스냅샷.
 */
@Getter
@Builder
public class AuditTrail {

    private final String documentId;

    @Builder.Default
    private final List<HashRecord> hashRecords = List.of();

    /** 문서와 무관한 전역 체인 꼬리 */
    @Builder.Default
    private final List<ChainBlock> chainBlocks = List.of();

    public int getTotalRecords() {
        return hashRecords.size();
    }
}
