package io.github.hongjungwan.ledger.api.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.UUID;

/**
 * 전체 체인 검증 결과. 첫 번째 손상 블록에서 검사를 중단.
 */
@Getter
@Builder
@ToString
public class ChainVerificationReport {

    private final boolean valid;

    private final long blocksChecked;

    /** 첫 번째 손상 블록 번호 (정상이면 null) */
    private final Long firstInvalidBlock;

    private final String failureReason;

    /** 어떤 블록에도 연결되지 않은 해시 레코드 */
    @Builder.Default
    private final List<UUID> orphanedHashIds = List.of();

    public static ChainVerificationReport valid(long blocksChecked, List<UUID> orphanedHashIds) {
        return ChainVerificationReport.builder()
                .valid(true)
                .blocksChecked(blocksChecked)
                .orphanedHashIds(orphanedHashIds)
                .build();
    }

    public static ChainVerificationReport invalid(long blocksChecked, long blockNumber, String reason,
                                                  List<UUID> orphanedHashIds) {
        return ChainVerificationReport.builder()
                .valid(false)
                .blocksChecked(blocksChecked)
                .firstInvalidBlock(blockNumber)
                .failureReason(reason)
                .orphanedHashIds(orphanedHashIds)
                .build();
    }
}
