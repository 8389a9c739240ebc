package io.github.hongjungwan.ledger.core.storage;

import io.github.hongjungwan.ledger.api.domain.ChainBlock;
import io.github.hongjungwan.ledger.api.domain.HashRecord;
import io.github.hongjungwan.ledger.api.exception.LedgerWriteException;
import io.github.hongjungwan.ledger.spi.LedgerSnapshot;
import io.github.hongjungwan.ledger.spi.LedgerStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * 프로세스 메모리 원장. 두 테이블을 하나의 읽기/쓰기 락으로 보호.
 *
 * <p>배치 삽입은 쓰기 락 안에서 검증 후 한 번에 반영되므로 부분 삽입이 없음.
 * 하위 클래스는 {@link #persistHashRecords}/{@link #persistBlocks}로 반영 전 영속화 가능.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final List<HashRecord> hashRecords = new ArrayList<>();
    private final List<ChainBlock> blocks = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void insertHashRecords(List<HashRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            persistHashRecords(records);
            hashRecords.addAll(records);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void insertBlocks(List<ChainBlock> newBlocks) {
        if (newBlocks.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            long expected = blocks.size();
            for (ChainBlock block : newBlocks) {
                if (block.getBlockNumber() != expected) {
                    throw new LedgerWriteException("Block number conflict: expected " + expected
                            + " but got " + block.getBlockNumber());
                }
                expected++;
            }
            persistBlocks(newBlocks);
            blocks.addAll(newBlocks);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<HashRecord> findLatestHashRecord(String documentId) {
        return readSnapshot(snapshot -> {
            List<HashRecord> records = snapshot.hashRecordsFor(documentId);
            return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
        });
    }

    @Override
    public Optional<ChainBlock> findLatestBlock() {
        lock.readLock().lock();
        try {
            return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks.get(blocks.size() - 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <T> T readSnapshot(Function<LedgerSnapshot, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(new Snapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** 메모리 반영 직전 호출 (쓰기 락 보유). 예외를 던지면 삽입 전체가 취소됨. */
    protected void persistHashRecords(List<HashRecord> records) {
    }

    /** 메모리 반영 직전 호출 (쓰기 락 보유). */
    protected void persistBlocks(List<ChainBlock> newBlocks) {
    }

    /** 영속 데이터 재적재용. 검증 없이 바로 반영. */
    protected void restore(List<HashRecord> records, List<ChainBlock> restoredBlocks) {
        lock.writeLock().lock();
        try {
            hashRecords.addAll(records);
            blocks.addAll(restoredBlocks);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private class Snapshot implements LedgerSnapshot {

        @Override
        public List<HashRecord> hashRecordsFor(String documentId) {
            // 안정 정렬이라 동일 timestamp는 삽입 순서 유지
            return hashRecords.stream()
                    .filter(record -> record.getDocumentId().equals(documentId))
                    .sorted(Comparator.comparing(HashRecord::getTimestamp))
                    .toList();
        }

        @Override
        public List<ChainBlock> latestBlocks(int limit) {
            List<ChainBlock> latest = new ArrayList<>();
            for (int i = blocks.size() - 1; i >= 0 && latest.size() < limit; i--) {
                latest.add(blocks.get(i));
            }
            return List.copyOf(latest);
        }

        @Override
        public List<ChainBlock> allBlocks() {
            return List.copyOf(blocks);
        }

        @Override
        public List<HashRecord> allHashRecords() {
            return List.copyOf(hashRecords);
        }
    }
}
