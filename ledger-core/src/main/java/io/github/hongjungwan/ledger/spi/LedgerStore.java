package io.github.hongjungwan.ledger.spi;

import io.github.hongjungwan.ledger.api.domain.ChainBlock;
import io.github.hongjungwan.ledger.api.domain.HashRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * SPI for the append-only ledger holding hash records and chain blocks.
 *
 * <p>Rows are never updated or deleted. Each batch insert is atomic for its
 * table. Implementations must reject a block whose number is not exactly
 * {@code latest + 1} (or 0 for an empty chain) so that concurrent writers
 * cannot fork the chain.</p>
 *
 * <h2>Built-in Implementations:</h2>
 * <ul>
 *   <li>InMemoryLedgerStore - process-local tables</li>
 *   <li>FileLedgerStore - JSON Lines files, replayed on startup</li>
 * </ul>
 */
public interface LedgerStore {

    /**
     * Insert hash records atomically.
     *
     * @throws io.github.hongjungwan.ledger.api.exception.LedgerWriteException on failure
     */
    void insertHashRecords(List<HashRecord> records);

    /**
     * Insert chain blocks atomically, in block number order.
     *
     * @throws io.github.hongjungwan.ledger.api.exception.LedgerWriteException on failure or
     *         block number conflict
     */
    void insertBlocks(List<ChainBlock> blocks);

    /**
     * Most recent hash record for a document by timestamp.
     *
     * @throws io.github.hongjungwan.ledger.api.exception.LedgerReadException on failure
     */
    Optional<HashRecord> findLatestHashRecord(String documentId);

    /**
     * Block with the highest block number.
     */
    Optional<ChainBlock> findLatestBlock();

    /**
     * Run several reads against one consistent, isolated view.
     */
    <T> T readSnapshot(Function<LedgerSnapshot, T> reader);
}
