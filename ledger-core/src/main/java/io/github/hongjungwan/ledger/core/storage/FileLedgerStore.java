package io.github.hongjungwan.ledger.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.ledger.api.domain.ChainBlock;
import io.github.hongjungwan.ledger.api.domain.HashRecord;
import io.github.hongjungwan.ledger.api.exception.LedgerReadException;
import io.github.hongjungwan.ledger.api.exception.LedgerWriteException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON Lines 파일 원장. 테이블마다 파일 하나, 한 줄에 한 행을 추가만 함.
 *
 * <p>시작 시 두 파일을 재생하여 메모리 테이블을 복원. 배치는 한 번의 append 쓰기로
 * 기록되며 쓰기 실패 시 메모리에도 반영되지 않음.
 */
@Slf4j
public class FileLedgerStore extends InMemoryLedgerStore {

    static final String HASH_RECORDS_FILE = "hash-records.jsonl";
    static final String CHAIN_BLOCKS_FILE = "chain-blocks.jsonl";

    private final Path hashRecordsFile;
    private final Path blocksFile;
    private final ObjectMapper objectMapper;

    public FileLedgerStore(Path directory) {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.hashRecordsFile = directory.resolve(HASH_RECORDS_FILE);
        this.blocksFile = directory.resolve(CHAIN_BLOCKS_FILE);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new LedgerWriteException("Cannot create ledger directory: " + directory, e);
        }

        List<HashRecord> records = replay(hashRecordsFile, HashRecord.class);
        List<ChainBlock> blocks = replay(blocksFile, ChainBlock.class);
        restore(records, blocks);
        log.info("File ledger loaded from {}: {} hash records, {} blocks", directory, records.size(), blocks.size());
    }

    @Override
    protected void persistHashRecords(List<HashRecord> records) {
        append(hashRecordsFile, records);
    }

    @Override
    protected void persistBlocks(List<ChainBlock> newBlocks) {
        append(blocksFile, newBlocks);
    }

    private void append(Path file, List<?> rows) {
        StringBuilder batch = new StringBuilder();
        try {
            for (Object row : rows) {
                batch.append(objectMapper.writeValueAsString(row)).append('\n');
            }
            Files.writeString(file, batch, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE,
                    StandardOpenOption.SYNC);
        } catch (IOException e) {
            log.error("Failed to append {} row(s) to {}", rows.size(), file, e);
            throw new LedgerWriteException("Failed to append to ledger file: " + file.getFileName(), e);
        }
    }

    private <T> List<T> replay(Path file, Class<T> type) {
        List<T> rows = new ArrayList<>();
        if (!Files.exists(file)) {
            return rows;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    rows.add(objectMapper.readValue(line, type));
                } catch (IOException e) {
                    throw new LedgerReadException("Corrupt ledger row at " + file.getFileName() + ":" + lineNumber, e);
                }
            }
            return rows;
        } catch (IOException e) {
            throw new LedgerReadException("Failed to read ledger file: " + file.getFileName(), e);
        }
    }
}
