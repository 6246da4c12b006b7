package com.eyelevel.imageprocessor.service.checkpoint;

import com.eyelevel.imageprocessor.common.json.JsonParser;
import com.eyelevel.imageprocessor.common.json.JsonSerializer;
import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.CheckpointStoreException;
import com.eyelevel.imageprocessor.exception.json.JsonParsingException;
import com.eyelevel.imageprocessor.model.CheckpointPayload;
import com.eyelevel.imageprocessor.model.CheckpointRef;
import com.eyelevel.imageprocessor.model.PhaseRecord;
import com.eyelevel.imageprocessor.model.PhaseStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stores each checkpoint as its own JSON file, {@code <batchId>_<epochMillis>_<sequence>.checkpoint},
 * next to a per-batch {@code <batchId>_index.json}.
 * <p>
 * {@link #latest} and {@link #save} trust the index and only touch the one record file it points at. The
 * batch's record files are scanned by name pattern only when the index is missing or unreadable, or when its
 * newest entry points at a missing or unreadable file; the scan answers the call and rewrites the index.
 * <p>
 * Writers of the same batch are serialized on one of a fixed set of lock stripes.
 */
@Slf4j
@Component
public class FileSystemCheckpointStore implements CheckpointStore {

    static final String RECORD_SUFFIX = ".checkpoint";
    static final String INDEX_SUFFIX = "_index.json";

    private static final Pattern BATCH_ID_PATTERN = Pattern.compile("[A-Za-z0-9-]+");
    private static final Pattern RECORD_NAME_PATTERN =
            Pattern.compile("^([A-Za-z0-9-]+)_(\\d+)(?:_(\\d+))?" + Pattern.quote(RECORD_SUFFIX) + "$");

    private static final Comparator<PhaseRecord> MOST_RECENT_FIRST = Comparator
            .comparing(PhaseRecord::timestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(PhaseRecord::sequenceNumber)
            .reversed();

    private static final int LOCK_STRIPES = 64;
    private static final int MAX_WRITE_ATTEMPTS = 5;

    private static final Comparator<StoredRecord> BY_SEQUENCE =
            Comparator.comparingLong(stored -> stored.record().sequenceNumber());

    private final Path directory;
    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;
    private final Object[] batchLocks = new Object[LOCK_STRIPES];

    public FileSystemCheckpointStore(ImageProcessingConfig config, JsonSerializer jsonSerializer,
                                     JsonParser jsonParser) {
        this.directory = Path.of(config.checkpoint().directory());
        this.jsonSerializer = jsonSerializer;
        this.jsonParser = jsonParser;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            batchLocks[i] = new Object();
        }
    }

    @Override
    public CheckpointRef save(String batchId, String phaseLabel, PhaseStatus status, CheckpointPayload payload) {
        requireBatchId(batchId);
        synchronized (lockFor(batchId)) {
            try {
                Files.createDirectories(directory);
                final CheckpointIndex index = currentIndex(batchId);
                final StoredRecord stored = writeRecord(batchId, index.lastSequence() + 1, phaseLabel, status,
                        payload);
                final PhaseRecord record = stored.record();
                final String fileName = stored.file().getFileName().toString();
                try {
                    writeIndex(index.append(new CheckpointIndex.Entry(record.sequenceNumber(), fileName, phaseLabel,
                            status, record.timestamp())));
                } catch (IOException | RuntimeException e) {
                    Files.deleteIfExists(stored.file());
                    throw e;
                }
                log.debug("[{}] Saved checkpoint #{} '{}' ({}).", batchId, record.sequenceNumber(), phaseLabel,
                        status.getValue());
                return new CheckpointRef(batchId, record.sequenceNumber(), fileName);
            } catch (IOException | JsonParsingException e) {
                throw new CheckpointStoreException(
                        String.format("Unable to save checkpoint '%s' for batch %s", phaseLabel, batchId), e);
            }
        }
    }

    @Override
    public Optional<PhaseRecord> latest(String batchId) {
        requireBatchId(batchId);
        synchronized (lockFor(batchId)) {
            final Optional<CheckpointIndex> index = readIndex(batchId);
            if (index.isPresent()) {
                final Optional<CheckpointIndex.Entry> last = index.get().lastEntry();
                if (last.isEmpty()) {
                    return Optional.empty();
                }
                final Optional<PhaseRecord> record = readRecord(directory.resolve(last.get().fileName()));
                if (record.isPresent() && record.get().sequenceNumber() == last.get().sequence()) {
                    return record;
                }
                log.warn("[{}] Checkpoint index entry #{} does not resolve to its record file. "
                        + "Falling back to a directory scan.", batchId, last.get().sequence());
            }
            final BatchScan scan = scan(batchId);
            if (index.isEmpty() && scan.isEmpty()) {
                return Optional.empty();
            }
            rebuildIndex(batchId, scan, index.map(CheckpointIndex::lastSequence).orElse(0L));
            return scan.records().stream().map(StoredRecord::record)
                    .max(Comparator.comparingLong(PhaseRecord::sequenceNumber));
        }
    }

    @Override
    public List<PhaseRecord> list(String batchId) {
        if (batchId != null) {
            requireBatchId(batchId);
            final List<PhaseRecord> records = new ArrayList<>(recordsOf(scanRecords(batchId)));
            records.sort(Comparator.comparingLong(PhaseRecord::sequenceNumber).reversed());
            return records;
        }
        final List<PhaseRecord> all = new ArrayList<>();
        for (String id : batchIds()) {
            all.addAll(recordsOf(scanRecords(id)));
        }
        all.sort(MOST_RECENT_FIRST);
        return all;
    }

    @Override
    public int prune(String batchId, int keep) {
        requireBatchId(batchId);
        if (keep < 0) {
            throw new IllegalArgumentException("keep must not be negative");
        }
        synchronized (lockFor(batchId)) {
            final BatchScan scan = scan(batchId);
            final List<StoredRecord> records = new ArrayList<>(scan.records());
            records.sort(BY_SEQUENCE.reversed());
            if (records.size() <= keep) {
                return 0;
            }
            int removed = 0;
            for (StoredRecord stale : records.subList(keep, records.size())) {
                final Path file = stale.file();
                try {
                    if (Files.deleteIfExists(file)) {
                        removed++;
                    }
                } catch (IOException e) {
                    throw new CheckpointStoreException("Unable to delete checkpoint file " + file, e);
                }
            }
            final long lastIssued = readIndex(batchId).map(CheckpointIndex::lastSequence).orElse(0L);
            rebuildIndex(batchId, new BatchScan(records.subList(0, keep), scan.highestNamedSequence()), lastIssued);
            log.info("[{}] Pruned {} checkpoint(s), kept {}.", batchId, removed, keep);
            return removed;
        }
    }

    @Override
    public Optional<PhaseRecord> load(CheckpointRef ref) {
        requireBatchId(ref.batchId());
        if (ref.fileName() != null) {
            final Optional<PhaseRecord> direct = readRecord(directory.resolve(ref.fileName()));
            if (direct.isPresent()) {
                return direct;
            }
        }
        return recordsOf(scanRecords(ref.batchId())).stream()
                .filter(record -> record.sequenceNumber() == ref.sequenceNumber())
                .findFirst();
    }

    @Override
    public Set<String> batchIds() {
        final Set<String> ids = new TreeSet<>();
        if (!Files.isDirectory(directory)) {
            return ids;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path file : stream) {
                final String name = file.getFileName().toString();
                final Matcher matcher = RECORD_NAME_PATTERN.matcher(name);
                if (matcher.matches()) {
                    ids.add(matcher.group(1));
                } else if (name.endsWith(INDEX_SUFFIX)) {
                    ids.add(name.substring(0, name.length() - INDEX_SUFFIX.length()));
                }
            }
        } catch (IOException e) {
            throw new CheckpointStoreException("Unable to list checkpoint directory " + directory, e);
        }
        return ids;
    }

    //<editor-fold desc="Index handling">
    private CheckpointIndex currentIndex(String batchId) {
        return readIndex(batchId).orElseGet(() -> {
            final BatchScan scan = scan(batchId);
            if (scan.isEmpty()) {
                return CheckpointIndex.empty(batchId);
            }
            log.warn("[{}] Checkpoint index missing or unreadable; rebuilding from {} record file(s).",
                    batchId, scan.records().size());
            return rebuildIndex(batchId, scan, 0L);
        });
    }

    private Optional<CheckpointIndex> readIndex(String batchId) {
        final Path indexFile = indexFile(batchId);
        if (!Files.isRegularFile(indexFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(jsonParser.parseFile(indexFile, CheckpointIndex.class));
        } catch (JsonParsingException e) {
            log.warn("[{}] Checkpoint index '{}' is corrupt: {}", batchId, indexFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Rewrites the index from scanned records. The issued sequence never drops below a sequence seen in a
     * record file name, readable or not, so a stray file cannot have its number issued again.
     */
    private CheckpointIndex rebuildIndex(String batchId, BatchScan scan, long lastIssued) {
        final List<CheckpointIndex.Entry> entries = scan.records().stream()
                .sorted(BY_SEQUENCE)
                .map(stored -> new CheckpointIndex.Entry(stored.record().sequenceNumber(),
                        stored.file().getFileName().toString(), stored.record().phaseLabel(),
                        stored.record().status(), stored.record().timestamp()))
                .toList();
        final long maxSequence = entries.stream().mapToLong(CheckpointIndex.Entry::sequence).max().orElse(0L);
        final long issued = Math.max(Math.max(lastIssued, maxSequence), scan.highestNamedSequence());
        final CheckpointIndex rebuilt = new CheckpointIndex(batchId, issued, entries);
        try {
            Files.createDirectories(directory);
            writeIndex(rebuilt);
        } catch (IOException e) {
            throw new CheckpointStoreException("Unable to rewrite checkpoint index for batch " + batchId, e);
        }
        return rebuilt;
    }

    private void writeIndex(CheckpointIndex index) throws IOException {
        final Path target = indexFile(index.batchId());
        final Path temp = directory.resolve(target.getFileName() + ".tmp");
        Files.write(temp, jsonSerializer.serializeToBytes(index, true));
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path indexFile(String batchId) {
        return directory.resolve(batchId + INDEX_SUFFIX);
    }
    //</editor-fold>

    //<editor-fold desc="Record files">
    private StoredRecord writeRecord(String batchId, long firstSequence, String phaseLabel, PhaseStatus status,
                                     CheckpointPayload payload) throws IOException {
        long sequence = firstSequence;
        for (int attempt = 1; ; attempt++) {
            final Instant now = Instant.now();
            final PhaseRecord record = new PhaseRecord(batchId, phaseLabel, status, sequence, now, payload);
            final Path file = directory.resolve(batchId + "_" + now.toEpochMilli() + "_" + sequence + RECORD_SUFFIX);
            try {
                Files.write(file, jsonSerializer.serializeToBytes(record, true),
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return new StoredRecord(file, record);
            } catch (FileAlreadyExistsException e) {
                if (attempt >= MAX_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.warn("[{}] Checkpoint file '{}' already exists; moving on to sequence {}.", batchId,
                        file.getFileName(), sequence + 1);
                sequence++;
            }
        }
    }

    private BatchScan scan(String batchId) {
        final List<StoredRecord> records = new ArrayList<>();
        long highestNamed = 0L;
        for (Path file : recordFiles(batchId)) {
            highestNamed = Math.max(highestNamed, sequenceInName(file));
            readRecord(file).ifPresent(record -> records.add(new StoredRecord(file, record)));
        }
        return new BatchScan(records, highestNamed);
    }

    private List<StoredRecord> scanRecords(String batchId) {
        return scan(batchId).records();
    }

    private static List<PhaseRecord> recordsOf(List<StoredRecord> stored) {
        return stored.stream().map(StoredRecord::record).toList();
    }

    private List<Path> recordFiles(String batchId) {
        final List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, batchId + "_*" + RECORD_SUFFIX)) {
            for (Path file : stream) {
                final Matcher matcher = RECORD_NAME_PATTERN.matcher(file.getFileName().toString());
                if (matcher.matches() && matcher.group(1).equals(batchId)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new CheckpointStoreException("Unable to scan checkpoint files for batch " + batchId, e);
        }
        return files;
    }

    private static long sequenceInName(Path file) {
        final Matcher matcher = RECORD_NAME_PATTERN.matcher(file.getFileName().toString());
        return matcher.matches() && matcher.group(3) != null ? Long.parseLong(matcher.group(3)) : 0L;
    }

    private Optional<PhaseRecord> readRecord(Path file) {
        try {
            return Optional.of(jsonParser.parseFile(file, PhaseRecord.class));
        } catch (JsonParsingException e) {
            if (e.getCause() instanceof NoSuchFileException) {
                log.debug("Checkpoint file '{}' no longer exists.", file);
            } else {
                log.warn("Skipping unreadable checkpoint file '{}': {}", file, e.getMessage());
            }
            return Optional.empty();
        }
    }

    private record StoredRecord(Path file, PhaseRecord record) {
    }

    /**
     * @param highestNamedSequence highest sequence in any matching file name, including unreadable files
     */
    private record BatchScan(List<StoredRecord> records, long highestNamedSequence) {

        boolean isEmpty() {
            return records.isEmpty() && highestNamedSequence == 0L;
        }
    }
    //</editor-fold>

    private Object lockFor(String batchId) {
        return batchLocks[Math.floorMod(batchId.hashCode(), LOCK_STRIPES)];
    }

    private static void requireBatchId(String batchId) {
        if (batchId == null || !BATCH_ID_PATTERN.matcher(batchId).matches()) {
            throw new IllegalArgumentException("Invalid batch id: " + batchId);
        }
    }
}
