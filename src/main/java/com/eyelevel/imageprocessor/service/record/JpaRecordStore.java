package com.eyelevel.imageprocessor.service.record;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.model.BatchMaster;
import com.eyelevel.imageprocessor.model.BatchStatus;
import com.eyelevel.imageprocessor.model.ImageMaster;
import com.eyelevel.imageprocessor.model.ImageStatus;
import com.eyelevel.imageprocessor.repository.BatchMasterRepository;
import com.eyelevel.imageprocessor.repository.ImageMasterRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RecordStore} backed by the {@code batch_master} and {@code image_master} tables.
 * Each call runs in the repository's own transaction, so one failed write never rolls back another.
 */
@Slf4j
@Service
public class JpaRecordStore implements RecordStore {

    private final BatchMasterRepository batchMasterRepository;
    private final ImageMasterRepository imageMasterRepository;
    private final boolean enabled;
    private final Map<String, Long> batchKeys = new ConcurrentHashMap<>();

    public JpaRecordStore(BatchMasterRepository batchMasterRepository, ImageMasterRepository imageMasterRepository,
                          ImageProcessingConfig config) {
        this.batchMasterRepository = batchMasterRepository;
        this.imageMasterRepository = imageMasterRepository;
        this.enabled = config.records().enabled();
    }

    @Override
    public void registerBatch(String batchId, String source) {
        if (!enabled) {
            return;
        }
        try {
            final BatchMaster batch = batchMasterRepository.findByBatchId(batchId)
                    .map(existing -> {
                        log.info("[{}] Batch record already exists; marking it as processing again.", batchId);
                        existing.setStatus(BatchStatus.PROCESSING);
                        existing.setErrorMessage(null);
                        existing.setPackagePath(null);
                        return existing;
                    })
                    .orElseGet(() -> BatchMaster.builder()
                            .batchId(batchId)
                            .source(source)
                            .status(BatchStatus.PROCESSING)
                            .build());
            final BatchMaster saved = batchMasterRepository.save(batch);
            batchKeys.put(batchId, saved.getId());
            log.debug("[{}] Batch record {} saved.", batchId, saved.getId());
        } catch (DataAccessException e) {
            log.error("[{}] Failed to register batch record: {}", batchId, e.getMessage(), e);
        }
    }

    @Override
    public Optional<Long> registerImage(String batchId, Path file) {
        if (!enabled) {
            return Optional.empty();
        }
        final Long batchKey = batchKeys.get(batchId);
        if (batchKey == null) {
            log.warn("[{}] Batch is not registered; skipping record for '{}'.", batchId, file.getFileName());
            return Optional.empty();
        }
        try {
            final ImageMaster image = ImageMaster.builder()
                    .batchMaster(batchMasterRepository.getReferenceById(batchKey))
                    .originalPath(file.toString())
                    .fileName(file.getFileName().toString())
                    .fileSize(Files.size(file))
                    .extension(FilenameUtils.getExtension(file.getFileName().toString()).toLowerCase(Locale.ROOT))
                    .fileHash(sha256(file))
                    .status(ImageStatus.EXTRACTED)
                    .build();
            return Optional.of(imageMasterRepository.save(image).getId());
        } catch (IOException | DataAccessException e) {
            log.warn("[{}] Failed to register image '{}': {}", batchId, file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void updateImage(Long imageId, ImageStatus status, String processedPath, String metadata) {
        if (!enabled || imageId == null) {
            return;
        }
        try {
            imageMasterRepository.findById(imageId).ifPresentOrElse(image -> {
                image.setStatus(status);
                if (processedPath != null) {
                    image.setProcessedPath(processedPath);
                }
                if (metadata != null) {
                    image.setMetadata(metadata);
                }
                imageMasterRepository.save(image);
            }, () -> log.warn("Image record {} not found; status {} not stored.", imageId, status));
        } catch (DataAccessException e) {
            log.warn("Failed to update image record {} to {}: {}", imageId, status, e.getMessage());
        }
    }

    @Override
    public void updateBatchStatus(String batchId, BatchStatus status, String packagePath, String errorMessage) {
        if (!enabled) {
            return;
        }
        try {
            final int updated = batchMasterRepository.updateOutcome(batchId, status, packagePath, errorMessage);
            if (updated == 0) {
                log.warn("[{}] No batch record to mark as {}.", batchId, status);
            }
            if (status != BatchStatus.PROCESSING) {
                batchKeys.remove(batchId);
            }
        } catch (DataAccessException e) {
            log.error("[{}] Failed to update batch status to {}: {}", batchId, status, e.getMessage(), e);
        }
    }

    private static String sha256(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return DigestUtils.sha256Hex(in);
        }
    }
}
