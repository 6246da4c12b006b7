package com.eyelevel.imageprocessor.scheduler;

import com.eyelevel.imageprocessor.config.ImageProcessingConfig;
import com.eyelevel.imageprocessor.exception.CheckpointStoreException;
import com.eyelevel.imageprocessor.service.checkpoint.CheckpointStore;
import com.eyelevel.imageprocessor.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CheckpointRetentionSchedulerTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Every known batch is pruned to the configured retention")
    void prunesEveryBatch() {
        final CheckpointStore store = mock(CheckpointStore.class);
        when(store.batchIds()).thenReturn(new LinkedHashSet<>(List.of("batch-a", "batch-b")));

        new CheckpointRetentionScheduler(store, TestFixtures.config(root)).pruneCheckpoints();

        verify(store).prune("batch-a", 20);
        verify(store).prune("batch-b", 20);
    }

    @Test
    @DisplayName("A failing batch does not stop the others from being pruned")
    void continuesAfterFailure() {
        final CheckpointStore store = mock(CheckpointStore.class);
        when(store.batchIds()).thenReturn(new LinkedHashSet<>(List.of("batch-a", "batch-b")));
        when(store.prune("batch-a", 20)).thenThrow(new CheckpointStoreException("locked"));

        new CheckpointRetentionScheduler(store, TestFixtures.config(root)).pruneCheckpoints();

        verify(store).prune("batch-b", 20);
    }

    @Test
    @DisplayName("Nothing happens when checkpointing is disabled")
    void skipsWhenDisabled() {
        final CheckpointStore store = mock(CheckpointStore.class);
        final ImageProcessingConfig base = TestFixtures.config(root);
        final ImageProcessingConfig disabled = base.toBuilder()
                .checkpoint(base.checkpoint().toBuilder().enabled(false).build())
                .build();

        new CheckpointRetentionScheduler(store, disabled).pruneCheckpoints();

        verifyNoInteractions(store);
    }
}
