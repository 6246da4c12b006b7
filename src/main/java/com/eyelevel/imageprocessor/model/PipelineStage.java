package com.eyelevel.imageprocessor.model;

/**
 * The fixed stage order of a batch. Stages that run per sub-batch carry a
 * {@code <stage>_batch_<n>} checkpoint label.
 */
public enum PipelineStage {
    EXTRACT("extract", false),
    RENAME("rename", true),
    FILTER("filter", true),
    CONVERT("convert", true),
    PACKAGE("package", false);

    /**
     * Label used for the checkpoint written when a batch aborts.
     */
    public static final String ERROR_LABEL = "error";

    private final String label;
    private final boolean perSubBatch;

    PipelineStage(String label, boolean perSubBatch) {
        this.label = label;
        this.perSubBatch = perSubBatch;
    }

    public String label() {
        return label;
    }

    public boolean isPerSubBatch() {
        return perSubBatch;
    }

    public String subBatchLabel(int subBatchIndex) {
        if (!perSubBatch) {
            throw new IllegalStateException("Stage '" + label + "' does not run per sub-batch");
        }
        return label + "_batch_" + subBatchIndex;
    }
}
