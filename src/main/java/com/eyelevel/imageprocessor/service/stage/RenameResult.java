package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.model.WorkItem;

import java.util.List;

/**
 * @param renamed      survivors in input order, each carrying its new path and sequence number
 * @param failed       items that could not be copied under their new name
 * @param nextSequence the sequence number the next sub-batch should start from
 */
public record RenameResult(List<WorkItem> renamed, int failed, int nextSequence) {
}
