package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.model.RejectionInfo;
import com.eyelevel.imageprocessor.model.WorkItem;

import java.util.List;
import java.util.Map;

/**
 * @param accepted items that met the resolution threshold, in input order, pointing at their filtered copy
 * @param rejected rejection details keyed by the original path of each dropped item
 */
public record FilterResult(List<WorkItem> accepted, Map<String, RejectionInfo> rejected) {
}
