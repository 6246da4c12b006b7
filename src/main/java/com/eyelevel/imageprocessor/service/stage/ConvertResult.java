package com.eyelevel.imageprocessor.service.stage;

import com.eyelevel.imageprocessor.model.WorkItem;

import java.util.List;
import java.util.Map;

/**
 * @param converted items whose converted file was written, in input order
 * @param failures  failure reason keyed by the original path of each item that could not be converted
 */
public record ConvertResult(List<WorkItem> converted, Map<String, String> failures) {

    public int failed() {
        return failures.size();
    }
}
