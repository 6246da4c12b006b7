package com.eyelevel.imageprocessor.service.pipeline;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Issues batch ids of the form {@code batch} followed by 12 lower-case hex characters.
 */
@Component
public class BatchIdGenerator {

    private static final String PREFIX = "batch";
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9-]{1,64}");

    public String next() {
        return PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * Ids supplied by callers end up in file names, so only letters, digits and dashes are accepted.
     */
    public static boolean isAcceptable(String batchId) {
        return batchId != null && ACCEPTED_ID.matcher(batchId).matches();
    }
}
