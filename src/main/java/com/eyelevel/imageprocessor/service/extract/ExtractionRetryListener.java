package com.eyelevel.imageprocessor.service.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("extractionRetryListener")
@Slf4j
public class ExtractionRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        if (context.getRetryCount() > 0) {
            log.warn("Source extraction failed on attempt {}. Retrying...", context.getRetryCount(), throwable);
        }
    }
}
