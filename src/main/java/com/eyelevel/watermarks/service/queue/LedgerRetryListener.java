package com.eyelevel.watermarks.service.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("ledgerRetryListener")
@Slf4j
public class LedgerRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Writing the job ledger failed on attempt {}. Retrying...", context.getRetryCount(), throwable);
    }
}
