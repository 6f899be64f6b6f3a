package com.mediavault.service;

import com.mediavault.model.ProgressEvent;

/**
 * Receiver of the ordered progress events of one operation.
 */
@FunctionalInterface
public interface ProgressSink {

    void emit(ProgressEvent event);
}
