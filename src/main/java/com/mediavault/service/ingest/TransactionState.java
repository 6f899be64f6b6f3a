package com.mediavault.service.ingest;

public enum TransactionState {
    NEW,
    STAGED,
    NORMALIZED,
    REHASHED,
    COMMITTED,
    DUPLICATE_DETECTED,
    ROLLED_BACK;

    public boolean isFinal() {
        return this == COMMITTED || this == DUPLICATE_DETECTED || this == ROLLED_BACK;
    }
}
