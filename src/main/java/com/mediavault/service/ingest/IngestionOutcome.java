package com.mediavault.service.ingest;

import com.mediavault.model.Disposition;
import com.mediavault.model.MediaAsset;
import com.mediavault.model.Rejection;

/**
 * Final result of one {@link IngestionTransaction}.
 */
public class IngestionOutcome {
    private final TransactionState state;
    private final MediaAsset asset;
    private final Disposition category;
    private final String message;
    private final String trashPath;

    private IngestionOutcome(TransactionState state, MediaAsset asset, Disposition category,
                             String message, String trashPath) {
        this.state = state;
        this.asset = asset;
        this.category = category;
        this.message = message;
        this.trashPath = trashPath;
    }

    public static IngestionOutcome committed(MediaAsset asset) {
        return new IngestionOutcome(TransactionState.COMMITTED, asset, null, null, null);
    }

    public static IngestionOutcome rejected(TransactionState state, Disposition category, String message,
                                            String trashPath) {
        return new IngestionOutcome(state, null, category, message, trashPath);
    }

    public TransactionState getState() { return state; }
    public MediaAsset getAsset() { return asset; }
    public Disposition getCategory() { return category; }
    public String getMessage() { return message; }

    /**
     * Location of the rejected file under the library root, or null if it was not trashed.
     */
    public String getTrashPath() { return trashPath; }

    public boolean isCommitted() {
        return state == TransactionState.COMMITTED;
    }

    public Rejection toRejection(String file, String sourcePath) {
        return new Rejection(file, sourcePath, category, message, trashPath);
    }
}
