package com.mediavault.service.ingest;

import com.mediavault.model.Disposition;
import com.mediavault.model.MediaAsset;
import com.mediavault.service.CaptureDateExtractor;
import com.mediavault.service.ContentHasher;
import com.mediavault.service.DimensionReader;
import com.mediavault.service.LibraryContext;
import com.mediavault.service.PathDeriver;
import com.mediavault.service.TrashManager;
import com.mediavault.service.normalize.MetadataNormalizer;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * Shared machinery of import, retag and terraform: hashing, date extraction, normalization,
 * canonical paths, trash and the asset store of one library.
 */
public class IngestionEngine {

    private final LibraryContext context;
    private final ContentHasher hasher;
    private final CaptureDateExtractor dateExtractor;
    private final MetadataNormalizer normalizer;
    private final PathDeriver pathDeriver;
    private final TrashManager trashManager;
    private final DimensionReader dimensionReader;

    public IngestionEngine(LibraryContext context, CaptureDateExtractor dateExtractor, MetadataNormalizer normalizer) {
        this.context = context;
        this.hasher = new ContentHasher();
        this.dateExtractor = dateExtractor;
        this.normalizer = normalizer;
        this.pathDeriver = new PathDeriver(context.getSettings().getShortHashLength());
        this.trashManager = new TrashManager(context);
        this.dimensionReader = new DimensionReader(context.getRoot());
    }

    /**
     * Prepares a transaction for one source file. Nothing happens until it is executed.
     */
    public IngestionTransaction begin(Path source, StagingMode mode, TransactionListener listener) {
        return new IngestionTransaction(this, source, mode, listener);
    }

    /**
     * Finds the active asset that already owns a hash.
     *
     * @param excludeId Asset to ignore (the one being processed), or null.
     * @return The colliding asset, or null.
     */
    public MediaAsset findCollision(String contentHash, Long excludeId) {
        MediaAsset existing = context.getStore().findByHash(contentHash);
        if (existing == null || (excludeId != null && excludeId.equals(existing.getId()))) {
            return null;
        }
        return existing;
    }

    /**
     * Resolves the derived path to a free relative path. A path counts as taken when another
     * asset is registered there or an unregistered file sits there.
     *
     * @param ownerId Asset that may keep its own current path, or null.
     */
    public String allocatePath(PathDeriver.DerivedPath derived, Long ownerId) {
        return pathDeriver.resolveAvailable(derived, candidate -> {
            MediaAsset holder = context.getStore().findByPath(candidate);
            if (holder != null) {
                return ownerId == null || !ownerId.equals(holder.getId());
            }
            return Files.exists(context.resolve(candidate), LinkOption.NOFOLLOW_LINKS);
        });
    }

    /**
     * A fresh, unique location in the staging area.
     */
    public Path newStagingFile(String extension) throws IOException {
        Path stagingDir = context.getStagingDir();
        Files.createDirectories(stagingDir);
        String suffix = extension == null || extension.isEmpty() ? "" : "." + extension;
        return stagingDir.resolve(UUID.randomUUID() + suffix);
    }

    /**
     * Category of a filesystem failure while handling a file.
     */
    public static Disposition classify(IOException e) {
        if (e instanceof AccessDeniedException) {
            return Disposition.PERMISSION_DENIED;
        }
        if (e instanceof FileSystemException) {
            String reason = ((FileSystemException) e).getReason();
            if (reason != null && reason.toLowerCase(Locale.ROOT).contains("denied")) {
                return Disposition.PERMISSION_DENIED;
            }
        }
        return Disposition.CORRUPTED;
    }

    public LibraryContext getContext() { return context; }
    public ContentHasher getHasher() { return hasher; }
    public CaptureDateExtractor getDateExtractor() { return dateExtractor; }
    public MetadataNormalizer getNormalizer() { return normalizer; }
    public PathDeriver getPathDeriver() { return pathDeriver; }
    public TrashManager getTrashManager() { return trashManager; }
    public DimensionReader getDimensionReader() { return dimensionReader; }
}
