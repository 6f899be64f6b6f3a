package com.mediavault.repository;

import com.mediavault.model.Disposition;
import com.mediavault.model.MediaAsset;
import com.mediavault.model.TrashEntry;

import java.util.List;

/**
 * Persistence of active assets and trash entries for one library.
 * Lookups return null when nothing matches. Failures surface as {@link DatabaseException};
 * a content hash collision on insert or update surfaces as {@link DuplicateHashException}.
 */
public interface AssetStore {

    MediaAsset findByHash(String contentHash);

    MediaAsset findById(long id);

    MediaAsset findByPath(String currentPath);

    List<MediaAsset> findAll();

    /**
     * Inserts a new asset and returns it with its generated id set.
     */
    MediaAsset insert(MediaAsset asset);

    void update(MediaAsset asset);

    void delete(long id);

    TrashEntry recordTrashEntry(TrashEntry entry);

    List<TrashEntry> findTrashEntries();

    List<TrashEntry> findTrashEntries(Disposition category);

    int countAssets();
}
