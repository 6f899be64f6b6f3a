package com.mediavault.service.retag;

import com.mediavault.model.Disposition;
import com.mediavault.model.MediaAsset;
import com.mediavault.model.MediaType;
import com.mediavault.model.OperationSummary;
import com.mediavault.model.ProgressEventType;
import com.mediavault.model.RetagMode;
import com.mediavault.service.OperationControl;
import com.mediavault.service.ingest.StagingMode;
import com.mediavault.service.ingest.TransactionListener;
import com.mediavault.testsupport.FakeMetadataWriter;
import com.mediavault.testsupport.MediaFixtures;
import com.mediavault.testsupport.TestLibrary;
import com.mediavault.testsupport.TestLibrary.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RetagBatchProcessor}.
 */
class RetagBatchProcessorTest {

    private static final LocalDateTime NEW_DATE = LocalDateTime.of(2019, 12, 24, 20, 0, 0);

    @TempDir
    Path libraryDir;

    @TempDir
    Path sourceDir;

    private TestLibrary library;
    private RetagBatchProcessor processor;

    @BeforeEach
    void setUp() {
        library = new TestLibrary(libraryDir);
        processor = new RetagBatchProcessor(library.getEngine());
    }

    private MediaAsset importAsset(String name, LocalDateTime date, String pixels) throws Exception {
        Path source = MediaFixtures.write(sourceDir.resolve(name), date, pixels);
        return library.getEngine().begin(source, StagingMode.COPY, TransactionListener.NONE).execute().getAsset();
    }

    /**
     * Two assets that differ only by their date become identical once given the same date:
     * the lower id keeps its record, the other is demoted to the duplicate trash.
     */
    @Test
    void testRetag_SameDate_DemotesCollidingAsset() throws Exception {
        // 1. Arrange
        MediaAsset first = importAsset("a.jpg", LocalDateTime.of(2019, 1, 1, 8, 0), "party");
        MediaAsset second = importAsset("b.jpg", LocalDateTime.of(2019, 2, 1, 8, 0), "cake");
        MediaAsset third = importAsset("c.jpg", LocalDateTime.of(2019, 3, 1, 8, 0), "party");
        assertNotEquals(first.getContentHash(), third.getContentHash());
        RecordingSink sink = new RecordingSink();

        // 2. Act
        OperationSummary summary = processor.retag(new RetagRequest(
                List.of(third.getId(), first.getId(), second.getId()), NEW_DATE, RetagMode.SAME), sink, new OperationControl());

        // 3. Assert
        assertEquals(2, summary.getProcessed());
        assertEquals(1, summary.getDuplicates());
        assertEquals(2, library.getContext().getStore().countAssets());
        assertNull(library.getContext().getStore().findById(third.getId()));
        assertFalse(Files.exists(library.getContext().resolve(third.getCurrentPath())));

        MediaAsset updated = library.getContext().getStore().findById(first.getId());
        assertEquals(NEW_DATE, updated.getCapturedAt());
        assertTrue(updated.getCurrentPath().startsWith("2019/2019-12-24/"));
        Path file = library.getContext().resolve(updated.getCurrentPath());
        assertEquals(NEW_DATE, MediaFixtures.readDate(file));
        assertEquals(updated.getContentHash(), library.getEngine().getHasher().hash(file));
        assertFalse(Files.exists(library.getContext().resolve(first.getCurrentPath())));

        assertEquals(1, library.getContext().getStore().findTrashEntries(Disposition.DUPLICATE).size());
        assertEquals(ProgressEventType.COMPLETE, sink.last().getType());
    }

    /**
     * A file the tools cannot rewrite keeps its record and its bytes.
     */
    @Test
    void testRetag_NormalizationFailure_LeavesAssetUntouched() throws Exception {
        MediaAsset asset = importAsset("a.jpg", LocalDateTime.of(2018, 5, 5, 5, 5), "x");
        Path file = library.getContext().resolve(asset.getCurrentPath());
        Files.writeString(file, FakeMetadataWriter.CORRUPT_MARKER);
        byte[] before = Files.readAllBytes(file);

        OperationSummary summary = processor.retag(new RetagRequest(List.of(asset.getId()), NEW_DATE, RetagMode.SAME),
                new RecordingSink(), new OperationControl());

        assertEquals(0, summary.getProcessed());
        assertEquals(1, summary.countOf(Disposition.CORRUPTED));
        MediaAsset reloaded = library.getContext().getStore().findById(asset.getId());
        assertEquals(asset.getCurrentPath(), reloaded.getCurrentPath());
        assertEquals(asset.getCapturedAt(), reloaded.getCapturedAt());
        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void testRetag_UnknownId_IsReported() throws Exception {
        MediaAsset asset = importAsset("a.jpg", LocalDateTime.of(2018, 5, 5, 5, 5), "x");

        OperationSummary summary = processor.retag(new RetagRequest(List.of(asset.getId(), 999L), NEW_DATE, RetagMode.SAME),
                new RecordingSink(), new OperationControl());

        assertEquals(1, summary.getProcessed());
        assertEquals(1, summary.getErrors());
        assertEquals("#999", summary.getRejections().get(0).getFile());
    }

    @Test
    void testComputeTargetDates_Shift_KeepsRelativeOffsets() {
        MediaAsset reference = asset(1L, LocalDateTime.of(2020, 1, 1, 10, 0));
        MediaAsset later = asset(2L, LocalDateTime.of(2020, 1, 1, 12, 30));

        Map<Long, LocalDateTime> dates = RetagBatchProcessor.computeTargetDates(List.of(later, reference),
                new RetagRequest(List.of(1L, 2L), LocalDateTime.of(2020, 1, 2, 10, 0), RetagMode.SHIFT));

        assertEquals(LocalDateTime.of(2020, 1, 2, 10, 0), dates.get(1L));
        assertEquals(LocalDateTime.of(2020, 1, 2, 12, 30), dates.get(2L));
    }

    /**
     * The first selected asset anchors the shift, whatever its id.
     */
    @Test
    void testComputeTargetDates_Shift_UsesFirstSelectedAsset() {
        MediaAsset a = asset(1L, LocalDateTime.of(2019, 1, 1, 0, 0));
        MediaAsset b = asset(2L, LocalDateTime.of(2021, 1, 1, 0, 0));

        Map<Long, LocalDateTime> dates = RetagBatchProcessor.computeTargetDates(List.of(a, b),
                new RetagRequest(List.of(2L, 1L), LocalDateTime.of(2020, 1, 1, 0, 0), RetagMode.SHIFT));

        assertEquals(LocalDateTime.of(2020, 1, 1, 0, 0), dates.get(2L));
        assertEquals(LocalDateTime.of(2018, 1, 1, 0, 0), dates.get(1L));
    }

    @Test
    void testRetag_MovedAsset_RemovesEmptiedDateAndYearFolders() throws Exception {
        MediaAsset asset = importAsset("a.jpg", LocalDateTime.of(2010, 3, 3, 12, 0), "old");
        Path oldFile = library.getContext().resolve(asset.getCurrentPath());
        Path dateFolder = oldFile.getParent();
        Path yearFolder = dateFolder.getParent();
        assertEquals("2010", yearFolder.getFileName().toString());

        OperationSummary summary = processor.retag(new RetagRequest(List.of(asset.getId()),
                LocalDateTime.of(2020, 1, 1, 0, 0), RetagMode.SAME), new RecordingSink(), new OperationControl());

        assertEquals(1, summary.getProcessed());
        assertFalse(Files.exists(dateFolder));
        assertFalse(Files.exists(yearFolder));
        assertTrue(Files.isDirectory(libraryDir));
        String newPath = library.getContext().getStore().findById(asset.getId()).getCurrentPath();
        assertTrue(newPath.startsWith("2020/2020-01-01/"));
    }

    @Test
    void testRetag_FolderWithOtherAssets_IsKept() throws Exception {
        MediaAsset moved = importAsset("a.jpg", LocalDateTime.of(2010, 3, 3, 12, 0), "first");
        importAsset("b.jpg", LocalDateTime.of(2010, 3, 3, 13, 0), "second");
        Path dateFolder = library.getContext().resolve(moved.getCurrentPath()).getParent();

        processor.retag(new RetagRequest(List.of(moved.getId()), LocalDateTime.of(2020, 1, 1, 0, 0), RetagMode.SAME),
                new RecordingSink(), new OperationControl());

        assertTrue(Files.isDirectory(dateFolder));
    }

    /**
     * Sequence mode orders assets by their current date, not by id.
     */
    @Test
    void testComputeTargetDates_Sequence_SpacesByInterval() {
        MediaAsset a = asset(1L, LocalDateTime.of(2020, 6, 1, 12, 0));
        MediaAsset b = asset(2L, LocalDateTime.of(2020, 6, 1, 9, 0));
        MediaAsset c = asset(3L, null);
        LocalDateTime start = LocalDateTime.of(2021, 1, 1, 0, 0, 0, 500_000_000);

        Map<Long, LocalDateTime> dates = RetagBatchProcessor.computeTargetDates(List.of(a, b, c),
                new RetagRequest(List.of(1L, 2L, 3L), start, RetagMode.SEQUENCE, Duration.ofSeconds(90)));

        assertEquals(LocalDateTime.of(2021, 1, 1, 0, 0, 0), dates.get(2L));
        assertEquals(LocalDateTime.of(2021, 1, 1, 0, 1, 30), dates.get(1L));
        assertEquals(LocalDateTime.of(2021, 1, 1, 0, 3, 0), dates.get(3L));
    }

    @Test
    void testRequest_SequenceWithNegativeInterval_Throws() {
        assertThrows(IllegalArgumentException.class, () ->
                new RetagRequest(List.of(1L), NEW_DATE, RetagMode.SEQUENCE, Duration.ofSeconds(-1)));
    }

    private static MediaAsset asset(long id, LocalDateTime capturedAt) {
        MediaAsset asset = new MediaAsset("hash" + id, "p/" + id + ".jpg", id + ".jpg", capturedAt, MediaType.IMAGE, 10);
        asset.setId(id);
        return asset;
    }
}
