package com.mediavault.service.terraform;

import com.mediavault.model.Disposition;
import com.mediavault.model.ManifestEvent;
import com.mediavault.model.ManifestRecord;
import com.mediavault.model.MediaAsset;
import com.mediavault.model.OperationSummary;
import com.mediavault.model.ProgressEventType;
import com.mediavault.model.TrashEntry;
import com.mediavault.service.LibraryContext;
import com.mediavault.service.OperationControl;
import com.mediavault.service.ingest.StagingMode;
import com.mediavault.service.ingest.TransactionListener;
import com.mediavault.testsupport.MediaFixtures;
import com.mediavault.testsupport.TestLibrary;
import com.mediavault.testsupport.TestLibrary.RecordingSink;
import com.mediavault.util.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for {@link TerraformOrchestrator}.
 * Each test reorganizes a real folder tree in place and inspects the tree, the store and the manifest.
 */
class TerraformOrchestratorTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2015, 8, 1, 9, 0, 0);

    @TempDir
    Path libraryDir;

    @TempDir
    Path outsideDir;

    private TestLibrary library;
    private LibraryContext context;
    private TerraformOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        library = new TestLibrary(libraryDir);
        context = library.getContext();
        orchestrator = new TerraformOrchestrator(library.getEngine());
    }

    private OperationSummary run(RecordingSink sink) {
        return orchestrator.terraform(libraryDir, sink, new OperationControl());
    }

    /**
     * A messy tree of fifty files, one of them corrupt: every good file becomes an asset at its
     * canonical path, the corrupt one goes to the trash, and the manifest accounts for all fifty.
     */
    @Test
    void testTerraform_MessyTree_ReorganizesEverything() throws Exception {
        // 1. Arrange
        for (int i = 0; i < 49; i++) {
            String folder = "import_" + (i % 5) + "/batch_" + (i % 3);
            String name = (i % 7 == 0) ? "clip_" + i + ".mov" : "IMG_" + i + ".jpg";
            MediaFixtures.write(libraryDir.resolve(folder).resolve(name), BASE.plusDays(i), "pixels" + i);
        }
        MediaFixtures.writeCorrupt(libraryDir.resolve("import_0/broken.jpg"));
        RecordingSink sink = new RecordingSink();

        // 2. Act
        OperationSummary summary = run(sink);

        // 3. Assert: store and trash
        assertEquals(49, summary.getProcessed());
        assertEquals(1, summary.getErrors());
        assertEquals(49, context.getStore().countAssets());
        List<TrashEntry> corrupted = context.getStore().findTrashEntries(Disposition.CORRUPTED);
        assertEquals(1, corrupted.size());
        assertEquals("import_0/broken.jpg", corrupted.get(0).getOriginalPath());

        for (MediaAsset asset : context.getStore().findAll()) {
            assertTrue(library.getEngine().getPathDeriver().isCanonical(asset.getCurrentPath(), asset.getCapturedAt(),
                    asset.getContentHash(), FileUtils.getExtension(asset.getCurrentPath())),
                    "Not canonical: " + asset.getCurrentPath());
            assertTrue(Files.exists(context.resolve(asset.getCurrentPath())));
        }

        // Old folders are gone
        for (int i = 0; i < 5; i++) {
            assertFalse(Files.exists(libraryDir.resolve("import_" + i)), "import_" + i + " should be removed");
        }

        // Manifest
        List<Path> manifests = ManifestLog.findManifests(context.getLogsDir());
        assertEquals(1, manifests.size());
        List<ManifestRecord> records = ManifestLog.read(manifests.get(0), libraryDir);
        assertEquals(ManifestEvent.START, records.get(0).getEvent());
        ManifestRecord last = records.get(records.size() - 1);
        assertEquals(ManifestEvent.COMPLETE, last.getEvent());
        assertEquals(50, last.getTotal());
        assertEquals(49, last.getProcessed());
        assertEquals(1, last.getErrors());
        assertEquals(49, count(records, ManifestEvent.SUCCESS));
        assertEquals(1, count(records, ManifestEvent.FAILED));

        // Every outcome is announced by processing records for the same original path
        for (int i = 0; i < records.size(); i++) {
            ManifestRecord record = records.get(i);
            if (record.getEvent() != null && record.getEvent().isOutcome()) {
                ManifestRecord previous = records.get(i - 1);
                assertEquals(ManifestEvent.PROCESSING, previous.getEvent());
                assertEquals(record.getOriginalPath(), previous.getOriginalPath());
            }
        }

        assertEquals(ProgressEventType.START, sink.getEvents().get(0).getType());
        assertEquals(50, sink.getEvents().get(0).getTotal());
        assertEquals(ProgressEventType.COMPLETE, sink.last().getType());
        assertFalse(context.getLock().isHeld(), "Lock must be released");
    }

    /**
     * Directories holding only OS junk count as empty; directories with other files stay.
     */
    @Test
    void testTerraform_CleansJunkOnlyDirectories() throws Exception {
        MediaFixtures.write(libraryDir.resolve("a/b/c/photo.jpg"), BASE, "p");
        Files.createDirectories(libraryDir.resolve("junk/deeper"));
        Files.writeString(libraryDir.resolve("junk/.DS_Store"), "x");
        Files.writeString(libraryDir.resolve("junk/deeper/Thumbs.db"), "x");
        Files.createDirectories(libraryDir.resolve("keep"));
        Files.writeString(libraryDir.resolve("keep/notes.txt"), "keep me");

        run(new RecordingSink());

        assertFalse(Files.exists(libraryDir.resolve("a")));
        assertFalse(Files.exists(libraryDir.resolve("junk")));
        assertTrue(Files.exists(libraryDir.resolve("keep/notes.txt")));
        assertTrue(Files.isDirectory(context.getLogsDir()));
    }

    /**
     * A lock held by a live process (here, this one) stops the run before anything is touched.
     */
    @Test
    void testTerraform_LockHeld_AbortsWithoutMutation() throws Exception {
        Path photo = MediaFixtures.write(libraryDir.resolve("album/photo.jpg"), BASE, "p");
        Path lockFile = context.getLock().getLockFile();
        Files.createDirectories(lockFile.getParent());
        Files.writeString(lockFile, String.valueOf(ProcessHandle.current().pid()), StandardCharsets.UTF_8);
        RecordingSink sink = new RecordingSink();

        OperationSummary summary = run(sink);

        assertEquals(1, sink.getEvents().size());
        assertEquals(ProgressEventType.ERROR, sink.last().getType());
        assertTrue(sink.last().getMessage().contains("Another reorganization"));
        assertEquals(0, summary.getProcessed());
        assertTrue(Files.exists(photo));
        assertEquals(0, context.getStore().countAssets());
        assertTrue(ManifestLog.findManifests(context.getLogsDir()).isEmpty());
        assertTrue(Files.exists(lockFile), "A lock this run did not take must not be removed");
    }

    @Test
    void testTerraform_MissingTool_FailsPreflight() throws Exception {
        Path clip = MediaFixtures.write(libraryDir.resolve("clip.mp4"), BASE, "v");
        library.getVideoWriter().setAvailable(false);
        RecordingSink sink = new RecordingSink();

        run(sink);

        assertEquals(ProgressEventType.ERROR, sink.last().getType());
        assertTrue(sink.last().getMessage().contains("ffmpeg"));
        assertTrue(Files.exists(clip));
        assertFalse(Files.exists(context.getLock().getLockFile()));
    }

    @Test
    void testTerraform_WrongRoot_IsRejected() {
        RecordingSink sink = new RecordingSink();

        orchestrator.terraform(outsideDir, sink, new OperationControl());

        assertEquals(ProgressEventType.ERROR, sink.last().getType());
        assertFalse(Files.exists(context.getLock().getLockFile()));
    }

    @Test
    void testTerraform_RawFile_IsSkipped() throws Exception {
        MediaFixtures.write(libraryDir.resolve("shoot/DSC_0001.NEF"), BASE, "raw");
        MediaFixtures.write(libraryDir.resolve("shoot/DSC_0001.JPG"), BASE, "jpeg");

        OperationSummary summary = run(new RecordingSink());

        assertEquals(1, summary.getProcessed());
        assertEquals(1, summary.getSkipped());
        assertEquals(0, summary.getErrors());
        assertTrue(Files.exists(libraryDir.resolve(".trash/raw_skipped/DSC_0001.NEF")));

        List<ManifestRecord> records = ManifestLog.read(ManifestLog.findManifests(context.getLogsDir()).get(0), libraryDir);
        ManifestRecord skipped = records.stream().filter(r -> r.getEvent() == ManifestEvent.SKIPPED).findFirst().orElseThrow();
        assertEquals("shoot/DSC_0001.NEF", skipped.getOriginalPath());
        assertEquals(Disposition.RAW_SKIPPED, skipped.getCategory());
    }

    @Test
    void testTerraform_SymlinksAreLeftAlone() throws Exception {
        Path target = MediaFixtures.write(outsideDir.resolve("elsewhere.jpg"), BASE, "far");
        Path link = libraryDir.resolve("links/elsewhere.jpg");
        Files.createDirectories(link.getParent());
        try {
            Files.createSymbolicLink(link, target);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "Symbolic links not supported here");
        }

        OperationSummary summary = run(new RecordingSink());

        assertEquals(0, summary.getProcessed());
        assertTrue(Files.isSymbolicLink(link));
        assertTrue(Files.exists(target));
        assertEquals(0, context.getStore().countAssets());
    }

    /**
     * A second run only handles what the first one did not: files it already placed are not
     * touched again.
     */
    @Test
    void testTerraform_SecondRun_OnlyProcessesNewFiles() throws Exception {
        MediaFixtures.write(libraryDir.resolve("one/a.jpg"), BASE, "a");
        MediaFixtures.write(libraryDir.resolve("one/b.jpg"), BASE, "b");
        run(new RecordingSink());

        MediaFixtures.write(libraryDir.resolve("two/c.jpg"), BASE.plusYears(1), "c");
        RecordingSink second = new RecordingSink();
        OperationSummary summary = run(second);

        assertEquals(1, second.getEvents().get(0).getTotal());
        assertEquals(1, summary.getProcessed());
        assertEquals(3, context.getStore().countAssets());
        assertEquals(2, ManifestLog.findManifests(context.getLogsDir()).size());
    }

    /**
     * A file that failed in a finished run does not shadow a new file later written to the same path.
     */
    @Test
    void testTerraform_NewFileAtPreviouslyFailedPath_IsProcessed() throws Exception {
        Path photo = libraryDir.resolve("inbox/photo.jpg");
        MediaFixtures.writeCorrupt(photo);
        OperationSummary first = run(new RecordingSink());
        assertEquals(1, first.getErrors());
        assertFalse(Files.exists(photo));

        MediaFixtures.write(photo, BASE, "fresh");
        RecordingSink second = new RecordingSink();
        OperationSummary summary = run(second);

        assertEquals(1, second.getEvents().get(0).getTotal());
        assertEquals(1, summary.getProcessed());
        assertFalse(Files.exists(photo));
        assertEquals(1, context.getStore().countAssets());
    }

    /**
     * A run killed while a file sat in staging: the next run moves it back and processes it.
     */
    @Test
    void testTerraform_InterruptedRun_ResumesStagedFile() throws Exception {
        // 1. Arrange: the state a crash right after the stage step leaves behind
        Path staged = MediaFixtures.write(context.getStagingDir().resolve("0a1b2c.jpg"), BASE, "interrupted");
        Files.createDirectories(libraryDir.resolve("album"));
        Files.createDirectories(context.getLogsDir());
        Files.writeString(context.getLogsDir().resolve("terraform_20200101_000000.jsonl"),
                "{\"event\":\"start\",\"original_path\":\"" + libraryDir + "\"}\n"
                        + "{\"event\":\"processing\",\"phase\":\"stage\",\"original_path\":\"album/p.jpg\","
                        + "\"new_path\":\".import_temp/0a1b2c.jpg\"}\n"
                        + "{\"event\":\"processing\",\"phase\":\"norm", StandardCharsets.UTF_8);

        // 2. Act
        OperationSummary summary = run(new RecordingSink());

        // 3. Assert
        assertEquals(1, summary.getProcessed());
        assertFalse(Files.exists(staged));
        assertFalse(Files.exists(libraryDir.resolve("album")));
        MediaAsset asset = context.getStore().findAll().get(0);
        assertEquals("p.jpg", asset.getOriginalFilename());
        assertEquals(BASE, asset.getCapturedAt());
    }

    @Test
    void testRecoverUnfinished_PlacedAndRegistered_GetsSuccessRecord() throws Exception {
        Path source = MediaFixtures.write(outsideDir.resolve("x.jpg"), BASE, "x");
        MediaAsset asset = library.getEngine().begin(source, StagingMode.COPY, TransactionListener.NONE).execute().getAsset();
        ResumeState resume = new ResumeState();
        resume.apply(List.of(
                ManifestRecord.processing("stage", "in/x.jpg", ".import_temp/u.jpg"),
                ManifestRecord.processing("place", "in/x.jpg", asset.getCurrentPath())));
        ManifestLog manifest = ManifestLog.create(context.getLogsDir(), LocalDateTime.of(2024, 1, 1, 0, 0));

        orchestrator.recoverUnfinished(resume, manifest);

        List<ManifestRecord> written = ManifestLog.read(manifest.getFile(), libraryDir);
        assertEquals(1, written.size());
        assertEquals(ManifestEvent.SUCCESS, written.get(0).getEvent());
        assertEquals(asset.getCurrentPath(), written.get(0).getNewPath());
        assertTrue(resume.isDone("in/x.jpg"));
        assertTrue(resume.isDone(asset.getCurrentPath()));
    }

    @Test
    void testRecoverUnfinished_TrashedFile_GetsFailedRecord() throws Exception {
        MediaFixtures.writeCorrupt(libraryDir.resolve(".trash/timeout/slow.mov"));
        ResumeState resume = new ResumeState();
        resume.apply(List.of(
                ManifestRecord.processing("stage", "videos/slow.mov", ".import_temp/v.mov"),
                ManifestRecord.processing("normalize", "videos/slow.mov", ".import_temp/v.mov"),
                ManifestRecord.processing("trash", "videos/slow.mov", ".trash/timeout/slow.mov")));
        ManifestLog manifest = ManifestLog.create(context.getLogsDir(), LocalDateTime.of(2024, 1, 1, 0, 0));

        orchestrator.recoverUnfinished(resume, manifest);

        List<ManifestRecord> written = ManifestLog.read(manifest.getFile(), libraryDir);
        assertEquals(ManifestEvent.FAILED, written.get(0).getEvent());
        assertEquals(Disposition.TIMEOUT, written.get(0).getCategory());
        assertTrue(resume.getUnfinished().isEmpty());
    }

    private static long count(List<ManifestRecord> records, ManifestEvent event) {
        return records.stream().filter(r -> r.getEvent() == event).collect(Collectors.counting());
    }
}
