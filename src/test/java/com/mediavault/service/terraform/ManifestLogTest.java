package com.mediavault.service.terraform;

import com.mediavault.model.Disposition;
import com.mediavault.model.ManifestEvent;
import com.mediavault.model.ManifestRecord;
import com.mediavault.model.OperationSummary;
import com.mediavault.model.Rejection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ManifestLog}.
 */
class ManifestLogTest {

    private static final LocalDateTime STARTED = LocalDateTime.of(2024, 2, 29, 13, 45, 10);

    @TempDir
    Path tempDir;

    @Test
    void testCreate_NamesFileAfterStartTime() throws Exception {
        ManifestLog log = ManifestLog.create(tempDir.resolve(".logs"), STARTED);

        assertEquals("terraform_20240229_134510.jsonl", log.getFile().getFileName().toString());
        assertTrue(Files.exists(log.getFile()));
    }

    /**
     * Two runs within the same second must not share a manifest.
     */
    @Test
    void testCreate_SameSecond_GetsDistinctFile() throws Exception {
        ManifestLog first = ManifestLog.create(tempDir, STARTED);
        ManifestLog second = ManifestLog.create(tempDir, STARTED);

        assertNotEquals(first.getFile(), second.getFile());
        assertEquals(2, ManifestLog.findManifests(tempDir).size());
    }

    @Test
    void testAppend_WritesOneJsonObjectPerLine() throws Exception {
        ManifestLog log = ManifestLog.create(tempDir, STARTED);
        log.append(ManifestRecord.start("/library"));
        log.append(ManifestRecord.processing("stage", "a/b.jpg", ".import_temp/x.jpg"));
        log.append(ManifestRecord.failed("a/c.jpg", ".trash/corrupted/c.jpg", Disposition.CORRUPTED, "broken"));

        List<String> lines = Files.readAllLines(log.getFile(), StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals(3, log.getRecordCount());
        assertTrue(lines.get(1).contains("\"event\":\"processing\""));
        assertTrue(lines.get(1).contains("\"original_path\":\"a/b.jpg\""));
        assertTrue(lines.get(2).contains("\"category\":\"corrupted\""));
        assertFalse(lines.get(0).contains("\"hash\""), "Null fields are omitted");
    }

    @Test
    void testRead_ParsesRecordsBack() throws Exception {
        ManifestLog log = ManifestLog.create(tempDir, STARTED);
        OperationSummary summary = new OperationSummary();
        summary.recordProcessed();
        summary.recordRejection(new Rejection("x.nef", "x.nef", Disposition.RAW_SKIPPED, "raw", null));
        log.append(ManifestRecord.success("in/a.jpg", "2024/2024-02-29/img_20240229_abcdef12.jpg", "abcdef12"));
        log.append(ManifestRecord.complete(summary));

        List<ManifestRecord> records = ManifestLog.read(log.getFile(), tempDir);

        assertEquals(ManifestEvent.SUCCESS, records.get(0).getEvent());
        assertEquals("in/a.jpg", records.get(0).getOriginalPath());
        assertEquals("abcdef12", records.get(0).getHash());
        assertEquals(ManifestEvent.COMPLETE, records.get(1).getEvent());
        assertEquals(1, records.get(1).getProcessed());
        assertEquals(1, records.get(1).getSkipped());
    }

    /**
     * A crash can cut the last line short; everything before it must still be readable.
     */
    @Test
    void testRead_SkipsTruncatedLine() throws Exception {
        Path file = tempDir.resolve("terraform_20200101_000000.jsonl");
        Files.writeString(file, "{\"event\":\"start\",\"original_path\":\"/lib\"}\n\n{\"event\":\"succ", StandardCharsets.UTF_8);

        List<ManifestRecord> records = ManifestLog.read(file, tempDir);

        assertEquals(1, records.size());
        assertEquals(ManifestEvent.START, records.get(0).getEvent());
    }

    @Test
    void testFindManifests_IgnoresOtherFiles() throws Exception {
        Files.writeString(tempDir.resolve("application.log"), "log");
        Files.writeString(tempDir.resolve("terraform_20200102_000000.jsonl"), "");
        Files.writeString(tempDir.resolve("terraform_20200101_000000.jsonl"), "");

        List<Path> manifests = ManifestLog.findManifests(tempDir);

        assertEquals(2, manifests.size());
        assertEquals("terraform_20200101_000000.jsonl", manifests.get(0).getFileName().toString());
        assertTrue(ManifestLog.findManifests(tempDir.resolve("missing")).isEmpty());
    }
}
