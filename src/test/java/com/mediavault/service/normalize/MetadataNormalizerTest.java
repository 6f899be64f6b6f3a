package com.mediavault.service.normalize;

import com.mediavault.model.Disposition;
import com.mediavault.model.MediaType;
import com.mediavault.testsupport.FakeMetadataWriter;
import com.mediavault.testsupport.MediaFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link MetadataNormalizer}.
 * Verifies that a rewrite only replaces the file after a successful read-back, and that every
 * failure leaves the original bytes and no temporary file behind.
 */
@ExtendWith(MockitoExtension.class)
class MetadataNormalizerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final LocalDateTime TARGET = LocalDateTime.of(2021, 6, 1, 10, 0, 0);

    @TempDir
    Path tempDir;

    @Mock
    private MetadataWriter videoWriter;

    private FakeMetadataWriter imageWriter;
    private MetadataNormalizer normalizer;

    @BeforeEach
    void setUp() {
        imageWriter = new FakeMetadataWriter("exiftool");
        normalizer = new MetadataNormalizer(tempDir, imageWriter, videoWriter, TIMEOUT, TIMEOUT, TIMEOUT);
    }

    /**
     * Verifies that the embedded date is replaced (sub-seconds dropped) and the pixel data kept.
     */
    @Test
    void testNormalize_RewritesDateInPlace() throws Exception {
        Path photo = MediaFixtures.write(tempDir.resolve("photo.jpg"), LocalDateTime.of(2010, 1, 1, 0, 0), "abc");

        normalizer.normalize(photo, TARGET.plusNanos(700_000_000));

        assertEquals(TARGET, MediaFixtures.readDate(photo));
        assertTrue(Files.readString(photo).contains("PIXELS=abc"));
        assertNoTemporaryFiles();
    }

    /**
     * Verifies that a tool failure leaves the file byte-for-byte unchanged.
     */
    @Test
    void testNormalize_ToolFailure_LeavesOriginalUntouched() throws Exception {
        Path broken = MediaFixtures.writeCorrupt(tempDir.resolve("broken.jpg"));
        byte[] before = Files.readAllBytes(broken);

        NormalizationException e = assertThrows(NormalizationException.class,
                () -> normalizer.normalize(broken, TARGET));

        assertEquals(Disposition.CORRUPTED, e.getCategory());
        assertArrayEquals(before, Files.readAllBytes(broken));
        assertNoTemporaryFiles();
    }

    /**
     * Verifies that a write the tool claims succeeded but cannot be read back is rejected.
     */
    @Test
    void testNormalize_ReadBackMismatch_IsCorrupted() throws Exception {
        Path clip = MediaFixtures.write(tempDir.resolve("clip.mov"), null, "frames");
        byte[] before = Files.readAllBytes(clip);
        doAnswer(invocation -> {
            Files.writeString(invocation.getArgument(1), "remuxed");
            return null;
        }).when(videoWriter).writeCaptureDate(any(Path.class), any(Path.class), any(LocalDateTime.class), any(Duration.class));
        when(videoWriter.readCaptureDate(any(Path.class), any(Duration.class))).thenReturn(TARGET.minusHours(2));

        NormalizationException e = assertThrows(NormalizationException.class,
                () -> normalizer.normalize(clip, TARGET));

        assertEquals(Disposition.CORRUPTED, e.getCategory());
        assertTrue(e.getMessage().contains("Verification failed"));
        assertArrayEquals(before, Files.readAllBytes(clip));
        assertNoTemporaryFiles();
    }

    @Test
    void testNormalize_EmptyOutput_IsCorrupted() throws Exception {
        Path clip = MediaFixtures.write(tempDir.resolve("clip.mp4"), null, "frames");
        doAnswer(invocation -> {
            Files.createFile(invocation.getArgument(1));
            return null;
        }).when(videoWriter).writeCaptureDate(any(Path.class), any(Path.class), any(LocalDateTime.class), any(Duration.class));

        NormalizationException e = assertThrows(NormalizationException.class,
                () -> normalizer.normalize(clip, TARGET));

        assertEquals(Disposition.CORRUPTED, e.getCategory());
        assertNoTemporaryFiles();
    }

    @Test
    void testNormalize_TimeoutCategoryIsPropagated() throws Exception {
        Path clip = MediaFixtures.write(tempDir.resolve("long.mkv"), null, "frames");
        doAnswer(invocation -> {
            throw new NormalizationException(Disposition.TIMEOUT, "ffmpeg timed out after 5s");
        }).when(videoWriter).writeCaptureDate(any(Path.class), any(Path.class), any(LocalDateTime.class), any(Duration.class));

        NormalizationException e = assertThrows(NormalizationException.class,
                () -> normalizer.normalize(clip, TARGET));

        assertEquals(Disposition.TIMEOUT, e.getCategory());
    }

    @Test
    void testNormalize_MissingFile_IsCorrupted() {
        NormalizationException e = assertThrows(NormalizationException.class,
                () -> normalizer.normalize(tempDir.resolve("gone.jpg"), TARGET));
        assertEquals(Disposition.CORRUPTED, e.getCategory());
    }

    /**
     * Verifies that RAW files and unsafe video containers are refused before any tool runs.
     */
    @Test
    void testCheckSupported_RejectsRawAndUnsafeContainers() throws Exception {
        assertEquals(MediaType.IMAGE, normalizer.checkSupported(Path.of("a.heic")));
        assertEquals(MediaType.VIDEO, normalizer.checkSupported(Path.of("a.mov")));

        for (String name : new String[]{"a.cr2", "a.avi", "a.mts", "a.txt"}) {
            NormalizationException e = assertThrows(NormalizationException.class,
                    () -> normalizer.checkSupported(Path.of(name)), name);
            assertEquals(Disposition.UNSUPPORTED_FORMAT, e.getCategory());
        }
        assertEquals(0, imageWriter.getWriteCount());
    }

    private void assertNoTemporaryFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().contains(".normalizing.")),
                    "Temporary file should be removed");
        }
    }
}
