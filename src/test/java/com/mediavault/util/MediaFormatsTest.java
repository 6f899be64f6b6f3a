package com.mediavault.util;

import com.mediavault.model.MediaType;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MediaFormatsTest {

    @Test
    void testTypeOf() {
        assertEquals(MediaType.IMAGE, MediaFormats.typeOf(Path.of("a.JPG")));
        assertEquals(MediaType.IMAGE, MediaFormats.typeOf("heic"));
        assertEquals(MediaType.VIDEO, MediaFormats.typeOf(Path.of("clip.mp4")));
        assertNull(MediaFormats.typeOf(Path.of("notes.txt")));
    }

    @Test
    void testRawCountsAsImageMedia() {
        assertTrue(MediaFormats.isRaw(Path.of("DSC_0001.NEF")));
        assertTrue(MediaFormats.isMedia(Path.of("DSC_0001.NEF")));
        assertEquals(MediaType.IMAGE, MediaFormats.typeOf("cr2"));
        assertFalse(MediaFormats.isRaw(Path.of("photo.jpg")));
    }

    @Test
    void testUnsupportedVideoContainers() {
        assertTrue(MediaFormats.isUnsupportedVideo(Path.of("old.avi")));
        assertTrue(MediaFormats.isUnsupportedVideo(Path.of("dvd.VOB")));
        assertFalse(MediaFormats.isUnsupportedVideo(Path.of("phone.mov")));
    }
}
