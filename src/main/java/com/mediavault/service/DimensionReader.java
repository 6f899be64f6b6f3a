package com.mediavault.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.mediavault.model.MediaType;
import com.mediavault.util.LibraryLogger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Best-effort pixel dimensions of a media file. Unknown dimensions are null, never an error.
 */
public class DimensionReader {

    private final Path libraryRoot;

    public DimensionReader(Path libraryRoot) {
        this.libraryRoot = libraryRoot;
    }

    /**
     * @return {width, height}, each possibly null.
     */
    public Integer[] read(Path file, MediaType type) {
        if (type == MediaType.IMAGE) {
            Integer[] fromImageIo = readWithImageIo(file);
            if (fromImageIo != null) {
                return fromImageIo;
            }
        }
        return readFromMetadata(file);
    }

    private Integer[] readWithImageIo(Path file) {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return new Integer[]{reader.getWidth(0), reader.getHeight(0)};
            } finally {
                reader.dispose();
            }
        } catch (Exception e) {
            LibraryLogger.logRecurringError(libraryRoot, "DimensionReader", "ImageIO could not read dimensions", e);
            return null;
        }
    }

    // Video containers and formats ImageIO lacks (HEIC, AVIF) expose width/height tags
    private Integer[] readFromMetadata(Path file) {
        Integer width = null;
        Integer height = null;
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());
            for (Directory directory : metadata.getDirectories()) {
                for (Tag tag : directory.getTags()) {
                    String name = tag.getTagName();
                    if (width == null && ("Width".equals(name) || "Image Width".equals(name))) {
                        width = directory.getInteger(tag.getTagType());
                    } else if (height == null && ("Height".equals(name) || "Image Height".equals(name))) {
                        height = directory.getInteger(tag.getTagType());
                    }
                }
                if (width != null && height != null) {
                    break;
                }
            }
        } catch (Exception e) {
            LibraryLogger.logRecurringError(libraryRoot, "DimensionReader", "Failed to read dimensions from metadata", e);
        }
        return new Integer[]{width, height};
    }
}
