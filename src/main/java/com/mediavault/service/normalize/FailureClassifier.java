package com.mediavault.service.normalize;

import com.mediavault.model.Disposition;

import java.util.Locale;

/**
 * Maps the diagnostic text of a failed tool call to a category.
 * Only used at the subprocess boundary, where the tools report errors as free text.
 */
public class FailureClassifier {

    private FailureClassifier() {
    }

    public static Disposition classify(String diagnostic) {
        String text = diagnostic == null ? "" : diagnostic.toLowerCase(Locale.ROOT);

        if (text.contains("timeout") || text.contains("timed out")) {
            return Disposition.TIMEOUT;
        }
        if (text.contains("not a valid") || text.contains("corrupt") || text.contains("invalid data")
                || text.contains("moov atom") || text.contains("file format error")
                || text.contains("end of file") || text.contains("truncated")) {
            return Disposition.CORRUPTED;
        }
        if ((text.contains("not found") || text.contains("no such file"))
                && (text.contains("exiftool") || text.contains("ffmpeg") || text.contains("ffprobe"))) {
            return Disposition.MISSING_TOOL;
        }
        if (text.contains("permission") || text.contains("denied") || text.contains("read-only")) {
            return Disposition.PERMISSION_DENIED;
        }
        // Includes "can't currently write" and "not yet supported" from exiftool
        return Disposition.UNSUPPORTED_FORMAT;
    }
}
