package com.mediavault.service.normalize;

import com.mediavault.model.Disposition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExternalToolRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void testMissingExecutable_IsMissingTool() {
        ExternalToolRunner runner = new ExternalToolRunner(tempDir);

        NormalizationException e = assertThrows(NormalizationException.class,
                () -> runner.run(List.of("mediavault-no-such-tool-xyz", "-ver"), Duration.ofSeconds(5)));

        assertEquals(Disposition.MISSING_TOOL, e.getCategory());
        assertFalse(runner.isInvocable(List.of("mediavault-no-such-tool-xyz"), Duration.ofSeconds(5)));
    }
}
