package com.wobble.dispatch.cli;

import com.wobble.output.file.FileFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class LogFileNamingTest {

    @Test
    void namesCarryTimestampAndExtension() {
        LocalDateTime now = LocalDateTime.of(2026, 3, 4, 5, 6, 7);

        assertEquals(Path.of("/tmp/wobble_results_20260304_050607.txt"),
                LogFileNaming.autoName(Path.of("/tmp"), FileFormat.TXT, now));
        assertEquals(Path.of("/tmp/wobble_results_20260304_050607.json"),
                LogFileNaming.autoName(Path.of("/tmp"), FileFormat.JSON, now));
    }
}
