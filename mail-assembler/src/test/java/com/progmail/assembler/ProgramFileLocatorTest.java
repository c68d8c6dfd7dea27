package com.progmail.assembler;

import com.progmail.util.RunLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramFileLocatorTest {

    @TempDir
    Path tempDir;

    private ProgramFileLocator locator;

    @BeforeEach
    public void setup() throws IOException {
        Files.createDirectories(tempDir.resolve("reports"));
        Files.createDirectories(tempDir.resolve("defaults"));
        locator = new ProgramFileLocator(tempDir, new RunLog());
    }

    @Test
    public void testPreferredDirectoryFirst() throws IOException {
        Files.writeString(tempDir.resolve("reports/a.xml"), "reports");
        Files.writeString(tempDir.resolve("defaults/a.xml"), "defaults");
        assertEquals(tempDir.resolve("reports/a.xml"), locator.locate("a.xml", "reports", "defaults"));
    }

    @Test
    public void testFallsBackToDefaultThenWorkingDirectory() throws IOException {
        Files.writeString(tempDir.resolve("defaults/b.xml"), "defaults");
        Files.writeString(tempDir.resolve("c.xml"), "cwd");
        assertEquals(tempDir.resolve("defaults/b.xml"), locator.locate("b.xml", "reports", "defaults"));
        assertEquals(tempDir.resolve("c.xml"), locator.locate("c.xml", "reports", "defaults"));
    }

    @Test
    public void testMissingFile() {
        assertNull(locator.locate("missing.xml", "reports", "."));
        assertNull(locator.locate(null, "reports", "."));
        AssemblyException e = assertThrows(AssemblyException.class,
                () -> locator.require("missing.xml", "reports", "."));
        assertEquals(ExitStatus.MISSING_INPUT, e.getStatus());
    }
}
