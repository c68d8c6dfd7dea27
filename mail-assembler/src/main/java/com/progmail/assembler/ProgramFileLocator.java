package com.progmail.assembler;

import com.progmail.util.RunLog;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds program report files: first in the preferred directory, then in the
 * default directory, then in the working directory.
 */
public class ProgramFileLocator {

    private final Path workingDirectory;
    private final RunLog log;

    public ProgramFileLocator(Path workingDirectory, RunLog log) {
        this.workingDirectory = workingDirectory;
        this.log = log;
    }

    /**
     * @return the first existing candidate, or null (logged) when there is none
     */
    public Path locate(String fileName, String preferredDir, String defaultDir) {
        if (fileName == null || fileName.isBlank()) {
            log.fatal("No file name given to look for (preferred directory '" + preferredDir + "')");
            return null;
        }

        List<Path> checked = new ArrayList<>();
        for (String dir : new String[] {preferredDir, defaultDir}) {
            if (dir == null || dir.isBlank()) {
                continue;
            }
            Path candidate = resolve(dir).resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                log.debug("Found '" + fileName + "' at " + candidate);
                return candidate;
            }
            checked.add(candidate.getParent());
        }

        Path candidate = workingDirectory.resolve(fileName);
        if (Files.isRegularFile(candidate)) {
            return candidate;
        }
        checked.add(workingDirectory);

        log.fatal("Can't find '" + fileName + "': checked " + describe(checked));
        return null;
    }

    /**
     * Same as {@link #locate} but fatal when nothing is found.
     */
    public Path require(String fileName, String preferredDir, String defaultDir) throws AssemblyException {
        Path path = locate(fileName, preferredDir, defaultDir);
        if (path == null) {
            throw new AssemblyException(ExitStatus.MISSING_INPUT, "Required file not found: " + fileName);
        }
        return path;
    }

    Path resolve(String dir) {
        return workingDirectory.resolve(dir).normalize();
    }

    private static String describe(List<Path> checked) {
        List<String> distinct = new ArrayList<>();
        for (Path p : checked) {
            String s = "'" + p + "'";
            if (!distinct.contains(s)) {
                distinct.add(s);
            }
        }
        return String.join(", ", distinct);
    }
}
