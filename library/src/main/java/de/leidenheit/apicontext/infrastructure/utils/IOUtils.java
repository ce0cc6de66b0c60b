package de.leidenheit.apicontext.infrastructure.utils;

import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class IOUtils {

    public static boolean isReadableFile(final String relativeOrAbsolutePath) {
        try {
            var path = resolveAgainstWorkingDir(relativeOrAbsolutePath);
            return Files.isRegularFile(path) && Files.isReadable(path);
        } catch (InvalidPathException e) {
            return false;
        }
    }

    /**
     * Joins a directory and a relative path after stripping leading and trailing slashes from the latter,
     * e.g. {@code ("schemas", "/person.json")} becomes {@code schemas/person.json}.
     */
    public static String joinRelative(final String directory, final String relativePath) {
        return "%s/%s".formatted(directory, StringUtils.strip(relativePath, "/"));
    }

    private static Path resolveAgainstWorkingDir(final String relativeOrAbsolutePath) {
        var path = Paths.get(relativeOrAbsolutePath);
        if (path.isAbsolute()) {
            return path;
        }
        return Paths.get(retrieveWorkingDir())
                .resolve(path)
                .normalize(); // removes . and ..
    }

    private static String retrieveWorkingDir() {
        return System.getProperty("user.dir");
    }

    private IOUtils() {}
}
