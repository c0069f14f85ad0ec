package com.vidnyan.lintnorm.domain.path;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rewrites paths reported by linters as paths relative to the repository root.
 * <p>
 * Tools report absolute paths, paths with {@code ./} or {@code ../} segments,
 * or paths that are already relative. All of them end up in one form:
 * relative to the working root, redundant segments collapsed, {@code /} as
 * separator. Nothing is read from disk, so paths do not need to exist.
 * <p>
 * Reported paths are handled as plain strings and never turned into
 * {@link Path} objects, so any file name a tool prints is accepted whatever
 * the platform file-name encoding is.
 */
public final class PathNormalizer {

    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:/.*");

    private final Path workingRoot;
    private final List<String> rootSegments;

    public PathNormalizer(Path workingRoot) {
        Objects.requireNonNull(workingRoot, "workingRoot");
        this.workingRoot = workingRoot.toAbsolutePath().normalize();
        this.rootSegments = collapse(separatorsToSlash(this.workingRoot.toString()));
    }

    /**
     * Normalizer rooted at the directory the process was started from.
     */
    public static PathNormalizer forCurrentDirectory() {
        return new PathNormalizer(Path.of(""));
    }

    public static String normalize(String rawPath, Path workingRoot) {
        return new PathNormalizer(workingRoot).normalize(rawPath);
    }

    public String normalize(String rawPath) {
        Objects.requireNonNull(rawPath, "rawPath");
        String raw = separatorsToSlash(rawPath.trim());

        List<String> absolute = isAbsolute(raw)
                ? collapse(raw)
                : collapse(String.join("/", rootSegments) + "/" + raw);

        int common = 0;
        while (common < rootSegments.size() && common < absolute.size()
                && rootSegments.get(common).equals(absolute.get(common))) {
            common++;
        }

        List<String> relative = new ArrayList<>();
        for (int i = common; i < rootSegments.size(); i++) {
            relative.add("..");
        }
        relative.addAll(absolute.subList(common, absolute.size()));
        return relative.isEmpty() ? "." : String.join("/", relative);
    }

    public Path workingRoot() {
        return workingRoot;
    }

    private static boolean isAbsolute(String path) {
        return path.startsWith("/") || DRIVE_PREFIX.matcher(path).matches();
    }

    /**
     * Segments of an absolute path with empty, {@code .} and {@code ..} segments resolved.
     * {@code ..} above the top level is dropped.
     */
    private static List<String> collapse(String absolutePath) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : absolutePath.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        return new ArrayList<>(segments);
    }

    private static String separatorsToSlash(String path) {
        return File.separatorChar == '/' ? path : path.replace(File.separatorChar, '/');
    }
}
