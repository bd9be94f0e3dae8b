package com.synesis.compiler;

import com.synesis.loader.ast.IncludeNode;
import com.synesis.loader.ast.IncludeNode.IncludeType;
import com.synesis.loader.ast.ProjectNode;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Resolves INCLUDE paths relative to the project directory. Glob patterns are matched below the longest
 * pattern-free prefix and returned sorted, so the order files are read in does not depend on the file system.
 */
final class IncludeResolver {
    private static final Logger LOG = Logger.getLogger(IncludeResolver.class.getName());

    private final Path baseDir;

    IncludeResolver(Path baseDir) {
        this.baseDir = baseDir;
    }

    List<Path> resolve(ProjectNode project, IncludeType type) throws IOException {
        List<Path> paths = new ArrayList<>();
        for (IncludeNode include : project.getIncludes(type)) {
            paths.addAll(resolve(include));
        }
        return paths;
    }

    List<Path> resolve(IncludeNode include) throws IOException {
        String rawPath = include.getPath();
        if (!include.isGlob()) {
            return List.of(toPath(rawPath));
        }
        List<Path> matches = resolveGlob(rawPath);
        if (matches.isEmpty()) {
            LOG.warning(() -> include.getLocation() + ": include pattern matched no files: " + rawPath);
        }
        return matches;
    }

    /** The PROJECT's {@code TEMPLATE} path, else its first {@code INCLUDE TEMPLATE}. */
    static Optional<String> templatePath(ProjectNode project) {
        if (!project.getTemplatePath().isEmpty()) {
            return Optional.of(project.getTemplatePath());
        }
        List<IncludeNode> templateIncludes = project.getIncludes(IncludeType.TEMPLATE);
        if (templateIncludes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(templateIncludes.get(0).getPath());
    }

    Path toPath(String raw) {
        String system = convertSeparators(raw);
        if (system.isEmpty()) {
            return baseDir;
        }
        Path path = Path.of(system);
        if (!path.isAbsolute()) {
            path = baseDir.resolve(path);
        }
        return path.normalize();
    }

    private List<Path> resolveGlob(String rawPath) throws IOException {
        String normalized = rawPath.replace('\\', '/');
        int globIndex = firstGlobIndex(normalized);
        int split = normalized.lastIndexOf('/', globIndex) + 1;
        Path searchRoot = toPath(normalized.substring(0, split));
        if (!Files.isDirectory(searchRoot)) {
            return List.of();
        }
        PathMatcher matcher =
                searchRoot.getFileSystem().getPathMatcher("glob:" + convertSeparators(normalized.substring(split)));
        List<Path> matches = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(searchRoot)) {
            stream.filter(Files::isRegularFile)
                    .forEach(
                            candidate -> {
                                if (matcher.matches(searchRoot.relativize(candidate))) {
                                    matches.add(candidate.normalize());
                                }
                            });
        }
        Collections.sort(matches);
        return matches;
    }

    private static int firstGlobIndex(String value) {
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '*' || ch == '?' || ch == '[') {
                return i;
            }
        }
        return -1;
    }

    private static String convertSeparators(String path) {
        String separator = FileSystems.getDefault().getSeparator();
        String normalized = path.replace("\\", "/");
        if ("/".equals(separator)) {
            return normalized;
        }
        return normalized.replace("/", separator);
    }
}
