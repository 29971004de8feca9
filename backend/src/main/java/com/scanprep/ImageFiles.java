package com.scanprep;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovery of input images and mapping of inputs to output paths.
 */
public final class ImageFiles {

    public static final Set<String> EXTENSIONS = Set.of("png", "jpg", "jpeg", "tif", "tiff", "bmp", "gif");

    private ImageFiles() {}

    /**
     * All image files below {@code sourceRoot} in a stable order, skipping hidden files
     * and anything under {@code excludeDir} (the destination, when it is nested in the source).
     */
    public static List<Path> list(Path sourceRoot, Path excludeDir) throws IOException {
        Path exclude = excludeDir == null ? null : excludeDir.toAbsolutePath().normalize();
        try (Stream<Path> walk = Files.walk(sourceRoot)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(ImageFiles::isImage)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .filter(p -> exclude == null || !p.toAbsolutePath().normalize().startsWith(exclude))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public static boolean isImage(Path file) {
        return EXTENSIONS.contains(extension(file.getFileName().toString()));
    }

    /**
     * {@code destRoot/<relative dir of input>/<base name>.<format>}.
     */
    public static Path outputPath(Path sourceRoot, Path input, Path destRoot, String format) {
        Path relative = sourceRoot.toAbsolutePath().normalize().relativize(input.toAbsolutePath().normalize());
        String name = baseName(relative.getFileName().toString()) + "." + format;
        Path parent = relative.getParent();
        return parent == null ? destRoot.resolve(name) : destRoot.resolve(parent).resolve(name);
    }

    static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
