package it.unimib.datai.autolayer.core.layer;

import it.unimib.datai.autolayer.common.model.RuntimeFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Lays out the folder of a dependency layer: {@code buildDir/layerLogicalId/<runtime subfolder>/...}.
 * The folder is always rebuilt from scratch.
 */
public final class LayerFolderBuilder {
    private static final Logger log = LoggerFactory.getLogger(LayerFolderBuilder.class);

    public static final String README_FILE = "AUTOLAYER_README";

    private static final Set<PosixFilePermission> BUILD_DIR_PERMISSIONS = PosixFilePermissions.fromString("rwxr-xr-x");

    private LayerFolderBuilder() {}

    /**
     * Builds the layer folder and returns its root.
     *
     * @throws InvalidRuntimeDefinitionException if {@code runtime} is missing
     * @throws UncheckedIOException              if the folder can't be built; no partial folder is left behind
     */
    public static Path build(
            Path buildDir,
            Path dependenciesDir,
            String layerLogicalId,
            String functionLogicalId,
            String runtime
    ) {
        if (runtime == null || runtime.isBlank()) {
            throw new InvalidRuntimeDefinitionException(functionLogicalId);
        }

        Path layerRoot = buildDir.resolve(layerLogicalId);
        Path contents = layerRoot.resolve(RuntimeFamily.layerSubfolderFor(runtime));
        try {
            deleteRecursively(layerRoot);
            createDirectories(contents);
            if (dependenciesDir != null && Files.isDirectory(dependenciesDir)) {
                copyTree(dependenciesDir, contents);
            } else {
                log.debug("Dependencies folder {} of function {} does not exist, creating empty layer", dependenciesDir, functionLogicalId);
            }
            writeReadme(layerRoot, functionLogicalId);
        } catch (IOException e) {
            discard(layerRoot, e);
            throw new UncheckedIOException("Failed to build layer folder: " + layerRoot, e);
        } catch (RuntimeException e) {
            discard(layerRoot, e);
            throw e;
        }

        log.info("Built dependency layer folder {} for function {}", layerRoot, functionLogicalId);
        return layerRoot;
    }

    private static void writeReadme(Path layerRoot, String functionLogicalId) throws IOException {
        Files.writeString(layerRoot.resolve(README_FILE),
                "This layer contains dependencies of function " + functionLogicalId
                        + " and was automatically added by autolayer.",
                StandardCharsets.UTF_8);
    }

    private static void createDirectories(Path dir) throws IOException {
        if (dir.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.createDirectories(dir, PosixFilePermissions.asFileAttribute(BUILD_DIR_PERMISSIONS));
        } else {
            Files.createDirectories(dir);
        }
    }

    private static void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                createDirectories(target.resolve(source.relativize(dir)));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file)),
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        List<Path> deepestFirst;
        try (Stream<Path> paths = Files.walk(root)) {
            deepestFirst = paths.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path p : deepestFirst) {
            Files.delete(p);
        }
    }

    private static void discard(Path layerRoot, Exception cause) {
        try {
            deleteRecursively(layerRoot);
        } catch (IOException cleanup) {
            cause.addSuppressed(cleanup);
        }
    }
}
