package com.github.trinity.eqprop.spice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Access to files bundled on the classpath.
 *
 * @author Sean Phillips
 */
public enum ResourceUtils {
    INSTANCE;
    private static final Logger LOG = LoggerFactory.getLogger(ResourceUtils.class);

    /** Op-amp subcircuits included by full-circuit netlists. */
    public static final String BEHAVIORAL_LIB = "behavioral.lib";

    /**
     * Copies a bundled resource into a directory.
     *
     * @param name      file name under {@code /spice/} on the classpath
     * @param directory target directory
     * @return the written file
     * @throws IOException if the resource is missing or cannot be written
     */
    public static Path copyResource(String name, Path directory) throws IOException {
        try (InputStream in = ResourceUtils.class.getResourceAsStream("/spice/" + name)) {
            if (in == null) {
                throw new IOException("Missing classpath resource /spice/" + name);
            }
            Path target = directory.resolve(name);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            LOG.debug("Copied {} to {}", name, target);
            return target;
        }
    }

    /**
     * Recursively deletes a directory, logging anything that cannot be removed.
     */
    public static void deleteQuietly(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException ex) {
                    LOG.warn("Could not delete {}: {}", p, ex.getMessage());
                }
            });
        } catch (IOException ex) {
            LOG.warn("Could not clean up {}: {}", directory, ex.getMessage());
        }
    }
}
