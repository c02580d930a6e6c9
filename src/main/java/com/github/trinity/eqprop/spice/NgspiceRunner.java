package com.github.trinity.eqprop.spice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs ngspice in batch mode on a netlist and returns the operating point.
 * <p>
 * Each run gets its own temporary directory holding the netlist, the bundled
 * op-amp library, the raw output and the log; the directory is removed afterwards.
 * </p>
 *
 * @author Sean Phillips
 */
public class NgspiceRunner {
    private static final Logger LOG = LoggerFactory.getLogger(NgspiceRunner.class);

    private final String executable;
    private final long timeoutSeconds;
    private final RawFileParser parser = new RawFileParser();

    public NgspiceRunner() {
        this("ngspice", 30);
    }

    public NgspiceRunner(String executable, long timeoutSeconds) {
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * @return true when {@code ngspice --version} runs and exits 0 within five seconds
     */
    public boolean isAvailable() {
        try {
            Process process = new ProcessBuilder(executable, "--version")
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException ex) {
            LOG.debug("{} not available: {}", executable, ex.getMessage());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Simulates one netlist.
     *
     * @param netlist netlist text; may {@code .include} the bundled behavioral library by file name
     * @return node voltages keyed by raw-file variable name, or empty if ngspice failed
     * @throws UncheckedIOException if the working files cannot be written or read
     */
    public Optional<Map<String, Double>> run(String netlist) {
        Path dir = null;
        try {
            dir = Files.createTempDirectory("eqprop-spice");
            Path circuit = dir.resolve("circuit.cir");
            Path raw = dir.resolve("output.raw");
            Path log = dir.resolve("output.log");
            Files.writeString(circuit, netlist, StandardCharsets.US_ASCII);
            ResourceUtils.copyResource(ResourceUtils.BEHAVIORAL_LIB, dir);
            LOG.debug("Running {} on netlist:\n{}", executable, netlist);

            Process process = new ProcessBuilder(executable, "-b", "-r", raw.toString(), "-o", log.toString(),
                circuit.toString())
                .directory(dir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                LOG.warn("{} timed out after {} s", executable, timeoutSeconds);
                return Optional.empty();
            }
            if (process.exitValue() != 0 || !Files.exists(raw)) {
                LOG.warn("{} exited with {}: {}", executable, process.exitValue(),
                    Files.exists(log) ? Files.readString(log, StandardCharsets.ISO_8859_1).strip() : "no log");
                return Optional.empty();
            }
            return parser.parse(raw);
        } catch (IOException ex) {
            throw new UncheckedIOException("ngspice run failed", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for {}", executable);
            return Optional.empty();
        } finally {
            ResourceUtils.deleteQuietly(dir);
        }
    }
}
