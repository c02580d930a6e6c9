package com.github.trinity.eqprop.spice;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the first data point of an ngspice {@code .raw} file.
 * <p>
 * Binary files carry an ASCII header ending in {@code Binary:} followed by
 * little-endian doubles, one per variable. Files without that marker are read as
 * ASCII, where each value follows the {@code Values:} line.
 * </p>
 *
 * @author Sean Phillips
 */
public class RawFileParser {

    private static final byte[] BINARY_MARKER = "Binary:\n".getBytes(StandardCharsets.US_ASCII);

    /**
     * @param rawFile ngspice output
     * @return variable name to value, or empty when the file holds no complete point
     * @throws IOException if the file cannot be read
     */
    public Optional<Map<String, Double>> parse(Path rawFile) throws IOException {
        byte[] content = Files.readAllBytes(rawFile);
        int marker = indexOf(content, BINARY_MARKER);
        if (marker < 0) {
            return parseAscii(new String(content, StandardCharsets.US_ASCII));
        }

        List<String> variables = variables(new String(content, 0, marker, StandardCharsets.US_ASCII));
        int offset = marker + BINARY_MARKER.length;
        if (variables.isEmpty() || content.length - offset < variables.size() * Double.BYTES) {
            return Optional.empty();
        }
        ByteBuffer data = ByteBuffer.wrap(content, offset, variables.size() * Double.BYTES)
            .order(ByteOrder.LITTLE_ENDIAN);
        Map<String, Double> values = new LinkedHashMap<>();
        for (String name : variables) {
            values.put(name, data.getDouble());
        }
        return Optional.of(values);
    }

    Optional<Map<String, Double>> parseAscii(String content) {
        List<String> variables = new ArrayList<>();
        Map<String, Double> values = new LinkedHashMap<>();
        boolean inVariables = false;
        boolean inValues = false;
        for (String raw : content.split("\n")) {
            String line = raw.strip();
            if (line.startsWith("Variables:")) {
                inVariables = true;
                continue;
            }
            if (line.startsWith("Values:")) {
                inVariables = false;
                inValues = true;
                continue;
            }
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (inVariables && parts.length >= 3) {
                variables.add(parts[1]);
            } else if (inValues) {
                // first value of a point is prefixed by the point index
                String token = parts.length == 2 ? parts[1] : parts[0];
                if (values.size() < variables.size()) {
                    try {
                        values.put(variables.get(values.size()), parseValue(token));
                    } catch (NumberFormatException ex) {
                        throw new IllegalStateException("Malformed value in raw file: " + line, ex);
                    }
                }
            }
        }
        return values.isEmpty() ? Optional.empty() : Optional.of(values);
    }

    private static List<String> variables(String header) {
        List<String> variables = new ArrayList<>();
        boolean inVariables = false;
        for (String raw : header.split("\n")) {
            String line = raw.strip();
            if (line.startsWith("Variables:")) {
                inVariables = true;
                continue;
            }
            if (line.startsWith("Values:") || line.startsWith("Binary:")) {
                break;
            }
            String[] parts = line.split("\\s+");
            if (inVariables && parts.length >= 3) {
                variables.add(parts[1]);
            }
        }
        return variables;
    }

    // complex values are written as "re,im"
    private static double parseValue(String token) {
        int comma = token.indexOf(',');
        return Double.parseDouble(comma < 0 ? token : token.substring(0, comma));
    }

    private static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
