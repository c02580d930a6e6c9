package com.github.trinity.eqprop.spice;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class RawFileParserTest {

    private static final String HEADER = "Title: * Auto-generated EqProp network\n"
        + "Date: Mon Oct 19 10:00:00  2026\n"
        + "Plotname: Operating Point\n"
        + "Flags: real\n"
        + "No. Variables: 3\n"
        + "No. Points: 1\n"
        + "Variables:\n"
        + "\t0\tv(h1)\tvoltage\n"
        + "\t1\tv(h2)\tvoltage\n"
        + "\t2\ti(v_x1)\tcurrent\n";

    private final RawFileParser parser = new RawFileParser();

    @TempDir
    Path dir;

    @Test
    public void testBinaryFile() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write((HEADER + "Binary:\n").getBytes(StandardCharsets.US_ASCII));
        ByteBuffer data = ByteBuffer.allocate(24).order(ByteOrder.LITTLE_ENDIAN);
        data.putDouble(2.70137).putDouble(2.29863).putDouble(-1.5e-5);
        out.write(data.array());
        Path raw = dir.resolve("binary.raw");
        Files.write(raw, out.toByteArray());

        Map<String, Double> values = parser.parse(raw).orElseThrow();
        assertEquals(3, values.size());
        assertEquals(2.70137, values.get("v(h1)"), 0.0);
        assertEquals(2.29863, values.get("v(h2)"), 0.0);
        assertEquals(-1.5e-5, values.get("i(v_x1)"), 0.0);
    }

    @Test
    public void testTruncatedBinaryIsEmpty() throws Exception {
        Path raw = dir.resolve("short.raw");
        byte[] header = (HEADER + "Binary:\n").getBytes(StandardCharsets.US_ASCII);
        byte[] content = new byte[header.length + 8];
        System.arraycopy(header, 0, content, 0, header.length);
        Files.write(raw, content);
        assertEquals(Optional.empty(), parser.parse(raw));
    }

    @Test
    public void testAsciiFile() throws Exception {
        Path raw = dir.resolve("ascii.raw");
        Files.writeString(raw, HEADER + "Values:\n 0\t2.500000e+00\n\t2.600000e+00\n\t-1.000000e-03\n\n",
            StandardCharsets.US_ASCII);
        Map<String, Double> values = parser.parse(raw).orElseThrow();
        assertEquals(2.5, values.get("v(h1)"), 0.0);
        assertEquals(2.6, values.get("v(h2)"), 0.0);
        assertEquals(-1e-3, values.get("i(v_x1)"), 0.0);
    }

    @Test
    public void testAsciiWithoutValuesIsEmpty() throws Exception {
        Path raw = dir.resolve("empty.raw");
        Files.writeString(raw, HEADER, StandardCharsets.US_ASCII);
        assertTrue(parser.parse(raw).isEmpty());
    }
}
