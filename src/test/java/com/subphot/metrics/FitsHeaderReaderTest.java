package com.subphot.metrics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class FitsHeaderReaderTest {

    @TempDir
    Path dir;

    private static String card(String keyword, String value) {
        return pad(String.format("%-8s= %20s", keyword, value));
    }

    private static String pad(String card) {
        StringBuilder sb = new StringBuilder(card);
        while (sb.length() < 80) {
            sb.append(' ');
        }
        return sb.toString();
    }

    private Path writeHeaderOnlyFits(String... cards) throws Exception {
        StringBuilder block = new StringBuilder();
        for (String c : cards) {
            block.append(c);
        }
        block.append(pad("END"));
        while (block.length() % 2880 != 0) {
            block.append(' ');
        }
        Path file = dir.resolve("1-000042_7.fits");
        Files.write(file, block.toString().getBytes(StandardCharsets.US_ASCII));
        return file;
    }

    @Test
    void readShouldReturnNumericKeywordsPresentInHeader() throws Exception {
        Path frame = writeHeaderOnlyFits(
                card("SIMPLE", "T"),
                card("BITPIX", "8"),
                card("NAXIS", "0"),
                card("HA", "-1.25"),
                card("EXPTIME", "30.0"),
                card("GAIN", "2.5")
        );

        Map<String, Double> header = new FitsHeaderReader().read(frame, List.of("HA", "EXPTIME", "GAIN", "MOONPH"));

        assertEquals(-1.25, header.get("HA"), 1e-12);
        assertEquals(30.0, header.get("EXPTIME"), 1e-12);
        assertEquals(2.5, header.get("GAIN"), 1e-12);
        assertFalse(header.containsKey("MOONPH"));
    }
}
