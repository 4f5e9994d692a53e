package com.subphot.runner;

import com.subphot.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

/**
 * Writes the registration grid used by both convolution transforms: the astrometric reference's
 * detections binned into a coarse grid over the detector, one {@code x y weight} line per cell.
 */
public final class RegistrationGridWriter {
    private static final Logger LOG = LogManager.getLogger(RegistrationGridWriter.class);
    private static final int X_COL = 1;
    private static final int Y_COL = 2;

    private final int gridX;
    private final int gridY;
    private final double xSize;
    private final double ySize;
    private final double weight;

    public RegistrationGridWriter(Config config) {
        this.gridX = Math.max(1, config.getInt("registration.grid_x", 30));
        this.gridY = Math.max(1, config.getInt("registration.grid_y", 30));
        this.xSize = config.getDouble("registration.ccd_xsize", 2048.0);
        this.ySize = config.getDouble("registration.ccd_ysize", 2048.0);
        this.weight = config.getDouble("registration.weight", 20.0);
    }

    public Path write(Path sourceList, Path output) throws IOException {
        double[] cellX = new double[gridX * gridY];
        double[] cellY = new double[gridX * gridY];
        Arrays.fill(cellX, -1.0);
        Arrays.fill(cellY, -1.0);

        int placed = 0;
        try (BufferedReader reader = Files.newBufferedReader(sourceList, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] tokens = trimmed.split("\\s+");
                if (tokens.length <= Y_COL) {
                    continue;
                }
                double x;
                double y;
                try {
                    x = Double.parseDouble(tokens[X_COL]);
                    y = Double.parseDouble(tokens[Y_COL]);
                } catch (NumberFormatException e) {
                    continue;
                }
                int bx = (int) (x * gridX / xSize);
                int by = (int) (y * gridY / ySize);
                if (bx < 0 || bx >= gridX || by < 0 || by >= gridY) {
                    continue;
                }
                int cell = by * gridX + bx;
                cellX[cell] = x;
                cellY[cell] = y;
                placed++;
            }
        }

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.US_ASCII)) {
            for (int i = 0; i < cellX.length; i++) {
                writer.write(String.format(Locale.ROOT, "%8.0f %8.0f %8.0f", cellX[i], cellY[i], weight));
                writer.newLine();
            }
        }
        LOG.info("registration grid {}x{} written to {} from {} detections", gridX, gridY, output, placed);
        return output;
    }
}
