package com.subphot.metrics;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tabular photometry: whitespace separated, magnitude/error/flag in columns 12/13/14, good when flag is {@code G}.
 */
public final class TextPhotometryReader implements PhotometryReader {
    private static final int MAG_COL = 12;
    private static final int ERR_COL = 13;
    private static final int FLAG_COL = 14;
    private static final String GOOD_FLAG = "G";

    @Override
    public PhotometryTable read(Path photometryFile) throws IOException {
        List<double[]> rows = new ArrayList<>();
        List<Boolean> flags = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(photometryFile, StandardCharsets.ISO_8859_1)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] tokens = trimmed.split("\\s+");
                if (tokens.length <= FLAG_COL) {
                    throw new MetricParseException(photometryFile, lineNo,
                            "expected at least " + (FLAG_COL + 1) + " columns, got " + tokens.length);
                }
                rows.add(new double[]{
                        Columns.parseOrNaN(tokens[MAG_COL]),
                        Columns.parseOrNaN(tokens[ERR_COL])
                });
                flags.add(GOOD_FLAG.equals(tokens[FLAG_COL]));
            }
        }
        double[] mags = new double[rows.size()];
        double[] errs = new double[rows.size()];
        boolean[] good = new boolean[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            mags[i] = rows.get(i)[0];
            errs[i] = rows.get(i)[1];
            good[i] = flags.get(i);
        }
        return new PhotometryTable(mags, errs, good);
    }
}
