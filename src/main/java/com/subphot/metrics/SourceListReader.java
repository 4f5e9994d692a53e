package com.subphot.metrics;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads detection lists: background in column 3, S in column 5, D in column 6 (zero based).
 */
public final class SourceListReader {
    private static final int BACKGROUND_COL = 3;
    private static final int S_COL = 5;
    private static final int D_COL = 6;

    public SourceListTable read(Path sourceList) throws IOException {
        List<double[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(sourceList, StandardCharsets.ISO_8859_1)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] tokens = trimmed.split("\\s+");
                if (tokens.length <= D_COL) {
                    throw new MetricParseException(sourceList, lineNo,
                            "expected at least " + (D_COL + 1) + " columns, got " + tokens.length);
                }
                rows.add(new double[]{
                        Columns.parseOrNaN(tokens[BACKGROUND_COL]),
                        Columns.parseOrNaN(tokens[S_COL]),
                        Columns.parseOrNaN(tokens[D_COL])
                });
            }
        }
        double[] bg = new double[rows.size()];
        double[] s = new double[rows.size()];
        double[] d = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            bg[i] = rows.get(i)[0];
            s[i] = rows.get(i)[1];
            d[i] = rows.get(i)[2];
        }
        return new SourceListTable(bg, s, d);
    }
}
