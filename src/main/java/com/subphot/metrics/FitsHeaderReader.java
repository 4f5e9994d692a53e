package com.subphot.metrics;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * FITS header keywords via nom-tam-fits. Every HDU is scanned so that tile-compressed frames, whose
 * observing keywords live in the first extension, resolve the same way as plain images.
 */
public final class FitsHeaderReader implements FrameHeaderReader {

    @Override
    public Map<String, Double> read(Path frame, Collection<String> keywords) throws IOException {
        Map<String, Double> out = new LinkedHashMap<>();
        try (Fits fits = new Fits(frame.toFile())) {
            BasicHDU<?> hdu;
            while (out.size() < keywords.size() && (hdu = fits.readHDU()) != null) {
                Header header = hdu.getHeader();
                for (String keyword : keywords) {
                    if (out.containsKey(keyword) || !header.containsKey(keyword)) {
                        continue;
                    }
                    HeaderCard card = header.findCard(keyword);
                    double value = card == null ? Double.NaN : parse(card.getValue());
                    if (Double.isFinite(value)) {
                        out.put(keyword, value);
                    }
                }
            }
        } catch (FitsException e) {
            throw new IOException("cannot read FITS header of " + frame + ": " + e.getMessage(), e);
        }
        return out;
    }

    private static double parse(String raw) {
        if (raw == null) {
            return Double.NaN;
        }
        String text = raw.trim();
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return Columns.parseOrNaN(text);
    }
}
