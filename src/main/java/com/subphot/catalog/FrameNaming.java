package com.subphot.catalog;

import java.nio.file.Path;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File-name conventions shared by every stage: companion base names and the names of derived artifacts.
 */
public final class FrameNaming {
    /** station id, frame number, CCD number, e.g. {@code 1-377741e_5}. */
    private static final Pattern FRAME_PATTERN = Pattern.compile("(\\d)-(\\d{6}\\w?)_(\\d)");
    private static final String REGISTERED_SUFFIX = "-xtrns";

    private FrameNaming() {
    }

    /**
     * File name without {@code .fits.fz}, {@code .fits} or {@code .fz} and without a trailing {@code -xtrns}.
     */
    public static String baseName(Path frame) {
        String name = frame.getFileName().toString();
        name = stripSuffix(name, ".fits.fz");
        name = stripSuffix(name, ".fits");
        name = stripSuffix(name, ".fz");
        return stripSuffix(name, REGISTERED_SUFFIX);
    }

    public static boolean isRegistered(Path frame) {
        String name = frame.getFileName().toString();
        name = stripSuffix(stripSuffix(name, ".fits.fz"), ".fits");
        return name.endsWith(REGISTERED_SUFFIX);
    }

    public static Path sourceList(Path dir, Path frame, String extension) {
        return dir.resolve(baseName(frame) + extension);
    }

    public static Path photometry(Path dir, Path frame, String extension) {
        return dir.resolve(baseName(frame) + extension);
    }

    public static Path xysdk(Path dir, Path frame) {
        return dir.resolve(baseName(frame) + ".xysdk");
    }

    public static Path itrans(Path dir, Path frame) {
        return dir.resolve(baseName(frame) + ".itrans");
    }

    public static Path registered(Path dir, Path frame) {
        return dir.resolve(baseName(frame) + REGISTERED_SUFFIX + ".fits");
    }

    public static Path convolvedReference(Path dir, Path registeredFrame) {
        return dir.resolve("PHOTREF-" + registeredFrame.getFileName());
    }

    public static Path subtracted(Path dir, Path registeredFrame) {
        return dir.resolve("subtracted-" + registeredFrame.getFileName());
    }

    public static Path kernel(Path dir, Path registeredFrame) {
        return dir.resolve(registeredFrame.getFileName() + "-kernel");
    }

    public static Path iphot(Path dir, Path frame) {
        return dir.resolve(baseName(frame) + ".iphot");
    }

    public static Path rawPhotometry(Path combinedReference) {
        Path dir = combinedReference.toAbsolutePath().getParent();
        return dir.resolve(baseName(combinedReference) + ".cmrawphot");
    }

    /**
     * CCD number encoded in a HAT-style frame name, if any.
     */
    public static OptionalInt ccdNumber(String fileName) {
        if (fileName == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = FRAME_PATTERN.matcher(fileName);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(matcher.group(3)));
    }

    private static String stripSuffix(String name, String suffix) {
        if (name.toLowerCase(Locale.ROOT).endsWith(suffix) && name.length() > suffix.length()) {
            return name.substring(0, name.length() - suffix.length());
        }
        return name;
    }
}
