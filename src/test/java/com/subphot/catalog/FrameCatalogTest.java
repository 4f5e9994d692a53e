package com.subphot.catalog;

import com.subphot.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FrameCatalogTest {

    @TempDir
    Path dir;

    @Test
    void resolve_shouldKeepOnlyFramesWithBothCompanions() throws Exception {
        Path phot = Files.createDirectories(dir.resolve("phot"));
        for (String base : List.of("1-000002_5", "1-000001_5", "1-000003_5")) {
            Files.writeString(dir.resolve(base + ".fits"), "");
        }
        Files.writeString(dir.resolve("1-000001_5.fistar"), "");
        Files.writeString(phot.resolve("1-000001_5.fiphot"), "");
        Files.writeString(dir.resolve("1-000002_5.fistar"), "");
        Files.writeString(phot.resolve("1-000002_5.fiphot"), "");
        Files.writeString(dir.resolve("1-000003_5.fistar"), "");
        Files.writeString(dir.resolve("notes.txt"), "");

        FrameCatalog catalog = new FrameCatalog(Config.fromConfigurationProperties(dir, Map.of()));
        FrameCatalog.Resolution resolution = catalog.resolve(dir, "*.fits", null, phot);

        assertEquals(2, resolution.frames.size());
        assertEquals("1-000001_5.fits", resolution.frames.get(0).frame.getFileName().toString());
        assertEquals("1-000002_5.fits", resolution.frames.get(1).frame.getFileName().toString());
        assertEquals(phot.toAbsolutePath().normalize().resolve("1-000002_5.fiphot"), resolution.frames.get(1).photometry);
        assertEquals(List.of(dir.resolve("1-000003_5.fits").toAbsolutePath().normalize()), resolution.missingCompanions);
    }

    @Test
    void resolve_shouldHonourConfiguredExtensions() throws Exception {
        Files.writeString(dir.resolve("a.fits"), "");
        Files.writeString(dir.resolve("a.srcs"), "");
        Files.writeString(dir.resolve("a.phot"), "");

        FrameCatalog catalog = new FrameCatalog(Config.fromConfigurationProperties(dir, Map.of(
                "catalog", Map.of("srclist_ext", ".srcs", "phot_ext", ".phot"))));

        assertEquals(1, catalog.resolve(dir, "*.fits", null, null).frames.size());
    }
}
