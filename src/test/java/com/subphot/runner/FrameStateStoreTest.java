package com.subphot.runner;

import com.subphot.model.FrameState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrameStateStoreTest {

    @TempDir
    Path dir;

    @Test
    void load_shouldStartEmptyWhenFileIsMissing() throws Exception {
        FrameStateStore store = FrameStateStore.load(dir.resolve("state.json"));

        assertTrue(store.frames().isEmpty());
        assertEquals(Optional.empty(), store.astrometricReference());
    }

    @Test
    void advance_shouldOnlyMoveForward() throws Exception {
        FrameStateStore store = FrameStateStore.load(dir.resolve("state.json"));
        Path frame = dir.resolve("1-000001_5.fits");
        store.discover(frame);

        assertTrue(store.advance(frame, FrameState.SUBTRACTED));
        assertFalse(store.advance(frame, FrameState.REGISTERED));
        assertFalse(store.advance(frame, FrameState.SUBTRACTED));
        assertEquals(Optional.of(FrameState.SUBTRACTED), store.state(frame));

        store.discover(frame);
        assertEquals(Optional.of(FrameState.SUBTRACTED), store.state(frame));
    }

    @Test
    void save_shouldRoundTripStatesAndReferences() throws Exception {
        Path file = dir.resolve("state/pipeline-state.json");
        FrameStateStore store = FrameStateStore.load(file);
        Path a = dir.resolve("1-000001_5.fits");
        Path b = dir.resolve("1-000002_5.fits");
        Path c = dir.resolve("1-000003_5.fits");
        store.discover(a);
        store.discover(b);
        store.discover(c);
        store.advance(b, FrameState.REGISTERED);
        store.advance(c, FrameState.CONVOLVED);
        store.setAstrometricReference(a);
        store.setPhotometricReferences(List.of(c, b));
        store.setCombinedReference(dir.resolve("ref/combined-photref.fits"));
        store.save();

        FrameStateStore reloaded = FrameStateStore.load(file);

        assertEquals(List.of(a, b, c), reloaded.frames());
        assertEquals(List.of(b, c), reloaded.framesAtLeast(FrameState.REGISTERED));
        assertEquals(Optional.of(a), reloaded.astrometricReference());
        assertEquals(List.of(c, b), reloaded.photometricReferences());
        assertEquals(Optional.of(dir.resolve("ref/combined-photref.fits")), reloaded.combinedReference());
        assertEquals(Optional.empty(), reloaded.referencePhotometry());
        assertFalse(Files.exists(file.resolveSibling("pipeline-state.json.tmp")));
    }

    @Test
    void load_shouldRejectCorruptFile() throws Exception {
        Path file = dir.resolve("state.json");
        Files.writeString(file, "{ not json");

        assertThrows(IOException.class, () -> FrameStateStore.load(file));
    }
}
