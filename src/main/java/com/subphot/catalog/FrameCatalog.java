package com.subphot.catalog;

import com.subphot.config.Config;
import com.subphot.model.FrameFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：FrameCatalog（class）。
 * 主要职责：把“目录 + 通配符”解析为 (帧, 检测列表, 测光列表) 三元组；缺任一伴随文件的帧直接丢弃并计数。
 * 使用建议：结果按文件名排序，保证后续排序与求交的输入顺序稳定。
 */
public final class FrameCatalog {
    private static final Logger LOG = LogManager.getLogger(FrameCatalog.class);

    private final String sourceListExtension;
    private final String photometryExtension;

    public FrameCatalog(Config config) {
        this.sourceListExtension = config.getString("catalog.srclist_ext", ".fistar");
        this.photometryExtension = config.getString("catalog.phot_ext", ".fiphot");
    }

    public Resolution resolve(Path fitsDir, String glob, Path sourceListDir, Path photometryDir) throws IOException {
        Path srcDir = sourceListDir == null ? fitsDir : sourceListDir;
        Path photDir = photometryDir == null ? fitsDir : photometryDir;

        List<Path> matched = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(fitsDir, glob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    matched.add(path.toAbsolutePath().normalize());
                }
            }
        }
        matched.sort(null);
        LOG.info("{} frames found in {} matching {}, looking for source and photometry lists", matched.size(), fitsDir, glob);

        List<FrameFiles> frames = new ArrayList<>();
        List<Path> missing = new ArrayList<>();
        for (Path frame : matched) {
            FrameFiles files = companionsOf(frame, srcDir, photDir);
            if (Files.exists(files.sourceList) && Files.exists(files.photometry)) {
                frames.add(files);
            } else {
                missing.add(frame);
                LOG.debug("missing companion file for {}, dropped", frame);
            }
        }
        if (!missing.isEmpty()) {
            LOG.warn("{} of {} frames dropped for a missing source or photometry list", missing.size(), matched.size());
        }
        return new Resolution(frames, missing);
    }

    /**
     * Expected companion paths for a frame; existence is not checked.
     */
    public FrameFiles companionsOf(Path frame, Path sourceListDir, Path photometryDir) {
        return new FrameFiles(
                frame,
                FrameNaming.sourceList(sourceListDir.toAbsolutePath().normalize(), frame, sourceListExtension),
                FrameNaming.photometry(photometryDir.toAbsolutePath().normalize(), frame, photometryExtension)
        );
    }

    public static final class Resolution {
        public final List<FrameFiles> frames;
        public final List<Path> missingCompanions;

        private Resolution(List<FrameFiles> frames, List<Path> missingCompanions) {
            this.frames = List.copyOf(frames);
            this.missingCompanions = List.copyOf(missingCompanions);
        }
    }
}
