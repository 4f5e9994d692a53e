package com.subphot.metrics;

import com.subphot.core.diagnostics.CauseCode;
import com.subphot.core.diagnostics.Outcome;
import com.subphot.model.FrameFiles;
import com.subphot.model.FrameRecord;
import com.subphot.model.MetricName;
import com.subphot.model.MetricValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * 模块说明：MetricExtractor（class）。
 * 主要职责：从检测列表、测光列表和帧头关键字推导单帧质量指标（S、D、背景、有效检测数、星等误差等）。
 * 失败约定：伴随文件缺失或内容无法解析时返回失败结果，该帧不进入任何候选池，不接受部分指标或占位值。
 * 帧头读取失败只会使帧头类指标不可用，由选择器按需排除。
 */
public final class MetricExtractor {
    private static final Logger LOG = LogManager.getLogger(MetricExtractor.class);
    private static final String OWNER = "com.subphot.metrics.MetricExtractor#extract(...)";
    static final int BINARY_MARKER_WINDOW = 600;
    static final String BINARY_MARKER = "--binary-output";

    private final SourceListReader sourceListReader = new SourceListReader();
    private final PhotometryReader textReader = new TextPhotometryReader();
    private final PhotometryReader binaryReader;
    private final FrameHeaderReader headerReader;

    public MetricExtractor(FrameHeaderReader headerReader) {
        this(headerReader, null);
    }

    /**
     * @param binaryReader reader for packed binary photometry, or {@code null} when none is installed
     */
    public MetricExtractor(FrameHeaderReader headerReader, PhotometryReader binaryReader) {
        this.headerReader = headerReader;
        this.binaryReader = binaryReader;
    }

    public Outcome<FrameRecord> extract(FrameFiles files) {
        if (!Files.exists(files.sourceList) || !Files.exists(files.photometry)) {
            return Outcome.failure(CauseCode.MISSING_COMPANION_FILE, OWNER, Map.of(
                    "frame", files.frame.toString(),
                    "source_list_exists", Files.exists(files.sourceList),
                    "photometry_exists", Files.exists(files.photometry)
            ));
        }

        PhotometryTable photometry;
        SourceListTable sources;
        try {
            boolean binary = isBinaryPhotometry(files.photometry);
            if (binary && binaryReader == null) {
                LOG.warn("{} is a binary photometry file but no binary reader is installed, skipping", files.photometry);
                return Outcome.failure(CauseCode.BINARY_READER_UNAVAILABLE, OWNER,
                        Map.of("frame", files.frame.toString(), "photometry", files.photometry.toString()));
            }
            photometry = binary ? binaryReader.read(files.photometry) : textReader.read(files.photometry);
            sources = sourceListReader.read(files.sourceList);
        } catch (IOException | RuntimeException e) {
            LOG.warn("cannot read metrics for {}: {}", files.frame, e.getMessage());
            return Outcome.failure(CauseCode.UNREADABLE_METRIC, OWNER,
                    Map.of("frame", files.frame.toString(), "error", String.valueOf(e.getMessage())));
        }

        Map<MetricName, MetricValue> metrics = new EnumMap<>(MetricName.class);
        metrics.put(MetricName.SEEING, MetricValue.of(Stats.nanMedian(sources.sValues)));
        metrics.put(MetricName.ROUNDNESS, MetricValue.of(Stats.nanMedian(sources.dValues)));
        metrics.put(MetricName.BACKGROUND, MetricValue.of(Stats.nanMedian(sources.background)));
        metrics.put(MetricName.GOOD_DETECTIONS, MetricValue.of(photometry.goodCount()));
        metrics.put(MetricName.MEDIAN_MAG_ERROR, MetricValue.of(Stats.nanMedian(photometry.goodErrors())));
        metrics.put(MetricName.MAG_ERROR_MAD, MetricValue.of(Stats.nanMad(photometry.goodMagnitudes())));
        putHeaderMetrics(files.frame, metrics);

        LOG.debug("metrics for {}: {}", files.frame.getFileName(), metrics);
        return Outcome.success(FrameRecord.of(files, metrics), OWNER);
    }

    private void putHeaderMetrics(Path frame, Map<MetricName, MetricValue> metrics) {
        Map<String, Double> header;
        try {
            header = headerReader.read(frame, HeaderKeywords.ALL);
        } catch (IOException e) {
            LOG.warn("cannot read header of {}, observing-condition metrics unavailable: {}", frame, e.getMessage());
            header = Map.of();
        }
        metrics.put(MetricName.HOUR_ANGLE, MetricValue.of(HeaderKeywords.value(header, HeaderKeywords.HOUR_ANGLE)));
        metrics.put(MetricName.ZENITH_DISTANCE, MetricValue.of(HeaderKeywords.value(header, HeaderKeywords.ZENITH_DISTANCE)));
        metrics.put(MetricName.MOON_PHASE, MetricValue.of(HeaderKeywords.value(header, HeaderKeywords.MOON_PHASE)));
        metrics.put(MetricName.MOON_ELEVATION, MetricValue.of(HeaderKeywords.value(header, HeaderKeywords.MOON_ELEVATION)));
        metrics.put(MetricName.MOON_DISTANCE, MetricValue.of(HeaderKeywords.value(header, HeaderKeywords.MOON_DISTANCE)));
        metrics.put(MetricName.GAIN, MetricValue.of(HeaderKeywords.gain(header)));
        metrics.put(MetricName.EXPOSURE_TIME, MetricValue.of(HeaderKeywords.value(header, HeaderKeywords.EXPTIME)));
    }

    static boolean isBinaryPhotometry(Path photometryFile) throws IOException {
        byte[] head;
        try (InputStream in = Files.newInputStream(photometryFile)) {
            head = in.readNBytes(BINARY_MARKER_WINDOW);
        }
        return new String(head, StandardCharsets.ISO_8859_1).contains(BINARY_MARKER);
    }
}
