package com.subphot.runner;

import com.subphot.catalog.FrameNaming;
import com.subphot.config.Config;
import com.subphot.core.diagnostics.CauseCode;
import com.subphot.core.diagnostics.Outcome;
import com.subphot.metrics.FrameHeaderReader;
import com.subphot.metrics.HeaderKeywords;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 模块说明：CcdParameterResolver（class）。
 * 主要职责：为测光变换确定增益、曝光时间与零点；显式配置优先，其次读帧头，零点按帧名中的 CCD 编号查表。
 * 三者缺一即返回 CCD_PARAMETERS_UNRESOLVED，不以默认值代替。
 */
public final class CcdParameterResolver {
    private static final Logger LOG = LogManager.getLogger(CcdParameterResolver.class);
    private static final String OWNER = "com.subphot.runner.CcdParameterResolver#resolve(...)";

    private final Config config;
    private final FrameHeaderReader headerReader;

    public CcdParameterResolver(Config config, FrameHeaderReader headerReader) {
        this.config = config;
        this.headerReader = headerReader;
    }

    /**
     * @param headerFrame frame whose header supplies gain and exposure time
     * @param namedAfter  file name carrying the CCD number used for the zeropoint lookup
     */
    public Outcome<CcdParameters> resolve(Path headerFrame, String namedAfter) {
        double gain = config.getDouble("photometry.ccd_gain", 0.0);
        double exptime = config.getDouble("photometry.exptime", 0.0);
        double zeropoint = config.getDouble("photometry.zeropoint", 0.0);

        if (gain <= 0.0 || exptime <= 0.0) {
            Map<String, Double> header = Map.of();
            try {
                header = headerReader.read(headerFrame, HeaderKeywords.DETECTOR);
            } catch (IOException e) {
                LOG.warn("cannot read detector keywords of {}: {}", headerFrame, e.getMessage());
            }
            if (gain <= 0.0) {
                gain = HeaderKeywords.gain(header);
            }
            if (exptime <= 0.0) {
                exptime = HeaderKeywords.value(header, HeaderKeywords.EXPTIME);
            }
        }
        if (zeropoint == 0.0) {
            zeropoint = zeropointFor(namedAfter);
        }

        Map<String, Object> missing = new LinkedHashMap<>();
        if (!(gain > 0.0)) {
            missing.put("gain", "unresolved");
        }
        if (!(exptime > 0.0)) {
            missing.put("exptime", "unresolved");
        }
        if (Double.isNaN(zeropoint)) {
            missing.put("zeropoint", "unresolved");
        }
        if (!missing.isEmpty()) {
            missing.put("frame", headerFrame.toString());
            return Outcome.failure(CauseCode.CCD_PARAMETERS_UNRESOLVED, OWNER, missing);
        }
        return Outcome.success(new CcdParameters(gain, exptime, zeropoint), OWNER);
    }

    double zeropointFor(String fileName) {
        OptionalInt ccd = FrameNaming.ccdNumber(fileName);
        if (ccd.isEmpty()) {
            return Double.NaN;
        }
        Double value = zeropointTable().get(ccd.getAsInt());
        return value == null ? Double.NaN : value;
    }

    Map<Integer, Double> zeropointTable() {
        Map<Integer, Double> table = new HashMap<>();
        for (String entry : config.getList("photometry.zeropoints")) {
            String[] parts = entry.split(":");
            if (parts.length != 2) {
                LOG.warn("ignoring malformed zeropoint entry '{}'", entry);
                continue;
            }
            try {
                table.put(Integer.parseInt(parts[0].trim()), Double.parseDouble(parts[1].trim()));
            } catch (NumberFormatException e) {
                LOG.warn("ignoring malformed zeropoint entry '{}'", entry);
            }
        }
        return table;
    }
}
