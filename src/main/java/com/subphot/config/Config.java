package com.subphot.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：汇总默认值、classpath 与工作目录下的 config.properties 以及调用方覆盖项，作为只读配置传给各组件。
 * 使用建议：新增配置键时同步补充 buildDefaults，避免组件各自硬编码默认值。
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final String FILE_NAME = "config.properties";
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, Map.of());
    }

    /**
     * Loads classpath and working-directory properties, then applies {@code overrides}
     * (nested maps are flattened into dotted keys).
     */
    public static Config load(Path workingDir, Map<String, ?> overrides) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath {}: {}", FILE_NAME, e.getMessage());
        }

        Path local = workingDir.resolve(FILE_NAME);
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        flattenInto(config, "", overrides);
        return config;
    }

    /**
     * Build Config from an in-memory property tree only, without touching the filesystem.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

/**
 * 方法说明：getPath，按工作目录解析相对路径。
 * 处理流程：键为空时返回工作目录本身；绝对路径原样返回（normalize 后）。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public Path getPath(String key, Path fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private static String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("app.debug", "false");
        defaults.put("outputs.dir", "outputs");

        defaults.put("paths.fits_dir", ".");
        defaults.put("paths.fits_glob", "*.fits");
        defaults.put("paths.registered_dir", "registered");
        defaults.put("paths.reference_dir", "reference");
        defaults.put("paths.subtracted_dir", "subtracted");
        defaults.put("paths.iphot_dir", "iphot");
        defaults.put("paths.lightcurve_dir", "lightcurves");
        defaults.put("paths.state_file", "pipeline-state.json");

        defaults.put("catalog.srclist_ext", ".fistar");
        defaults.put("catalog.phot_ext", ".fiphot");

        defaults.put("pipeline.workers", "16");
        defaults.put("pipeline.max_tasks_per_worker", "1000");
        defaults.put("pipeline.overwrite", "false");

        defaults.put("metrics.force_recompute", "false");

        defaults.put("astromref.rank_depth", "200");
        defaults.put("astromref.cache_file", "TM-imagesub-astromref.json");

        defaults.put("photref.minframes", "80");
        defaults.put("photref.max_hour_angle", "3.0");
        defaults.put("photref.max_zenith_dist", "30.0");
        defaults.put("photref.max_moon_phase", "25.0");
        defaults.put("photref.max_moon_elev", "-10.0");
        defaults.put("photref.cache_file", "TM-imagesub-photref.json");

        defaults.put("convolve.kernel_spec", "b/4;i/4;d=4/4");
        defaults.put("combine.method", "median");

        defaults.put("registration.grid_x", "30");
        defaults.put("registration.grid_y", "30");
        defaults.put("registration.ccd_xsize", "2048");
        defaults.put("registration.ccd_ysize", "2048");
        defaults.put("registration.weight", "20");

        defaults.put("photometry.apertures", "2.95:7.0:6.0,3.35:7.0:6.0,3.95:7.0:6.0");
        defaults.put("photometry.srclist_idcol", "1");
        defaults.put("photometry.srclist_xycol", "7,8");
        defaults.put("photometry.disjoint_radius", "2");
        defaults.put("photometry.zeropoints", "5:17.11,6:17.11,7:17.11,8:16.63");

        defaults.put("transform.xysdk.cmd",
                "grtrans {srclist} --col-xy 2,3 --col-fit 6,7,8 --col-weight 10 --order 4 "
                        + "--iterations 3 --rejection-level 3 --comment --output-transformation {output}");
        defaults.put("transform.shift.cmd",
                "grmatch --match-points -r {astromref} --col-ref 2,3 --col-ref-ordering +9 "
                        + "-i {srclist} --col-inp 2,3 --col-inp-ordering +9 --weight reference,column=9 "
                        + "--triangulation maxinp=5000,maxref=5000,conformable,auto,unitarity=0.01 "
                        + "--order 4 --max-distance 1 --comment --output-transformation {output} --output /dev/null");
        defaults.put("transform.register.cmd",
                "fitrans {frame} -k --input-transformation {itrans} --reverse -o {output}");
        defaults.put("transform.photref_convolve.cmd",
                "ficonv -i {target} -r {frame} -it {regfile} -k \"{kernel}\" -oc {output}");
        defaults.put("transform.combine.cmd",
                "ficombine {framelist} -m {method} -o {output}");
        defaults.put("transform.reference_photometry.cmd",
                "fiphot --input {photref} --input-list {srclist} --col-id {idcol} --col-xy {xycol} "
                        + "--gain {gain} --mag-flux {zeropoint},{exptime} --apertures '{apertures}' "
                        + "--sky-fit 'mode,sigma=3,iterations=2' --disjoint-radius 2 --serial {serial} "
                        + "--format 'IXY-----,sMm' --nan-string 'NaN' --aperture-mask-ignore 'saturated' "
                        + "--comment '--comment' --single-background 3 -op {output} -k");
        defaults.put("transform.subtract.cmd",
                "ficonv -r {reference} -i {frame} -it {regfile} -k \"{kernel}\" -ok {kernel_output} -os {output}");
        defaults.put("transform.subtracted_photometry.cmd",
                "fiphot --input-subtracted {frame} --input-raw-photometry {rawphot} "
                        + "--sky-fit mode,iterations=2,sigma=3 --format IXY-----,sMm "
                        + "--mag-flux {zeropoint},{exptime} --gain {gain} --disjoint-radius {disjoint_radius} "
                        + "--magfit orders=4:2,niter=3,sigma=3 --input-kernel {kernel} --comment --output - | "
                        + "grtrans --col-xy 2,3 --input-transformation {itrans} --col-out 4,5 --output - | "
                        + "grtrans --col-xy 4,5 --input-transformation {xysdk} --col-out 6,7,8 --output {output}");
        defaults.put("transform.collect.cmd",
                "mkdir -p {lcdir} && xargs grcollect --col-base 1 --prefix {lcdir}/ --extension rlc < {iphotlist} "
                        + "&& cp {iphotlist} {output}");

        return Collections.unmodifiableMap(defaults);
    }
}
