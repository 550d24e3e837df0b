package dev.nuclr.plugin.core.render.parallel;

import dev.nuclr.plugin.core.render.parallel.pool.BitmapPool;
import dev.nuclr.plugin.core.render.parallel.pool.OutputFormat;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

/**
 * Settings store for parallel rendering defaults.
 * Persisted to the platform user config directory as a .properties file.
 */
@Slf4j
public final class ParallelRenderSettings {

    public static final String KEY_WORKER_COUNT       = "pdf.render.workerCount";
    public static final String KEY_MAX_QUEUE_DEPTH    = "pdf.render.maxQueueDepth";
    public static final String KEY_BITMAP_POOL_SIZE   = "pdf.render.bitmapPoolSize";
    public static final String KEY_OUTPUT_FORMAT      = "pdf.render.outputFormat";
    public static final String KEY_DPI                = "pdf.render.dpi";
    public static final String KEY_KEEP_WORKER_CACHES = "pdf.render.keepWorkerCaches";

    private static final int          DEFAULT_WORKER_COUNT     = 0;
    private static final int          MAX_WORKER_COUNT         = 256;
    private static final int          DEFAULT_MAX_QUEUE_DEPTH  = 0;
    private static final int          DEFAULT_BITMAP_POOL_SIZE = BitmapPool.DEFAULT_MAX_SIZE;
    private static final OutputFormat DEFAULT_OUTPUT_FORMAT    = OutputFormat.BGRX;
    private static final int          DEFAULT_DPI              = 0;
    private static final int          MAX_DPI                  = 1200;

    private static volatile ParallelRenderSettings instance;

    private final Path file;
    private final Properties props = new Properties();

    /** Settings backed by {@code file}; a missing file means all defaults. */
    public ParallelRenderSettings(Path file) {
        this.file = file.toAbsolutePath();
        load();
    }

    public static ParallelRenderSettings getInstance() {
        ParallelRenderSettings s = instance;
        if (s == null) {
            synchronized (ParallelRenderSettings.class) {
                s = instance;
                if (s == null) {
                    s = new ParallelRenderSettings(defaultSettingsFile());
                    instance = s;
                }
            }
        }
        return s;
    }

    // --- Getters ---

    /** 0 means choose per document. */
    public synchronized int getWorkerCount() {
        return clamp(intProperty(KEY_WORKER_COUNT, DEFAULT_WORKER_COUNT), 0, MAX_WORKER_COUNT);
    }

    /** 0 means automatic. */
    public synchronized int getMaxQueueDepth() {
        return Math.max(0, intProperty(KEY_MAX_QUEUE_DEPTH, DEFAULT_MAX_QUEUE_DEPTH));
    }

    public synchronized int getBitmapPoolSize() {
        return Math.max(0, intProperty(KEY_BITMAP_POOL_SIZE, DEFAULT_BITMAP_POOL_SIZE));
    }

    public synchronized OutputFormat getOutputFormat() {
        try {
            return OutputFormat.valueOf(props.getProperty(KEY_OUTPUT_FORMAT, DEFAULT_OUTPUT_FORMAT.name()));
        } catch (IllegalArgumentException e) {
            return DEFAULT_OUTPUT_FORMAT;
        }
    }

    public synchronized int getDpi() {
        return clamp(intProperty(KEY_DPI, DEFAULT_DPI), 0, MAX_DPI);
    }

    public synchronized boolean isKeepWorkerCaches() {
        return Boolean.parseBoolean(props.getProperty(KEY_KEEP_WORKER_CACHES, "false"));
    }

    // --- Setters (also persist) ---

    public synchronized void setWorkerCount(int workerCount) {
        props.setProperty(KEY_WORKER_COUNT, String.valueOf(clamp(workerCount, 0, MAX_WORKER_COUNT)));
        save();
    }

    public synchronized void setMaxQueueDepth(int depth) {
        props.setProperty(KEY_MAX_QUEUE_DEPTH, String.valueOf(Math.max(0, depth)));
        save();
    }

    public synchronized void setBitmapPoolSize(int size) {
        props.setProperty(KEY_BITMAP_POOL_SIZE, String.valueOf(Math.max(0, size)));
        save();
    }

    public synchronized void setOutputFormat(OutputFormat format) {
        props.setProperty(KEY_OUTPUT_FORMAT, format.name());
        save();
    }

    public synchronized void setDpi(int dpi) {
        props.setProperty(KEY_DPI, String.valueOf(clamp(dpi, 0, MAX_DPI)));
        save();
    }

    public synchronized void setKeepWorkerCaches(boolean keep) {
        props.setProperty(KEY_KEEP_WORKER_CACHES, String.valueOf(keep));
        save();
    }

    // --- Persistence ---

    private int intProperty(String key, int defaultValue) {
        try {
            return Integer.parseInt(props.getProperty(key, String.valueOf(defaultValue)).trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int clamp(int v, int min, int max) {
        return Math.min(Math.max(v, min), max);
    }

    private void load() {
        if (!Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not load parallel render settings, using defaults: {}", e.getMessage());
        }
    }

    private void save() {
        try {
            Path dir = file.getParent();
            if (dir != null) Files.createDirectories(dir);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                props.store(out, "Nuclr PDF parallel render settings");
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Could not save parallel render settings: {}", e.getMessage());
        }
    }

    private static Path defaultSettingsFile() {
        String os = System.getProperty("os.name", "").toLowerCase();
        Path dir;
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            dir = (appData != null)
                    ? Path.of(appData, "nuclr")
                    : Path.of(System.getProperty("user.home"), "nuclr");
        } else if (os.contains("mac")) {
            dir = Path.of(System.getProperty("user.home"), "Library", "Application Support", "nuclr");
        } else {
            String xdg = System.getenv("XDG_CONFIG_HOME");
            dir = (xdg != null)
                    ? Path.of(xdg, "nuclr")
                    : Path.of(System.getProperty("user.home"), ".config", "nuclr");
        }
        return dir.resolve("pdf-parallel-render.properties");
    }
}
