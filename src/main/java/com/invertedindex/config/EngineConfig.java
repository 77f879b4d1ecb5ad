package com.invertedindex.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或 properties 配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    static final String KEY_SINGLE_THREADED = "single-threaded";
    static final String KEY_INDEX_OUTPUT_PATH = "index.output-path";
    static final String KEY_WORKER_COUNT = "worker.count";
    static final String KEY_SEGMENT_FLUSH_THRESHOLD = "segment.flush-threshold";
    static final String KEY_MERGE_FACTOR = "merge.factor";

    private boolean singleThreaded = false;
    private Path indexOutputPath = Paths.get(Constants.DEFAULT_INDEX_FILE);
    private Integer workerCount;
    private long segmentFlushThreshold = Constants.DEFAULT_SEGMENT_FLUSH_THRESHOLD;
    private int mergeFactor = Constants.DEFAULT_MERGE_FACTOR;

    public boolean isSingleThreaded() {
        return singleThreaded;
    }

    public void setSingleThreaded(boolean singleThreaded) {
        this.singleThreaded = singleThreaded;
    }

    public Path getIndexOutputPath() {
        return indexOutputPath;
    }

    public void setIndexOutputPath(Path indexOutputPath) {
        if (indexOutputPath == null) {
            throw new IllegalArgumentException("索引输出路径不能为空");
        }
        this.indexOutputPath = indexOutputPath;
    }

    /**
     * 未显式配置时为 null，由 {@link #effectiveWorkerCount()} 回退到 CPU 核数。
     */
    public Integer getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(Integer workerCount) {
        if (workerCount != null && workerCount <= 0) {
            throw new IllegalArgumentException("工作线程数必须为正数: " + workerCount);
        }
        this.workerCount = workerCount;
    }

    public long getSegmentFlushThreshold() {
        return segmentFlushThreshold;
    }

    public void setSegmentFlushThreshold(long segmentFlushThreshold) {
        if (segmentFlushThreshold <= 0) {
            throw new IllegalArgumentException("段刷写阈值必须为正数: " + segmentFlushThreshold);
        }
        this.segmentFlushThreshold = segmentFlushThreshold;
    }

    public int getMergeFactor() {
        return mergeFactor;
    }

    public void setMergeFactor(int mergeFactor) {
        if (mergeFactor < 2) {
            throw new IllegalArgumentException("归并路数至少为2: " + mergeFactor);
        }
        this.mergeFactor = mergeFactor;
    }

    /**
     * 计算并发模式下实际使用的线程数，限制在安全上限以内。
     */
    public int effectiveWorkerCount() {
        int requested = workerCount == null ? Constants.DEFAULT_INDEX_THREADS : workerCount;
        return Math.max(1, Math.min(requested, Constants.MAX_INDEX_THREADS));
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从 properties 文件加载配置，缺失的键保留默认值。
     *
     * @param propertiesFile 配置文件路径
     * @return 加载后的配置
     * @throws IOException 文件无法读取时抛出
     */
    public static EngineConfig load(Path propertiesFile) throws IOException {
        if (propertiesFile == null) {
            throw new IllegalArgumentException("配置文件路径不能为空");
        }
        Properties properties = new Properties();
        try (InputStream inputStream = Files.newInputStream(propertiesFile)) {
            properties.load(inputStream);
        } catch (IOException exception) {
            throw new IOException("读取配置文件失败: " + propertiesFile, exception);
        }
        return from(properties);
    }

    /**
     * 将 properties 映射为配置对象，非法取值立即失败。
     */
    static EngineConfig from(Properties properties) {
        EngineConfig config = defaults();
        String singleThreaded = properties.getProperty(KEY_SINGLE_THREADED);
        if (singleThreaded != null) {
            config.setSingleThreaded(Boolean.parseBoolean(singleThreaded.trim()));
        }
        String outputPath = properties.getProperty(KEY_INDEX_OUTPUT_PATH);
        if (outputPath != null && !outputPath.isBlank()) {
            config.setIndexOutputPath(Paths.get(outputPath.trim()));
        }
        String workers = properties.getProperty(KEY_WORKER_COUNT);
        if (workers != null && !workers.isBlank()) {
            config.setWorkerCount(parseInt(KEY_WORKER_COUNT, workers));
        }
        String flushThreshold = properties.getProperty(KEY_SEGMENT_FLUSH_THRESHOLD);
        if (flushThreshold != null && !flushThreshold.isBlank()) {
            config.setSegmentFlushThreshold(parseInt(KEY_SEGMENT_FLUSH_THRESHOLD, flushThreshold));
        }
        String mergeFactor = properties.getProperty(KEY_MERGE_FACTOR);
        if (mergeFactor != null && !mergeFactor.isBlank()) {
            config.setMergeFactor(parseInt(KEY_MERGE_FACTOR, mergeFactor));
        }
        return config;
    }

    private static int parseInt(String key, String rawValue) {
        try {
            return Integer.parseInt(rawValue.trim());
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException("配置项 " + key + " 不是整数: " + rawValue, exception);
        }
    }
}
