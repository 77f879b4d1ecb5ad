package com.invertedindex.index;

import com.invertedindex.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * 一次构建专用的临时段目录。
 *
 * 目录名由 {@link Files#createTempDirectory} 生成，不会与其他进程或并发构建冲突；
 * 段文件名由原子计数器分配，可从任意线程调用。关闭时删除目录及其全部内容。
 */
public final class SegmentStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SegmentStore.class);
    private static final String DIRECTORY_PREFIX = "invidx-segments-";

    private final Path directory;
    private final AtomicInteger nextSegmentId = new AtomicInteger();
    private final List<Path> allocated = new ArrayList<>();
    private volatile boolean closed;

    private SegmentStore(Path directory) {
        this.directory = directory;
    }

    /**
     * 在指定父目录下创建临时段目录。
     *
     * @param parentDirectory 父目录，为 null 时使用系统临时目录
     * @return 新的段存储
     * @throws IOException 目录创建失败时抛出
     */
    public static SegmentStore create(Path parentDirectory) throws IOException {
        Path directory;
        if (parentDirectory == null) {
            directory = Files.createTempDirectory(DIRECTORY_PREFIX);
        } else {
            Files.createDirectories(parentDirectory);
            directory = Files.createTempDirectory(parentDirectory, DIRECTORY_PREFIX);
        }
        logger.debug("创建临时段目录: {}", directory);
        return new SegmentStore(directory);
    }

    /**
     * 分配一个尚未使用的段文件路径，文件本身由调用方写入。
     */
    public Path allocate() {
        if (closed) {
            throw new IllegalStateException("SegmentStore 已关闭: " + directory);
        }
        Path segmentPath = directory.resolve(String.format("seg-%08x%s", nextSegmentId.getAndIncrement(), Constants.SEGMENT_SUFFIX));
        synchronized (allocated) {
            allocated.add(segmentPath);
        }
        return segmentPath;
    }

    /**
     * 按分配顺序返回全部已分配路径（包括已释放的）。
     */
    public List<Path> allocatedSegments() {
        synchronized (allocated) {
            return List.copyOf(allocated);
        }
    }

    /**
     * 删除已被完整消费的段文件。删除失败只记录日志，关闭目录时会再次清理。
     */
    public void release(Path segmentPath) {
        try {
            Files.deleteIfExists(segmentPath);
        } catch (IOException exception) {
            logger.warn("删除段文件失败，将在关闭时重试: {}", segmentPath, exception);
        }
    }

    public Path directory() {
        return directory;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 删除临时目录及其中所有文件，可重复调用。
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException exception) {
                    logger.warn("清理临时文件失败: {}", path, exception);
                }
            }
        } catch (IOException exception) {
            logger.warn("遍历临时段目录失败: {}", directory, exception);
        }
        logger.debug("已清理临时段目录: {}", directory);
    }
}
