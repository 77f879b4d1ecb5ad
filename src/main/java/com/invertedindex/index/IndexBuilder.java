package com.invertedindex.index;

import com.invertedindex.config.Constants;
import com.invertedindex.config.EngineConfig;
import com.invertedindex.document.Document;
import com.invertedindex.document.DocumentSources;
import com.invertedindex.text.AlphanumericTokenizer;
import com.invertedindex.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 索引构建协调器。
 *
 * 单线程模式在调用线程内依次读取、分词、攒批、写段；并发模式由固定线程池为每个文档产出部分索引，
 * 结果按完成顺序经 {@link ExecutorCompletionService} 交给唯一的收集者（调用线程），只有收集者写段。
 * 所有段写完后由 {@link ExternalMerger} 归并为最终索引，并写出 JSON 元数据。
 *
 * 任一任务失败即停止派发、取消未完成任务、删除临时段目录并抛出原始异常。
 */
public final class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final EngineConfig config;
    private final PartialIndexBuilder partialIndexBuilder;

    public IndexBuilder(EngineConfig config) {
        this(config, new AlphanumericTokenizer());
    }

    public IndexBuilder(EngineConfig config, Tokenizer tokenizer) {
        if (config == null) {
            throw new IllegalArgumentException("config 不能为空");
        }
        this.config = config;
        this.partialIndexBuilder = new PartialIndexBuilder(tokenizer);
    }

    /**
     * 为输入路径构建索引，目录展开为其下的普通文件，docId 按展开顺序从 1 开始分配。
     *
     * @param inputs 文件或目录
     * @return 构建报告
     * @throws com.invertedindex.document.DocumentReadException 输入无法读取
     * @throws com.invertedindex.storage.SegmentWriteException 段写入失败
     * @throws com.invertedindex.storage.MergeWriteException 最终索引写入失败
     * @throws InterruptedIOException 构建线程被中断
     * @throws IOException 其他 I/O 失败
     */
    public BuildReport build(List<Path> inputs) throws IOException {
        long startNanos = System.nanoTime();
        List<Path> files = DocumentSources.expand(inputs);
        Path outputPath = config.getIndexOutputPath().toAbsolutePath();
        Path outputDirectory = outputPath.getParent();
        Files.createDirectories(outputDirectory);

        int workerCount = config.isSingleThreaded() ? 1 : config.effectiveWorkerCount();
        logger.info("开始构建索引: documents={}, mode={}, workers={}, output={}",
            files.size(), config.isSingleThreaded() ? "single-threaded" : "concurrent", workerCount, outputPath);

        SegmentBatcher batcher;
        ExternalMerger.MergeStats mergeStats;
        try (SegmentStore segmentStore = SegmentStore.create(outputDirectory)) {
            batcher = new SegmentBatcher(segmentStore, config.getSegmentFlushThreshold());
            if (config.isSingleThreaded()) {
                collectSingleThreaded(files, batcher);
            } else {
                collectConcurrently(files, batcher, workerCount);
            }
            batcher.flush();
            logger.info("收集阶段完成: segments={}, words={}", batcher.segments().size(), batcher.wordCount());

            ExternalMerger merger = new ExternalMerger(segmentStore, config.getMergeFactor());
            mergeStats = merger.merge(batcher.segments(), outputPath);
        }

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        IndexMeta meta = new IndexMeta(
            outputPath.getFileName().toString(),
            Constants.FORMAT_VERSION,
            mergeStats.documentCount(),
            mergeStats.termCount(),
            batcher.wordCount(),
            mergeStats.segmentCount(),
            mergeStats.passes(),
            config.isSingleThreaded(),
            workerCount,
            elapsedMillis,
            Instant.now()
        );
        writeMeta(meta, IndexMeta.metaPathFor(outputPath));

        logger.info("索引构建完成: {}, documents={}, terms={}, words={}, 耗时={}ms",
            outputPath, mergeStats.documentCount(), mergeStats.termCount(), batcher.wordCount(), elapsedMillis);
        return new BuildReport(outputPath, mergeStats.documentCount(), mergeStats.termCount(), batcher.wordCount(),
            mergeStats.segmentCount(), mergeStats.passes(), elapsedMillis);
    }

    /**
     * 索引已经提交，元数据写入失败时删除上一次构建留下的元数据，避免 status 报告与新索引不符的统计。
     */
    private static void writeMeta(IndexMeta meta, Path metaPath) throws IOException {
        try {
            meta.writeTo(metaPath);
        } catch (IOException exception) {
            logger.error("索引已提交但元数据写入失败: {}", metaPath, exception);
            if (Files.isRegularFile(metaPath)) {
                try {
                    Files.delete(metaPath);
                } catch (IOException cleanupException) {
                    exception.addSuppressed(cleanupException);
                }
            }
            throw exception;
        }
    }

    private void collectSingleThreaded(List<Path> files, SegmentBatcher batcher) throws IOException {
        for (int index = 0; index < files.size(); index++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("索引构建被中断，已处理文档数=" + index);
            }
            Document document = Document.load(index + 1, files.get(index));
            batcher.add(partialIndexBuilder.build(document));
            logger.debug("已索引文档: docId={}, path={}", document.docId(), document.sourcePath());
        }
    }

    private void collectConcurrently(List<Path> files, SegmentBatcher batcher, int workerCount) throws IOException {
        ExecutorService executor = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        CompletionService<PartialIndex> completionService = new ExecutorCompletionService<>(executor);
        boolean completed = false;
        try {
            for (int index = 0; index < files.size(); index++) {
                int docId = index + 1;
                Path path = files.get(index);
                completionService.submit(() -> partialIndexBuilder.build(Document.load(docId, path)));
            }
            for (int received = 0; received < files.size(); received++) {
                PartialIndex partialIndex = awaitResult(completionService.take());
                batcher.add(partialIndex);
            }
            completed = true;
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("索引构建被中断");
            interrupted.initCause(exception);
            throw interrupted;
        } finally {
            shutdown(executor, completed);
        }
    }

    private static PartialIndex awaitResult(Future<PartialIndex> future)
        throws IOException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException("索引任务失败", cause);
        }
    }

    private static void shutdown(ExecutorService executor, boolean completed) {
        if (completed) {
            executor.shutdown();
        } else {
            List<Runnable> cancelled = executor.shutdownNow();
            logger.warn("构建失败，已取消 {} 个未开始的任务", cancelled.size());
        }
        try {
            if (!executor.awaitTermination(Constants.WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("工作线程未在 {} 秒内退出", Constants.WORKER_SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger nextId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "index-worker-" + nextId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
