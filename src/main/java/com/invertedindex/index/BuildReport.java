package com.invertedindex.index;

import java.nio.file.Path;

/**
 * 一次构建的结果摘要。
 *
 * @param indexPath 最终索引路径
 * @param documentCount 文档数
 * @param termCount 词项数
 * @param wordCount 词元总数
 * @param segmentCount 收集阶段写出的段数
 * @param mergePasses 归并轮数
 * @param elapsedMillis 总耗时（毫秒）
 */
public record BuildReport(
    Path indexPath,
    int documentCount,
    int termCount,
    long wordCount,
    int segmentCount,
    int mergePasses,
    long elapsedMillis
) {
}
