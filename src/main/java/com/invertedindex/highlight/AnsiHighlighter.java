package com.invertedindex.highlight;

import com.invertedindex.config.Constants;
import com.invertedindex.text.AlphanumericTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 根据索引中记录的位置在原文中定位高亮片段，并渲染为 ANSI 彩色文本。
 */
public final class AnsiHighlighter {
    private static final Logger logger = LoggerFactory.getLogger(AnsiHighlighter.class);

    private AnsiHighlighter() {
    }

    /**
     * 为每个位置计算高亮片段，长度取该位置起连续字母数字的长度。
     *
     * 文档在建索引后被修改时，超出当前文本或不再指向词项字符的位置会被丢弃并记录告警。
     *
     * @param text 重新读取的原文
     * @param positions 索引记录的起始偏移，升序
     * @param sourcePath 原文路径，仅用于日志
     * @return 按起始位置升序的高亮片段
     */
    public static List<HighlightSpan> locate(String text, int[] positions, Path sourcePath) {
        List<HighlightSpan> spans = new ArrayList<>(positions.length);
        for (int position : positions) {
            int length = AlphanumericTokenizer.termExtent(text, position);
            if (length == 0) {
                logger.warn("高亮位置已失效，文档可能在建索引后被修改: path={}, position={}, textLength={}",
                    sourcePath, position, text.length());
                continue;
            }
            spans.add(new HighlightSpan(position, length));
        }
        return spans;
    }

    /**
     * 用 ANSI 红色包裹每个片段。重叠或越界的片段会被跳过或截断。
     *
     * @param text 原文
     * @param spans 高亮片段
     * @return 带 ANSI 转义的文本
     */
    public static String render(String text, List<HighlightSpan> spans) {
        if (text == null || text.isEmpty() || spans == null || spans.isEmpty()) {
            return text == null ? "" : text;
        }
        List<HighlightSpan> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingInt(HighlightSpan::start));

        StringBuilder builder = new StringBuilder(text.length() + sorted.size() * 10);
        int cursor = 0;
        for (HighlightSpan span : sorted) {
            if (span.start() < cursor || span.start() >= text.length()) {
                continue;
            }
            int end = Math.min(span.end(), text.length());
            builder.append(text, cursor, span.start());
            builder.append(Constants.ANSI_HIGHLIGHT);
            builder.append(text, span.start(), end);
            builder.append(Constants.ANSI_RESET);
            cursor = end;
        }
        builder.append(text, cursor, text.length());
        return builder.toString();
    }
}
