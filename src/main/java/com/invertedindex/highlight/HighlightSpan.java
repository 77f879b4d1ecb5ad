package com.invertedindex.highlight;

/**
 * 文本中需要高亮的片段。
 *
 * @param start 起始偏移（char 下标）
 * @param length 片段长度（char 数）
 */
public record HighlightSpan(int start, int length) {
    public HighlightSpan {
        if (start < 0) {
            throw new IllegalArgumentException("start 不能为负数: " + start);
        }
        if (length <= 0) {
            throw new IllegalArgumentException("length 必须为正数: " + length);
        }
    }

    /**
     * 片段结束位置（不含）。
     */
    public int end() {
        return start + length;
    }
}
