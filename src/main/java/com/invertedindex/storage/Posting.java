package com.invertedindex.storage;

import java.util.Arrays;

/**
 * 单个文档对某词项的出现记录。
 *
 * @param docId 文档ID
 * @param positions 文档内起始偏移，严格递增且非空
 */
public record Posting(int docId, int[] positions) {
    /**
     * 构造时执行校验并复制输入数据，避免外部修改。
     */
    public Posting {
        if (docId <= 0) {
            throw new IllegalArgumentException("docId必须为正数: " + docId);
        }
        if (positions == null || positions.length == 0) {
            throw new IllegalArgumentException("positions不能为空, docId=" + docId);
        }
        for (int index = 0; index < positions.length; index++) {
            if (positions[index] < 0) {
                throw new IllegalArgumentException("位置不能为负数，docId=" + docId + ", value=" + positions[index]);
            }
            if (index > 0 && positions[index] <= positions[index - 1]) {
                throw new IllegalArgumentException("positions必须严格递增，docId=" + docId + ", 位置=" + index);
            }
        }
        positions = Arrays.copyOf(positions, positions.length);
    }

    /**
     * 出现次数。
     */
    public int frequency() {
        return positions.length;
    }

    public int position(int index) {
        return positions[index];
    }

    @Override
    public int[] positions() {
        return Arrays.copyOf(positions, positions.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Posting that)) {
            return false;
        }
        return docId == that.docId && Arrays.equals(positions, that.positions);
    }

    @Override
    public int hashCode() {
        return 31 * docId + Arrays.hashCode(positions);
    }

    @Override
    public String toString() {
        return "Posting[docId=" + docId + ", positions=" + Arrays.toString(positions) + "]";
    }
}
