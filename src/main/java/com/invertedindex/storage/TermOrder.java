package com.invertedindex.storage;

import java.util.Comparator;

/**
 * 词项的全局顺序：按 Unicode 码点逐个比较，与 UTF-8 编码后的无符号字节序一致。
 *
 * {@link String#compareTo} 比较的是 UTF-16 代码单元，增补平面字符（代理对）会排在 U+E000..U+FFFF 之前，
 * 与文件中的字节序不符，因此排序、写入校验、读取校验和归并堆都必须使用这里的比较器。
 */
public final class TermOrder {

    public static final Comparator<String> COMPARATOR = TermOrder::compare;

    private TermOrder() {
        // 工具类，禁止实例化
    }

    /**
     * 比较两个词项。
     *
     * @return 负数、零或正数，分别表示 left 小于、等于或大于 right
     */
    public static int compare(String left, String right) {
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length() && rightIndex < right.length()) {
            int leftCodePoint = left.codePointAt(leftIndex);
            int rightCodePoint = right.codePointAt(rightIndex);
            if (leftCodePoint != rightCodePoint) {
                return Integer.compare(leftCodePoint, rightCodePoint);
            }
            leftIndex += Character.charCount(leftCodePoint);
            rightIndex += Character.charCount(rightCodePoint);
        }
        return Integer.compare(left.length() - leftIndex, right.length() - rightIndex);
    }
}
