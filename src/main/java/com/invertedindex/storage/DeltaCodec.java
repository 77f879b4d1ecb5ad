package com.invertedindex.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Delta编码器
 *
 * 用于压缩严格递增的整数序列（docId列表、文档内位置列表）。
 * 原理：将绝对值转换为相邻值的差值（delta），
 * 配合VarInt编码可大幅减少存储空间。
 *
 * 示例：[10, 15, 20, 25] -> [10, 5, 5, 5]
 */
public final class DeltaCodec {

    private DeltaCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 对严格递增序列进行Delta编码
     *
     * @param sortedValues 非负严格递增序列
     * @return Delta编码后的数组
     * @throws IllegalArgumentException 如果输入非严格递增、含负数或为null
     */
    public static int[] encode(int[] sortedValues) {
        validateStrictlyIncreasing(sortedValues);
        if (sortedValues.length == 0) {
            return new int[0];
        }

        int[] deltas = new int[sortedValues.length];
        deltas[0] = sortedValues[0];
        for (int i = 1; i < sortedValues.length; i++) {
            deltas[i] = sortedValues[i] - sortedValues[i - 1];
        }
        return deltas;
    }

    /**
     * Delta编码 + VarInt组合编码，直接写入输出流
     *
     * @param sortedValues 非负严格递增序列
     * @param out 输出流
     * @throws IOException IO异常
     */
    public static void encodeDeltaVarInt(int[] sortedValues, OutputStream out) throws IOException {
        for (int delta : encode(sortedValues)) {
            VarIntCodec.writeVarInt(delta, out);
        }
    }

    /**
     * 从输入流读取Delta+VarInt编码的数据并解码
     *
     * @param count 期望读取的值数量
     * @param in 输入流
     * @return 解码后的原始序列
     * @throws IOException IO异常、数据不足或序列非严格递增
     */
    public static int[] decodeDeltaVarInt(int count, InputStream in) throws IOException {
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            int delta = VarIntCodec.readVarInt(in);
            values[i] = accumulate(values, i, delta);
        }
        return values;
    }

    private static int accumulate(int[] values, int index, int delta) throws IOException {
        if (index == 0) {
            return delta;
        }
        if (delta == 0) {
            throw new IndexParseException("delta为0，序列未严格递增，位置 " + index);
        }
        long value = (long) values[index - 1] + delta;
        if (value > Integer.MAX_VALUE) {
            throw new IndexParseException("delta累加溢出，位置 " + index);
        }
        return (int) value;
    }

    private static void validateStrictlyIncreasing(int[] sortedValues) {
        if (sortedValues == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        for (int i = 0; i < sortedValues.length; i++) {
            if (sortedValues[i] < 0) {
                throw new IllegalArgumentException("输入不能包含负数，在位置 " + i + " 处违反");
            }
            if (i > 0 && sortedValues[i] <= sortedValues[i - 1]) {
                throw new IllegalArgumentException("输入必须是严格递增序列，在位置 " + i + " 处违反");
            }
        }
    }
}
