package com.invertedindex.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 编解码器单元测试
 * 
 * 测试 VarIntCodec 和 DeltaCodec 的正确性
 */
class CodecTest {
    
    // ==================== VarIntCodec 测试 ====================
    
    @Test
    @DisplayName("VarInt边界值编码解码测试")
    void testVarIntBoundaryValues() throws IOException {
        int[] testValues = {0, 1, 127, 128, 16383, 16384, Integer.MAX_VALUE};
        
        for (int value : testValues) {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            VarIntCodec.writeVarInt(value, baos);
            ByteArrayInputStream bais = new ByteArrayInputStream(baos.toByteArray());
            int decoded = VarIntCodec.readVarInt(bais);
            
            assertEquals(value, decoded, "VarInt编解码失败，原值: " + value);
            assertEquals(-1, bais.read(), "流应该有且仅有VarInt数据");
        }
    }
    
    @Test
    @DisplayName("VarInt负数应该抛出异常")
    void testVarIntNegativeValue() {
        assertThrows(IllegalArgumentException.class, () -> {
            VarIntCodec.writeVarInt(-1, new ByteArrayOutputStream());
        });
    }

    @Test
    @DisplayName("VarInt读取到一半遇到EOF")
    void testVarIntTruncated() {
        ByteArrayInputStream bais = new ByteArrayInputStream(new byte[]{(byte) 0x80, (byte) 0x80});
        assertThrows(EOFException.class, () -> VarIntCodec.readVarInt(bais));
    }

    @Test
    @DisplayName("VarInt超过32位或解码为负数时报错")
    void testVarIntOverflow() {
        byte[] tooLong = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x01};
        assertThrows(IndexParseException.class, () -> VarIntCodec.readVarInt(new ByteArrayInputStream(tooLong)));

        byte[] negative = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x0F};
        assertThrows(IndexParseException.class, () -> VarIntCodec.readVarInt(new ByteArrayInputStream(negative)));
    }
    
    @ParameterizedTest
    @CsvSource({
        "0, 1",
        "127, 1",
        "128, 2",
        "16383, 2",
        "16384, 3",
        "2097152, 4",
        "268435456, 5",
        "2147483647, 5"
    })
    @DisplayName("VarInt编码字节数")
    void testVarIntEncodedLength(int value, int expectedSize) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        VarIntCodec.writeVarInt(value, baos);
        assertEquals(expectedSize, baos.size());
    }
    
    // ==================== DeltaCodec 测试 ====================
    
    @Test
    @DisplayName("Delta编码解码基本测试")
    void testDeltaEncodeDecode() throws IOException {
        int[] original = {10, 15, 20, 25, 30};
        int[] expectedDeltas = {10, 5, 5, 5, 5};
        
        int[] encoded = DeltaCodec.encode(original);
        assertArrayEquals(expectedDeltas, encoded);
        
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        DeltaCodec.encodeDeltaVarInt(original, baos);
        assertEquals(original.length, baos.size());
        int[] decoded = DeltaCodec.decodeDeltaVarInt(original.length, new ByteArrayInputStream(baos.toByteArray()));
        assertArrayEquals(original, decoded);
    }
    
    @Test
    @DisplayName("Delta编码非严格递增或含负数序列应该抛出异常")
    void testDeltaRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> DeltaCodec.encode(new int[]{10, 15, 12, 20}));
        assertThrows(IllegalArgumentException.class, () -> DeltaCodec.encode(new int[]{3, 3}));
        assertThrows(IllegalArgumentException.class, () -> DeltaCodec.encode(new int[]{-1, 4}));
        assertThrows(IllegalArgumentException.class, () -> DeltaCodec.encode(null));
    }
    
    @Test
    @DisplayName("Delta编码空数组和单元素数组")
    void testDeltaEdgeCases() throws IOException {
        int[] empty = {};
        assertArrayEquals(empty, DeltaCodec.encode(empty));
        assertArrayEquals(empty, DeltaCodec.decodeDeltaVarInt(0, new ByteArrayInputStream(new byte[0])));
        
        int[] single = {42};
        assertArrayEquals(single, DeltaCodec.encode(single));
        assertArrayEquals(single, DeltaCodec.decodeDeltaVarInt(1, new ByteArrayInputStream(new byte[]{42})));
    }

    @Test
    @DisplayName("解码时delta为0视为索引损坏")
    void testDecodeZeroDelta() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        VarIntCodec.writeVarInt(5, baos);
        VarIntCodec.writeVarInt(0, baos);

        ByteArrayInputStream bais = new ByteArrayInputStream(baos.toByteArray());
        assertThrows(IndexParseException.class, () -> DeltaCodec.decodeDeltaVarInt(2, bais));
    }

    @Test
    @DisplayName("解码时delta累加溢出视为索引损坏")
    void testDecodeOverflow() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        VarIntCodec.writeVarInt(Integer.MAX_VALUE, baos);
        VarIntCodec.writeVarInt(1, baos);

        ByteArrayInputStream bais = new ByteArrayInputStream(baos.toByteArray());
        assertThrows(IndexParseException.class, () -> DeltaCodec.decodeDeltaVarInt(2, bais));
    }
    
    @ParameterizedTest
    @ValueSource(ints = {0, 1, 10, 1000})
    @DisplayName("Delta+VarInt随机序列测试")
    void testRandomSequences(int count) throws IOException {
        Random random = new Random(count);
        int[] original = new int[count];
        int current = 0;
        for (int i = 0; i < count; i++) {
            current += random.nextInt(100) + 1; // 随机步长1-100
            original[i] = current;
        }
        
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        DeltaCodec.encodeDeltaVarInt(original, baos);
        
        ByteArrayInputStream bais = new ByteArrayInputStream(baos.toByteArray());
        int[] decoded = DeltaCodec.decodeDeltaVarInt(original.length, bais);
        
        assertArrayEquals(original, decoded);
        assertEquals(-1, bais.read());
    }
}
