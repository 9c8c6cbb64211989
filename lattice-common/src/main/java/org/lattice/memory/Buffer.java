/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lattice.memory;

import org.lattice.annotation.Public;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import static org.lattice.utils.Preconditions.checkArgument;
import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 列式数据使用的一块连续堆内存。
 *
 * <p>所有多字节数值都按小端序读写,与列式格式在内存中的约定一致。索引都是字节索引,
 * 不包含任何切片偏移量:切片由 {@link org.lattice.data.ArrayData} 的 offset 表示,
 * 缓冲区本身从不移动。
 *
 * <p>遍历期间缓冲区只读,多个线程可以同时读取同一个缓冲区。{@code put*} 系列方法只供容器层
 * 在构建数组时使用,构建完成后不应再写入。
 */
@Public
public final class Buffer {

    private static final Buffer EMPTY = new Buffer(new byte[0]);

    /** 底层字节数组。 */
    private final byte[] heapMemory;

    /** 以小端序包装 {@link #heapMemory} 的视图,只做绝对位置的读写。 */
    private final ByteBuffer wrapper;

    private Buffer(byte[] heapMemory) {
        this.heapMemory = heapMemory;
        this.wrapper = ByteBuffer.wrap(heapMemory).order(ByteOrder.LITTLE_ENDIAN);
    }

    /** 包装已有字节数组,不复制。 */
    public static Buffer wrap(byte[] bytes) {
        checkNotNull(bytes, "Bytes must not be null.");
        return bytes.length == 0 ? EMPTY : new Buffer(bytes);
    }

    /** 分配 {@code size} 字节、内容全为 0 的缓冲区。 */
    public static Buffer allocate(int size) {
        checkArgument(size >= 0, "Buffer size must not be negative: %s", size);
        return size == 0 ? EMPTY : new Buffer(new byte[size]);
    }

    /** 缓冲区的字节数。 */
    public int size() {
        return heapMemory.length;
    }

    public byte get(int index) {
        return heapMemory[index];
    }

    /**
     * 将 {@code [index, index + length)} 范围的字节复制到 {@code dst}。
     *
     * @param index 源缓冲区中的起始字节索引
     * @param dst 目标数组
     * @param dstOffset 目标数组中的起始位置
     * @param length 复制的字节数
     */
    public void get(int index, byte[] dst, int dstOffset, int length) {
        System.arraycopy(heapMemory, index, dst, dstOffset, length);
    }

    public short getShort(int index) {
        return wrapper.getShort(index);
    }

    public int getInt(int index) {
        return wrapper.getInt(index);
    }

    public long getLong(int index) {
        return wrapper.getLong(index);
    }

    public float getFloat(int index) {
        return wrapper.getFloat(index);
    }

    public double getDouble(int index) {
        return wrapper.getDouble(index);
    }

    public void put(int index, byte b) {
        heapMemory[index] = b;
    }

    public void put(int index, byte[] src) {
        System.arraycopy(src, 0, heapMemory, index, src.length);
    }

    public void putShort(int index, short value) {
        wrapper.putShort(index, value);
    }

    public void putInt(int index, int value) {
        wrapper.putInt(index, value);
    }

    public void putLong(int index, long value) {
        wrapper.putLong(index, value);
    }

    public void putFloat(int index, float value) {
        wrapper.putFloat(index, value);
    }

    public void putDouble(int index, double value) {
        wrapper.putDouble(index, value);
    }

    /**
     * 比较两个缓冲区指定区域的字节是否相同。
     *
     * @param other 另一个缓冲区
     * @param offset1 当前缓冲区中的起始位置
     * @param offset2 另一个缓冲区中的起始位置
     * @param length 比较的字节数
     */
    public boolean equalTo(Buffer other, int offset1, int offset2, int length) {
        for (int i = 0; i < length; i++) {
            if (heapMemory[offset1 + i] != other.heapMemory[offset2 + i]) {
                return false;
            }
        }
        return true;
    }

    /** 复制全部内容到新的字节数组。 */
    public byte[] toBytes() {
        return Arrays.copyOf(heapMemory, heapMemory.length);
    }

    @Override
    public String toString() {
        return "Buffer{size=" + heapMemory.length + "}";
    }
}
