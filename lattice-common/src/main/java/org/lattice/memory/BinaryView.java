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

import java.nio.charset.StandardCharsets;

/**
 * 缓冲区中一段连续字节的借用视图。
 *
 * <p>BinaryView 只记录起始位置和长度,不复制数据。只有 {@link #toBytes()} 和
 * {@link #toUtf8String()} 会产生副本。
 *
 * <p>视图借用自某个数组的数据缓冲区,仅在源数组存活期间有效。遍历回调收到的视图不应在回调
 * 返回后继续保留;需要保留时请调用 {@link #toBytes()}。
 *
 * <p>{@link #compareTo} 按无符号字节做字典序比较,较短的前缀排在前面。
 */
@Public
public final class BinaryView implements Comparable<BinaryView> {

    private final Buffer buffer;

    private final int offset;

    private final int length;

    public BinaryView(Buffer buffer, int offset, int length) {
        this.buffer = buffer;
        this.offset = offset;
        this.length = length;
    }

    /** 包装字节数组的视图,主要用于比较和测试。 */
    public static BinaryView of(byte[] bytes) {
        return new BinaryView(Buffer.wrap(bytes), 0, bytes.length);
    }

    public static BinaryView ofUtf8(String s) {
        return of(s.getBytes(StandardCharsets.UTF_8));
    }

    public Buffer buffer() {
        return buffer;
    }

    /** 视图在缓冲区中的起始字节索引。 */
    public int offset() {
        return offset;
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /** 读取视图内第 {@code index} 个字节。 */
    public byte byteAt(int index) {
        return buffer.get(offset + index);
    }

    public byte[] toBytes() {
        byte[] bytes = new byte[length];
        if (length > 0) {
            buffer.get(offset, bytes, 0, length);
        }
        return bytes;
    }

    /** 将视图内容按 UTF-8 解码为字符串。 */
    public String toUtf8String() {
        return new String(toBytes(), StandardCharsets.UTF_8);
    }

    @Override
    public int compareTo(BinaryView other) {
        int len = Math.min(length, other.length);
        for (int i = 0; i < len; i++) {
            int res = (byteAt(i) & 0xFF) - (other.byteAt(i) & 0xFF);
            if (res != 0) {
                return res;
            }
        }
        return length - other.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BinaryView)) {
            return false;
        }
        BinaryView that = (BinaryView) o;
        return length == that.length && buffer.equalTo(that.buffer, offset, that.offset, length);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < length; i++) {
            result = 31 * result + byteAt(i);
        }
        return result;
    }

    @Override
    public String toString() {
        return toUtf8String();
    }
}
