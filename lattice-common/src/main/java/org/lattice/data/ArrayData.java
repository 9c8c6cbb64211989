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

package org.lattice.data;

import org.lattice.annotation.Public;
import org.lattice.memory.Buffer;
import org.lattice.types.DataType;
import org.lattice.types.TypeId;
import org.lattice.utils.BitUtil;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.lattice.utils.Preconditions.checkArgument;
import static org.lattice.utils.Preconditions.checkElementIndex;
import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 一段列式数据的物理表示:类型、逻辑长度、切片偏移、缓冲区列表、子数组和可选的字典。
 *
 * <p>缓冲区的角色由类型的布局类别决定:
 * <ul>
 *   <li>定宽与布尔: {@code [validity?, values]}
 *   <li>变长二进制与字符串: {@code [validity?, offsets, values?]},偏移量为 int32,
 *       LARGE_* 类型为 int64
 *   <li>定长二进制与 decimal128: {@code [validity?, records]}
 *   <li>null 类型: 无缓冲区,所有位置都是 null
 * </ul>
 *
 * <p>切片规则: 有效位图、定宽值缓冲区和偏移量缓冲区都按 {@code offset} 寻址;变长类型的值缓冲区
 * 永远不按 offset 平移,它按偏移量中存储的绝对位置寻址。
 *
 * <p>缓冲区列表中的元素可以为 null,表示缺失。有效位图缺失表示 {@code [offset, offset + length)}
 * 内所有位置都有效;变长值缓冲区缺失表示数据为空。
 *
 * <p>ArrayData 是不可变的,{@link #slice} 得到的新实例与原实例共享缓冲区。
 */
@Public
public final class ArrayData {

    /** null 计数尚未计算时的标记值。 */
    public static final int UNKNOWN_NULL_COUNT = -1;

    private final DataType type;

    private final int length;

    private final int offset;

    private final int nullCount;

    private final List<Buffer> buffers;

    private final List<ArrayData> children;

    @Nullable private final ArrayData dictionary;

    public ArrayData(
            DataType type,
            int length,
            int offset,
            int nullCount,
            List<Buffer> buffers,
            List<ArrayData> children,
            @Nullable ArrayData dictionary) {
        this.type = checkNotNull(type, "Type must not be null.");
        checkArgument(length >= 0, "Length must not be negative: %s", length);
        checkArgument(offset >= 0, "Offset must not be negative: %s", offset);
        checkArgument(
                nullCount >= UNKNOWN_NULL_COUNT && nullCount <= length,
                "Invalid null count %s for length %s",
                nullCount,
                length);
        this.length = length;
        this.offset = offset;
        this.nullCount = nullCount;
        this.buffers = Collections.unmodifiableList(new ArrayList<>(buffers));
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.dictionary = dictionary;
    }

    /** 创建 offset 为 0、没有子数组的 ArrayData。 */
    public static ArrayData of(
            DataType type, int length, int nullCount, @Nullable Buffer... buffers) {
        return new ArrayData(
                type, length, 0, nullCount, Arrays.asList(buffers), Collections.emptyList(), null);
    }

    /** 创建 offset 为 0、带有子数组的 ArrayData。 */
    public static ArrayData of(
            DataType type,
            int length,
            int nullCount,
            List<Buffer> buffers,
            List<ArrayData> children) {
        return new ArrayData(type, length, 0, nullCount, buffers, children, null);
    }

    public DataType getType() {
        return type;
    }

    public TypeId getTypeId() {
        return type.getTypeId();
    }

    public int getLength() {
        return length;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * 返回构造时给出的 null 计数,可能是 {@link #UNKNOWN_NULL_COUNT}。
     *
     * <p>遍历逻辑不依赖该值,见 {@link #getNullCount()}。
     */
    public int getStoredNullCount() {
        return nullCount;
    }

    /**
     * 返回 null 的个数。未知时根据有效位图计算,但不会修改当前实例。
     *
     * <p>null 类型的所有位置都是 null;没有有效位图的其他类型没有 null。
     */
    public int getNullCount() {
        if (nullCount != UNKNOWN_NULL_COUNT) {
            return nullCount;
        }
        if (type.is(TypeId.NA)) {
            return length;
        }
        Buffer validity = getValidityBuffer();
        if (validity == null) {
            return 0;
        }
        return length - BitUtil.countSetBits(validity, offset, length);
    }

    public List<Buffer> getBuffers() {
        return buffers;
    }

    public int getBufferCount() {
        return buffers.size();
    }

    /** 返回第 {@code i} 个缓冲区;下标越界或缓冲区缺失时返回 null。 */
    @Nullable
    public Buffer getBuffer(int i) {
        return i < buffers.size() ? buffers.get(i) : null;
    }

    /** 有效位图,即第 0 个缓冲区。 */
    @Nullable
    public Buffer getValidityBuffer() {
        return getBuffer(0);
    }

    public List<ArrayData> getChildren() {
        return children;
    }

    public ArrayData getChild(int i) {
        checkElementIndex(i, children.size(), "Child index out of range");
        return children.get(i);
    }

    @Nullable
    public ArrayData getDictionary() {
        return dictionary;
    }

    /**
     * 返回共享缓冲区的切片视图。
     *
     * @param offset 相对当前切片的起始位置
     * @param length 切片长度
     */
    public ArrayData slice(int offset, int length) {
        checkArgument(
                offset >= 0 && length >= 0 && offset + length <= this.length,
                "Slice [%s, %s) out of range for length %s",
                offset,
                offset + length,
                this.length);
        int slicedNullCount;
        if (nullCount == 0) {
            slicedNullCount = 0;
        } else if (nullCount == this.length) {
            slicedNullCount = length;
        } else {
            slicedNullCount = UNKNOWN_NULL_COUNT;
        }
        return new ArrayData(
                type,
                length,
                this.offset + offset,
                slicedNullCount,
                buffers,
                children,
                dictionary);
    }

    /** 返回替换类型后的新实例,缓冲区与子数组共享。扩展类型用它得到存储类型的视图。 */
    public ArrayData withType(DataType newType) {
        return new ArrayData(newType, length, offset, nullCount, buffers, children, dictionary);
    }

    @Override
    public String toString() {
        return "ArrayData{"
                + "type="
                + type
                + ", length="
                + length
                + ", offset="
                + offset
                + ", nullCount="
                + nullCount
                + ", buffers="
                + buffers.size()
                + ", children="
                + children.size()
                + '}';
    }
}
