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

import org.lattice.memory.Buffer;
import org.lattice.types.BaseBinaryType;
import org.lattice.types.DataType;
import org.lattice.types.DictionaryType;
import org.lattice.types.ExtensionType;
import org.lattice.types.FixedSizeListType;
import org.lattice.types.FixedWidthType;
import org.lattice.types.LayoutCategory;
import org.lattice.types.NestedType;
import org.lattice.types.TypeId;
import org.lattice.types.UnionType;
import org.lattice.utils.BitUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * 检查 {@link ArrayData} 是否满足内存布局约定。
 *
 * <p>检查内容包括: 每种布局的缓冲区个数、有效位图与值缓冲区的大小、偏移量单调不减且不越过值缓冲区、
 * 已知的 null 计数与位图一致。检查只针对物理布局,不涉及任何模式 (schema) 语义。
 *
 * <p>遍历逻辑从不调用该类,违反约定的输入在遍历时的行为未定义。构造来自外部的数据时应先调用
 * {@link #validate(ArrayData)}。
 */
public class ArrayDataValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ArrayDataValidator.class);

    /**
     * 校验给定数据及其子数组、字典。
     *
     * @throws IllegalArgumentException 如果数据违反布局约定
     */
    public static void validate(ArrayData data) {
        validateLayout(data, data.getType());
        validateNullCount(data);
        for (ArrayData child : data.getChildren()) {
            validate(child);
        }
        if (data.getDictionary() != null) {
            validate(data.getDictionary());
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Validated array layout {}", data);
        }
    }

    private static void validateLayout(ArrayData data, DataType type) {
        int end = data.getOffset() + data.getLength();
        switch (type.getLayout()) {
            case NULL:
                for (Buffer buffer : data.getBuffers()) {
                    check(buffer == null, "Null type must not carry buffers: %s", data);
                }
                return;
            case BOOLEAN:
                checkBufferCount(data, 2);
                checkValidity(data);
                checkSize(data, 1, BitUtil.bytesForBits(end), "values");
                return;
            case FIXED_WIDTH:
                checkBufferCount(data, 2);
                checkValidity(data);
                checkSize(data, 1, (long) end * ((FixedWidthType) type).byteWidth(), "values");
                return;
            case FIXED_SIZE_BINARY:
                checkBufferCount(data, 2);
                checkValidity(data);
                checkSize(data, 1, (long) end * ((FixedWidthType) type).byteWidth(), "records");
                return;
            case VARIABLE_BINARY:
                checkBufferCount(data, 3);
                checkValidity(data);
                Buffer values = data.getBuffer(2);
                checkOffsets(
                        data,
                        ((BaseBinaryType) type).isLarge(),
                        values == null ? 0 : values.size());
                return;
            case NESTED:
                validateNested(data, type);
                return;
            case DELEGATED:
                if (type.is(TypeId.DICTIONARY)) {
                    check(data.getDictionary() != null, "Dictionary array without dictionary");
                    validateLayout(data, ((DictionaryType) type).getIndexType());
                } else {
                    validateLayout(data, ((ExtensionType) type).getStorageType());
                }
                return;
            default:
                throw fail("Unknown layout for type %s", type);
        }
    }

    private static void validateNested(ArrayData data, DataType type) {
        int end = data.getOffset() + data.getLength();
        switch (type.getTypeId()) {
            case LIST:
            case MAP:
            case LARGE_LIST:
                checkBufferCount(data, 2);
                checkValidity(data);
                check(data.getChildren().size() == 1, "List array needs one child: %s", data);
                checkOffsets(data, type.is(TypeId.LARGE_LIST), data.getChild(0).getLength());
                return;
            case FIXED_SIZE_LIST:
                checkBufferCount(data, 1);
                checkValidity(data);
                check(data.getChildren().size() == 1, "List array needs one child: %s", data);
                long listSize = ((FixedSizeListType) type).getListSize();
                check(
                        data.getChild(0).getLength() >= end * listSize,
                        "Child of %s is shorter than %s",
                        data,
                        end * listSize);
                return;
            case STRUCT:
                checkBufferCount(data, 1);
                checkValidity(data);
                checkChildren(data, (NestedType) type);
                for (ArrayData child : data.getChildren()) {
                    check(
                            child.getLength() >= end,
                            "Struct child %s is shorter than %s",
                            child,
                            end);
                }
                return;
            case SPARSE_UNION:
            case DENSE_UNION:
                boolean dense = ((UnionType) type).getMode() == UnionType.Mode.DENSE;
                checkBufferCount(data, dense ? 3 : 2);
                check(data.getValidityBuffer() == null, "Union arrays have no validity bitmap");
                checkChildren(data, (NestedType) type);
                checkSize(data, 1, end, "type ids");
                if (dense) {
                    checkSize(data, 2, (long) end * 4, "value offsets");
                }
                return;
            default:
                throw fail("Unknown nested type %s", type);
        }
    }

    private static void validateNullCount(ArrayData data) {
        int stored = data.getStoredNullCount();
        if (stored == ArrayData.UNKNOWN_NULL_COUNT
                || data.getType().getLayout() == LayoutCategory.NULL) {
            return;
        }
        Buffer validity = data.getValidityBuffer();
        int actual =
                validity == null
                        ? 0
                        : data.getLength()
                                - BitUtil.countSetBits(
                                        validity, data.getOffset(), data.getLength());
        check(
                stored == actual,
                "Null count %s does not match validity bitmap (%s) of %s",
                stored,
                actual,
                data);
    }

    private static void checkBufferCount(ArrayData data, int expected) {
        check(
                data.getBufferCount() == expected,
                "Expected %s buffers for %s but got %s",
                expected,
                data.getType(),
                data.getBufferCount());
    }

    private static void checkValidity(ArrayData data) {
        Buffer validity = data.getValidityBuffer();
        if (validity != null) {
            long required = BitUtil.bytesForBits((long) data.getOffset() + data.getLength());
            check(
                    validity.size() >= required,
                    "Validity bitmap of %s has %s bytes, need %s",
                    data,
                    validity.size(),
                    required);
        }
    }

    private static void checkSize(ArrayData data, int index, long required, String role) {
        if (data.getLength() == 0) {
            return;
        }
        Buffer buffer = data.getBuffer(index);
        check(buffer != null, "Missing %s buffer of %s", role, data);
        check(
                buffer.size() >= required,
                "The %s buffer of %s has %s bytes, need %s",
                role,
                data,
                buffer.size(),
                required);
    }

    private static void checkChildren(ArrayData data, NestedType type) {
        check(
                data.getChildren().size() == type.getFieldCount(),
                "Expected %s children for %s but got %s",
                type.getFieldCount(),
                type,
                data.getChildren().size());
    }

    /** 偏移量从 offset 到 offset + length 共 length + 1 个,单调不减且最后一个不超过 limit。 */
    private static void checkOffsets(ArrayData data, boolean large, long limit) {
        int width = large ? 8 : 4;
        int first = data.getOffset();
        int last = first + data.getLength();
        if (data.getLength() == 0 && data.getBuffer(1) == null) {
            return;
        }
        checkSize(data, 1, ((long) last + 1) * width, "offsets");
        Buffer offsets = data.getBuffer(1);
        long previous = readOffset(offsets, first, large);
        check(previous >= 0, "Negative first offset %s in %s", previous, data);
        for (int i = first + 1; i <= last; i++) {
            long current = readOffset(offsets, i, large);
            check(
                    current >= previous,
                    "Offsets of %s are not monotonic at slot %s: %s > %s",
                    data,
                    i - first,
                    previous,
                    current);
            previous = current;
        }
        check(
                previous <= limit,
                "Last offset %s of %s is beyond the value range %s",
                previous,
                data,
                limit);
    }

    private static long readOffset(Buffer offsets, int index, boolean large) {
        return large ? offsets.getLong(index * 8) : offsets.getInt(index * 4);
    }

    private static void check(boolean condition, String template, @Nullable Object... args) {
        if (!condition) {
            throw fail(template, args);
        }
    }

    private static IllegalArgumentException fail(String template, @Nullable Object... args) {
        String message = String.format(template, args);
        LOG.warn("Invalid array layout: {}", message);
        return new IllegalArgumentException(message);
    }

    private ArrayDataValidator() {}
}
