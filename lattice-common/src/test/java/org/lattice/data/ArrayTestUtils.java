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
import org.lattice.types.DataType;
import org.lattice.types.DataTypes;
import org.lattice.types.ExtensionType;
import org.lattice.types.FixedSizeBinaryType;
import org.lattice.types.TimeUnit;
import org.lattice.types.TypeId;
import org.lattice.utils.BitUtil;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 构造测试用 {@link ArrayData} 的工具类。
 *
 * <p>有效位图用字符串描述,第 {@code i} 个字符为 {@code '1'} 表示位置 {@code i} 有效,
 * 例如 {@code "10110"}。传入 null 表示没有有效位图。
 */
public class ArrayTestUtils {

    /** 由 0/1 字符串构造位图,大小恰好为所需的字节数。 */
    public static Buffer bitmap(String bits) {
        Buffer buffer = Buffer.allocate(BitUtil.bytesForBits(bits.length()));
        for (int i = 0; i < bits.length(); i++) {
            if (bits.charAt(i) == '1') {
                BitUtil.setBit(buffer, i);
            }
        }
        return buffer;
    }

    public static int nullCount(@Nullable String validity) {
        if (validity == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < validity.length(); i++) {
            if (validity.charAt(i) == '0') {
                count++;
            }
        }
        return count;
    }

    @Nullable
    private static Buffer validityOf(@Nullable String validity) {
        return validity == null ? null : bitmap(validity);
    }

    public static Buffer int32Buffer(int... values) {
        Buffer buffer = Buffer.allocate(values.length * 4);
        for (int i = 0; i < values.length; i++) {
            buffer.putInt(i * 4, values[i]);
        }
        return buffer;
    }

    public static Buffer int64Buffer(long... values) {
        Buffer buffer = Buffer.allocate(values.length * 8);
        for (int i = 0; i < values.length; i++) {
            buffer.putLong(i * 8, values[i]);
        }
        return buffer;
    }

    public static Buffer utf8(String s) {
        return Buffer.wrap(s.getBytes(StandardCharsets.UTF_8));
    }

    public static ArrayData int32Array(@Nullable String validity, int... values) {
        return ArrayData.of(
                DataTypes.INT32(),
                values.length,
                nullCount(validity),
                validityOf(validity),
                int32Buffer(values));
    }

    public static ArrayData int64Array(@Nullable String validity, long... values) {
        return ArrayData.of(
                DataTypes.INT64(),
                values.length,
                nullCount(validity),
                validityOf(validity),
                int64Buffer(values));
    }

    public static ArrayData doubleArray(@Nullable String validity, double... values) {
        Buffer buffer = Buffer.allocate(values.length * 8);
        for (int i = 0; i < values.length; i++) {
            buffer.putDouble(i * 8, values[i]);
        }
        return ArrayData.of(
                DataTypes.DOUBLE(),
                values.length,
                nullCount(validity),
                validityOf(validity),
                buffer);
    }

    public static ArrayData booleanArray(@Nullable String validity, String values) {
        return ArrayData.of(
                DataTypes.BOOLEAN(),
                values.length(),
                nullCount(validity),
                validityOf(validity),
                bitmap(values));
    }

    /** 字符串数组,元素为 null 的位置在位图中置为无效。 */
    public static ArrayData stringArray(String... values) {
        return binaryArray(DataTypes.STRING(), values);
    }

    public static ArrayData largeStringArray(String... values) {
        return binaryArray(DataTypes.LARGE_STRING(), values);
    }

    private static ArrayData binaryArray(DataType type, String... values) {
        boolean large = type.equals(DataTypes.LARGE_STRING());
        StringBuilder data = new StringBuilder();
        StringBuilder validity = new StringBuilder();
        long[] offsets = new long[values.length + 1];
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                data.append(values[i]);
            }
            validity.append(values[i] == null ? '0' : '1');
            offsets[i + 1] = data.toString().getBytes(StandardCharsets.UTF_8).length;
        }
        Buffer offsetBuffer;
        if (large) {
            offsetBuffer = int64Buffer(offsets);
        } else {
            int[] intOffsets = new int[offsets.length];
            for (int i = 0; i < offsets.length; i++) {
                intOffsets[i] = (int) offsets[i];
            }
            offsetBuffer = int32Buffer(intOffsets);
        }
        String bits = validity.toString();
        return ArrayData.of(
                type,
                values.length,
                nullCount(bits),
                bits.contains("0") ? bitmap(bits) : null,
                offsetBuffer,
                utf8(data.toString()));
    }

    public static ArrayData fixedSizeBinaryArray(
            FixedSizeBinaryType type, @Nullable String validity, byte[]... values) {
        int width = type.byteWidth();
        Buffer records = Buffer.allocate(values.length * width);
        for (int i = 0; i < values.length; i++) {
            records.put(i * width, values[i]);
        }
        return ArrayData.of(
                type, values.length, nullCount(validity), validityOf(validity), records);
    }

    /** 以 int32 偏移量构造列表数组。 */
    public static ArrayData listArray(
            DataType type, @Nullable String validity, ArrayData values, int... offsets) {
        return ArrayData.of(
                type,
                offsets.length - 1,
                nullCount(validity),
                Arrays.asList(validityOf(validity), int32Buffer(offsets)),
                Collections.singletonList(values));
    }

    public static ArrayData structArray(
            DataType type, @Nullable String validity, int length, ArrayData... children) {
        return ArrayData.of(
                type,
                length,
                nullCount(validity),
                Collections.singletonList(validityOf(validity)),
                Arrays.asList(children));
    }

    /** 每个非保留类型标签的一个示例类型。 */
    public static DataType sampleType(TypeId typeId) {
        switch (typeId) {
            case NA:
                return DataTypes.NULL();
            case BOOL:
                return DataTypes.BOOLEAN();
            case UINT8:
                return DataTypes.UINT8();
            case INT8:
                return DataTypes.INT8();
            case UINT16:
                return DataTypes.UINT16();
            case INT16:
                return DataTypes.INT16();
            case UINT32:
                return DataTypes.UINT32();
            case INT32:
                return DataTypes.INT32();
            case UINT64:
                return DataTypes.UINT64();
            case INT64:
                return DataTypes.INT64();
            case HALF_FLOAT:
                return DataTypes.HALF_FLOAT();
            case FLOAT:
                return DataTypes.FLOAT();
            case DOUBLE:
                return DataTypes.DOUBLE();
            case STRING:
                return DataTypes.STRING();
            case BINARY:
                return DataTypes.BINARY();
            case LARGE_STRING:
                return DataTypes.LARGE_STRING();
            case LARGE_BINARY:
                return DataTypes.LARGE_BINARY();
            case FIXED_SIZE_BINARY:
                return DataTypes.FIXED_SIZE_BINARY(4);
            case DATE32:
                return DataTypes.DATE32();
            case DATE64:
                return DataTypes.DATE64();
            case TIMESTAMP:
                return DataTypes.TIMESTAMP(TimeUnit.MICROSECOND, "UTC");
            case TIME32:
                return DataTypes.TIME32(TimeUnit.MILLISECOND);
            case TIME64:
                return DataTypes.TIME64(TimeUnit.NANOSECOND);
            case INTERVAL_MONTHS:
                return DataTypes.INTERVAL_MONTHS();
            case INTERVAL_DAY_TIME:
                return DataTypes.INTERVAL_DAY_TIME();
            case DECIMAL128:
                return DataTypes.DECIMAL128(10, 2);
            case DURATION:
                return DataTypes.DURATION(TimeUnit.SECOND);
            case LIST:
                return DataTypes.LIST(DataTypes.INT32());
            case LARGE_LIST:
                return DataTypes.LARGE_LIST(DataTypes.INT32());
            case FIXED_SIZE_LIST:
                return DataTypes.FIXED_SIZE_LIST(DataTypes.INT32(), 3);
            case MAP:
                return DataTypes.MAP(DataTypes.STRING(), DataTypes.INT64());
            case STRUCT:
                return DataTypes.STRUCT(DataTypes.FIELD("a", DataTypes.INT32()));
            case SPARSE_UNION:
                return DataTypes.SPARSE_UNION(DataTypes.FIELD("a", DataTypes.INT32()));
            case DENSE_UNION:
                return DataTypes.DENSE_UNION(DataTypes.FIELD("a", DataTypes.INT32()));
            case DICTIONARY:
                return DataTypes.DICTIONARY(DataTypes.INT32(), DataTypes.STRING());
            case EXTENSION:
                return new UuidType();
            default:
                throw new IllegalArgumentException("No sample for " + typeId);
        }
    }

    /** 长度为 0 的数组数据,字典类型附带空字典。 */
    public static ArrayData emptyArray(DataType type) {
        return new ArrayData(
                type,
                0,
                0,
                0,
                Collections.<Buffer>emptyList(),
                Collections.<ArrayData>emptyList(),
                type.is(TypeId.DICTIONARY) ? stringArray() : null);
    }

    public static List<Buffer> buffers(@Nullable Buffer... buffers) {
        return new ArrayList<>(Arrays.asList(buffers));
    }

    public static byte[] bytes(int... values) {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            bytes[i] = (byte) values[i];
        }
        return bytes;
    }

    /** 以 16 字节定长二进制存储的 UUID 扩展类型。 */
    public static class UuidType extends ExtensionType {

        private static final long serialVersionUID = 1L;

        public UuidType() {
            super(DataTypes.FIXED_SIZE_BINARY(16));
        }

        @Override
        public String extensionName() {
            return "uuid";
        }

        @Override
        protected boolean extensionEquals(ExtensionType other) {
            return other instanceof UuidType;
        }
    }

    /** 使用保留类型标签的类型,尚无任何分派分支。 */
    public static class ReservedType extends DataType {

        private static final long serialVersionUID = 1L;

        public ReservedType(TypeId typeId) {
            super(typeId);
        }

        @Override
        public String asSQLString() {
            return getTypeId().name();
        }
    }

    private ArrayTestUtils() {}
}
