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

package org.lattice.types;

import org.lattice.annotation.Public;

import java.util.Arrays;

/**
 * 用于创建 {@link DataType} 的工厂方法集合。
 *
 * <pre>{@code
 * DataType ids = DataTypes.INT64();
 * DataType names = DataTypes.DICTIONARY(DataTypes.INT32(), DataTypes.STRING());
 * DataType points = DataTypes.STRUCT(
 *         DataTypes.FIELD("x", DataTypes.DOUBLE()),
 *         DataTypes.FIELD("y", DataTypes.DOUBLE()));
 * }</pre>
 */
@Public
public class DataTypes {

    public static NullType NULL() {
        return new NullType();
    }

    public static BooleanType BOOLEAN() {
        return new BooleanType();
    }

    public static Int8Type INT8() {
        return new Int8Type();
    }

    public static UInt8Type UINT8() {
        return new UInt8Type();
    }

    public static Int16Type INT16() {
        return new Int16Type();
    }

    public static UInt16Type UINT16() {
        return new UInt16Type();
    }

    public static Int32Type INT32() {
        return new Int32Type();
    }

    public static UInt32Type UINT32() {
        return new UInt32Type();
    }

    public static Int64Type INT64() {
        return new Int64Type();
    }

    public static UInt64Type UINT64() {
        return new UInt64Type();
    }

    public static HalfFloatType HALF_FLOAT() {
        return new HalfFloatType();
    }

    public static FloatType FLOAT() {
        return new FloatType();
    }

    public static DoubleType DOUBLE() {
        return new DoubleType();
    }

    public static StringType STRING() {
        return new StringType();
    }

    public static BinaryType BINARY() {
        return new BinaryType();
    }

    public static LargeStringType LARGE_STRING() {
        return new LargeStringType();
    }

    public static LargeBinaryType LARGE_BINARY() {
        return new LargeBinaryType();
    }

    public static FixedSizeBinaryType FIXED_SIZE_BINARY(int byteWidth) {
        return new FixedSizeBinaryType(byteWidth);
    }

    public static Date32Type DATE32() {
        return new Date32Type();
    }

    public static Date64Type DATE64() {
        return new Date64Type();
    }

    public static TimestampType TIMESTAMP(TimeUnit unit) {
        return new TimestampType(unit);
    }

    public static TimestampType TIMESTAMP(TimeUnit unit, String timezone) {
        return new TimestampType(unit, timezone);
    }

    public static Time32Type TIME32(TimeUnit unit) {
        return new Time32Type(unit);
    }

    public static Time64Type TIME64(TimeUnit unit) {
        return new Time64Type(unit);
    }

    public static MonthIntervalType INTERVAL_MONTHS() {
        return new MonthIntervalType();
    }

    public static DayTimeIntervalType INTERVAL_DAY_TIME() {
        return new DayTimeIntervalType();
    }

    public static Decimal128Type DECIMAL128(int precision, int scale) {
        return new Decimal128Type(precision, scale);
    }

    public static DurationType DURATION(TimeUnit unit) {
        return new DurationType(unit);
    }

    public static ListType LIST(DataType valueType) {
        return new ListType(valueType);
    }

    public static LargeListType LARGE_LIST(DataType valueType) {
        return new LargeListType(valueType);
    }

    public static FixedSizeListType FIXED_SIZE_LIST(DataType valueType, int listSize) {
        return new FixedSizeListType(valueType, listSize);
    }

    public static MapType MAP(DataType keyType, DataType itemType) {
        return new MapType(keyType, itemType);
    }

    public static DataField FIELD(String name, DataType type) {
        return new DataField(name, type);
    }

    public static DataField FIELD(String name, DataType type, boolean nullable) {
        return new DataField(name, type, nullable);
    }

    public static StructType STRUCT(DataField... fields) {
        return new StructType(Arrays.asList(fields));
    }

    /** 创建稀疏联合类型,类型码依次为 0, 1, 2, ...。 */
    public static SparseUnionType SPARSE_UNION(DataField... fields) {
        return new SparseUnionType(Arrays.asList(fields), sequentialCodes(fields.length));
    }

    /** 创建稠密联合类型,类型码依次为 0, 1, 2, ...。 */
    public static DenseUnionType DENSE_UNION(DataField... fields) {
        return new DenseUnionType(Arrays.asList(fields), sequentialCodes(fields.length));
    }

    public static DictionaryType DICTIONARY(IntegerType indexType, DataType valueType) {
        return new DictionaryType(indexType, valueType);
    }

    private static byte[] sequentialCodes(int count) {
        byte[] codes = new byte[count];
        for (int i = 0; i < count; i++) {
            codes[i] = (byte) i;
        }
        return codes;
    }

    private DataTypes() {}
}
