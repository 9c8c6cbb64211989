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

/**
 * {@link TypeVisitor} 的默认实现,将所有调用重定向到 {@link #defaultMethod(DataType)}。
 *
 * <p>子类只需重写关心的 visit 方法,其余类型由默认方法统一处理,例如抛出异常表示不支持。
 *
 * @param <R> 访问结果的类型
 */
@Public
public abstract class TypeDefaultVisitor<R> implements TypeVisitor<R> {

    @Override
    public R visit(NullType nullType) {
        return defaultMethod(nullType);
    }

    @Override
    public R visit(BooleanType booleanType) {
        return defaultMethod(booleanType);
    }

    @Override
    public R visit(UInt8Type uint8Type) {
        return defaultMethod(uint8Type);
    }

    @Override
    public R visit(Int8Type int8Type) {
        return defaultMethod(int8Type);
    }

    @Override
    public R visit(UInt16Type uint16Type) {
        return defaultMethod(uint16Type);
    }

    @Override
    public R visit(Int16Type int16Type) {
        return defaultMethod(int16Type);
    }

    @Override
    public R visit(UInt32Type uint32Type) {
        return defaultMethod(uint32Type);
    }

    @Override
    public R visit(Int32Type int32Type) {
        return defaultMethod(int32Type);
    }

    @Override
    public R visit(UInt64Type uint64Type) {
        return defaultMethod(uint64Type);
    }

    @Override
    public R visit(Int64Type int64Type) {
        return defaultMethod(int64Type);
    }

    @Override
    public R visit(HalfFloatType halfFloatType) {
        return defaultMethod(halfFloatType);
    }

    @Override
    public R visit(FloatType floatType) {
        return defaultMethod(floatType);
    }

    @Override
    public R visit(DoubleType doubleType) {
        return defaultMethod(doubleType);
    }

    @Override
    public R visit(StringType stringType) {
        return defaultMethod(stringType);
    }

    @Override
    public R visit(BinaryType binaryType) {
        return defaultMethod(binaryType);
    }

    @Override
    public R visit(LargeStringType largeStringType) {
        return defaultMethod(largeStringType);
    }

    @Override
    public R visit(LargeBinaryType largeBinaryType) {
        return defaultMethod(largeBinaryType);
    }

    @Override
    public R visit(FixedSizeBinaryType fixedSizeBinaryType) {
        return defaultMethod(fixedSizeBinaryType);
    }

    @Override
    public R visit(Date32Type date32Type) {
        return defaultMethod(date32Type);
    }

    @Override
    public R visit(Date64Type date64Type) {
        return defaultMethod(date64Type);
    }

    @Override
    public R visit(TimestampType timestampType) {
        return defaultMethod(timestampType);
    }

    @Override
    public R visit(Time32Type time32Type) {
        return defaultMethod(time32Type);
    }

    @Override
    public R visit(Time64Type time64Type) {
        return defaultMethod(time64Type);
    }

    @Override
    public R visit(MonthIntervalType monthIntervalType) {
        return defaultMethod(monthIntervalType);
    }

    @Override
    public R visit(DayTimeIntervalType dayTimeIntervalType) {
        return defaultMethod(dayTimeIntervalType);
    }

    @Override
    public R visit(Decimal128Type decimal128Type) {
        return defaultMethod(decimal128Type);
    }

    @Override
    public R visit(DurationType durationType) {
        return defaultMethod(durationType);
    }

    @Override
    public R visit(ListType listType) {
        return defaultMethod(listType);
    }

    @Override
    public R visit(LargeListType largeListType) {
        return defaultMethod(largeListType);
    }

    @Override
    public R visit(FixedSizeListType fixedSizeListType) {
        return defaultMethod(fixedSizeListType);
    }

    @Override
    public R visit(MapType mapType) {
        return defaultMethod(mapType);
    }

    @Override
    public R visit(StructType structType) {
        return defaultMethod(structType);
    }

    @Override
    public R visit(SparseUnionType sparseUnionType) {
        return defaultMethod(sparseUnionType);
    }

    @Override
    public R visit(DenseUnionType denseUnionType) {
        return defaultMethod(denseUnionType);
    }

    @Override
    public R visit(DictionaryType dictionaryType) {
        return defaultMethod(dictionaryType);
    }

    @Override
    public R visit(ExtensionType extensionType) {
        return defaultMethod(extensionType);
    }

    /**
     * 默认访问方法,由所有未被重写的 visit 方法调用。
     *
     * @param dataType 被访问的数据类型
     * @return 访问结果
     */
    protected abstract R defaultMethod(DataType dataType);
}
