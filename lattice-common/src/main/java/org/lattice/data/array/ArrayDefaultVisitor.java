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

package org.lattice.data.array;

import org.lattice.annotation.Public;

/**
 * {@link ArrayVisitor} 的默认实现,将所有调用重定向到 {@link #defaultMethod(Array)}。
 *
 * @param <R> 访问结果的类型
 */
@Public
public abstract class ArrayDefaultVisitor<R> implements ArrayVisitor<R> {

    @Override
    public R visitNull(NullArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitBoolean(BooleanArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitUInt8(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitInt8(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitUInt16(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitInt16(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitUInt32(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitInt32(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitUInt64(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitInt64(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitHalfFloat(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitFloat(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitDouble(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitString(BinaryArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitBinary(BinaryArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitLargeString(BinaryArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitLargeBinary(BinaryArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitFixedSizeBinary(FixedSizeBinaryArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitDate32(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitDate64(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitTimestamp(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitTime32(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitTime64(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitMonthInterval(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitDayTimeInterval(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitDecimal128(Decimal128Array array) {
        return defaultMethod(array);
    }

    @Override
    public R visitDuration(PrimitiveArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitList(ListArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitLargeList(ListArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitFixedSizeList(FixedSizeListArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitMap(MapArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitStruct(StructArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitSparseUnion(UnionArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitDenseUnion(UnionArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitDictionary(DictionaryArray array) {
        return defaultMethod(array);
    }

    @Override
    public R visitExtension(ExtensionArray array) {
        return defaultMethod(array);
    }

    protected abstract R defaultMethod(Array array);
}
