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

package org.lattice.data.scalar;

import org.lattice.annotation.Public;

/**
 * {@link ScalarVisitor} 的默认实现,将所有调用重定向到 {@link #defaultMethod(Scalar)}。
 *
 * @param <R> 访问结果的类型
 */
@Public
public abstract class ScalarDefaultVisitor<R> implements ScalarVisitor<R> {

    @Override
    public R visitNull(NullScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitBoolean(BooleanScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitUInt8(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitInt8(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitUInt16(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitInt16(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitUInt32(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitInt32(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitUInt64(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitInt64(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitHalfFloat(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitFloat(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitDouble(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitString(BinaryScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitBinary(BinaryScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitLargeString(BinaryScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitLargeBinary(BinaryScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitFixedSizeBinary(FixedSizeBinaryScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitDate32(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitDate64(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitTimestamp(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitTime32(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitTime64(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitMonthInterval(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitDayTimeInterval(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitDecimal128(Decimal128Scalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitDuration(PrimitiveScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitList(ListScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitLargeList(ListScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitFixedSizeList(ListScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitMap(ListScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitStruct(StructScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitSparseUnion(UnionScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitDenseUnion(UnionScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitDictionary(DictionaryScalar scalar) {
        return defaultMethod(scalar);
    }

    @Override
    public R visitExtension(ExtensionScalar scalar) {
        return defaultMethod(scalar);
    }

    protected abstract R defaultMethod(Scalar scalar);
}
