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
 * 标量的访问者接口,每个可分发的类型标签对应一个方法。
 *
 * @param <R> 访问结果的类型
 * @see ScalarDispatcher
 */
@Public
public interface ScalarVisitor<R> {

    R visitNull(NullScalar scalar);

    R visitBoolean(BooleanScalar scalar);

    R visitUInt8(PrimitiveScalar scalar);

    R visitInt8(PrimitiveScalar scalar);

    R visitUInt16(PrimitiveScalar scalar);

    R visitInt16(PrimitiveScalar scalar);

    R visitUInt32(PrimitiveScalar scalar);

    R visitInt32(PrimitiveScalar scalar);

    R visitUInt64(PrimitiveScalar scalar);

    R visitInt64(PrimitiveScalar scalar);

    R visitHalfFloat(PrimitiveScalar scalar);

    R visitFloat(PrimitiveScalar scalar);

    R visitDouble(PrimitiveScalar scalar);

    R visitString(BinaryScalar scalar);

    R visitBinary(BinaryScalar scalar);

    R visitLargeString(BinaryScalar scalar);

    R visitLargeBinary(BinaryScalar scalar);

    R visitFixedSizeBinary(FixedSizeBinaryScalar scalar);

    R visitDate32(PrimitiveScalar scalar);

    R visitDate64(PrimitiveScalar scalar);

    R visitTimestamp(PrimitiveScalar scalar);

    R visitTime32(PrimitiveScalar scalar);

    R visitTime64(PrimitiveScalar scalar);

    R visitMonthInterval(PrimitiveScalar scalar);

    R visitDayTimeInterval(PrimitiveScalar scalar);

    R visitDecimal128(Decimal128Scalar scalar);

    R visitDuration(PrimitiveScalar scalar);

    R visitList(ListScalar scalar);

    R visitLargeList(ListScalar scalar);

    R visitFixedSizeList(ListScalar scalar);

    R visitMap(ListScalar scalar);

    R visitStruct(StructScalar scalar);

    R visitSparseUnion(UnionScalar scalar);

    R visitDenseUnion(UnionScalar scalar);

    R visitDictionary(DictionaryScalar scalar);

    R visitExtension(ExtensionScalar scalar);
}
