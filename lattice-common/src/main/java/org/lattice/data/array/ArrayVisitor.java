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
 * 数组的访问者接口,每个可分发的类型标签对应一个方法。
 *
 * <p>多个标签可以共享同一个视图类,例如 {@link #visitInt32} 与 {@link #visitDate32} 都接收
 * {@link PrimitiveArray},因此方法按标签命名而不是按参数类型重载。
 *
 * @param <R> 访问结果的类型
 * @see ArrayDispatcher
 */
@Public
public interface ArrayVisitor<R> {

    R visitNull(NullArray array);

    R visitBoolean(BooleanArray array);

    R visitUInt8(PrimitiveArray array);

    R visitInt8(PrimitiveArray array);

    R visitUInt16(PrimitiveArray array);

    R visitInt16(PrimitiveArray array);

    R visitUInt32(PrimitiveArray array);

    R visitInt32(PrimitiveArray array);

    R visitUInt64(PrimitiveArray array);

    R visitInt64(PrimitiveArray array);

    R visitHalfFloat(PrimitiveArray array);

    R visitFloat(PrimitiveArray array);

    R visitDouble(PrimitiveArray array);

    R visitString(BinaryArray array);

    R visitBinary(BinaryArray array);

    R visitLargeString(BinaryArray array);

    R visitLargeBinary(BinaryArray array);

    R visitFixedSizeBinary(FixedSizeBinaryArray array);

    R visitDate32(PrimitiveArray array);

    R visitDate64(PrimitiveArray array);

    R visitTimestamp(PrimitiveArray array);

    R visitTime32(PrimitiveArray array);

    R visitTime64(PrimitiveArray array);

    R visitMonthInterval(PrimitiveArray array);

    R visitDayTimeInterval(PrimitiveArray array);

    R visitDecimal128(Decimal128Array array);

    R visitDuration(PrimitiveArray array);

    R visitList(ListArray array);

    R visitLargeList(ListArray array);

    R visitFixedSizeList(FixedSizeListArray array);

    R visitMap(MapArray array);

    R visitStruct(StructArray array);

    R visitSparseUnion(UnionArray array);

    R visitDenseUnion(UnionArray array);

    R visitDictionary(DictionaryArray array);

    R visitExtension(ExtensionArray array);
}
