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
import org.lattice.data.ArrayData;
import org.lattice.exceptions.NotImplementedException;
import org.lattice.types.DataType;

/**
 * 数组分发器,根据类型标签调用 {@link ArrayVisitor} 中对应的方法。
 *
 * <p>每个非保留标签恰好调用一次访问者方法,参数是该标签对应的具体视图。保留或无法识别的标签抛出
 * {@link NotImplementedException},不调用任何访问者方法。
 */
@Public
public final class ArrayDispatcher {

    /**
     * 分发一个数组视图。
     *
     * @throws NotImplementedException 如果类型标签是保留的或无法识别
     */
    public static <R> R visit(Array array, ArrayVisitor<R> visitor) {
        switch (array.getTypeId()) {
            case NA:
                return visitor.visitNull((NullArray) array);
            case BOOL:
                return visitor.visitBoolean((BooleanArray) array);
            case UINT8:
                return visitor.visitUInt8((PrimitiveArray) array);
            case INT8:
                return visitor.visitInt8((PrimitiveArray) array);
            case UINT16:
                return visitor.visitUInt16((PrimitiveArray) array);
            case INT16:
                return visitor.visitInt16((PrimitiveArray) array);
            case UINT32:
                return visitor.visitUInt32((PrimitiveArray) array);
            case INT32:
                return visitor.visitInt32((PrimitiveArray) array);
            case UINT64:
                return visitor.visitUInt64((PrimitiveArray) array);
            case INT64:
                return visitor.visitInt64((PrimitiveArray) array);
            case HALF_FLOAT:
                return visitor.visitHalfFloat((PrimitiveArray) array);
            case FLOAT:
                return visitor.visitFloat((PrimitiveArray) array);
            case DOUBLE:
                return visitor.visitDouble((PrimitiveArray) array);
            case STRING:
                return visitor.visitString((BinaryArray) array);
            case BINARY:
                return visitor.visitBinary((BinaryArray) array);
            case LARGE_STRING:
                return visitor.visitLargeString((BinaryArray) array);
            case LARGE_BINARY:
                return visitor.visitLargeBinary((BinaryArray) array);
            case FIXED_SIZE_BINARY:
                return visitor.visitFixedSizeBinary((FixedSizeBinaryArray) array);
            case DATE32:
                return visitor.visitDate32((PrimitiveArray) array);
            case DATE64:
                return visitor.visitDate64((PrimitiveArray) array);
            case TIMESTAMP:
                return visitor.visitTimestamp((PrimitiveArray) array);
            case TIME32:
                return visitor.visitTime32((PrimitiveArray) array);
            case TIME64:
                return visitor.visitTime64((PrimitiveArray) array);
            case INTERVAL_MONTHS:
                return visitor.visitMonthInterval((PrimitiveArray) array);
            case INTERVAL_DAY_TIME:
                return visitor.visitDayTimeInterval((PrimitiveArray) array);
            case DECIMAL128:
                return visitor.visitDecimal128((Decimal128Array) array);
            case DURATION:
                return visitor.visitDuration((PrimitiveArray) array);
            case LIST:
                return visitor.visitList((ListArray) array);
            case LARGE_LIST:
                return visitor.visitLargeList((ListArray) array);
            case FIXED_SIZE_LIST:
                return visitor.visitFixedSizeList((FixedSizeListArray) array);
            case MAP:
                return visitor.visitMap((MapArray) array);
            case STRUCT:
                return visitor.visitStruct((StructArray) array);
            case SPARSE_UNION:
                return visitor.visitSparseUnion((UnionArray) array);
            case DENSE_UNION:
                return visitor.visitDenseUnion((UnionArray) array);
            case DICTIONARY:
                return visitor.visitDictionary((DictionaryArray) array);
            case EXTENSION:
                return visitor.visitExtension((ExtensionArray) array);
            default:
                break;
        }
        throw notImplemented(array.type());
    }

    /** 为数组数据创建视图后分发。 */
    public static <R> R visit(ArrayData data, ArrayVisitor<R> visitor) {
        if (data.getTypeId().isReserved()) {
            throw notImplemented(data.getType());
        }
        return visit(Array.make(data), visitor);
    }

    private static NotImplementedException notImplemented(DataType type) {
        return new NotImplementedException("Array visitor for type not implemented: " + type);
    }

    private ArrayDispatcher() {}
}
