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
import org.lattice.exceptions.NotImplementedException;

/**
 * 标量分发器,根据类型标签调用 {@link ScalarVisitor} 中对应的方法。
 *
 * <p>保留或无法识别的标签抛出 {@link NotImplementedException},不调用任何访问者方法。
 */
@Public
public final class ScalarDispatcher {

    public static <R> R visit(Scalar scalar, ScalarVisitor<R> visitor) {
        switch (scalar.getTypeId()) {
            case NA:
                return visitor.visitNull((NullScalar) scalar);
            case BOOL:
                return visitor.visitBoolean((BooleanScalar) scalar);
            case UINT8:
                return visitor.visitUInt8((PrimitiveScalar) scalar);
            case INT8:
                return visitor.visitInt8((PrimitiveScalar) scalar);
            case UINT16:
                return visitor.visitUInt16((PrimitiveScalar) scalar);
            case INT16:
                return visitor.visitInt16((PrimitiveScalar) scalar);
            case UINT32:
                return visitor.visitUInt32((PrimitiveScalar) scalar);
            case INT32:
                return visitor.visitInt32((PrimitiveScalar) scalar);
            case UINT64:
                return visitor.visitUInt64((PrimitiveScalar) scalar);
            case INT64:
                return visitor.visitInt64((PrimitiveScalar) scalar);
            case HALF_FLOAT:
                return visitor.visitHalfFloat((PrimitiveScalar) scalar);
            case FLOAT:
                return visitor.visitFloat((PrimitiveScalar) scalar);
            case DOUBLE:
                return visitor.visitDouble((PrimitiveScalar) scalar);
            case STRING:
                return visitor.visitString((BinaryScalar) scalar);
            case BINARY:
                return visitor.visitBinary((BinaryScalar) scalar);
            case LARGE_STRING:
                return visitor.visitLargeString((BinaryScalar) scalar);
            case LARGE_BINARY:
                return visitor.visitLargeBinary((BinaryScalar) scalar);
            case FIXED_SIZE_BINARY:
                return visitor.visitFixedSizeBinary((FixedSizeBinaryScalar) scalar);
            case DATE32:
                return visitor.visitDate32((PrimitiveScalar) scalar);
            case DATE64:
                return visitor.visitDate64((PrimitiveScalar) scalar);
            case TIMESTAMP:
                return visitor.visitTimestamp((PrimitiveScalar) scalar);
            case TIME32:
                return visitor.visitTime32((PrimitiveScalar) scalar);
            case TIME64:
                return visitor.visitTime64((PrimitiveScalar) scalar);
            case INTERVAL_MONTHS:
                return visitor.visitMonthInterval((PrimitiveScalar) scalar);
            case INTERVAL_DAY_TIME:
                return visitor.visitDayTimeInterval((PrimitiveScalar) scalar);
            case DECIMAL128:
                return visitor.visitDecimal128((Decimal128Scalar) scalar);
            case DURATION:
                return visitor.visitDuration((PrimitiveScalar) scalar);
            case LIST:
                return visitor.visitList((ListScalar) scalar);
            case LARGE_LIST:
                return visitor.visitLargeList((ListScalar) scalar);
            case FIXED_SIZE_LIST:
                return visitor.visitFixedSizeList((ListScalar) scalar);
            case MAP:
                return visitor.visitMap((ListScalar) scalar);
            case STRUCT:
                return visitor.visitStruct((StructScalar) scalar);
            case SPARSE_UNION:
                return visitor.visitSparseUnion((UnionScalar) scalar);
            case DENSE_UNION:
                return visitor.visitDenseUnion((UnionScalar) scalar);
            case DICTIONARY:
                return visitor.visitDictionary((DictionaryScalar) scalar);
            case EXTENSION:
                return visitor.visitExtension((ExtensionScalar) scalar);
            default:
                break;
        }
        throw new NotImplementedException(
                "Scalar visitor for type not implemented: " + scalar.type());
    }

    private ScalarDispatcher() {}
}
