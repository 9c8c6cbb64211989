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
import org.lattice.exceptions.NotImplementedException;

/**
 * 类型分发器,将运行时的类型标签解析为 {@link TypeVisitor} 的具体重载调用。
 *
 * <p>分发是对封闭枚举 {@link TypeId} 的全函数:每个非保留标签恰好调用一次访问者方法,
 * 传入的是具体类型而不是 {@link DataType}。保留标签或无法识别的标签抛出
 * {@link NotImplementedException},此时不会调用任何访问者方法。
 *
 * <pre>{@code
 * int width = TypeDispatcher.visit(type, new TypeDefaultVisitor<Integer>() {
 *     public Integer visit(Int32Type t) {
 *         return 4;
 *     }
 *
 *     protected Integer defaultMethod(DataType t) {
 *         return -1;
 *     }
 * });
 * }</pre>
 */
@Public
public final class TypeDispatcher {

    /**
     * 根据类型标签调用访问者的对应方法。
     *
     * @param type 被访问的类型
     * @param visitor 访问者
     * @param <R> 访问结果的类型
     * @return 访问者的返回值
     * @throws NotImplementedException 如果类型标签是保留的或无法识别
     */
    public static <R> R visit(DataType type, TypeVisitor<R> visitor) {
        switch (type.getTypeId()) {
            case NA:
                return visitor.visit((NullType) type);
            case BOOL:
                return visitor.visit((BooleanType) type);
            case UINT8:
                return visitor.visit((UInt8Type) type);
            case INT8:
                return visitor.visit((Int8Type) type);
            case UINT16:
                return visitor.visit((UInt16Type) type);
            case INT16:
                return visitor.visit((Int16Type) type);
            case UINT32:
                return visitor.visit((UInt32Type) type);
            case INT32:
                return visitor.visit((Int32Type) type);
            case UINT64:
                return visitor.visit((UInt64Type) type);
            case INT64:
                return visitor.visit((Int64Type) type);
            case HALF_FLOAT:
                return visitor.visit((HalfFloatType) type);
            case FLOAT:
                return visitor.visit((FloatType) type);
            case DOUBLE:
                return visitor.visit((DoubleType) type);
            case STRING:
                return visitor.visit((StringType) type);
            case BINARY:
                return visitor.visit((BinaryType) type);
            case LARGE_STRING:
                return visitor.visit((LargeStringType) type);
            case LARGE_BINARY:
                return visitor.visit((LargeBinaryType) type);
            case FIXED_SIZE_BINARY:
                return visitor.visit((FixedSizeBinaryType) type);
            case DATE32:
                return visitor.visit((Date32Type) type);
            case DATE64:
                return visitor.visit((Date64Type) type);
            case TIMESTAMP:
                return visitor.visit((TimestampType) type);
            case TIME32:
                return visitor.visit((Time32Type) type);
            case TIME64:
                return visitor.visit((Time64Type) type);
            case INTERVAL_MONTHS:
                return visitor.visit((MonthIntervalType) type);
            case INTERVAL_DAY_TIME:
                return visitor.visit((DayTimeIntervalType) type);
            case DECIMAL128:
                return visitor.visit((Decimal128Type) type);
            case DURATION:
                return visitor.visit((DurationType) type);
            case LIST:
                return visitor.visit((ListType) type);
            case LARGE_LIST:
                return visitor.visit((LargeListType) type);
            case FIXED_SIZE_LIST:
                return visitor.visit((FixedSizeListType) type);
            case MAP:
                return visitor.visit((MapType) type);
            case STRUCT:
                return visitor.visit((StructType) type);
            case SPARSE_UNION:
                return visitor.visit((SparseUnionType) type);
            case DENSE_UNION:
                return visitor.visit((DenseUnionType) type);
            case DICTIONARY:
                return visitor.visit((DictionaryType) type);
            case EXTENSION:
                return visitor.visit((ExtensionType) type);
            default:
                break;
        }
        throw new NotImplementedException("Type not implemented: " + type);
    }

    private TypeDispatcher() {}
}
