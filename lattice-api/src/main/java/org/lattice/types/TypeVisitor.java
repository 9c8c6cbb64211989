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
 * {@link DataType} 的访问者接口,每个可分发的 {@link TypeId} 对应一个 visit 重载。
 *
 * <p>访问者不通过 {@code DataType} 上的虚方法回调,而是由 {@link TypeDispatcher} 对类型标签做
 * switch,将实例转换为具体类型后调用对应的重载。这样分发表是封闭且可以完整校验的:
 * 每个非保留标签恰好对应一次方法调用,保留标签抛出
 * {@link org.lattice.exceptions.NotImplementedException}。
 *
 * <p>只关心少数类型的访问者可以继承 {@link TypeDefaultVisitor}。
 *
 * @param <R> 访问结果的类型
 */
@Public
public interface TypeVisitor<R> {

    R visit(NullType nullType);

    R visit(BooleanType booleanType);

    R visit(UInt8Type uint8Type);

    R visit(Int8Type int8Type);

    R visit(UInt16Type uint16Type);

    R visit(Int16Type int16Type);

    R visit(UInt32Type uint32Type);

    R visit(Int32Type int32Type);

    R visit(UInt64Type uint64Type);

    R visit(Int64Type int64Type);

    R visit(HalfFloatType halfFloatType);

    R visit(FloatType floatType);

    R visit(DoubleType doubleType);

    R visit(StringType stringType);

    R visit(BinaryType binaryType);

    R visit(LargeStringType largeStringType);

    R visit(LargeBinaryType largeBinaryType);

    R visit(FixedSizeBinaryType fixedSizeBinaryType);

    R visit(Date32Type date32Type);

    R visit(Date64Type date64Type);

    R visit(TimestampType timestampType);

    R visit(Time32Type time32Type);

    R visit(Time64Type time64Type);

    R visit(MonthIntervalType monthIntervalType);

    R visit(DayTimeIntervalType dayTimeIntervalType);

    R visit(Decimal128Type decimal128Type);

    R visit(DurationType durationType);

    R visit(ListType listType);

    R visit(LargeListType largeListType);

    R visit(FixedSizeListType fixedSizeListType);

    R visit(MapType mapType);

    R visit(StructType structType);

    R visit(SparseUnionType sparseUnionType);

    R visit(DenseUnionType denseUnionType);

    R visit(DictionaryType dictionaryType);

    R visit(ExtensionType extensionType);
}
