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
import org.lattice.memory.Buffer;
import org.lattice.types.DataType;
import org.lattice.types.TypeId;
import org.lattice.utils.BitUtil;

import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * {@link ArrayData} 之上的类型化只读视图。
 *
 * <p>Array 把原始缓冲区解释为某一类别的值,并提供按位置读取的方法。视图本身不持有任何状态,
 * 所有数据都来自底层的 ArrayData,因此视图可以随时创建和丢弃。
 *
 * <p>同一类别的多个类型标签共享一个视图类,例如所有定宽数值与时间类型都使用 {@link PrimitiveArray}。
 * 需要区分具体标签时使用 {@link ArrayDispatcher}。
 */
@Public
public abstract class Array {

    protected final ArrayData data;

    protected Array(ArrayData data) {
        this.data = checkNotNull(data, "Array data must not be null.");
    }

    /**
     * 根据类型标签创建对应的视图。
     *
     * @throws NotImplementedException 如果类型标签是保留的
     */
    public static Array make(ArrayData data) {
        switch (data.getTypeId()) {
            case NA:
                return new NullArray(data);
            case BOOL:
                return new BooleanArray(data);
            case UINT8:
            case INT8:
            case UINT16:
            case INT16:
            case UINT32:
            case INT32:
            case UINT64:
            case INT64:
            case HALF_FLOAT:
            case FLOAT:
            case DOUBLE:
            case DATE32:
            case DATE64:
            case TIMESTAMP:
            case TIME32:
            case TIME64:
            case INTERVAL_MONTHS:
            case INTERVAL_DAY_TIME:
            case DURATION:
                return new PrimitiveArray(data);
            case STRING:
            case BINARY:
            case LARGE_STRING:
            case LARGE_BINARY:
                return new BinaryArray(data);
            case FIXED_SIZE_BINARY:
                return new FixedSizeBinaryArray(data);
            case DECIMAL128:
                return new Decimal128Array(data);
            case LIST:
            case LARGE_LIST:
                return new ListArray(data);
            case FIXED_SIZE_LIST:
                return new FixedSizeListArray(data);
            case MAP:
                return new MapArray(data);
            case STRUCT:
                return new StructArray(data);
            case SPARSE_UNION:
            case DENSE_UNION:
                return new UnionArray(data);
            case DICTIONARY:
                return new DictionaryArray(data);
            case EXTENSION:
                return new ExtensionArray(data);
            default:
                throw new NotImplementedException(
                        "Array not implemented for type: " + data.getType());
        }
    }

    public ArrayData data() {
        return data;
    }

    public DataType type() {
        return data.getType();
    }

    public TypeId getTypeId() {
        return data.getTypeId();
    }

    public int length() {
        return data.getLength();
    }

    public int offset() {
        return data.getOffset();
    }

    public int nullCount() {
        return data.getNullCount();
    }

    /** 判断位置 {@code i} 是否为 null。有效位图缺失时所有位置都有效。 */
    public boolean isNull(int i) {
        Buffer validity = data.getValidityBuffer();
        return validity != null && !BitUtil.getBit(validity, (long) data.getOffset() + i);
    }

    public boolean isValid(int i) {
        return !isNull(i);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + data + "}";
    }
}
