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
import org.lattice.types.DataType;
import org.lattice.types.TypeId;

import java.util.Objects;

import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 单个逻辑值:一个类型加一个值或 null 标记。
 *
 * <p>标量是不可变的,不引用任何缓冲区(列表类标量除外,它的值本身就是一段数组数据)。
 * 需要按具体类型标签处理时使用 {@link ScalarDispatcher}。
 */
@Public
public abstract class Scalar {

    protected final DataType type;

    protected final boolean valid;

    protected Scalar(DataType type, boolean valid) {
        this.type = checkNotNull(type, "Scalar type must not be null.");
        this.valid = valid;
    }

    public DataType type() {
        return type;
    }

    public TypeId getTypeId() {
        return type.getTypeId();
    }

    /** 是否持有值;为 false 表示 null。 */
    public boolean isValid() {
        return valid;
    }

    /** 值的字符串表示,只在 {@link #isValid()} 时调用。 */
    protected abstract String valueToString();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Scalar that = (Scalar) o;
        return valid == that.valid && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, valid);
    }

    @Override
    public String toString() {
        return type.asSQLString() + ":" + (valid ? valueToString() : "null");
    }
}
