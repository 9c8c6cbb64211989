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

import java.util.Objects;

import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 字典编码类型。
 *
 * <p>数组本身存储整数索引,布局与 {@link #getIndexType()} 相同;字典值存放在单独的数组中,
 * 类型为 {@link #getValueType()}。
 */
@Public
public class DictionaryType extends DataType {

    private static final long serialVersionUID = 1L;

    private final IntegerType indexType;

    private final DataType valueType;

    private final boolean ordered;

    public DictionaryType(IntegerType indexType, DataType valueType, boolean ordered) {
        super(TypeId.DICTIONARY);
        this.indexType = checkNotNull(indexType, "Index type must not be null.");
        this.valueType = checkNotNull(valueType, "Value type must not be null.");
        this.ordered = ordered;
    }

    public DictionaryType(IntegerType indexType, DataType valueType) {
        this(indexType, valueType, false);
    }

    public IntegerType getIndexType() {
        return indexType;
    }

    public DataType getValueType() {
        return valueType;
    }

    public boolean isOrdered() {
        return ordered;
    }

    @Override
    public String asSQLString() {
        return String.format(
                "DICTIONARY<%s, %s%s>",
                indexType.asSQLString(), valueType.asSQLString(), ordered ? ", ordered" : "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        if (!super.equals(o)) {
            return false;
        }
        DictionaryType that = (DictionaryType) o;
        return ordered == that.ordered
                && indexType.equals(that.indexType)
                && valueType.equals(that.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), indexType, valueType, ordered);
    }
}
