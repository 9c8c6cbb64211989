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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static org.lattice.utils.Preconditions.checkArgument;
import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 定长列表类型,每个列表恰好包含 {@code listSize} 个元素。
 *
 * <p>数组布局只有有效位图,第 {@code i} 个列表对应子数组中
 * {@code [(offset + i) * listSize, (offset + i + 1) * listSize)} 的元素。
 */
@Public
public class FixedSizeListType extends NestedType {

    private static final long serialVersionUID = 1L;

    private final DataField valueField;

    private final int listSize;

    public FixedSizeListType(DataField valueField, int listSize) {
        super(TypeId.FIXED_SIZE_LIST);
        checkArgument(listSize >= 0, "List size must be non-negative, but is %s.", listSize);
        this.valueField = checkNotNull(valueField, "Value field must not be null.");
        this.listSize = listSize;
    }

    public FixedSizeListType(DataType valueType, int listSize) {
        this(new DataField("item", valueType), listSize);
    }

    public DataField getValueField() {
        return valueField;
    }

    public DataType getValueType() {
        return valueField.getType();
    }

    public int getListSize() {
        return listSize;
    }

    @Override
    public List<DataField> getFields() {
        return Collections.singletonList(valueField);
    }

    @Override
    public String asSQLString() {
        return "FIXED_SIZE_LIST<" + valueField.getType().asSQLString() + ">[" + listSize + "]";
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
        FixedSizeListType that = (FixedSizeListType) o;
        return listSize == that.listSize && valueField.equals(that.valueField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), valueField, listSize);
    }
}
