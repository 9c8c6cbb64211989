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

import static org.lattice.utils.Preconditions.checkNotNull;

/** 32 位偏移量的变长列表类型。数组布局为 {@code [有效位图, 偏移量]},元素存放在唯一的子数组中。 */
@Public
public class ListType extends NestedType {

    private static final long serialVersionUID = 1L;

    private final DataField valueField;

    public ListType(DataField valueField) {
        super(TypeId.LIST);
        this.valueField = checkNotNull(valueField, "Value field must not be null.");
    }

    public ListType(DataType valueType) {
        this(new DataField("item", valueType));
    }

    public DataField getValueField() {
        return valueField;
    }

    public DataType getValueType() {
        return valueField.getType();
    }

    @Override
    public List<DataField> getFields() {
        return Collections.singletonList(valueField);
    }

    @Override
    public String asSQLString() {
        return "LIST<" + valueField.getType().asSQLString() + ">";
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
        ListType that = (ListType) o;
        return valueField.equals(that.valueField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), valueField);
    }
}
