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

/** 64 位偏移量的变长列表类型,布局与 {@link ListType} 相同,只是偏移量为 int64。 */
@Public
public class LargeListType extends NestedType {

    private static final long serialVersionUID = 1L;

    private final DataField valueField;

    public LargeListType(DataField valueField) {
        super(TypeId.LARGE_LIST);
        this.valueField = checkNotNull(valueField, "Value field must not be null.");
    }

    public LargeListType(DataType valueType) {
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
        return "LARGE_LIST<" + valueField.getType().asSQLString() + ">";
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
        LargeListType that = (LargeListType) o;
        return valueField.equals(that.valueField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), valueField);
    }
}
