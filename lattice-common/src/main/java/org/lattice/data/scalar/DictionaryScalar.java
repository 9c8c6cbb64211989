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
import org.lattice.data.ArrayData;
import org.lattice.types.DictionaryType;

import javax.annotation.Nullable;

import java.util.Objects;

import static org.lattice.utils.Preconditions.checkNotNull;

/** 字典标量: 一个索引加它所引用的字典。 */
@Public
public class DictionaryScalar extends Scalar {

    @Nullable private final PrimitiveScalar index;

    private final ArrayData dictionary;

    public DictionaryScalar(
            DictionaryType type, @Nullable PrimitiveScalar index, ArrayData dictionary) {
        super(type, index != null && index.isValid());
        this.index = index;
        this.dictionary = checkNotNull(dictionary, "Dictionary must not be null.");
    }

    @Nullable
    public PrimitiveScalar getIndex() {
        return index;
    }

    public ArrayData getDictionary() {
        return dictionary;
    }

    @Override
    protected String valueToString() {
        return "index=" + index.getLong();
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        DictionaryScalar that = (DictionaryScalar) o;
        return Objects.equals(index, that.index) && dictionary == that.dictionary;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), index);
    }
}
