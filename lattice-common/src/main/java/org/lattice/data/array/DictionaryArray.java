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
import org.lattice.types.DictionaryType;

import static org.lattice.utils.Preconditions.checkNotNull;

/** 字典编码数组: 缓冲区按索引类型布局,值通过索引在字典中查找。 */
@Public
public class DictionaryArray extends Array {

    private final DictionaryType dictionaryType;

    public DictionaryArray(ArrayData data) {
        super(data);
        this.dictionaryType = (DictionaryType) data.getType();
        checkNotNull(data.getDictionary(), "Dictionary array without dictionary.");
    }

    /** 以索引类型解释同一组缓冲区。 */
    public PrimitiveArray indices() {
        return new PrimitiveArray(data.withType(dictionaryType.getIndexType()));
    }

    public Array dictionary() {
        return Array.make(data.getDictionary());
    }

    public long getIndex(int i) {
        return indices().getAsLong(i);
    }
}
