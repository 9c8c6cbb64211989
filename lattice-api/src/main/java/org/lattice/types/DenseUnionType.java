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

import java.util.List;

/**
 * 稠密联合类型。
 *
 * <p>布局为 {@code [null, 类型码, int32 偏移量]};第 {@code i} 个位置的值取自所选子数组中
 * 偏移量 {@code offsets[offset + i]} 处的元素。
 */
@Public
public class DenseUnionType extends UnionType {

    private static final long serialVersionUID = 1L;

    public DenseUnionType(List<DataField> fields, byte[] typeCodes) {
        super(TypeId.DENSE_UNION, fields, typeCodes);
    }

    @Override
    public Mode getMode() {
        return Mode.DENSE;
    }
}
