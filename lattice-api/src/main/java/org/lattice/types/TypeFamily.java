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
 * 类型族枚举,用于将 {@link TypeId} 按逻辑特征分组。
 *
 * <p>一个类型标签可以属于多个类型族,例如 {@link TypeId#INT32} 同时属于 {@link #NUMERIC}
 * 和 {@link #INTEGER}。类型族只用于分类判断,与物理布局无关,物理布局见 {@link LayoutCategory}。
 *
 * <pre>
 * NUMERIC
 * ├── INTEGER: INT8 ... UINT64
 * └── FLOATING_POINT: HALF_FLOAT, FLOAT, DOUBLE
 * DECIMAL: DECIMAL128, DECIMAL256
 * TEMPORAL: DATE32, DATE64, TIMESTAMP, TIME32, TIME64, DURATION
 * INTERVAL: INTERVAL_MONTHS, INTERVAL_DAY_TIME, INTERVAL_MONTH_DAY_NANO
 * BINARY_LIKE: STRING, BINARY, LARGE_STRING, LARGE_BINARY, FIXED_SIZE_BINARY
 * NESTED: LIST, LARGE_LIST, FIXED_SIZE_LIST, MAP, STRUCT, SPARSE_UNION, DENSE_UNION
 * UNION: SPARSE_UNION, DENSE_UNION
 * EXTENSION: EXTENSION
 * </pre>
 */
@Public
public enum TypeFamily {
    NUMERIC,

    INTEGER,

    FLOATING_POINT,

    DECIMAL,

    TEMPORAL,

    INTERVAL,

    BINARY_LIKE,

    NESTED,

    UNION,

    EXTENSION
}
