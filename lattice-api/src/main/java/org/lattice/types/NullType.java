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
 * 空类型,所有值都是 null。
 *
 * <p>空类型的数组没有任何缓冲区,也就没有有效位图;与其他类型"缺少位图即全部有效"的约定不同,
 * 空类型数组的每个位置都为 null。
 */
@Public
public class NullType extends DataType {

    private static final long serialVersionUID = 1L;

    private static final String FORMAT = "NULL";

    public NullType() {
        super(TypeId.NA);
    }

    @Override
    public String asSQLString() {
        return FORMAT;
    }
}
