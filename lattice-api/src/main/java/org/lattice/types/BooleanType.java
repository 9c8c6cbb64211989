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
 * 布尔类型,取值为 true 或 false。
 *
 * <p>值缓冲区按位压缩存储,第 {@code i} 个逻辑位置的值位于第 {@code offset + i} 位
 * (LSB 优先)。
 */
@Public
public class BooleanType extends FixedWidthType {

    private static final long serialVersionUID = 1L;

    private static final String FORMAT = "BOOLEAN";

    public BooleanType() {
        super(TypeId.BOOL);
    }

    @Override
    public String asSQLString() {
        return FORMAT;
    }
}
