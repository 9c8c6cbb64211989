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
 * 整数类型的基类,包括 8/16/32/64 位的有符号与无符号整数。
 *
 * <p>Java 没有无符号整数,无符号类型的值按相同位宽的有符号原始类型读出,需要时由调用方
 * 使用 {@link Byte#toUnsignedInt}、{@link Integer#toUnsignedLong} 等方法转换。
 */
@Public
public abstract class IntegerType extends FixedWidthType {

    private static final long serialVersionUID = 1L;

    protected IntegerType(TypeId typeId) {
        super(typeId);
    }

    /** 是否为有符号整数。 */
    public abstract boolean isSigned();

    @Override
    public String asSQLString() {
        return (isSigned() ? "INT" : "UINT") + bitWidth();
    }
}
