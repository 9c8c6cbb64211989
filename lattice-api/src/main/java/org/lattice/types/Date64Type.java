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
 * 日期类型,以距 UNIX 纪元的毫秒数(int64)存储。
 *
 * <p>值应为 86,400,000 的整数倍,本类不做校验。
 */
@Public
public class Date64Type extends FixedWidthType {

    private static final long serialVersionUID = 1L;

    public Date64Type() {
        super(TypeId.DATE64);
    }

    @Override
    public String asSQLString() {
        return "DATE64";
    }
}
