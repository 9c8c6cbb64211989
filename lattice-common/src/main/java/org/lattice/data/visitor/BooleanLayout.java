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

package org.lattice.data.visitor;

import org.lattice.annotation.Public;
import org.lattice.data.ArrayData;
import org.lattice.memory.Buffer;
import org.lattice.utils.BitUtil;

/** 布尔布局: 值按位压缩存储,第 {@code i} 个值是第 {@code offset + i} 位。 */
@Public
public final class BooleanLayout implements PhysicalLayout<Boolean> {

    public static final BooleanLayout INSTANCE = new BooleanLayout();

    private BooleanLayout() {}

    @Override
    public ValueAdapter<Boolean> bind(ArrayData data) {
        Buffer values = data.getBuffer(1);
        long offset = data.getOffset();
        return position -> BitUtil.getBit(values, offset + position);
    }

    @Override
    public String toString() {
        return "BooleanLayout";
    }
}
