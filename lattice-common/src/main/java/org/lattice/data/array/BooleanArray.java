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
import org.lattice.utils.BitUtil;

/** 布尔数组,值按位压缩存储。 */
@Public
public class BooleanArray extends Array {

    public BooleanArray(ArrayData data) {
        super(data);
    }

    public boolean getBoolean(int i) {
        return BitUtil.getBit(data.getBuffer(1), (long) data.getOffset() + i);
    }

    /** 统计有效且为 true 的位置个数。 */
    public int trueCount() {
        int count = 0;
        for (int i = 0; i < length(); i++) {
            if (isValid(i) && getBoolean(i)) {
                count++;
            }
        }
        return count;
    }
}
