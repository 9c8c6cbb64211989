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
import org.lattice.types.Decimal128Type;

import java.math.BigDecimal;
import java.math.BigInteger;

/** decimal128 数组,每个值是 16 字节小端序的二进制补码整数,配合类型的 scale 解释。 */
@Public
public class Decimal128Array extends FixedSizeBinaryArray {

    public Decimal128Array(ArrayData data) {
        super(data);
    }

    public BigDecimal getDecimal(int i) {
        byte[] littleEndian = getBytes(i);
        byte[] bigEndian = new byte[littleEndian.length];
        for (int j = 0; j < littleEndian.length; j++) {
            bigEndian[j] = littleEndian[littleEndian.length - 1 - j];
        }
        return new BigDecimal(new BigInteger(bigEndian), ((Decimal128Type) type()).getScale());
    }
}
