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

package org.lattice.utils;

/**
 * 位图扫描器返回的一个块:块内的位数以及其中被置位的个数。
 *
 * <p>{@code popCount == length} 时整块有效,{@code popCount == 0} 时整块为 null,
 * 其余情况需要逐位判断。
 */
public final class BitBlockCount {

    private final int length;

    private final int popCount;

    public BitBlockCount(int length, int popCount) {
        this.length = length;
        this.popCount = popCount;
    }

    public int length() {
        return length;
    }

    public int popCount() {
        return popCount;
    }

    public boolean isNoneSet() {
        return popCount == 0;
    }

    public boolean isAllSet() {
        return length == popCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BitBlockCount that = (BitBlockCount) o;
        return length == that.length && popCount == that.popCount;
    }

    @Override
    public int hashCode() {
        return 31 * length + popCount;
    }

    @Override
    public String toString() {
        return "BitBlockCount{length=" + length + ", popCount=" + popCount + "}";
    }
}
