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

/**
 * 绑定到某段数组数据后的取值函数。
 *
 * @param <V> 值的类型
 */
@Public
@FunctionalInterface
public interface ValueAdapter<V> {

    /**
     * 读取逻辑位置 {@code position} 的值,位置相对数组的 offset。
     *
     * <p>不检查有效性;对 null 位置调用时返回的是缓冲区中的任意内容。
     */
    V valueAt(int position);
}
