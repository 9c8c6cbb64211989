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

/**
 * 一类物理布局的取值方式。
 *
 * <p>{@link #bind(ArrayData)} 一次性解析出基础缓冲区和偏移量,返回的 {@link ValueAdapter}
 * 对每个位置只做地址计算。布局从不检查有效性,null 的判断完全由遍历器负责。
 *
 * @param <V> 取出的值的类型
 * @see PhysicalLayouts
 */
@Public
@FunctionalInterface
public interface PhysicalLayout<V> {

    /**
     * 绑定到一段数组数据。
     *
     * @param data 满足该布局约定的数组数据
     * @return 按逻辑位置取值的适配器
     */
    ValueAdapter<V> bind(ArrayData data);
}
