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
 * 物理布局类别,描述一种类型的值在内存缓冲区中的排布方式。
 *
 * <p>每个 {@link TypeId} 恰好对应一个布局类别,该映射是固定的。遍历核心根据布局类别选择
 * 对应的值适配器:
 *
 * <table border="1">
 *   <tr><th>类别</th><th>buffers[0]</th><th>buffers[1]</th><th>buffers[2]</th></tr>
 *   <tr><td>NULL</td><td>-</td><td>-</td><td>-</td></tr>
 *   <tr><td>BOOLEAN</td><td>有效位图(可选)</td><td>位压缩值</td><td>-</td></tr>
 *   <tr><td>FIXED_WIDTH</td><td>有效位图(可选)</td><td>定宽值</td><td>-</td></tr>
 *   <tr><td>VARIABLE_BINARY</td><td>有效位图(可选)</td><td>偏移量数组</td><td>值字节(可选)</td></tr>
 *   <tr><td>FIXED_SIZE_BINARY</td><td>有效位图(可选)</td><td>定长记录</td><td>-</td></tr>
 * </table>
 *
 * <p>{@link #NESTED} 的值存放在子数组中,{@link #DELEGATED} 的值布局由另一个类型决定
 * (字典类型使用索引类型的布局,扩展类型使用存储类型的布局)。
 */
@Public
public enum LayoutCategory {
    /** 无缓冲区,所有位置都是 null。 */
    NULL,

    /** 值按位压缩存储。 */
    BOOLEAN,

    /** 定宽值,按 {@code (offset + i) * byteWidth} 寻址。 */
    FIXED_WIDTH,

    /** 变长二进制/字符串,值缓冲区由偏移量数组绝对寻址,从不按 offset 切片。 */
    VARIABLE_BINARY,

    /** 定长二进制记录。 */
    FIXED_SIZE_BINARY,

    /** 嵌套类型,值位于子数组。 */
    NESTED,

    /** 布局委托给另一个类型。 */
    DELEGATED
}
