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

package org.lattice.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Target;

/**
 * 公共稳定接口注解。
 *
 * <p>被标记的类型属于对外稳定的 API,在主版本内保持向后兼容。未标记的类型被视为内部实现,
 * 可能在任意版本中变更。
 *
 * <h2>标记准则</h2>
 * <ul>
 *   <li>面向调用方的类型定义、访问者接口与分发入口
 *   <li>容器层的数据表示(数组、标量、缓冲区)
 *   <li>内部辅助类(如位块计数器的实现细节)不应标记
 * </ul>
 *
 * @see VisibleForTesting
 */
@Documented
@Target(ElementType.TYPE)
public @interface Public {}
