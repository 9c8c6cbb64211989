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

package org.lattice.exceptions;

/**
 * 类型分发未实现异常。
 *
 * <p>当分发器(类型、数组、标量)或物理布局注册表遇到一个无法处理的类型标签时抛出,
 * 包括为前向兼容而保留的 {@code TypeId} 成员,以及不支持内联值遍历的嵌套类型。
 *
 * <p>抛出该异常时不会调用任何访问者方法,也不携带任何部分结果。异常消息中会尽量包含
 * 出问题的类型描述,便于调用方定位。
 */
public class NotImplementedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NotImplementedException(String message) {
        super(message);
    }

    public NotImplementedException(String message, Throwable cause) {
        super(message, cause);
    }
}
