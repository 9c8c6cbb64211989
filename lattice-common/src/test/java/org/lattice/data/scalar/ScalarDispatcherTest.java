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

package org.lattice.data.scalar;

import org.lattice.data.ArrayTestUtils;
import org.lattice.exceptions.NotImplementedException;
import org.lattice.types.BaseBinaryType;
import org.lattice.types.DataType;
import org.lattice.types.DataTypes;
import org.lattice.types.Decimal128Type;
import org.lattice.types.DictionaryType;
import org.lattice.types.ExtensionType;
import org.lattice.types.FixedSizeBinaryType;
import org.lattice.types.StructType;
import org.lattice.types.TypeId;
import org.lattice.types.UnionType;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lattice.data.ArrayTestUtils.sampleType;

/** {@link ScalarDispatcher} 的测试。 */
class ScalarDispatcherTest {

    static Scalar sampleScalar(TypeId typeId) {
        DataType type = sampleType(typeId);
        switch (typeId) {
            case NA:
                return new NullScalar();
            case BOOL:
                return new BooleanScalar(true);
            case FLOAT:
                return PrimitiveScalar.ofFloat(1.5f);
            case STRING:
            case BINARY:
            case LARGE_STRING:
            case LARGE_BINARY:
                return new BinaryScalar((BaseBinaryType) type, new byte[] {'a'});
            case FIXED_SIZE_BINARY:
                return new FixedSizeBinaryScalar((FixedSizeBinaryType) type, new byte[4]);
            case DECIMAL128:
                return new Decimal128Scalar((Decimal128Type) type, new BigDecimal("1.00"));
            case LIST:
            case LARGE_LIST:
            case FIXED_SIZE_LIST:
            case MAP:
                return new ListScalar(type, null);
            case STRUCT:
                return new StructScalar(
                        (StructType) type,
                        Collections.<Scalar>singletonList(
                                PrimitiveScalar.of(DataTypes.INT32(), 1)));
            case SPARSE_UNION:
            case DENSE_UNION:
                return new UnionScalar(
                        (UnionType) type, (byte) 0, PrimitiveScalar.of(DataTypes.INT32(), 1));
            case DICTIONARY:
                return new DictionaryScalar(
                        (DictionaryType) type,
                        PrimitiveScalar.of(DataTypes.INT32(), 0),
                        ArrayTestUtils.stringArray("a"));
            case EXTENSION:
                return new ExtensionScalar(
                        (ExtensionType) type,
                        new FixedSizeBinaryScalar(
                                DataTypes.FIXED_SIZE_BINARY(16), new byte[16]));
            default:
                return PrimitiveScalar.of(type, 1L);
        }
    }

    @ParameterizedTest
    @EnumSource(
            value = TypeId.class,
            names = {"DECIMAL256", "INTERVAL_MONTH_DAY_NANO"},
            mode = EnumSource.Mode.EXCLUDE)
    void testEveryTagInvokesExactlyOneMethod(TypeId typeId) {
        List<Method> calls = new ArrayList<>();
        Scalar scalar = sampleScalar(typeId);

        Object result = ScalarDispatcher.visit(scalar, recordingVisitor(calls));

        assertThat(scalar.getTypeId()).isEqualTo(typeId);
        assertThat(calls).hasSize(1);
        assertThat(calls.get(0).getParameterTypes()[0]).isAssignableFrom(scalar.getClass());
        assertThat(result).isEqualTo(calls.get(0).getName());
    }

    @Test
    void testDispatchTableIsTotal() {
        List<Method> calls = new ArrayList<>();
        ScalarVisitor<Object> visitor = recordingVisitor(calls);
        int dispatchable = 0;
        for (TypeId typeId : TypeId.values()) {
            if (!typeId.isReserved()) {
                ScalarDispatcher.visit(sampleScalar(typeId), visitor);
                dispatchable++;
            }
        }

        Set<Method> distinct = new HashSet<>(calls);
        assertThat(distinct).hasSize(dispatchable);
        assertThat(distinct)
                .containsExactlyInAnyOrderElementsOf(
                        Arrays.asList(ScalarVisitor.class.getDeclaredMethods()));
    }

    @ParameterizedTest
    @EnumSource(
            value = TypeId.class,
            names = {"DECIMAL256", "INTERVAL_MONTH_DAY_NANO"})
    void testReservedTagThrowsWithoutVisiting(TypeId typeId) {
        List<Method> calls = new ArrayList<>();
        Scalar reserved =
                new Scalar(new ArrayTestUtils.ReservedType(typeId), false) {
                    @Override
                    protected String valueToString() {
                        return "";
                    }
                };

        assertThatThrownBy(() -> ScalarDispatcher.visit(reserved, recordingVisitor(calls)))
                .isInstanceOf(NotImplementedException.class)
                .hasMessage("Scalar visitor for type not implemented: " + typeId.name());
        assertThat(calls).isEmpty();
    }

    @Test
    void testDefaultVisitorRoutesToDefaultMethod() {
        ScalarDefaultVisitor<String> visitor =
                new ScalarDefaultVisitor<String>() {
                    @Override
                    public String visitMap(ListScalar scalar) {
                        return "map";
                    }

                    @Override
                    protected String defaultMethod(Scalar scalar) {
                        return "other:" + scalar;
                    }
                };

        assertThat(ScalarDispatcher.visit(sampleScalar(TypeId.MAP), visitor)).isEqualTo("map");
        assertThat(ScalarDispatcher.visit(sampleScalar(TypeId.LIST), visitor))
                .isEqualTo("other:" + sampleScalar(TypeId.LIST));
        assertThat(ScalarDispatcher.visit(new BooleanScalar(false), visitor))
                .isEqualTo("other:BOOLEAN:false");
    }

    @SuppressWarnings("unchecked")
    private static ScalarVisitor<Object> recordingVisitor(List<Method> calls) {
        return (ScalarVisitor<Object>)
                Proxy.newProxyInstance(
                        ScalarVisitor.class.getClassLoader(),
                        new Class<?>[] {ScalarVisitor.class},
                        (proxy, method, args) -> {
                            calls.add(method);
                            return method.getName();
                        });
    }
}
