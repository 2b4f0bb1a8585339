// Copyright 2026 The PathSymex Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package pathsymex.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static pathsymex.core.Program.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import pathsymex.core.Program;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;
import pathsymex.io.ExprPrinter;

public class ExprInitializerTests {
	private static final Type.Struct POINT = STRUCT_TYPE(COMPONENT("x", Type.Int32), COMPONENT("y", Type.Bool));

	private final Program program = new Program(TYPEDEF("point", POINT));
	private final ExprInitializer initializer = new ExprInitializer();

	private Optional<Expr> zero(Type type) {
		return initializer.zeroValue(type, program);
	}

	@Test
	public void testScalars() {
		assertEquals(CONST(false), zero(Type.Bool).get());
		assertEquals(CONST(0, Type.UInt64), zero(Type.UInt64).get());
		assertEquals(CONST(0, POINTER_TYPE(Type.Int32)), zero(POINTER_TYPE(Type.Int32)).get());
	}

	@Test
	public void testAggregates() {
		assertEquals("{ 0, false }", ExprPrinter.toString(zero(SYNONYM("point")).get()));
		assertEquals(SYNONYM("point"), zero(SYNONYM("point")).get().getType());
		assertEquals("[ { 0, false }, { 0, false } ]", ExprPrinter.toString(zero(ARRAY_TYPE(POINT, 2)).get()));
		assertEquals("<< 0, 0, 0 >>", ExprPrinter.toString(zero(VECTOR_TYPE(Type.Int32, 3)).get()));
	}

	@Test
	public void testNoZero() {
		assertFalse(zero(UNION_TYPE(COMPONENT("f", Type.Int32))).isPresent());
		assertFalse(zero(UNBOUNDED_ARRAY_TYPE(Type.Int32)).isPresent());
		assertFalse(zero(ARRAY_TYPE(Type.Int32, SYMBOL("n", Type.UInt64))).isPresent());
		assertFalse(zero(CODE_TYPE(Type.Int32)).isPresent());
		// a struct with a union inside it has no zero either
		assertFalse(zero(STRUCT_TYPE(COMPONENT("u", UNION_TYPE(COMPONENT("f", Type.Int32))))).isPresent());
	}
}
