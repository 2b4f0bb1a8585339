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
package pathsymex.symex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static pathsymex.core.Program.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import pathsymex.core.Program;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;
import pathsymex.io.ExprPrinter;
import pathsymex.state.AuxiliarySymbols;
import pathsymex.state.VarMap;
import pathsymex.util.ContractViolation;
import wycc.util.Logger;

/**
 * Check reading expressions in a symbolic state, covering propagation, the
 * flattening of aggregates, the treatment of arrays and the handling of
 * dereferences and free inputs.
 *
 * @author The PathSymex Project Developers
 *
 */
public class PathSymexStateTests {
	private static final Type.Struct POINT = STRUCT_TYPE(COMPONENT("x", Type.Int32), COMPONENT("y", Type.Int32));
	private static final Type.Union WORD = UNION_TYPE(COMPONENT("f", Type.Int32), COMPONENT("b", Type.Bool));
	private static final Type.Array ARRAY3 = ARRAY_TYPE(Type.Int32, 3);

	private static final Expr.Symbol x = SYMBOL("x", Type.Int32);
	private static final Expr.Symbol g = SYMBOL("g", Type.Int32);
	private static final Expr.Symbol i = SYMBOL("i", Type.Int32);
	private static final Expr.Symbol j = SYMBOL("j", Type.Int32);
	private static final Expr.Symbol s = SYMBOL("s", POINT);
	private static final Expr.Symbol q = SYMBOL("q", SYNONYM("point"));
	private static final Expr.Symbol a = SYMBOL("a", ARRAY3);
	private static final Expr.Symbol u = SYMBOL("u", UNBOUNDED_ARRAY_TYPE(Type.Int32));
	private static final Expr.Symbol w = SYMBOL("w", WORD);
	private static final Expr.Symbol p = SYMBOL("p", POINTER_TYPE(Type.Int32));

	private Program program;
	private SymexConfig config;
	private PathSymexState state;

	@BeforeEach
	public void setup() {
		program = new Program(LOCAL("x", Type.Int32), GLOBAL("g", Type.Int32), LOCAL("i", Type.Int32),
				LOCAL("j", Type.Int32), THREAD_LOCAL("t", Type.Int32), LOCAL("s", POINT), TYPEDEF("point", POINT),
				LOCAL("q", SYNONYM("point")), GLOBAL("a", ARRAY3), GLOBAL("u", UNBOUNDED_ARRAY_TYPE(Type.Int32)),
				LOCAL("w", WORD), LOCAL("p", POINTER_TYPE(Type.Int32)), LOCAL("b", Type.Bool),
				LOCAL("v", VECTOR_TYPE(Type.Int32, 2)), LOCAL("points", ARRAY_TYPE(POINT, 2)));
		config = new SymexConfig(program);
		state = new PathSymexState(config);
	}

	// ======================================================================
	// Propagation
	// ======================================================================

	@Test
	public void testFirstReadWithoutPropagation() {
		assertEquals(SSA_SYMBOL("x#0", Type.Int32, "x"), state.read(x, false));
	}

	@Test
	public void testFirstReadWithPropagation() {
		assertEquals(CONST(0, Type.Int32), state.read(x, true));
		// still no write, so the value remains
		assertEquals(CONST(0, Type.Int32), state.read(x));
		// but the incarnation minted at first touch is retained
		assertEquals(SSA_SYMBOL("x#0", Type.Int32, "x"), state.read(x, false));
	}

	@Test
	public void testPropagationGating() {
		Expr r = state.read(SYMBOL("b", Type.Bool), false);
		assertTrue(r instanceof Expr.Symbol);
		assertTrue(((Expr.Symbol) r).isSSA());
		// later propagation does not invent a value either
		assertEquals(r, state.read(SYMBOL("b", Type.Bool), true));
	}

	@Test
	public void testRepeatedReadsAreIdentical() {
		Expr r1 = state.read(x, false);
		Expr r2 = state.read(x, false);
		assertEquals(r1, r2);
		// results are never shared
		assertFalse(r1 == r2);
	}

	@Test
	public void testAssignmentMintsFreshSymbol() {
		Expr before = state.read(x, false);
		VarMap.VarInfo info = config.getVarMap().lookup("x");
		Expr.Symbol written = state.recordAssignment(info, null);
		Expr after = state.read(x, false);
		assertNotEquals(before, after);
		assertEquals(written, after);
		assertEquals("x#1", ((Expr.Symbol) after).getIdentifier());
		// without a value there is nothing to propagate
		assertEquals(after, state.read(x, true));
	}

	@Test
	public void testAssignmentPropagatesValue() {
		VarMap.VarInfo info = config.getVarMap().get(x);
		state.recordAssignment(info, CONST(5, Type.Int32));
		assertEquals(CONST(5, Type.Int32), state.read(x));
		assertEquals(SSA_SYMBOL("x#1", Type.Int32, "x"), state.read(x, false));
	}

	@Test
	public void testExternalCounterIncrement() {
		state.read(x, false);
		VarMap.VarInfo info = config.getVarMap().lookup("x");
		info.incrementSSACounter();
		state.getVarState(info).setSSASymbol(null);
		assertEquals(SSA_SYMBOL("x#1", Type.Int32, "x"), state.read(x, false));
	}

	// ======================================================================
	// Aggregates
	// ======================================================================

	@Test
	public void testStructFlattening() {
		Expr r = state.read(s, false);
		assertTrue(r instanceof Expr.StructConstructor);
		assertEquals(2, r.size());
		assertEquals(SSA_SYMBOL("s.x#0", Type.Int32, "s.x"), r.getOperand(0));
		assertEquals(SSA_SYMBOL("s.y#0", Type.Int32, "s.y"), r.getOperand(1));
	}

	@Test
	public void testStructFlatteningThroughSynonym() {
		assertEquals("{ q.x#0, q.y#0 }", ExprPrinter.toString(state.read(q, false)));
	}

	@Test
	public void testStructFlatteningWithPropagation() {
		Expr r = state.read(s);
		assertEquals(STRUCT(POINT, Arrays.asList(CONST(0, Type.Int32), CONST(0, Type.Int32))), r);
	}

	@Test
	public void testStructMember() {
		assertEquals(SSA_SYMBOL("s.y#0", Type.Int32, "s.y"), state.read(MEMBER(s, "y"), false));
		// member and whole struct share locations
		assertEquals("{ s.x#0, s.y#0 }", ExprPrinter.toString(state.read(s, false)));
	}

	@Test
	public void testBoundedArrayFlattening() {
		assertEquals("[ a[0]#0, a[1]#0, a[2]#0 ]", ExprPrinter.toString(state.read(a, false)));
	}

	@Test
	public void testConstantIndex() {
		Expr r = state.read(INDEX(a, ADD(CONST(1, Type.Int32), CONST(1, Type.Int32))), false);
		assertEquals(SSA_SYMBOL("a[2]#0", Type.Int32, "a[2]"), r);
	}

	@Test
	public void testPropagatedIndex() {
		// i is zero on first read, hence a[i] is a[0]
		assertEquals(CONST(0, Type.Int32), state.read(INDEX(a, i)));
		assertEquals(SSA_SYMBOL("a[0]#0", Type.Int32, "a[0]"), state.read(INDEX(a, CONST(0, Type.Int32)), false));
	}

	@Test
	public void testSymbolicIndexCaseSplit() {
		Expr r = state.read(INDEX(a, i), false);
		assertTrue(r instanceof Expr.Cond);
		assertEquals("cond { i#0 == 0 -> a[0]#0; i#0 == 1 -> a[1]#0; i#0 == 2 -> a[2]#0 }", ExprPrinter.toString(r));
	}

	@Test
	public void testSymbolicIndicesHaveSameStructure() {
		Expr.Cond ri = (Expr.Cond) state.read(INDEX(a, i), false);
		Expr.Cond rj = (Expr.Cond) state.read(INDEX(a, j), false);
		assertEquals(3, ri.numberOfCases());
		assertEquals(3, rj.numberOfCases());
		for (int k = 0; k != 3; ++k) {
			Expr.Equals gi = (Expr.Equals) ri.getGuard(k);
			Expr.Equals gj = (Expr.Equals) rj.getGuard(k);
			assertEquals(CONST(k, Type.Int32), gi.getRightHandSide());
			assertEquals(gi.getRightHandSide(), gj.getRightHandSide());
			assertEquals(ri.getValue(k), rj.getValue(k));
		}
	}

	@Test
	public void testDynamicIndexCollapses() {
		Expr v = SYMBOL("v", VECTOR_TYPE(Type.Int32, 2));
		assertEquals(SSA_SYMBOL("v[*]#0", Type.Int32, "v[*]"), state.read(INDEX(v, i), false));
		assertEquals(SSA_SYMBOL("v[*]#0", Type.Int32, "v[*]"), state.read(INDEX(v, j), false));
	}

	@Test
	public void testMemberOfDynamicIndex() {
		Expr points = SYMBOL("points", ARRAY_TYPE(POINT, 2));
		Expr e = MEMBER(INDEX(points, i), "x");
		assertEquals(SSA_SYMBOL("points[*].x#0", Type.Int32, "points[*].x"), state.read(e, false));
		assertEquals(SSA_SYMBOL("points[1].x#0", Type.Int32, "points[1].x"),
				state.read(MEMBER(INDEX(points, CONST(1, Type.Int32)), "x"), false));
	}

	@Test
	public void testUnboundedArrayIndex() {
		Expr r = state.read(INDEX(u, i), false);
		assertTrue(r instanceof Expr.Index);
		assertEquals("u#0[i#0]", ExprPrinter.toString(r));
	}

	@Test
	public void testUnboundedArrayHasNoDefaultZero() {
		// the default initializer has nothing for an array without a size
		Expr r = state.read(u, true);
		assertEquals(SSA_SYMBOL("u#0", u.getType(), "u"), r);
	}

	@Test
	public void testUnboundedArrayZeroFromInitializer() {
		Expr empty = ARRAY(u.getType(), Arrays.<Expr>asList());
		config.setInitializer((type, ns) -> Optional.of(empty));
		assertEquals(empty, state.read(u, true));
		// the value is retained, whilst the incarnation remains
		assertEquals(empty, state.read(u, true));
		assertEquals(SSA_SYMBOL("u#0", u.getType(), "u"), state.read(u, false));
	}

	@Test
	public void testArrayOverSizeLimit() {
		config.setArraySizeLimit(2);
		Expr r = state.read(INDEX(a, i), false);
		assertTrue(r instanceof Expr.Index);
		assertEquals("a#0[i#0]", ExprPrinter.toString(r));
	}

	@Test
	public void testUnionMemberAborts() {
		assertThrows(ContractViolation.class, () -> state.read(MEMBER(w, "f")));
		assertThrows(ContractViolation.class, () -> state.read(MEMBER(w, "b"), false));
	}

	@Test
	public void testUnionReadWhole() {
		assertEquals(SSA_SYMBOL("w#0", WORD, "w"), state.read(w));
	}

	// ======================================================================
	// Dereferences & free inputs
	// ======================================================================

	@Test
	public void testNondet() {
		Expr r1 = state.read(NONDET(Type.Int32));
		Expr r2 = state.read(NONDET(Type.Int32));
		// never propagated
		assertEquals(SSA_SYMBOL("symex::nondet0#0", Type.Int32, "symex::nondet0"), r1);
		assertEquals(SSA_SYMBOL("symex::nondet1#0", Type.Int32, "symex::nondet1"), r2);
		assertEquals(VarMap.Kind.PROCEDURE_LOCAL, config.getVarMap().lookup("symex::nondet0").getKind());
	}

	@Test
	public void testAuxiliaryNamingIsSequential() {
		state.read(NONDET(Type.Int32));
		Expr r = state.read(DEREF_FAILURE(Type.Int32));
		assertEquals(SYMBOL("symex::deref1", Type.Int32), r);
		AuxiliarySymbols symbols = config.getNewSymbols();
		assertEquals(2, symbols.getSymbols().size());
		assertEquals("symex::nondet0", symbols.getSymbols().get(0).getName());
		assertEquals("symex::deref1", symbols.getSymbols().get(1).getName());
	}

	@Test
	public void testUnexpectedSideEffect() {
		assertThrows(ContractViolation.class, () -> state.read(SIDE_EFFECT("malloc", Type.Int32)));
	}

	@Test
	public void testUnresolvedDereference() {
		Expr r = state.read(DEREF(p));
		assertEquals(SYMBOL("symex::deref0", Type.Int32), r);
	}

	@Test
	public void testIntegerDereference() {
		Expr r = state.read(INTEGER_DEREF(CONST(123, Type.UInt64), Type.Int32));
		assertEquals(SYMBOL("symex::deref0", Type.Int32), r);
	}

	@Test
	public void testResolvedDereference() {
		config.setDereferencer((pointer, ns) -> IF(EQ(pointer, CONST(0, pointer.getType())), g, x));
		// pointer is propagated, even though its target is not
		assertEquals(SSA_SYMBOL("g#0", Type.Int32, "g"), state.read(DEREF(p), false));
	}

	@Test
	public void testDereferenceSeesPointerValue() {
		config.setDereferencer((pointer, ns) -> {
			assertEquals(CONST(0, p.getType()), pointer);
			return x;
		});
		assertEquals(CONST(0, Type.Int32), state.read(DEREF(p)));
	}

	@Test
	public void testAddressOfUnchanged() {
		Expr e = ADDRESS_OF(MEMBER(s, "x"));
		assertEquals(e, state.read(e));
		// and no location is touched
		assertNull(config.getVarMap().lookup("s.x"));
	}

	@Test
	public void testByteExtractOperands() {
		Expr e = BYTE_EXTRACT(x, CONST(0, Type.Int32), new Type.Int(8, false), false);
		assertEquals("byte_extract_little_endian(x#0, 0)", ExprPrinter.toString(state.read(e, false)));
	}

	@Test
	public void testCodeSymbolUntouched() {
		Expr f = SYMBOL("f", CODE_TYPE(Type.Int32, Type.Int32));
		assertEquals(f, state.read(f));
	}

	@Test
	public void testConditional() {
		Expr e = IF(EQ(x, CONST(0, Type.Int32)), g, x);
		assertEquals(CONST(0, Type.Int32), state.read(e));
		assertEquals("(x#0 == 0) ? g#0 : x#0", ExprPrinter.toString(state.read(e, false)));
	}

	// ======================================================================
	// General properties
	// ======================================================================

	@ParameterizedTest
	@MethodSource("expressions")
	public void testIdempotence(Expr e) {
		Expr r = state.read(e, false);
		assertEquals(r, state.read(r, false));
		assertEquals(r, state.read(r, true));
	}

	@ParameterizedTest
	@MethodSource("expressions")
	public void testInputUnchanged(Expr e) {
		Expr original = e.copy();
		state.read(e, false);
		state.read(e, true);
		assertEquals(original, e);
	}

	@Test
	public void testClassification() {
		state.read(ADD(ADD(x, g), SYMBOL("t", Type.Int32)), false);
		VarMap varMap = config.getVarMap();
		assertEquals(VarMap.Kind.PROCEDURE_LOCAL, varMap.lookup("x").getKind());
		assertEquals(VarMap.Kind.SHARED, varMap.lookup("g").getKind());
		assertEquals(VarMap.Kind.THREAD_LOCAL, varMap.lookup("t").getKind());
	}

	@Test
	public void testUnknownSymbol() {
		assertThrows(ContractViolation.class, () -> state.read(SYMBOL("missing", Type.Int32)));
	}

	@Test
	public void testForkIsolation() {
		assertEquals(CONST(0, Type.Int32), state.read(x));
		PathSymexState fork = state.fork();
		VarMap.VarInfo info = config.getVarMap().lookup("x");
		fork.recordAssignment(info, CONST(7, Type.Int32));
		assertEquals(CONST(7, Type.Int32), fork.read(x));
		assertEquals(CONST(0, Type.Int32), state.read(x));
		assertEquals(SSA_SYMBOL("x#0", Type.Int32, "x"), state.read(x, false));
		assertEquals(SSA_SYMBOL("x#1", Type.Int32, "x"), fork.read(x, false));
		// locations are shared
		fork.read(g, false);
		state.read(g, false);
		assertEquals(2, config.getVarMap().size());
		assertTrue(fork.getConfig() == state.getConfig());
	}

	@Test
	public void testLookupVarState() {
		assertNull(state.lookupVarState("x"));
		state.read(x);
		assertTrue(state.lookupVarState("x").hasValue());
		assertTrue(state.lookupVarState("x").hasSSASymbol());
	}

	@Test
	public void testIsSymbolMemberIndex() {
		assertTrue(state.isSymbolMemberIndex(MEMBER(s, "x")));
		assertTrue(state.isSymbolMemberIndex(INDEX(a, i)));
		assertFalse(state.isSymbolMemberIndex(MEMBER(w, "f")));
		assertFalse(state.isSymbolMemberIndex(SSA_SYMBOL("x#0", Type.Int32, "x")));
		assertFalse(state.isSymbolMemberIndex(ADD(x, g)));
		assertFalse(state.isSymbolMemberIndex(SYMBOL("f", CODE_TYPE(Type.Int32))));
	}

	@Test
	public void testDebugLogging() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true);
		config.setDebug(true).setLogger(new Logger.Default(out));
		state.read(x, false);
		out.flush();
		String output = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(output.contains("read x ==> x#0"));
	}

	@Test
	public void testDeepInstantiation() {
		final int depth = 200000;
		Expr e = x;
		for (int k = 0; k != depth; ++k) {
			e = ADD(e, x);
		}
		Expr r = state.instantiate(e, false);
		Expr.Symbol x0 = SSA_SYMBOL("x#0", Type.Int32, "x");
		// walk both spines without recursing
		Expr input = e;
		for (int k = 0; k != depth; ++k) {
			assertTrue(r instanceof Expr.Addition);
			assertFalse(r == input);
			assertEquals(x0, r.getOperand(1));
			assertTrue(input.getOperand(1) == x);
			r = r.getOperand(0);
			input = input.getOperand(0);
		}
		assertEquals(x0, r);
		assertTrue(input == x);
	}

	private static Stream<Expr> expressions() {
		return Stream.of(x, s, a, INDEX(a, i), INDEX(u, j), MEMBER(s, "x"), ADD(x, CONST(1, Type.Int32)),
				EQ(INDEX(a, CONST(1, Type.Int32)), g), IF(EQ(i, j), x, g), NONDET(Type.Int32),
				ADDRESS_OF(x));
	}
}
