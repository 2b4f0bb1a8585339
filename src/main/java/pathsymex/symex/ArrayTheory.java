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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import pathsymex.core.Namespace;
import pathsymex.core.Program;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;
import pathsymex.util.ContractViolation;

/**
 * Encodes an access to a bounded array at a non-constant index as an explicit
 * case split over every possible index. For example, <code>a[i]</code> where
 * <code>a</code> has three elements becomes:
 *
 * <pre>
 * cond { i == 0 -> a[0]; i == 1 -> a[1]; i == 2 -> a[2] }
 * </pre>
 *
 * A single <code>cond</code> is used rather than nested conditionals, to keep
 * the depth of the result constant.
 *
 * @author The PathSymex Project Developers
 *
 */
public class ArrayTheory {
	private final PathSymexState state;

	public ArrayTheory(PathSymexState state) {
		if (state == null) {
			throw new IllegalArgumentException("invalid state");
		}
		this.state = state;
	}

	/**
	 * Split a given access, if it is an index into a bounded array whose index
	 * does not evaluate to a constant.
	 *
	 * @param expr
	 * @param propagate Whether values are propagated when reading the index.
	 * @return
	 */
	public Optional<Expr.Cond> split(Expr expr, boolean propagate) {
		if (!(expr instanceof Expr.Index)) {
			return Optional.empty();
		}
		SymexConfig config = state.getConfig();
		Namespace ns = config.getNamespace();
		Expr.Index index = (Expr.Index) expr;
		Type type = ns.follow(index.getArray().getType());
		if (!(type instanceof Type.Array) || config.getVarMap().isUnboundedArray(type)) {
			return Optional.empty();
		}
		Expr value = config.getSimplifier().simplify(state.read(index.getIndex(), propagate), ns);
		if (value.isConstant()) {
			return Optional.empty();
		}
		Type.Array arrayType = (Type.Array) type;
		BigInteger size = ((Expr.Integer) arrayType.getSize()).getValue();
		if (size.signum() < 0 || size.bitLength() > 31) {
			throw new ContractViolation("failed to convert array size");
		}
		Type indexType = index.getIndex().getType();
		List<Expr> guards = new ArrayList<>();
		List<Expr> values = new ArrayList<>();
		for (int k = 0; k < size.intValue(); ++k) {
			guards.add(Program.EQ(index.getIndex().copy(), Program.CONST(k, indexType)));
			values.add(Program.INDEX(index.getArray().copy(), Program.CONST(k, indexType), arrayType.getElement()));
		}
		return Optional.of(Program.COND(index.getType(), guards, values));
	}
}
