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

import pathsymex.core.Namespace;
import pathsymex.core.Program;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;
import pathsymex.state.VarMap;
import pathsymex.util.ContractViolation;

/**
 * Splits struct, array and vector values into constructors over their
 * individual components. For example, given <code>s</code> of type
 * <code>struct { int x; int a[2]; }</code>, the result is
 * <code>{ s.x, [ s.a[0], s.a[1] ] }</code>. Arrays without a usable constant
 * size are left alone, and hence treated as a single location.
 *
 * @author The PathSymex Project Developers
 *
 */
public class AggregateFlattener {
	private final Namespace ns;
	private final VarMap varMap;
	private final Simplifier simplifier;

	public AggregateFlattener(Namespace ns, VarMap varMap, Simplifier simplifier) {
		this.ns = ns;
		this.varMap = varMap;
		this.simplifier = simplifier;
	}

	public AggregateFlattener(SymexConfig config) {
		this(config.getNamespace(), config.getVarMap(), config.getSimplifier());
	}

	/**
	 * Expand a given expression. Nodes in the result are never shared with the
	 * argument, which itself is left untouched.
	 *
	 * @param expr
	 * @return Either a constructor, or the expression itself if it is not a
	 *         flattenable aggregate.
	 */
	public Expr expand(Expr expr) {
		Type type = ns.follow(expr.getType());
		if (type instanceof Type.Struct) {
			return expandStruct(expr, (Type.Struct) type);
		} else if (type instanceof Type.Array) {
			if (varMap.isUnboundedArray(type)) {
				return expr;
			}
			return expandArray(expr, (Type.Array) type);
		} else if (type instanceof Type.Vector) {
			return expandVector(expr, (Type.Vector) type);
		} else {
			return expr;
		}
	}

	private Expr expandStruct(Expr expr, Type.Struct type) {
		List<Type.Component> components = type.getComponents();
		List<Expr> operands = new ArrayList<>();
		for (int i = 0; i != components.size(); ++i) {
			Type.Component component = components.get(i);
			Expr member;
			if (expr instanceof Expr.StructConstructor) {
				if (expr.size() != components.size()) {
					throw new ContractViolation("struct constructor does not match its type");
				}
				member = expr.getOperand(i).copy();
			} else {
				member = Program.MEMBER(expr.copy(), component.getName(), component.getType());
			}
			operands.add(expand(member));
		}
		return Program.STRUCT(expr.getType(), operands);
	}

	private Expr expandArray(Expr expr, Type.Array type) {
		Expr size = type.getSize();
		int n = toInt(size, "failed to convert array size");
		List<Expr> operands = new ArrayList<>();
		for (int i = 0; i < n; ++i) {
			Expr element = Program.INDEX(expr.copy(), Program.CONST(i, size.getType()), type.getElement());
			if (expr instanceof Expr.ArrayConstructor) {
				element = simplifier.simplify(element, ns).copy();
			}
			operands.add(expand(element));
		}
		return Program.ARRAY(expr.getType(), operands);
	}

	private Expr expandVector(Expr expr, Type.Vector type) {
		Expr size = type.getSize();
		if (!(size instanceof Expr.Integer)) {
			throw new ContractViolation("vector with non-constant size");
		}
		int n = toInt(size, "failed to convert vector size");
		List<Expr> operands = new ArrayList<>();
		for (int i = 0; i < n; ++i) {
			Expr element = Program.INDEX(expr.copy(), Program.CONST(i, size.getType()), type.getElement());
			if (expr instanceof Expr.VectorConstructor) {
				element = simplifier.simplify(element, ns).copy();
			}
			operands.add(expand(element));
		}
		return Program.VECTOR(expr.getType(), operands);
	}

	private static int toInt(Expr size, String message) {
		BigInteger value = ((Expr.Integer) size).getValue();
		if (value.signum() < 0 || value.bitLength() > 31) {
			throw new ContractViolation(message);
		}
		return value.intValue();
	}
}
