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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import pathsymex.core.Namespace;
import pathsymex.core.Program;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;
import pathsymex.symex.Simplifier;

/**
 * A simple constant folder, sufficient for evaluating array indices and
 * cleaning up the conditionals produced during symbolic execution. The
 * following are folded:
 *
 * <ul>
 * <li>Additions of integer constants (with wrap around) and of zero.</li>
 * <li>Equalities between constants, or between identical expressions.</li>
 * <li>Conditionals with constant conditions or identical branches.</li>
 * <li>Cases of a <code>cond</code> whose guards are constant.</li>
 * <li>Constant indices into array (or vector) constructors, and members of
 * struct constructors.</li>
 * </ul>
 *
 * @author The PathSymex Project Developers
 *
 */
public class ExprSimplifier implements Simplifier {

	@Override
	public Expr simplify(Expr expr, Namespace ns) {
		return new Folder(ns).visitExpression(expr);
	}

	/**
	 * Reduce a given value into the range of a given integer type.
	 *
	 * @param value
	 * @param type
	 * @return
	 */
	public static BigInteger normalise(BigInteger value, Type type) {
		if (!(type instanceof Type.Int)) {
			return value;
		}
		Type.Int t = (Type.Int) type;
		BigInteger modulus = BigInteger.ONE.shiftLeft(t.getWidth());
		value = value.mod(modulus);
		if (t.isSigned() && value.testBit(t.getWidth() - 1)) {
			value = value.subtract(modulus);
		}
		return value;
	}

	private static class Folder extends AbstractExpressionTransform {
		private final Namespace ns;

		public Folder(Namespace ns) {
			this.ns = ns;
		}

		@Override
		protected Expr visitAddition(Expr.Addition expr) {
			Expr e = visitOperands(expr);
			Expr lhs = e.getOperand(0);
			Expr rhs = e.getOperand(1);
			if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
				BigInteger sum = ((Expr.Integer) lhs).getValue().add(((Expr.Integer) rhs).getValue());
				return Program.CONST(normalise(sum, e.getType()), e.getType());
			} else if (isZero(lhs) && rhs.getType().equals(e.getType())) {
				return rhs;
			} else if (isZero(rhs) && lhs.getType().equals(e.getType())) {
				return lhs;
			}
			return e;
		}

		@Override
		protected Expr visitEquals(Expr.Equals expr) {
			Expr e = visitOperands(expr);
			Expr lhs = e.getOperand(0);
			Expr rhs = e.getOperand(1);
			if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
				return Program.CONST(((Expr.Integer) lhs).getValue().equals(((Expr.Integer) rhs).getValue()));
			} else if (lhs instanceof Expr.Boolean && rhs instanceof Expr.Boolean) {
				return Program.CONST(((Expr.Boolean) lhs).getValue() == ((Expr.Boolean) rhs).getValue());
			} else if (lhs.equals(rhs)) {
				return Program.CONST(true);
			}
			return e;
		}

		@Override
		protected Expr visitIf(Expr.If expr) {
			Expr e = visitOperands(expr);
			Expr condition = e.getOperand(0);
			if (condition instanceof Expr.Boolean) {
				return ((Expr.Boolean) condition).getValue() ? e.getOperand(1) : e.getOperand(2);
			} else if (e.getOperand(1).equals(e.getOperand(2))) {
				return e.getOperand(1);
			}
			return e;
		}

		@Override
		protected Expr visitCond(Expr.Cond expr) {
			Expr.Cond e = (Expr.Cond) visitOperands(expr);
			List<Expr> guards = new ArrayList<>();
			List<Expr> values = new ArrayList<>();
			for (int i = 0; i != e.numberOfCases(); ++i) {
				Expr guard = e.getGuard(i);
				if (guard instanceof Expr.Boolean && !((Expr.Boolean) guard).getValue()) {
					continue;
				} else if (guard instanceof Expr.Boolean && guards.isEmpty()) {
					// first case which definitely holds
					return e.getValue(i);
				}
				guards.add(guard);
				values.add(e.getValue(i));
			}
			if (guards.isEmpty() || guards.size() == e.numberOfCases()) {
				return e;
			}
			return Program.COND(e.getType(), guards, values);
		}

		@Override
		protected Expr visitIndex(Expr.Index expr) {
			Expr e = visitOperands(expr);
			Expr source = e.getOperand(0);
			Expr index = e.getOperand(1);
			if ((source instanceof Expr.ArrayConstructor || source instanceof Expr.VectorConstructor)
					&& index instanceof Expr.Integer) {
				BigInteger i = ((Expr.Integer) index).getValue();
				if (i.signum() >= 0 && i.compareTo(BigInteger.valueOf(source.size())) < 0) {
					return source.getOperand(i.intValue());
				}
			}
			return e;
		}

		@Override
		protected Expr visitMember(Expr.Member expr) {
			Expr e = visitOperands(expr);
			Expr source = e.getOperand(0);
			if (source instanceof Expr.StructConstructor) {
				Type type = ns.follow(source.getType());
				if (type instanceof Type.Struct) {
					int i = ((Type.Struct) type).getComponentIndex(expr.getComponentName());
					if (i >= 0 && i < source.size()) {
						return source.getOperand(i);
					}
				}
			}
			return e;
		}

		private static boolean isZero(Expr e) {
			return e instanceof Expr.Integer && ((Expr.Integer) e).getValue().signum() == 0;
		}
	}
}
