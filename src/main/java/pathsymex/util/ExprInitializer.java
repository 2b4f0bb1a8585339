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
import java.util.Optional;

import pathsymex.core.Namespace;
import pathsymex.core.Program;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;
import pathsymex.symex.ZeroInitializer;

/**
 * Constructs zero values by following the structure of a type. Booleans are
 * <code>false</code>, integers and pointers are <code>0</code>, and
 * aggregates are constructors of zero values. Unions, functions and arrays
 * without a constant size have no zero value.
 *
 * @author The PathSymex Project Developers
 *
 */
public class ExprInitializer implements ZeroInitializer {

	@Override
	public Optional<Expr> zeroValue(Type type, Namespace ns) {
		Type t = ns.follow(type);
		if (t instanceof Type.Bool) {
			return Optional.of(Program.CONST(false));
		} else if (t instanceof Type.Int || t instanceof Type.Pointer) {
			return Optional.of(Program.CONST(0, type));
		} else if (t instanceof Type.Struct) {
			List<Expr> operands = new ArrayList<>();
			for (Type.Component c : ((Type.Struct) t).getComponents()) {
				Optional<Expr> zero = zeroValue(c.getType(), ns);
				if (!zero.isPresent()) {
					return Optional.empty();
				}
				operands.add(zero.get());
			}
			return Optional.of(Program.STRUCT(type, operands));
		} else if (t instanceof Type.Array) {
			Type.Array array = (Type.Array) t;
			return replicate(array.getElement(), array.getSize(), ns).map(ops -> Program.ARRAY(type, ops));
		} else if (t instanceof Type.Vector) {
			Type.Vector vector = (Type.Vector) t;
			return replicate(vector.getElement(), vector.getSize(), ns).map(ops -> Program.VECTOR(type, ops));
		} else {
			return Optional.empty();
		}
	}

	private Optional<List<Expr>> replicate(Type element, Expr size, Namespace ns) {
		if (!(size instanceof Expr.Integer)) {
			return Optional.empty();
		}
		BigInteger n = ((Expr.Integer) size).getValue();
		if (n.signum() < 0 || n.bitLength() > 31) {
			return Optional.empty();
		}
		Optional<Expr> zero = zeroValue(element, ns);
		if (!zero.isPresent()) {
			return Optional.empty();
		}
		List<Expr> operands = new ArrayList<>();
		for (int i = 0; i < n.intValue(); ++i) {
			operands.add(zero.get().copy());
		}
		return Optional.of(operands);
	}
}
