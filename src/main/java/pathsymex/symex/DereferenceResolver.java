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

import pathsymex.core.Program.Expr;
import pathsymex.util.AbstractExpressionTransform;

/**
 * Replaces every dereference in an expression with whatever the configured
 * {@link Dereferencer} says the pointer refers to, and every address-of with
 * the result of the configured {@link AddressEvaluator}. The pointer being
 * dereferenced is first read in the given state, so that the oracle sees its
 * current value.
 *
 * @author The PathSymex Project Developers
 *
 */
public class DereferenceResolver extends AbstractExpressionTransform {
	private final PathSymexState state;

	public DereferenceResolver(PathSymexState state) {
		if (state == null) {
			throw new IllegalArgumentException("invalid state");
		}
		this.state = state;
	}

	public Expr resolve(Expr expr) {
		return visitExpression(expr);
	}

	@Override
	protected Expr visitDereference(Expr.Dereference expr) {
		SymexConfig config = state.getConfig();
		Expr pointer = state.read(expr.getPointer(), true);
		return config.getDereferencer().dereference(pointer, config.getNamespace());
	}

	@Override
	protected Expr visitAddressOf(Expr.AddressOf expr) {
		SymexConfig config = state.getConfig();
		return config.getAddressEvaluator().addressOf(expr, config.getNamespace());
	}
}
