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

import pathsymex.core.Namespace;
import pathsymex.core.Program.Expr;

/**
 * Computes the address of an lvalue which is not itself dereferenced.
 */
public interface AddressEvaluator {

	/**
	 * Leaves the address unchanged, which is only adequate when addresses are
	 * taken of plain symbols.
	 */
	public static final AddressEvaluator IDENTITY = new AddressEvaluator() {
		@Override
		public Expr addressOf(Expr.AddressOf expr, Namespace ns) {
			return expr;
		}
	};

	public Expr addressOf(Expr.AddressOf expr, Namespace ns);
}
