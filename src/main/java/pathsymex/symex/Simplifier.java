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
 * Algebraic simplification and constant folding. Implementations must be
 * idempotent and must not modify the given expression, though the result may
 * share nodes with it.
 */
public interface Simplifier {
	public Expr simplify(Expr expr, Namespace ns);
}
