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
package pathsymex.state;

import pathsymex.core.Namespace;
import pathsymex.core.Program.Decl;
import pathsymex.util.ContractViolation;

/**
 * Determines whether a program symbol is shared between threads, local to a
 * thread, or local to a procedure.
 */
public interface SymbolClassifier {

	public VarMap.Kind classify(String identifier);

	/**
	 * Classify symbols by their declared storage: variables with static lifetime
	 * are shared, unless marked thread-local; everything else is
	 * procedure-local.
	 *
	 * @param ns
	 * @return
	 */
	public static SymbolClassifier fromNamespace(Namespace ns) {
		return identifier -> {
			Decl.Symbol symbol = ns.lookup(identifier);
			if (symbol == null) {
				throw new ContractViolation("identifier \"" + identifier + "\" lookup in namespace failed");
			} else if (!symbol.isStaticLifetime()) {
				return VarMap.Kind.PROCEDURE_LOCAL;
			} else if (symbol.isThreadLocal()) {
				return VarMap.Kind.THREAD_LOCAL;
			} else {
				return VarMap.Kind.SHARED;
			}
		};
	}
}
