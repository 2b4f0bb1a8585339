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

import java.util.Optional;

import pathsymex.core.Namespace;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;

/**
 * Synthesizes the default ("zero") value of a type.
 */
public interface ZeroInitializer {
	/**
	 * Construct the zero value of a given type.
	 *
	 * @param type
	 * @param ns
	 * @return The zero value, or nothing if the type has no canonical default.
	 */
	public Optional<Expr> zeroValue(Type type, Namespace ns);
}
