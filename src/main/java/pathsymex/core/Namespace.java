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
package pathsymex.core;

/**
 * Provides lookup of symbols and named types.
 *
 * @author The PathSymex Project Developers
 *
 */
public interface Namespace {
	/**
	 * Look up the declaration of a given symbol.
	 *
	 * @param identifier
	 * @return The declaration, or <code>null</code> if there is none.
	 */
	public Program.Decl.Symbol lookup(String identifier);

	/**
	 * Expand any type synonyms at the outermost level of a given type.
	 *
	 * @param type
	 * @return
	 */
	public Program.Type follow(Program.Type type);
}
