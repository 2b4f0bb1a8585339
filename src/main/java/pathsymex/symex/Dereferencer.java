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
import pathsymex.core.Program;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;

/**
 * Resolves a pointer value to the object(s) it may point to. The result can
 * be, for example, a guarded choice between candidate objects, or a
 * dereference failure. It need not be in SSA form.
 */
public interface Dereferencer {

	/**
	 * Resolves nothing: the dereference is kept as is, and later becomes an
	 * unconstrained placeholder.
	 */
	public static final Dereferencer UNRESOLVED = new Dereferencer() {
		@Override
		public Expr dereference(Expr pointer, Namespace ns) {
			Type type = ns.follow(pointer.getType());
			if (!(type instanceof Type.Pointer)) {
				throw new IllegalArgumentException("dereference requires pointer operand");
			}
			return Program.DEREF(pointer, ((Type.Pointer) type).getTarget());
		}
	};

	/**
	 * Dereference a given pointer value.
	 *
	 * @param pointer The pointer value, as already read in the current state.
	 * @param ns
	 * @return
	 */
	public Expr dereference(Expr pointer, Namespace ns);
}
