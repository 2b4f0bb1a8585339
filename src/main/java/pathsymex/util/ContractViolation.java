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

/**
 * Signals that an expression handed to the symbolic state breaks an invariant
 * which an earlier stage should have established (for example, a member
 * access into a union which was not lowered to a byte extract).
 *
 * @author The PathSymex Project Developers
 *
 */
public class ContractViolation extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public ContractViolation(String message) {
		super(message);
	}
}
