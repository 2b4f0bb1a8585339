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

import pathsymex.core.Program.Expr;

/**
 * The state of one variable on one path: its current SSA incarnation (if it
 * has been read or written) and its propagated value (if known).
 */
public class VarState {
	private Expr ssaSymbol;
	private Expr value;

	public VarState() {
	}

	private VarState(VarState other) {
		this.ssaSymbol = other.ssaSymbol == null ? null : other.ssaSymbol.copy();
		this.value = other.value == null ? null : other.value.copy();
	}

	public boolean hasSSASymbol() {
		return ssaSymbol != null;
	}

	public Expr getSSASymbol() {
		return ssaSymbol;
	}

	public void setSSASymbol(Expr ssaSymbol) {
		this.ssaSymbol = ssaSymbol;
	}

	public boolean hasValue() {
		return value != null;
	}

	public Expr getValue() {
		return value;
	}

	/**
	 * Set the propagated value, or clear it by passing <code>null</code>.
	 *
	 * @param value
	 */
	public void setValue(Expr value) {
		this.value = value;
	}

	public VarState copy() {
		return new VarState(this);
	}

	@Override
	public String toString() {
		return "ssa: " + ssaSymbol + ", value: " + value;
	}
}
