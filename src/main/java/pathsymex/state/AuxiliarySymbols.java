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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import pathsymex.core.Program.Decl;
import pathsymex.core.Program.Type;

/**
 * The append-only table of symbols synthesized during symbolic execution, such
 * as free inputs and placeholders for unresolved dereferences. All symbols are
 * numbered from a single counter, so that names are unique across categories.
 *
 * @author The PathSymex Project Developers
 *
 */
public class AuxiliarySymbols {
	public static final String PREFIX = "symex::";
	/**
	 * Free inputs.
	 */
	public static final String NONDET = "nondet";
	/**
	 * Unresolved or failed dereferences.
	 */
	public static final String DEREF = "deref";

	private final List<Decl.Symbol> symbols = new ArrayList<>();
	private final Map<String, Decl.Symbol> index = new HashMap<>();
	private int counter;

	/**
	 * Synthesize a new symbol of a given category and type.
	 *
	 * @param category
	 * @param type
	 * @return
	 */
	public synchronized Decl.Symbol fresh(String category, Type type) {
		String name = PREFIX + category + counter;
		counter++;
		// procedure-local
		Decl.Symbol symbol = new Decl.Symbol(name, type, false, false, true);
		symbols.add(symbol);
		index.put(name, symbol);
		return symbol;
	}

	public synchronized boolean contains(String identifier) {
		return index.containsKey(identifier);
	}

	public synchronized Decl.Symbol lookup(String identifier) {
		return index.get(identifier);
	}

	public synchronized List<Decl.Symbol> getSymbols() {
		return Collections.unmodifiableList(new ArrayList<>(symbols));
	}

	public synchronized int getCounter() {
		return counter;
	}

	synchronized void clear() {
		symbols.clear();
		index.clear();
		counter = 0;
	}
}
