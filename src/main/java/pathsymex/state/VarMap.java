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

import java.io.PrintStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import pathsymex.core.Namespace;
import pathsymex.core.Program;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;

/**
 * Numbers the memory locations accessed during symbolic execution. A location
 * is a base symbol together with an access path suffix, such as
 * <code>s.f[2]</code> or <code>a[*]</code>. Each location is registered once,
 * receiving a unique number and a sharing classification, and is never removed
 * until the map is cleared. The map is shared between all paths being explored,
 * hence all updates are serialised.
 *
 * @author The PathSymex Project Developers
 *
 */
public class VarMap {
	/**
	 * Prefix of objects allocated dynamically, which are always shared.
	 */
	public static final String DYNAMIC_PREFIX = "symex_dynamic::";

	public enum Kind {
		SHARED, THREAD_LOCAL, PROCEDURE_LOCAL
	}

	public static class VarInfo {
		private final Kind kind;
		private final int number;
		private final String fullIdentifier;
		private final String symbol;
		private final String suffix;
		// the symbol-member-index expression first registered
		private final Expr original;
		private int ssaCounter;

		private VarInfo(Kind kind, int number, String symbol, String suffix, Expr original) {
			this.kind = kind;
			this.number = number;
			this.fullIdentifier = symbol + suffix;
			this.symbol = symbol;
			this.suffix = suffix;
			this.original = original;
		}

		public Kind getKind() {
			return kind;
		}

		public boolean isShared() {
			return kind == Kind.SHARED;
		}

		public int getNumber() {
			return number;
		}

		public String getFullIdentifier() {
			return fullIdentifier;
		}

		public String getSymbol() {
			return symbol;
		}

		public String getSuffix() {
			return suffix;
		}

		public Expr getOriginal() {
			return original;
		}

		public Type getType() {
			return original.getType();
		}

		public synchronized int getSSACounter() {
			return ssaCounter;
		}

		/**
		 * Advance the generation of this location. This must happen on every write,
		 * before the SSA symbol for the written value is minted.
		 */
		public synchronized void incrementSSACounter() {
			++ssaCounter;
		}

		public synchronized String ssaIdentifier() {
			return fullIdentifier + "#" + ssaCounter;
		}

		/**
		 * Construct the SSA symbol for the current generation of this location.
		 *
		 * @return
		 */
		public Expr.Symbol ssaSymbol() {
			return Program.SSA_SYMBOL(ssaIdentifier(), original.getType(), fullIdentifier);
		}

		@Override
		public String toString() {
			return "full_identifier: " + fullIdentifier + ", number: " + number + ", kind: " + kind + ", ssa_counter: "
					+ getSSACounter();
		}
	}

	private final Map<String, VarInfo> idMap = new LinkedHashMap<>();
	private final Namespace ns;
	private final SymbolClassifier classifier;
	private final AuxiliarySymbols newSymbols = new AuxiliarySymbols();
	/**
	 * Constant-sized arrays larger than this are treated as unbounded.
	 */
	private int arraySizeLimit = Integer.MAX_VALUE;
	private int count;

	public VarMap(Namespace ns) {
		this(ns, SymbolClassifier.fromNamespace(ns));
	}

	public VarMap(Namespace ns, SymbolClassifier classifier) {
		if (ns == null) {
			throw new IllegalArgumentException("invalid namespace");
		} else if (classifier == null) {
			throw new IllegalArgumentException("invalid classifier");
		}
		this.ns = ns;
		this.classifier = classifier;
	}

	public Namespace getNamespace() {
		return ns;
	}

	/**
	 * Get the symbols synthesized so far.
	 *
	 * @return
	 */
	public AuxiliarySymbols getNewSymbols() {
		return newSymbols;
	}

	public VarMap setArraySizeLimit(int limit) {
		if (limit < 0) {
			throw new IllegalArgumentException("invalid array size limit");
		}
		this.arraySizeLimit = limit;
		return this;
	}

	public int getArraySizeLimit() {
		return arraySizeLimit;
	}

	/**
	 * Get the location identified by a given symbol and suffix, registering it if
	 * this is the first time it is seen.
	 *
	 * @param symbol   The base symbol identifier.
	 * @param suffix   The access path (e.g. <code>.f[2]</code>), possibly empty.
	 * @param original The access expression itself, whose type is the location's
	 *                 type.
	 * @return
	 */
	public synchronized VarInfo get(String symbol, String suffix, Expr original) {
		if (symbol == null || symbol.isEmpty()) {
			throw new IllegalArgumentException("invalid symbol");
		}
		String fullIdentifier = symbol + suffix;
		VarInfo info = idMap.get(fullIdentifier);
		if (info == null) {
			info = new VarInfo(classify(symbol), count++, symbol, suffix, original.copy());
			idMap.put(fullIdentifier, info);
		}
		return info;
	}

	public VarInfo get(Expr.Symbol original) {
		return get(original.getIdentifier(), "", original);
	}

	/**
	 * Look up a location by its full identifier.
	 *
	 * @param fullIdentifier
	 * @return The location, or <code>null</code> if it was never registered.
	 */
	public synchronized VarInfo lookup(String fullIdentifier) {
		return idMap.get(fullIdentifier);
	}

	public synchronized int size() {
		return idMap.size();
	}

	public synchronized List<VarInfo> getVariables() {
		return new ArrayList<>(idMap.values());
	}

	/**
	 * Forget all locations and synthesized symbols, restarting all numbering. This
	 * is for use between independent analyses.
	 */
	public synchronized void clear() {
		idMap.clear();
		newSymbols.clear();
		count = 0;
	}

	/**
	 * Check whether a given type is an array which cannot be flattened, because
	 * its size is unknown, not constant, or too large.
	 *
	 * @param type
	 * @return
	 */
	public boolean isUnboundedArray(Type type) {
		type = ns.follow(type);
		if (!(type instanceof Type.Array)) {
			return false;
		}
		Expr size = ((Type.Array) type).getSize();
		if (!(size instanceof Expr.Integer)) {
			return true;
		}
		BigInteger value = ((Expr.Integer) size).getValue();
		return value.compareTo(BigInteger.valueOf(arraySizeLimit)) > 0;
	}

	public synchronized void output(PrintStream out) {
		for (VarInfo info : idMap.values()) {
			out.println(info);
		}
	}

	private Kind classify(String symbol) {
		if (symbol.startsWith(DYNAMIC_PREFIX)) {
			return Kind.SHARED;
		} else if (newSymbols.contains(symbol)) {
			return Kind.PROCEDURE_LOCAL;
		} else {
			return classifier.classify(symbol);
		}
	}
}
