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
import pathsymex.state.AuxiliarySymbols;
import pathsymex.state.SymbolClassifier;
import pathsymex.state.VarMap;
import pathsymex.util.ExprInitializer;
import pathsymex.util.ExprSimplifier;
import wycc.util.Logger;

/**
 * The configuration shared by every path of one analysis: the namespace, the
 * variable map and the external collaborators. Paths forked from one another
 * share the same configuration.
 *
 * @author The PathSymex Project Developers
 *
 */
public class SymexConfig {
	private final Namespace ns;
	/**
	 * Numbering of all locations, shared between paths.
	 */
	private final VarMap varMap;
	private Simplifier simplifier = new ExprSimplifier();
	private ZeroInitializer initializer = new ExprInitializer();
	private Dereferencer dereferencer = Dereferencer.UNRESOLVED;
	private AddressEvaluator addressEvaluator = AddressEvaluator.IDENTITY;
	/**
	 * Logger for useful stuff
	 */
	private Logger logger = Logger.NULL;
	/**
	 * Specify whether to print verbose progress messages or not
	 */
	private boolean verbose = false;
	/**
	 * Specify debugging mode (this reports every read)
	 */
	private boolean debug = false;

	public SymexConfig(Namespace ns) {
		this(ns, new VarMap(ns));
	}

	public SymexConfig(Namespace ns, SymbolClassifier classifier) {
		this(ns, new VarMap(ns, classifier));
	}

	public SymexConfig(Namespace ns, VarMap varMap) {
		if (ns == null) {
			throw new IllegalArgumentException("invalid namespace");
		} else if (varMap == null) {
			throw new IllegalArgumentException("invalid variable map");
		}
		this.ns = ns;
		this.varMap = varMap;
	}

	public Namespace getNamespace() {
		return ns;
	}

	public VarMap getVarMap() {
		return varMap;
	}

	public AuxiliarySymbols getNewSymbols() {
		return varMap.getNewSymbols();
	}

	public Simplifier getSimplifier() {
		return simplifier;
	}

	public ZeroInitializer getInitializer() {
		return initializer;
	}

	public Dereferencer getDereferencer() {
		return dereferencer;
	}

	public AddressEvaluator getAddressEvaluator() {
		return addressEvaluator;
	}

	public Logger getLogger() {
		return logger;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public boolean isDebug() {
		return debug;
	}

	public SymexConfig setSimplifier(Simplifier simplifier) {
		if (simplifier == null) {
			throw new IllegalArgumentException("invalid simplifier");
		}
		this.simplifier = simplifier;
		return this;
	}

	public SymexConfig setInitializer(ZeroInitializer initializer) {
		if (initializer == null) {
			throw new IllegalArgumentException("invalid initializer");
		}
		this.initializer = initializer;
		return this;
	}

	public SymexConfig setDereferencer(Dereferencer dereferencer) {
		if (dereferencer == null) {
			throw new IllegalArgumentException("invalid dereferencer");
		}
		this.dereferencer = dereferencer;
		return this;
	}

	public SymexConfig setAddressEvaluator(AddressEvaluator addressEvaluator) {
		if (addressEvaluator == null) {
			throw new IllegalArgumentException("invalid address evaluator");
		}
		this.addressEvaluator = addressEvaluator;
		return this;
	}

	public SymexConfig setLogger(Logger logger) {
		if (logger == null) {
			throw new IllegalArgumentException("invalid logger");
		}
		this.logger = logger;
		return this;
	}

	public SymexConfig setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	public SymexConfig setDebug(boolean flag) {
		this.debug = flag;
		return this;
	}

	/**
	 * Set the largest array size which will be flattened. Larger arrays are
	 * handled as unbounded arrays.
	 *
	 * @param limit
	 * @return
	 */
	public SymexConfig setArraySizeLimit(int limit) {
		varMap.setArraySizeLimit(limit);
		return this;
	}
}
