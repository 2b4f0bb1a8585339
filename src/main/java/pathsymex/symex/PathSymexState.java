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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import pathsymex.core.Namespace;
import pathsymex.core.Program.Decl;
import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;
import pathsymex.io.ExprPrinter;
import pathsymex.state.AuxiliarySymbols;
import pathsymex.state.VarMap;
import pathsymex.state.VarState;
import pathsymex.util.ContractViolation;
import wycc.util.Logger;

/**
 * The symbolic state of a single execution path. This is responsible for
 * turning program-level expressions into expressions over SSA symbols, such
 * that they can be handed to a solver. Consider the following:
 *
 * <pre>
 * s.x + a[i]
 * </pre>
 *
 * Assuming <code>a</code> is an array of two elements, reading this expression
 * (without propagation) gives something like:
 *
 * <pre>
 * s.x#0 + cond { i#0 == 0 -> a[0]#0; i#0 == 1 -> a[1]#0 }
 * </pre>
 *
 * Here, each of <code>s.x</code>, <code>a[0]</code>, <code>a[1]</code> and
 * <code>i</code> is a separate location numbered in the shared {@link VarMap},
 * whilst the current SSA incarnation (and, possibly, known value) of each is
 * held in this state.
 *
 * @author The PathSymex Project Developers
 *
 */
public class PathSymexState {
	private final SymexConfig config;
	/**
	 * Maps the full identifier of every location touched on this path to its
	 * state.
	 */
	private final Map<String, VarState> varStates;
	private final DereferenceResolver dereferencer;
	private final AggregateFlattener flattener;
	private final ArrayTheory arrayTheory;

	public PathSymexState(SymexConfig config) {
		if (config == null) {
			throw new IllegalArgumentException("invalid configuration");
		}
		this.config = config;
		this.varStates = new HashMap<>();
		this.dereferencer = new DereferenceResolver(this);
		this.flattener = new AggregateFlattener(config);
		this.arrayTheory = new ArrayTheory(this);
	}

	private PathSymexState(PathSymexState other) {
		this.config = other.config;
		this.varStates = new HashMap<>();
		for (Map.Entry<String, VarState> e : other.varStates.entrySet()) {
			varStates.put(e.getKey(), e.getValue().copy());
		}
		this.dereferencer = new DereferenceResolver(this);
		this.flattener = new AggregateFlattener(config);
		this.arrayTheory = new ArrayTheory(this);
	}

	public SymexConfig getConfig() {
		return config;
	}

	/**
	 * Create an independent copy of this state, for exploring a branch. The two
	 * states continue to share the same configuration and variable map.
	 *
	 * @return
	 */
	public PathSymexState fork() {
		return new PathSymexState(this);
	}

	public Expr read(Expr expr) {
		return read(expr, true);
	}

	/**
	 * Read a given expression in this state. This happens in three phases:
	 * dereferences are resolved (always propagating pointer values); then
	 * variable accesses are replaced by their SSA incarnations or values; and
	 * finally the result is simplified.
	 *
	 * @param expr      The expression to read, which is not modified.
	 * @param propagate Whether or not known values should be substituted for
	 *                  variables.
	 * @return
	 */
	public Expr read(Expr expr, boolean propagate) {
		if (expr == null) {
			throw new IllegalArgumentException("invalid expression");
		}
		Runtime runtime = Runtime.getRuntime();
		long start = System.currentTimeMillis();
		long memory = runtime.freeMemory();
		// we force propagation for dereferencing
		Expr dereferenced = dereferencer.resolve(expr);
		Expr instantiated = instantiate(dereferenced, propagate);
		Expr result = config.getSimplifier().simplify(instantiated, config.getNamespace());
		if (config.isDebug()) {
			Logger logger = config.getLogger();
			logger.logTimedMessage("read " + ExprPrinter.toString(expr) + " ==> " + ExprPrinter.toString(result),
					System.currentTimeMillis() - start, memory - runtime.freeMemory());
		}
		return result;
	}

	/**
	 * Replace every variable access in a given expression with its SSA
	 * incarnation or value. The given expression is not modified. Instead, each
	 * node is copied (shallowly) as it is visited, and its operands are then
	 * replaced in the copy. An explicit stack is used rather than recursion so
	 * that deep expressions are handled.
	 *
	 * @param expr
	 * @param propagate
	 * @return
	 */
	public Expr instantiate(Expr expr, boolean propagate) {
		Expr[] root = new Expr[] { expr };
		Deque<Slot> stack = new ArrayDeque<>();
		stack.push(new Slot(root, null, 0));
		while (!stack.isEmpty()) {
			Slot slot = stack.pop();
			Expr node = slot.get();
			Optional<Expr> replacement = instantiateNode(node, propagate);
			if (replacement.isPresent()) {
				slot.set(replacement.get());
			} else {
				// operands of the copy still refer into the original
				Expr copy = node.rebuild(node.getOperands().toArray(new Expr[node.size()]));
				slot.set(copy);
				for (int i = 0; i != copy.size(); ++i) {
					stack.push(new Slot(root, copy, i));
				}
			}
		}
		return root[0];
	}

	/**
	 * Apply the rewrite rule for a single node, if any.
	 *
	 * @param expr
	 * @param propagate
	 * @return The replacement for this node (which is not visited further), or
	 *         nothing if the node's operands should be visited instead.
	 */
	protected Optional<Expr> instantiateNode(Expr expr, boolean propagate) {
		Namespace ns = config.getNamespace();
		if (isSymbolMemberIndex(expr)) {
			Optional<Expr> result = readSymbolMemberIndex(expr, propagate);
			if (result.isPresent()) {
				return result;
			}
		}
		if (expr instanceof Expr.AddressOf) {
			// already evaluated when dereferencing
			return Optional.of(expr.copy());
		} else if (expr instanceof Expr.SideEffect) {
			String statement = ((Expr.SideEffect) expr).getStatement();
			if (statement.equals(Expr.SideEffect.NONDET)) {
				Expr.Symbol symbol = freshSymbol(AuxiliarySymbols.NONDET, expr.getType());
				return Optional.of(readSymbolMemberIndex(symbol, false).orElse(symbol));
			} else {
				throw new ContractViolation("unexpected side effect " + statement);
			}
		} else if (expr instanceof Expr.Dereference || expr instanceof Expr.IntegerDereference
				|| expr instanceof Expr.DereferenceFailure) {
			return Optional.of(freshSymbol(AuxiliarySymbols.DEREF, expr.getType()));
		} else if (expr instanceof Expr.Member) {
			Type type = ns.follow(((Expr.Member) expr).getCompound().getType());
			if (type instanceof Type.Union) {
				throw new ContractViolation("unexpected union member");
			} else if (!(type instanceof Type.Struct)) {
				throw new ContractViolation("member expects struct or union type: " + expr);
			}
		} else if (expr instanceof Expr.Symbol) {
			Expr.Symbol symbol = (Expr.Symbol) expr;
			if (!symbol.isSSA() && !isFunction(ns.follow(symbol.getType()))) {
				throw new ContractViolation("unexpected symbol " + symbol.getIdentifier());
			}
		}
		return Optional.empty();
	}

	/**
	 * Resolve an access path (e.g. <code>s.f[i]</code>) onto the variables of
	 * this state.
	 *
	 * @param expr
	 * @param propagate
	 * @return The resolved expression, or nothing if the given expression is not
	 *         an access path which can be resolved.
	 */
	public Optional<Expr> readSymbolMemberIndex(Expr expr, boolean propagate) {
		Namespace ns = config.getNamespace();
		VarMap varMap = config.getVarMap();
		// don't touch function symbols
		if (isFunction(ns.follow(expr.getType()))) {
			return Optional.empty();
		}
		// unbounded arrays are left for the solver's array theory
		if (expr instanceof Expr.Index && varMap.isUnboundedArray(((Expr.Index) expr).getArray().getType())) {
			Expr.Index index = (Expr.Index) expr;
			Optional<Expr> array = readSymbolMemberIndex(index.getArray(), propagate);
			if (!array.isPresent()) {
				return Optional.empty();
			}
			return Optional.of(index.rebuild(array.get(), instantiate(index.getIndex(), propagate)));
		}
		Expr flattened = flattener.expand(expr);
		if (flattened != expr && flattened instanceof Expr.Aggregate) {
			for (int i = 0; i != flattened.size(); ++i) {
				Expr operand = flattened.getOperand(i);
				Optional<Expr> resolved = readSymbolMemberIndex(operand, propagate);
				flattened.setOperand(i, resolved.isPresent() ? resolved.get() : instantiate(operand, propagate));
			}
			return Optional.of(flattened);
		}
		Optional<Expr.Cond> split = arrayTheory.split(flattened, propagate);
		if (split.isPresent()) {
			// the branches still contain unresolved accesses
			return Optional.of(instantiate(split.get(), propagate));
		}
		String suffix = "";
		Expr current = expr;
		while (!(current instanceof Expr.Symbol)) {
			if (current instanceof Expr.Member) {
				Expr.Member member = (Expr.Member) current;
				if (!(ns.follow(member.getCompound().getType()) instanceof Type.Struct)) {
					// includes unions, deliberately
					return Optional.empty();
				}
				suffix = "." + member.getComponentName() + suffix;
				current = member.getCompound();
			} else if (current instanceof Expr.Index) {
				Expr.Index index = (Expr.Index) current;
				suffix = arrayIndexAsString(read(index.getIndex(), propagate)) + suffix;
				current = index.getArray();
			} else {
				return Optional.empty();
			}
		}
		Expr.Symbol symbol = (Expr.Symbol) current;
		if (symbol.isSSA()) {
			return Optional.empty();
		}
		VarMap.VarInfo info = varMap.get(symbol.getIdentifier(), suffix, expr);
		VarState state = getVarState(info);
		if (propagate && state.hasValue()) {
			return Optional.of(state.getValue().copy());
		} else if (state.hasSSASymbol()) {
			return Optional.of(state.getSSASymbol().copy());
		}
		// never read before, no value
		Expr.Symbol ssa = info.ssaSymbol();
		state.setSSASymbol(ssa);
		if (propagate) {
			Optional<Expr> zero = config.getInitializer().zeroValue(ssa.getType(), ns);
			if (zero.isPresent()) {
				state.setValue(zero.get());
				return Optional.of(zero.get().copy());
			}
		}
		return Optional.of(ssa.copy());
	}

	/**
	 * Check whether a given expression is a chain of struct member and index
	 * accesses onto a program variable, such as <code>s.f[i].g</code>.
	 *
	 * @param expr
	 * @return
	 */
	public boolean isSymbolMemberIndex(Expr expr) {
		Namespace ns = config.getNamespace();
		if (isFunction(ns.follow(expr.getType()))) {
			return false;
		}
		Expr current = expr;
		while (true) {
			if (current instanceof Expr.Symbol) {
				return !((Expr.Symbol) current).isSSA();
			} else if (current instanceof Expr.Member) {
				Expr.Member member = (Expr.Member) current;
				if (!(ns.follow(member.getCompound().getType()) instanceof Type.Struct)) {
					return false;
				}
				current = member.getCompound();
			} else if (current instanceof Expr.Index) {
				current = ((Expr.Index) current).getArray();
			} else {
				return false;
			}
		}
	}

	/**
	 * Get the state of a given location on this path, creating it if it has not
	 * been touched before.
	 *
	 * @param info
	 * @return
	 */
	public VarState getVarState(VarMap.VarInfo info) {
		return varStates.computeIfAbsent(info.getFullIdentifier(), id -> new VarState());
	}

	/**
	 * Get the state of a given location on this path.
	 *
	 * @param fullIdentifier
	 * @return The state, or <code>null</code> if the location has not been
	 *         touched on this path.
	 */
	public VarState lookupVarState(String fullIdentifier) {
		return varStates.get(fullIdentifier);
	}

	/**
	 * Record an assignment to a given location. This starts a new generation of
	 * the location, whose SSA symbol is returned.
	 *
	 * @param info
	 * @param value The value assigned, or <code>null</code> if it is not known.
	 * @return
	 */
	public Expr.Symbol recordAssignment(VarMap.VarInfo info, Expr value) {
		if (info == null) {
			throw new IllegalArgumentException("invalid variable");
		}
		info.incrementSSACounter();
		Expr.Symbol ssa = info.ssaSymbol();
		VarState state = getVarState(info);
		state.setSSASymbol(ssa);
		state.setValue(value == null ? null : value.copy());
		return (Expr.Symbol) ssa.copy();
	}

	protected String arrayIndexAsString(Expr index) {
		Expr value = config.getSimplifier().simplify(index, config.getNamespace());
		if (value instanceof Expr.Integer) {
			return "[" + ((Expr.Integer) value).getValue() + "]";
		} else {
			return "[*]";
		}
	}

	private Expr.Symbol freshSymbol(String category, Type type) {
		Decl.Symbol symbol = config.getNewSymbols().fresh(category, type);
		if (config.isVerbose()) {
			config.getLogger().logTimedMessage("new symbol " + symbol.getName(), 0, 0);
		}
		return symbol.toExpr();
	}

	private static boolean isFunction(Type type) {
		return type instanceof Type.Code || type instanceof Type.MathematicalFunction;
	}

	/**
	 * Identifies a position in the tree being instantiated: either the root, or
	 * some operand of a node.
	 */
	private static final class Slot {
		private final Expr[] root;
		private final Expr parent;
		private final int operand;

		private Slot(Expr[] root, Expr parent, int operand) {
			this.root = root;
			this.parent = parent;
			this.operand = operand;
		}

		public Expr get() {
			return parent == null ? root[0] : parent.getOperand(operand);
		}

		public void set(Expr expr) {
			if (parent == null) {
				root[0] = expr;
			} else {
				parent.setOperand(operand, expr);
			}
		}
	}
}
