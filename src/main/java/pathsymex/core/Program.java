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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import pathsymex.io.ExprPrinter;

/**
 * A program under analysis, consisting of its symbol and type declarations.
 * This class also hosts the expression and type language understood by the
 * symbolic state, along with a constructor API for building them.
 *
 * @author The PathSymex Project Developers
 *
 */
public class Program implements Namespace {
	/**
	 * The list of top-level declarations within this program.
	 */
	private final List<Decl> declarations = new ArrayList<>();
	private final Map<String, Decl.Symbol> symbols = new HashMap<>();
	private final Map<String, Decl.TypeSynonym> synonyms = new HashMap<>();

	public Program() {
	}

	public Program(Decl... declarations) {
		for (Decl d : declarations) {
			add(d);
		}
	}

	public Program add(Decl d) {
		if (d instanceof Decl.Symbol) {
			if (symbols.putIfAbsent(d.getName(), (Decl.Symbol) d) != null) {
				throw new IllegalArgumentException("duplicate symbol \"" + d.getName() + "\"");
			}
		} else if (synonyms.putIfAbsent(d.getName(), (Decl.TypeSynonym) d) != null) {
			throw new IllegalArgumentException("duplicate type \"" + d.getName() + "\"");
		}
		declarations.add(d);
		return this;
	}

	public List<Decl> getDeclarations() {
		return Collections.unmodifiableList(declarations);
	}

	@Override
	public Decl.Symbol lookup(String identifier) {
		return symbols.get(identifier);
	}

	@Override
	public Type follow(Type type) {
		int steps = 0;
		while (type instanceof Type.Synonym) {
			String name = ((Type.Synonym) type).getName();
			Decl.TypeSynonym d = synonyms.get(name);
			if (d == null) {
				throw new IllegalArgumentException("unknown type \"" + name + "\"");
			} else if (++steps > synonyms.size()) {
				throw new IllegalArgumentException("cyclic type \"" + name + "\"");
			}
			type = d.getType();
		}
		return type;
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl {

		public String getName();

		/**
		 * A program variable (or function) along with the storage properties needed
		 * to classify accesses to it as shared, thread-local or procedure-local.
		 */
		public static class Symbol implements Decl {
			private final String name;
			private final Type type;
			private final boolean staticLifetime;
			private final boolean threadLocal;
			private final boolean auxiliary;

			public Symbol(String name, Type type, boolean staticLifetime, boolean threadLocal, boolean auxiliary) {
				if (name == null || name.isEmpty()) {
					throw new IllegalArgumentException("invalid symbol name");
				} else if (type == null) {
					throw new IllegalArgumentException("invalid symbol type");
				}
				this.name = name;
				this.type = type;
				this.staticLifetime = staticLifetime;
				this.threadLocal = threadLocal;
				this.auxiliary = auxiliary;
			}

			@Override
			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			public boolean isStaticLifetime() {
				return staticLifetime;
			}

			public boolean isThreadLocal() {
				return threadLocal;
			}

			public boolean isAuxiliary() {
				return auxiliary;
			}

			/**
			 * Construct a (non-SSA) reference to this symbol.
			 *
			 * @return
			 */
			public Expr.Symbol toExpr() {
				return SYMBOL(name, type);
			}

			@Override
			public String toString() {
				return name + " : " + type;
			}
		}

		public static class TypeSynonym implements Decl {
			private final String name;
			private final Type type;

			public TypeSynonym(String name, Type type) {
				this.name = name;
				this.type = type;
			}

			@Override
			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	/**
	 * An expression node. Every node has a type and a fixed number of operands,
	 * each of which it owns exclusively. Operands may be replaced in place, but the
	 * kind and arity of a node never change.
	 */
	public interface Expr {

		public Type getType();

		public int size();

		public Expr getOperand(int i);

		public void setOperand(int i, Expr operand);

		public List<Expr> getOperands();

		/**
		 * Construct a node of the same kind (and attributes) as this, but with the
		 * given operands.
		 *
		 * @param operands
		 * @return
		 */
		public Expr rebuild(Expr... operands);

		/**
		 * Create a deep copy of this expression, sharing no nodes with it.
		 *
		 * @return
		 */
		public Expr copy();

		public boolean isConstant();

		public interface BinaryOperator {
			Expr getLeftHandSide();

			Expr getRightHandSide();
		}

		public static class Symbol extends AbstractExpr {
			private final String identifier;
			private final boolean ssa;
			private final String fullIdentifier;

			private Symbol(String identifier, Type type, boolean ssa, String fullIdentifier) {
				super(type);
				if (identifier == null) {
					throw new IllegalArgumentException("invalid identifier");
				}
				this.identifier = identifier;
				this.ssa = ssa;
				this.fullIdentifier = fullIdentifier;
			}

			public String getIdentifier() {
				return identifier;
			}

			/**
			 * Check whether this symbol is an SSA incarnation, rather than a program
			 * variable.
			 *
			 * @return
			 */
			public boolean isSSA() {
				return ssa;
			}

			/**
			 * For SSA symbols, the full identifier of the location this is an incarnation
			 * of. Otherwise <code>null</code>.
			 *
			 * @return
			 */
			public String getFullIdentifier() {
				return fullIdentifier;
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new Symbol(identifier, getType(), ssa, fullIdentifier);
			}

			@Override
			protected boolean equalData(AbstractExpr other) {
				Symbol s = (Symbol) other;
				return identifier.equals(s.identifier) && ssa == s.ssa
						&& Objects.equals(fullIdentifier, s.fullIdentifier);
			}

			@Override
			public int hashCode() {
				return super.hashCode() ^ identifier.hashCode();
			}
		}

		public static class Member extends AbstractExpr {
			private final String component;

			private Member(Expr compound, String component, Type type) {
				super(type, compound);
				this.component = component;
			}

			public Expr getCompound() {
				return getOperand(0);
			}

			public String getComponentName() {
				return component;
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new Member(operands[0], component, getType());
			}

			@Override
			protected boolean equalData(AbstractExpr other) {
				return component.equals(((Member) other).component);
			}
		}

		public static class Index extends AbstractExpr {
			private Index(Expr array, Expr index, Type type) {
				super(type, array, index);
			}

			public Expr getArray() {
				return getOperand(0);
			}

			public Expr getIndex() {
				return getOperand(1);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new Index(operands[0], operands[1], getType());
			}
		}

		public static class Dereference extends AbstractExpr {
			private Dereference(Expr pointer, Type type) {
				super(type, pointer);
			}

			public Expr getPointer() {
				return getOperand(0);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new Dereference(operands[0], getType());
			}
		}

		/**
		 * A dereference of an integer address, such as <code>*(T*) 123</code>, which
		 * no object is known to live at.
		 */
		public static class IntegerDereference extends AbstractExpr {
			private IntegerDereference(Expr address, Type type) {
				super(type, address);
			}

			public Expr getAddress() {
				return getOperand(0);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new IntegerDereference(operands[0], getType());
			}
		}

		public static class AddressOf extends AbstractExpr {
			private AddressOf(Expr object) {
				super(new Type.Pointer(object.getType()), object);
			}

			public Expr getObject() {
				return getOperand(0);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new AddressOf(operands[0]);
			}
		}

		public static class SideEffect extends AbstractExpr {
			public static final String NONDET = "nondet";

			private final String statement;

			private SideEffect(String statement, Type type) {
				super(type);
				this.statement = statement;
			}

			public String getStatement() {
				return statement;
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new SideEffect(statement, getType());
			}

			@Override
			protected boolean equalData(AbstractExpr other) {
				return statement.equals(((SideEffect) other).statement);
			}
		}

		public static class ByteExtract extends AbstractExpr {
			private final boolean bigEndian;

			private ByteExtract(Expr operand, Expr offset, Type type, boolean bigEndian) {
				super(type, operand, offset);
				this.bigEndian = bigEndian;
			}

			public Expr getSource() {
				return getOperand(0);
			}

			public Expr getOffset() {
				return getOperand(1);
			}

			public boolean isBigEndian() {
				return bigEndian;
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new ByteExtract(operands[0], operands[1], getType(), bigEndian);
			}

			@Override
			protected boolean equalData(AbstractExpr other) {
				return bigEndian == ((ByteExtract) other).bigEndian;
			}
		}

		public static class Equals extends AbstractExpr implements BinaryOperator {
			private Equals(Expr lhs, Expr rhs) {
				super(Type.Bool, lhs, rhs);
			}

			@Override
			public Expr getLeftHandSide() {
				return getOperand(0);
			}

			@Override
			public Expr getRightHandSide() {
				return getOperand(1);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new Equals(operands[0], operands[1]);
			}
		}

		public static class Addition extends AbstractExpr implements BinaryOperator {
			private Addition(Expr lhs, Expr rhs) {
				super(lhs.getType(), lhs, rhs);
			}

			@Override
			public Expr getLeftHandSide() {
				return getOperand(0);
			}

			@Override
			public Expr getRightHandSide() {
				return getOperand(1);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new Addition(operands[0], operands[1]);
			}
		}

		public static class If extends AbstractExpr {
			private If(Expr condition, Expr trueBranch, Expr falseBranch) {
				super(trueBranch.getType(), condition, trueBranch, falseBranch);
			}

			public Expr getCondition() {
				return getOperand(0);
			}

			public Expr getTrueBranch() {
				return getOperand(1);
			}

			public Expr getFalseBranch() {
				return getOperand(2);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new If(operands[0], operands[1], operands[2]);
			}
		}

		/**
		 * An n-way conditional whose operands alternate between guards and values.
		 * The value of the first case whose guard holds is the value of the whole.
		 */
		public static class Cond extends AbstractExpr {
			private Cond(Type type, Expr[] operands) {
				super(type, operands);
				if ((operands.length % 2) != 0) {
					throw new IllegalArgumentException("unbalanced cond");
				}
			}

			public int numberOfCases() {
				return size() / 2;
			}

			public Expr getGuard(int i) {
				return getOperand(2 * i);
			}

			public Expr getValue(int i) {
				return getOperand((2 * i) + 1);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new Cond(getType(), operands);
			}
		}

		/**
		 * A struct, array or vector constructor.
		 */
		public static abstract class Aggregate extends AbstractExpr {
			private Aggregate(Type type, Expr[] operands) {
				super(type, operands);
			}
		}

		public static class StructConstructor extends Aggregate {
			private StructConstructor(Type type, Expr[] operands) {
				super(type, operands);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new StructConstructor(getType(), operands);
			}
		}

		public static class ArrayConstructor extends Aggregate {
			private ArrayConstructor(Type type, Expr[] operands) {
				super(type, operands);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new ArrayConstructor(getType(), operands);
			}
		}

		public static class VectorConstructor extends Aggregate {
			private VectorConstructor(Type type, Expr[] operands) {
				super(type, operands);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new VectorConstructor(getType(), operands);
			}
		}

		public static class Integer extends AbstractExpr {
			private final BigInteger value;

			private Integer(BigInteger value, Type type) {
				super(type);
				this.value = value;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public boolean isConstant() {
				return true;
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new Integer(value, getType());
			}

			@Override
			protected boolean equalData(AbstractExpr other) {
				return value.equals(((Integer) other).value);
			}

			@Override
			public int hashCode() {
				return super.hashCode() ^ value.hashCode();
			}
		}

		public static class Boolean extends AbstractExpr {
			private final boolean value;

			private Boolean(boolean value) {
				super(Type.Bool);
				this.value = value;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public boolean isConstant() {
				return true;
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new Boolean(value);
			}

			@Override
			protected boolean equalData(AbstractExpr other) {
				return value == ((Boolean) other).value;
			}
		}

		/**
		 * Produced by a dereference which could not be resolved to any object.
		 */
		public static class DereferenceFailure extends AbstractExpr {
			private DereferenceFailure(Type type) {
				super(type);
			}

			@Override
			protected Expr construct(Expr[] operands) {
				return new DereferenceFailure(getType());
			}
		}
	}

	public static abstract class AbstractExpr implements Expr {
		private final Type type;
		private final Expr[] operands;

		protected AbstractExpr(Type type, Expr... operands) {
			if (type == null) {
				throw new IllegalArgumentException("missing type");
			}
			for (int i = 0; i != operands.length; ++i) {
				if (operands[i] == null) {
					throw new IllegalArgumentException("missing operand");
				}
			}
			this.type = type;
			this.operands = Arrays.copyOf(operands, operands.length);
		}

		@Override
		public Type getType() {
			return type;
		}

		@Override
		public int size() {
			return operands.length;
		}

		@Override
		public Expr getOperand(int i) {
			return operands[i];
		}

		@Override
		public void setOperand(int i, Expr operand) {
			if (operand == null) {
				throw new IllegalArgumentException("missing operand");
			}
			operands[i] = operand;
		}

		@Override
		public List<Expr> getOperands() {
			return Collections.unmodifiableList(Arrays.asList(operands));
		}

		@Override
		public Expr rebuild(Expr... operands) {
			if (operands.length != this.operands.length) {
				throw new IllegalArgumentException("invalid number of operands");
			}
			return construct(Arrays.copyOf(operands, operands.length));
		}

		@Override
		public Expr copy() {
			Expr[] nOperands = new Expr[operands.length];
			for (int i = 0; i != operands.length; ++i) {
				nOperands[i] = operands[i].copy();
			}
			return construct(nOperands);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		protected abstract Expr construct(Expr[] operands);

		/**
		 * Compare any node-specific data (e.g. identifiers or values) held by this and
		 * a node of the same class.
		 *
		 * @param other
		 * @return
		 */
		protected boolean equalData(AbstractExpr other) {
			return true;
		}

		@Override
		public boolean equals(Object o) {
			if (o == this) {
				return true;
			} else if (o == null || o.getClass() != getClass()) {
				return false;
			}
			AbstractExpr e = (AbstractExpr) o;
			return type.equals(e.type) && equalData(e) && Arrays.equals(operands, e.operands);
		}

		@Override
		public int hashCode() {
			return getClass().getName().hashCode() ^ Arrays.hashCode(operands);
		}

		@Override
		public String toString() {
			return ExprPrinter.toString(this);
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type {
		public static final Type Bool = new Bool();
		public static final Type Int32 = new Int(32, true);
		public static final Type UInt64 = new Int(64, false);

		public static class Bool implements Type {
			@Override
			public boolean equals(Object o) {
				return o instanceof Bool;
			}

			@Override
			public int hashCode() {
				return 1;
			}

			@Override
			public String toString() {
				return ExprPrinter.toString(this);
			}
		}

		public static class Int implements Type {
			private final int width;
			private final boolean signed;

			public Int(int width, boolean signed) {
				if (width <= 0) {
					throw new IllegalArgumentException("invalid width");
				}
				this.width = width;
				this.signed = signed;
			}

			public int getWidth() {
				return width;
			}

			public boolean isSigned() {
				return signed;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int && ((Int) o).width == width && ((Int) o).signed == signed;
			}

			@Override
			public int hashCode() {
				return signed ? width : -width;
			}

			@Override
			public String toString() {
				return ExprPrinter.toString(this);
			}
		}

		public static class Pointer implements Type {
			private final Type target;

			public Pointer(Type target) {
				this.target = target;
			}

			public Type getTarget() {
				return target;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Pointer && ((Pointer) o).target.equals(target);
			}

			@Override
			public int hashCode() {
				return 7 * target.hashCode();
			}

			@Override
			public String toString() {
				return ExprPrinter.toString(this);
			}
		}

		public static class Component {
			private final String name;
			private final Type type;

			public Component(String name, Type type) {
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Component && ((Component) o).name.equals(name)
						&& ((Component) o).type.equals(type);
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ type.hashCode();
			}
		}

		/**
		 * A struct or union type, made up from an ordered list of named components.
		 */
		public static abstract class Compound implements Type {
			private final List<Component> components;

			private Compound(List<Component> components) {
				this.components = Collections.unmodifiableList(new ArrayList<>(components));
			}

			public List<Component> getComponents() {
				return components;
			}

			public Component getComponent(String name) {
				for (Component c : components) {
					if (c.getName().equals(name)) {
						return c;
					}
				}
				return null;
			}

			public int getComponentIndex(String name) {
				for (int i = 0; i != components.size(); ++i) {
					if (components.get(i).getName().equals(name)) {
						return i;
					}
				}
				return -1;
			}

			@Override
			public boolean equals(Object o) {
				return o != null && o.getClass() == getClass() && ((Compound) o).components.equals(components);
			}

			@Override
			public int hashCode() {
				return getClass().getName().hashCode() ^ components.hashCode();
			}

			@Override
			public String toString() {
				return ExprPrinter.toString(this);
			}
		}

		public static class Struct extends Compound {
			public Struct(List<Component> components) {
				super(components);
			}
		}

		public static class Union extends Compound {
			public Union(List<Component> components) {
				super(components);
			}
		}

		/**
		 * An array type. The size is either a constant, some other (symbolic)
		 * expression, or <code>null</code> for an array of unknown size.
		 */
		public static class Array implements Type {
			private final Type element;
			private final Expr size;

			public Array(Type element, Expr size) {
				this.element = element;
				this.size = size;
			}

			public Type getElement() {
				return element;
			}

			public Expr getSize() {
				return size;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Array && ((Array) o).element.equals(element)
						&& Objects.equals(((Array) o).size, size);
			}

			@Override
			public int hashCode() {
				return element.hashCode() ^ Objects.hashCode(size);
			}

			@Override
			public String toString() {
				return ExprPrinter.toString(this);
			}
		}

		public static class Vector implements Type {
			private final Type element;
			private final Expr size;

			public Vector(Type element, Expr size) {
				if (size == null) {
					throw new IllegalArgumentException("vector requires a size");
				}
				this.element = element;
				this.size = size;
			}

			public Type getElement() {
				return element;
			}

			public Expr getSize() {
				return size;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Vector && ((Vector) o).element.equals(element) && ((Vector) o).size.equals(size);
			}

			@Override
			public int hashCode() {
				return 31 * element.hashCode() ^ size.hashCode();
			}

			@Override
			public String toString() {
				return ExprPrinter.toString(this);
			}
		}

		public static class Code implements Type {
			private final List<Type> parameters;
			private final Type returns;

			public Code(List<Type> parameters, Type returns) {
				this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
				this.returns = returns;
			}

			public List<Type> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Code && ((Code) o).parameters.equals(parameters) && ((Code) o).returns.equals(returns);
			}

			@Override
			public int hashCode() {
				return parameters.hashCode() ^ returns.hashCode();
			}

			@Override
			public String toString() {
				return ExprPrinter.toString(this);
			}
		}

		public static class MathematicalFunction implements Type {
			private final List<Type> domain;
			private final Type codomain;

			public MathematicalFunction(List<Type> domain, Type codomain) {
				this.domain = Collections.unmodifiableList(new ArrayList<>(domain));
				this.codomain = codomain;
			}

			public List<Type> getDomain() {
				return domain;
			}

			public Type getCodomain() {
				return codomain;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof MathematicalFunction && ((MathematicalFunction) o).domain.equals(domain)
						&& ((MathematicalFunction) o).codomain.equals(codomain);
			}

			@Override
			public int hashCode() {
				return 3 * domain.hashCode() ^ codomain.hashCode();
			}

			@Override
			public String toString() {
				return ExprPrinter.toString(this);
			}
		}

		/**
		 * A reference to a named type (e.g. a struct tag), resolved through a
		 * {@link Namespace}.
		 */
		public static class Synonym implements Type {
			private final String name;

			public Synonym(String name) {
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Synonym && ((Synonym) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return ExprPrinter.toString(this);
			}
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	// Declarations

	public static Decl.Symbol LOCAL(String name, Type type) {
		return new Decl.Symbol(name, type, false, false, false);
	}

	public static Decl.Symbol GLOBAL(String name, Type type) {
		return new Decl.Symbol(name, type, true, false, false);
	}

	public static Decl.Symbol THREAD_LOCAL(String name, Type type) {
		return new Decl.Symbol(name, type, true, true, false);
	}

	public static Decl.TypeSynonym TYPEDEF(String name, Type type) {
		return new Decl.TypeSynonym(name, type);
	}

	// Types

	public static Type.Component COMPONENT(String name, Type type) {
		return new Type.Component(name, type);
	}

	public static Type.Struct STRUCT_TYPE(Type.Component... components) {
		return new Type.Struct(Arrays.asList(components));
	}

	public static Type.Union UNION_TYPE(Type.Component... components) {
		return new Type.Union(Arrays.asList(components));
	}

	public static Type.Array ARRAY_TYPE(Type element, int size) {
		return new Type.Array(element, CONST(size, Type.UInt64));
	}

	public static Type.Array ARRAY_TYPE(Type element, Expr size) {
		return new Type.Array(element, size);
	}

	public static Type.Array UNBOUNDED_ARRAY_TYPE(Type element) {
		return new Type.Array(element, null);
	}

	public static Type.Vector VECTOR_TYPE(Type element, int size) {
		return new Type.Vector(element, CONST(size, Type.UInt64));
	}

	public static Type.Pointer POINTER_TYPE(Type target) {
		return new Type.Pointer(target);
	}

	public static Type.Code CODE_TYPE(Type returns, Type... parameters) {
		return new Type.Code(Arrays.asList(parameters), returns);
	}

	public static Type.Synonym SYNONYM(String name) {
		return new Type.Synonym(name);
	}

	// Accesses

	public static Expr.Symbol SYMBOL(String identifier, Type type) {
		return new Expr.Symbol(identifier, type, false, null);
	}

	public static Expr.Symbol SSA_SYMBOL(String identifier, Type type, String fullIdentifier) {
		return new Expr.Symbol(identifier, type, true, fullIdentifier);
	}

	public static Expr.Member MEMBER(Expr compound, String component, Type type) {
		return new Expr.Member(compound, component, type);
	}

	/**
	 * Construct a member access, determining its type from the (unnamed) compound
	 * type of the given operand.
	 *
	 * @param compound
	 * @param component
	 * @return
	 */
	public static Expr.Member MEMBER(Expr compound, String component) {
		if (!(compound.getType() instanceof Type.Compound)) {
			throw new IllegalArgumentException("member requires struct or union operand");
		}
		Type.Component c = ((Type.Compound) compound.getType()).getComponent(component);
		if (c == null) {
			throw new IllegalArgumentException("unknown component \"" + component + "\"");
		}
		return new Expr.Member(compound, component, c.getType());
	}

	public static Expr.Index INDEX(Expr array, Expr index, Type type) {
		return new Expr.Index(array, index, type);
	}

	/**
	 * Construct an index expression, determining its type from the array (or
	 * vector) type of the given operand.
	 *
	 * @param array
	 * @param index
	 * @return
	 */
	public static Expr.Index INDEX(Expr array, Expr index) {
		Type type = array.getType();
		if (type instanceof Type.Array) {
			return new Expr.Index(array, index, ((Type.Array) type).getElement());
		} else if (type instanceof Type.Vector) {
			return new Expr.Index(array, index, ((Type.Vector) type).getElement());
		} else {
			throw new IllegalArgumentException("index requires array or vector operand");
		}
	}

	public static Expr.Dereference DEREF(Expr pointer, Type type) {
		return new Expr.Dereference(pointer, type);
	}

	public static Expr.Dereference DEREF(Expr pointer) {
		if (!(pointer.getType() instanceof Type.Pointer)) {
			throw new IllegalArgumentException("dereference requires pointer operand");
		}
		return new Expr.Dereference(pointer, ((Type.Pointer) pointer.getType()).getTarget());
	}

	public static Expr.IntegerDereference INTEGER_DEREF(Expr address, Type type) {
		return new Expr.IntegerDereference(address, type);
	}

	public static Expr.AddressOf ADDRESS_OF(Expr object) {
		return new Expr.AddressOf(object);
	}

	public static Expr.DereferenceFailure DEREF_FAILURE(Type type) {
		return new Expr.DereferenceFailure(type);
	}

	public static Expr.SideEffect NONDET(Type type) {
		return new Expr.SideEffect(Expr.SideEffect.NONDET, type);
	}

	public static Expr.SideEffect SIDE_EFFECT(String statement, Type type) {
		return new Expr.SideEffect(statement, type);
	}

	public static Expr.ByteExtract BYTE_EXTRACT(Expr operand, Expr offset, Type type, boolean bigEndian) {
		return new Expr.ByteExtract(operand, offset, type, bigEndian);
	}

	// Operators

	public static Expr.Equals EQ(Expr lhs, Expr rhs) {
		return new Expr.Equals(lhs, rhs);
	}

	public static Expr.Addition ADD(Expr lhs, Expr rhs) {
		return new Expr.Addition(lhs, rhs);
	}

	public static Expr.If IF(Expr condition, Expr trueBranch, Expr falseBranch) {
		return new Expr.If(condition, trueBranch, falseBranch);
	}

	public static Expr.Cond COND(Type type, List<Expr> guards, List<Expr> values) {
		if (guards.size() != values.size()) {
			throw new IllegalArgumentException("mismatched guards and values");
		}
		Expr[] operands = new Expr[guards.size() * 2];
		for (int i = 0; i != guards.size(); ++i) {
			operands[2 * i] = guards.get(i);
			operands[(2 * i) + 1] = values.get(i);
		}
		return new Expr.Cond(type, operands);
	}

	// Aggregates

	public static Expr.StructConstructor STRUCT(Type type, List<Expr> operands) {
		return new Expr.StructConstructor(type, operands.toArray(new Expr[operands.size()]));
	}

	public static Expr.ArrayConstructor ARRAY(Type type, List<Expr> operands) {
		return new Expr.ArrayConstructor(type, operands.toArray(new Expr[operands.size()]));
	}

	public static Expr.VectorConstructor VECTOR(Type type, List<Expr> operands) {
		return new Expr.VectorConstructor(type, operands.toArray(new Expr[operands.size()]));
	}

	// Constants

	public static Expr.Boolean CONST(boolean b) {
		return new Expr.Boolean(b);
	}

	public static Expr.Integer CONST(long i, Type type) {
		return new Expr.Integer(BigInteger.valueOf(i), type);
	}

	public static Expr.Integer CONST(BigInteger i, Type type) {
		return new Expr.Integer(i, type);
	}
}
