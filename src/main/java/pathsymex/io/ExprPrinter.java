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
package pathsymex.io;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import pathsymex.core.Program.Expr;
import pathsymex.core.Program.Type;

/**
 * Renders expressions and types in a C-like concrete syntax, primarily for
 * debugging output.
 */
public class ExprPrinter {
	private final PrintWriter out;

	public ExprPrinter(OutputStream output) {
		this(new PrintWriter(output));
	}

	public ExprPrinter(PrintWriter writer) {
		this.out = writer;
	}

	public void flush() {
		out.flush();
	}

	public static String toString(Expr e) {
		StringWriter sw = new StringWriter();
		ExprPrinter printer = new ExprPrinter(new PrintWriter(sw));
		printer.write(e);
		printer.flush();
		return sw.toString();
	}

	public static String toString(Type t) {
		StringWriter sw = new StringWriter();
		ExprPrinter printer = new ExprPrinter(new PrintWriter(sw));
		printer.write(t);
		printer.flush();
		return sw.toString();
	}

	public void write(Expr e) {
		writeExpression(e);
	}

	public void write(Type t) {
		writeType(t);
	}

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.BinaryOperator || e instanceof Expr.If || e instanceof Expr.Cond
				|| e instanceof Expr.Dereference || e instanceof Expr.AddressOf) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.Symbol) {
			out.print(((Expr.Symbol) e).getIdentifier());
		} else if (e instanceof Expr.Member) {
			writeMember((Expr.Member) e);
		} else if (e instanceof Expr.Index) {
			writeIndex((Expr.Index) e);
		} else if (e instanceof Expr.Dereference) {
			out.print("*");
			writeExpressionWithBraces(((Expr.Dereference) e).getPointer());
		} else if (e instanceof Expr.IntegerDereference) {
			out.print("*(");
			writeType(e.getType());
			out.print("*) ");
			writeExpressionWithBraces(((Expr.IntegerDereference) e).getAddress());
		} else if (e instanceof Expr.AddressOf) {
			out.print("&");
			writeExpressionWithBraces(((Expr.AddressOf) e).getObject());
		} else if (e instanceof Expr.SideEffect) {
			out.print(((Expr.SideEffect) e).getStatement());
			out.print("()");
		} else if (e instanceof Expr.ByteExtract) {
			writeByteExtract((Expr.ByteExtract) e);
		} else if (e instanceof Expr.Equals) {
			writeBinary((Expr.Equals) e, " == ");
		} else if (e instanceof Expr.Addition) {
			writeBinary((Expr.Addition) e, " + ");
		} else if (e instanceof Expr.If) {
			writeIf((Expr.If) e);
		} else if (e instanceof Expr.Cond) {
			writeCond((Expr.Cond) e);
		} else if (e instanceof Expr.StructConstructor) {
			writeOperands("{ ", e.getOperands(), " }");
		} else if (e instanceof Expr.ArrayConstructor) {
			writeOperands("[ ", e.getOperands(), " ]");
		} else if (e instanceof Expr.VectorConstructor) {
			writeOperands("<< ", e.getOperands(), " >>");
		} else if (e instanceof Expr.Integer) {
			out.print(((Expr.Integer) e).getValue());
		} else if (e instanceof Expr.Boolean) {
			out.print(((Expr.Boolean) e).getValue() ? "true" : "false");
		} else if (e instanceof Expr.DereferenceFailure) {
			out.print("deref_failure");
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeMember(Expr.Member e) {
		writeExpressionWithBraces(e.getCompound());
		out.print(".");
		out.print(e.getComponentName());
	}

	private void writeIndex(Expr.Index e) {
		writeExpressionWithBraces(e.getArray());
		out.print("[");
		writeExpression(e.getIndex());
		out.print("]");
	}

	private void writeByteExtract(Expr.ByteExtract e) {
		out.print(e.isBigEndian() ? "byte_extract_big_endian(" : "byte_extract_little_endian(");
		writeExpression(e.getSource());
		out.print(", ");
		writeExpression(e.getOffset());
		out.print(")");
	}

	private void writeBinary(Expr.BinaryOperator e, String operator) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(operator);
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeIf(Expr.If e) {
		writeExpressionWithBraces(e.getCondition());
		out.print(" ? ");
		writeExpressionWithBraces(e.getTrueBranch());
		out.print(" : ");
		writeExpressionWithBraces(e.getFalseBranch());
	}

	private void writeCond(Expr.Cond e) {
		out.print("cond { ");
		for (int i = 0; i != e.numberOfCases(); ++i) {
			if (i != 0) {
				out.print("; ");
			}
			writeExpression(e.getGuard(i));
			out.print(" -> ");
			writeExpression(e.getValue(i));
		}
		out.print(" }");
	}

	private void writeOperands(String open, List<Expr> operands, String close) {
		out.print(open);
		for (int i = 0; i != operands.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(operands.get(i));
		}
		out.print(close);
	}

	private void writeType(Type t) {
		if (t instanceof Type.Bool) {
			out.print("bool");
		} else if (t instanceof Type.Int) {
			Type.Int i = (Type.Int) t;
			out.print(i.isSigned() ? "int" : "uint");
			out.print(i.getWidth());
		} else if (t instanceof Type.Pointer) {
			writeType(((Type.Pointer) t).getTarget());
			out.print("*");
		} else if (t instanceof Type.Compound) {
			writeCompound((Type.Compound) t);
		} else if (t instanceof Type.Array) {
			Type.Array a = (Type.Array) t;
			writeType(a.getElement());
			out.print("[");
			if (a.getSize() != null) {
				writeExpression(a.getSize());
			}
			out.print("]");
		} else if (t instanceof Type.Vector) {
			Type.Vector v = (Type.Vector) t;
			out.print("vector ");
			writeType(v.getElement());
			out.print("[");
			writeExpression(v.getSize());
			out.print("]");
		} else if (t instanceof Type.Code) {
			Type.Code c = (Type.Code) t;
			writeTypes(c.getParameters());
			out.print(" -> ");
			writeType(c.getReturns());
		} else if (t instanceof Type.MathematicalFunction) {
			Type.MathematicalFunction f = (Type.MathematicalFunction) t;
			out.print("function ");
			writeTypes(f.getDomain());
			out.print(" -> ");
			writeType(f.getCodomain());
		} else if (t instanceof Type.Synonym) {
			out.print(((Type.Synonym) t).getName());
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	private void writeCompound(Type.Compound t) {
		out.print(t instanceof Type.Union ? "union { " : "struct { ");
		for (Type.Component c : t.getComponents()) {
			writeType(c.getType());
			out.print(" ");
			out.print(c.getName());
			out.print("; ");
		}
		out.print("}");
	}

	private void writeTypes(List<Type> types) {
		out.print("(");
		for (int i = 0; i != types.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeType(types.get(i));
		}
		out.print(")");
	}
}
