// Copyright 2020 The GCL Verifier Developers
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
package gclverify.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import gclverify.core.GclFile;
import gclverify.core.Kind;
import gclverify.core.Name;
import gclverify.core.Operator;
import gclverify.core.Type;
import gclverify.core.TypedFile;
import gclverify.core.TypedFile.Expr;
import gclverify.core.TypedFile.Stmt;

/**
 * Prints types, kinds, expressions and statements in the concrete syntax of
 * the Guarded Command Language. The printed form of predicates is what
 * identifies proof obligations, so it must be deterministic.
 */
public class GclFilePrinter {
	private final PrintWriter out;

	public GclFilePrinter(OutputStream output) {
		this.out = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
	}

	public void flush() {
		out.flush();
	}

	public void write(TypedFile.Program program) {
		for (TypedFile.Declaration d : program.getDeclarations()) {
			out.print(d.isConstant() ? "con " : "var ");
			writeNames(d.getNames());
			out.print(" : ");
			writeType(d.getType());
			if (d.getProperty() != null) {
				out.print(" { ");
				writeExpression(d.getProperty());
				out.print(" }");
			}
			out.println();
		}
		writeStatements(0, program.getStatements());
		out.flush();
	}

	// =========================================================================
	// Statements
	// =========================================================================

	private void writeStatements(int indent, List<Stmt> stmts) {
		for (Stmt s : stmts) {
			writeStatement(indent, s);
		}
	}

	private void writeStatement(int indent, Stmt s) {
		tab(indent);
		if (s instanceof Stmt.Skip) {
			out.println("skip");
		} else if (s instanceof Stmt.Abort) {
			out.println("abort");
		} else if (s instanceof Stmt.Assign) {
			Stmt.Assign a = (Stmt.Assign) s;
			writeNames(a.getNames());
			out.print(" := ");
			writeExpressions(a.getExprs());
			out.println();
		} else if (s instanceof Stmt.AAssign) {
			Stmt.AAssign a = (Stmt.AAssign) s;
			writeExpressionWithBraces(a.getArray());
			out.print("[");
			writeExpression(a.getIndex());
			out.print("] := ");
			writeExpression(a.getValue());
			out.println();
		} else if (s instanceof Stmt.Assert) {
			out.print("{ ");
			writeExpression(((Stmt.Assert) s).getCondition());
			out.println(" }");
		} else if (s instanceof Stmt.LoopInvariant) {
			Stmt.LoopInvariant l = (Stmt.LoopInvariant) s;
			out.print("{ ");
			writeExpression(l.getInvariant());
			if (l.getBound() != null) {
				out.print(", bnd: ");
				writeExpression(l.getBound());
			}
			out.println(" }");
		} else if (s instanceof Stmt.Do) {
			writeGuardedCommands(indent, "do", ((Stmt.Do) s).getCommands(), "od");
		} else if (s instanceof Stmt.If) {
			writeGuardedCommands(indent, "if", ((Stmt.If) s).getCommands(), "fi");
		} else if (s instanceof Stmt.Spec) {
			out.print("[!");
			out.print(((Stmt.Spec) s).getText());
			out.println("!]");
		} else if (s instanceof Stmt.Proof) {
			out.print("{- ");
			out.print(((Stmt.Proof) s).getContents());
			out.println(" -}");
		} else if (s instanceof Stmt.Alloc) {
			Stmt.Alloc a = (Stmt.Alloc) s;
			out.print(a.getVariable().getText());
			out.print(" := new (");
			writeExpressions(a.getExprs());
			out.println(")");
		} else if (s instanceof Stmt.HLookup) {
			Stmt.HLookup h = (Stmt.HLookup) s;
			out.print(h.getVariable().getText());
			out.print(" := *");
			writeExpressionWithBraces(h.getExpr());
			out.println();
		} else if (s instanceof Stmt.HMutate) {
			Stmt.HMutate h = (Stmt.HMutate) s;
			out.print("*");
			writeExpressionWithBraces(h.getLeft());
			out.print(" := ");
			writeExpression(h.getRight());
			out.println();
		} else if (s instanceof Stmt.Dispose) {
			out.print("dispose ");
			writeExpression(((Stmt.Dispose) s).getExpr());
			out.println();
		} else if (s instanceof Stmt.Block) {
			out.println("|[");
			writeStatements(indent + 1, ((Stmt.Block) s).getProgram().getStatements());
			tab(indent);
			out.println("]|");
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
		}
	}

	private void writeGuardedCommands(int indent, String open, List<TypedFile.GdCmd> cmds, String close) {
		out.print(open);
		String sep = " ";
		for (TypedFile.GdCmd c : cmds) {
			if (!sep.equals(" ")) {
				tab(indent);
			}
			out.print(sep);
			writeExpression(c.getGuard());
			out.println(" →");
			writeStatements(indent + 1, c.getBody());
			sep = " | ";
		}
		tab(indent);
		out.println(close);
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	private void writeExpressions(List<Expr> exprs) {
		for (int i = 0; i != exprs.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(exprs.get(i));
		}
	}

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.App || e instanceof Expr.Chain || e instanceof Expr.Lam) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	public void writeExpression(Expr e) {
		if (e instanceof Expr.Lit) {
			out.print(((Expr.Lit) e).getValue());
		} else if (e instanceof Expr.Var) {
			out.print(((Expr.Var) e).getName().getText());
		} else if (e instanceof Expr.Const) {
			out.print(((Expr.Const) e).getName().getText());
		} else if (e instanceof Expr.Op) {
			out.print(((Expr.Op) e).getOperator().getSymbol().getText());
		} else if (e instanceof Expr.Chain) {
			writeChain(((Expr.Chain) e).getChain());
		} else if (e instanceof Expr.App) {
			writeApp((Expr.App) e);
		} else if (e instanceof Expr.Lam) {
			Expr.Lam l = (Expr.Lam) e;
			out.print("λ ");
			out.print(l.getParameter().getText());
			out.print(" → ");
			writeExpression(l.getBody());
		} else if (e instanceof Expr.Quant) {
			Expr.Quant q = (Expr.Quant) e;
			out.print("⟨");
			writeQuantifier(q.getQuantifier());
			out.print(" ");
			writeNames(q.getBound());
			out.print(" : ");
			writeExpression(q.getRange());
			out.print(" : ");
			writeExpression(q.getBody());
			out.print("⟩");
		} else if (e instanceof Expr.ArrIdx) {
			Expr.ArrIdx a = (Expr.ArrIdx) e;
			writeExpressionWithBraces(a.getArray());
			out.print("[");
			writeExpression(a.getIndex());
			out.print("]");
		} else if (e instanceof Expr.ArrUpd) {
			Expr.ArrUpd a = (Expr.ArrUpd) e;
			out.print("(");
			writeExpression(a.getArray());
			out.print(" : ");
			writeExpression(a.getIndex());
			out.print(" ↦ ");
			writeExpression(a.getValue());
			out.print(")");
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeChain(TypedFile.Chain c) {
		if (c instanceof TypedFile.Chain.Pure) {
			writeExpressionWithBraces(((TypedFile.Chain.Pure) c).getExpr());
		} else {
			TypedFile.Chain.More m = (TypedFile.Chain.More) c;
			writeChain(m.getChain());
			out.print(" ");
			out.print(m.getOperator().getOperator().getSymbol().getText());
			out.print(" ");
			writeExpressionWithBraces(m.getExpr());
		}
	}

	private void writeApp(Expr.App e) {
		Expr fn = e.getFunction();
		if (fn instanceof Expr.App && ((Expr.App) fn).getFunction() instanceof Expr.Op) {
			Operator op = ((Expr.Op) ((Expr.App) fn).getFunction()).getOperator();
			if (!op.getSymbol().isUnary()) {
				// binary operator
				writeExpressionWithBraces(((Expr.App) fn).getArgument());
				out.print(" " + op.getSymbol().getText() + " ");
				writeExpressionWithBraces(e.getArgument());
				return;
			}
		}
		if (fn instanceof Expr.Op && ((Expr.Op) fn).getOperator().getSymbol().isUnary()) {
			out.print(((Expr.Op) fn).getOperator().getSymbol().getText());
			writeExpressionWithBraces(e.getArgument());
		} else {
			if (fn instanceof Expr.Lam) {
				writeExpressionWithBraces(fn);
			} else {
				writeExpression(fn);
			}
			out.print(" ");
			writeExpressionWithBraces(e.getArgument());
		}
	}

	private void writeQuantifier(Expr q) {
		if (q instanceof Expr.Op) {
			out.print(quantifier(((Expr.Op) q).getOperator()));
		} else {
			writeExpressionWithBraces(q);
		}
	}

	private void writeNames(List<Name> names) {
		for (int i = 0; i != names.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			out.print(names.get(i).getText());
		}
	}

	private void tab(int indent) {
		for (int i = 0; i != indent; ++i) {
			out.print("  ");
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public void writeType(Type t) {
		if (t instanceof Type.Base) {
			out.print(((Type.Base) t).getTag().getText());
		} else if (t instanceof Type.Array) {
			Type.Array a = (Type.Array) t;
			out.print("array ");
			writeInterval(a.getInterval());
			out.print(" of ");
			writeType(a.getElement());
		} else if (t instanceof Type.Tuple) {
			out.print("(");
			for (int i = 1; i < ((Type.Tuple) t).getArity(); ++i) {
				out.print(",");
			}
			out.print(")");
		} else if (t instanceof Type.Arrow) {
			out.print("(→)");
		} else if (t instanceof Type.Named) {
			out.print(((Type.Named) t).getName().getText());
		} else if (t instanceof Type.App) {
			if (Type.isFunction(t)) {
				writeTypeWithBraces(Type.domain(t), true);
				out.print(" → ");
				writeType(Type.codomain(t));
			} else {
				Type.App a = (Type.App) t;
				writeType(a.getLeft());
				out.print(" ");
				writeTypeWithBraces(a.getRight(), false);
			}
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	private void writeTypeWithBraces(Type t, boolean functionsOnly) {
		boolean braces = functionsOnly ? Type.isFunction(t) : (t instanceof Type.App || t instanceof Type.Array);
		if (braces) {
			out.print("(");
			writeType(t);
			out.print(")");
		} else {
			writeType(t);
		}
	}

	private void writeInterval(Type.Interval i) {
		if (i == null) {
			out.print("?");
			return;
		}
		out.print(i.getLower().isInclusive() ? "[" : "(");
		writeUntypedExpression(i.getLower().getBound());
		out.print(" .. ");
		writeUntypedExpression(i.getUpper().getBound());
		out.print(i.getUpper().isInclusive() ? "]" : ")");
	}

	public void writeKind(Kind k) {
		if (k instanceof Kind.Star) {
			out.print("*");
		} else if (k instanceof Kind.Func) {
			Kind.Func f = (Kind.Func) k;
			if (f.getFrom() instanceof Kind.Func) {
				out.print("(");
				writeKind(f.getFrom());
				out.print(")");
			} else {
				writeKind(f.getFrom());
			}
			out.print(" → ");
			writeKind(f.getTo());
		} else if (k instanceof Kind.MetaVar) {
			out.print(((Kind.MetaVar) k).getName().getText());
		} else {
			throw new IllegalArgumentException("unknown kind encountered (" + k.getClass().getName() + ")");
		}
	}

	// =========================================================================
	// Untyped expressions
	// =========================================================================

	public void writeUntypedExpression(GclFile.Expr e) {
		if (e instanceof GclFile.Expr.Lit) {
			out.print(((GclFile.Expr.Lit) e).getValue());
		} else if (e instanceof GclFile.Expr.Var) {
			out.print(((GclFile.Expr.Var) e).getName().getText());
		} else if (e instanceof GclFile.Expr.Const) {
			out.print(((GclFile.Expr.Const) e).getName().getText());
		} else if (e instanceof GclFile.Expr.Op) {
			out.print(((GclFile.Expr.Op) e).getOperator().getSymbol().getText());
		} else if (e instanceof GclFile.Expr.Chain) {
			writeUntypedChain(((GclFile.Expr.Chain) e).getChain());
		} else if (e instanceof GclFile.Expr.App) {
			GclFile.Expr.App a = (GclFile.Expr.App) e;
			GclFile.Expr fn = a.getFunction();
			if (fn instanceof GclFile.Expr.App && ((GclFile.Expr.App) fn).getFunction() instanceof GclFile.Expr.Op
					&& !((GclFile.Expr.Op) ((GclFile.Expr.App) fn).getFunction()).getOperator().getSymbol()
							.isUnary()) {
				GclFile.Expr.App inner = (GclFile.Expr.App) fn;
				writeUntypedExpressionWithBraces(inner.getArgument());
				out.print(" ");
				writeUntypedExpression(inner.getFunction());
				out.print(" ");
				writeUntypedExpressionWithBraces(a.getArgument());
			} else {
				writeUntypedExpression(fn);
				out.print(fn instanceof GclFile.Expr.Op ? "" : " ");
				writeUntypedExpressionWithBraces(a.getArgument());
			}
		} else if (e instanceof GclFile.Expr.Lam) {
			GclFile.Expr.Lam l = (GclFile.Expr.Lam) e;
			out.print("λ " + l.getParameter().getText() + " → ");
			writeUntypedExpression(l.getBody());
		} else if (e instanceof GclFile.Expr.Quant) {
			GclFile.Expr.Quant q = (GclFile.Expr.Quant) e;
			out.print("⟨");
			if (q.getQuantifier() instanceof GclFile.Expr.Op) {
				out.print(quantifier(((GclFile.Expr.Op) q.getQuantifier()).getOperator()));
			} else {
				writeUntypedExpressionWithBraces(q.getQuantifier());
			}
			out.print(" ");
			writeNames(q.getBound());
			out.print(" : ");
			writeUntypedExpression(q.getRange());
			out.print(" : ");
			writeUntypedExpression(q.getBody());
			out.print("⟩");
		} else if (e instanceof GclFile.Expr.ArrIdx) {
			GclFile.Expr.ArrIdx a = (GclFile.Expr.ArrIdx) e;
			writeUntypedExpressionWithBraces(a.getArray());
			out.print("[");
			writeUntypedExpression(a.getIndex());
			out.print("]");
		} else if (e instanceof GclFile.Expr.ArrUpd) {
			GclFile.Expr.ArrUpd a = (GclFile.Expr.ArrUpd) e;
			out.print("(");
			writeUntypedExpression(a.getArray());
			out.print(" : ");
			writeUntypedExpression(a.getIndex());
			out.print(" ↦ ");
			writeUntypedExpression(a.getValue());
			out.print(")");
		} else if (e instanceof GclFile.Expr.Tuple) {
			out.print("(");
			List<GclFile.Expr> es = ((GclFile.Expr.Tuple) e).getElements();
			for (int i = 0; i != es.size(); ++i) {
				if (i != 0) {
					out.print(", ");
				}
				writeUntypedExpression(es.get(i));
			}
			out.print(")");
		} else if (e instanceof GclFile.Expr.Func) {
			out.print(((GclFile.Expr.Func) e).getName().getText());
		} else if (e instanceof GclFile.Expr.Case) {
			out.print("case ");
			writeUntypedExpression(((GclFile.Expr.Case) e).getScrutinee());
			out.print(" of ...");
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeUntypedExpressionWithBraces(GclFile.Expr e) {
		if (e instanceof GclFile.Expr.App || e instanceof GclFile.Expr.Chain || e instanceof GclFile.Expr.Lam) {
			out.print("(");
			writeUntypedExpression(e);
			out.print(")");
		} else {
			writeUntypedExpression(e);
		}
	}

	private void writeUntypedChain(GclFile.Chain c) {
		if (c instanceof GclFile.Chain.Pure) {
			writeUntypedExpressionWithBraces(((GclFile.Chain.Pure) c).getExpr());
		} else {
			GclFile.Chain.More m = (GclFile.Chain.More) c;
			writeUntypedChain(m.getChain());
			out.print(" " + m.getOperator().getSymbol().getText() + " ");
			writeUntypedExpressionWithBraces(m.getExpr());
		}
	}

	private static String quantifier(Operator op) {
		switch (op.getSymbol()) {
		case CONJ:
		case CONJ_U:
			return "∀";
		case DISJ:
		case DISJ_U:
			return "∃";
		case ADD:
			return "Σ";
		case MUL:
			return "Π";
		default:
			return op.getSymbol().getText();
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	public static String toString(Expr e) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		GclFilePrinter printer = new GclFilePrinter(bout);
		printer.writeExpression(e);
		printer.flush();
		return bout.toString(StandardCharsets.UTF_8);
	}

	public static String toString(GclFile.Expr e) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		GclFilePrinter printer = new GclFilePrinter(bout);
		printer.writeUntypedExpression(e);
		printer.flush();
		return bout.toString(StandardCharsets.UTF_8);
	}

	public static String toString(Type t) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		GclFilePrinter printer = new GclFilePrinter(bout);
		printer.writeType(t);
		printer.flush();
		return bout.toString(StandardCharsets.UTF_8);
	}

	public static String toString(Kind k) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		GclFilePrinter printer = new GclFilePrinter(bout);
		printer.writeKind(k);
		printer.flush();
		return bout.toString(StandardCharsets.UTF_8);
	}

	public static String toString(TypedFile.Program p) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		new GclFilePrinter(bout).write(p);
		return bout.toString(StandardCharsets.UTF_8);
	}
}
