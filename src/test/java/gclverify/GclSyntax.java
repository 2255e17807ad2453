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
package gclverify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import gclverify.core.GclFile;
import gclverify.core.GclFile.Expr;
import gclverify.core.GclFile.Stmt;
import gclverify.core.Lit;
import gclverify.core.Loc;
import gclverify.core.Name;
import gclverify.core.Operator;
import gclverify.core.Type;

/**
 * Shorthand for constructing untyped programs in tests, standing in for the
 * parser.
 */
public class GclSyntax {

	public static Name name(String text) {
		return new Name(text);
	}

	public static List<Name> names(String... texts) {
		ArrayList<Name> ns = new ArrayList<>();
		for (String t : texts) {
			ns.add(new Name(t));
		}
		return ns;
	}

	// Expressions

	public static Expr num(int n) {
		return new Expr.Lit(Lit.num(n), Loc.NONE);
	}

	public static Expr bool(boolean b) {
		return new Expr.Lit(Lit.bool(b), Loc.NONE);
	}

	public static Expr var(String n) {
		return new Expr.Var(new Name(n));
	}

	public static Expr con(String n) {
		return new Expr.Const(new Name(n));
	}

	public static Expr op(Operator.Symbol symbol) {
		return new Expr.Op(new Operator(symbol));
	}

	public static Expr app(Expr fn, Expr arg) {
		return new Expr.App(fn, arg, Loc.NONE);
	}

	public static Expr bin(Operator.Symbol symbol, Expr lhs, Expr rhs) {
		return app(app(op(symbol), lhs), rhs);
	}

	public static Expr not(Expr e) {
		return app(op(Operator.Symbol.NEG), e);
	}

	/**
	 * Construct a comparison chain, e.g. <code>chain(a, LT, b, LTE, c)</code>
	 * for <code>a &lt; b ≤ c</code>.
	 *
	 * @param first
	 * @param rest alternating operator symbols and operands
	 * @return
	 */
	public static Expr chain(Expr first, Object... rest) {
		GclFile.Chain c = new GclFile.Chain.Pure(first);
		for (int i = 0; i < rest.length; i += 2) {
			Operator op = new Operator((Operator.Symbol) rest[i]);
			c = new GclFile.Chain.More(c, op, (Expr) rest[i + 1], Loc.NONE);
		}
		return new Expr.Chain(c);
	}

	public static Expr lam(String param, Expr body) {
		return new Expr.Lam(new Name(param), body, Loc.NONE);
	}

	public static Expr quant(Operator.Symbol symbol, List<Name> bound, Expr range, Expr body) {
		return new Expr.Quant(op(symbol), bound, range, body, Loc.NONE);
	}

	public static Expr idx(Expr arr, Expr index) {
		return new Expr.ArrIdx(arr, index, Loc.NONE);
	}

	public static Expr upd(Expr arr, Expr index, Expr value) {
		return new Expr.ArrUpd(arr, index, value, Loc.NONE);
	}

	// Types

	public static Type array(Type element) {
		Type.Interval interval = new Type.Interval(new Type.Endpoint(true, num(0)),
				new Type.Endpoint(false, con("N")), Loc.NONE);
		return new Type.Array(interval, element);
	}

	// Statements

	public static Stmt skip() {
		return new Stmt.Skip(Loc.NONE);
	}

	public static Stmt abort() {
		return new Stmt.Abort(Loc.NONE);
	}

	public static Stmt assign(String n, Expr e) {
		return new Stmt.Assign(names(n), Arrays.asList(e), Loc.NONE);
	}

	public static Stmt assign(List<Name> ns, List<Expr> es) {
		return new Stmt.Assign(ns, es, Loc.NONE);
	}

	public static Stmt aassign(Expr arr, Expr index, Expr value) {
		return new Stmt.AAssign(arr, index, value, Loc.NONE);
	}

	public static Stmt assertion(Expr e) {
		return new Stmt.Assert(e, Loc.NONE);
	}

	public static Stmt invariant(Expr inv, Expr bnd) {
		return new Stmt.LoopInvariant(inv, bnd, Loc.NONE);
	}

	public static GclFile.GdCmd gd(Expr guard, Stmt... body) {
		return new GclFile.GdCmd(guard, Arrays.asList(body), Loc.NONE);
	}

	public static Stmt loop(GclFile.GdCmd... cmds) {
		return new Stmt.Do(Arrays.asList(cmds), Loc.NONE);
	}

	public static Stmt cond(GclFile.GdCmd... cmds) {
		return new Stmt.If(Arrays.asList(cmds), Loc.NONE);
	}

	public static Stmt spec(Loc range) {
		return new Stmt.Spec("", range);
	}

	public static Stmt alloc(String n, Expr... es) {
		return new Stmt.Alloc(new Name(n), Arrays.asList(es), Loc.NONE);
	}

	public static Stmt lookup(String n, Expr e) {
		return new Stmt.HLookup(new Name(n), e, Loc.NONE);
	}

	public static Stmt mutate(Expr l, Expr r) {
		return new Stmt.HMutate(l, r, Loc.NONE);
	}

	public static Stmt dispose(Expr e) {
		return new Stmt.Dispose(e, Loc.NONE);
	}

	// Declarations and programs

	public static GclFile.Declaration vars(Type type, String... ns) {
		return new GclFile.Declaration.VarDecl(names(ns), type, null, Loc.NONE);
	}

	public static GclFile.Declaration cons(Type type, String... ns) {
		return new GclFile.Declaration.ConstDecl(names(ns), type, null, Loc.NONE);
	}

	public static GclFile.Program program(List<GclFile.Declaration> decls, Stmt... stmts) {
		return program(Collections.emptyList(), decls, stmts);
	}

	public static GclFile.Program program(List<GclFile.Definition> defs, List<GclFile.Declaration> decls,
			Stmt... stmts) {
		return new GclFile.Program(defs, decls, Collections.emptyList(), Arrays.asList(stmts), Loc.NONE);
	}
}
