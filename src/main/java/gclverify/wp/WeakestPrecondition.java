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
package gclverify.wp;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import gclverify.core.Name;
import gclverify.core.Type;
import gclverify.core.TypedFile;
import gclverify.core.TypedFile.Expr;
import gclverify.core.TypedFile.Stmt;
import gclverify.util.ExpressionSubstitution;
import gclverify.util.FreeVariables;

import static gclverify.core.TypedFile.*;

/**
 * Computes weakest preconditions by working backwards through statements. The
 * weakest precondition <code>wp(S, Q)</code> is the weakest predicate which
 * ensures that executing <code>S</code> terminates in a state satisfying
 * <code>Q</code>. For example, <code>wp(x := x + 1, x &gt; 0)</code> is
 * <code>x + 1 &gt; 0</code>.
 */
public class WeakestPrecondition {
	private final WpSession session;
	private final ObligationGenerator generator;

	public WeakestPrecondition(WpSession session, ObligationGenerator generator) {
		this.session = session;
		this.generator = generator;
	}

	/**
	 * The predicate reached when working backwards through a sequence of
	 * segments, together with the origin of any obligation which must establish
	 * it.
	 */
	public static final class Target {
		private final Pred pred;
		private final ProofObligation.Origin origin;

		public Target(Pred pred, ProofObligation.Origin origin) {
			this.pred = pred;
			this.origin = origin;
		}

		public Pred getPred() {
			return pred;
		}

		public ProofObligation.Origin getOrigin() {
			return origin;
		}
	}

	public Pred wpStmts(List<Stmt> stmts, Pred post, ProofObligation.Origin origin) throws StructError {
		return wpSegs(Segment.group(stmts), post, origin).getPred();
	}

	/**
	 * Work backwards through a sequence of segments. Upon reaching an assertion,
	 * obligations from that assertion onwards are generated and the assertion
	 * itself becomes the precondition.
	 *
	 * @param segs
	 * @param post
	 * @param origin
	 * @return
	 * @throws StructError
	 */
	public Target wpSegs(List<Segment> segs, Pred post, ProofObligation.Origin origin) throws StructError {
		if (segs.isEmpty()) {
			return new Target(post, origin);
		}
		Segment head = segs.get(0);
		List<Segment> rest = segs.subList(1, segs.size());
		switch (head.getKind()) {
		case BLOCK: {
			Target t = wpSegs(rest, post, origin);
			return new Target(wpSStmts(head.getStatements(), t.getPred()), t.getOrigin());
		}
		case SPEC: {
			int id = session.nextSpecId();
			Target t = wpSegs(rest, post, origin);
			session.tellSpec(id, t.getPred(), t.getPred(), head.getStatement().getLoc());
			return t;
		}
		default: {
			Pred p = ObligationGenerator.toPred(head.getStatement());
			generator.structSegs(p, null, rest, post, origin);
			return new Target(p, ObligationGenerator.origin(ProofObligation.Origin.Kind.ASSERTION, p));
		}
		}
	}

	/**
	 * Work backwards through statements which contain no assertions or
	 * specification holes at the outermost level. Loops with invariants may
	 * still appear, but only in bodies from which assertions were removed.
	 *
	 * @param stmts
	 * @param post
	 * @return
	 * @throws StructError
	 */
	public Pred wpSStmts(List<Stmt> stmts, Pred post) throws StructError {
		for (int i = stmts.size() - 1; i >= 0; --i) {
			Stmt s = stmts.get(i);
			if (s instanceof Stmt.Do && i > 0 && stmts.get(i - 1) instanceof Stmt.LoopInvariant) {
				// inv ∧ ((inv ∧ ¬guards) ⇒ post)
				Expr inv = ((Stmt.LoopInvariant) stmts.get(i - 1)).getInvariant();
				List<Expr> guards = guards(((Stmt.Do) s).getCommands());
				Expr exit = CONJ(inv, NEG(DISJUNCT(guards)));
				post = new Pred.Constant(CONJ(inv, IMPLIES(exit, post.toExpr())));
				i = i - 1;
			} else {
				post = wp(s, post);
			}
		}
		return post;
	}

	public Pred wp(Stmt stmt, Pred post) throws StructError {
		if (stmt instanceof Stmt.Skip || stmt instanceof Stmt.Proof) {
			return post;
		} else if (stmt instanceof Stmt.Abort) {
			return new Pred.Constant(FALSE);
		} else if (stmt instanceof Stmt.Assign) {
			Stmt.Assign s = (Stmt.Assign) stmt;
			return substitute(s.getNames(), s.getExprs(), post);
		} else if (stmt instanceof Stmt.AAssign) {
			return wpAAssign((Stmt.AAssign) stmt, post);
		} else if (stmt instanceof Stmt.If) {
			return wpIf((Stmt.If) stmt, post);
		} else if (stmt instanceof Stmt.Do) {
			throw new StructError.MissingAssertion(stmt.getLoc());
		} else if (stmt instanceof Stmt.Alloc) {
			return wpAlloc((Stmt.Alloc) stmt, post);
		} else if (stmt instanceof Stmt.HLookup) {
			return wpHLookup((Stmt.HLookup) stmt, post);
		} else if (stmt instanceof Stmt.HMutate) {
			Stmt.HMutate s = (Stmt.HMutate) stmt;
			// (e1 ↦ _) • ((e1 ↦ e2) -* post)
			Expr updated = SIMP(POINTS_TO(s.getLeft(), s.getRight()), post.toExpr());
			return new Pred.Constant(SCONJ(allocated(s.getLeft(), post), updated));
		} else if (stmt instanceof Stmt.Dispose) {
			Stmt.Dispose s = (Stmt.Dispose) stmt;
			// (e ↦ _) • post
			return new Pred.Constant(SCONJ(allocated(s.getExpr(), post), post.toExpr()));
		} else if (stmt instanceof Stmt.Block) {
			return wpBlock(((Stmt.Block) stmt).getProgram(), post);
		} else {
			throw new IllegalArgumentException("unexpected statement encountered (" + stmt.getClass().getName() + ")");
		}
	}

	private Pred wpAAssign(Stmt.AAssign stmt, Pred post) throws StructError {
		if (!(stmt.getArray() instanceof Expr.Var)) {
			throw new StructError.MultiDimArrayAssignment(stmt.getLoc());
		}
		Expr.Var x = (Expr.Var) stmt.getArray();
		Expr upd = new Expr.ArrUpd(x, stmt.getIndex(), stmt.getValue(), x.getType(), stmt.getLoc());
		ArrayList<Name> names = new ArrayList<>();
		names.add(x.getName());
		ArrayList<Expr> exprs = new ArrayList<>();
		exprs.add(upd);
		return substitute(names, exprs, post);
	}

	private Pred wpIf(Stmt.If stmt, Pred post) throws StructError {
		ArrayList<Expr> clauses = new ArrayList<>();
		clauses.add(DISJUNCT(guards(stmt.getCommands())));
		for (TypedFile.GdCmd c : stmt.getCommands()) {
			Pred pre = wpStmts(c.getBody(), post, null);
			clauses.add(IMPLIES(c.getGuard(), pre.toExpr()));
		}
		return new Pred.Constant(CONJUNCT(clauses));
	}

	/**
	 * <code>wp(x := new(e0, e1, ...), P) = ∀x'. (x' ↦ e0 • x'+1 ↦ e1 • ...) -* P[x'/x]</code>
	 */
	private Pred wpAlloc(Stmt.Alloc stmt, Pred post) {
		Name x = stmt.getVariable();
		Set<String> free = new HashSet<>(FreeVariables.of(post.toExpr()));
		free.addAll(FreeVariables.of(stmt.getExprs()));
		Name x1 = new Name(session.freshInScope(x.getText(), free), x.getLoc());
		Expr.Var v = VAR(x1, Type.INT);
		Expr body = ExpressionSubstitution.substitute(x, v, post.toExpr(), session.getNamesInScope());
		ArrayList<Expr> cells = new ArrayList<>();
		List<Expr> exprs = stmt.getExprs();
		for (int i = 0; i != exprs.size(); ++i) {
			Expr address = i == 0 ? v : ADD(v, NUMBER(i));
			cells.add(POINTS_TO(address, exprs.get(i)));
		}
		return new Pred.Constant(FORALL(x1, SIMP(SCONJUNCT(cells), body)));
	}

	/**
	 * <code>wp(x := *e, P) = ∃v. (e ↦ v) • ((e ↦ v) -* P[v/x])</code>
	 */
	private Pred wpHLookup(Stmt.HLookup stmt, Pred post) {
		Name x = stmt.getVariable();
		Set<String> free = new HashSet<>(FreeVariables.of(post.toExpr()));
		free.addAll(FreeVariables.of(stmt.getExpr()));
		Name v = new Name(session.freshInScope(x.getText(), free), x.getLoc());
		Expr.Var var = VAR(v, Type.INT);
		Expr body = ExpressionSubstitution.substitute(x, var, post.toExpr(), session.getNamesInScope());
		Expr entry = POINTS_TO(stmt.getExpr(), var);
		return new Pred.Constant(EXISTS(v, SCONJ(entry, SIMP(entry, body))));
	}

	/**
	 * Construct <code>∃n. e ↦ n</code>, i.e. that <code>e</code> is allocated.
	 */
	private Expr allocated(Expr e, Pred post) {
		Set<String> free = new HashSet<>(FreeVariables.of(post.toExpr()));
		free.addAll(FreeVariables.of(e));
		Name n = new Name(session.freshInScope("new", free));
		return EXISTS(n, POINTS_TO(e, VAR(n, Type.INT)));
	}

	/**
	 * Compute the weakest precondition of a nested block. Locally declared names
	 * which shadow names already in scope are renamed first, so that they
	 * cannot be confused in the resulting predicate.
	 *
	 * @param program
	 * @param post
	 * @return
	 * @throws StructError
	 */
	public Pred wpBlock(TypedFile.Program program, Pred post) throws StructError {
		ArrayList<Name> locals = new ArrayList<>();
		for (TypedFile.Declaration d : program.getDeclarations()) {
			locals.addAll(d.getNames());
		}
		Set<String> localNames = new HashSet<>();
		for (Name n : locals) {
			localNames.add(n.getText());
		}
		Map<String, Name> renaming = new LinkedHashMap<>();
		ArrayList<String> declared = new ArrayList<>();
		for (Name n : locals) {
			if (session.isInScope(n.getText())) {
				Name m = new Name(session.freshInScope(n.getText(), localNames, renamedTexts(renaming)), n.getLoc());
				renaming.put(n.getText(), m);
				declared.add(m.getText());
			} else {
				declared.add(n.getText());
			}
		}
		List<Stmt> stmts = ExpressionSubstitution.rename(renaming, program.getStatements(),
				session.getNamesInScope());
		session.enterScope(declared);
		try {
			return wpStmts(stmts, post, null);
		} finally {
			session.exitScope();
		}
	}

	private Pred substitute(List<Name> names, List<Expr> exprs, Pred post) {
		Expr e = ExpressionSubstitution.substitute(names, exprs, post.toExpr(), session.getNamesInScope());
		return e == post.toExpr() ? post : new Pred.Constant(e);
	}

	private static Set<String> renamedTexts(Map<String, Name> renaming) {
		Set<String> r = new HashSet<>();
		for (Name n : renaming.values()) {
			r.add(n.getText());
		}
		return r;
	}

	static List<Expr> guards(List<TypedFile.GdCmd> cmds) {
		ArrayList<Expr> gs = new ArrayList<>();
		for (TypedFile.GdCmd c : cmds) {
			gs.add(c.getGuard());
		}
		return gs;
	}
}
