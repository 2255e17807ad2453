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
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gclverify.core.Name;
import gclverify.core.Type;
import gclverify.core.TypedFile;
import gclverify.core.TypedFile.Expr;
import gclverify.core.TypedFile.Stmt;
import gclverify.types.TypeEnvironment;

import static gclverify.core.TypedFile.*;

/**
 * <p>
 * Generates the proof obligations for a typed program by working forwards
 * between assertions. Between consecutive assertions <code>{P} S {Q}</code>
 * the obligation <code>P ⇒ wp(S, Q)</code> is generated. Loops must be
 * immediately preceded by their invariant, and give rise to obligations that
 * the invariant is preserved and (when a bound is given) that the loop
 * terminates.
 * </p>
 * <p>
 * Specification holes generate no obligations. Instead, the pre- and
 * postcondition of each hole are recorded.
 * </p>
 */
public class ObligationGenerator {
	private static final Logger LOGGER = LoggerFactory.getLogger(ObligationGenerator.class);

	private final WpSession session;
	private final WeakestPrecondition wp;

	public ObligationGenerator(WpSession session) {
		this.session = session;
		this.wp = new WeakestPrecondition(session, this);
	}

	public WpSession getSession() {
		return session;
	}

	public WeakestPrecondition getWeakestPrecondition() {
		return wp;
	}

	/**
	 * Generate the obligations for an entire program. The program's precondition
	 * is its leading assertion (if any) and, likewise, its postcondition is its
	 * trailing assertion.
	 *
	 * @param program
	 * @throws StructError
	 */
	public void structProgram(TypedFile.Program program) throws StructError {
		ArrayList<String> names = new ArrayList<>();
		for (TypedFile.Declaration d : program.getDeclarations()) {
			for (Name n : d.getNames()) {
				names.add(n.getText());
			}
		}
		for (TypedFile.Definition d : program.getDefinitions()) {
			if (d instanceof TypedFile.Definition.FuncDefn) {
				names.add(((TypedFile.Definition.FuncDefn) d).getName().getText());
			} else if (d instanceof TypedFile.Definition.FuncDefnSig) {
				names.add(((TypedFile.Definition.FuncDefnSig) d).getName().getText());
			}
		}
		session.enterScope(names);
		try {
			structStmts(program.getStatements());
		} finally {
			session.exitScope();
		}
		LOGGER.debug("generated {} obligations and {} specifications", session.getObligations().size(),
				session.getSpecifications().size());
	}

	public void structStmts(List<Stmt> stmts) throws StructError {
		Pred pre = new Pred.Constant(TRUE);
		if (!stmts.isEmpty() && stmts.get(0) instanceof Stmt.Assert) {
			pre = toPred(stmts.get(0));
			stmts = stmts.subList(1, stmts.size());
		}
		Pred post = new Pred.Constant(TRUE);
		ProofObligation.Origin origin = new ProofObligation.Origin(ProofObligation.Origin.Kind.ASSERTION,
				pre.getLoc());
		if (!stmts.isEmpty() && stmts.get(stmts.size() - 1) instanceof Stmt.Assert) {
			post = toPred(stmts.get(stmts.size() - 1));
			stmts = stmts.subList(0, stmts.size() - 1);
			origin = origin(ProofObligation.Origin.Kind.ASSERTION, post);
		}
		structSegs(pre, null, Segment.group(stmts), post, origin);
	}

	/**
	 * Generate obligations for a sequence of segments, given a precondition
	 * known to hold at the start and a postcondition to be established at the
	 * end.
	 *
	 * @param pre
	 * @param preOrigin
	 *            Origin for the first obligation arising from <code>pre</code>,
	 *            or <code>null</code> if this is determined by what it must
	 *            establish.
	 * @param segs
	 * @param post
	 * @param postOrigin
	 *            Origin for any obligation which establishes <code>post</code>.
	 * @throws StructError
	 */
	public void structSegs(Pred pre, ProofObligation.Origin preOrigin, List<Segment> segs, Pred post,
			ProofObligation.Origin postOrigin) throws StructError {
		if (segs.isEmpty()) {
			tellPO(pre, post, preOrigin != null ? preOrigin : postOrigin);
			return;
		}
		Segment head = segs.get(0);
		List<Segment> rest = segs.subList(1, segs.size());
		switch (head.getKind()) {
		case ASSERTION: {
			Pred p = toPred(head.getStatement());
			tellPO(pre, p, preOrigin != null ? preOrigin : origin(ProofObligation.Origin.Kind.ASSERTION, p));
			structSegs(p, null, rest, post, postOrigin);
			break;
		}
		case SPEC: {
			int id = session.nextSpecId();
			WeakestPrecondition.Target t = wp.wpSegs(rest, post, postOrigin);
			session.tellSpec(id, pre, t.getPred(), head.getStatement().getLoc());
			break;
		}
		default:
			structBlock(pre, preOrigin, head.getStatements(), rest, post, postOrigin);
		}
	}

	private void structBlock(Pred pre, ProofObligation.Origin preOrigin, List<Stmt> stmts, List<Segment> rest,
			Pred post, ProofObligation.Origin postOrigin) throws StructError {
		Stmt first = stmts.get(0);
		if (first instanceof Stmt.Do) {
			if (!(pre instanceof Pred.LoopInvariant)) {
				throw new StructError.MissingAssertion(first.getLoc());
			}
			ArrayList<Segment> after = new ArrayList<>();
			if (stmts.size() > 1) {
				after.add(Segment.block(stmts.subList(1, stmts.size())));
			}
			after.addAll(rest);
			structLoop((Pred.LoopInvariant) pre, (Stmt.Do) first, after, post, postOrigin);
		} else if (!rest.isEmpty() && rest.get(0).getKind() == Segment.Kind.ASSERTION) {
			Pred p = toPred(rest.get(0).getStatement());
			Pred q = wp.wpSStmts(stmts, p);
			tellPO(pre, q, preOrigin != null ? preOrigin : origin(ProofObligation.Origin.Kind.ASSERTION, p));
			structSegs(p, null, rest.subList(1, rest.size()), post, postOrigin);
		} else {
			WeakestPrecondition.Target t = wp.wpSegs(rest, post, postOrigin);
			Pred q = wp.wpSStmts(stmts, t.getPred());
			tellPO(pre, q, preOrigin != null ? preOrigin : t.getOrigin());
		}
	}

	/**
	 * Generate the obligations for a loop with a given invariant, followed by
	 * some segments.
	 *
	 * @param inv
	 * @param loop
	 * @param after
	 * @param post
	 * @param postOrigin
	 * @throws StructError
	 */
	public void structLoop(Pred.LoopInvariant inv, Stmt.Do loop, List<Segment> after, Pred post,
			ProofObligation.Origin postOrigin) throws StructError {
		List<GdCmd> cmds = loop.getCommands();
		List<Expr> guards = WeakestPrecondition.guards(cmds);
		Expr invariant = inv.toExpr();
		ProofObligation.Origin preserved = new ProofObligation.Origin(ProofObligation.Origin.Kind.LOOP_INVARIANT,
				inv.getLoc());
		// inv ∧ g ⇒ wp(body, inv)
		for (GdCmd c : cmds) {
			Pred pre = new Pred.Constant(CONJ(invariant, c.getGuard()));
			structSegs(pre, null, Segment.group(c.getBody()), inv, preserved);
		}
		// inv ∧ ¬(g1 ∨ ... ∨ gn) ⇒ post
		Pred exit = new Pred.Constant(CONJ(invariant, NEG(DISJUNCT(guards))));
		ProofObligation.Origin exitOrigin = new ProofObligation.Origin(ProofObligation.Origin.Kind.LOOP_EXIT,
				loop.getLoc());
		structSegs(exit, exitOrigin, after, post, postOrigin);
		if (session.isCheckTermination()) {
			structTermination(inv, loop, guards);
		}
	}

	private void structTermination(Pred.LoopInvariant inv, Stmt.Do loop, List<Expr> guards) throws StructError {
		Expr bnd = inv.getBound();
		if (bnd == null) {
			session.tellWarning(new StructWarning.MissingBound(loop.getLoc()));
			return;
		}
		Expr invariant = inv.toExpr();
		// inv ∧ (g1 ∨ ... ∨ gn) ⇒ bnd ≥ 0
		tellPO(new Pred.Constant(CONJ(invariant, DISJUNCT(guards))), new Pred.Constant(GTE(bnd, NUMBER(0))),
				new ProofObligation.Origin(ProofObligation.Origin.Kind.LOOP_TERMINATION, loop.getLoc()));
		// inv ∧ g ∧ bnd = b ⇒ wp(body, bnd < b)
		String b = session.freshInScope("bnd");
		Expr.Var var = VAR(b, Type.INT);
		ArrayList<String> names = new ArrayList<>();
		names.add(b);
		session.enterScope(names);
		try {
			for (GdCmd c : loop.getCommands()) {
				List<Stmt> body = stripAsserts(c.getBody());
				if (body == null) {
					LOGGER.debug("skipping bound decrement for loop body containing specification");
					continue;
				}
				Pred pre = new Pred.Constant(CONJUNCT(Arrays.asList(invariant, c.getGuard(), EQ(bnd, var))));
				Pred post = wp.wpSStmts(body, new Pred.Constant(LT(bnd, var)));
				tellPO(pre, post, new ProofObligation.Origin(ProofObligation.Origin.Kind.BOUND_DECREMENT,
						loop.getLoc()));
			}
		} finally {
			session.exitScope();
		}
	}

	/**
	 * Remove assertions from a list of statements, keeping loop invariants which
	 * precede loops. This fails (returning <code>null</code>) if a specification
	 * hole is encountered.
	 *
	 * @param stmts
	 * @return
	 */
	public static List<Stmt> stripAsserts(List<Stmt> stmts) {
		ArrayList<Stmt> result = new ArrayList<>();
		for (int i = 0; i != stmts.size(); ++i) {
			Stmt s = stmts.get(i);
			if (s instanceof Stmt.Spec) {
				return null;
			} else if (s instanceof Stmt.Assert) {
				continue;
			} else if (s instanceof Stmt.LoopInvariant) {
				if (i + 1 < stmts.size() && stmts.get(i + 1) instanceof Stmt.Do) {
					result.add(s);
				}
			} else if (s instanceof Stmt.If) {
				List<GdCmd> cmds = stripAssertsFromCommands(((Stmt.If) s).getCommands());
				if (cmds == null) {
					return null;
				}
				result.add(new Stmt.If(cmds, s.getLoc()));
			} else if (s instanceof Stmt.Do) {
				List<GdCmd> cmds = stripAssertsFromCommands(((Stmt.Do) s).getCommands());
				if (cmds == null) {
					return null;
				}
				result.add(new Stmt.Do(cmds, s.getLoc()));
			} else {
				result.add(s);
			}
		}
		return result;
	}

	private static List<GdCmd> stripAssertsFromCommands(List<GdCmd> cmds) {
		ArrayList<GdCmd> result = new ArrayList<>();
		for (GdCmd c : cmds) {
			List<Stmt> body = stripAsserts(c.getBody());
			if (body == null) {
				return null;
			}
			result.add(new GdCmd(c.getGuard(), body, c.getLoc()));
		}
		return result;
	}

	private void tellPO(Pred pre, Pred post, ProofObligation.Origin origin) {
		if (origin == null) {
			origin = origin(ProofObligation.Origin.Kind.ASSERTION, post);
		}
		session.tellPO(pre, post, origin);
	}

	/**
	 * Convert an assertion or loop invariant into a predicate.
	 *
	 * @param stmt
	 * @return
	 */
	static Pred toPred(Stmt stmt) {
		if (stmt instanceof Stmt.Assert) {
			Stmt.Assert s = (Stmt.Assert) stmt;
			return new Pred.Assertion(s.getCondition(), s.getLoc());
		} else {
			Stmt.LoopInvariant s = (Stmt.LoopInvariant) stmt;
			return new Pred.LoopInvariant(s.getInvariant(), s.getBound(), s.getLoc());
		}
	}

	static ProofObligation.Origin origin(ProofObligation.Origin.Kind kind, Pred p) {
		return new ProofObligation.Origin(kind, p.getLoc());
	}

	/**
	 * Construct a generator for a given environment.
	 *
	 * @param env
	 * @param checkTermination
	 * @return
	 */
	public static ObligationGenerator create(TypeEnvironment env, boolean checkTermination) {
		return new ObligationGenerator(new WpSession(env, checkTermination));
	}
}
