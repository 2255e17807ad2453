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

import static gclverify.core.TypedFile.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import gclverify.core.Loc;
import gclverify.core.Name;
import gclverify.core.Type;
import gclverify.core.TypedFile;
import gclverify.core.TypedFile.Expr;
import gclverify.core.TypedFile.Stmt;
import gclverify.io.GclFilePrinter;
import gclverify.types.TypeEnvironment;

public class WeakestPreconditionTests {
	private static final Expr X = VAR("x", Type.INT);
	private static final Expr Y = VAR("y", Type.INT);
	private static final Expr P = VAR("p", Type.INT);
	private static final Expr A = VAR("A", new Type.Array(null, Type.INT));

	private WpSession session;
	private WeakestPrecondition wp;

	@BeforeEach
	public void setup() {
		session = new WpSession(TypeEnvironment.EMPTY, true);
		wp = new ObligationGenerator(session).getWeakestPrecondition();
	}

	@Test
	public void test_skip_01() throws StructError {
		Pred post = new Pred.Constant(LT(NUMBER(0), X));
		assertSame(post, wp.wp(new Stmt.Skip(Loc.NONE), post));
	}

	@Test
	public void test_abort_01() throws StructError {
		Pred post = new Pred.Constant(LT(NUMBER(0), X));
		assertEquals("false", print(wp.wp(new Stmt.Abort(Loc.NONE), post)));
	}

	@Test
	public void test_assign_01() throws StructError {
		// wp(x := x + 1, 0 < x) = 0 < (x + 1)
		Pred post = new Pred.Constant(LT(NUMBER(0), X));
		Stmt s = assign(X, ADD(X, NUMBER(1)));
		assertEquals("0 < (x + 1)", print(wp.wp(s, post)));
	}

	@Test
	public void test_assign_02() throws StructError {
		// Statements are processed backwards
		Pred post = new Pred.Constant(LT(NUMBER(0), Y));
		Pred pre = wp.wpSStmts(Arrays.asList(assign(X, ADD(X, NUMBER(1))), assign(Y, X)), post);
		assertEquals("0 < (x + 1)", print(pre));
	}

	@Test
	public void test_assign_03() throws StructError {
		// Simultaneous assignment swaps
		Pred post = new Pred.Constant(LT(X, Y));
		Stmt s = new Stmt.Assign(Arrays.asList(new Name("x"), new Name("y")), Arrays.asList(Y, X), Loc.NONE);
		assertEquals("y < x", print(wp.wp(s, post)));
	}

	@Test
	public void test_aassign_01() throws StructError {
		// wp(A[x] := 1, A[y] = 0) = (A : x ↦ 1)[y] = 0
		Pred post = new Pred.Constant(EQ(new Expr.ArrIdx(A, Y, Type.INT, Loc.NONE), NUMBER(0)));
		Stmt s = new Stmt.AAssign(A, X, NUMBER(1), Loc.NONE);
		assertEquals("(A : x ↦ 1)[y] = 0", print(wp.wp(s, post)));
	}

	@Test
	public void test_aassign_02() {
		Expr row = new Expr.ArrIdx(A, X, Type.INT, Loc.NONE);
		Stmt s = new Stmt.AAssign(row, Y, NUMBER(1), Loc.NONE);
		assertThrows(StructError.MultiDimArrayAssignment.class, () -> wp.wp(s, new Pred.Constant(TRUE)));
	}

	@Test
	public void test_if_01() throws StructError {
		// Some guard must hold, and each branch must establish the postcondition
		Expr g1 = LT(X, NUMBER(0));
		Expr g2 = GTE(X, NUMBER(0));
		Stmt s = new Stmt.If(Arrays.asList(gd(g1, assign(X, NUMBER(0))), gd(g2, new Stmt.Skip(Loc.NONE))),
				Loc.NONE);
		Pred post = new Pred.Constant(GTE(X, NUMBER(0)));
		Expr expected = CONJUNCT(Arrays.asList(DISJ(g1, g2), IMPLIES(g1, GTE(NUMBER(0), NUMBER(0))),
				IMPLIES(g2, post.toExpr())));
		assertEquals(GclFilePrinter.toString(expected), print(wp.wp(s, post)));
	}

	@Test
	public void test_do_01() {
		Stmt s = new Stmt.Do(Arrays.asList(gd(LT(X, Y), assign(X, ADD(X, NUMBER(1))))), Loc.NONE);
		assertThrows(StructError.MissingAssertion.class, () -> wp.wp(s, new Pred.Constant(TRUE)));
	}

	@Test
	public void test_alloc_01() throws StructError {
		// wp(x := new(1, 2), x = y) = ⟨∀ x0 :: (x0 ↦ 1 • x0 + 1 ↦ 2) -* x0 = y⟩
		Stmt s = new Stmt.Alloc(new Name("x"), Arrays.asList(NUMBER(1), NUMBER(2)), Loc.NONE);
		Pred pre = wp.wp(s, new Pred.Constant(EQ(X, Y)));
		assertEquals("⟨∀ x0 : true : ((x0 ↦ 1) • ((x0 + 1) ↦ 2)) -* (x0 = y)⟩", print(pre));
	}

	@Test
	public void test_lookup_01() throws StructError {
		// wp(x := *p, x = 1) = ⟨∃ x0 :: p ↦ x0 • (p ↦ x0 -* x0 = 1)⟩
		Stmt s = new Stmt.HLookup(new Name("x"), P, Loc.NONE);
		Pred pre = wp.wp(s, new Pred.Constant(EQ(X, NUMBER(1))));
		assertEquals("⟨∃ x0 : true : (p ↦ x0) • ((p ↦ x0) -* (x0 = 1))⟩", print(pre));
	}

	@Test
	public void test_mutate_01() throws StructError {
		Stmt s = new Stmt.HMutate(P, NUMBER(5), Loc.NONE);
		Pred pre = wp.wp(s, new Pred.Constant(TRUE));
		assertEquals("⟨∃ new : true : p ↦ new⟩ • ((p ↦ 5) -* true)", print(pre));
	}

	@Test
	public void test_dispose_01() throws StructError {
		Stmt s = new Stmt.Dispose(P, Loc.NONE);
		Pred pre = wp.wp(s, new Pred.Constant(TRUE));
		assertEquals("⟨∃ new : true : p ↦ new⟩ • true", print(pre));
	}

	@Test
	public void test_dispose_02() throws StructError {
		// The existential avoids names in scope
		session.enterScope(Arrays.asList("new"));
		Stmt s = new Stmt.Dispose(P, Loc.NONE);
		Pred pre = wp.wp(s, new Pred.Constant(TRUE));
		assertEquals("⟨∃ new0 : true : p ↦ new0⟩ • true", print(pre));
	}

	@Test
	public void test_block_01() throws StructError {
		// A local shadowing x does not affect the outer x
		session.enterScope(Arrays.asList("x"));
		TypedFile.Declaration local = new TypedFile.Declaration(false, Arrays.asList(new Name("x")), Type.INT, null,
				Loc.NONE);
		TypedFile.Program body = new TypedFile.Program(Collections.emptyList(), Arrays.asList(local),
				Collections.emptyList(), Arrays.asList(assign(X, NUMBER(1))), Loc.NONE);
		Pred post = new Pred.Constant(EQ(X, NUMBER(0)));
		assertSame(post, wp.wp(new Stmt.Block(body, Loc.NONE), post));
	}

	@Test
	public void test_segments_01() {
		java.util.List<Segment> segs = Segment.group(Arrays.asList(new Stmt.Assert(TRUE, Loc.NONE),
				assign(X, NUMBER(1)), assign(Y, NUMBER(2)), new Stmt.Spec("", Loc.NONE),
				new Stmt.LoopInvariant(TRUE, null, Loc.NONE)));
		assertEquals(4, segs.size());
		assertEquals(Segment.Kind.ASSERTION, segs.get(0).getKind());
		assertEquals(Segment.Kind.BLOCK, segs.get(1).getKind());
		assertEquals(2, segs.get(1).getStatements().size());
		assertEquals(Segment.Kind.SPEC, segs.get(2).getKind());
		assertEquals(Segment.Kind.ASSERTION, segs.get(3).getKind());
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private static Stmt assign(Expr lhs, Expr rhs) {
		Name n = ((Expr.Var) lhs).getName();
		return new Stmt.Assign(Arrays.asList(n), Arrays.asList(rhs), Loc.NONE);
	}

	private static TypedFile.GdCmd gd(Expr guard, Stmt... body) {
		return new TypedFile.GdCmd(guard, Arrays.asList(body), Loc.NONE);
	}

	private static String print(Pred p) {
		return GclFilePrinter.toString(p.toExpr());
	}
}
