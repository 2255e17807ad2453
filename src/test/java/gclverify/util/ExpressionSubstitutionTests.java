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
package gclverify.util;

import static gclverify.core.TypedFile.ADD;
import static gclverify.core.TypedFile.FORALL;
import static gclverify.core.TypedFile.LT;
import static gclverify.core.TypedFile.NUMBER;
import static gclverify.core.TypedFile.VAR;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gclverify.core.Loc;
import gclverify.core.Name;
import gclverify.core.Type;
import gclverify.core.TypedFile.Expr;
import gclverify.core.TypedFile.Stmt;
import gclverify.io.GclFilePrinter;

public class ExpressionSubstitutionTests {
	private static final Expr X = VAR("x", Type.INT);
	private static final Expr Y = VAR("y", Type.INT);
	private static final Expr Z = VAR("z", Type.INT);
	private static final Expr P = VAR("p", Type.BOOL);

	@Test
	public void test_simple_01() {
		Expr e = ExpressionSubstitution.substitute(new Name("x"), NUMBER(1), ADD(X, Y), Collections.emptySet());
		assertEquals("1 + y", GclFilePrinter.toString(e));
	}

	@Test
	public void test_simple_02() {
		// Substitution is simultaneous
		Expr e = ExpressionSubstitution.substitute(Arrays.asList(new Name("x"), new Name("y")), Arrays.asList(Y, X),
				LT(X, Y), Collections.emptySet());
		assertEquals("y < x", GclFilePrinter.toString(e));
	}

	@Test
	public void test_notFree_01() {
		Expr target = ADD(Y, NUMBER(2));
		assertSame(target, ExpressionSubstitution.substitute(new Name("x"), NUMBER(1), target, Collections.emptySet()));
	}

	@Test
	public void test_shadow_01() {
		// ⟨∀ x : x < y : p⟩[x := 1] is unchanged
		Expr target = FORALL(Arrays.asList(new Name("x")), LT(X, Y), P);
		Expr e = ExpressionSubstitution.substitute(new Name("x"), NUMBER(1), target, Collections.emptySet());
		assertSame(target, e);
	}

	@Test
	public void test_capture_01() {
		// ⟨∀ y : y < x : p⟩[x := y + 1]
		Expr target = FORALL(Arrays.asList(new Name("y")), LT(Y, X), P);
		Expr e = ExpressionSubstitution.substitute(new Name("x"), ADD(Y, NUMBER(1)), target, Collections.emptySet());
		assertEquals("⟨∀ y0 : y0 < (y + 1) : p⟩", GclFilePrinter.toString(e));
	}

	@Test
	public void test_capture_02() {
		// The renamed binder avoids names in scope
		Expr target = FORALL(Arrays.asList(new Name("y")), LT(Y, X), P);
		Expr e = ExpressionSubstitution.substitute(new Name("x"), ADD(Y, NUMBER(1)), target, Arrays.asList("y0"));
		assertEquals("⟨∀ y1 : y1 < (y + 1) : p⟩", GclFilePrinter.toString(e));
	}

	@Test
	public void test_capture_03() {
		// The renamed binder avoids free variables of the body
		Expr y0 = VAR("y0", Type.INT);
		Expr target = FORALL(Arrays.asList(new Name("y")), LT(Y, ADD(X, y0)), P);
		Expr e = ExpressionSubstitution.substitute(new Name("x"), Y, target, Collections.emptySet());
		assertEquals("⟨∀ y1 : y1 < (y + y0) : p⟩", GclFilePrinter.toString(e));
	}

	@Test
	public void test_lambda_01() {
		// (λz → z + x)[x := z]
		Expr target = new Expr.Lam(new Name("z"), Type.INT, ADD(Z, X), Type.FUNC(Type.INT, Type.INT), Loc.NONE);
		Expr e = ExpressionSubstitution.substitute(new Name("x"), Z, target, Collections.emptySet());
		assertEquals("λ z0 → z0 + z", GclFilePrinter.toString(e));
	}

	@Test
	public void test_free_01() {
		Expr target = FORALL(Arrays.asList(new Name("y")), LT(Y, X), P);
		assertEquals(new HashSet<>(Arrays.asList("x", "p")), FreeVariables.of(target));
	}

	@Test
	public void test_rename_01() {
		// Renaming reaches the targets of assignments
		Stmt s = new Stmt.Assign(Arrays.asList(new Name("x")), Arrays.asList(ADD(X, NUMBER(1))), Loc.NONE);
		Map<String, Name> renaming = Collections.singletonMap("x", new Name("x1"));
		List<Stmt> stmts = ExpressionSubstitution.rename(renaming, Arrays.asList(s), Collections.emptySet());
		Stmt.Assign r = (Stmt.Assign) stmts.get(0);
		assertEquals("x1", r.getNames().get(0).getText());
		assertEquals("x1 + 1", GclFilePrinter.toString(r.getExprs().get(0)));
	}

	@Test
	public void test_rename_02() {
		Map<String, Name> renaming = Collections.singletonMap("y", new Name("w"));
		Expr e = ExpressionSubstitution.renaming(renaming, Collections.emptySet()).visitExpression(ADD(X, Y));
		assertEquals("x + w", GclFilePrinter.toString(e));
		assertTrue(((Expr.App) e).getArgument() instanceof Expr.Var);
	}
}
