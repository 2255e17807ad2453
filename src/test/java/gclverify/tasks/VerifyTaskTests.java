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
package gclverify.tasks;

import static gclverify.GclSyntax.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import gclverify.core.GclException;
import gclverify.core.GclFile;
import gclverify.core.Kind;
import gclverify.core.Loc;
import gclverify.core.Operator.Symbol;
import gclverify.core.Type;
import gclverify.core.UnsupportedConstruct;
import gclverify.types.TypeError;
import gclverify.wp.ProofObligation;
import gclverify.wp.StructError;
import gclverify.wp.StructWarning;

public class VerifyTaskTests {
	private static final List<GclFile.Declaration> DECLS = Arrays.asList(cons(Type.INT, "N"), vars(Type.INT, "x"));

	/**
	 * <code>{ x = 0 } { x ≤ N } do x < N → x := x + 1 od { x = N }</code>
	 */
	private static GclFile.Program countUp(GclFile.Expr bound) {
		return program(DECLS, assertion(chain(var("x"), Symbol.EQ, num(0))),
				invariant(chain(var("x"), Symbol.LTE, con("N")), bound),
				loop(gd(chain(var("x"), Symbol.LT, con("N")), assign("x", bin(Symbol.ADD, var("x"), num(1))))),
				assertion(chain(var("x"), Symbol.EQ, con("N"))));
	}

	@Test
	public void test_defaults_01() {
		VerifyTask task = new VerifyTask();
		assertTrue(task.isCheckTermination());
		assertFalse(task.setCheckTermination(false).isCheckTermination());
	}

	@Test
	public void test_run_01() throws GclException {
		VerifyTask.Result r = new VerifyTask().setVerbose(true).run(countUp(bin(Symbol.SUB, con("N"), var("x"))));
		assertEquals(5, r.getObligations().size());
		assertEquals(0, r.getSpecifications().size());
		assertEquals(0, r.getWarnings().size());
		assertEquals(2, r.getProgram().getDeclarations().size());
		assertTrue(r.getEnvironment().lookup(name("x")) != null);
	}

	@Test
	public void test_run_02() throws GclException {
		VerifyTask.Result r = new VerifyTask().run(countUp(null));
		assertEquals(3, r.getObligations().size());
		assertEquals(1, r.getWarnings().size());
		assertTrue(r.getWarnings().get(0) instanceof StructWarning.MissingBound);
	}

	@Test
	public void test_run_03() throws GclException {
		VerifyTask.Result r = new VerifyTask().setCheckTermination(false).run(countUp(null));
		assertEquals(3, r.getObligations().size());
		assertEquals(0, r.getWarnings().size());
		for (ProofObligation po : r.getObligations()) {
			assertTrue(po.getOrigin().getKind() != ProofObligation.Origin.Kind.LOOP_TERMINATION);
		}
	}

	@Test
	public void test_run_04() throws GclException {
		GclFile.Definition list = new GclFile.Definition.TypeDefn(name("List"), names("a"),
				Arrays.asList(new GclFile.TypeDefnCtor(name("Nil"), Collections.emptyList())), Loc.NONE);
		VerifyTask.Result r = new VerifyTask().run(program(Arrays.asList(list), DECLS, skip()));
		assertEquals(new Kind.Func(Kind.STAR, Kind.STAR), r.getKinds().get(name("List")));
		assertEquals(0, r.getObligations().size());
	}

	@Test
	public void test_error_01() {
		// Type errors stop verification
		GclFile.Program p = program(DECLS, assign("x", bool(true)));
		assertThrows(TypeError.UnifyFailed.class, () -> new VerifyTask().run(p));
	}

	@Test
	public void test_error_02() {
		GclFile.Program p = program(DECLS, assign("y", num(1)));
		assertThrows(TypeError.NotInScope.class, () -> new VerifyTask().run(p));
	}

	@Test
	public void test_error_03() {
		GclFile.Program p = program(DECLS, loop(gd(chain(var("x"), Symbol.LT, con("N")), skip())));
		GclException e = assertThrows(StructError.MissingAssertion.class, () -> new VerifyTask().run(p));
		assertEquals(GclException.Kind.STRUCT, e.getKind());
	}

	@Test
	public void test_error_04() {
		GclFile.Program inner = program(Collections.emptyList(), skip());
		GclFile.Program p = program(DECLS, new GclFile.Stmt.Block(inner, Loc.NONE));
		assertThrows(UnsupportedConstruct.class, () -> new VerifyTask().run(p));
	}
}
