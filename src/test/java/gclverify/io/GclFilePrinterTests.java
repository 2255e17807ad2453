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

import static gclverify.GclSyntax.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import gclverify.core.GclException;
import gclverify.core.Kind;
import gclverify.core.Name;
import gclverify.core.Operator.Symbol;
import gclverify.core.Type;
import gclverify.core.TypedFile;
import gclverify.types.Elaborator;

public class GclFilePrinterTests {
	private static final Type LIST = new Type.Data(new Name("List"));

	@Test
	public void test_type_01() {
		assertEquals("Int → Bool", GclFilePrinter.toString(Type.FUNC(Type.INT, Type.BOOL)));
		assertEquals("Int → Int → Int", GclFilePrinter.toString(Type.FUNC(Type.INT, Type.INT, Type.INT)));
		assertEquals("(Int → Int) → Int",
				GclFilePrinter.toString(Type.FUNC(Type.FUNC(Type.INT, Type.INT), Type.INT)));
	}

	@Test
	public void test_type_02() {
		assertEquals("List Int", GclFilePrinter.toString(new Type.App(LIST, Type.INT)));
		assertEquals("List (List Char)",
				GclFilePrinter.toString(new Type.App(LIST, new Type.App(LIST, Type.CHAR))));
	}

	@Test
	public void test_type_03() {
		assertEquals("array [0 .. N) of Int", GclFilePrinter.toString(array(Type.INT)));
		assertEquals("array ? of Bool", GclFilePrinter.toString(new Type.Array(null, Type.BOOL)));
		assertEquals("(→)", GclFilePrinter.toString(Type.ARROW));
		assertEquals("(,)", GclFilePrinter.toString(new Type.Tuple(2)));
	}

	@Test
	public void test_kind_01() {
		Kind k = new Kind.Func(Kind.STAR, Kind.STAR);
		assertEquals("*", GclFilePrinter.toString(Kind.STAR));
		assertEquals("* → *", GclFilePrinter.toString(k));
		assertEquals("(* → *) → *", GclFilePrinter.toString(new Kind.Func(k, Kind.STAR)));
		assertEquals("* → * → *", GclFilePrinter.toString(new Kind.Func(Kind.STAR, k)));
	}

	@Test
	public void test_untyped_01() {
		assertEquals("x + 1", GclFilePrinter.toString(bin(Symbol.ADD, var("x"), num(1))));
		assertEquals("(x + 1) * y",
				GclFilePrinter.toString(bin(Symbol.MUL, bin(Symbol.ADD, var("x"), num(1)), var("y"))));
		assertEquals("¬p", GclFilePrinter.toString(not(var("p"))));
	}

	@Test
	public void test_untyped_02() {
		assertEquals("0 ≤ i < N", GclFilePrinter.toString(chain(num(0), Symbol.LTE, var("i"), Symbol.LT, con("N"))));
		assertEquals("⟨Σ i : 0 ≤ i : A[i]⟩", GclFilePrinter.toString(quant(Symbol.ADD, names("i"),
				chain(num(0), Symbol.LTE, var("i")), idx(var("A"), var("i")))));
		assertEquals("(A : i ↦ 0)", GclFilePrinter.toString(upd(var("A"), var("i"), num(0))));
		assertEquals("λ z → z + 1", GclFilePrinter.toString(lam("z", bin(Symbol.ADD, var("z"), num(1)))));
	}

	@Test
	public void test_typed_01() {
		TypedFile.Expr x = TypedFile.VAR("x", Type.INT);
		TypedFile.Expr e = TypedFile.IMPLIES(TypedFile.LT(x, TypedFile.NUMBER(0)), TypedFile.FALSE);
		assertEquals("(x < 0) ⇒ false", GclFilePrinter.toString(e));
		assertEquals("¬(x < 0)", GclFilePrinter.toString(TypedFile.NEG(TypedFile.LT(x, TypedFile.NUMBER(0)))));
	}

	@Test
	public void test_typed_02() {
		TypedFile.Expr x = TypedFile.VAR("x", Type.INT);
		TypedFile.Expr e = TypedFile.FORALL(Arrays.asList(new Name("x")), TypedFile.TRUE,
				TypedFile.GTE(x, TypedFile.NUMBER(0)));
		assertEquals("⟨∀ x : true : x ≥ 0⟩", GclFilePrinter.toString(e));
	}

	@Test
	public void test_program_01() throws GclException {
		TypedFile.Program p = new Elaborator().elaborate(program(
				Arrays.asList(cons(Type.INT, "N"), vars(Type.INT, "x")),
				assertion(chain(var("x"), Symbol.EQ, num(0))), invariant(chain(var("x"), Symbol.LTE, con("N")),
						bin(Symbol.SUB, con("N"), var("x"))),
				loop(gd(chain(var("x"), Symbol.LT, con("N")), assign("x", bin(Symbol.ADD, var("x"), num(1)))))));
		String text = GclFilePrinter.toString(p);
		assertTrue(text.contains("con N : Int"));
		assertTrue(text.contains("var x : Int"));
		assertTrue(text.contains("{ x = 0 }"));
		assertTrue(text.contains("{ x ≤ N, bnd: N - x }"));
		assertTrue(text.contains("do x < N →"));
		assertTrue(text.contains("  x := x + 1"));
		assertTrue(text.contains("od"));
	}
}
