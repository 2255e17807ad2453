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
package gclverify.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gclverify.core.GclFile;
import gclverify.core.Kind;
import gclverify.core.Loc;
import gclverify.core.Name;
import gclverify.core.Type;
import gclverify.util.FreshNames;

public class KindInferenceTests {
	private static final Kind STAR = Kind.STAR;

	// data List a = Nil | Cons a (List a)
	private static final GclFile.Definition.TypeDefn LIST = data("List", Arrays.asList("a"),
			ctor("Nil"),
			ctor("Cons", tvar("a"), new Type.App(tdata("List"), tvar("a"))));

	@Test
	public void test_base_01() throws TypeError {
		KindInference ki = new KindInference(new FreshNames());
		assertEquals(STAR, ki.inferKind(Type.INT));
		assertEquals(STAR, ki.inferKind(new Type.Array(null, Type.BOOL)));
	}

	@Test
	public void test_arrow_01() throws TypeError {
		KindInference ki = new KindInference(new FreshNames());
		assertEquals(new Kind.Func(STAR, new Kind.Func(STAR, STAR)), ki.inferKind(Type.ARROW));
		assertEquals(STAR, ki.inferKind(Type.FUNC(Type.INT, Type.BOOL)));
	}

	@Test
	public void test_tuple_01() throws TypeError {
		KindInference ki = new KindInference(new FreshNames());
		assertEquals(new Kind.Func(STAR, new Kind.Func(STAR, STAR)), ki.inferKind(new Type.Tuple(2)));
	}

	@Test
	public void test_undefined_01() {
		KindInference ki = new KindInference(new FreshNames());
		TypeError.UndefinedType e = assertThrows(TypeError.UndefinedType.class, () -> ki.inferKind(tdata("Tree")));
		assertEquals(new Name("Tree"), e.getName());
	}

	@Test
	public void test_app_01() {
		// Int Int is ill-kinded
		KindInference ki = new KindInference(new FreshNames());
		assertThrows(TypeError.KindUnifyFailed.class, () -> ki.inferKind(new Type.App(Type.INT, Type.INT)));
	}

	@Test
	public void test_data_01() throws TypeError {
		KindInference ki = new KindInference(new FreshNames());
		Map<Name, Type> ctors = ki.inferDataTypes(Arrays.asList(LIST));
		assertEquals(new Kind.Func(STAR, STAR), ki.getKinds().get(new Name("List")));
		assertEquals(2, ctors.size());
		// Nil : List ?a
		Type nil = ctors.get(new Name("Nil"));
		assertTrue(nil instanceof Type.App);
		assertEquals(tdata("List"), ((Type.App) nil).getLeft());
		assertTrue(((Type.App) nil).getRight() instanceof Type.MetaVar);
		// Cons : ?a → List ?a → List ?a
		Type cons = ctors.get(new Name("Cons"));
		assertTrue(Type.isFunction(cons));
		assertEquals(((Type.App) nil).getRight(), Type.domain(cons));
	}

	@Test
	public void test_data_02() throws TypeError {
		// data T f = MkT (f Int)
		GclFile.Definition.TypeDefn t = data("T", Arrays.asList("f"),
				ctor("MkT", new Type.App(tvar("f"), Type.INT)));
		KindInference ki = new KindInference(new FreshNames());
		ki.inferDataTypes(Arrays.asList(t));
		Kind expected = new Kind.Func(new Kind.Func(STAR, STAR), STAR);
		assertEquals(expected, ki.getKinds().get(new Name("T")));
	}

	@Test
	public void test_data_03() throws TypeError {
		// Unconstrained parameters default to *
		GclFile.Definition.TypeDefn t = data("Phantom", Arrays.asList("a"), ctor("MkPhantom"));
		KindInference ki = new KindInference(new FreshNames());
		ki.inferDataTypes(Arrays.asList(t));
		assertEquals(new Kind.Func(STAR, STAR), ki.getKinds().get(new Name("Phantom")));
	}

	@Test
	public void test_data_04() throws TypeError {
		// Mutually recursive datatypes
		GclFile.Definition.TypeDefn even = data("Even", Collections.emptyList(), ctor("Zero"),
				ctor("SuccE", tdata("Odd")));
		GclFile.Definition.TypeDefn odd = data("Odd", Collections.emptyList(), ctor("SuccO", tdata("Even")));
		KindInference ki = new KindInference(new FreshNames());
		ki.inferDataTypes(Arrays.asList(even, odd));
		assertEquals(STAR, ki.getKinds().get(new Name("Even")));
		assertEquals(STAR, ki.getKinds().get(new Name("Odd")));
	}

	@Test
	public void test_data_05() {
		// data T a = MkT (a a) requires an infinite kind
		GclFile.Definition.TypeDefn t = data("T", Arrays.asList("a"), ctor("MkT", new Type.App(tvar("a"), tvar("a"))));
		KindInference ki = new KindInference(new FreshNames());
		assertThrows(TypeError.KindUnifyFailed.class, () -> ki.inferDataTypes(Arrays.asList(t)));
	}

	@Test
	public void test_data_06() {
		// data T = MkT (List Int Int) applies List to too many arguments
		Type bad = new Type.App(new Type.App(tdata("List"), Type.INT), Type.INT);
		GclFile.Definition.TypeDefn t = data("T", Collections.emptyList(), ctor("MkT", bad));
		KindInference ki = new KindInference(new FreshNames());
		assertThrows(TypeError.KindUnifyFailed.class, () -> ki.inferDataTypes(Arrays.asList(LIST, t)));
	}

	@Test
	public void test_star_01() throws TypeError {
		// Type variables range over types of kind *, and are not left annotated
		KindInference ki = new KindInference(new FreshNames());
		ki.inferDataTypes(Arrays.asList(LIST));
		ki.checkStar(Type.FUNC(tvar("a"), new Type.App(tdata("List"), tvar("a"))));
		assertNull(ki.getContext().lookup(new Name("a")));
	}

	@Test
	public void test_star_02() throws TypeError {
		KindInference ki = new KindInference(new FreshNames());
		ki.inferDataTypes(Arrays.asList(LIST));
		assertThrows(TypeError.KindUnifyFailed.class, () -> ki.checkStar(tdata("List")));
	}

	@Test
	public void test_star_03() {
		KindInference ki = new KindInference(new FreshNames());
		assertThrows(TypeError.UndefinedType.class, () -> ki.checkStar(new Type.Array(null, tdata("Foo"))));
	}

	@Test
	public void test_unknown_01() {
		// A metavariable the context has never seen
		KindInference ki = new KindInference(new FreshNames());
		Kind.MetaVar k = new Kind.MetaVar(new Name("?k_99"));
		assertThrows(IllegalStateException.class, () -> ki.unifyKind(k, STAR));
	}

	@Test
	public void test_context_01() throws TypeError {
		// Parameter annotations are removed, and no name is annotated twice
		KindInference ki = new KindInference(new FreshNames());
		ki.inferDataTypes(Arrays.asList(LIST));
		List<Name> annotated = new ArrayList<>();
		for (KindContext.Slot s : ki.getContext().getSlots()) {
			if (s.getTag() == KindContext.Slot.Tag.ANNOTATED) {
				annotated.add(s.getName());
			}
			assertFalse(s.getTag() == KindContext.Slot.Tag.UNSOLVED);
		}
		assertEquals(Arrays.asList(new Name("List")), annotated);
		assertEquals(annotated.size(), new HashSet<>(annotated).size());
	}

	@Test
	public void test_context_02() {
		KindContext ctx = new KindContext();
		ctx.annotate(new Name("T"), STAR);
		assertThrows(IllegalArgumentException.class, () -> ctx.annotate(new Name("T"), STAR));
	}

	@Test
	public void test_context_03() {
		KindContext ctx = new KindContext();
		Name a = new Name("?k_0");
		Name b = new Name("?k_1");
		ctx.addUnsolved(a);
		ctx.addUnsolved(b);
		ctx.solve(a, new Kind.Func(new Kind.MetaVar(b), STAR));
		assertNull(ctx.solution(b));
		ctx.solve(b, STAR);
		assertEquals(new Kind.Func(STAR, STAR), ctx.resolve(new Kind.MetaVar(a)));
		assertFalse(ctx.isUnsolved(a));
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private static Type tvar(String n) {
		return new Type.Var(new Name(n));
	}

	private static Type tdata(String n) {
		return new Type.Data(new Name(n));
	}

	private static GclFile.TypeDefnCtor ctor(String name, Type... args) {
		return new GclFile.TypeDefnCtor(new Name(name), Arrays.asList(args));
	}

	private static GclFile.Definition.TypeDefn data(String name, List<String> params,
			GclFile.TypeDefnCtor... ctors) {
		List<Name> ps = new ArrayList<>();
		for (String p : params) {
			ps.add(new Name(p));
		}
		return new GclFile.Definition.TypeDefn(new Name(name), ps, Arrays.asList(ctors), Loc.NONE);
	}
}
