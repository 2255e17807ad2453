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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gclverify.core.Name;
import gclverify.core.Type;

public class SubstitutionTests {
	private static final Name A = new Name("a");
	private static final Name B = new Name("b");
	private static final Type.Var VA = new Type.Var(A);
	private static final Type.Var VB = new Type.Var(B);

	@Test
	public void test_apply_01() {
		Substitution s = Substitution.singleton(A, Type.INT);
		assertEquals(Type.INT, s.apply(VA));
		assertEquals(VB, s.apply(VB));
	}

	@Test
	public void test_apply_02() {
		Substitution s = Substitution.singleton(A, Type.BOOL);
		assertEquals(Type.FUNC(Type.BOOL, VB), s.apply(Type.FUNC(VA, VB)));
	}

	@Test
	public void test_apply_03() {
		// Meta variables are substituted like any other variable
		Substitution s = Substitution.singleton(A, Type.CHAR);
		assertEquals(Type.CHAR, s.apply(new Type.MetaVar(A)));
	}

	@Test
	public void test_apply_04() {
		Type.Array arr = new Type.Array(null, VA);
		Type result = Substitution.singleton(A, Type.INT).apply(arr);
		assertEquals(new Type.Array(null, Type.INT), result);
	}

	@Test
	public void test_apply_05() {
		Type t = Type.FUNC(Type.INT, Type.BOOL);
		assertSame(t, Substitution.singleton(A, Type.CHAR).apply(t));
	}

	@Test
	public void test_compose_01() {
		// (s1 ∘ s2)(t) = s1(s2(t))
		Substitution s1 = Substitution.singleton(B, Type.INT);
		Substitution s2 = Substitution.singleton(A, Type.FUNC(VB, VB));
		Substitution s = s1.compose(s2);
		Type t = Type.FUNC(VA, VB);
		assertEquals(s1.apply(s2.apply(t)), s.apply(t));
		assertEquals(Type.FUNC(Type.INT, Type.INT), s.get(A));
	}

	@Test
	public void test_compose_02() {
		// Left operand wins on collision
		Substitution s1 = Substitution.singleton(A, Type.INT);
		Substitution s2 = Substitution.singleton(A, Type.BOOL);
		assertEquals(Type.INT, s1.compose(s2).get(A));
		assertEquals(Type.BOOL, s2.compose(s1).get(A));
	}

	@Test
	public void test_compose_03() {
		Substitution s = Substitution.singleton(A, Type.INT);
		assertSame(s, s.compose(Substitution.EMPTY));
		assertEquals(s, Substitution.EMPTY.compose(s));
	}

	@Test
	public void test_compose_04() {
		// Composition is associative
		Name c = new Name("c");
		Substitution s1 = Substitution.singleton(c, Type.CHAR);
		Substitution s2 = Substitution.singleton(B, new Type.Var(c));
		Substitution s3 = Substitution.singleton(A, Type.FUNC(VB, new Type.Var(c)));
		Type t = Type.FUNC(VA, VB);
		Type left = s1.compose(s2).compose(s3).apply(t);
		Type right = s1.compose(s2.compose(s3)).apply(t);
		assertEquals(left, right);
		assertEquals(Type.FUNC(Type.FUNC(Type.CHAR, Type.CHAR), Type.CHAR), left);
	}

	@Test
	public void test_of_01() {
		Map<Name, Type> m = new LinkedHashMap<>();
		m.put(A, Type.INT);
		m.put(B, Type.BOOL);
		Substitution s = Substitution.of(m);
		m.clear();
		assertEquals(2, s.size());
		assertTrue(s.domain().contains(A));
		assertEquals(Type.BOOL, s.apply(VB));
	}
}
