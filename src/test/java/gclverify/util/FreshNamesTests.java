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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class FreshNamesTests {

	@Test
	public void test_fresh_01() {
		FreshNames fresh = new FreshNames();
		assertEquals("?t_0", fresh.fresh("t").getText());
		assertEquals("?t_1", fresh.fresh("t").getText());
		assertEquals("?k_2", fresh.fresh("k").getText());
		assertEquals(3, fresh.count());
	}

	@Test
	public void test_fresh_02() {
		FreshNames fresh = new FreshNames();
		assertNotEquals(fresh.fresh("a"), fresh.fresh("a"));
	}

	@Test
	public void test_inScope_01() {
		List<Set<String>> scopes = Arrays.asList(new HashSet<>(Arrays.asList("y")));
		assertEquals("x", FreshNames.freshInScope("x", scopes));
	}

	@Test
	public void test_inScope_02() {
		List<Set<String>> scopes = Arrays.asList(new HashSet<>(Arrays.asList("x", "x0")));
		assertEquals("x1", FreshNames.freshInScope("x", scopes));
	}

	@Test
	public void test_inScope_03() {
		// Names taken in any scope are avoided
		List<Set<String>> scopes = Arrays.asList(Collections.singleton("x"), Collections.singleton("x0"),
				Collections.singleton("x1"));
		assertEquals("x2", FreshNames.freshInScope("x", scopes));
	}

	@Test
	public void test_inScope_04() {
		assertEquals("bnd", FreshNames.freshInScope("bnd", Collections.emptyList()));
	}
}
