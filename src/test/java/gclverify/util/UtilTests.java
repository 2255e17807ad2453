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

import static gclverify.GclSyntax.names;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import gclverify.core.Loc;
import gclverify.core.Name;

public class UtilTests {

	@Test
	public void test_duplicates_01() {
		assertTrue(Util.duplicates(names("x", "y", "z")).isEmpty());
	}

	@Test
	public void test_duplicates_02() {
		// Each duplicate is reported once, at its first occurrence
		Loc first = new Loc("main.gcl", 1, 5, 4, 1, 5, 4);
		Loc second = new Loc("main.gcl", 2, 5, 14, 2, 5, 14);
		List<Name> dups = Util.duplicates(Arrays.asList(new Name("x", first), new Name("y"), new Name("x", second),
				new Name("x"), new Name("y")));
		assertEquals(2, dups.size());
		assertEquals("x", dups.get(0).getText());
		assertEquals(1, dups.get(0).getLoc().getStartLine());
		assertEquals("y", dups.get(1).getText());
	}

	@Test
	public void test_text_01() {
		assertEquals(Arrays.asList("a", "b"), Util.text(names("a", "b")));
	}
}
