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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import gclverify.core.GclException;
import gclverify.core.GclFile;
import gclverify.core.Kind;
import gclverify.core.Loc;
import gclverify.core.Name;
import gclverify.core.Operator;
import gclverify.core.Operator.Symbol;
import gclverify.core.Type;
import gclverify.tasks.VerifyTask;
import gclverify.types.TypeError;

public class JsonEncoderTests {
	private final JsonEncoder encoder = new JsonEncoder();

	@Test
	public void test_loc_01() {
		assertEquals("NoLoc", encoder.encode(Loc.NONE).get("tag").asText());
		Loc loc = new Loc("main.gcl", 1, 2, 1, 1, 7, 6);
		ObjectNode n = encoder.encode(loc);
		assertEquals("Loc", n.get("tag").asText());
		assertEquals("main.gcl", n.get("file").asText());
		assertEquals(2, n.get("start").get("column").asInt());
		assertEquals(6, n.get("end").get("offset").asInt());
		Loc back = encoder.decodeLoc(n);
		assertEquals(loc.getStartLine(), back.getStartLine());
		assertEquals(loc.getEndColumn(), back.getEndColumn());
		assertEquals("main.gcl", back.getFile());
	}

	@Test
	public void test_type_01() {
		ObjectNode n = encoder.encode(Type.FUNC(Type.INT, Type.BOOL));
		assertEquals("TApp", n.get("tag").asText());
		assertEquals("TApp", n.get("left").get("tag").asText());
		assertEquals("TOp", n.get("left").get("left").get("tag").asText());
		assertEquals("Int", n.get("left").get("right").get("base").asText());
		assertEquals("Bool", n.get("right").get("base").asText());
	}

	@Test
	public void test_type_02() throws JsonProcessingException {
		// Array bounds survive a trip through text
		Type t = array(new Type.App(new Type.Data(new Name("List")), new Type.Var(new Name("a"))));
		String json = encoder.toJson(encoder.encode(t));
		Type back = encoder.decodeType(encoder.parse(json));
		assertEquals("array [0 .. N) of List a", GclFilePrinter.toString(back));
	}

	@Test
	public void test_type_04() throws JsonProcessingException {
		// Locations survive a trip through text
		Loc outer = new Loc("main.gcl", 3, 5, 20, 3, 14, 29);
		Loc inner = new Loc("main.gcl", 3, 10, 25, 3, 13, 28);
		Loc named = new Loc("main.gcl", 3, 14, 29, 3, 14, 29);
		Type t = new Type.App(new Type.Base(Type.Base.Tag.INT, inner), new Type.Var(new Name("a", named)), outer);
		ObjectNode n = encoder.encode(t);
		assertEquals(3, n.get("loc").get("start").get("line").asInt());
		Type.App back = (Type.App) encoder.decodeType(encoder.parse(encoder.toJson(n)));
		assertEquals(5, back.getLoc().getStartColumn());
		assertEquals(29, back.getLoc().getEndOffset());
		assertEquals(10, back.getLeft().getLoc().getStartColumn());
		assertEquals("main.gcl", back.getLeft().getLoc().getFile());
		assertEquals(14, back.getRight().getLoc().getStartColumn());
	}

	@Test
	public void test_chain_01() {
		Loc loc = new Loc("main.gcl", 1, 1, 0, 1, 6, 5);
		GclFile.Chain c = new GclFile.Chain.More(new GclFile.Chain.Pure(var("x")), new Operator(Symbol.LT),
				num(0), loc);
		ObjectNode n = encoder.encode(new GclFile.Expr.Chain(c));
		JsonNode more = n.get("chain");
		assertEquals("More", more.get("tag").asText());
		assertEquals(6, more.get("loc").get("end").get("column").asInt());
	}

	@Test
	public void test_type_03() {
		ObjectNode n = encoder.encode(new Type.MetaVar(new Name("?t_0")));
		assertEquals("TMetaVar", n.get("tag").asText());
		assertEquals("?t_0", n.get("name").get("text").asText());
		assertThrows(IllegalArgumentException.class, () -> encoder.decodeType(encoder.encode(Loc.NONE)));
	}

	@Test
	public void test_kind_01() {
		ObjectNode n = encoder.encode(new Kind.Func(Kind.STAR, Kind.STAR));
		assertEquals("KFunc", n.get("tag").asText());
		assertEquals("KStar", n.get("from").get("tag").asText());
		assertEquals("KStar", n.get("to").get("tag").asText());
	}

	@Test
	public void test_expr_01() {
		ObjectNode n = encoder.encode(bin(Symbol.ADD, var("x"), num(1)));
		assertEquals("App", n.get("tag").asText());
		assertEquals("Num", n.get("argument").get("lit").get("tag").asText());
		assertEquals(1, n.get("argument").get("lit").get("value").asInt());
		JsonNode op = n.get("function").get("function").get("operator");
		assertEquals("ADD", op.get("symbol").asText());
		assertEquals("+", op.get("text").asText());
	}

	@Test
	public void test_results_01() throws GclException {
		VerifyTask.Result r = new VerifyTask().run(program(
				Arrays.asList(cons(Type.INT, "N"), vars(Type.INT, "x")),
				assertion(chain(var("x"), Symbol.GTE, num(0))), spec(Loc.NONE),
				assertion(chain(var("x"), Symbol.GT, num(0)))));
		ObjectNode spec = encoder.encode(r.getSpecifications().get(0));
		assertEquals("Specification", spec.get("tag").asText());
		assertEquals(0, spec.get("id").asInt());
		assertEquals("x ≥ 0", spec.get("pre").get("text").asText());
		assertEquals("Assertion", spec.get("pre").get("tag").asText());
		ArrayNode env = (ArrayNode) spec.get("environment");
		assertTrue(env.size() >= 2);
		boolean found = false;
		for (JsonNode entry : env) {
			if (entry.get("name").get("text").asText().equals("N")) {
				assertEquals("ConstTypeInfo", entry.get("tag").asText());
				found = true;
			}
		}
		assertTrue(found);
	}

	@Test
	public void test_results_02() throws GclException {
		VerifyTask.Result r = new VerifyTask().run(program(Arrays.asList(vars(Type.INT, "x")),
				assertion(chain(var("x"), Symbol.GTE, num(0))), assign("x", bin(Symbol.ADD, var("x"), num(1))),
				assertion(chain(var("x"), Symbol.GT, num(0)))));
		ObjectNode po = encoder.encode(r.getObligations().get(0));
		assertEquals("ProofObligation", po.get("tag").asText());
		assertEquals("ASSERTION", po.get("origin").get("tag").asText());
		assertEquals("Assertion", po.get("origin").get("label").asText());
		assertEquals(r.getObligations().get(0).getHash(), po.get("hash").asText());
		assertFalse(po.get("hash").asText().isEmpty());
	}

	@Test
	public void test_error_01() {
		TypeError e = new TypeError.NotInScope(new Name("y"));
		ObjectNode n = encoder.encode(e);
		assertEquals("TYPE", n.get("tag").asText());
		assertEquals("NotInScope", n.get("error").asText());
		assertEquals("y", n.get("name").get("text").asText());
	}

	@Test
	public void test_error_02() {
		TypeError e = new TypeError.UnifyFailed(Type.INT, Type.BOOL, Loc.NONE);
		ObjectNode n = encoder.encode(e);
		assertEquals("UnifyFailed", n.get("error").asText());
		assertEquals("Int", n.get("left").get("base").asText());
		assertEquals("Bool", n.get("right").get("base").asText());
	}
}
