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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import gclverify.core.GclException;
import gclverify.core.GclFile;
import gclverify.core.Kind;
import gclverify.core.Lit;
import gclverify.core.Loc;
import gclverify.core.Name;
import gclverify.core.Operator;
import gclverify.core.Type;
import gclverify.core.TypedFile;
import gclverify.core.UnsupportedConstruct;
import gclverify.types.TypeEnvironment;
import gclverify.types.TypeError;
import gclverify.types.TypeInfo;
import gclverify.wp.Pred;
import gclverify.wp.ProofObligation;
import gclverify.wp.Specification;
import gclverify.wp.StructWarning;

/**
 * Encodes the results of verification as JSON trees for consumption by an
 * editor front end. Every variant is written as an object with a
 * <code>"tag"</code> field naming it. Types (along with names and locations)
 * can also be decoded again.
 */
public class JsonEncoder {
	private final ObjectMapper mapper;

	public JsonEncoder() {
		this(new ObjectMapper());
	}

	public JsonEncoder(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public String toJson(JsonNode node) throws JsonProcessingException {
		return mapper.writeValueAsString(node);
	}

	public JsonNode parse(String json) throws JsonProcessingException {
		return mapper.readTree(json);
	}

	// =========================================================================
	// Locations and names
	// =========================================================================

	public ObjectNode encode(Loc loc) {
		if (loc == null || loc.isNone()) {
			return tagged("NoLoc");
		}
		ObjectNode n = tagged("Loc");
		n.put("file", loc.getFile());
		n.set("start", position(loc.getStartLine(), loc.getStartColumn(), loc.getStartOffset()));
		n.set("end", position(loc.getEndLine(), loc.getEndColumn(), loc.getEndOffset()));
		return n;
	}

	private ObjectNode position(int line, int column, int offset) {
		ObjectNode n = mapper.createObjectNode();
		n.put("line", line);
		n.put("column", column);
		n.put("offset", offset);
		return n;
	}

	public ObjectNode encode(Name name) {
		ObjectNode n = tagged("Name");
		n.put("text", name.getText());
		n.set("loc", encode(name.getLoc()));
		return n;
	}

	private ArrayNode encodeNames(List<Name> names) {
		ArrayNode arr = mapper.createArrayNode();
		for (Name n : names) {
			arr.add(encode(n));
		}
		return arr;
	}

	public Loc decodeLoc(JsonNode node) {
		String tag = tagOf(node);
		if (tag.equals("NoLoc")) {
			return Loc.NONE;
		} else if (tag.equals("Loc")) {
			JsonNode s = node.get("start");
			JsonNode e = node.get("end");
			String file = node.hasNonNull("file") ? node.get("file").asText() : null;
			return new Loc(file, s.get("line").asInt(), s.get("column").asInt(), s.get("offset").asInt(),
					e.get("line").asInt(), e.get("column").asInt(), e.get("offset").asInt());
		}
		throw new IllegalArgumentException("unknown location encountered (" + tag + ")");
	}

	public Name decodeName(JsonNode node) {
		expect(node, "Name");
		return new Name(node.get("text").asText(), decodeLoc(node.get("loc")));
	}

	// =========================================================================
	// Types and kinds
	// =========================================================================

	public ObjectNode encode(Type type) {
		ObjectNode n;
		if (type instanceof Type.Base) {
			n = tagged("TBase");
			n.put("base", ((Type.Base) type).getTag().getText());
		} else if (type instanceof Type.Array) {
			Type.Array t = (Type.Array) type;
			n = tagged("TArray");
			if (t.getInterval() != null) {
				n.set("interval", encode(t.getInterval()));
			}
			n.set("element", encode(t.getElement()));
		} else if (type instanceof Type.Tuple) {
			n = tagged("TTuple");
			n.put("arity", ((Type.Tuple) type).getArity());
		} else if (type instanceof Type.Arrow) {
			n = tagged("TOp");
		} else if (type instanceof Type.App) {
			Type.App t = (Type.App) type;
			n = tagged("TApp");
			n.set("left", encode(t.getLeft()));
			n.set("right", encode(t.getRight()));
		} else if (type instanceof Type.Data) {
			n = named("TData", ((Type.Data) type).getName());
		} else if (type instanceof Type.Var) {
			n = named("TVar", ((Type.Var) type).getName());
		} else if (type instanceof Type.MetaVar) {
			n = named("TMetaVar", ((Type.MetaVar) type).getName());
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + type.getClass().getName() + ")");
		}
		n.set("loc", encode(type.getLoc()));
		return n;
	}

	private ObjectNode encode(Type.Interval interval) {
		ObjectNode n = tagged("Interval");
		n.set("lower", encode(interval.getLower()));
		n.set("upper", encode(interval.getUpper()));
		n.set("loc", encode(interval.getLoc()));
		return n;
	}

	private ObjectNode encode(Type.Endpoint endpoint) {
		ObjectNode n = tagged(endpoint.isInclusive() ? "Including" : "Excluding");
		n.set("bound", encode(endpoint.getBound()));
		return n;
	}

	public Type decodeType(JsonNode node) {
		String tag = tagOf(node);
		Loc loc = node.has("loc") ? decodeLoc(node.get("loc")) : Loc.NONE;
		switch (tag) {
		case "TBase":
			String base = node.get("base").asText();
			for (Type.Base.Tag t : Type.Base.Tag.values()) {
				if (t.getText().equals(base)) {
					return new Type.Base(t, loc);
				}
			}
			throw new IllegalArgumentException("unknown base type encountered (" + base + ")");
		case "TArray":
			Type.Interval interval = node.has("interval") ? decodeInterval(node.get("interval")) : null;
			return new Type.Array(interval, decodeType(node.get("element")), loc);
		case "TTuple":
			return new Type.Tuple(node.get("arity").asInt(), loc);
		case "TOp":
			return new Type.Arrow(loc);
		case "TApp":
			return new Type.App(decodeType(node.get("left")), decodeType(node.get("right")), loc);
		case "TData":
			return new Type.Data(decodeName(node.get("name")));
		case "TVar":
			return new Type.Var(decodeName(node.get("name")));
		case "TMetaVar":
			return new Type.MetaVar(decodeName(node.get("name")));
		default:
			throw new IllegalArgumentException("unknown type encountered (" + tag + ")");
		}
	}

	private Type.Interval decodeInterval(JsonNode node) {
		expect(node, "Interval");
		return new Type.Interval(decodeEndpoint(node.get("lower")), decodeEndpoint(node.get("upper")),
				decodeLoc(node.get("loc")));
	}

	private Type.Endpoint decodeEndpoint(JsonNode node) {
		boolean inclusive = tagOf(node).equals("Including");
		return new Type.Endpoint(inclusive, decodeExpr(node.get("bound")));
	}

	public ObjectNode encode(Kind kind) {
		if (kind instanceof Kind.Star) {
			return tagged("KStar");
		} else if (kind instanceof Kind.Func) {
			Kind.Func k = (Kind.Func) kind;
			ObjectNode n = tagged("KFunc");
			n.set("from", encode(k.getFrom()));
			n.set("to", encode(k.getTo()));
			return n;
		} else if (kind instanceof Kind.MetaVar) {
			return named("KMetaVar", ((Kind.MetaVar) kind).getName());
		}
		throw new IllegalArgumentException("unknown kind encountered (" + kind.getClass().getName() + ")");
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public ObjectNode encode(Lit lit) {
		switch (lit.getKind()) {
		case NUM: {
			ObjectNode n = tagged("Num");
			n.put("value", (Integer) lit.getValue());
			return n;
		}
		case BOOL: {
			ObjectNode n = tagged("Bol");
			n.put("value", (Boolean) lit.getValue());
			return n;
		}
		case CHAR: {
			ObjectNode n = tagged("Chr");
			n.put("value", String.valueOf(lit.getValue()));
			return n;
		}
		default:
			return tagged("Emp");
		}
	}

	public ObjectNode encode(Operator op) {
		ObjectNode n = tagged("Operator");
		n.put("symbol", op.getSymbol().name());
		n.put("text", op.getSymbol().getText());
		n.set("loc", encode(op.getLoc()));
		return n;
	}

	public ObjectNode encode(GclFile.Expr e) {
		ObjectNode n;
		if (e instanceof GclFile.Expr.Lit) {
			n = tagged("Lit");
			n.set("lit", encode(((GclFile.Expr.Lit) e).getValue()));
		} else if (e instanceof GclFile.Expr.Var) {
			n = named("Var", ((GclFile.Expr.Var) e).getName());
		} else if (e instanceof GclFile.Expr.Const) {
			n = named("Const", ((GclFile.Expr.Const) e).getName());
		} else if (e instanceof GclFile.Expr.Op) {
			n = tagged("Op");
			n.set("operator", encode(((GclFile.Expr.Op) e).getOperator()));
		} else if (e instanceof GclFile.Expr.Chain) {
			n = tagged("Chain");
			n.set("chain", encode(((GclFile.Expr.Chain) e).getChain()));
		} else if (e instanceof GclFile.Expr.App) {
			GclFile.Expr.App a = (GclFile.Expr.App) e;
			n = tagged("App");
			n.set("function", encode(a.getFunction()));
			n.set("argument", encode(a.getArgument()));
		} else if (e instanceof GclFile.Expr.Lam) {
			GclFile.Expr.Lam l = (GclFile.Expr.Lam) e;
			n = tagged("Lam");
			n.set("parameter", encode(l.getParameter()));
			n.set("body", encode(l.getBody()));
		} else if (e instanceof GclFile.Expr.Quant) {
			GclFile.Expr.Quant q = (GclFile.Expr.Quant) e;
			n = tagged("Quant");
			n.set("quantifier", encode(q.getQuantifier()));
			n.set("bound", encodeNames(q.getBound()));
			n.set("range", encode(q.getRange()));
			n.set("body", encode(q.getBody()));
		} else if (e instanceof GclFile.Expr.ArrIdx) {
			GclFile.Expr.ArrIdx a = (GclFile.Expr.ArrIdx) e;
			n = tagged("ArrIdx");
			n.set("array", encode(a.getArray()));
			n.set("index", encode(a.getIndex()));
		} else if (e instanceof GclFile.Expr.ArrUpd) {
			GclFile.Expr.ArrUpd a = (GclFile.Expr.ArrUpd) e;
			n = tagged("ArrUpd");
			n.set("array", encode(a.getArray()));
			n.set("index", encode(a.getIndex()));
			n.set("value", encode(a.getValue()));
		} else if (e instanceof GclFile.Expr.Tuple) {
			n = tagged("Tuple");
			ArrayNode arr = n.putArray("elements");
			for (GclFile.Expr el : ((GclFile.Expr.Tuple) e).getElements()) {
				arr.add(encode(el));
			}
		} else if (e instanceof GclFile.Expr.Func) {
			n = named("Func", ((GclFile.Expr.Func) e).getName());
		} else if (e instanceof GclFile.Expr.Case) {
			n = tagged("Case");
			n.set("scrutinee", encode(((GclFile.Expr.Case) e).getScrutinee()));
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
		n.set("loc", encode(e.getLoc()));
		return n;
	}

	private ObjectNode encode(GclFile.Chain c) {
		if (c instanceof GclFile.Chain.Pure) {
			ObjectNode n = tagged("Pure");
			n.set("expr", encode(((GclFile.Chain.Pure) c).getExpr()));
			return n;
		} else {
			GclFile.Chain.More m = (GclFile.Chain.More) c;
			ObjectNode n = tagged("More");
			n.set("chain", encode(m.getChain()));
			n.set("operator", encode(m.getOperator()));
			n.set("expr", encode(m.getExpr()));
			n.set("loc", encode(m.getLoc()));
			return n;
		}
	}

	/**
	 * Decode an untyped expression. Only the forms which can appear as array
	 * bounds are supported (literals, variables, constants, operators and
	 * applications).
	 *
	 * @param node
	 * @return
	 */
	public GclFile.Expr decodeExpr(JsonNode node) {
		String tag = tagOf(node);
		Loc loc = node.has("loc") ? decodeLoc(node.get("loc")) : Loc.NONE;
		switch (tag) {
		case "Lit":
			return new GclFile.Expr.Lit(decodeLit(node.get("lit")), loc);
		case "Var":
			return new GclFile.Expr.Var(decodeName(node.get("name")));
		case "Const":
			return new GclFile.Expr.Const(decodeName(node.get("name")));
		case "Op": {
			JsonNode op = node.get("operator");
			Operator.Symbol symbol = Operator.Symbol.valueOf(op.get("symbol").asText());
			return new GclFile.Expr.Op(new Operator(symbol, decodeLoc(op.get("loc"))));
		}
		case "App":
			return new GclFile.Expr.App(decodeExpr(node.get("function")), decodeExpr(node.get("argument")), loc);
		default:
			throw new IllegalArgumentException("unsupported expression encountered (" + tag + ")");
		}
	}

	private Lit decodeLit(JsonNode node) {
		String tag = tagOf(node);
		switch (tag) {
		case "Num":
			return Lit.num(node.get("value").asInt());
		case "Bol":
			return Lit.bool(node.get("value").asBoolean());
		case "Chr":
			return Lit.chr(node.get("value").asText().charAt(0));
		case "Emp":
			return Lit.EMP;
		default:
			throw new IllegalArgumentException("unknown literal encountered (" + tag + ")");
		}
	}

	public ObjectNode encode(TypedFile.Expr e) {
		ObjectNode n;
		if (e instanceof TypedFile.Expr.Lit) {
			n = tagged("Lit");
			n.set("lit", encode(((TypedFile.Expr.Lit) e).getValue()));
		} else if (e instanceof TypedFile.Expr.Var) {
			n = named("Var", ((TypedFile.Expr.Var) e).getName());
		} else if (e instanceof TypedFile.Expr.Const) {
			n = named("Const", ((TypedFile.Expr.Const) e).getName());
		} else if (e instanceof TypedFile.Expr.Op) {
			n = tagged("Op");
			n.set("operator", encode(((TypedFile.Expr.Op) e).getOperator()));
		} else if (e instanceof TypedFile.Expr.Chain) {
			n = tagged("Chain");
			n.set("chain", encode(((TypedFile.Expr.Chain) e).getChain()));
		} else if (e instanceof TypedFile.Expr.App) {
			TypedFile.Expr.App a = (TypedFile.Expr.App) e;
			n = tagged("App");
			n.set("function", encode(a.getFunction()));
			n.set("argument", encode(a.getArgument()));
		} else if (e instanceof TypedFile.Expr.Lam) {
			TypedFile.Expr.Lam l = (TypedFile.Expr.Lam) e;
			n = tagged("Lam");
			n.set("parameter", encode(l.getParameter()));
			n.set("parameterType", encode(l.getParameterType()));
			n.set("body", encode(l.getBody()));
		} else if (e instanceof TypedFile.Expr.Quant) {
			TypedFile.Expr.Quant q = (TypedFile.Expr.Quant) e;
			n = tagged("Quant");
			n.set("quantifier", encode(q.getQuantifier()));
			n.set("bound", encodeNames(q.getBound()));
			n.set("range", encode(q.getRange()));
			n.set("body", encode(q.getBody()));
		} else if (e instanceof TypedFile.Expr.ArrIdx) {
			TypedFile.Expr.ArrIdx a = (TypedFile.Expr.ArrIdx) e;
			n = tagged("ArrIdx");
			n.set("array", encode(a.getArray()));
			n.set("index", encode(a.getIndex()));
		} else if (e instanceof TypedFile.Expr.ArrUpd) {
			TypedFile.Expr.ArrUpd a = (TypedFile.Expr.ArrUpd) e;
			n = tagged("ArrUpd");
			n.set("array", encode(a.getArray()));
			n.set("index", encode(a.getIndex()));
			n.set("value", encode(a.getValue()));
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
		Type type = e.getType();
		if (type != null) {
			n.set("type", encode(type));
		}
		n.set("loc", encode(e.getLoc()));
		return n;
	}

	private ObjectNode encode(TypedFile.Chain c) {
		if (c instanceof TypedFile.Chain.Pure) {
			ObjectNode n = tagged("Pure");
			n.set("expr", encode(((TypedFile.Chain.Pure) c).getExpr()));
			return n;
		} else {
			TypedFile.Chain.More m = (TypedFile.Chain.More) c;
			ObjectNode n = tagged("More");
			n.set("chain", encode(m.getChain()));
			n.set("operator", encode(m.getOperator()));
			n.set("expr", encode(m.getExpr()));
			n.set("loc", encode(m.getLoc()));
			return n;
		}
	}

	// =========================================================================
	// Verification results
	// =========================================================================

	public ObjectNode encode(Pred pred) {
		ObjectNode n;
		if (pred instanceof Pred.Constant) {
			n = tagged("Constant");
			n.set("expr", encode(pred.toExpr()));
		} else if (pred instanceof Pred.Assertion) {
			n = tagged("Assertion");
			n.set("expr", encode(pred.toExpr()));
		} else if (pred instanceof Pred.LoopInvariant) {
			Pred.LoopInvariant p = (Pred.LoopInvariant) pred;
			n = tagged("LoopInvariant");
			n.set("expr", encode(p.toExpr()));
			if (p.getBound() != null) {
				n.set("bound", encode(p.getBound()));
			}
		} else {
			throw new IllegalArgumentException("unknown predicate encountered (" + pred.getClass().getName() + ")");
		}
		n.put("text", GclFilePrinter.toString(pred.toExpr()));
		n.set("loc", encode(pred.getLoc()));
		return n;
	}

	public ObjectNode encode(ProofObligation po) {
		ObjectNode n = tagged("ProofObligation");
		n.set("pre", encode(po.getPre()));
		n.set("post", encode(po.getPost()));
		n.put("hash", po.getHash());
		ObjectNode origin = n.putObject("origin");
		origin.put("tag", po.getOrigin().getKind().name());
		origin.put("label", po.getLabel());
		origin.set("loc", encode(po.getOrigin().getLoc()));
		return n;
	}

	public ObjectNode encode(Specification spec) {
		ObjectNode n = tagged("Specification");
		n.put("id", spec.getId());
		n.set("pre", encode(spec.getPre()));
		n.set("post", encode(spec.getPost()));
		n.set("range", encode(spec.getRange()));
		n.set("environment", encode(spec.getEnvironment()));
		return n;
	}

	public ArrayNode encode(TypeEnvironment env) {
		ArrayNode arr = mapper.createArrayNode();
		for (Map.Entry<Name, TypeInfo> e : env.entries()) {
			TypeInfo info = e.getValue();
			String tag;
			if (info instanceof TypeInfo.TypeDefnCtor) {
				tag = "TypeDefnCtorInfo";
			} else if (info instanceof TypeInfo.Const) {
				tag = "ConstTypeInfo";
			} else {
				tag = "VarTypeInfo";
			}
			ObjectNode n = tagged(tag);
			n.set("name", encode(e.getKey()));
			n.set("type", encode(info.getType()));
			arr.add(n);
		}
		return arr;
	}

	public ObjectNode encode(StructWarning warning) {
		ObjectNode n = tagged(warning.getClass().getSimpleName());
		n.put("message", warning.getMessage());
		n.set("loc", encode(warning.getLoc()));
		return n;
	}

	public ObjectNode encode(GclException error) {
		ObjectNode n = tagged(error.getKind().name());
		n.put("error", error.getClass().getSimpleName());
		n.put("message", error.getMessage());
		n.set("loc", encode(error.getLocation()));
		if (error instanceof TypeError) {
			encodeDetails((TypeError) error, n);
		} else if (error instanceof UnsupportedConstruct) {
			n.put("construct", ((UnsupportedConstruct) error).getConstruct());
		} else if (error instanceof GclException.CannotReadFile) {
			n.put("path", ((GclException.CannotReadFile) error).getPath());
		}
		return n;
	}

	private void encodeDetails(TypeError error, ObjectNode n) {
		if (error instanceof TypeError.NotInScope) {
			n.set("name", encode(((TypeError.NotInScope) error).getName()));
		} else if (error instanceof TypeError.UnifyFailed) {
			TypeError.UnifyFailed e = (TypeError.UnifyFailed) error;
			n.set("left", encode(e.getLeft()));
			n.set("right", encode(e.getRight()));
		} else if (error instanceof TypeError.KindUnifyFailed) {
			TypeError.KindUnifyFailed e = (TypeError.KindUnifyFailed) error;
			n.set("left", encode(e.getLeft()));
			n.set("right", encode(e.getRight()));
		} else if (error instanceof TypeError.RecursiveType) {
			TypeError.RecursiveType e = (TypeError.RecursiveType) error;
			n.set("name", encode(e.getName()));
			n.set("type", encode(e.getType()));
		} else if (error instanceof TypeError.AssignToConst) {
			n.set("name", encode(((TypeError.AssignToConst) error).getName()));
		} else if (error instanceof TypeError.UndefinedType) {
			n.set("name", encode(((TypeError.UndefinedType) error).getName()));
		} else if (error instanceof TypeError.DuplicatedIdentifiers) {
			n.set("names", encodeNames(((TypeError.DuplicatedIdentifiers) error).getNames()));
		} else if (error instanceof TypeError.RedundantNames) {
			n.set("names", encodeNames(((TypeError.RedundantNames) error).getNames()));
		} else if (error instanceof TypeError.MissingArguments) {
			n.set("names", encodeNames(((TypeError.MissingArguments) error).getNames()));
		} else if (error instanceof TypeError.RedundantExprs) {
			List<ObjectNode> exprs = new ArrayList<>();
			for (GclFile.Expr e : ((TypeError.RedundantExprs) error).getExprs()) {
				exprs.add(encode(e));
			}
			n.putArray("exprs").addAll(exprs);
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private ObjectNode tagged(String tag) {
		ObjectNode n = mapper.createObjectNode();
		n.put("tag", tag);
		return n;
	}

	private ObjectNode named(String tag, Name name) {
		ObjectNode n = tagged(tag);
		n.set("name", encode(name));
		return n;
	}

	private static String tagOf(JsonNode node) {
		if (node == null || !node.has("tag")) {
			throw new IllegalArgumentException("missing tag in " + node);
		}
		return node.get("tag").asText();
	}

	private static void expect(JsonNode node, String tag) {
		String actual = tagOf(node);
		if (!actual.equals(tag)) {
			throw new IllegalArgumentException("expected " + tag + ", found " + actual);
		}
	}
}
