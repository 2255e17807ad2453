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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gclverify.core.TypedFile;

/**
 * A run of statements processed as a unit when generating proof obligations.
 * Statements are grouped so that every assertion, loop invariant and
 * specification hole stands alone, whilst maximal runs of other statements
 * form blocks. For example:
 *
 * <pre>
 * { P }         ASSERTION
 * x := 1        \
 * y := x        /  BLOCK
 * [! !]         SPEC
 * { Q }         ASSERTION
 * </pre>
 */
public final class Segment {
	public enum Kind {
		BLOCK, ASSERTION, SPEC
	}

	private final Kind kind;
	private final List<TypedFile.Stmt> stmts;

	private Segment(Kind kind, List<TypedFile.Stmt> stmts) {
		this.kind = kind;
		this.stmts = stmts;
	}

	public Kind getKind() {
		return kind;
	}

	public List<TypedFile.Stmt> getStatements() {
		return stmts;
	}

	/**
	 * Get the single statement of an assertion or specification segment.
	 *
	 * @return
	 */
	public TypedFile.Stmt getStatement() {
		return stmts.get(0);
	}

	/**
	 * Construct a block segment from the given statements.
	 *
	 * @param stmts
	 * @return
	 */
	public static Segment block(List<TypedFile.Stmt> stmts) {
		return new Segment(Kind.BLOCK, Collections.unmodifiableList(stmts));
	}

	public static List<Segment> group(List<TypedFile.Stmt> stmts) {
		ArrayList<Segment> segments = new ArrayList<>();
		ArrayList<TypedFile.Stmt> run = new ArrayList<>();
		for (TypedFile.Stmt s : stmts) {
			if (s instanceof TypedFile.Stmt.Assert || s instanceof TypedFile.Stmt.LoopInvariant) {
				flush(run, segments);
				segments.add(new Segment(Kind.ASSERTION, Collections.singletonList(s)));
			} else if (s instanceof TypedFile.Stmt.Spec) {
				flush(run, segments);
				segments.add(new Segment(Kind.SPEC, Collections.singletonList(s)));
			} else {
				run.add(s);
			}
		}
		flush(run, segments);
		return segments;
	}

	private static void flush(ArrayList<TypedFile.Stmt> run, List<Segment> segments) {
		if (!run.isEmpty()) {
			segments.add(block(new ArrayList<>(run)));
			run.clear();
		}
	}

	@Override
	public String toString() {
		return kind + stmts.toString();
	}
}
