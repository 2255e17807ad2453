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
package gclverify.core;

import java.util.Objects;

/**
 * A source range within a given file. Locations are attached to every node
 * produced by the parser and are carried through to diagnostics, proof
 * obligations and specification holes. They are metadata only, and never
 * take part in the identity of names or types.
 */
public final class Loc {
	/**
	 * Represents the absence of a location (e.g. for nodes synthesised during
	 * weakest precondition calculation).
	 */
	public static final Loc NONE = new Loc(null, 0, 0, 0, 0, 0, 0);

	private final String file;
	private final int startLine;
	private final int startColumn;
	private final int startOffset;
	private final int endLine;
	private final int endColumn;
	private final int endOffset;

	public Loc(String file, int startLine, int startColumn, int startOffset, int endLine, int endColumn,
			int endOffset) {
		this.file = file;
		this.startLine = startLine;
		this.startColumn = startColumn;
		this.startOffset = startOffset;
		this.endLine = endLine;
		this.endColumn = endColumn;
		this.endOffset = endOffset;
	}

	/**
	 * Construct a location covering a single line.
	 *
	 * @param file
	 * @param line
	 * @param startColumn
	 * @param endColumn
	 * @return
	 */
	public static Loc line(String file, int line, int startColumn, int endColumn) {
		return new Loc(file, line, startColumn, 0, line, endColumn, 0);
	}

	public boolean isNone() {
		return file == null;
	}

	public String getFile() {
		return file;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndColumn() {
		return endColumn;
	}

	public int getEndOffset() {
		return endOffset;
	}

	/**
	 * Construct the smallest location spanning both this and another location.
	 * Joining with <code>NONE</code> yields the other operand.
	 *
	 * @param other
	 * @return
	 */
	public Loc join(Loc other) {
		if (other == null || other.isNone()) {
			return this;
		} else if (isNone()) {
			return other;
		}
		Loc start = startOffset <= other.startOffset ? this : other;
		Loc end = endOffset >= other.endOffset ? this : other;
		return new Loc(file, start.startLine, start.startColumn, start.startOffset, end.endLine, end.endColumn,
				end.endOffset);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Loc)) {
			return false;
		}
		Loc l = (Loc) o;
		return Objects.equals(file, l.file) && startLine == l.startLine && startColumn == l.startColumn
				&& startOffset == l.startOffset && endLine == l.endLine && endColumn == l.endColumn
				&& endOffset == l.endOffset;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startLine, startColumn, startOffset, endLine, endColumn, endOffset);
	}

	@Override
	public String toString() {
		if (isNone()) {
			return "<no location>";
		}
		return file + ":" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
	}
}
