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

/**
 * The root of all failures reported by the verifier. Every failure carries a
 * source location and a category. Each phase stops at its first failure, so a
 * run yields at most one of these.
 */
public abstract class GclException extends Exception {
	private static final long serialVersionUID = 1L;

	public enum Kind {
		PARSE, TYPE, STRUCT, CANNOT_READ_FILE, UNSUPPORTED, OTHERS
	}

	private final Loc location;

	public GclException(String message, Loc location) {
		super(message);
		this.location = location == null ? Loc.NONE : location;
	}

	/**
	 * Get the source location this failure is attributed to.
	 *
	 * @return
	 */
	public Loc getLocation() {
		return location;
	}

	/**
	 * Get the category of this failure.
	 *
	 * @return
	 */
	public abstract Kind getKind();

	/**
	 * A syntax error from the parser, passed through unchanged.
	 */
	public static class ParseError extends GclException {
		private static final long serialVersionUID = 1L;

		public ParseError(String message, Loc location) {
			super(message, location);
		}

		@Override
		public Kind getKind() {
			return Kind.PARSE;
		}
	}

	public static class CannotReadFile extends GclException {
		private static final long serialVersionUID = 1L;
		private final String path;

		public CannotReadFile(String path) {
			super("cannot read file " + path, Loc.NONE);
			this.path = path;
		}

		public String getPath() {
			return path;
		}

		@Override
		public Kind getKind() {
			return Kind.CANNOT_READ_FILE;
		}
	}

	public static class Others extends GclException {
		private static final long serialVersionUID = 1L;

		public Others(String message) {
			super(message, Loc.NONE);
		}

		@Override
		public Kind getKind() {
			return Kind.OTHERS;
		}
	}
}
