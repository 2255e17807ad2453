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

import gclverify.core.GclException;
import gclverify.core.Loc;

/**
 * A problem with the structure of a program which prevents proof obligations
 * from being generated.
 */
public abstract class StructError extends GclException {
	private static final long serialVersionUID = 1L;

	public StructError(String message, Loc location) {
		super(message, location);
	}

	@Override
	public Kind getKind() {
		return Kind.STRUCT;
	}

	/**
	 * A loop which is not immediately preceded by a loop invariant.
	 */
	public static class MissingAssertion extends StructError {
		private static final long serialVersionUID = 1L;

		public MissingAssertion(Loc location) {
			super("missing loop invariant", location);
		}
	}

	public static class MultiDimArrayAssignment extends StructError {
		private static final long serialVersionUID = 1L;

		public MultiDimArrayAssignment(Loc location) {
			super("assignment to multi-dimensional arrays not supported", location);
		}
	}
}
