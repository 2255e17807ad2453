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
 * Signals a construct which the parser accepts but which has no elaboration
 * or verification rule yet (e.g. tuples, pattern matching and nested blocks).
 * This is kept apart from {@link gclverify.types.TypeError} since it does not
 * indicate a defect in the user's program.
 */
public class UnsupportedConstruct extends GclException {
	private static final long serialVersionUID = 1L;
	private final String construct;

	public UnsupportedConstruct(String construct, Loc location) {
		super(construct + " not supported", location);
		this.construct = construct;
	}

	/**
	 * Get the name of the unsupported construct.
	 *
	 * @return
	 */
	public String getConstruct() {
		return construct;
	}

	@Override
	public Kind getKind() {
		return Kind.UNSUPPORTED;
	}
}
