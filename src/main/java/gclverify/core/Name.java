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
 * An identifier together with the location it was written at. Two names are
 * equal whenever their text is equal, regardless of location.
 */
public final class Name {
	private final String text;
	private final Loc loc;

	public Name(String text) {
		this(text, Loc.NONE);
	}

	public Name(String text, Loc loc) {
		if (text == null) {
			throw new IllegalArgumentException("invalid name");
		}
		this.text = text;
		this.loc = loc == null ? Loc.NONE : loc;
	}

	public String getText() {
		return text;
	}

	public Loc getLoc() {
		return loc;
	}

	@Override
	public boolean equals(Object o) {
		return (o instanceof Name) && ((Name) o).text.equals(text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public String toString() {
		return text;
	}
}
