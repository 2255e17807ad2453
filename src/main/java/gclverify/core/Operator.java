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
 * An operator occurrence. Unicode and ASCII spellings of the same operator are
 * kept apart (e.g. <code>⇒</code> and <code>=&gt;</code>) so that a program
 * can be echoed back as written, though both spellings share a type.
 */
public final class Operator {

	public enum Symbol {
		// Chain operators
		EQ_PROP("≡", true), EQ_PROP_U("<=>", true), EQ("=", true), NEQ("≠", true), NEQ_U("/=", true),
		LTE("≤", true), LTE_U("<=", true), GTE("≥", true), GTE_U(">=", true), LT("<", true), GT(">", true),
		// Arithmetic and logical operators
		IMPLIES("⇒"), IMPLIES_U("=>"), CONJ("∧"), CONJ_U("&&"), DISJ("∨"), DISJ_U("||"), NEG("¬"), NEG_U("~"),
		NEG_NUM("-"), ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"), MAX("↑"), MIN("↓"), EXP("^"),
		HASH("#"),
		// Heap operators
		POINTS_TO("↦"), SCONJ("•"), SIMP("-*");

		private final String text;
		private final boolean chain;

		Symbol(String text) {
			this(text, false);
		}

		Symbol(String text, boolean chain) {
			this.text = text;
			this.chain = chain;
		}

		public String getText() {
			return text;
		}

		/**
		 * Check whether this operator may appear as a link in a comparison chain
		 * (e.g. <code>a &lt; b ≤ c</code>).
		 *
		 * @return
		 */
		public boolean isChainOp() {
			return chain;
		}

		/**
		 * Check whether this is a prefix operator.
		 *
		 * @return
		 */
		public boolean isUnary() {
			return this == NEG || this == NEG_U || this == NEG_NUM || this == HASH;
		}
	}

	private final Symbol symbol;
	private final Loc loc;

	public Operator(Symbol symbol) {
		this(symbol, Loc.NONE);
	}

	public Operator(Symbol symbol, Loc loc) {
		this.symbol = symbol;
		this.loc = loc == null ? Loc.NONE : loc;
	}

	public Symbol getSymbol() {
		return symbol;
	}

	public Loc getLoc() {
		return loc;
	}

	public boolean is(Symbol... symbols) {
		for (int i = 0; i != symbols.length; ++i) {
			if (symbols[i] == symbol) {
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean equals(Object o) {
		return (o instanceof Operator) && ((Operator) o).symbol == symbol;
	}

	@Override
	public int hashCode() {
		return symbol.hashCode();
	}

	@Override
	public String toString() {
		return symbol.getText();
	}
}
