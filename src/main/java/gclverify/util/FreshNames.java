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

import java.util.Collection;

import gclverify.core.Loc;
import gclverify.core.Name;

/**
 * Supplies names which are guaranteed unique within a session. Fresh names
 * begin with <code>?</code>, which cannot appear in a user identifier, and end
 * with the value of a counter which only ever increases.
 */
public class FreshNames {
    private int counter;

    public FreshNames() {
        this.counter = 0;
    }

    /**
     * Generate a name never returned before by this supply, derived from a
     * human-readable hint (e.g. <code>?t_3</code>).
     *
     * @param hint
     * @return
     */
    public Name fresh(String hint) {
        return fresh(hint, Loc.NONE);
    }

    public Name fresh(String hint, Loc loc) {
        return new Name("?" + hint + "_" + (counter++), loc);
    }

    /**
     * Get the number of names generated so far.
     *
     * @return
     */
    public int count() {
        return counter;
    }

    /**
     * Choose a name visible in none of the given scopes. The prefix itself is
     * tried first, followed by <code>prefix0</code>, <code>prefix1</code> and so
     * on. This is used for bound variables introduced into predicates, which
     * should remain readable.
     *
     * @param prefix
     * @param scopes
     * @return
     */
    public static String freshInScope(String prefix, Collection<? extends Collection<String>> scopes) {
        if (!visible(prefix, scopes)) {
            return prefix;
        }
        for (int i = 0;; ++i) {
            String candidate = prefix + i;
            if (!visible(candidate, scopes)) {
                return candidate;
            }
        }
    }

    private static boolean visible(String name, Collection<? extends Collection<String>> scopes) {
        for (Collection<String> scope : scopes) {
            if (scope.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
