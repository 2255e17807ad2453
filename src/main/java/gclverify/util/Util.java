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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import gclverify.core.Name;

public class Util {

    /**
     * Determine the names which occur more than once in a list, reporting the
     * first occurrence of each.
     *
     * @param names
     * @return
     */
    public static List<Name> duplicates(List<Name> names) {
        ArrayList<Name> result = new ArrayList<>();
        Set<Name> seen = new LinkedHashSet<>();
        for (int i = 0; i != names.size(); ++i) {
            Name n = names.get(i);
            if (!seen.add(n) && !result.contains(n)) {
                // report the first occurrence, which carries the earliest location
                for (Name m : names) {
                    if (m.equals(n)) {
                        result.add(m);
                        break;
                    }
                }
            }
        }
        return result;
    }

    /**
     * Extract the text of each name in a list.
     *
     * @param names
     * @return
     */
    public static List<String> text(List<Name> names) {
        ArrayList<String> rs = new ArrayList<>();
        for (Name n : names) {
            rs.add(n.getText());
        }
        return rs;
    }
}
