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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import gclverify.core.Name;
import gclverify.core.TypedFile.Expr;

/**
 * Determines the names occurring free in a typed expression. Both variables and
 * constants are reported, since substitution may replace either.
 */
public class FreeVariables extends AbstractExpressionFold<Set<String>> {

    private static final FreeVariables INSTANCE = new FreeVariables();

    public static Set<String> of(Expr expr) {
        return INSTANCE.visitExpression(expr);
    }

    public static Set<String> of(List<Expr> exprs) {
        Set<String> result = new LinkedHashSet<>();
        for (Expr e : exprs) {
            result.addAll(of(e));
        }
        return result;
    }

    @Override
    protected Set<String> constructVar(Expr.Var expr) {
        return Collections.singleton(expr.getName().getText());
    }

    @Override
    protected Set<String> constructConst(Expr.Const expr) {
        return Collections.singleton(expr.getName().getText());
    }

    @Override
    protected Set<String> constructLam(Expr.Lam expr, Set<String> body) {
        return remove(body, Collections.singletonList(expr.getParameter()));
    }

    @Override
    protected Set<String> constructQuant(Expr.Quant expr, Set<String> quantifier, Set<String> range, Set<String> body) {
        return join(quantifier, remove(join(range, body), expr.getBound()));
    }

    @Override
    public Set<String> join(Set<String> lhs, Set<String> rhs) {
        if (lhs.isEmpty()) {
            return rhs;
        } else if (rhs.isEmpty()) {
            return lhs;
        }
        Set<String> result = new LinkedHashSet<>(lhs);
        result.addAll(rhs);
        return result;
    }

    @Override
    public Set<String> BOTTOM() {
        return Collections.emptySet();
    }

    private static Set<String> remove(Set<String> names, List<Name> bound) {
        Set<String> result = new LinkedHashSet<>(names);
        for (Name n : bound) {
            result.remove(n.getText());
        }
        return result;
    }
}
