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

import gclverify.core.TypedFile.Expr;
import java.util.List;

/**
 * Reduces a typed expression to a single value by joining the values of its
 * children. Leaves produce <code>BOTTOM()</code> unless overridden.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructLit(Expr.Lit expr) {
        return BOTTOM();
    }

    @Override
    protected E constructVar(Expr.Var expr) {
        return BOTTOM();
    }

    @Override
    protected E constructConst(Expr.Const expr) {
        return BOTTOM();
    }

    @Override
    protected E constructOp(Expr.Op expr) {
        return BOTTOM();
    }

    @Override
    protected E constructChain(Expr.Chain expr, List<E> operands) {
        return join(operands);
    }

    @Override
    protected E constructApp(Expr.App expr, E function, E argument) {
        return join(function, argument);
    }

    @Override
    protected E constructLam(Expr.Lam expr, E body) {
        return body;
    }

    @Override
    protected E constructQuant(Expr.Quant expr, E quantifier, E range, E body) {
        return join(quantifier, join(range, body));
    }

    @Override
    protected E constructArrIdx(Expr.ArrIdx expr, E array, E index) {
        return join(array, index);
    }

    @Override
    protected E constructArrUpd(Expr.ArrUpd expr, E array, E index, E value) {
        return join(array, join(index, value));
    }

    protected E join(List<E> operands) {
        E result = BOTTOM();
        for (int i = 0; i != operands.size(); ++i) {
            result = join(result, operands.get(i));
        }
        return result;
    }

    public abstract E join(E lhs, E rhs);

    public abstract E BOTTOM();
}
