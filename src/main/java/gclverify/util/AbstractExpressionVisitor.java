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

import gclverify.core.TypedFile.Chain;
import gclverify.core.TypedFile.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * A generic bottom-up traversal over typed expressions. Each
 * <code>visitXXX</code> method visits the children of a node and hands their
 * results to the corresponding <code>constructXXX</code> method.
 *
 * @param <E> the result of visiting an expression
 */
public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if(expr instanceof Expr.Lit) {
            return constructLit((Expr.Lit) expr);
        } else if(expr instanceof Expr.Var) {
            return constructVar((Expr.Var) expr);
        } else if(expr instanceof Expr.Const) {
            return constructConst((Expr.Const) expr);
        } else if(expr instanceof Expr.Op) {
            return constructOp((Expr.Op) expr);
        } else if(expr instanceof Expr.Chain) {
            return visitChain((Expr.Chain) expr);
        } else if(expr instanceof Expr.App) {
            return visitApp((Expr.App) expr);
        } else if(expr instanceof Expr.Lam) {
            return visitLam((Expr.Lam) expr);
        } else if(expr instanceof Expr.Quant) {
            return visitQuant((Expr.Quant) expr);
        } else if(expr instanceof Expr.ArrIdx) {
            return visitArrIdx((Expr.ArrIdx) expr);
        } else if(expr instanceof Expr.ArrUpd) {
            return visitArrUpd((Expr.ArrUpd) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitChain(Expr.Chain expr) {
        List<E> operands = new ArrayList<>();
        visitLinks(expr.getChain(), operands);
        return constructChain(expr, operands);
    }

    /**
     * Visit the operands of a chain from left to right, skipping the operators.
     *
     * @param chain
     * @param operands
     */
    private void visitLinks(Chain chain, List<E> operands) {
        if(chain instanceof Chain.Pure) {
            operands.add(visitExpression(((Chain.Pure) chain).getExpr()));
        } else {
            Chain.More more = (Chain.More) chain;
            visitLinks(more.getChain(), operands);
            operands.add(visitExpression(more.getExpr()));
        }
    }

    protected E visitApp(Expr.App expr) {
        E function = visitExpression(expr.getFunction());
        E argument = visitExpression(expr.getArgument());
        return constructApp(expr, function, argument);
    }

    protected E visitLam(Expr.Lam expr) {
        E body = visitExpression(expr.getBody());
        return constructLam(expr, body);
    }

    protected E visitQuant(Expr.Quant expr) {
        E quantifier = visitExpression(expr.getQuantifier());
        E range = visitExpression(expr.getRange());
        E body = visitExpression(expr.getBody());
        return constructQuant(expr, quantifier, range, body);
    }

    protected E visitArrIdx(Expr.ArrIdx expr) {
        E array = visitExpression(expr.getArray());
        E index = visitExpression(expr.getIndex());
        return constructArrIdx(expr, array, index);
    }

    protected E visitArrUpd(Expr.ArrUpd expr) {
        E array = visitExpression(expr.getArray());
        E index = visitExpression(expr.getIndex());
        E value = visitExpression(expr.getValue());
        return constructArrUpd(expr, array, index, value);
    }

    protected abstract E constructLit(Expr.Lit expr);

    protected abstract E constructVar(Expr.Var expr);

    protected abstract E constructConst(Expr.Const expr);

    protected abstract E constructOp(Expr.Op expr);

    protected abstract E constructChain(Expr.Chain expr, List<E> operands);

    protected abstract E constructApp(Expr.App expr, E function, E argument);

    protected abstract E constructLam(Expr.Lam expr, E body);

    protected abstract E constructQuant(Expr.Quant expr, E quantifier, E range, E body);

    protected abstract E constructArrIdx(Expr.ArrIdx expr, E array, E index);

    protected abstract E constructArrUpd(Expr.ArrUpd expr, E array, E index, E value);
}
