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

import java.util.List;

import gclverify.core.Type;
import gclverify.core.TypedFile.Chain;
import gclverify.core.TypedFile.Expr;

/**
 * A bottom-up rewrite of typed expressions. A node is only reconstructed when
 * one of its children, or its type, actually changes, so untouched subtrees
 * are shared between the input and output.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr> {

    /**
     * Rewrite a type attached to an expression. By default types are left
     * unchanged.
     *
     * @param type
     * @return
     */
    protected Type transformType(Type type) {
        return type;
    }

    @Override
    protected Expr constructLit(Expr.Lit expr) {
        Type type = transformType(expr.getType());
        if (type == expr.getType()) {
            return expr;
        } else {
            return new Expr.Lit(expr.getValue(), type, expr.getLoc());
        }
    }

    @Override
    protected Expr constructVar(Expr.Var expr) {
        Type type = transformType(expr.getType());
        if (type == expr.getType()) {
            return expr;
        } else {
            return new Expr.Var(expr.getName(), type, expr.getLoc());
        }
    }

    @Override
    protected Expr constructConst(Expr.Const expr) {
        Type type = transformType(expr.getType());
        if (type == expr.getType()) {
            return expr;
        } else {
            return new Expr.Const(expr.getName(), type, expr.getLoc());
        }
    }

    @Override
    protected Expr constructOp(Expr.Op expr) {
        Type type = transformType(expr.getType());
        if (type == expr.getType()) {
            return expr;
        } else {
            return new Expr.Op(expr.getOperator(), type);
        }
    }

    @Override
    protected Expr constructChain(Expr.Chain expr, List<Expr> operands) {
        Chain chain = rebuild(expr.getChain(), operands, operands.size() - 1);
        Type type = transformType(expr.getType());
        if (chain == expr.getChain() && type == expr.getType()) {
            return expr;
        } else {
            return new Expr.Chain(chain, type);
        }
    }

    private Chain rebuild(Chain chain, List<Expr> operands, int index) {
        if (chain instanceof Chain.Pure) {
            Chain.Pure c = (Chain.Pure) chain;
            Expr operand = operands.get(index);
            return operand == c.getExpr() ? c : new Chain.Pure(operand);
        } else {
            Chain.More c = (Chain.More) chain;
            Chain left = rebuild(c.getChain(), operands, index - 1);
            Expr.Op op = (Expr.Op) constructOp(c.getOperator());
            Expr operand = operands.get(index);
            if (left == c.getChain() && op == c.getOperator() && operand == c.getExpr()) {
                return c;
            } else {
                return new Chain.More(left, op, operand, c.getLoc());
            }
        }
    }

    @Override
    protected Expr constructApp(Expr.App expr, Expr function, Expr argument) {
        Type type = transformType(expr.getType());
        if (expr.getFunction() == function && expr.getArgument() == argument && type == expr.getType()) {
            return expr;
        } else {
            return new Expr.App(function, argument, type, expr.getLoc());
        }
    }

    @Override
    protected Expr constructLam(Expr.Lam expr, Expr body) {
        Type type = transformType(expr.getType());
        Type parameterType = transformType(expr.getParameterType());
        if (expr.getBody() == body && type == expr.getType() && parameterType == expr.getParameterType()) {
            return expr;
        } else {
            return new Expr.Lam(expr.getParameter(), parameterType, body, type, expr.getLoc());
        }
    }

    @Override
    protected Expr constructQuant(Expr.Quant expr, Expr quantifier, Expr range, Expr body) {
        Type type = transformType(expr.getType());
        if (expr.getQuantifier() == quantifier && expr.getRange() == range && expr.getBody() == body
                && type == expr.getType()) {
            return expr;
        } else {
            return new Expr.Quant(quantifier, expr.getBound(), range, body, type, expr.getLoc());
        }
    }

    @Override
    protected Expr constructArrIdx(Expr.ArrIdx expr, Expr array, Expr index) {
        Type type = transformType(expr.getType());
        if (expr.getArray() == array && expr.getIndex() == index && type == expr.getType()) {
            return expr;
        } else {
            return new Expr.ArrIdx(array, index, type, expr.getLoc());
        }
    }

    @Override
    protected Expr constructArrUpd(Expr.ArrUpd expr, Expr array, Expr index, Expr value) {
        Type type = transformType(expr.getType());
        if (expr.getArray() == array && expr.getIndex() == index && expr.getValue() == value
                && type == expr.getType()) {
            return expr;
        } else {
            return new Expr.ArrUpd(array, index, value, type, expr.getLoc());
        }
    }
}
