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
import java.util.List;

import gclverify.core.Name;
import gclverify.core.TypedFile;
import gclverify.core.TypedFile.Expr;
import gclverify.core.TypedFile.GdCmd;
import gclverify.core.TypedFile.Stmt;

/**
 * A rewrite over typed statements. Subclasses override
 * {@link #transformExpression(Expr)} and {@link #transformName(Name)}, which are
 * applied to every expression and every assigned name respectively. As for
 * expressions, a statement is only reconstructed when something within it
 * changes.
 */
public abstract class AbstractStatementVisitor {

    protected Expr transformExpression(Expr expr) {
        return expr;
    }

    protected Name transformName(Name name) {
        return name;
    }

    public List<Stmt> visitStatements(List<Stmt> stmts) {
        List<Stmt> newStmts = stmts;
        for (int i = 0; i != stmts.size(); ++i) {
            Stmt o = stmts.get(i);
            Stmt n = visitStatement(o);
            if (o != n) {
                if (newStmts == stmts) {
                    newStmts = new ArrayList<>(stmts);
                }
                newStmts.set(i, n);
            }
        }
        return newStmts;
    }

    public Stmt visitStatement(Stmt s) {
        if(s instanceof Stmt.Skip || s instanceof Stmt.Abort || s instanceof Stmt.Spec || s instanceof Stmt.Proof) {
            return s;
        } else if(s instanceof Stmt.Assign) {
            return visitAssign((Stmt.Assign) s);
        } else if(s instanceof Stmt.AAssign) {
            return visitAAssign((Stmt.AAssign) s);
        } else if(s instanceof Stmt.Assert) {
            return visitAssert((Stmt.Assert) s);
        } else if(s instanceof Stmt.LoopInvariant) {
            return visitLoopInvariant((Stmt.LoopInvariant) s);
        } else if(s instanceof Stmt.Do) {
            Stmt.Do d = (Stmt.Do) s;
            List<GdCmd> cmds = visitGdCmds(d.getCommands());
            return cmds == d.getCommands() ? d : new Stmt.Do(cmds, d.getLoc());
        } else if(s instanceof Stmt.If) {
            Stmt.If d = (Stmt.If) s;
            List<GdCmd> cmds = visitGdCmds(d.getCommands());
            return cmds == d.getCommands() ? d : new Stmt.If(cmds, d.getLoc());
        } else if(s instanceof Stmt.Alloc) {
            return visitAlloc((Stmt.Alloc) s);
        } else if(s instanceof Stmt.HLookup) {
            return visitHLookup((Stmt.HLookup) s);
        } else if(s instanceof Stmt.HMutate) {
            Stmt.HMutate m = (Stmt.HMutate) s;
            Expr left = transformExpression(m.getLeft());
            Expr right = transformExpression(m.getRight());
            return left == m.getLeft() && right == m.getRight() ? m : new Stmt.HMutate(left, right, m.getLoc());
        } else if(s instanceof Stmt.Dispose) {
            Stmt.Dispose d = (Stmt.Dispose) s;
            Expr e = transformExpression(d.getExpr());
            return e == d.getExpr() ? d : new Stmt.Dispose(e, d.getLoc());
        } else if(s instanceof Stmt.Block) {
            return visitBlock((Stmt.Block) s);
        } else {
            throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
        }
    }

    protected Stmt visitAssign(Stmt.Assign s) {
        List<Name> names = transformNames(s.getNames());
        List<Expr> exprs = transformExpressions(s.getExprs());
        if (names == s.getNames() && exprs == s.getExprs()) {
            return s;
        } else {
            return new Stmt.Assign(names, exprs, s.getLoc());
        }
    }

    protected Stmt visitAAssign(Stmt.AAssign s) {
        Expr array = transformExpression(s.getArray());
        Expr index = transformExpression(s.getIndex());
        Expr value = transformExpression(s.getValue());
        if (array == s.getArray() && index == s.getIndex() && value == s.getValue()) {
            return s;
        } else {
            return new Stmt.AAssign(array, index, value, s.getLoc());
        }
    }

    protected Stmt visitAssert(Stmt.Assert s) {
        Expr condition = transformExpression(s.getCondition());
        return condition == s.getCondition() ? s : new Stmt.Assert(condition, s.getLoc());
    }

    protected Stmt visitLoopInvariant(Stmt.LoopInvariant s) {
        Expr invariant = transformExpression(s.getInvariant());
        Expr bound = s.getBound() == null ? null : transformExpression(s.getBound());
        if (invariant == s.getInvariant() && bound == s.getBound()) {
            return s;
        } else {
            return new Stmt.LoopInvariant(invariant, bound, s.getLoc());
        }
    }

    protected Stmt visitAlloc(Stmt.Alloc s) {
        Name variable = transformName(s.getVariable());
        List<Expr> exprs = transformExpressions(s.getExprs());
        if (variable == s.getVariable() && exprs == s.getExprs()) {
            return s;
        } else {
            return new Stmt.Alloc(variable, exprs, s.getLoc());
        }
    }

    protected Stmt visitHLookup(Stmt.HLookup s) {
        Name variable = transformName(s.getVariable());
        Expr expr = transformExpression(s.getExpr());
        if (variable == s.getVariable() && expr == s.getExpr()) {
            return s;
        } else {
            return new Stmt.HLookup(variable, expr, s.getLoc());
        }
    }

    protected Stmt visitBlock(Stmt.Block s) {
        TypedFile.Program p = s.getProgram();
        List<Stmt> stmts = visitStatements(p.getStatements());
        if (stmts == p.getStatements()) {
            return s;
        } else {
            TypedFile.Program np = new TypedFile.Program(p.getDefinitions(), p.getDeclarations(),
                    p.getProperties(), stmts, p.getLoc());
            return new Stmt.Block(np, s.getLoc());
        }
    }

    protected List<GdCmd> visitGdCmds(List<GdCmd> cmds) {
        List<GdCmd> result = cmds;
        for (int i = 0; i != cmds.size(); ++i) {
            GdCmd o = cmds.get(i);
            Expr guard = transformExpression(o.getGuard());
            List<Stmt> body = visitStatements(o.getBody());
            if (guard != o.getGuard() || body != o.getBody()) {
                if (result == cmds) {
                    result = new ArrayList<>(cmds);
                }
                result.set(i, new GdCmd(guard, body, o.getLoc()));
            }
        }
        return result;
    }

    protected List<Expr> transformExpressions(List<Expr> exprs) {
        List<Expr> result = exprs;
        for (int i = 0; i != exprs.size(); ++i) {
            Expr o = exprs.get(i);
            Expr n = transformExpression(o);
            if (o != n) {
                if (result == exprs) {
                    result = new ArrayList<>(exprs);
                }
                result.set(i, n);
            }
        }
        return result;
    }

    protected List<Name> transformNames(List<Name> names) {
        List<Name> result = names;
        for (int i = 0; i != names.size(); ++i) {
            Name o = names.get(i);
            Name n = transformName(o);
            if (o != n) {
                if (result == names) {
                    result = new ArrayList<>(names);
                }
                result.set(i, n);
            }
        }
        return result;
    }
}
