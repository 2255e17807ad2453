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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import gclverify.core.Name;
import gclverify.core.TypedFile;
import gclverify.core.TypedFile.Expr;
import gclverify.core.TypedFile.Stmt;

/**
 * <p>
 * Capture-avoiding simultaneous substitution of expressions for the free
 * variables and constants of a typed expression. For example, substituting
 * <code>y + 1</code> for <code>x</code> in <code>⟨∀ y : y &lt; x : P⟩</code>
 * gives <code>⟨∀ y0 : y0 &lt; y + 1 : P[y0/y]⟩</code>. The binder
 * <code>y</code> is renamed since it would otherwise capture the free
 * <code>y</code> of the replacement.
 * </p>
 * <p>
 * Renamed binders are chosen with {@link FreshNames#freshInScope}, avoiding the
 * free variables of the body and of the replacements, and any names supplied
 * as additional scope (e.g. the program variables visible at that point).
 * </p>
 */
public class ExpressionSubstitution extends AbstractExpressionTransform {
    /**
     * Names mapped to replacement expressions.
     */
    private final Map<String, Expr> mapping;
    /**
     * Names mapped to other names. Occurrences keep their type and location.
     */
    private final Map<String, Name> renaming;
    /**
     * Additional names which renamed binders must avoid.
     */
    private final Collection<String> scope;

    public ExpressionSubstitution(Map<String, Expr> mapping, Collection<String> scope) {
        this(mapping, Collections.emptyMap(), scope);
    }

    private ExpressionSubstitution(Map<String, Expr> mapping, Map<String, Name> renaming, Collection<String> scope) {
        this.mapping = mapping;
        this.renaming = renaming;
        this.scope = scope;
    }

    /**
     * Construct a substitution which renames variables, rather than replacing
     * them with arbitrary expressions.
     *
     * @param renaming
     * @param scope
     * @return
     */
    public static ExpressionSubstitution renaming(Map<String, Name> renaming, Collection<String> scope) {
        return new ExpressionSubstitution(Collections.emptyMap(), renaming, scope);
    }

    /**
     * Simultaneously substitute each name for the corresponding expression within
     * a given expression.
     *
     * @param names
     * @param exprs
     * @param target
     * @param scope
     * @return
     */
    public static Expr substitute(List<Name> names, List<Expr> exprs, Expr target, Collection<String> scope) {
        Map<String, Expr> mapping = new LinkedHashMap<>();
        for (int i = 0; i != names.size(); ++i) {
            mapping.put(names.get(i).getText(), exprs.get(i));
        }
        return new ExpressionSubstitution(mapping, scope).visitExpression(target);
    }

    public static Expr substitute(Name name, Expr expr, Expr target, Collection<String> scope) {
        return substitute(Arrays.asList(name), Arrays.asList(expr), target, scope);
    }

    /**
     * Rename variables throughout a list of statements, including the targets of
     * assignments. Nested blocks which redeclare a renamed variable are left
     * alone for that variable.
     *
     * @param renaming
     * @param stmts
     * @param scope
     * @return
     */
    public static List<Stmt> rename(Map<String, Name> renaming, List<Stmt> stmts, Collection<String> scope) {
        return new StatementRenaming(renaming, scope).visitStatements(stmts);
    }

    public boolean isEmpty() {
        return mapping.isEmpty() && renaming.isEmpty();
    }

    @Override
    protected Expr constructVar(Expr.Var expr) {
        Expr r = replacement(expr.getName().getText(), expr);
        return r == null ? expr : r;
    }

    @Override
    protected Expr constructConst(Expr.Const expr) {
        Expr r = replacement(expr.getName().getText(), expr);
        return r == null ? expr : r;
    }

    @Override
    protected Expr visitLam(Expr.Lam expr) {
        List<Name> binders = Arrays.asList(expr.getParameter());
        Set<String> free = FreeVariables.of(expr.getBody());
        ExpressionSubstitution inner = restrict(binders, free);
        if (inner.isEmpty()) {
            return expr;
        }
        Map<String, Name> fresh = captured(binders, inner, free);
        Expr body = expr.getBody();
        Name parameter = expr.getParameter();
        if (!fresh.isEmpty()) {
            body = renaming(fresh, scope).visitExpression(body);
            parameter = fresh.get(parameter.getText());
        }
        body = inner.visitExpression(body);
        return new Expr.Lam(parameter, expr.getParameterType(), body, expr.getType(), expr.getLoc());
    }

    @Override
    protected Expr visitQuant(Expr.Quant expr) {
        Expr quantifier = visitExpression(expr.getQuantifier());
        Set<String> free = new LinkedHashSet<>(FreeVariables.of(expr.getRange()));
        free.addAll(FreeVariables.of(expr.getBody()));
        ExpressionSubstitution inner = restrict(expr.getBound(), free);
        if (inner.isEmpty()) {
            return quantifier == expr.getQuantifier() ? expr
                    : new Expr.Quant(quantifier, expr.getBound(), expr.getRange(), expr.getBody(), expr.getType(),
                            expr.getLoc());
        }
        Map<String, Name> fresh = captured(expr.getBound(), inner, free);
        Expr range = expr.getRange();
        Expr body = expr.getBody();
        List<Name> bound = expr.getBound();
        if (!fresh.isEmpty()) {
            ExpressionSubstitution r = renaming(fresh, scope);
            range = r.visitExpression(range);
            body = r.visitExpression(body);
            bound = new ArrayList<>();
            for (Name n : expr.getBound()) {
                bound.add(fresh.getOrDefault(n.getText(), n));
            }
        }
        range = inner.visitExpression(range);
        body = inner.visitExpression(body);
        return new Expr.Quant(quantifier, bound, range, body, expr.getType(), expr.getLoc());
    }

    private Expr replacement(String name, Expr occurrence) {
        Expr e = mapping.get(name);
        if (e != null) {
            return e;
        }
        Name n = renaming.get(name);
        if (n == null) {
            return null;
        } else if (occurrence instanceof Expr.Const) {
            return new Expr.Const(n, occurrence.getType(), occurrence.getLoc());
        } else {
            return new Expr.Var(n, occurrence.getType(), occurrence.getLoc());
        }
    }

    /**
     * Restrict this substitution to entries which are not shadowed by the given
     * binders, and which actually occur free underneath them.
     *
     * @param binders
     * @param free
     * @return
     */
    private ExpressionSubstitution restrict(List<Name> binders, Set<String> free) {
        Set<String> bound = new LinkedHashSet<>(Util.text(binders));
        Map<String, Expr> m = new LinkedHashMap<>();
        for (Map.Entry<String, Expr> e : mapping.entrySet()) {
            if (!bound.contains(e.getKey()) && free.contains(e.getKey())) {
                m.put(e.getKey(), e.getValue());
            }
        }
        Map<String, Name> r = new LinkedHashMap<>();
        for (Map.Entry<String, Name> e : renaming.entrySet()) {
            if (!bound.contains(e.getKey()) && free.contains(e.getKey())) {
                r.put(e.getKey(), e.getValue());
            }
        }
        return new ExpressionSubstitution(m, r, scope);
    }

    /**
     * Determine which binders would capture a free variable of some replacement,
     * and choose a fresh name for each of them.
     *
     * @param binders
     * @param inner
     * @param free
     * @return
     */
    private Map<String, Name> captured(List<Name> binders, ExpressionSubstitution inner, Set<String> free) {
        Set<String> incoming = inner.replacementNames();
        Map<String, Name> fresh = new HashMap<>();
        Set<String> taken = new LinkedHashSet<>(incoming);
        taken.addAll(free);
        taken.addAll(Util.text(binders));
        for (Name b : binders) {
            if (incoming.contains(b.getText())) {
                String n = FreshNames.freshInScope(b.getText(), Arrays.asList(taken, scope));
                taken.add(n);
                fresh.put(b.getText(), new Name(n, b.getLoc()));
            }
        }
        return fresh;
    }

    private Set<String> replacementNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Expr e : mapping.values()) {
            names.addAll(FreeVariables.of(e));
        }
        for (Name n : renaming.values()) {
            names.add(n.getText());
        }
        return names;
    }

    private static class StatementRenaming extends AbstractStatementVisitor {
        private final Map<String, Name> renaming;
        private final ExpressionSubstitution substitution;
        private final Collection<String> scope;

        public StatementRenaming(Map<String, Name> renaming, Collection<String> scope) {
            this.renaming = renaming;
            this.scope = scope;
            this.substitution = ExpressionSubstitution.renaming(renaming, scope);
        }

        @Override
        protected Expr transformExpression(Expr expr) {
            return substitution.visitExpression(expr);
        }

        @Override
        protected Name transformName(Name name) {
            Name n = renaming.get(name.getText());
            return n == null ? name : new Name(n.getText(), name.getLoc());
        }

        @Override
        protected Stmt visitBlock(Stmt.Block s) {
            Map<String, Name> r = new LinkedHashMap<>(renaming);
            for (TypedFile.Declaration d : s.getProgram().getDeclarations()) {
                for (Name n : d.getNames()) {
                    r.remove(n.getText());
                }
            }
            if (r.size() == renaming.size()) {
                return super.visitBlock(s);
            }
            TypedFile.Program p = s.getProgram();
            List<Stmt> stmts = rename(r, p.getStatements(), scope);
            if (stmts == p.getStatements()) {
                return s;
            }
            TypedFile.Program np = new TypedFile.Program(p.getDefinitions(), p.getDeclarations(), p.getProperties(),
                    stmts, p.getLoc());
            return new Stmt.Block(np, s.getLoc());
        }
    }
}
