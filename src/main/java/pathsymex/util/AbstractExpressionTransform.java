// Copyright 2026 The PathSymex Project Developers
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
package pathsymex.util;

import pathsymex.core.Program.Expr;

/**
 * A bottom-up rewriting of an expression tree. Nodes whose operands are
 * unchanged by the transform are returned as is, whilst the others are rebuilt
 * with their new operands. The input tree is never modified.
 *
 * @author The PathSymex Project Developers
 *
 */
public abstract class AbstractExpressionTransform {

    public Expr visitExpression(Expr expr) {
        if (expr instanceof Expr.Dereference) {
            return visitDereference((Expr.Dereference) expr);
        } else if (expr instanceof Expr.AddressOf) {
            return visitAddressOf((Expr.AddressOf) expr);
        } else if (expr instanceof Expr.Member) {
            return visitMember((Expr.Member) expr);
        } else if (expr instanceof Expr.Index) {
            return visitIndex((Expr.Index) expr);
        } else if (expr instanceof Expr.Equals) {
            return visitEquals((Expr.Equals) expr);
        } else if (expr instanceof Expr.Addition) {
            return visitAddition((Expr.Addition) expr);
        } else if (expr instanceof Expr.If) {
            return visitIf((Expr.If) expr);
        } else if (expr instanceof Expr.Cond) {
            return visitCond((Expr.Cond) expr);
        } else {
            return visitOperands(expr);
        }
    }

    protected Expr visitDereference(Expr.Dereference expr) {
        return visitOperands(expr);
    }

    protected Expr visitAddressOf(Expr.AddressOf expr) {
        return visitOperands(expr);
    }

    protected Expr visitMember(Expr.Member expr) {
        return visitOperands(expr);
    }

    protected Expr visitIndex(Expr.Index expr) {
        return visitOperands(expr);
    }

    protected Expr visitEquals(Expr.Equals expr) {
        return visitOperands(expr);
    }

    protected Expr visitAddition(Expr.Addition expr) {
        return visitOperands(expr);
    }

    protected Expr visitIf(Expr.If expr) {
        return visitOperands(expr);
    }

    protected Expr visitCond(Expr.Cond expr) {
        return visitOperands(expr);
    }

    /**
     * Visit every operand of a given expression, rebuilding the expression only if
     * one or more of them changed.
     *
     * @param expr
     * @return
     */
    protected Expr visitOperands(Expr expr) {
        final int n = expr.size();
        Expr[] operands = null;
        for (int i = 0; i != n; ++i) {
            Expr ith = expr.getOperand(i);
            Expr nth = visitExpression(ith);
            if (ith != nth && operands == null) {
                operands = new Expr[n];
                for (int j = 0; j < i; ++j) {
                    operands[j] = expr.getOperand(j);
                }
            }
            if (operands != null) {
                operands[i] = nth;
            }
        }
        if (operands == null) {
            return expr;
        } else {
            return expr.rebuild(operands);
        }
    }
}
