/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

import java.util.List;

/**
 * Ivy-like rendering of source formulas, for logs and error messages.
 */
class FormulaPrinter extends Formula.Visitor<String> {

    static String print(Formula f) {
        return new FormulaPrinter().visitThis(f);
    }

    private String quantifier(String q, Formula.Quantifier f) {
        StringBuilder sb = new StringBuilder(q).append(" ");
        List<Formula.Var> vars = f.getVariables();
        for (int i = 0; i < vars.size(); i++) {
            if (i > 0) {
                sb.append(",");
            }
            sb.append(vars.get(i).getName()).append(":").append(vars.get(i).getSort());
        }
        return sb.append(". ").append(visitThis(f.getBody())).toString();
    }

    private String join(String op, List<Formula> terms) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) {
                sb.append(" ").append(op).append(" ");
            }
            sb.append(visitThis(terms.get(i)));
        }
        return sb.append(")").toString();
    }

    @Override
    public String visit(Formula.ForAll f) {
        return "(" + quantifier("forall", f) + ")";
    }

    @Override
    public String visit(Formula.Exists f) {
        return "(" + quantifier("exists", f) + ")";
    }

    @Override
    public String visit(Formula.Ite f) {
        return "(" + visitThis(f.getThen()) + " if " + visitThis(f.getCond()) + " else " + visitThis(f.getElse()) + ")";
    }

    @Override
    public String visit(Formula.And f) {
        return f.getTerms().isEmpty() ? "true" : join("&", f.getTerms());
    }

    @Override
    public String visit(Formula.Or f) {
        return f.getTerms().isEmpty() ? "false" : join("|", f.getTerms());
    }

    @Override
    public String visit(Formula.Eq f) {
        return join("=", f.getTerms());
    }

    @Override
    public String visit(Formula.Implies f) {
        return join("->", f.getTerms());
    }

    @Override
    public String visit(Formula.Iff f) {
        return join("<->", f.getTerms());
    }

    @Override
    public String visit(Formula.Not f) {
        return "~" + visitThis(f.getBody());
    }

    @Override
    public String visit(Formula.Apply f) {
        StringBuilder sb = new StringBuilder(f.getFunc().getName()).append("(");
        for (int i = 0; i < f.getArgs().size(); i++) {
            if (i > 0) {
                sb.append(",");
            }
            sb.append(visitThis(f.getArgs().get(i)));
        }
        return sb.append(")").toString();
    }

    @Override
    public String visit(Formula.Const f) {
        return f.getName();
    }

    @Override
    public String visit(Formula.Var f) {
        return f.getName();
    }
}
