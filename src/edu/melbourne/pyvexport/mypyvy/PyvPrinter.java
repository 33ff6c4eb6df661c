/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.mypyvy;

import java.util.List;

/**
 * Concrete mypyvy syntax for expressions. Operands that are not atomic are
 * parenthesized, so no precedence table is needed.
 */
public class PyvPrinter extends PyvExpr.Visitor<String> {

    public static String print(PyvExpr e) {
        return new PyvPrinter().visitThis(e);
    }

    public static String printVars(List<SortedVar> vars) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < vars.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(vars.get(i).getName()).append(":").append(vars.get(i).getSort());
        }
        return sb.toString();
    }

    static boolean isAtomic(PyvExpr e) {
        if (e instanceof PyvExpr.Bool || e instanceof PyvExpr.Id || e instanceof PyvExpr.AppExpr) {
            return true;
        }
        if (e instanceof PyvExpr.UnaryExpr) {
            PyvExpr.UnaryExpr u = (PyvExpr.UnaryExpr) e;
            return u.getOp() == PyvExpr.UnaryExpr.Op.NEW || isAtomic(u.getArg());
        }
        if (e instanceof PyvExpr.NaryExpr) {
            PyvExpr.NaryExpr n = (PyvExpr.NaryExpr) e;
            if (n.getOp() == PyvExpr.NaryExpr.Op.DISTINCT || n.getArgs().isEmpty()) {
                return true;
            }
            return n.getArgs().size() == 1 && isAtomic(n.getArgs().get(0));
        }
        if (e instanceof PyvExpr.QuantifierExpr) {
            return ((PyvExpr.QuantifierExpr) e).getVars().isEmpty() && isAtomic(((PyvExpr.QuantifierExpr) e).getBody());
        }
        return false;
    }

    private String operand(PyvExpr e) {
        String s = visitThis(e);
        return isAtomic(e) ? s : "(" + s + ")";
    }

    private String args(List<PyvExpr> args) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(visitThis(args.get(i)));
        }
        return sb.append(")").toString();
    }

    @Override
    public String visit(PyvExpr.Bool e) {
        return e.getValue() ? "true" : "false";
    }

    @Override
    public String visit(PyvExpr.Id e) {
        return e.getName();
    }

    @Override
    public String visit(PyvExpr.UnaryExpr e) {
        if (e.getOp() == PyvExpr.UnaryExpr.Op.NEW) {
            return "new(" + visitThis(e.getArg()) + ")";
        }
        return "!" + operand(e.getArg());
    }

    @Override
    public String visit(PyvExpr.BinaryExpr e) {
        return operand(e.getArg1()) + " " + e.getOp().getText() + " " + operand(e.getArg2());
    }

    @Override
    public String visit(PyvExpr.NaryExpr e) {
        List<PyvExpr> args = e.getArgs();
        if (e.getOp() == PyvExpr.NaryExpr.Op.DISTINCT) {
            return "distinct" + args(args);
        }
        if (args.isEmpty()) {
            return e.getOp() == PyvExpr.NaryExpr.Op.AND ? "true" : "false";
        }
        if (args.size() == 1) {
            return visitThis(args.get(0));
        }
        String sep = e.getOp() == PyvExpr.NaryExpr.Op.AND ? " & " : " | ";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(sep);
            }
            sb.append(operand(args.get(i)));
        }
        return sb.toString();
    }

    @Override
    public String visit(PyvExpr.AppExpr e) {
        return e.getCallee() + args(e.getArgs());
    }

    @Override
    public String visit(PyvExpr.QuantifierExpr e) {
        if (e.getVars().isEmpty()) {
            return visitThis(e.getBody());
        }
        String q = e.getQuant() == PyvExpr.QuantifierExpr.Quant.FORALL ? "forall " : "exists ";
        return q + printVars(e.getVars()) + ". " + visitThis(e.getBody());
    }

    @Override
    public String visit(PyvExpr.IfThenElse e) {
        return "if " + operand(e.getBranch()) + " then " + operand(e.getThen()) + " else " + operand(e.getEls());
    }
}
