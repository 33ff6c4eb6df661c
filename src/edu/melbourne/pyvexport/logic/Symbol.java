/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

/**
 * A named individual, relation or function of the source signature.
 */
public class Symbol implements Comparable<Symbol> {

    public enum Kind {
        INDIVIDUAL, RELATION, FUNCTION
    }

    private final String name;
    private final Sort sort;

    public Symbol(String name, Sort sort) {
        if (name == null || sort == null) {
            throw new IllegalArgumentException("symbol needs a name and a sort");
        }
        this.name = name;
        this.sort = sort;
    }

    public String getName() {
        return name;
    }

    public Sort getSort() {
        return sort;
    }

    public Kind getKind() {
        if (sort instanceof Sort.FunctionSort) {
            return ((Sort.FunctionSort) sort).isRelation() ? Kind.RELATION : Kind.FUNCTION;
        }
        return Kind.INDIVIDUAL;
    }

    public int getArity() {
        if (sort instanceof Sort.FunctionSort) {
            return ((Sort.FunctionSort) sort).getDomain().size();
        }
        return 0;
    }

    /**
     * Sort of an application of this symbol (the sort itself for individuals).
     */
    public Sort getRange() {
        if (sort instanceof Sort.FunctionSort) {
            return ((Sort.FunctionSort) sort).getRange();
        }
        return sort;
    }

    public boolean isNew() {
        return Naming.isNew(name);
    }

    public Symbol newOf() {
        return new Symbol(Naming.newOf(name), sort);
    }

    public Symbol toNew() {
        return new Symbol(Naming.toNew(name), sort);
    }

    public boolean isSkolem() {
        return Naming.isSkolem(name);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Symbol)) {
            return false;
        }
        Symbol other = (Symbol) o;
        return other.name.equals(name) && other.sort.equals(sort);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + sort.hashCode();
    }

    @Override
    public int compareTo(Symbol o) {
        int res = name.compareTo(o.name);
        if (res == 0) {
            res = sort.toString().compareTo(o.sort.toString());
        }
        if (res == 0 && !sort.equals(o.sort)) {
            res = sort.getClass().getName().compareTo(o.sort.getClass().getName());
        }
        return res;
    }

    @Override
    public String toString() {
        return name + ":" + sort;
    }
}
