/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.mypyvy;

/**
 * A quantified variable or a transition parameter.
 */
public class SortedVar {

    private final String name;
    private final PyvSort sort;

    public SortedVar(String name, PyvSort sort) {
        this.name = name;
        this.sort = sort;
    }

    public String getName() {
        return name;
    }

    public PyvSort getSort() {
        return sort;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SortedVar)) {
            return false;
        }
        SortedVar other = (SortedVar) o;
        return other.name.equals(name) && other.sort.equals(sort);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + sort.hashCode();
    }

    @Override
    public String toString() {
        return name + ":" + sort;
    }
}
