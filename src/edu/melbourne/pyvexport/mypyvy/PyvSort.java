/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.mypyvy;

/**
 * First-order mypyvy sorts: declared sorts and the built-in {@code bool}.
 */
public abstract class PyvSort {

    public static final PyvSort BOOL = new PyvSort() {
        @Override
        public String toString() {
            return "bool";
        }
    };

    public static PyvSort uninterpreted(String name) {
        return new UninterpretedSort(name);
    }

    public static class UninterpretedSort extends PyvSort {

        private final String name;

        public UninterpretedSort(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UninterpretedSort && ((UninterpretedSort) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
