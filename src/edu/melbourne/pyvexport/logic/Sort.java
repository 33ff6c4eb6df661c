/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.pyvexport.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * Sorts of the elaborated source logic. First-order sorts are uninterpreted,
 * enumerated or Boolean; function sorts only ever type symbols.
 */
public abstract class Sort {

    public static final BooleanSort BOOL = new BooleanSort();

    public abstract String getName();

    public boolean isFirstOrder() {
        return false;
    }

    public static UninterpretedSort uninterpreted(String name) {
        return new UninterpretedSort(name);
    }

    public static EnumeratedSort enumerated(String name, String... values) {
        List<String> l = new ArrayList<>();
        Collections.addAll(l, values);
        return new EnumeratedSort(name, l);
    }

    public static FunctionSort function(Sort range, Sort... domain) {
        List<Sort> l = new ArrayList<>();
        Collections.addAll(l, domain);
        return new FunctionSort(l, range);
    }

    public static FunctionSort relation(Sort... domain) {
        return function(BOOL, domain);
    }

    @Override
    public String toString() {
        return getName();
    }

    public static class UninterpretedSort extends Sort {

        private final String name;

        public UninterpretedSort(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean isFirstOrder() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UninterpretedSort && ((UninterpretedSort) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    /**
     * A finite sort whose values are the given distinct names, in declaration
     * order.
     */
    public static class EnumeratedSort extends Sort {

        private final String name;
        private final List<String> values;

        public EnumeratedSort(String name, List<String> values) {
            if (new HashSet<>(values).size() != values.size()) {
                throw new IllegalArgumentException("enumerated sort " + name + " has repeated values " + values);
            }
            this.name = name;
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public String getName() {
            return name;
        }

        public List<String> getValues() {
            return values;
        }

        @Override
        public boolean isFirstOrder() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof EnumeratedSort)) {
                return false;
            }
            EnumeratedSort other = (EnumeratedSort) o;
            return other.name.equals(name) && other.values.equals(values);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + values.hashCode();
        }
    }

    public static class BooleanSort extends Sort {

        private BooleanSort() {
        }

        @Override
        public String getName() {
            return "bool";
        }

        @Override
        public boolean isFirstOrder() {
            return true;
        }
    }

    /**
     * Sorts with a built-in theory (integers, bit vectors...). Only modelled
     * so that they can be rejected.
     */
    public static class InterpretedSort extends Sort {

        private final String name;

        public InterpretedSort(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof InterpretedSort && ((InterpretedSort) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return 17 + name.hashCode();
        }
    }

    /**
     * The sort of a relation (Boolean range) or function. The domain is never
     * empty: nullary symbols carry their range sort directly.
     */
    public static class FunctionSort extends Sort {

        private final List<Sort> domain;
        private final Sort range;

        public FunctionSort(List<Sort> domain, Sort range) {
            if (domain.isEmpty()) {
                throw new IllegalArgumentException("function sort with empty domain");
            }
            this.domain = Collections.unmodifiableList(new ArrayList<>(domain));
            this.range = range;
        }

        public List<Sort> getDomain() {
            return domain;
        }

        public Sort getRange() {
            return range;
        }

        public boolean isRelation() {
            return range == BOOL;
        }

        @Override
        public String getName() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < domain.size(); i++) {
                if (i > 0) {
                    sb.append(" * ");
                }
                sb.append(domain.get(i).getName());
            }
            sb.append(" -> ").append(range.getName());
            return sb.toString();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionSort)) {
                return false;
            }
            FunctionSort other = (FunctionSort) o;
            return other.domain.equals(domain) && other.range.equals(range);
        }

        @Override
        public int hashCode() {
            return 31 * domain.hashCode() + range.hashCode();
        }
    }
}
