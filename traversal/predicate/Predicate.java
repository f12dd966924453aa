/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.traversal.predicate;

import com.graphmatch.core.traversal.ExecutionContext;
import com.graphmatch.core.traversal.common.MapSupport;
import com.graphmatch.core.traversal.common.MapView;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * A boolean condition over the bindings of an {@link ExecutionContext}. Predicates are immutable values:
 * two predicates built from equal parts are equal.
 */
public abstract class Predicate {

    public static final Predicate TRUE = new True();

    public abstract boolean isMatch(ExecutionContext context);

    public Predicate and(Predicate other) {
        return new And(this, other);
    }

    public Predicate or(Predicate other) {
        return new Or(this, other);
    }

    public Predicate not() {
        return new Not(this);
    }

    public static class True extends Predicate {

        private True() { }

        @Override
        public boolean isMatch(ExecutionContext context) {
            return true;
        }

        @Override
        public Predicate and(Predicate other) {
            return other;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof True;
        }

        @Override
        public int hashCode() {
            return True.class.hashCode();
        }

        @Override
        public String toString() {
            return "true";
        }
    }

    public static class And extends Predicate {

        private final Predicate left;
        private final Predicate right;
        private final int hash;

        public And(Predicate left, Predicate right) {
            this.left = left;
            this.right = right;
            this.hash = Objects.hash(And.class, left, right);
        }

        public Predicate left() {
            return left;
        }

        public Predicate right() {
            return right;
        }

        @Override
        public boolean isMatch(ExecutionContext context) {
            return left.isMatch(context) && right.isMatch(context);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            And that = (And) o;
            return left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return "(" + left + " AND " + right + ")";
        }
    }

    public static class Or extends Predicate {

        private final Predicate left;
        private final Predicate right;
        private final int hash;

        public Or(Predicate left, Predicate right) {
            this.left = left;
            this.right = right;
            this.hash = Objects.hash(Or.class, left, right);
        }

        @Override
        public boolean isMatch(ExecutionContext context) {
            return left.isMatch(context) || right.isMatch(context);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Or that = (Or) o;
            return left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return "(" + left + " OR " + right + ")";
        }
    }

    public static class Not extends Predicate {

        private final Predicate inner;

        public Not(Predicate inner) {
            this.inner = inner;
        }

        @Override
        public boolean isMatch(ExecutionContext context) {
            return !inner.isMatch(context);
        }

        @Override
        public Predicate not() {
            return inner;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return inner.equals(((Not) o).inner);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Not.class, inner);
        }

        @Override
        public String toString() {
            return "NOT(" + inner + ")";
        }
    }

    /**
     * Reads a property of whatever the identifier is bound to: a literal map, a node or a relationship.
     */
    abstract static class Property extends Predicate {

        final String identifier;
        final String key;

        private Property(String identifier, String key) {
            this.identifier = identifier;
            this.key = key;
        }

        Optional<MapView> properties(ExecutionContext context) {
            return context.get(identifier).map(
                    value -> MapSupport.castToMap(value).apply(context.state().query())
            );
        }
    }

    public static class HasProperty extends Property {

        public HasProperty(String identifier, String key) {
            super(identifier, key);
        }

        @Override
        public boolean isMatch(ExecutionContext context) {
            return properties(context).map(properties -> properties.contains(key)).orElse(false);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            HasProperty that = (HasProperty) o;
            return identifier.equals(that.identifier) && key.equals(that.key);
        }

        @Override
        public int hashCode() {
            return Objects.hash(HasProperty.class, identifier, key);
        }

        @Override
        public String toString() {
            return "exists(" + identifier + "." + key + ")";
        }
    }

    /**
     * Compares a property with either a constant or a query parameter. Numbers compare by value, so an
     * integer property equals the same long constant.
     */
    public static class PropertyEquals extends Property {

        @Nullable
        private final Object value;
        @Nullable
        private final String parameter;

        private PropertyEquals(String identifier, String key, @Nullable Object value, @Nullable String parameter) {
            super(identifier, key);
            this.value = value;
            this.parameter = parameter;
        }

        public static PropertyEquals of(String identifier, String key, Object value) {
            return new PropertyEquals(identifier, key, value, null);
        }

        public static PropertyEquals ofParameter(String identifier, String key, String parameter) {
            return new PropertyEquals(identifier, key, null, parameter);
        }

        @Override
        public boolean isMatch(ExecutionContext context) {
            Object expected = parameter != null ? context.state().parameter(parameter) : value;
            return properties(context).flatMap(properties -> properties.get(key))
                    .map(actual -> valuesEqual(actual, expected))
                    .orElse(false);
        }

        private static boolean valuesEqual(Object actual, @Nullable Object expected) {
            if (expected == null) return false;
            if (actual instanceof Number && expected instanceof Number) {
                Number a = (Number) actual, b = (Number) expected;
                if (isIntegral(a) && isIntegral(b)) return a.longValue() == b.longValue();
                else return a.doubleValue() == b.doubleValue();
            }
            return actual.equals(expected);
        }

        private static boolean isIntegral(Number number) {
            return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PropertyEquals that = (PropertyEquals) o;
            return identifier.equals(that.identifier) && key.equals(that.key) &&
                    Objects.equals(value, that.value) && Objects.equals(parameter, that.parameter);
        }

        @Override
        public int hashCode() {
            return Objects.hash(PropertyEquals.class, identifier, key, value, parameter);
        }

        @Override
        public String toString() {
            String rhs = parameter != null ? "$" + parameter : (value instanceof String ? "'" + value + "'" : String.valueOf(value));
            return identifier + "." + key + " = " + rhs;
        }
    }
}
