package com.symdiff.expression;

import java.util.Objects;

/**
 * Expression representing a symbolic variable.
 *
 * <p>A variable is an opaque identifier of one or more characters. Two
 * variables are the same variable when their names are equal.
 */
public final class Variable implements Expression {

    private final String name;

    private Variable(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }

    /**
     * Creates a variable.
     *
     * @param name the variable name
     * @return the variable expression
     * @throws IllegalArgumentException if the name is empty
     */
    public static Variable of(String name) {
        return new Variable(name);
    }

    /**
     * Returns the variable name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Returns whether this variable has the same name as another.
     *
     * @param other the variable to compare with
     * @return true if the names are equal
     */
    public boolean isSameVariable(Variable other) {
        return name.equals(other.name);
    }

    @Override
    public boolean isConstant() {
        return false;
    }

    @Override
    public String render() {
        return name;
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Variable)) return false;
        Variable that = (Variable) obj;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
