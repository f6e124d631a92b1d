package com.fsnow.filterengine.transformation;

import com.fsnow.filterengine.model.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of a standardized filter tree.
 * <p>
 * A LITERAL node holds a single (possibly negated) term. AND/OR nodes hold
 * children; when all of their children are literals they may be flagged as a
 * <em>compound leaf</em>, in which case canonicalization treats the whole group
 * as a single boolean variable.
 */
public final class FilterNode {

    public enum Type { LITERAL, AND, OR, NOT }

    private final Type type;
    private final Term term;
    private final List<FilterNode> children;
    private final boolean compoundLeaf;

    private FilterNode(Type type, Term term, List<FilterNode> children, boolean compoundLeaf) {
        this.type = type;
        this.term = term;
        this.children = children;
        this.compoundLeaf = compoundLeaf;
    }

    public static FilterNode literal(Term term) {
        return new FilterNode(Type.LITERAL, Objects.requireNonNull(term, "Term cannot be null"),
                Collections.emptyList(), false);
    }

    public static FilterNode and(List<FilterNode> children, boolean compoundLeaf) {
        return group(Type.AND, children, compoundLeaf);
    }

    public static FilterNode or(List<FilterNode> children, boolean compoundLeaf) {
        return group(Type.OR, children, compoundLeaf);
    }

    public static FilterNode not(FilterNode child) {
        return new FilterNode(Type.NOT, null, Collections.singletonList(child), false);
    }

    public static FilterNode group(Type type, List<FilterNode> children, boolean compoundLeaf) {
        if (type != Type.AND && type != Type.OR) {
            throw new IllegalArgumentException("Not a group type: " + type);
        }
        if (children.isEmpty()) {
            throw new IllegalArgumentException("A group requires at least one child");
        }
        if (compoundLeaf && !children.stream().allMatch(FilterNode::isLiteral)) {
            throw new IllegalArgumentException("A compound leaf may only contain literals");
        }
        return new FilterNode(type, null, Collections.unmodifiableList(new ArrayList<>(children)), compoundLeaf);
    }

    public Type getType() {
        return type;
    }

    public Term getTerm() {
        if (type != Type.LITERAL) {
            throw new IllegalStateException("Not a literal node");
        }
        return term;
    }

    public List<FilterNode> getChildren() {
        return children;
    }

    public boolean isLiteral() {
        return type == Type.LITERAL;
    }

    public boolean isGroup() {
        return type == Type.AND || type == Type.OR;
    }

    public boolean isCompoundLeaf() {
        return compoundLeaf;
    }

    /**
     * Checks if this node occupies a single truth-table column.
     */
    public boolean isVariable() {
        return type == Type.LITERAL || compoundLeaf;
    }

    /**
     * Returns the negation of this node, pushing it down to the literals.
     * Compound leaves stay compound leaves (De Morgan keeps literal-only groups literal-only).
     */
    public FilterNode negate() {
        switch (type) {
            case LITERAL:
                return literal(term.negate());
            case NOT:
                return children.get(0);
            default:
                List<FilterNode> negated = new ArrayList<>();
                for (FilterNode child : children) {
                    negated.add(child.negate());
                }
                return group(type == Type.AND ? Type.OR : Type.AND, negated, compoundLeaf);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FilterNode that = (FilterNode) o;
        return compoundLeaf == that.compoundLeaf && type == that.type
                && Objects.equals(term, that.term) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, term, children, compoundLeaf);
    }

    @Override
    public String toString() {
        if (type == Type.LITERAL) {
            return term.toString();
        }
        return type.name().toLowerCase() + (compoundLeaf ? "*" : "") + children;
    }
}
