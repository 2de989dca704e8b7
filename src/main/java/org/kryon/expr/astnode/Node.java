package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.Visitor;

/**
 * An expression tree node.
 * <p>
 * Trees are produced by an external parser and are only borrowed by the
 * compiler and optimizer: no pass mutates a node it was given.
 */
public interface Node {

    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    void accept(Visitor visitor);
}
