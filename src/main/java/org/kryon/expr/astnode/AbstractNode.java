package org.kryon.expr.astnode;

import org.kryon.expr.astvisitor.PrintVisitor;

/**
 * Abstract base class for tree nodes.
 * <p>
 * It provides deep toString() formatting using PrintVisitor.
 */
public abstract class AbstractNode implements Node {

    /**
     * Returns an indented dump of the tree rooted at this node.
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }
}
