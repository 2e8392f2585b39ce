package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;

/** Type of a group declaration: a type, or a parenthesized list of items. */
public abstract class GroupTypeExpression extends SwanNode {

    protected GroupTypeExpression(SourceSpan span) {
        super(span);
    }
}
