package info.isaksson.erland.swanmodel.types;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanNode;

/** Right-hand side of a type declaration. */
public abstract class TypeDefinition extends SwanNode {

    protected TypeDefinition(SourceSpan span) {
        super(span);
    }
}
