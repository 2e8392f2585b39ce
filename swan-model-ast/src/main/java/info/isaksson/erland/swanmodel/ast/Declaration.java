package info.isaksson.erland.swanmodel.ast;

/** A named declaration: contributes its identifier to {@link SwanNode#fullPath()}. */
public interface Declaration {

    Identifier identifier();

    default String name() {
        return identifier().value();
    }
}
