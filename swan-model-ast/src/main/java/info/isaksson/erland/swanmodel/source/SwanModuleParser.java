package info.isaksson.erland.swanmodel.source;

import info.isaksson.erland.swanmodel.ast.Module;

import java.io.IOException;

/** Builds the module tree of a source unit. */
public interface SwanModuleParser {

    /**
     * Parses a unit. Text that cannot be structured ends up in protected nodes rather than
     * failing the whole unit.
     *
     * @throws IOException when the source text cannot be read
     */
    Module parse(SwanSource source) throws IOException;
}
