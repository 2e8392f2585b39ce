package info.isaksson.erland.swanmodel.ast;

import java.util.Optional;

public enum ModuleKind {
    BODY(".swan"),
    INTERFACE(".swani");

    private final String extension;

    ModuleKind(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static Optional<ModuleKind> fromFileName(String fileName) {
        if (fileName == null) return Optional.empty();
        if (fileName.endsWith(INTERFACE.extension)) return Optional.of(INTERFACE);
        if (fileName.endsWith(BODY.extension)) return Optional.of(BODY);
        return Optional.empty();
    }
}
