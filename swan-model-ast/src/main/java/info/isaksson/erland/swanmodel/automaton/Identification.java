package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.Luid;

import java.util.Optional;

/** State reference: a LUID, a name, both ({@code #2 Off}), or neither. */
public record Identification(Luid luid, Identifier id) {

    public static final Identification UNDEFINED = new Identification(null, null);

    public Optional<Luid> optionalLuid() {
        return Optional.ofNullable(luid);
    }

    public Optional<Identifier> optionalId() {
        return Optional.ofNullable(id);
    }

    public boolean isUndefined() {
        return luid == null && id == null;
    }

    /**
     * True when both designate the same state: equal LUIDs when both have one, else equal
     * names when both have one.
     */
    public boolean designates(Identification other) {
        if (other == null || isUndefined() || other.isUndefined()) return false;
        if (luid != null && other.luid != null) return luid.equals(other.luid);
        if (id != null && other.id != null) return id.value().equals(other.id.value());
        return false;
    }

    public String render() {
        if (luid != null && id != null) return luid + " " + id.render();
        if (luid != null) return luid.toString();
        return id == null ? "" : id.render();
    }

    @Override public String toString() {
        return render();
    }
}
