package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@code :1: if arrow :2: else arrow end}. Entries are considered by ascending priority,
 * ties and missing priorities keeping list order, missing priorities last.
 */
public final class ForkPriorityList extends Fork {

    private static final Comparator<ForkWithPriority> BY_PRIORITY = Comparator.comparing(
            (ForkWithPriority f) -> f.priority().orElse(null), Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<ForkWithPriority> forks;

    public ForkPriorityList(SourceSpan span, List<ForkWithPriority> forks) {
        super(span);
        this.forks = adoptAll(forks);
    }

    public List<ForkWithPriority> forks() {
        return forks;
    }

    /** Entries sorted by priority; the sort is stable. */
    public List<ForkWithPriority> byPriority() {
        List<ForkWithPriority> sorted = new ArrayList<>(forks);
        sorted.sort(BY_PRIORITY);
        return sorted;
    }

    @Override public List<Arrow> arrows() {
        List<Arrow> guarded = new ArrayList<>();
        List<Arrow> others = new ArrayList<>();
        for (ForkWithPriority f : byPriority()) {
            (f.isIfArrow() ? guarded : others).add(f.arrow());
        }
        guarded.addAll(others);
        return guarded;
    }

    @Override protected Optional<Arrow> doSelect(GuardOracle oracle) {
        Arrow fallback = null;
        for (ForkWithPriority f : byPriority()) {
            if (f.isIfArrow()) {
                if (holds(f.arrow(), oracle)) return Optional.of(f.arrow());
            } else if (fallback == null) {
                fallback = f.arrow();
            }
        }
        return Optional.ofNullable(fallback);
    }

    @Override public void write(SwanWriter out) {
        for (ForkWithPriority f : forks) out.node(f).text(" ");
        out.text("end");
    }
}
