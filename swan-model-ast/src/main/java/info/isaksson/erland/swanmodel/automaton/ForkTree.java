package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.SwanWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** {@code if arrow elsif arrow ... [else arrow] end} */
public final class ForkTree extends Fork {

    private final Arrow ifArrow;
    private final List<Arrow> elsifArrows;
    private final Arrow elseArrow;

    public ForkTree(SourceSpan span, Arrow ifArrow, List<Arrow> elsifArrows, Arrow elseArrow) {
        super(span);
        if (ifArrow == null) throw new IllegalArgumentException("if arrow is null");
        this.ifArrow = adopt(ifArrow);
        this.elsifArrows = adoptAll(elsifArrows);
        this.elseArrow = adopt(elseArrow);
    }

    public Arrow ifArrow() {
        return ifArrow;
    }

    public List<Arrow> elsifArrows() {
        return elsifArrows;
    }

    public Optional<Arrow> elseArrow() {
        return Optional.ofNullable(elseArrow);
    }

    @Override public List<Arrow> arrows() {
        List<Arrow> out = new ArrayList<>();
        out.add(ifArrow);
        out.addAll(elsifArrows);
        if (elseArrow != null) out.add(elseArrow);
        return out;
    }

    @Override protected Optional<Arrow> doSelect(GuardOracle oracle) {
        if (holds(ifArrow, oracle)) return Optional.of(ifArrow);
        for (Arrow a : elsifArrows) {
            if (holds(a, oracle)) return Optional.of(a);
        }
        return Optional.ofNullable(elseArrow);
    }

    @Override public void write(SwanWriter out) {
        out.text("if ").node(ifArrow);
        for (Arrow a : elsifArrows) out.text(" elsif ").node(a);
        if (elseArrow != null) out.text(" else ").node(elseArrow);
        out.text(" end");
    }
}
