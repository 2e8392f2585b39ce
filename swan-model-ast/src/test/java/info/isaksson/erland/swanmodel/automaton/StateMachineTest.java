package info.isaksson.erland.swanmodel.automaton;

import info.isaksson.erland.swanmodel.ast.Identifier;
import info.isaksson.erland.swanmodel.ast.Luid;
import info.isaksson.erland.swanmodel.ast.PathIdentifier;
import info.isaksson.erland.swanmodel.ast.SourceSpan;
import info.isaksson.erland.swanmodel.ast.StructuralInvariantException;
import info.isaksson.erland.swanmodel.expr.PathIdExpr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StateMachineTest {

    private static final SourceSpan S = SourceSpan.NONE;

    private static Identification id(String luid, String name) {
        return new Identification(luid == null ? null : Luid.of(luid), name == null ? null : Identifier.of(name));
    }

    private static Transition to(String guard, String state, boolean resume) {
        PathIdExpr g = guard == null ? null : new PathIdExpr(S, PathIdentifier.parse(guard));
        return new Transition(S, new Arrow(S, g, null, new Target(S, id(null, state), resume)));
    }

    private static State state(String luid, String name, boolean initial, List<Transition> strong, List<Transition> weak) {
        return new State(S, id(luid, name), strong, List.of(), weak, initial);
    }

    @Test
    void exactlyOneInitialStateIsRequired() {
        State a = state("1", "A", false, List.of(), List.of());
        State b = state("2", "B", false, List.of(), List.of());
        StructuralInvariantException none = assertThrows(StructuralInvariantException.class,
                () -> new StateMachine(S, null, null, List.of(a, b)));
        assertTrue(none.getMessage().contains("0 initial states"));

        State c = state("1", "C", true, List.of(), List.of());
        State d = state("2", "D", true, List.of(), List.of());
        assertThrows(StructuralInvariantException.class, () -> new StateMachine(S, null, null, List.of(c, d)));
    }

    @Test
    void findsStatesByNameAndLuid() {
        State idle = state("1", "Idle", true, List.of(), List.of());
        State run = state("2", "Run", false, List.of(), List.of());
        StateMachine sm = new StateMachine(S, null, Luid.of("sm"), List.of(idle, run));

        assertSame(idle, sm.initialState());
        assertSame(run, sm.state("Run").orElseThrow());
        assertSame(run, sm.state("#2").orElseThrow());
        assertTrue(sm.state("Stop").isEmpty());
        assertSame(run, sm.resolve(new Target(S, id("2", null), false)).orElseThrow());
    }

    @Test
    void outgoingMergesStateAndMachineLevelTransitions() {
        Transition ownStrong = to("go", "Run", false);
        Transition ownWeak = to(null, "Idle", true);
        State idle = state("1", "Idle", true, List.of(ownStrong), List.of(ownWeak));
        State run = state("2", "Run", false, List.of(), List.of());
        Transition late = to("b", "Run", false);
        Transition early = to("a", "Run", false);
        Transition weakDecl = to("c", "Run", true);
        Transition other = to("d", "Idle", false);
        StateMachine sm = new StateMachine(S, null, null, List.of(idle, run,
                new TransitionDecl(S, 2, id(null, "Idle"), TransitionKind.STRONG, late),
                new TransitionDecl(S, 1, id("1", null), TransitionKind.STRONG, early),
                new TransitionDecl(S, null, id(null, "Idle"), TransitionKind.WEAK, weakDecl),
                new TransitionDecl(S, 1, id(null, "Run"), TransitionKind.STRONG, other)));

        List<Transition> order = sm.outgoing(idle).stream().map(OutgoingTransition::transition).toList();

        assertEquals(List.of(ownStrong, early, late, ownWeak, weakDecl), order);
        assertEquals(TransitionKind.WEAK, sm.outgoing(idle).get(3).kind());
        assertEquals(List.of(other), sm.outgoing(run).stream().map(OutgoingTransition::transition).toList());
    }

    @Test
    void outgoingRejectsForeignState() {
        StateMachine sm = new StateMachine(S, null, null, List.of(state("1", "A", true, List.of(), List.of())));
        assertThrows(IllegalArgumentException.class,
                () -> sm.outgoing(state("1", "A", true, List.of(), List.of())));
    }

    @Test
    void rendersStatesAndTransitions() {
        State idle = state("1", "Idle", true, List.of(to("go", "Run", false)), List.of());
        State run = state("2", "Run", false, List.of(), List.of(to(null, "Idle", true)));
        StateMachine sm = new StateMachine(S, null, Luid.of("sm"), List.of(idle, run,
                new TransitionDecl(S, 1, id(null, "Run"), TransitionKind.STRONG, to("stop", "Idle", false))));

        assertEquals("""
                automaton #sm
                  initial state #1 Idle:
                    unless
                      if (go) restart Run;
                  state #2 Run:
                    until
                      resume Idle;
                  :1: Run unless if (stop) restart Idle;
                ;""", sm.render());
    }
}
