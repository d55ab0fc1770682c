package au.edu.unimelb.processmining.inductive.tree;

import au.edu.unimelb.processmining.inductive.log.EventLog;
import dk.brics.automaton.*;

import java.util.*;

/**
 * The language of a process tree as a minimal deterministic automaton. Every activity label is
 * encoded as one character, tau is the empty string.
 */
public class ProcessTreeAutomaton {

    private static final char FIRST_SYMBOL = '\u0100';

    private final Map<String, Character> label2symbol = new HashMap<>();
    private final Map<Character, String> symbol2label = new HashMap<>();
    private final Automaton automaton;

    public ProcessTreeAutomaton(ProcessTree tree) {
        char symbol = FIRST_SYMBOL;
        for (String label : tree.getActivities()) {
            label2symbol.put(label, symbol);
            symbol2label.put(symbol, label);
            symbol++;
        }
        automaton = tree.accept(new LanguageBuilder());
    }

    public Automaton getAutomaton() {
        return automaton.clone();
    }

    /**
     * @return true if replaying the tree can produce exactly this trace
     */
    public boolean accepts(List<String> trace) {
        StringBuilder word = new StringBuilder(trace.size());
        for (String activity : trace) {
            Character symbol = label2symbol.get(activity);
            if (symbol == null) return false;
            word.append(symbol.charValue());
        }
        return automaton.run(word.toString());
    }

    /**
     * Enumerates the language of the tree up to a trace length.
     *
     * @param maxLength longest trace to produce
     * @return every accepted trace of at most {@code maxLength} events, each with frequency 1
     */
    public EventLog playout(int maxLength) {
        Automaton expanded = automaton.clone();
        expanded.expandSingleton();

        EventLog.Builder builder = EventLog.builder();
        for (int length = 0; length <= maxLength; length++) {
            Set<String> accepted = new TreeSet<>(SpecialOperations.getStrings(expanded, length));
            for (String word : accepted) builder.add(decode(word), 1);
        }
        return builder.build();
    }

    private List<String> decode(String word) {
        List<String> trace = new ArrayList<>(word.length());
        for (char c : word.toCharArray()) trace.add(symbol2label.get(c));
        return trace;
    }

    public static Automaton mkLeafNode(char symbol) {
        Automaton a = new Automaton();

        State q0 = new State();
        State qf = new State();
        qf.setAccept(true);
        q0.addTransition(new Transition(symbol, qf));

        a.setInitialState(q0);
        a.setDeterministic(true);
        return a;
    }

    public static Automaton mkTau() {
        return Automaton.makeEmptyString();
    }

    public static Automaton mkSequence(List<Automaton> parts) {
        Automaton result = BasicOperations.concatenate(parts);
        result.minimize();
        return result;
    }

    public static Automaton mkExclusive(List<Automaton> choices) {
        Automaton result = BasicOperations.union(choices);
        result.determinize();
        result.minimize();
        return result;
    }

    public static Automaton mkParallel(List<Automaton> branches) {
        Automaton result = branches.get(0);
        for (int i = 1; i < branches.size(); i++) {
            result = ShuffleOperations.shuffle(result, branches.get(i));
            result.minimize();
        }
        return result;
    }

    /**
     * do (redo do)*, where redo is the choice between all redo-parts.
     */
    public static Automaton mkLoop(List<Automaton> parts) {
        Automaton body = parts.get(0);
        Automaton redo = BasicOperations.union(parts.subList(1, parts.size()));

        Automaton iteration = redo.concatenate(body).repeat();
        Automaton result = body.concatenate(iteration);
        result.minimize();
        return result;
    }

    private final class LanguageBuilder implements ProcessTreeVisitor<Automaton> {

        @Override
        public Automaton visitActivity(ProcessTree leaf) {
            return mkLeafNode(label2symbol.get(leaf.getLabel()));
        }

        @Override
        public Automaton visitTau(ProcessTree tau) {
            return mkTau();
        }

        @Override
        public Automaton visitSequence(ProcessTree node, List<Automaton> children) {
            return mkSequence(children);
        }

        @Override
        public Automaton visitExclusive(ProcessTree node, List<Automaton> children) {
            return mkExclusive(children);
        }

        @Override
        public Automaton visitParallel(ProcessTree node, List<Automaton> children) {
            return mkParallel(children);
        }

        @Override
        public Automaton visitLoop(ProcessTree node, List<Automaton> children) {
            return mkLoop(children);
        }
    }
}
