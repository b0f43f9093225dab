package analysis.lifetime.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Last instruction of a basic block, transfers control to zero or more successor blocks
 */
public abstract class Terminator {

    public enum Kind {
        GOTO, SWITCH, CALL, RELEASE, RETURN, UNREACHABLE
    }

    /**
     * Source span, may be null
     */
    private final String span;

    protected Terminator(String span) {
        this.span = span;
    }

    public abstract Kind getKind();

    /**
     * Successors taken when the terminator completes normally, in order
     *
     * @return ids of the normal successor blocks
     */
    public abstract List<Integer> getNormalSuccessors();

    /**
     * Successor taken when the terminator unwinds
     *
     * @return id of the cleanup block, or null if there is none
     */
    public Integer getUnwindSuccessor() {
        return null;
    }

    /**
     * Distinct successors in the order they should be explored: normal successors in terminator order followed by
     * the unwind successor
     *
     * @return ordered list of distinct successor ids
     */
    public final List<Integer> getSuccessors() {
        Set<Integer> succs = new LinkedHashSet<>(getNormalSuccessors());
        Integer unwind = getUnwindSuccessor();
        if (unwind != null) {
            succs.add(unwind);
        }
        return new ArrayList<>(succs);
    }

    public String getSpan() {
        return span;
    }

    /**
     * Unconditional jump
     */
    public static final class Goto extends Terminator {
        private final int target;

        public Goto(int target, String span) {
            super(span);
            this.target = target;
        }

        public int getTarget() {
            return target;
        }

        @Override
        public Kind getKind() {
            return Kind.GOTO;
        }

        @Override
        public List<Integer> getNormalSuccessors() {
            return Collections.singletonList(target);
        }

        @Override
        public String toString() {
            return "goto bb" + target;
        }
    }

    /**
     * Multi-way branch on an optional discriminant place
     */
    public static final class Switch extends Terminator {
        /**
         * Place inspected to choose the successor, null if the branch reads a constant
         */
        private final Place discriminant;
        private final List<Integer> targets;

        public Switch(Place discriminant, List<Integer> targets, String span) {
            super(span);
            this.discriminant = discriminant;
            this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        }

        public Place getDiscriminant() {
            return discriminant;
        }

        @Override
        public Kind getKind() {
            return Kind.SWITCH;
        }

        @Override
        public List<Integer> getNormalSuccessors() {
            return targets;
        }

        @Override
        public String toString() {
            return "switch(" + (discriminant == null ? "const" : discriminant.toString()) + ") -> " + targets;
        }
    }

    /**
     * Call of a named function. The callee body is never entered; its effect is only recognized by name.
     */
    public static final class Call extends Terminator {
        private final String callee;
        private final List<Operand> args;
        /**
         * Place receiving the return value, null if there is none
         */
        private final Place destination;
        /**
         * Block executed after a normal return, null if the callee diverges
         */
        private final Integer normalNext;
        private final Integer unwindNext;

        public Call(String callee, List<Operand> args, Place destination, Integer normalNext, Integer unwindNext,
                    String span) {
            super(span);
            this.callee = callee;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
            this.destination = destination;
            this.normalNext = normalNext;
            this.unwindNext = unwindNext;
        }

        public String getCallee() {
            return callee;
        }

        public List<Operand> getArgs() {
            return args;
        }

        public Place getDestination() {
            return destination;
        }

        public Integer getNormalNext() {
            return normalNext;
        }

        @Override
        public Integer getUnwindSuccessor() {
            return unwindNext;
        }

        @Override
        public Kind getKind() {
            return Kind.CALL;
        }

        @Override
        public List<Integer> getNormalSuccessors() {
            if (normalNext == null) {
                return Collections.emptyList();
            }
            return Collections.singletonList(normalNext);
        }

        @Override
        public String toString() {
            return (destination == null ? "" : destination + " = ") + callee + args;
        }
    }

    /**
     * Implicit end-of-scope release of a place
     */
    public static final class Release extends Terminator {
        private final Place place;
        private final int next;
        private final Integer unwindNext;

        public Release(Place place, int next, Integer unwindNext, String span) {
            super(span);
            this.place = place;
            this.next = next;
            this.unwindNext = unwindNext;
        }

        public Place getPlace() {
            return place;
        }

        public int getNext() {
            return next;
        }

        @Override
        public Integer getUnwindSuccessor() {
            return unwindNext;
        }

        @Override
        public Kind getKind() {
            return Kind.RELEASE;
        }

        @Override
        public List<Integer> getNormalSuccessors() {
            return Collections.singletonList(next);
        }

        @Override
        public String toString() {
            return "release(" + place + ") -> bb" + next;
        }
    }

    public static final class Return extends Terminator {
        public Return(String span) {
            super(span);
        }

        @Override
        public Kind getKind() {
            return Kind.RETURN;
        }

        @Override
        public List<Integer> getNormalSuccessors() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return "return";
        }
    }

    public static final class Unreachable extends Terminator {
        public Unreachable(String span) {
            super(span);
        }

        @Override
        public Kind getKind() {
            return Kind.UNREACHABLE;
        }

        @Override
        public List<Integer> getNormalSuccessors() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return "unreachable";
        }
    }
}
