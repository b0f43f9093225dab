package analysis.lifetime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.lifetime.binding.BindingManager;
import analysis.lifetime.binding.ReleaseKind;
import analysis.lifetime.binding.ReleaseRecord;
import analysis.lifetime.binding.ReleaseState;
import analysis.lifetime.ir.BasicBlock;
import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.Operand;
import analysis.lifetime.ir.Place;
import analysis.lifetime.ir.Rvalue;
import analysis.lifetime.ir.SourceLocation;
import analysis.lifetime.ir.Statement;
import analysis.lifetime.ir.Terminator;
import analysis.lifetime.place.PlaceId;
import analysis.lifetime.place.PlaceIdEncoder;
import analysis.lifetime.traversal.BlockVisitor;
import analysis.lifetime.traversal.PathContext;

/**
 * Simulates the statements and terminator of a block on the binding state of one path and records use-after-release
 * and double-release violations.
 * <p>
 * Moves and borrows bind the base variables of their source and target. Releases and reads use the full,
 * projection-aware id of a place. Assigning to a released place reinitializes its whole group. Places whose base has
 * static storage, or holds an address obtained from an address-of helper, are never released or bound.
 */
public class LifetimeViolationDetector implements BlockVisitor {

    private final FunctionBody body;
    private final PlaceIdEncoder encoder;
    private final CalleeClassifier classifier;
    /**
     * Findings in the order they were detected, across all visits
     */
    private final List<Finding> findings = new ArrayList<>();
    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    /**
     * Create a detector for one function
     *
     * @param body
     *            function being analyzed
     * @param encoder
     *            encoder for the places of <code>body</code>
     * @param classifier
     *            recognizes release, alias and address-of callees
     */
    public LifetimeViolationDetector(FunctionBody body, PlaceIdEncoder encoder, CalleeClassifier classifier) {
        this.body = body;
        this.encoder = encoder;
        this.classifier = classifier;
    }

    @Override
    public void visitBlock(BasicBlock bb, PathContext context, BindingManager state) {
        List<Statement> statements = bb.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            processStatement(statements.get(i), bb.getLocation(i), context, state);
        }
        processTerminator(bb.getTerminator(), bb.getLocation(SourceLocation.TERMINATOR), context, state);
    }

    /**
     * Simulate one assignment
     *
     * @param s
     *            assignment
     * @param loc
     *            location of the assignment
     * @param context
     *            path context of the current visit
     * @param state
     *            binding state of the current path
     */
    private void processStatement(Statement s, SourceLocation loc, PathContext context, BindingManager state) {
        Place target = s.getTarget();
        Rvalue rv = s.getRvalue();
        reinitialize(target, loc, state);
        overwrite(target, state);
        switch (rv.getKind()) {
        case MOVE:
        case BORROW:
            Place source = rv.getSource();
            checkUse(source, loc, context, state);
            if (!isExcluded(source, state) && !isExcluded(target, state)) {
                state.bind(encoder.baseId(source), encoder.baseId(target));
            }
            break;
        case COPY:
        case OTHER:
            for (Place p : rv.getReadPlaces()) {
                checkUse(p, loc, context, state);
            }
            break;
        default:
            throw new RuntimeException("Unhandled rvalue kind " + rv.getKind());
        }
    }

    /**
     * Simulate a terminator
     *
     * @param t
     *            terminator
     * @param loc
     *            location of the terminator
     * @param context
     *            path context of the current visit
     * @param state
     *            binding state of the current path
     */
    private void processTerminator(Terminator t, SourceLocation loc, PathContext context, BindingManager state) {
        switch (t.getKind()) {
        case GOTO:
        case UNREACHABLE:
            return;
        case SWITCH:
            Place disc = ((Terminator.Switch) t).getDiscriminant();
            if (disc != null) {
                checkUse(disc, loc, context, state);
            }
            return;
        case RELEASE:
            release(((Terminator.Release) t).getPlace(), ReleaseKind.IMPLICIT_SCOPE_END, loc, context, state);
            return;
        case RETURN:
            if (body.getReturnVariable() != null) {
                checkUse(Place.of(body.getReturnVariable()), loc, context, state);
            }
            return;
        case CALL:
            processCall((Terminator.Call) t, loc, context, state);
            return;
        default:
            throw new RuntimeException("Unhandled terminator kind " + t.getKind());
        }
    }

    private void processCall(Terminator.Call call, SourceLocation loc, PathContext context, BindingManager state) {
        String callee = call.getCallee();
        List<Operand> args = call.getArgs();
        Place first = args.isEmpty() || args.get(0).isConstant() ? null : args.get(0).getPlace();
        boolean releases = first != null && classifier.isExplicitRelease(callee);

        for (int i = 0; i < args.size(); i++) {
            Operand arg = args.get(i);
            if (arg.isConstant() || (releases && i == 0)) {
                continue;
            }
            checkUse(arg.getPlace(), loc, context, state);
        }
        if (releases) {
            release(first, ReleaseKind.EXPLICIT_RELEASE_CALL, loc, context, state);
        }

        Place dest = call.getDestination();
        if (dest == null) {
            return;
        }
        reinitialize(dest, loc, state);
        if (classifier.isStaticAddressOf(callee)) {
            state.markStaticDerived(encoder.baseId(dest));
            if (outputLevel >= 2) {
                System.err.println("STATIC ADDRESS " + dest + " = " + callee + " at " + loc + " in " + body.getName());
            }
        } else {
            overwrite(dest, state);
            if (first != null && classifier.isAliasProducing(callee) && !isExcluded(first, state)
                    && !isExcluded(dest, state)) {
                state.bind(encoder.baseId(first), encoder.baseId(dest));
            }
        }
    }

    /**
     * Clear the release state of a place that is being written, if it was released
     */
    private void reinitialize(Place target, SourceLocation loc, BindingManager state) {
        PlaceId id = encoder.encode(target);
        if (state.isReleased(id)) {
            state.unrelease(id);
            if (outputLevel >= 2) {
                System.err.println("REINITIALIZED " + id + " at " + loc + " in " + body.getName());
            }
        }
    }

    /**
     * A write to a whole variable drops any earlier static address it held
     */
    private void overwrite(Place target, BindingManager state) {
        if (target.isBare()) {
            state.clearStaticDerived(encoder.baseId(target));
        }
    }

    /**
     * Release a place, reporting a double release if its group was already released
     */
    private void release(Place p, ReleaseKind kind, SourceLocation loc, PathContext context, BindingManager state) {
        if (isExcluded(p, state)) {
            return;
        }
        PlaceId id = encoder.encode(p);
        ReleaseRecord previous = state.release(id, kind, loc, body.getName());
        if (previous != null) {
            ReleaseRecord current = state.getReleaseState(id).getRecord();
            record(Finding.doubleRelease(id, loc, state.findGroup(id), previous, current, context,
                                         isThroughRawPointer(id)));
        }
    }

    /**
     * Check that a place that is read does not denote a released resource, reporting at most one finding
     */
    private void checkUse(Place p, SourceLocation loc, PathContext context, BindingManager state) {
        PlaceId id = encoder.encode(p);
        checkUse(id, isThroughRawPointer(id), loc, context, state);
    }

    /**
     * Check a read of the place with the given id. The place read by a leading dereference is checked first, then
     * the portion before a trailing dereference, then the place itself.
     *
     * @param rawPointerRead
     *            whether the place originally read dereferences a raw pointer
     * @return true if a violation was reported
     */
    private boolean checkUse(PlaceId id, boolean rawPointerRead, SourceLocation loc, PathContext context,
                             BindingManager state) {
        if (id.hasPrefixDeref() && checkUse(id.getDerefOperand(), rawPointerRead, loc, context, state)) {
            return true;
        }
        if (id.hasSuffixDeref() && checkUse(id.getSuffixDerefPrefix(), rawPointerRead, loc, context, state)) {
            return true;
        }
        ReleaseState rs = state.getReleaseState(id);
        if (!rs.isReleased()) {
            return false;
        }
        record(Finding.useAfterRelease(id, loc, state.findGroup(id), rs.getRecord(), context, rawPointerRead));
        return true;
    }

    private boolean isExcluded(Place p, BindingManager state) {
        return encoder.isStatic(p) || state.isStaticDerived(encoder.baseId(p));
    }

    private boolean isThroughRawPointer(PlaceId id) {
        return id.hasDeref() && encoder.isRawPointer(Place.of(id.getBaseName()));
    }

    private void record(Finding f) {
        findings.add(f);
        if (outputLevel >= 2) {
            System.err.println("FOUND " + f + " in " + body.getName());
        }
    }

    /**
     * All findings recorded so far, in detection order
     *
     * @return findings
     */
    public List<Finding> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    /**
     * Set the level of debug output written to standard error
     *
     * @param level
     *            higher means more output
     */
    public void setOutputLevel(int level) {
        outputLevel = level;
    }
}
