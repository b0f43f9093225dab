package analysis.lifetime.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import analysis.lifetime.traversal.TraversalConfig;

import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;
import com.ibm.wala.util.graph.traverse.DFS;
import com.ibm.wala.util.graph.traverse.SCCIterator;

/**
 * Control flow graph of one function together with the variables it declares
 */
public final class FunctionBody {

    private final String name;
    private final int entry;
    /**
     * Declared variables, in declaration order
     */
    private final Map<String, Variable> variables;
    /**
     * Blocks by id, in the order given by the front end
     */
    private final Map<Integer, BasicBlock> blocks;
    /**
     * Name of the variable holding the return value, null if the function returns nothing
     */
    private final String returnVariable;
    /**
     * Traversal bounds requested for this function, null to use the analysis-wide policy
     */
    private final TraversalConfig traversalOverride;
    /**
     * Graph view of the blocks, computed on demand
     */
    private Graph<BasicBlock> cfg;

    private FunctionBody(Builder b) {
        this.name = b.name;
        this.entry = b.entry;
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(b.variables));
        this.blocks = Collections.unmodifiableMap(new LinkedHashMap<>(b.blocks));
        this.returnVariable = b.returnVariable;
        this.traversalOverride = b.traversalOverride;
    }

    public String getName() {
        return name;
    }

    public int getEntryId() {
        return entry;
    }

    public BasicBlock getEntry() {
        return getBlock(entry);
    }

    /**
     * Get the block with the given id
     *
     * @param id
     *            block id
     * @return the block
     * @throws MalformedBodyException
     *             if there is no such block
     */
    public BasicBlock getBlock(int id) {
        BasicBlock bb = blocks.get(id);
        if (bb == null) {
            throw new MalformedBodyException(name, "no block bb" + id);
        }
        return bb;
    }

    public Collection<BasicBlock> getBlocks() {
        return blocks.values();
    }

    public int getNumberOfBlocks() {
        return blocks.size();
    }

    public Map<String, Variable> getVariables() {
        return variables;
    }

    /**
     * Get the declaration for a variable
     *
     * @param varName
     *            name of the variable
     * @return declared variable
     * @throws MalformedBodyException
     *             if the variable is not declared
     */
    public Variable getVariable(String varName) {
        Variable v = variables.get(varName);
        if (v == null) {
            throw new MalformedBodyException(name, "undeclared variable " + varName);
        }
        return v;
    }

    public String getReturnVariable() {
        return returnVariable;
    }

    public TraversalConfig getTraversalOverride() {
        return traversalOverride;
    }

    /**
     * Check that every block, variable and projection referenced by this body exists and is consistent with the
     * declared types
     *
     * @throws MalformedBodyException
     *             describing the first problem found
     */
    public void validate() {
        getBlock(entry);
        if (returnVariable != null) {
            getVariable(returnVariable);
        }
        for (BasicBlock bb : blocks.values()) {
            for (Statement s : bb.getStatements()) {
                validatePlace(s.getTarget(), bb);
                for (Place p : s.getRvalue().getReadPlaces()) {
                    validatePlace(p, bb);
                }
            }
            Terminator t = bb.getTerminator();
            switch (t.getKind()) {
            case SWITCH:
                Place disc = ((Terminator.Switch) t).getDiscriminant();
                if (disc != null) {
                    validatePlace(disc, bb);
                }
                break;
            case CALL:
                Terminator.Call call = (Terminator.Call) t;
                for (Operand o : call.getArgs()) {
                    if (!o.isConstant()) {
                        validatePlace(o.getPlace(), bb);
                    }
                }
                if (call.getDestination() != null) {
                    validatePlace(call.getDestination(), bb);
                }
                break;
            case RELEASE:
                validatePlace(((Terminator.Release) t).getPlace(), bb);
                break;
            default:
                break;
            }
            for (Integer succ : t.getSuccessors()) {
                if (!blocks.containsKey(succ)) {
                    throw new MalformedBodyException(name, "bb" + bb.getId() + " jumps to missing block bb" + succ);
                }
            }
        }
    }

    /**
     * Compute the type of a place, checking each projection against the declared type of the base
     *
     * @param p
     *            place to check
     * @return type of the place
     * @throws MalformedBodyException
     *             if the base is undeclared or a projection does not apply
     */
    public TypeDescriptor typeOf(Place p) {
        TypeDescriptor t = getVariable(p.getBase()).getType();
        for (Projection proj : p.getProjections()) {
            try {
                t = t.project(proj);
            } catch (IllegalArgumentException e) {
                throw new MalformedBodyException(name, "ill-typed place " + p + ": " + e.getMessage(), e);
            }
        }
        return t;
    }

    private void validatePlace(Place p, BasicBlock bb) {
        try {
            typeOf(p);
        } catch (MalformedBodyException e) {
            throw new MalformedBodyException(name, "in bb" + bb.getId() + ", " + e.getMessage(), e);
        }
    }

    /**
     * Graph with one node per block and an edge for every (normal or unwind) successor
     *
     * @return control flow graph for this body
     * @throws MalformedBodyException
     *             if a terminator targets a missing block
     */
    public synchronized Graph<BasicBlock> getControlFlowGraph() {
        if (cfg == null) {
            SlowSparseNumberedGraph<BasicBlock> g = SlowSparseNumberedGraph.make();
            for (BasicBlock bb : blocks.values()) {
                g.addNode(bb);
            }
            for (BasicBlock bb : blocks.values()) {
                for (Integer succ : bb.getTerminator().getSuccessors()) {
                    g.addEdge(bb, getBlock(succ));
                }
            }
            cfg = g;
        }
        return cfg;
    }

    /**
     * Blocks reachable from the entry block
     *
     * @return set of reachable blocks
     */
    public Set<BasicBlock> getReachableBlocks() {
        return DFS.getReachableNodes(getControlFlowGraph(), Collections.singleton(getEntry()));
    }

    /**
     * Whether the control flow graph contains a loop
     *
     * @return true if some strongly connected component has more than one block or a block jumps to itself
     */
    public boolean hasLoop() {
        Graph<BasicBlock> g = getControlFlowGraph();
        Iterator<Set<BasicBlock>> sccs = new SCCIterator<>(g);
        while (sccs.hasNext()) {
            Set<BasicBlock> scc = sccs.next();
            if (scc.size() > 1) {
                return true;
            }
            BasicBlock only = scc.iterator().next();
            if (g.hasEdge(only, only)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "fn " + name;
    }

    /**
     * Incrementally assembles a {@link FunctionBody}
     */
    public static final class Builder {
        private final String name;
        private int entry = 0;
        private final Map<String, Variable> variables = new LinkedHashMap<>();
        private final Map<Integer, BasicBlock> blocks = new LinkedHashMap<>();
        private String returnVariable;
        private TraversalConfig traversalOverride;

        public Builder(String name) {
            this.name = name;
        }

        public Builder entry(int id) {
            this.entry = id;
            return this;
        }

        /**
         * Declare a variable
         *
         * @param v
         *            declaration
         * @return this builder
         * @throws MalformedBodyException
         *             if a variable with the same name was already declared
         */
        public Builder variable(Variable v) {
            if (variables.put(v.getName(), v) != null) {
                throw new MalformedBodyException(name, "duplicate variable " + v.getName());
            }
            return this;
        }

        public Builder local(String varName) {
            return variable(Variable.local(varName, TypeDescriptor.UNKNOWN));
        }

        public Builder staticItem(String varName) {
            return variable(Variable.staticItem(varName, TypeDescriptor.UNKNOWN));
        }

        /**
         * Add a block
         *
         * @param bb
         *            block to add
         * @return this builder
         * @throws MalformedBodyException
         *             if a block with the same id was already added
         */
        public Builder block(BasicBlock bb) {
            if (blocks.put(bb.getId(), bb) != null) {
                throw new MalformedBodyException(name, "duplicate block bb" + bb.getId());
            }
            return this;
        }

        public Builder block(int id, Terminator t, Statement... statements) {
            List<Statement> ss = new ArrayList<>(statements.length);
            Collections.addAll(ss, statements);
            return block(new BasicBlock(id, ss, t));
        }

        public Builder returnVariable(String varName) {
            this.returnVariable = varName;
            return this;
        }

        public Builder traversalOverride(TraversalConfig config) {
            this.traversalOverride = config;
            return this;
        }

        public FunctionBody build() {
            return new FunctionBody(this);
        }
    }
}
