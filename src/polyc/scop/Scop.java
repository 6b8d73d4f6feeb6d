package polyc.scop;

import polyc.poly.Relation;
import polyc.poly.UnionRelation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* A static control part: the parameter context, the iteration domains and
* the schedule of its statements, the flow and false dependences between
* statement instances, the arrays it accesses and the place of the region in
* the source text. A scop is read-only once created.
*/
public class Scop {

    private final Relation context;

    private final UnionRelation domain;

    private final UnionRelation schedule;

    private final UnionRelation dep_flow;

    private final UnionRelation dep_false;

    private final List<ScopStatement> statements;

    private final List<ScopArray> arrays;

    private final int start;

    private final int end;

    /**
    * Creates a scop. The iteration domain is the union of the statement
    * domains.
    *
    * @param context the parameter domain.
    * @param schedule the schedule of all statements.
    * @param dep_flow the flow dependences, or null if unknown.
    * @param dep_false the anti and output dependences, or null if unknown.
    * @param statements the statements in source order.
    * @param arrays the arrays in declaration order.
    * @param start the offset of the first character of the region.
    * @param end the offset just after the region.
    */
    public Scop(Relation context, UnionRelation schedule,
            UnionRelation dep_flow, UnionRelation dep_false,
            List<ScopStatement> statements, List<ScopArray> arrays,
            int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                    "invalid region [" + start + ", " + end + ")");
        }
        this.context = context;
        this.schedule = schedule;
        this.dep_flow = dep_flow;
        this.dep_false = dep_false;
        this.statements = Collections.unmodifiableList(
                new ArrayList<ScopStatement>(statements));
        this.arrays = Collections.unmodifiableList(
                new ArrayList<ScopArray>(arrays));
        UnionRelation d = UnionRelation.empty();
        for (ScopStatement stmt : statements) {
            d = d.add(stmt.getDomain());
        }
        this.domain = d;
        this.start = start;
        this.end = end;
    }

    /**
    * Returns a copy of this scop with the given dependences.
    */
    public Scop withDependences(UnionRelation flow, UnionRelation false_deps) {
        return new Scop(context, schedule, flow, false_deps,
                statements, arrays, start, end);
    }

    public Relation getContext() {
        return context;
    }

    public UnionRelation getDomain() {
        return domain;
    }

    public UnionRelation getSchedule() {
        return schedule;
    }

    /** Returns the flow dependences, or null if they were not given. */
    public UnionRelation getDepFlow() {
        return dep_flow;
    }

    /** Returns the false dependences, or null if they were not given. */
    public UnionRelation getDepFalse() {
        return dep_false;
    }

    /** Checks if both dependence relations are known. */
    public boolean hasDependences() {
        return (dep_flow != null && dep_false != null);
    }

    public List<ScopStatement> getStatements() {
        return statements;
    }

    public List<ScopArray> getArrays() {
        return arrays;
    }

    /** Returns the offset of the first character of the region. */
    public int getStart() {
        return start;
    }

    /** Returns the offset just after the last character of the region. */
    public int getEnd() {
        return end;
    }

    /** Checks if some array is declared but not exposed. */
    public boolean hasHiddenArrays() {
        for (ScopArray a : arrays) {
            if (a.isDeclared() && !a.isExposed()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(200);
        sb.append("context ").append(context).append("\n");
        for (ScopArray a : arrays) {
            sb.append("array ").append(a).append("\n");
        }
        for (ScopStatement s : statements) {
            sb.append("statement ").append(s.getDomain()).append("\n  ");
            sb.append(s.getBody()).append(";\n");
        }
        sb.append("schedule ").append(schedule).append("\n");
        return sb.toString();
    }

}
