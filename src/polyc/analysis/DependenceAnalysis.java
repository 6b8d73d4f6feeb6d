package polyc.analysis;

import polyc.hir.PrintTools;
import polyc.poly.Relation;
import polyc.poly.UnionRelation;
import polyc.scop.AccessExpression;
import polyc.scop.Scop;
import polyc.scop.ScopStatement;

import java.util.ArrayList;
import java.util.List;

/**
* Computes memory-based dependences of a scop: pairs of statement instances
* that access the same element, at least one of them writing, with the
* source scheduled before the target. Flow dependences go from a write to a
* read, anti dependences from a read to a write and output dependences from
* a write to a write. Every value-based dependence is also a memory-based
* one, so the result may only be larger than needed.
*/
public class DependenceAnalysis {

    private final Scop scop;

    // Schedule of each statement, padded to a common length.
    private final List<Relation> schedules;

    private final Relation order;

    public DependenceAnalysis(Scop scop) {
        this.scop = scop;
        int n = 0;
        for (Relation r : scop.getSchedule().getRelations()) {
            n = Math.max(n, r.getSpace().getNumOut());
        }
        schedules = new ArrayList<Relation>();
        for (ScopStatement stmt : scop.getStatements()) {
            Relation s = scop.getSchedule().getRelationByName(stmt.getName());
            if (s == null) {
                throw new IllegalArgumentException(
                        "statement " + stmt.getName() + " is not scheduled");
            }
            schedules.add(s.padOutputs(n).intersectDomain(stmt.getDomain()));
        }
        order = Relation.lexLessThan(new ArrayList<String>(0), n);
    }

    /** Returns the flow dependences. */
    public UnionRelation computeFlow() {
        return compute(true, false);
    }

    /** Returns the anti and output dependences. */
    public UnionRelation computeFalse() {
        return compute(false, true).union(compute(true, true));
    }

    /**
    * Returns a copy of the scop with its dependences computed if the scop
    * does not provide them.
    */
    public static Scop ensureDependences(Scop scop) {
        if (scop.hasDependences()) {
            return scop;
        }
        DependenceAnalysis da = new DependenceAnalysis(scop);
        UnionRelation flow = da.computeFlow();
        UnionRelation false_deps = da.computeFalse();
        PrintTools.printlnStatus(2, "[DependenceAnalysis] flow", flow);
        PrintTools.printlnStatus(2, "[DependenceAnalysis] false", false_deps);
        return scop.withDependences(flow, false_deps);
    }

    /**
    * Collects the dependences from accesses of the source kind to accesses
    * of the target kind, a write if the flag is set and a read otherwise.
    */
    private UnionRelation compute(boolean source_write, boolean target_write) {
        UnionRelation ret = UnionRelation.empty();
        List<ScopStatement> stmts = scop.getStatements();
        for (int s = 0; s < stmts.size(); s++) {
            for (int t = 0; t < stmts.size(); t++) {
                Relation before = schedules.get(s).applyRange(order)
                        .applyRange(schedules.get(t).reverse());
                for (AccessExpression a : stmts.get(s).getAccesses()) {
                    if (!matches(a, source_write)) {
                        continue;
                    }
                    for (AccessExpression b : stmts.get(t).getAccesses()) {
                        if (!matches(b, target_write) ||
                            !a.getName().equals(b.getName()) ||
                            a.getRelation().getSpace().getNumOut() !=
                            b.getRelation().getSpace().getNumOut()) {
                            continue;
                        }
                        Relation dep = a.getRelation()
                                .intersectDomain(stmts.get(s).getDomain())
                                .applyRange(b.getRelation()
                                        .intersectDomain(stmts.get(t).getDomain())
                                        .reverse())
                                .intersect(before)
                                .removeEmpty();
                        if (!dep.getBasicRelations().isEmpty()) {
                            ret = ret.add(dep);
                        }
                    }
                }
            }
        }
        return ret;
    }

    private static boolean matches(AccessExpression a, boolean write) {
        return a.isNamed() && (write ? a.isWrite() : a.isRead());
    }

}
