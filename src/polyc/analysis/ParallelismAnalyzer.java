package polyc.analysis;

import polyc.hir.PrintTools;
import polyc.poly.Relation;
import polyc.poly.Space;
import polyc.poly.UnionRelation;

import java.util.ArrayList;

/**
* Decides whether a loop can run its iterations in parallel. The loop is
* given by the schedule of the statements inside it, truncated after the
* loop dimension. The loop is parallel if every dependence between two
* instances that share the iterations of the enclosing loops also shares the
* iteration of the loop itself.
*/
public final class ParallelismAnalyzer {

    private ParallelismAnalyzer() {
    }

    /**
    * Checks if the innermost dimension of a schedule prefix carries no
    * dependence.
    *
    * @param prefix the schedule of the statements in the loop, restricted to
    *   the dimensions up to and including the loop dimension.
    * @param flow the flow dependences.
    * @param false_deps the anti and output dependences.
    * @return true if the loop is parallel.
    */
    public static boolean isParallel(UnionRelation prefix, UnionRelation flow,
            UnionRelation false_deps) {
        UnionRelation deps = flow.union(false_deps);
        UnionRelation time = deps.applyRange(prefix).applyDomain(prefix);
        if (time.isEmpty()) {
            PrintTools.printlnStatus(3, "[ParallelismAnalyzer]",
                    "no dependence inside", prefix);
            return true;
        }
        boolean ret = true;
        for (Relation r : time.getRelations()) {
            Space space = r.getSpace();
            int depth = space.getNumOut() - 1;
            for (int i = 0; i < depth; i++) {
                r = r.equate(i, i);
            }
            Relation same = Relation.universe(Space.mapSpace(
                    new ArrayList<String>(0), space.getInName(), depth + 1,
                    space.getOutName(), depth + 1));
            for (int i = 0; i <= depth; i++) {
                same = same.equate(i, i);
            }
            if (!r.isSubset(same)) {
                PrintTools.printlnStatus(3, "[ParallelismAnalyzer]",
                        "carried", r);
                ret = false;
                break;
            }
        }
        return ret;
    }

}
