package polyc.codegen;

import polyc.analysis.DependenceAnalysis;
import polyc.analysis.ParallelismAnalyzer;
import polyc.hir.Expression;
import polyc.hir.ExpressionStatement;
import polyc.hir.ForLoop;
import polyc.hir.FunctionCall;
import polyc.hir.PrintTools;
import polyc.hir.Statement;
import polyc.poly.Relation;
import polyc.scop.AccessExpression;
import polyc.scop.Scop;
import polyc.scop.ScopArray;
import polyc.scop.ScopStatement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
* Builds the loop tree of a scop for a CPU target. The leaves are annotated
* with the index expressions of their accesses so that {@link CpuPrinter}
* can print the statement bodies; with OpenMP enabled, the outermost loops
* that carry no dependence are marked parallel.
*/
public class CpuCodeGen extends CodeGenPass {

    /** State shared by the callbacks of one tree construction. */
    public static class BuildInfo {

        public final Scop scop;

        public final Map<String, ScopStatement> statements;

        // Set while the loop being built is inside a parallel loop.
        public boolean in_parallel_for;

        public BuildInfo(Scop scop) {
            this.scop = scop;
            this.statements = new HashMap<String, ScopStatement>();
            for (ScopStatement stmt : scop.getStatements()) {
                statements.put(stmt.getName(), stmt);
            }
            this.in_parallel_for = false;
        }

    }

    private final boolean openmp;

    public CpuCodeGen(Scop scop, boolean openmp) {
        super(scop);
        this.openmp = openmp;
    }

    public String getPassName() {
        return "[CpuCodeGen]";
    }

    public void start() {
        tree = generate(scop, openmp);
    }

    /**
    * Builds the annotated tree of a scop.
    *
    * @param scop the scop.
    * @param openmp whether to mark parallel loops.
    * @return the root of the tree.
    * @throws CodeGenException if a leaf names no statement of the scop.
    */
    public static Statement generate(Scop scop, boolean openmp) {
        if (scop == null) {
            throw new IllegalArgumentException("no scop to generate code for");
        }
        if (openmp) {
            scop = DependenceAnalysis.ensureDependences(scop);
        }
        BuildInfo info = new BuildInfo(scop);
        AstBuild build = new AstBuild(scop.getContext());
        List<String> names = new ArrayList<String>();
        for (ScopArray array : scop.getArrays()) {
            names.add(array.getName());
        }
        build.reserveNames(names);
        build.setListener(openmp ?
                new ParallelLoopListener(info) : new LeafListener(info));
        Statement ret = build.build(
                scop.getSchedule().intersectDomain(scop.getDomain()));
        PrintTools.printlnStatus(4, "[CpuCodeGen] tree", ret);
        return ret;
    }

    /**
    * Attaches a {@link StatementAnnotation} to every leaf.
    */
    static class LeafListener implements AstBuildListener {

        protected final BuildInfo info;

        LeafListener(BuildInfo info) {
            this.info = info;
        }

        public void beforeFor(ForLoop loop, AstBuild build) {
        }

        public void afterFor(ForLoop loop, AstBuild build) {
        }

        public void atEachDomain(ExpressionStatement leaf, AstBuild build) {
            FunctionCall call = (FunctionCall)leaf.getExpression();
            String name = call.getName().toString();
            ScopStatement stmt = info.statements.get(name);
            if (stmt == null) {
                throw new CodeGenException("no statement named " + name);
            }
            List<AccessExpression> accesses = stmt.getAccesses();
            Relation reverse = build.getSchedule().getRelations().get(0)
                    .reverse();
            List<List<Expression>> index =
                    new ArrayList<List<Expression>>(accesses.size());
            for (AccessExpression access : accesses) {
                index.add(AccessTransformer.transform(
                        access.getRelation(), reverse, build));
            }
            leaf.annotate(new StatementAnnotation(stmt, index));
        }

    }

    /**
    * Also marks a loop parallel if no enclosing loop is parallel and the
    * loop carries no dependence.
    */
    static class ParallelLoopListener extends LeafListener {

        ParallelLoopListener(BuildInfo info) {
            super(info);
        }

        @Override
        public void beforeFor(ForLoop loop, AstBuild build) {
            LoopAnnotation note = new LoopAnnotation();
            if (!info.in_parallel_for &&
                ParallelismAnalyzer.isParallel(build.getSchedule(),
                        info.scop.getDepFlow(), info.scop.getDepFalse())) {
                note.setParallel();
                info.in_parallel_for = true;
            }
            loop.annotate(note);
        }

        @Override
        public void afterFor(ForLoop loop, AstBuild build) {
            LoopAnnotation note =
                    loop.getAnnotation(LoopAnnotation.class, "parallel");
            if (note != null && note.isParallel()) {
                info.in_parallel_for = false;
            }
        }

    }

}
