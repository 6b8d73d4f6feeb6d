package polyc.codegen;

import polyc.hir.Annotation;

/**
* Records the code generation decisions for one generated loop. The only
* decision is whether the loop runs its iterations in parallel; it starts
* out false and can be set once, before the loop body is built.
*/
public class LoopAnnotation extends Annotation {

    private static final long serialVersionUID = 1L;

    /** Creates a sequential loop annotation. */
    public LoopAnnotation() {
        super();
        put("parallel", Boolean.FALSE);
    }

    /** Checks if the annotated loop is parallel. */
    public boolean isParallel() {
        return Boolean.TRUE.equals(get("parallel"));
    }

    /**
    * Marks the annotated loop parallel.
    *
    * @throws IllegalStateException if the loop is already marked.
    */
    public void setParallel() {
        if (isParallel()) {
            throw new IllegalStateException("loop already marked parallel");
        }
        put("parallel", Boolean.TRUE);
    }

    @Override
    public String toString() {
        return "";
    }

}
