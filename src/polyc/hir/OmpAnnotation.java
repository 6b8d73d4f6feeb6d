package polyc.hir;

import java.util.Arrays;
import java.util.List;

/**
* OmpAnnotation is used for OpenMP directives. Each directive is a key of the
* annotation and directives print in the order OpenMP expects them, so
* <pre>
*   OmpAnnotation.parallelFor()
* </pre>
* prints as {@code #pragma omp parallel for}.
*/
public class OmpAnnotation extends PragmaAnnotation {

    private static final long serialVersionUID = 3481L;

    // Directives in printing order.
    private static final List<String> directives =
            Arrays.asList("parallel", "for");

    /** Constructs an omp annotation without directives. */
    public OmpAnnotation() {
        super("omp");
    }

    /**
    * Returns the directive for worksharing the iterations of the next loop
    * among the threads of a new team.
    */
    public static OmpAnnotation parallelFor() {
        OmpAnnotation omp = new OmpAnnotation();
        omp.put("parallel", Boolean.TRUE);
        omp.put("for", Boolean.TRUE);
        return omp;
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder(40);
        str.append(super.toString());
        for (String directive : directives) {
            if (containsKey(directive)) {
                str.append(" ").append(directive);
            }
        }
        return str.toString();
    }

}
