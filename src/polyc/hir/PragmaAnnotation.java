package polyc.hir;

/**
* PragmaAnnotation is used for annotations of pragma type. The key
* <tt>pragma</tt> holds the pragma name that follows the <tt>#pragma</tt>
* keyword; sub classes append their own directives after it.
*/
public class PragmaAnnotation extends Annotation {

    private static final long serialVersionUID = 3470L;

    /**
    * Constructs a pragma with the given name.
    *
    * @param pragma the name after {@code #pragma}, e.g. {@code omp}.
    */
    public PragmaAnnotation(String pragma) {
        super();
        put("pragma", pragma);
    }

    @Override
    public String toString() {
        String pragma = get("pragma");
        return "#pragma " + pragma;
    }

}
