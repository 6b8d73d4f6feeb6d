package polyc.hir;

/**
* CommentAnnotation is used for annotations of comment type, e.g. the marker
* comment in front of generated code.
*/
public class CommentAnnotation extends Annotation {

    private static final long serialVersionUID = 3476L;

    private boolean one_liner;  // Is this printed in one line.

    /**
    * Constructs a new comment annotation with the given comment.
    */
    public CommentAnnotation(String comment) {
        super();
        // The termination mark would end the comment early.
        comment = comment.replaceAll("\\*/", "");
        put("comment", comment);
        one_liner = false;
    }

    /** Sets the one-liner flag, which prints the comment on a single line. */
    public void setOneLiner(boolean one_liner) {
        this.one_liner = one_liner;
    }

    @Override
    public String toString() {
        if (one_liner) {
            return ("/* " + get("comment") + " */");
        } else {
            return ("/*\n" + get("comment") + "\n*/");
        }
    }

}
