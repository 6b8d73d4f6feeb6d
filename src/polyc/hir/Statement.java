package polyc.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
* Base class for all statements of the generated tree. Statements own their
* parts and their annotations: an annotation lives exactly as long as the
* statement it is attached to.
*/
public abstract class Statement implements Traversable, Annotatable {

    private Traversable parent;

    /** The parts of the statement, in printing order. */
    protected List<Traversable> children;

    private List<Annotation> annotations;

    /** Creates a statement without parts. */
    protected Statement() {
        parent = null;
        children = new ArrayList<Traversable>(4);
        annotations = null;
    }

    /**
    * Creates a statement owning the given parts.
    *
    * @throws NotAnOrphanException if a part already has a parent.
    */
    protected Statement(List<? extends Traversable> parts) {
        this();
        for (Traversable t : parts) {
            adopt(t);
        }
    }

    /**
    * Appends a part to this statement.
    *
    * @throws NotAnOrphanException if <var>t</var> has a parent.
    */
    protected void adopt(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(t + " in " + getClass().getName());
        }
        children.add(t);
        t.setParent(this);
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    /**
    * Replaces the <var>index</var>th part by <var>t</var>.
    *
    * @throws NotAnOrphanException if <var>t</var> has a parent.
    */
    public void setChild(int index, Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(t.toString());
        }
        children.get(index).setParent(null);
        children.set(index, t);
        t.setParent(this);
    }

    /**
    * Prints the statement alone; annotations are printed by the code
    * generator's printer, which knows where each kind belongs.
    */
    public abstract void print(PrintWriter o);

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(80);
        print(new PrintWriter(sw));
        return sw.toString();
    }

    public void annotate(Annotation annotation) {
        if (annotations == null) {
            annotations = new LinkedList<Annotation>();
        }
        annotations.add(annotation);
    }

    public List<Annotation> getAnnotations() {
        if (annotations == null) {
            return Collections.emptyList();
        }
        return annotations;
    }

    public <T extends Annotation> T getAnnotation(Class<T> type, String key) {
        for (Annotation annotation : getAnnotations()) {
            if (type.isInstance(annotation) && annotation.containsKey(key)) {
                return type.cast(annotation);
            }
        }
        return null;
    }

}
