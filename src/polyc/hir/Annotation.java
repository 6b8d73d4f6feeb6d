package polyc.hir;

import java.util.HashMap;

/**
* <b>Annotation</b> is the base class of the information attached to IR
* objects. It is a map from keys to values so that sub classes only decide
* how the information is printed, if at all. Annotations are owned by the
* object they are attached to and go away with it.
*/
public abstract class Annotation extends HashMap<String, Object> {

    private static final long serialVersionUID = 1L;

    protected Annotation() {
        super();
    }

    /**
    * Returns the value associated with the key, cast to the type expected by
    * the caller.
    */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T)super.get(key);
    }

    /**
    * Returns the printed form, or an empty string for annotations that only
    * carry data for the code generator.
    */
    public abstract String toString();

    /** Annotations are compared by identity. */
    @Override
    public boolean equals(Object o) {
        return (o == this);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

}
