package polyc.hir;

import java.util.List;

/**
* IR objects that carry annotations. In the generated tree, loops and leaves
* are annotated by the code generator and read back by its printer.
*/
public interface Annotatable extends Traversable {

    /** Attaches the annotation to this object. */
    void annotate(Annotation annotation);

    /** Returns the attached annotations, possibly empty, never null. */
    List<Annotation> getAnnotations();

    /**
    * Returns the first annotation of the given type that contains the key,
    * or null if there is none.
    */
    <T extends Annotation> T getAnnotation(Class<T> type, String key);

}
