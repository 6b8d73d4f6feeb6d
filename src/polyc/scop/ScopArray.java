package polyc.scop;

import polyc.hir.DeclarationStatement;
import polyc.hir.Expression;
import polyc.hir.Identifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* An array accessed by a scop. A declared array is declared by the generated
* code; an exposed one is visible outside the region, so a declared array
* that is not exposed is a temporary local to the generated code.
*/
public class ScopArray {

    private final String name;

    private final String type;

    private final List<Expression> extents;

    private final boolean declared;

    private final boolean exposed;

    /**
    * Creates an array description.
    *
    * @param name the array name.
    * @param type the element type.
    * @param extents the size of each dimension, outermost first; empty for
    *   a scalar.
    * @param declared true if the generated code declares the array.
    * @param exposed true if the array is visible outside the region.
    */
    public ScopArray(String name, String type, List<Expression> extents,
            boolean declared, boolean exposed) {
        this.name = name;
        this.type = type;
        this.extents = Collections.unmodifiableList(
                new ArrayList<Expression>(extents));
        this.declared = declared;
        this.exposed = exposed;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public List<Expression> getExtents() {
        return extents;
    }

    /** Returns the number of dimensions. */
    public int getDimension() {
        return extents.size();
    }

    public boolean isDeclared() {
        return declared;
    }

    public boolean isExposed() {
        return exposed;
    }

    /** Returns a fresh declaration of the array, e.g. {@code float A[N];}. */
    public DeclarationStatement getDeclaration() {
        List<Expression> dims = new ArrayList<Expression>(extents.size());
        for (Expression e : extents) {
            dims.add(e.clone());
        }
        return new DeclarationStatement(type, new Identifier(name), dims, null);
    }

    @Override
    public String toString() {
        return getDeclaration().toString();
    }

}
