package polyc.poly;

import polyc.hir.UnsupportedInput;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* A finite union of {@link BasicRelation}s over one {@link Space}. A set is a
* relation whose space is a set space. Relations are immutable.
*/
public final class Relation {

    private final Space space;
    private final List<BasicRelation> pieces;

    /**
    * Creates the union of the given pieces, which must all have the tuples
    * of <var>space</var>; their parameters are aligned to those of
    * <var>space</var> extended with any missing ones.
    */
    public Relation(Space space, List<BasicRelation> pieces) {
        List<String> params = space.getParams();
        for (BasicRelation b : pieces) {
            if (!b.getSpace().tuplesMatch(space)) {
                throw new IllegalArgumentException(
                        "piece " + b.getSpace() + " is not in " + space);
            }
            params = Space.mergeParams(params, b.getSpace().getParams());
        }
        this.space = space.withParams(params);
        List<BasicRelation> aligned = new ArrayList<BasicRelation>(pieces.size());
        for (BasicRelation b : pieces) {
            aligned.add(b.alignParams(params));
        }
        this.pieces = Collections.unmodifiableList(aligned);
    }

    /** Returns the relation made of a single basic relation. */
    public static Relation fromBasic(BasicRelation b) {
        List<BasicRelation> list = new ArrayList<BasicRelation>(1);
        list.add(b);
        return new Relation(b.getSpace(), list);
    }

    /** Returns the empty relation over the given space. */
    public static Relation empty(Space space) {
        return new Relation(space, new ArrayList<BasicRelation>(0));
    }

    /** Returns the relation without constraints over the given space. */
    public static Relation universe(Space space) {
        return fromBasic(BasicRelation.universe(space));
    }

    /**
    * Returns the strict lexicographic order on unnamed tuples of
    * <var>n</var> dimensions: {@code [t] -> [u]} with {@code t << u}.
    */
    public static Relation lexLessThan(List<String> params, int n) {
        Space space = Space.mapSpace(params, null, n, null, n);
        List<BasicRelation> list = new ArrayList<BasicRelation>(n);
        for (int k = 0; k < n; k++) {
            BasicRelation b = BasicRelation.universe(space);
            for (int i = 0; i < k; i++) {
                b = b.equate(i, i);
            }
            long[] row = new long[space.getNumColumns()];
            row[space.outColumn(k)] = 1;
            row[space.inColumn(k)] = -1;
            row[0] = -1;
            list.add(b.addInequality(row));
        }
        return new Relation(space, list);
    }

    public Space getSpace() {
        return space;
    }

    /** Returns the pieces of the union. */
    public List<BasicRelation> getBasicRelations() {
        return pieces;
    }

    /** Returns this relation over a superset of its parameters. */
    public Relation alignParams(List<String> params) {
        List<BasicRelation> list = new ArrayList<BasicRelation>(pieces.size());
        for (BasicRelation b : pieces) {
            list.add(b.alignParams(params));
        }
        return new Relation(space.withParams(params), list);
    }

    /** Returns the union with a relation of the same tuples. */
    public Relation union(Relation other) {
        List<BasicRelation> list = new ArrayList<BasicRelation>(pieces);
        list.addAll(other.pieces);
        return new Relation(space.withParams(space.mergeParams(other.space)),
                list);
    }

    /** Returns the intersection with a relation of the same tuples. */
    public Relation intersect(Relation other) {
        List<BasicRelation> list = new ArrayList<BasicRelation>();
        for (BasicRelation a : pieces) {
            for (BasicRelation b : other.pieces) {
                addNonEmpty(list, a.intersect(b));
            }
        }
        return new Relation(space.withParams(space.mergeParams(other.space)),
                list);
    }

    /** Returns this map with its input restricted to the given set. */
    public Relation intersectDomain(Relation set) {
        List<BasicRelation> list = new ArrayList<BasicRelation>();
        for (BasicRelation a : pieces) {
            for (BasicRelation b : set.pieces) {
                addNonEmpty(list, a.intersectDomain(b));
            }
        }
        return new Relation(space.withParams(space.mergeParams(set.space)),
                list);
    }

    /** Returns this relation with its output restricted to the given set. */
    public Relation intersectRange(Relation set) {
        List<BasicRelation> list = new ArrayList<BasicRelation>();
        for (BasicRelation a : pieces) {
            for (BasicRelation b : set.pieces) {
                addNonEmpty(list, a.intersectRange(b));
            }
        }
        return new Relation(space.withParams(space.mergeParams(set.space)),
                list);
    }

    /** Returns this relation restricted to a parameter domain. */
    public Relation intersectParams(Relation context) {
        List<BasicRelation> list = new ArrayList<BasicRelation>();
        for (BasicRelation a : pieces) {
            for (BasicRelation b : context.pieces) {
                addNonEmpty(list, a.intersectParams(b));
            }
        }
        return new Relation(
                space.withParams(space.mergeParams(context.space)), list);
    }

    private static void addNonEmpty(List<BasicRelation> list, BasicRelation b) {
        BasicRelation s = b.simplify();
        if (!s.isEmpty()) {
            list.add(s);
        }
    }

    /** Returns the relation with input and output swapped. */
    public Relation reverse() {
        List<BasicRelation> list = new ArrayList<BasicRelation>(pieces.size());
        for (BasicRelation b : pieces) {
            list.add(b.reverse());
        }
        return new Relation(space.reverse(), list);
    }

    /**
    * Composes this relation X -&gt; Y with <var>next</var> Y -&gt; Z.
    */
    public Relation applyRange(Relation next) {
        Space target;
        if (space.isSet()) {
            target = next.space.range();
        } else {
            target = Space.mapSpace(space.mergeParams(next.space),
                    space.getInName(), space.getInDimNames(),
                    next.space.getOutName(), next.space.getOutDimNames());
        }
        List<BasicRelation> list = new ArrayList<BasicRelation>();
        for (BasicRelation a : pieces) {
            for (BasicRelation b : next.pieces) {
                addNonEmpty(list, a.applyRange(b));
            }
        }
        return new Relation(target.withParams(
                space.mergeParams(next.space)), list);
    }

    /**
    * Applies <var>map</var> X -&gt; Z to the input of this relation
    * X -&gt; Y, giving Z -&gt; Y.
    */
    public Relation applyDomain(Relation map) {
        return map.reverse().applyRange(this);
    }

    /** Returns this relation with an input equal to an output. */
    public Relation equate(int in_pos, int out_pos) {
        List<BasicRelation> list = new ArrayList<BasicRelation>(pieces.size());
        for (BasicRelation b : pieces) {
            addNonEmpty(list, b.equate(in_pos, out_pos));
        }
        return new Relation(space, list);
    }

    /** Returns the set of inputs. */
    public Relation domain() {
        List<BasicRelation> list = new ArrayList<BasicRelation>(pieces.size());
        for (BasicRelation b : pieces) {
            list.add(b.domain());
        }
        return new Relation(space.domain(), list);
    }

    /** Returns the set of outputs. */
    public Relation range() {
        List<BasicRelation> list = new ArrayList<BasicRelation>(pieces.size());
        for (BasicRelation b : pieces) {
            list.add(b.range());
        }
        return new Relation(space.range(), list);
    }

    /** Keeps the first <var>n</var> output dimensions. */
    public Relation truncateOutputs(int n) {
        List<BasicRelation> list = new ArrayList<BasicRelation>(pieces.size());
        for (BasicRelation b : pieces) {
            list.add(b.truncateOutputs(n));
        }
        return new Relation(space.withNumOut(Math.min(n, space.getNumOut())),
                list);
    }

    /** Appends output dimensions fixed to zero until there are <var>n</var>. */
    public Relation padOutputs(int n) {
        List<BasicRelation> list = new ArrayList<BasicRelation>(pieces.size());
        for (BasicRelation b : pieces) {
            list.add(b.padOutputs(n));
        }
        return new Relation(space.withNumOut(Math.max(n, space.getNumOut())),
                list);
    }

    /** Checks if no piece holds an integer point. */
    public boolean isEmpty() {
        for (BasicRelation b : pieces) {
            if (!b.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /** Returns this relation without its empty pieces. */
    public Relation removeEmpty() {
        List<BasicRelation> list = new ArrayList<BasicRelation>(pieces.size());
        for (BasicRelation b : pieces) {
            addNonEmpty(list, b);
        }
        return new Relation(space, list);
    }

    /**
    * Returns the points of this relation not in <var>other</var>, which must
    * be free of existential variables after simplification.
    *
    * @throws UnsupportedInput if <var>other</var> has existentials.
    */
    public Relation subtract(Relation other) {
        if (!space.tuplesMatch(other.space)) {
            throw new IllegalArgumentException(
                    "spaces do not match: " + space + " and " + other.space);
        }
        List<String> params = space.mergeParams(other.space);
        List<BasicRelation> current = new ArrayList<BasicRelation>();
        for (BasicRelation a : pieces) {
            current.add(a.alignParams(params));
        }
        for (BasicRelation raw : other.pieces) {
            BasicRelation b = raw.alignParams(params).simplify();
            if (b.getNumExists() > 0) {
                throw new UnsupportedInput(
                        "cannot subtract a relation with existentials: " + b);
            }
            List<Constraint> cs = b.getConstraints();
            List<BasicRelation> next = new ArrayList<BasicRelation>();
            for (BasicRelation c : current) {
                BasicRelation prefix = c;
                for (Constraint k : cs) {
                    long[] row = widen(k.getCoefficients(), c.getNumColumns());
                    long[] below = Rows.negate(row);
                    below[0] -= 1;
                    addNonEmpty(next, prefix.addInequality(below));
                    if (k.isEquality()) {
                        long[] above = row.clone();
                        above[0] -= 1;
                        addNonEmpty(next, prefix.addInequality(above));
                        prefix = prefix.addEquality(row);
                    } else {
                        prefix = prefix.addInequality(row);
                    }
                }
            }
            current = next;
        }
        return new Relation(space.withParams(params), current);
    }

    private static long[] widen(long[] row, int width) {
        return Arrays.copyOf(row, width);
    }

    /** Checks if every point of this relation is in <var>other</var>. */
    public boolean isSubset(Relation other) {
        return subtract(other).isEmpty();
    }

    /**
    * Converts this map into a piecewise multi-affine function of its input,
    * merging pieces with identical expressions.
    *
    * @throws UnsupportedInput if the map is not single-valued with affine
    *   pieces.
    */
    public PwMultiAff toPwMultiAff() {
        return PwMultiAff.fromRelation(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80);
        if (space.getNumParams() > 0) {
            sb.append(space.getParams()).append(" -> ");
        }
        sb.append("{ ");
        for (int i = 0; i < pieces.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            BasicRelation b = pieces.get(i);
            sb.append(b.tupleString());
            String c = b.constraintsString();
            if (c.length() > 0) {
                sb.append(" : ").append(c);
            }
        }
        sb.append(" }");
        return sb.toString();
    }

}
