package polyc.poly;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
* A union of relations living in different spaces, keyed by their tuples,
* such as the schedule of all statements of a scop or a dependence relation
* between statement pairs. Entries keep the order in which their tuples were
* first added. Union relations are immutable.
*/
public final class UnionRelation {

    private final Map<String, Relation> map;

    private UnionRelation(Map<String, Relation> map) {
        this.map = Collections.unmodifiableMap(map);
    }

    /** Returns the empty union. */
    public static UnionRelation empty() {
        return new UnionRelation(new LinkedHashMap<String, Relation>());
    }

    /** Returns the union holding a single relation. */
    public static UnionRelation of(Relation r) {
        return empty().add(r);
    }

    /** Returns the union of the given relations. */
    public static UnionRelation of(Collection<Relation> relations) {
        UnionRelation ret = empty();
        for (Relation r : relations) {
            ret = ret.add(r);
        }
        return ret;
    }

    /** Returns this union with one more relation. */
    public UnionRelation add(Relation r) {
        Map<String, Relation> m = new LinkedHashMap<String, Relation>(map);
        String key = r.getSpace().getTupleKey();
        Relation old = m.get(key);
        m.put(key, (old == null) ? r : old.union(r));
        return new UnionRelation(m);
    }

    /** Returns the union of two unions. */
    public UnionRelation union(UnionRelation other) {
        UnionRelation ret = this;
        for (Relation r : other.map.values()) {
            ret = ret.add(r);
        }
        return ret;
    }

    /** Returns the relations, one per space. */
    public List<Relation> getRelations() {
        return new ArrayList<Relation>(map.values());
    }

    /** Returns the relation of the given tuple key or null. */
    public Relation getRelation(String tuple_key) {
        return map.get(tuple_key);
    }

    /**
    * Returns the relation whose input tuple, or set tuple, has the given
    * name, or null if there is none.
    */
    public Relation getRelationByName(String name) {
        for (Relation r : map.values()) {
            Space s = r.getSpace();
            String n = s.isSet() ? s.getOutName() : s.getInName();
            if (name.equals(n)) {
                return r;
            }
        }
        return null;
    }

    /** Returns the number of spaces in the union. */
    public int getNumRelations() {
        return map.size();
    }

    /**
    * Restricts the input of each map to the set of the same tuple; maps
    * without a matching set are dropped.
    */
    public UnionRelation intersectDomain(UnionRelation sets) {
        UnionRelation ret = empty();
        for (Relation r : map.values()) {
            for (Relation s : sets.map.values()) {
                if (r.getSpace().domainMatches(s.getSpace())) {
                    Relation x = r.intersectDomain(s);
                    if (!x.getBasicRelations().isEmpty()) {
                        ret = ret.add(x);
                    }
                }
            }
        }
        return ret;
    }

    /** Restricts every relation to a parameter domain. */
    public UnionRelation intersectParams(Relation context) {
        UnionRelation ret = empty();
        for (Relation r : map.values()) {
            ret = ret.add(r.intersectParams(context));
        }
        return ret;
    }

    /**
    * Composes every relation of this union with every relation of
    * <var>next</var> whose input tuple matches its output tuple.
    */
    public UnionRelation applyRange(UnionRelation next) {
        UnionRelation ret = empty();
        for (Relation a : map.values()) {
            for (Relation b : next.map.values()) {
                if (a.getSpace().rangeMatchesDomainOf(b.getSpace())) {
                    Relation x = a.applyRange(b);
                    if (!x.getBasicRelations().isEmpty()) {
                        ret = ret.add(x);
                    }
                }
            }
        }
        return ret;
    }

    /**
    * Applies the maps of <var>maps</var> to the inputs of this union:
    * X -&gt; Y with X -&gt; Z gives Z -&gt; Y.
    */
    public UnionRelation applyDomain(UnionRelation maps) {
        return maps.reverse().applyRange(this);
    }

    /** Reverses every map. */
    public UnionRelation reverse() {
        UnionRelation ret = empty();
        for (Relation r : map.values()) {
            ret = ret.add(r.reverse());
        }
        return ret;
    }

    /** Returns the union of the input sets. */
    public UnionRelation domain() {
        UnionRelation ret = empty();
        for (Relation r : map.values()) {
            ret = ret.add(r.domain());
        }
        return ret;
    }

    /** Returns the union of the output sets. */
    public UnionRelation range() {
        UnionRelation ret = empty();
        for (Relation r : map.values()) {
            ret = ret.add(r.range());
        }
        return ret;
    }

    /** Checks if no relation holds a point. */
    public boolean isEmpty() {
        for (Relation r : map.values()) {
            if (!r.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
    * Returns the single relation of this union.
    *
    * @param space the space of the result when the union is empty.
    * @throws IllegalStateException if the union spans several spaces.
    */
    public Relation toRelation(Space space) {
        if (map.isEmpty()) {
            return Relation.empty(space);
        }
        if (map.size() > 1) {
            throw new IllegalStateException(
                    "union spans " + map.size() + " spaces: " + this);
        }
        return map.values().iterator().next();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80);
        for (Relation r : map.values()) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(r);
        }
        return sb.length() == 0 ? "{ }" : sb.toString();
    }

}
