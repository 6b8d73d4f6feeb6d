package polyc.poly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* The space of a relation: the parameter names, the input tuple and the
* output tuple. A set has no input tuple and its elements live in the output
* tuple. Tuple names may be null for unnamed tuples such as schedule time
* vectors. Dimension names are kept for printing and naming only; two spaces
* match when their tuple names and arities agree.
*/
public final class Space {

    private final List<String> params;
    private final String in_name;
    private final List<String> in_dims;
    private final String out_name;
    private final List<String> out_dims;
    private final boolean is_set;

    private Space(List<String> params, String in_name, List<String> in_dims,
            String out_name, List<String> out_dims, boolean is_set) {
        this.params = Collections.unmodifiableList(
                new ArrayList<String>(params));
        this.in_name = in_name;
        this.in_dims = Collections.unmodifiableList(
                new ArrayList<String>(in_dims));
        this.out_name = out_name;
        this.out_dims = Collections.unmodifiableList(
                new ArrayList<String>(out_dims));
        this.is_set = is_set;
    }

    /**
    * Creates the space of a set.
    *
    * @param params the parameter names.
    * @param name the tuple name or null.
    * @param dims the dimension names; entries may be null.
    */
    public static Space setSpace(
            List<String> params, String name, List<String> dims) {
        return new Space(params, null, new ArrayList<String>(0),
                name, dims, true);
    }

    /** Creates the space of a set with unnamed dimensions. */
    public static Space setSpace(List<String> params, String name, int n) {
        return setSpace(params, name, unnamed(n));
    }

    /**
    * Creates the space of a map.
    */
    public static Space mapSpace(List<String> params,
            String in_name, List<String> in_dims,
            String out_name, List<String> out_dims) {
        return new Space(params, in_name, in_dims, out_name, out_dims, false);
    }

    /** Creates the space of a map with unnamed dimensions. */
    public static Space mapSpace(List<String> params,
            String in_name, int n_in, String out_name, int n_out) {
        return mapSpace(params, in_name, unnamed(n_in),
                out_name, unnamed(n_out));
    }

    /** Creates a parameter domain, a set without dimensions. */
    public static Space paramSpace(List<String> params) {
        return setSpace(params, null, 0);
    }

    private static List<String> unnamed(int n) {
        List<String> ret = new ArrayList<String>(n);
        for (int i = 0; i < n; i++) {
            ret.add(null);
        }
        return ret;
    }

    public boolean isSet() {
        return is_set;
    }

    public List<String> getParams() {
        return params;
    }

    public int getNumParams() {
        return params.size();
    }

    public int getNumIn() {
        return in_dims.size();
    }

    public int getNumOut() {
        return out_dims.size();
    }

    public String getInName() {
        return in_name;
    }

    public String getOutName() {
        return out_name;
    }

    /** Returns the name of the <var>i</var>th input dimension or null. */
    public String getInDimName(int i) {
        return in_dims.get(i);
    }

    /** Returns the name of the <var>i</var>th output dimension or null. */
    public String getOutDimName(int i) {
        return out_dims.get(i);
    }

    public List<String> getInDimNames() {
        return in_dims;
    }

    public List<String> getOutDimNames() {
        return out_dims;
    }

    /**
    * Returns the number of columns of a constraint over this space, not
    * counting existential variables: the constant, the parameters, the input
    * and the output dimensions.
    */
    public int getNumColumns() {
        return 1 + params.size() + in_dims.size() + out_dims.size();
    }

    /** Returns the column of the <var>i</var>th parameter. */
    public int paramColumn(int i) {
        return 1 + i;
    }

    /** Returns the column of the <var>i</var>th input dimension. */
    public int inColumn(int i) {
        return 1 + params.size() + i;
    }

    /** Returns the column of the <var>i</var>th output dimension. */
    public int outColumn(int i) {
        return 1 + params.size() + in_dims.size() + i;
    }

    /** Returns the space with input and output swapped. */
    public Space reverse() {
        if (is_set) {
            throw new IllegalStateException("cannot reverse a set space");
        }
        return new Space(params, out_name, out_dims, in_name, in_dims, false);
    }

    /** Returns the set space of the input tuple. */
    public Space domain() {
        if (is_set) {
            return paramSpace(params);
        }
        return setSpace(params, in_name, in_dims);
    }

    /** Returns the set space of the output tuple. */
    public Space range() {
        return setSpace(params, out_name, out_dims);
    }

    /** Returns this space with the given parameter list. */
    public Space withParams(List<String> new_params) {
        return new Space(new_params, in_name, in_dims,
                out_name, out_dims, is_set);
    }

    /** Returns this space keeping only the first <var>n</var> outputs. */
    public Space withNumOut(int n) {
        List<String> dims = new ArrayList<String>(n);
        for (int i = 0; i < n; i++) {
            dims.add(i < out_dims.size() ? out_dims.get(i) : null);
        }
        return new Space(params, in_name, in_dims, out_name, dims, is_set);
    }

    /**
    * Returns the map space from the domain tuple of <var>in</var> to the
    * range tuple of <var>out</var>, with the parameters of this space.
    */
    public Space join(Space in, Space out) {
        List<String> in_d = in.is_set ? in.out_dims : in.in_dims;
        String in_n = in.is_set ? in.out_name : in.in_name;
        return new Space(params, in_n, in_d, out.out_name, out.out_dims, false);
    }

    /**
    * Returns the key identifying the tuples of this space, ignoring
    * parameters and dimension names.
    */
    public String getTupleKey() {
        StringBuilder sb = new StringBuilder(32);
        if (!is_set) {
            sb.append(in_name == null ? "" : in_name);
            sb.append("/").append(in_dims.size()).append("->");
        }
        sb.append(out_name == null ? "" : out_name);
        sb.append("/").append(out_dims.size());
        return sb.toString();
    }

    /**
    * Checks if the input tuple of this map matches the given set tuple.
    */
    public boolean domainMatches(Space set) {
        return (eq(in_name, set.out_name) &&
                in_dims.size() == set.out_dims.size());
    }

    /**
    * Checks if the output tuple of this relation matches the input tuple of
    * <var>map</var>.
    */
    public boolean rangeMatchesDomainOf(Space map) {
        return (eq(out_name, map.in_name) &&
                out_dims.size() == map.in_dims.size());
    }

    /** Checks if two spaces have the same tuples, ignoring parameters. */
    public boolean tuplesMatch(Space other) {
        return (is_set == other.is_set &&
                getTupleKey().equals(other.getTupleKey()));
    }

    private static boolean eq(String a, String b) {
        return (a == null) ? b == null : a.equals(b);
    }

    /**
    * Returns the merged parameter list: the parameters of this space
    * followed by the parameters of <var>other</var> it does not have.
    */
    public List<String> mergeParams(Space other) {
        return mergeParams(params, other.params);
    }

    /** Merges two parameter lists keeping the order of first appearance. */
    public static List<String> mergeParams(List<String> a, List<String> b) {
        List<String> ret = new ArrayList<String>(a);
        for (String p : b) {
            if (!ret.contains(p)) {
                ret.add(p);
            }
        }
        return ret;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Space)) {
            return false;
        }
        Space other = (Space)o;
        return (tuplesMatch(other) && params.equals(other.params));
    }

    @Override
    public int hashCode() {
        return getTupleKey().hashCode() * 31 + params.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(32);
        if (!params.isEmpty()) {
            sb.append(params).append(" -> ");
        }
        if (!is_set) {
            tupleString(sb, in_name, in_dims, "i");
            sb.append(" -> ");
        }
        tupleString(sb, out_name, out_dims, is_set ? "i" : "o");
        return sb.toString();
    }

    void tupleString(StringBuilder sb, String name, List<String> dims,
            String prefix) {
        if (name != null) {
            sb.append(name);
        }
        sb.append("[");
        for (int i = 0; i < dims.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            String d = dims.get(i);
            sb.append(d == null ? prefix + i : d);
        }
        sb.append("]");
    }

}
