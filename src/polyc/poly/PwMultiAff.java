package polyc.poly;

import polyc.hir.UnsupportedInput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* A piecewise multi-affine function: a list of pieces, each a domain over the
* input tuple and one {@link AffineExpression} per output dimension. The
* expressions are over the columns {@code [1 | params | in]}. Pieces with
* identical expressions are merged, so a single-valued map whose output is
* the same affine function everywhere has one piece.
*/
public final class PwMultiAff {

    /** One piece of the function. */
    public static final class Piece {

        private final Relation domain;
        private final List<AffineExpression> exprs;

        Piece(Relation domain, List<AffineExpression> exprs) {
            this.domain = domain;
            this.exprs = Collections.unmodifiableList(exprs);
        }

        /** Returns the set of inputs on which the piece applies. */
        public Relation getDomain() {
            return domain;
        }

        /** Returns one expression per output dimension. */
        public List<AffineExpression> getExpressions() {
            return exprs;
        }

    }

    private final Space space;
    private final List<Piece> pieces;

    private PwMultiAff(Space space, List<Piece> pieces) {
        this.space = space;
        this.pieces = Collections.unmodifiableList(pieces);
    }

    public Space getSpace() {
        return space;
    }

    public List<Piece> getPieces() {
        return pieces;
    }

    public int getNumPieces() {
        return pieces.size();
    }

    /** Returns the number of output dimensions. */
    public int getNumOut() {
        return space.getNumOut();
    }

    static PwMultiAff fromRelation(Relation map) {
        Space space = map.getSpace();
        if (space.isSet()) {
            throw new IllegalArgumentException("not a map: " + space);
        }
        List<Piece> pieces = new ArrayList<Piece>();
        for (BasicRelation raw : map.getBasicRelations()) {
            BasicRelation b = raw.simplify();
            if (b.isEmpty()) {
                continue;
            }
            List<AffineExpression> exprs = solve(b);
            Relation dom = Relation.fromBasic(b.domain());
            boolean merged = false;
            for (int i = 0; i < pieces.size() && !merged; i++) {
                Piece p = pieces.get(i);
                if (p.exprs.equals(exprs)) {
                    pieces.set(i, new Piece(p.domain.union(dom), exprs));
                    merged = true;
                }
            }
            if (!merged) {
                pieces.add(new Piece(dom, exprs));
            }
        }
        return new PwMultiAff(space, pieces);
    }

    /**
    * Solves the equalities of a basic map for its outputs by integer
    * Gaussian elimination, existentials first so that they drop out of the
    * output rows.
    */
    private static List<AffineExpression> solve(BasicRelation b) {
        Space space = b.getSpace();
        int n_out = space.getNumOut();
        int width = b.getNumColumns();
        List<long[]> rows = Rows.copy(b.equalities());
        List<Integer> order = new ArrayList<Integer>();
        for (int i = 0; i < b.getNumExists(); i++) {
            order.add(b.existsColumn(i));
        }
        for (int i = 0; i < n_out; i++) {
            order.add(space.outColumn(i));
        }
        int[] pivot_row = new int[width];
        java.util.Arrays.fill(pivot_row, -1);
        boolean[] used = new boolean[rows.size()];
        for (int col : order) {
            int p = -1;
            for (int r = 0; r < rows.size(); r++) {
                if (!used[r] && rows.get(r)[col] != 0 &&
                    (p == -1 ||
                     Math.abs(rows.get(r)[col]) < Math.abs(rows.get(p)[col]))) {
                    p = r;
                }
            }
            if (p == -1) {
                continue;
            }
            used[p] = true;
            pivot_row[col] = p;
            long[] eq = rows.get(p);
            for (int r = 0; r < rows.size(); r++) {
                if (r != p) {
                    rows.set(r, Rows.eliminate(rows.get(r), eq, col));
                }
            }
        }
        int first_in_free = space.outColumn(0);
        List<AffineExpression> exprs = new ArrayList<AffineExpression>(n_out);
        for (int i = 0; i < n_out; i++) {
            int col = space.outColumn(i);
            if (pivot_row[col] == -1) {
                throw new UnsupportedInput("output " + i +
                        " is not a function of the input in " + b);
            }
            long[] row = rows.get(pivot_row[col]);
            for (int k = first_in_free; k < width; k++) {
                if (k != col && row[k] != 0) {
                    throw new UnsupportedInput("output " + i +
                            " is not a function of the input in " + b);
                }
            }
            // row[col] * out + rest = 0, so out = -rest / row[col].
            long sign = (row[col] > 0) ? -1 : 1;
            long[] c = new long[first_in_free];
            for (int k = 0; k < first_in_free; k++) {
                c[k] = sign * row[k];
            }
            exprs.add(new AffineExpression(c, Math.abs(row[col])));
        }
        return exprs;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80);
        for (Piece p : pieces) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(p.exprs).append(" : ").append(p.domain);
        }
        return sb.toString();
    }

}
