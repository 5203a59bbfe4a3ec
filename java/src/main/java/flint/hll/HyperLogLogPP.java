/**
 * HyperLogLogPP.java
 */
package flint.hll;

import java.nio.charset.StandardCharsets;

/**
 * HyperLogLog++ cardinality estimator with a sparse and a dense phase.
 * 
 * <pre>
 * sparse : sorted varint list of hash encodings at p' = 25 (+ unsorted insert buffer)
 * dense  : m = 2^p registers of 6 bits
 * 
 * p = 4  → 16 registers, 13 bytes
 * p = 14 → 16,384 registers, 12,289 bytes (~12 KB)
 * p = 18 → 262,144 registers, 196,609 bytes (~192 KB)
 * </pre>
 * 
 * The estimator starts sparse and converts to dense once the sparse list
 * would take more space than the dense registers.
 */
public final class HyperLogLogPP implements Estimator {
    public static final int MIN_PRECISION = 4;
    public static final int MAX_PRECISION = 18;
    static final int BITS_PER_REGISTER = 6;
    private static final int TMP_SET_SIZE = 256;

    private final int p; // number of bits for register index
    private final int m; // number of registers (2^p)
    private final double alphaMM; // bias correction constant

    private boolean sparse = true;
    private SparseList sparseList = SparseList.EMPTY;
    private final int[] tmpSet = new int[TMP_SET_SIZE];
    private int tmpCount = 0;
    private DenseRegisters dense = null;

    /**
     * Creates a HyperLogLog++ with the specified precision parameter.
     * @param p precision parameter (4 <= p <= 18)
     */
    public HyperLogLogPP(int p) {
        if (p < MIN_PRECISION || p > MAX_PRECISION) {
            throw new IllegalArgumentException("p must be between " + MIN_PRECISION + " and " + MAX_PRECISION);
        }
        this.p = p;
        this.m = 1 << p;
        this.alphaMM = getAlpha(m) * m * m;
    }

    /**
     * Creates a HyperLogLog++ with default precision (p=14, giving ~0.81% standard error).
     */
    public HyperLogLogPP() {
        this(14);
    }

    /**
     * Adds an element. Null values are ignored.
     * @param value the value to add
     */
    public void add(Object value) {
        if (value == null) {
            return;
        }
        addHash(hash(value.toString()));
    }

    /**
     * Adds a 64-bit hash value.
     * @param hash the hash value to add
     */
    public void addHash(long hash) {
        if (sparse) {
            tmpSet[tmpCount++] = SparseCodec.encodeHash(hash, p);
            if (tmpCount == tmpSet.length) {
                flushTmpSet();
                if (sparseList.sizeInBytes() > denseBytes()) {
                    toDense();
                }
            }
            return;
        }
        dense.max(SparseCodec.denseIndex(hash, p), SparseCodec.denseRank(hash, p));
    }

    /**
     * Estimates the cardinality (number of distinct elements).
     * @return estimated cardinality
     */
    @Override
    public long count() {
        if (sparse) {
            // linear counting over the 2^25 sparse registers
            final double mp = 1 << SparseCodec.SPARSE_PRECISION;
            final int n = sparseView().size();
            return Math.round(mp * Math.log(mp / (mp - n)));
        }

        double rawEstimate = alphaMM / sum();
        if (rawEstimate <= 2.5 * m) {
            // Small range correction
            int zeros = countZeros();
            if (zeros != 0) {
                return Math.round(m * Math.log(m / (double) zeros));
            }
        }
        return Math.round(rawEstimate);
    }

    @Override
    public int precision() {
        return p;
    }

    @Override
    public int registerCount() {
        return m;
    }

    @Override
    public boolean isSparse() {
        return sparse;
    }

    @Override
    public DenseRegisters denseRegisters() {
        if (sparse)
            throw new IllegalStateException("estimator is sparse");
        return dense;
    }

    @Override
    public SparseReader sparseReader() {
        if (!sparse)
            throw new IllegalStateException("estimator is dense");
        return sparseView().reader();
    }

    @Override
    public Register decodeHash(int encoded) {
        return SparseCodec.decodeHash(encoded, p);
    }

    /**
     * Merges pending inserts into the sparse list.
     */
    void flushTmpSet() {
        sparseList = sparseList.merge(tmpSet, tmpCount);
        tmpCount = 0;
    }

    /**
     * Converts to the dense representation. No-op when already dense.
     */
    public void toDense() {
        if (!sparse)
            return;
        final DenseRegisters d = new DenseRegisters(m, BITS_PER_REGISTER);
        for (SparseReader r = sparseView().reader(); !r.done();) {
            final Register reg = decodeHash(r.next());
            d.max(reg.index(), reg.value());
        }
        dense = d;
        sparse = false;
        sparseList = SparseList.EMPTY;
        tmpCount = 0;
    }

    /**
     * Clears all data, returning to the sparse representation.
     */
    public void clear() {
        sparse = true;
        sparseList = SparseList.EMPTY;
        tmpCount = 0;
        dense = null;
    }

    /**
     * Returns the size in bytes of the current representation.
     * @return size in bytes
     */
    public int sizeInBytes() {
        return sparse ? sparseList.sizeInBytes() + tmpCount * Integer.BYTES : dense.sizeInBytes();
    }

    // Private helper methods

    private SparseList sparseView() {
        return sparseList.merge(tmpSet, tmpCount);
    }

    private int denseBytes() {
        return DenseRegisters.bytes(m, BITS_PER_REGISTER);
    }

    private double sum() {
        double sum = 0;
        for (int i = 0; i < m; i++) {
            sum += Math.pow(2, -dense.get(i));
        }
        return sum;
    }

    private int countZeros() {
        int count = 0;
        for (int i = 0; i < m; i++) {
            if (dense.get(i) == 0) {
                count++;
            }
        }
        return count;
    }

    private static double getAlpha(int m) {
        switch (m) {
            case 16:
                return 0.673;
            case 32:
                return 0.697;
            case 64:
                return 0.709;
            default:
                return 0.7213 / (1 + 1.079 / m);
        }
    }

    /**
     * 64-bit FNV-1a over the UTF-8 bytes, finished with the MurmurHash3 fmix64 avalanche.
     */
    static long hash(String s) {
        long h = 0xcbf29ce484222325L;
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xFF);
            h *= 0x100000001b3L;
        }
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }

    @Override
    public String toString() {
        return String.format("HyperLogLogPP(p=%d, m=%d, %s, estimated_cardinality=%d)", 
                           p, m, sparse ? "sparse" : "dense", count());
    }
}
