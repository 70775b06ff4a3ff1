package io.github.yok.fermi.core.symmetry;

import io.github.yok.fermi.core.model.ExpandedKPoint;
import io.github.yok.fermi.core.model.IrreducibleKPoint;
import io.github.yok.fermi.core.model.SymmetryOperation;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 既約 k 点を対称操作（回転）で全ブリルアンゾーンへ展開するクラスです。
 *
 * <p>
 * 各既約 k 点に全対称操作を適用して [-0.5, 0.5) に折り返し、既に採用した点と周期的に等価でない点だけを残します。
 * エネルギーは展開元の既約 k 点から複製します。
 * </p>
 */
@Slf4j
@Getter
public final class SymmetryExpander {

    /**
     * 等価判定の既定許容誤差です。
     */
    public static final double DEFAULT_TOLERANCE = 1e-6;

    /**
     * 等価判定の許容誤差です。
     */
    private final double tolerance;

    /**
     * 既定の許容誤差で展開器を生成します。
     */
    public SymmetryExpander() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * 展開器を生成します。
     *
     * @param tolerance 等価判定の許容誤差です（0 より大きい値）
     * @throws IllegalArgumentException tolerance が正でない場合に発生します
     */
    public SymmetryExpander(double tolerance) {
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance は 0 より大きい必要があります: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    /**
     * 既約 k 点を全ブリルアンゾーンへ展開します。
     *
     * <p>
     * 対称操作が 1 つもない場合は恒等操作のみで展開します。
     * </p>
     *
     * @param irreducible 既約 k 点です（null 不可）
     * @param operations 対称操作です（null 不可）
     * @return 展開した k 点（採用順）です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public List<ExpandedKPoint> expand(List<IrreducibleKPoint> irreducible,
            List<SymmetryOperation> operations) {
        if (irreducible == null) {
            throw new IllegalArgumentException("irreducible は null 不可です");
        }
        if (operations == null) {
            throw new IllegalArgumentException("operations は null 不可です");
        }
        List<SymmetryOperation> ops = operations;
        if (ops.isEmpty()) {
            log.warn("対称操作がないため恒等操作のみで展開します");
            ops = List.of(SymmetryOperation.IDENTITY);
        }

        long t0 = System.nanoTime();
        List<ExpandedKPoint> expanded = new ArrayList<>();
        List<double[]> seen = new ArrayList<>();

        for (int origIdx = 0; origIdx < irreducible.size(); origIdx++) {
            IrreducibleKPoint kp = irreducible.get(origIdx);
            double[] k = {kp.getKx(), kp.getKy(), kp.getKz()};

            for (SymmetryOperation op : ops) {
                double[] wrapped = wrap(apply(op, k));
                if (containsEquivalent(seen, wrapped)) {
                    continue;
                }
                seen.add(wrapped);
                expanded.add(new ExpandedKPoint(wrapped[0], wrapped[1], wrapped[2],
                        kp.getEnergies(), origIdx));
            }
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("対称展開が完了しました。既約k点={}、対称操作={}、展開後={}、所要時間={}ms", irreducible.size(),
                ops.size(), expanded.size(), elapsedMs);
        return expanded;
    }

    /**
     * 採用済みの点に等価な点があるかを返します。
     */
    private boolean containsEquivalent(List<double[]> seen, double[] k) {
        for (double[] s : seen) {
            if (equivalent(s, k, tolerance)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 対称操作の回転を k 点に適用します（{@code k' = R k}）。
     *
     * @param op 対称操作です
     * @param k k 点（分率座標、長さ 3）です
     * @return 回転後の k 点です
     */
    public static double[] apply(SymmetryOperation op, double[] k) {
        DMatrixRMaj rotation = new DMatrixRMaj(3, 3);
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                rotation.set(row, col, op.rotation(row, col));
            }
        }
        DMatrixRMaj in = new DMatrixRMaj(3, 1, true, k[0], k[1], k[2]);
        DMatrixRMaj out = new DMatrixRMaj(3, 1);
        CommonOps_DDRM.mult(rotation, in, out);
        return new double[] {out.get(0, 0), out.get(1, 0), out.get(2, 0)};
    }

    /**
     * 1 成分を [-0.5, 0.5) に折り返します。
     *
     * <p>
     * |x| が 1 を超える場合は最寄りの整数を引いて縮め、±0.5 ちょうどの扱いは ±1 の加減算で揃えます。
     * </p>
     *
     * @param x 成分です（有限値）
     * @return 折り返した成分です
     * @throws IllegalArgumentException x が有限でない場合に発生します
     */
    public static double wrap(double x) {
        if (!Double.isFinite(x)) {
            throw new IllegalArgumentException("k 点成分は有限値が必要です: " + x);
        }
        double result = Math.abs(x) > 1.0 ? x - Math.floor(x + 0.5) : x;
        while (result >= 0.5) {
            result -= 1.0;
        }
        while (result < -0.5) {
            result += 1.0;
        }
        return result;
    }

    /**
     * k 点を成分ごとに [-0.5, 0.5) へ折り返します。
     *
     * @param k k 点（長さ 3）です
     * @return 折り返した k 点です
     */
    public static double[] wrap(double[] k) {
        return new double[] {wrap(k[0]), wrap(k[1]), wrap(k[2])};
    }

    /**
     * 2 つの k 点が周期境界を考慮して等価かどうかを返します。
     *
     * <p>
     * 各軸で {@code min(|Δ|, 1 - |Δ|) < tolerance} を満たす場合に等価とします。
     * </p>
     *
     * @param a k 点です
     * @param b k 点です
     * @param tolerance 許容誤差です
     * @return 等価な場合は true です
     */
    public static boolean equivalent(double[] a, double[] b, double tolerance) {
        double[] wa = wrap(a);
        double[] wb = wrap(b);
        for (int axis = 0; axis < 3; axis++) {
            double d = Math.abs(wa[axis] - wb[axis]);
            if (Math.min(d, 1.0 - d) >= tolerance) {
                return false;
            }
        }
        return true;
    }
}
