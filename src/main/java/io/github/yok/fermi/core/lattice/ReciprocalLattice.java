package io.github.yok.fermi.core.lattice;

import io.github.yok.fermi.core.model.LatticeParameters;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 逆格子基本ベクトル b1, b2, b3 を保持し、分率座標をデカルト座標へ変換するクラスです。
 *
 * <p>
 * 行列は「行 = 基本ベクトル」で保持します。分率座標 (k1, k2, k3) のデカルト座標は
 * {@code k1 b1 + k2 b2 + k3 b3} です。
 * </p>
 */
public final class ReciprocalLattice {

    /**
     * 逆格子基本ベクトル（行 = b_i）です。
     */
    private final DMatrixRMaj basis;

    private ReciprocalLattice(DMatrixRMaj basis) {
        this.basis = basis;
    }

    /**
     * 格子定数から逆格子を計算します。
     *
     * <p>
     * 実格子を a1 = (a, 0, 0)、a2 を xy 平面内に置く標準配置で組み立て、{@code B = 2π (A^-1)^T} とします。
     * </p>
     *
     * @param p 格子定数です（null 不可）
     * @return 逆格子です
     * @throws IllegalArgumentException p が null、または実格子が特異な場合に発生します
     */
    public static ReciprocalLattice fromLatticeParameters(LatticeParameters p) {
        if (p == null) {
            throw new IllegalArgumentException("latticeParameters は null 不可です");
        }
        double cosA = Math.cos(p.getAlpha());
        double cosB = Math.cos(p.getBeta());
        double cosG = Math.cos(p.getGamma());
        double sinG = Math.sin(p.getGamma());

        double cx = p.getC() * cosB;
        double cy = p.getC() * (cosA - cosB * cosG) / sinG;
        double cz2 = p.getC() * p.getC() - cx * cx - cy * cy;
        double cz = cz2 > 0.0 ? Math.sqrt(cz2) : 0.0;

        DMatrixRMaj direct = new DMatrixRMaj(3, 3, true,
                p.getA(), 0.0, 0.0,
                p.getB() * cosG, p.getB() * sinG, 0.0,
                cx, cy, cz);

        DMatrixRMaj inverse = new DMatrixRMaj(3, 3);
        if (!CommonOps_DDRM.invert(direct, inverse)) {
            throw new IllegalArgumentException("実格子行列が特異です: " + p);
        }
        DMatrixRMaj reciprocal = new DMatrixRMaj(3, 3);
        CommonOps_DDRM.transpose(inverse, reciprocal);
        CommonOps_DDRM.scale(2.0 * Math.PI, reciprocal);
        return new ReciprocalLattice(reciprocal);
    }

    /**
     * outputkgen の {@code G1 G2 G3} ブロックから逆格子を作成します。
     *
     * <p>
     * ブロックは列が G1, G2, G3、行がデカルト成分の表として扱います。
     * </p>
     *
     * @param rows ブロックの 3 行です（各長さ 3）
     * @return 逆格子です
     * @throws IllegalArgumentException rows が 3×3 でない場合に発生します
     */
    public static ReciprocalLattice fromColumnVectors(List<double[]> rows) {
        if (rows == null || rows.size() != 3) {
            throw new IllegalArgumentException("G1 G2 G3 ブロックは 3 行が必要です");
        }
        DMatrixRMaj table = new DMatrixRMaj(3, 3);
        for (int r = 0; r < 3; r++) {
            double[] row = rows.get(r);
            if (row == null || row.length != 3) {
                throw new IllegalArgumentException("G1 G2 G3 ブロックの行は 3 列が必要です: row=" + r);
            }
            for (int c = 0; c < 3; c++) {
                table.set(r, c, row[c]);
            }
        }
        DMatrixRMaj basis = new DMatrixRMaj(3, 3);
        CommonOps_DDRM.transpose(table, basis);
        return new ReciprocalLattice(basis);
    }

    /**
     * 逆格子基本ベクトル b_i を返します。
     *
     * @param i ベクトル番号（0..2）です
     * @return ベクトルの複製です
     */
    public double[] vector(int i) {
        return new double[] {basis.get(i, 0), basis.get(i, 1), basis.get(i, 2)};
    }

    /**
     * 分率座標の座標列（x, y, z の繰り返し）をデカルト座標に変換します。
     *
     * @param fractional 分率座標列です（長さは 3 の倍数）
     * @return デカルト座標列です
     * @throws IllegalArgumentException 長さが 3 の倍数でない場合に発生します
     */
    public float[] toCartesian(float[] fractional) {
        if (fractional == null || fractional.length % 3 != 0) {
            throw new IllegalArgumentException("座標列の長さは 3 の倍数が必要です");
        }
        int n = fractional.length / 3;
        if (n == 0) {
            return new float[0];
        }
        DMatrixRMaj frac = new DMatrixRMaj(n, 3);
        for (int i = 0; i < fractional.length; i++) {
            frac.data[i] = fractional[i];
        }
        DMatrixRMaj cart = new DMatrixRMaj(n, 3);
        CommonOps_DDRM.mult(frac, basis, cart);

        float[] out = new float[fractional.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) cart.data[i];
        }
        return out;
    }
}
