package io.github.yok.fermi.core.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 結晶の対称操作（3×3 整数回転行列 + 並進ベクトル）を保持するクラスです。
 *
 * <p>
 * 逆格子空間のエネルギーに作用するのは回転のみで、並進は保持するだけです。
 * </p>
 */
@EqualsAndHashCode
@ToString
public final class SymmetryOperation {

    /**
     * 恒等操作です。
     */
    public static final SymmetryOperation IDENTITY =
            new SymmetryOperation(new int[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}},
                    new double[] {0.0, 0.0, 0.0});

    /**
     * 回転行列（行優先）です。
     */
    private final int[][] rotation;

    /**
     * 並進ベクトルです。
     */
    private final double[] translation;

    /**
     * 対称操作を生成します。
     *
     * @param rotation 3×3 の回転行列です（null 不可）
     * @param translation 長さ 3 の並進ベクトルです（null 不可）
     * @throws IllegalArgumentException 次元が 3 でない場合に発生します
     */
    public SymmetryOperation(int[][] rotation, double[] translation) {
        if (rotation == null || rotation.length != 3) {
            throw new IllegalArgumentException("rotation は 3×3 が必要です");
        }
        if (translation == null || translation.length != 3) {
            throw new IllegalArgumentException("translation は長さ 3 が必要です");
        }
        this.rotation = new int[3][];
        for (int row = 0; row < 3; row++) {
            if (rotation[row] == null || rotation[row].length != 3) {
                throw new IllegalArgumentException("rotation は 3×3 が必要です: row=" + row);
            }
            this.rotation[row] = rotation[row].clone();
        }
        this.translation = translation.clone();
    }

    /**
     * 回転行列の要素を返します。
     *
     * @param row 行（0..2）です
     * @param col 列（0..2）です
     * @return 要素です
     */
    public int rotation(int row, int col) {
        return rotation[row][col];
    }

    /**
     * 並進ベクトルの成分を返します。
     *
     * @param axis 軸（0..2）です
     * @return 成分です
     */
    public double translation(int axis) {
        return translation[axis];
    }
}
