package io.github.yok.fermi.core.model;

import lombok.Value;

/**
 * 等値面の三角形メッシュを保持するクラスです。
 *
 * <p>
 * 座標・法線は (x, y, z) の 3 要素ずつ並んだ配列で、三角形は頂点インデックスの 3 つ組です。
 * 頂点数 0 のメッシュは「この解像度で交差がない」ことを表す正常な結果です。
 * </p>
 */
@Value
public class IsosurfaceMesh {

    /**
     * 空のメッシュです。
     */
    public static final IsosurfaceMesh EMPTY =
            new IsosurfaceMesh(new float[0], new float[0], new int[0]);

    /**
     * 頂点座標（分率座標）です。
     */
    float[] positions;

    /**
     * 頂点法線（単位ベクトル）です。
     */
    float[] normals;

    /**
     * 三角形の頂点インデックスです。
     */
    int[] indices;

    /**
     * メッシュを生成します。配列は複製して保持します。
     *
     * @param positions 頂点座標です（null 不可）
     * @param normals 頂点法線です（null 不可、positions と同じ長さ）
     * @param indices 三角形の頂点インデックスです（null 不可）
     * @throws IllegalArgumentException 配列が null、または長さが合わない場合に発生します
     */
    public IsosurfaceMesh(float[] positions, float[] normals, int[] indices) {
        if (positions == null || normals == null || indices == null) {
            throw new IllegalArgumentException("positions/normals/indices は null 不可です");
        }
        if (positions.length != normals.length) {
            throw new IllegalArgumentException("positions と normals の長さが一致しません: "
                    + positions.length + " / " + normals.length);
        }
        this.positions = positions.clone();
        this.normals = normals.clone();
        this.indices = indices.clone();
    }

    /**
     * 頂点座標の複製を返します。
     *
     * @return 頂点座標です
     */
    public float[] getPositions() {
        return positions.clone();
    }

    /**
     * 頂点法線の複製を返します。
     *
     * @return 頂点法線です
     */
    public float[] getNormals() {
        return normals.clone();
    }

    /**
     * 三角形の頂点インデックスの複製を返します。
     *
     * @return 頂点インデックスです
     */
    public int[] getIndices() {
        return indices.clone();
    }

    /**
     * 頂点数を返します。
     *
     * @return 頂点数です
     */
    public int getVertexCount() {
        return positions.length / 3;
    }

    /**
     * 三角形数を返します。
     *
     * @return 三角形数です
     */
    public int getTriangleCount() {
        return indices.length / 3;
    }

    /**
     * 頂点を持たないかどうかを返します。
     *
     * @return 頂点がない場合は true です
     */
    public boolean isEmpty() {
        return positions.length == 0;
    }
}
