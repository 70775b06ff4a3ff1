package io.github.yok.fermi.core.model;

import java.util.List;
import lombok.Value;

/**
 * k メッシュ生成リスト（outputkgen）から読み込んだ内容を保持するクラスです。
 */
@Value
public class KMeshGeneration {

    /**
     * x 方向の格子点数（分割数 + 1）です。
     */
    int nx;

    /**
     * y 方向の格子点数（分割数 + 1）です。
     */
    int ny;

    /**
     * z 方向の格子点数（分割数 + 1）です。
     */
    int nz;

    /**
     * 逆格子基本ベクトル G1, G2, G3 です（読めなかった場合は空）。
     */
    List<double[]> reciprocalVectors;

    /**
     * 全メッシュ点の行です（ちょうど nx*ny*nz 行）。
     */
    List<MeshEntry> entries;

    /**
     * outputkgen の 1 行（点番号、メッシュ座標、代表点番号）です。
     */
    @Value
    public static class MeshEntry {

        /**
         * 点番号（1 始まり）です。
         */
        int pointIndex;

        int x;

        int y;

        int z;

        /**
         * 対称性で等価な代表点の点番号（1 始まり）です。
         */
        int relation;
    }
}
