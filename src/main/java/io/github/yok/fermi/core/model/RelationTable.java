package io.github.yok.fermi.core.model;

import io.github.yok.fermi.core.exception.DimensionMismatchException;
import java.util.List;

/**
 * 全メッシュ点から既約代表点への対応表です。
 *
 * <p>
 * 点番号は 1 始まりです。自分自身を指す点（{@code relation[p] == p}）を既約点とみなし、出現順に
 * 1 始まりの連番（既約インデックス）を振ります。
 * </p>
 */
public final class RelationTable {

    /**
     * 点番号 → 代表点番号です（添字 0 は未使用）。
     */
    private final int[] relation;

    /**
     * 既約点の点番号 → 既約インデックス（1 始まり、既約点でなければ 0）です。
     */
    private final int[] sequentialIndex;

    /**
     * 既約点の数です。
     */
    private final int irreducibleCount;

    private RelationTable(int[] relation, int[] sequentialIndex, int irreducibleCount) {
        this.relation = relation;
        this.sequentialIndex = sequentialIndex;
        this.irreducibleCount = irreducibleCount;
    }

    /**
     * outputkgen の行から対応表を構築します。
     *
     * @param entries メッシュ点の行です（行番号 = 点番号 - 1）
     * @return 対応表です
     * @throws IllegalArgumentException entries が null の場合に発生します
     * @throws DimensionMismatchException 代表点番号が範囲外の場合に発生します
     */
    public static RelationTable of(List<KMeshGeneration.MeshEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries は null 不可です");
        }
        int total = entries.size();
        int[] relation = new int[total + 1];
        for (int i = 0; i < total; i++) {
            int r = entries.get(i).getRelation();
            if (r < 1 || r > total) {
                throw new DimensionMismatchException("代表点番号の範囲（点 " + (i + 1) + "）", total, r);
            }
            relation[i + 1] = r;
        }

        int[] sequential = new int[total + 1];
        int count = 0;
        for (int p = 1; p <= total; p++) {
            if (relation[p] == p) {
                count++;
                sequential[p] = count;
            }
        }
        return new RelationTable(relation, sequential, count);
    }

    /**
     * 全メッシュ点数を返します。
     *
     * @return 点数です
     */
    public int size() {
        return relation.length - 1;
    }

    /**
     * 既約点の数を返します。
     *
     * @return 既約点数です
     */
    public int irreducibleCount() {
        return irreducibleCount;
    }

    /**
     * 点の代表点番号を 2 段引き（{@code relation[relation[p]]}）で返します。
     *
     * @param pointIndex 点番号（1 始まり）です
     * @return 代表点の点番号です
     */
    public int representativeOf(int pointIndex) {
        return relation[relation[pointIndex]];
    }

    /**
     * 点に対応する既約インデックスを返します。
     *
     * @param pointIndex 点番号（1 始まり）です
     * @return 既約インデックス（1 始まり）です。代表点が既約点でない場合は 0 です
     */
    public int irreducibleIndexOf(int pointIndex) {
        return sequentialIndex[representativeOf(pointIndex)];
    }
}
