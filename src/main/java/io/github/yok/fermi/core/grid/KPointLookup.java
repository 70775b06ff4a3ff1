package io.github.yok.fermi.core.grid;

import io.github.yok.fermi.core.model.ExpandedKPoint;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 展開済み k 点を元メッシュの格子インデックスで引く対応表です。
 *
 * <p>
 * 分率座標 k を {@code round((k + 0.5) * n) mod n} で格子インデックスに丸めます。 同じ格子点に複数の k
 * 点が丸められた場合は、最初に登録した点を採用します（登録順は入力リストの順）。
 * </p>
 */
@Slf4j
public final class KPointLookup {

    /**
     * 元メッシュの分割数です。
     */
    @Getter
    private final int division;

    /**
     * 格子インデックス → k 点です（挿入順を保持）。
     */
    private final Map<Integer, ExpandedKPoint> points;

    private KPointLookup(int division, Map<Integer, ExpandedKPoint> points) {
        this.division = division;
        this.points = points;
    }

    /**
     * 対応表を構築します。
     *
     * @param expanded 展開済み k 点です（null 不可）
     * @param division 元メッシュの分割数です（1 以上）
     * @return 対応表です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public static KPointLookup build(List<ExpandedKPoint> expanded, int division) {
        if (expanded == null) {
            throw new IllegalArgumentException("expanded は null 不可です");
        }
        if (division <= 0) {
            throw new IllegalArgumentException("division は 1 以上が必要です: " + division);
        }
        Map<Integer, ExpandedKPoint> map = new LinkedHashMap<>();
        int collisions = 0;
        for (ExpandedKPoint kp : expanded) {
            int key = key(toIndex(kp.getKx(), division), toIndex(kp.getKy(), division),
                    toIndex(kp.getKz(), division), division);
            if (map.putIfAbsent(key, kp) != null) {
                collisions++;
            }
        }
        if (collisions > 0) {
            log.debug("格子インデックスが重複した k 点が {} 点あります（先に登録した点を採用）", collisions);
        }
        return new KPointLookup(division, map);
    }

    /**
     * 分率座標を格子インデックスに丸めます。
     *
     * @param k 分率座標（[-0.5, 0.5)）です
     * @param division 分割数です
     * @return 格子インデックス（0 以上 division 未満）です
     */
    public static int toIndex(double k, int division) {
        long rounded = Math.round((k + 0.5) * division);
        return (int) Math.floorMod(rounded, (long) division);
    }

    /**
     * 格子インデックスの k 点を返します（周期境界で折り返します）。
     *
     * @param ix x インデックスです（範囲外可）
     * @param iy y インデックスです（範囲外可）
     * @param iz z インデックスです（範囲外可）
     * @return k 点です。登録がない場合は null です
     */
    public ExpandedKPoint get(int ix, int iy, int iz) {
        return points.get(key(Math.floorMod(ix, division), Math.floorMod(iy, division),
                Math.floorMod(iz, division), division));
    }

    /**
     * 登録済みの格子点数を返します。
     *
     * @return 格子点数です
     */
    public int size() {
        return points.size();
    }

    private static int key(int ix, int iy, int iz, int division) {
        return ix + iy * division + iz * division * division;
    }
}
