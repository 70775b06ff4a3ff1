package io.github.yok.fermi.core.pipeline;

import io.github.yok.fermi.core.lattice.ReciprocalLattice;
import io.github.yok.fermi.core.model.EnergyGrid;
import java.util.List;
import java.util.Optional;
import lombok.Value;

/**
 * 取り込み（パース → 格子化 → シフト → 交差判定）の結果を保持するクラスです。
 */
@Value
public class FermiSurfaceResult {

    /**
     * フェルミ準位を 0 にシフトしたエネルギー格子です。
     */
    EnergyGrid grid;

    /**
     * 表示用の概要です。
     */
    FermiSurfaceSummary summary;

    /**
     * 逆格子です（入力から求められない場合は null）。
     */
    ReciprocalLattice reciprocalLattice;

    /**
     * フェルミ準位を横切るバンドの番号（昇順）を返します。
     *
     * @return 交差バンドです
     */
    public List<Integer> getCrossingBands() {
        return summary.getCrossingBands();
    }

    /**
     * 逆格子を返します。
     *
     * @return 逆格子です（不明な場合は空）
     */
    public Optional<ReciprocalLattice> findReciprocalLattice() {
        return Optional.ofNullable(reciprocalLattice);
    }
}
