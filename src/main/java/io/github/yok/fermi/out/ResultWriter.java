package io.github.yok.fermi.out;

import io.github.yok.fermi.core.pipeline.BandSurface;
import io.github.yok.fermi.core.pipeline.FermiSurfaceResult;
import java.util.List;

/**
 * 再構成結果を出力する処理のインタフェースです。
 *
 * <p>
 * 描画や UI 側が読み込めるよう、取り込み結果の概要とバンドごとのフェルミ面メッシュを受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 取り込み結果とフェルミ面を出力します。
     *
     * @param result 取り込み結果です
     * @param surfaces バンドごとのフェルミ面です
     */
    void write(FermiSurfaceResult result, List<BandSurface> surfaces);
}
