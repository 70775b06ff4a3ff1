package io.github.yok.fermi.core.pipeline;

import io.github.yok.fermi.core.model.IsosurfaceMesh;
import lombok.Value;

/**
 * 1 バンド分のフェルミ面（表示色とメッシュ）を保持するクラスです。
 */
@Value
public class BandSurface {

    /**
     * バンド番号です。
     */
    int bandIndex;

    /**
     * 表示色（#rrggbb）です。
     */
    String color;

    /**
     * 等値面メッシュです（頂点数 1 以上）。
     */
    IsosurfaceMesh mesh;
}
