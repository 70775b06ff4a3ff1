package io.github.yok.fermi.core.isosurface;

import io.github.yok.fermi.core.model.EnergyGrid;
import io.github.yok.fermi.core.model.IsosurfaceMesh;

/**
 * エネルギー格子の 1 バンドから等値面を抽出する処理の抽象です。
 */
public interface IsosurfaceExtractor {

    /**
     * 等値面を抽出します。
     *
     * <p>
     * 交差がない場合は空のメッシュを返します（例外にはしません）。
     * </p>
     *
     * @param grid エネルギー格子です
     * @param band バンド番号です（0 以上 bandCount 未満）
     * @param isoValue 等値です（シフト済み格子では 0）
     * @return 等値面メッシュです
     */
    IsosurfaceMesh extract(EnergyGrid grid, int band, double isoValue);
}
