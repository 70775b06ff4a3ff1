package io.github.yok.fermi.core.model;

import io.github.yok.fermi.core.exception.DimensionMismatchException;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * 分率逆格子座標の正則 3 次元格子上に置いたバンドエネルギー（eV）を保持するクラスです。
 *
 * <p>
 * インデックス変換は {@code index = ix + iy * nx + iz * nx * ny} です。格子は周期的で、
 * 範囲外のインデックスは nx/ny/nz を法として折り返します。 格子点 (ix, iy, iz) の分率座標は
 * {@code (ix / nx - 0.5, iy / ny - 0.5, iz / nz - 0.5)} です。
 * </p>
 */
@Getter
public final class EnergyGrid {

    /**
     * x 方向の格子点数です。
     */
    private final int nx;

    /**
     * y 方向の格子点数です。
     */
    private final int ny;

    /**
     * z 方向の格子点数です。
     */
    private final int nz;

    /**
     * バンドごとの値配列です（各長さ nx*ny*nz）。
     */
    @Getter(AccessLevel.NONE)
    private final double[][] data;

    /**
     * 基準とするフェルミエネルギー（eV）です。
     */
    private final double fermiEnergy;

    /**
     * エネルギー格子を生成します。
     *
     * <p>
     * 配列は呼び出し側から所有権ごと受け取り、複製しません。
     * </p>
     *
     * @param nx x 方向の格子点数です（1 以上）
     * @param ny y 方向の格子点数です（1 以上）
     * @param nz z 方向の格子点数です（1 以上）
     * @param data バンドごとの値配列です（null 不可）
     * @param fermiEnergy フェルミエネルギー（eV）です
     * @throws IllegalArgumentException 格子点数が 1 未満、または data が null の場合に発生します
     * @throws DimensionMismatchException 値配列の長さが nx*ny*nz と一致しない場合に発生します
     */
    public EnergyGrid(int nx, int ny, int nz, double[][] data, double fermiEnergy) {
        if (nx <= 0 || ny <= 0 || nz <= 0) {
            throw new IllegalArgumentException(
                    "nx/ny/nz は 1 以上が必要です: " + nx + "x" + ny + "x" + nz);
        }
        if (data == null) {
            throw new IllegalArgumentException("data は null 不可です");
        }
        int size = nx * ny * nz;
        for (int b = 0; b < data.length; b++) {
            int actual = data[b] == null ? 0 : data[b].length;
            if (actual != size) {
                throw new DimensionMismatchException("band " + b + " の値配列", size, actual);
            }
        }
        this.nx = nx;
        this.ny = ny;
        this.nz = nz;
        this.data = data;
        this.fermiEnergy = fermiEnergy;
    }

    /**
     * 格子点の総数 nx*ny*nz を返します。
     *
     * @return 格子点数です
     */
    public int size() {
        return nx * ny * nz;
    }

    /**
     * バンド数を返します。
     *
     * @return バンド数です
     */
    public int getBandCount() {
        return data.length;
    }

    /**
     * 周期境界で折り返した格子点の配列インデックスを返します。
     *
     * @param ix x インデックスです（範囲外可）
     * @param iy y インデックスです（範囲外可）
     * @param iz z インデックスです（範囲外可）
     * @return 配列インデックスです
     */
    public int indexOf(int ix, int iy, int iz) {
        int px = Math.floorMod(ix, nx);
        int py = Math.floorMod(iy, ny);
        int pz = Math.floorMod(iz, nz);
        return px + py * nx + pz * nx * ny;
    }

    /**
     * 格子点の値を返します（周期境界）。
     *
     * @param band バンド番号です
     * @param ix x インデックスです（範囲外可）
     * @param iy y インデックスです（範囲外可）
     * @param iz z インデックスです（範囲外可）
     * @return 値です
     */
    public double valueAt(int band, int ix, int iy, int iz) {
        return data[band][indexOf(ix, iy, iz)];
    }

    /**
     * 配列インデックスで値を返します。
     *
     * @param band バンド番号です
     * @param index 配列インデックスです（0 以上 size 未満）
     * @return 値です
     */
    public double valueAt(int band, int index) {
        return data[band][index];
    }
}
