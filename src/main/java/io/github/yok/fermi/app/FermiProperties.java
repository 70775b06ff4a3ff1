package io.github.yok.fermi.app;

import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * fermi-surface の設定値（fermi.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "fermi")
public class FermiProperties {

    /**
     * 入力設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 補間格子の設定です。
     */
    @Valid
    private Grid grid = new Grid();

    /**
     * 対称展開の設定です。
     */
    @Valid
    private Symmetry symmetry = new Symmetry();

    /**
     * 表示バンドの設定です。
     */
    @Valid
    private Bands bands = new Bands();

    /**
     * 実行制御の設定です。
     */
    @Valid
    private Run run = new Run();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "fermi")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Input i = getInput();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "input",
                // variant: 入力形式（GENERIC/PRECOMPUTED）
                "variant", i.getVariant(),
                // dir: 入力ディレクトリ
                "dir", i.getDir(),
                // caseName: ケース名（空ならディレクトリから推定）
                "caseName", i.getCaseName(),
                // spinOrbit: .energyso を読むかどうか
                "spinOrbit", i.isSpinOrbit());

        appendSection(sb, nl, "grid",
                // size: 補間格子の各軸の点数
                "size", getGrid().getSize());

        appendSection(sb, nl, "symmetry",
                // tolerance: 等価判定の許容誤差
                "tolerance", getSymmetry().getTolerance());

        appendSection(sb, nl, "bands",
                // enabled: 表示バンド（空なら交差バンドの先頭から）
                "enabled", getBands().getEnabled(),
                // defaultEnabledCount: 既定で有効にする交差バンド数
                "defaultEnabledCount", getBands().getDefaultEnabledCount());

        appendSection(sb, nl, "run",
                // timeoutSeconds: 取り込み処理のタイムアウト（秒）
                "timeoutSeconds", getRun().getTimeoutSeconds());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir(),
                // cartesian: デカルト座標も出力するかどうか
                "cartesian", o.isCartesian());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * 入力形式です。
         */
        @NotNull
        private Variant variant = Variant.GENERIC;

        /**
         * 入力ディレクトリです。
         */
        @NotEmpty
        private String dir = "./case";

        /**
         * ケース名です（空の場合は入力ディレクトリのファイル名から推定します）。
         */
        private String caseName = "";

        /**
         * エネルギーファイルをスピン軌道形式（.energyso）として読むかどうかです。
         */
        private boolean spinOrbit = false;

        public enum Variant {
            /**
             * klist / energy / scf / struct から対称展開と補間で格子を作ります。
             */
            GENERIC,

            /**
             * output1 / output2 / outputkgen の対応表で格子を埋めます。
             */
            PRECOMPUTED
        }
    }

    @Data
    public static class Grid {

        /**
         * 補間格子の各軸の点数です。
         */
        @Min(2)
        private int size = 32;
    }

    @Data
    public static class Symmetry {

        /**
         * 等価判定の許容誤差です。
         */
        @Positive
        private double tolerance = 1e-6;
    }

    @Data
    public static class Bands {

        /**
         * 表示するバンド番号です（空の場合は交差バンドの先頭 defaultEnabledCount 本）。
         */
        private List<Integer> enabled = new ArrayList<>();

        /**
         * 既定で有効にする交差バンド数です。
         */
        @Min(0)
        private int defaultEnabledCount = 4;
    }

    @Data
    public static class Run {

        /**
         * 取り込みと抽出のタイムアウト（秒）です。
         */
        @Positive
        private long timeoutSeconds = 600;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotEmpty
        private String dir = "./out";

        /**
         * 分率座標に加えてデカルト座標（逆格子ベクトル基準）も出力するかどうかです。
         */
        private boolean cartesian = true;
    }
}
