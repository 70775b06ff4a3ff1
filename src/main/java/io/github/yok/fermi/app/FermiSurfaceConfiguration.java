package io.github.yok.fermi.app;

import io.github.yok.fermi.core.band.BandCrossingFilter;
import io.github.yok.fermi.core.grid.DirectGridFiller;
import io.github.yok.fermi.core.grid.FermiLevelShifter;
import io.github.yok.fermi.core.grid.InterpolatedGridBuilder;
import io.github.yok.fermi.core.isosurface.IsosurfaceExtractor;
import io.github.yok.fermi.core.isosurface.MarchingCubesExtractor;
import io.github.yok.fermi.core.parser.EnergyFileParser;
import io.github.yok.fermi.core.parser.FermiEnergyParser;
import io.github.yok.fermi.core.parser.GenericFermiDataReader;
import io.github.yok.fermi.core.parser.KlistParser;
import io.github.yok.fermi.core.parser.Output1Parser;
import io.github.yok.fermi.core.parser.OutputkgenParser;
import io.github.yok.fermi.core.parser.StructParser;
import io.github.yok.fermi.core.pipeline.FermiSurfacePipeline;
import io.github.yok.fermi.core.symmetry.SymmetryExpander;
import io.github.yok.fermi.out.CsvResultWriter;
import io.github.yok.fermi.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * パーサ・格子化・等値面抽出・出力の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 汎用形式と最適化形式の両方を扱える {@link FermiSurfacePipeline} を組み立てます。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class FermiSurfaceConfiguration {

    /**
     * fermi-surface の設定値（fermi.*）です。
     */
    private final FermiProperties p;

    /**
     * 汎用形式の読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public GenericFermiDataReader genericFermiDataReader() {
        return new GenericFermiDataReader(new KlistParser(), new EnergyFileParser(),
                fermiEnergyParser(), new StructParser());
    }

    /**
     * フェルミエネルギーのパーサを生成します。
     *
     * @return パーサです
     */
    @Bean
    public FermiEnergyParser fermiEnergyParser() {
        return new FermiEnergyParser();
    }

    /**
     * 対称展開ロジックを生成します。
     *
     * @return 対称展開ロジックです
     */
    @Bean
    public SymmetryExpander symmetryExpander() {
        return new SymmetryExpander(p.getSymmetry().getTolerance());
    }

    /**
     * 等値面抽出ロジックを生成します。
     *
     * @return 等値面抽出ロジックです
     */
    @Bean
    public IsosurfaceExtractor isosurfaceExtractor() {
        return new MarchingCubesExtractor();
    }

    /**
     * 処理全体をまとめるパイプラインを生成します。
     *
     * @param reader 汎用形式の読み込みロジックです
     * @param fermiEnergyParser フェルミエネルギーのパーサです
     * @param expander 対称展開ロジックです
     * @param extractor 等値面抽出ロジックです
     * @return パイプラインです
     */
    @Bean
    public FermiSurfacePipeline fermiSurfacePipeline(GenericFermiDataReader reader,
            FermiEnergyParser fermiEnergyParser, SymmetryExpander expander,
            IsosurfaceExtractor extractor) {
        return new FermiSurfacePipeline(reader, new Output1Parser(), fermiEnergyParser,
                new OutputkgenParser(), expander, new InterpolatedGridBuilder(),
                new DirectGridFiller(), new FermiLevelShifter(), new BandCrossingFilter(),
                extractor, p.getGrid().getSize());
    }

    /**
     * 入力ファイルの読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public InputFileLoader inputFileLoader() {
        return new InputFileLoader(p.getInput().getDir());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir(), p.getOutput().isCartesian());
    }
}
