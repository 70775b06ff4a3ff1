package io.github.yok.fermi.app;

import io.github.yok.fermi.core.exception.UnreadableInputException;
import io.github.yok.fermi.core.parser.CaseNames;
import io.github.yok.fermi.core.parser.Wien2kFileType;
import io.github.yok.fermi.core.pipeline.GenericInputs;
import io.github.yok.fermi.core.pipeline.PrecomputedInputs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * 入力ディレクトリから {@code <case>.<拡張子>} のファイルを読み込むクラスです。
 *
 * <p>
 * ケース名が空の場合は、ディレクトリ内の klist（最適化形式では output1）のファイル名から推定します。
 * </p>
 */
@Slf4j
public class InputFileLoader {

    /**
     * 入力ディレクトリです。
     */
    private final Path dir;

    /**
     * 入力ローダを生成します。
     *
     * @param dir 入力ディレクトリです（null 不可）
     * @throws IllegalArgumentException dir が null または空の場合に発生します
     */
    public InputFileLoader(String dir) {
        if (dir == null || dir.isEmpty()) {
            throw new IllegalArgumentException("input.dir は必須です");
        }
        this.dir = Paths.get(dir);
    }

    /**
     * 汎用形式の 4 ファイルを読み込みます。
     *
     * <p>
     * spinOrbit が false でも {@code .energy} がなく {@code .energyso} がある場合は後者を読みます。
     * </p>
     *
     * @param caseName ケース名です（空なら推定します）
     * @param spinOrbit .energyso を読むかどうかです
     * @return 入力内容です
     * @throws UnreadableInputException ファイルが存在しない、または読み込めない場合に発生します
     */
    public GenericInputs loadGeneric(String caseName, boolean spinOrbit) {
        String name = resolveCaseName(caseName, Wien2kFileType.KLIST);
        boolean so = spinOrbit;
        if (!so && !Files.exists(dir.resolve(name + ".energy"))
                && Files.exists(dir.resolve(name + ".energyso"))) {
            log.info("{}.energy がないため {}.energyso をスピン軌道形式として読みます", name, name);
            so = true;
        }
        String klist = read(name + ".klist", Wien2kFileType.KLIST);
        String energy = so ? read(name + ".energyso", Wien2kFileType.ENERGYSO)
                : read(name + ".energy", Wien2kFileType.ENERGY);
        String scf = read(name + ".scf", Wien2kFileType.SCF);
        String struct = read(name + ".struct", Wien2kFileType.STRUCT);
        return new GenericInputs(klist, energy, scf, struct, name, so);
    }

    /**
     * 最適化形式の 3 ファイルを読み込みます。
     *
     * @param caseName ケース名です（空なら推定します）
     * @return 入力内容です
     * @throws UnreadableInputException ファイルが存在しない、または読み込めない場合に発生します
     */
    public PrecomputedInputs loadPrecomputed(String caseName) {
        String name = resolveCaseName(caseName, Wien2kFileType.OUTPUT1);
        String output1 = read(name + ".output1", Wien2kFileType.OUTPUT1);
        String output2 = read(name + ".output2", Wien2kFileType.OUTPUT2);
        String outputkgen = read(name + ".outputkgen", Wien2kFileType.OUTPUTKGEN);
        return new PrecomputedInputs(output1, output2, outputkgen, name);
    }

    /**
     * ケース名を決定します。
     *
     * @param caseName 指定されたケース名です
     * @param anchor 推定に使うファイル種別です
     * @return ケース名です
     * @throws UnreadableInputException 推定に使えるファイルがない場合に発生します
     */
    String resolveCaseName(String caseName, Wien2kFileType anchor) {
        if (caseName != null && !caseName.isBlank()) {
            return caseName;
        }
        if (!Files.isDirectory(dir)) {
            throw new UnreadableInputException(dir.toString(), "ディレクトリではありません");
        }
        List<String> names;
        try (Stream<Path> files = Files.list(dir)) {
            names = files.map(p -> p.getFileName().toString()).sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UnreadableInputException(dir.toString(), e);
        }
        Optional<String> found = names.stream()
                .filter(n -> Wien2kFileType.detect(null, n) == anchor).findFirst();
        if (found.isEmpty()) {
            throw new UnreadableInputException(dir.toString(),
                    anchor + " のファイルがないためケース名を推定できません");
        }
        String name = CaseNames.extractCaseName(found.get());
        log.info("ケース名を {} と推定しました（{}）", name, found.get());
        return name;
    }

    /**
     * ファイルを UTF-8 で読み込みます。
     *
     * <p>
     * 内容から判定した種別が期待と異なる場合は WARN を出力します（読み込みは続けます）。
     * </p>
     *
     * @param filename ファイル名です
     * @param expected 期待する種別です
     * @return 内容です
     * @throws UnreadableInputException ファイルが存在しない、または読み込めない場合に発生します
     */
    private String read(String filename, Wien2kFileType expected) {
        Path file = dir.resolve(filename);
        if (!Files.isRegularFile(file)) {
            throw new UnreadableInputException(file.toString(), "ファイルが存在しません");
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UnreadableInputException(file.toString(), e);
        }
        Wien2kFileType detected = Wien2kFileType.detect(content, null);
        if (!isCompatible(expected, detected)) {
            log.warn("{} の内容は {} に見えます（期待: {}）", filename, detected, expected);
        }
        log.debug("{} を読み込みました（{} 文字）", file, content.length());
        return content;
    }

    /**
     * 内容から判定した種別が期待する種別と矛盾しないかどうかを返します。
     *
     * <p>
     * energy と energyso、output2 と scf は内容だけでは区別できないため同じものとして扱います。
     * </p>
     *
     * @param expected 期待する種別です
     * @param detected 内容から判定した種別です
     * @return 矛盾しない場合は true です
     */
    static boolean isCompatible(Wien2kFileType expected, Wien2kFileType detected) {
        if (detected == Wien2kFileType.UNKNOWN || detected == expected) {
            return true;
        }
        if (expected == Wien2kFileType.ENERGY && detected == Wien2kFileType.ENERGYSO) {
            return true;
        }
        return expected == Wien2kFileType.OUTPUT2 && detected == Wien2kFileType.SCF;
    }
}
