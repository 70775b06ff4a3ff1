package io.github.yok.fermi.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * 固有値ファイル（case.energy / case.energyso）を読み込むクラスです。
 *
 * <p>
 * k 点ごとに見出し行 {@code kx ky kz index nPW nBands weight} があり、続く nBands 行が
 * {@code bandIndex energy(Ry)} です。エネルギーは eV に換算して返します。 スピン軌道（energyso）形式は先頭 4 行が
 * ファイル見出しのため読み飛ばします。
 * </p>
 */
@Slf4j
public final class EnergyFileParser {

    /**
     * スピン軌道形式のファイル見出し行数です。
     */
    static final int SPIN_ORBIT_HEADER_LINES = 4;

    private static final String NUM = "([-+]?[\\d.]+(?:[EeDd][-+]?\\d+)?)";

    /**
     * 座標の区切りです。固定幅 (3E19.12) では負号の前に空白が入らないため、符号の直前でも区切ります。
     */
    private static final String COORD_SEP = "(?:\\s+|(?=[-+]))";

    /**
     * k 点見出し行です。
     */
    private static final Pattern K_HEADER = Pattern.compile("^\\s*" + NUM + COORD_SEP + NUM
            + COORD_SEP + NUM + "\\s+(\\S+)\\s+(\\d+)\\s+(\\d+)\\s+([\\d.]+)");

    /**
     * バンド行です。
     */
    private static final Pattern BAND_LINE = Pattern.compile("^\\s*(\\d+)\\s+" + NUM);

    /**
     * 見出し行の分類器です。
     */
    private final LineClassifier<KPointHeader> headerClassifier = new LineClassifier<>(
            List.of(line -> line.isBlank() ? Optional.of(ParsedLine.skip()) : Optional.empty(),
                    EnergyFileParser::matchHeader));

    /**
     * バンド行の分類器です。
     */
    private final LineClassifier<Double> bandClassifier =
            new LineClassifier<>(List.of(EnergyFileParser::matchBand));

    /**
     * 固有値ファイルを読み込みます。
     *
     * @param content ファイル内容です（null は空扱い）
     * @param spinOrbit スピン軌道形式（先頭 4 行を読み飛ばす）かどうかです
     * @return k 点ごとのエネルギー（ファイル順）です
     */
    public List<KPointEnergies> parse(String content, boolean spinOrbit) {
        List<String> lines = TextLines.split(content);
        List<KPointEnergies> result = new ArrayList<>();

        int i = spinOrbit ? SPIN_ORBIT_HEADER_LINES : 0;
        while (i < lines.size()) {
            ParsedLine<KPointHeader> parsed = headerClassifier.classify(lines.get(i));
            if (!parsed.isRecord()) {
                i++;
                continue;
            }

            KPointHeader header = parsed.getValue();
            List<Double> energies = new ArrayList<>(header.getBandCount());
            for (int b = 0; b < header.getBandCount(); b++) {
                i++;
                if (i >= lines.size()) {
                    break;
                }
                ParsedLine<Double> band = bandClassifier.classify(lines.get(i));
                if (band.isRecord()) {
                    energies.add(EnergyUnits.rydbergToEv(band.getValue()));
                }
            }
            if (energies.size() < header.getBandCount()) {
                log.debug("k 点 ({}, {}, {}) のバンド行が不足しています: 期待={}、実際={}", header.getKx(),
                        header.getKy(), header.getKz(), header.getBandCount(), energies.size());
            }
            result.add(new KPointEnergies(header.getKx(), header.getKy(), header.getKz(),
                    header.getWeight(), energies));
            i++;
        }
        return result;
    }

    /**
     * k 点見出し行を認識します。
     */
    static Optional<ParsedLine<KPointHeader>> matchHeader(String line) {
        Matcher m = K_HEADER.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        OptionalDouble kx = TextLines.parseDouble(m.group(1));
        OptionalDouble ky = TextLines.parseDouble(m.group(2));
        OptionalDouble kz = TextLines.parseDouble(m.group(3));
        OptionalDouble weight = TextLines.parseDouble(m.group(7));
        if (kx.isEmpty() || ky.isEmpty() || kz.isEmpty() || weight.isEmpty()) {
            return Optional.empty();
        }
        int bandCount = Integer.parseInt(m.group(6));
        return Optional.of(ParsedLine.record(new KPointHeader(kx.getAsDouble(), ky.getAsDouble(),
                kz.getAsDouble(), bandCount, weight.getAsDouble())));
    }

    /**
     * バンド行を認識し、エネルギー（Ry）を返します。
     */
    static Optional<ParsedLine<Double>> matchBand(String line) {
        Matcher m = BAND_LINE.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        OptionalDouble energy = TextLines.parseDouble(m.group(2));
        return energy.isPresent() ? Optional.of(ParsedLine.record(energy.getAsDouble()))
                : Optional.empty();
    }

    /**
     * k 点見出し行の内容です。
     */
    @Value
    static class KPointHeader {

        double kx;

        double ky;

        double kz;

        int bandCount;

        double weight;
    }

    /**
     * 1 つの k 点のエネルギー（eV）です。
     */
    @Value
    public static class KPointEnergies {

        double kx;

        double ky;

        double kz;

        double weight;

        List<Double> energies;
    }
}
