package dhcore.engine;

import dhcore.config.DegreeHourConstants;
import dhcore.model.AggregateRow;
import dhcore.model.Season;
import dhcore.model.SiteMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Группировка часов прогона по (час суток, бин).
 * <p>
 * Строки выдаются для всех 24 x binCount комбинаций, по возрастанию часа, затем бина.
 * Счётчики группы = число часов группы с градусо-часами > 0 (и нужным сезоном);
 * средняя температура - по всем часам группы. Пустая группа даёт нули, а не NaN.
 * Часы без температуры (бин -1) в группы не попадают.
 */
public final class Aggregator {

    private Aggregator() {}

    public static List<AggregateRow> aggregate(DerivedSeries s, BinScheme scheme, SiteMetadata site) {
        int hours = DegreeHourConstants.HOURS_PER_DAY;
        int bins = scheme.binCount();
        int seasons = Season.values().length;

        double[][] sumDh = new double[hours][bins];
        double[][] sumTemp = new double[hours][bins];
        int[][] members = new int[hours][bins];
        int[][] active = new int[hours][bins];
        int[][][] activeBySeason = new int[hours][bins][seasons];

        for (int i = 0; i < s.size; i++) {
            int b = s.binIndex[i];
            if (b < 0) continue;
            int h = s.hour[i];

            double dh = s.degreeHour[i];
            sumDh[h][b] += dh;
            sumTemp[h][b] += s.temperature[i];
            members[h][b]++;

            if (dh > 0.0) {
                active[h][b]++;
                activeBySeason[h][b][s.season[i].ordinal()]++;
            }
        }

        String city = (site != null) ? site.city() : "";
        String stateProvince = (site != null) ? site.stateProvince() : "";

        List<AggregateRow> rows = new ArrayList<>(hours * bins);
        for (int h = 0; h < hours; h++) {
            for (int b = 0; b < bins; b++) {
                int n = members[h][b];
                double meanTemp = (n == 0) ? 0.0 : sumTemp[h][b] / n;
                int[] bySeason = activeBySeason[h][b];

                rows.add(new AggregateRow(
                        h,
                        scheme.bin(b),
                        sumDh[h][b],
                        meanTemp,
                        active[h][b],
                        bySeason[Season.SPRING.ordinal()],
                        bySeason[Season.SUMMER.ordinal()],
                        bySeason[Season.FALL.ordinal()],
                        bySeason[Season.WINTER.ordinal()],
                        city,
                        stateProvince
                ));
            }
        }
        return rows;
    }
}
