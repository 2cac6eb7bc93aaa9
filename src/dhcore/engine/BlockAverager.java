package dhcore.engine;

import dhcore.config.DegreeHourConstants;

/**
 * Средние по фиксированным неперекрывающимся блокам.
 * Блок k: индексы [k*B, min((k+1)*B, N)); блоки отсчитываются от индекса 0,
 * последний может быть короче B. Это не скользящее среднее: все часы блока
 * получают одно и то же значение.
 * <p>
 * Пропуски (NaN) в среднее не входят; блок без единого значения даёт NaN.
 */
public final class BlockAverager {

    private BlockAverager() {}

    /** Суточные средние (блок 24 ч), значение на каждый час. */
    public static double[] dailyMeans(double[] temps) {
        return blockMeans(temps, DegreeHourConstants.HOURS_PER_DAY);
    }

    /** Недельные средние (блок 168 ч), значение на каждый час. */
    public static double[] weeklyMeans(double[] temps) {
        return blockMeans(temps, DegreeHourConstants.HOURS_PER_WEEK);
    }

    /**
     * Среднее блока, продублированное на каждый индекс блока.
     */
    public static double[] blockMeans(double[] values, int blockSize) {
        double[] perBlock = perBlockMeans(values, blockSize);
        double[] out = new double[values.length];
        for (int k = 0; k < perBlock.length; k++) {
            int from = k * blockSize;
            int to = Math.min(from + blockSize, values.length);
            for (int i = from; i < to; i++) {
                out[i] = perBlock[k];
            }
        }
        return out;
    }

    /**
     * Одно среднее на блок: длина результата ceil(N / blockSize).
     */
    public static double[] perBlockMeans(double[] values, int blockSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize must be > 0");
        }
        int blocks = (values.length + blockSize - 1) / blockSize;
        double[] out = new double[blocks];

        for (int k = 0; k < blocks; k++) {
            int from = k * blockSize;
            int to = Math.min(from + blockSize, values.length);

            double sum = 0.0;
            int n = 0;
            for (int i = from; i < to; i++) {
                double v = values[i];
                if (Double.isNaN(v)) continue;
                sum += v;
                n++;
            }
            out[k] = (n == 0) ? Double.NaN : sum / n;
        }
        return out;
    }
}
