package dhcore.engine;

import dhcore.config.DegreeHourConstants;
import dhcore.config.DegreeType;

/**
 * Почасовые градусо-часы по сырой температуре часа (не по блочной средней).
 * HEATING: max((порог - t) / 24, 0); COOLING: max((t - порог) / 24, 0).
 */
public final class DegreeHourCalculator {

    private DegreeHourCalculator() {}

    public static double degreeHour(DegreeType type, double threshold, double temp) {
        if (Double.isNaN(temp)) return 0.0;
        double delta = (type == DegreeType.HEATING) ? (threshold - temp) : (temp - threshold);
        return Math.max(delta / DegreeHourConstants.HOURS_PER_DAY, 0.0);
    }

    public static double[] compute(DegreeType type, double threshold, double[] temps) {
        double[] out = new double[temps.length];
        for (int i = 0; i < temps.length; i++) {
            out[i] = degreeHour(type, threshold, temps[i]);
        }
        return out;
    }
}
