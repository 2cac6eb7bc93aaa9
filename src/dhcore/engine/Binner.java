package dhcore.engine;

import dhcore.config.DegreeHourConstants;
import dhcore.config.ScenarioConfig;
import org.apache.commons.math3.util.Precision;

import java.util.ArrayList;
import java.util.List;

/**
 * Построение температурных бинов сценария.
 * Внутренние границы lo, lo+W, lo+2W, ... не выше hi; первой ставится -100,
 * последней +100. Порядок фиксирован и от способа вставки не зависит.
 */
public final class Binner {

    private Binner() {}

    public static BinScheme build(ScenarioConfig cfg) {
        return build(cfg.getMinTemperature(), cfg.getMaxTemperature(), cfg.getBinWidth());
    }

    public static BinScheme build(double lo, double hi, double width) {
        if (!(width > 0.0)) {
            throw new IllegalArgumentException("width must be > 0");
        }
        if (!(lo < hi)) {
            throw new IllegalArgumentException("lo must be < hi");
        }

        List<Double> interior = new ArrayList<>();
        for (int k = 0; ; k++) {
            // lo + k*W без накопления: каждая граница считается от lo
            double b = Precision.round(lo + k * width, DegreeHourConstants.BOUNDARY_SCALE);
            if (Precision.compareTo(b, hi, DegreeHourConstants.BOUNDARY_EPSILON) > 0) break;
            interior.add(b);
        }

        double[] boundaries = new double[interior.size() + 2];
        boundaries[0] = DegreeHourConstants.TEMP_OVERFLOW_MIN;
        for (int i = 0; i < interior.size(); i++) {
            boundaries[i + 1] = interior.get(i);
        }
        boundaries[boundaries.length - 1] = DegreeHourConstants.TEMP_OVERFLOW_MAX;
        return new BinScheme(boundaries);
    }

    /**
     * Индексы бинов по всем часам ряда (-1 для пропусков).
     */
    public static int[] assign(BinScheme scheme, double[] temps) {
        int[] out = new int[temps.length];
        for (int i = 0; i < temps.length; i++) {
            out[i] = scheme.indexOf(temps[i]);
        }
        return out;
    }
}
