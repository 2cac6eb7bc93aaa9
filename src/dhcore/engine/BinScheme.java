package dhcore.engine;

import dhcore.model.TemperatureBin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Набор границ бинов: [-100, lo, lo+W, ..., 100] и соответствующие интервалы (b[i], b[i+1]].
 */
public final class BinScheme {

    private final double[] boundaries;
    private final List<TemperatureBin> bins;

    BinScheme(double[] boundaries) {
        this.boundaries = boundaries;
        List<TemperatureBin> list = new ArrayList<>(boundaries.length - 1);
        int last = boundaries.length - 2;
        for (int i = 0; i <= last; i++) {
            list.add(new TemperatureBin(i, boundaries[i], boundaries[i + 1], i == 0 || i == last));
        }
        this.bins = Collections.unmodifiableList(list);
    }

    public double[] boundaries() {
        return boundaries.clone();
    }

    public List<TemperatureBin> bins() {
        return bins;
    }

    public int binCount() {
        return bins.size();
    }

    public TemperatureBin bin(int index) {
        return bins.get(index);
    }

    /**
     * Индекс бина для температуры: интервалы закрыты справа.
     * Всё, что не выше первой внутренней границы, попадает в нижний бин переполнения
     * (включая значения не выше -100), всё, что выше последней внутренней, - в верхний.
     *
     * @return индекс бина или -1 для NaN
     */
    public int indexOf(double temp) {
        if (Double.isNaN(temp)) return -1;

        int lastBin = bins.size() - 1;
        if (temp <= boundaries[1]) return 0;
        if (temp > boundaries[boundaries.length - 2]) return lastBin;

        // первая граница >= temp; бин слева от неё
        int pos = Arrays.binarySearch(boundaries, temp);
        if (pos >= 0) {
            return pos - 1;
        }
        int insertion = -pos - 1;
        return insertion - 1;
    }
}
