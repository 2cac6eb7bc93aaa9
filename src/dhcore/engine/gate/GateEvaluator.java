package dhcore.engine.gate;

import dhcore.engine.DerivedSeries;

/**
 * Фильтр сценария: решает, какие часы сохраняют градусо-часы.
 */
public interface GateEvaluator {

    /**
     * Флаги "оставить" по каждому часу ряда.
     * Требует заполненных суточных/недельных средних.
     */
    boolean[] evaluate(DerivedSeries series);

    /**
     * Обнулить градусо-часы там, где фильтр не прошёл.
     *
     * @return число обнулённых часов с ненулевыми градусо-часами
     */
    default int apply(DerivedSeries series) {
        boolean[] keep = evaluate(series);
        int zeroed = 0;
        for (int i = 0; i < series.size; i++) {
            if (keep[i]) continue;
            if (series.degreeHour[i] > 0.0) zeroed++;
            series.degreeHour[i] = 0.0;
        }
        return zeroed;
    }
}
