package dhcore.model;

/**
 * Итоговая строка для пары (час суток, бин) одной площадки.
 */
public final class AggregateRow {

    /** Час суток 0..23. */
    public final int hourOfDay;

    /** Температурный бин. */
    public final TemperatureBin bin;

    /** Сумма градусо-часов группы. */
    public final double sumDegreeHour;

    /** Средняя температура всех часов группы, °C (0.0 для пустой группы). */
    public final double meanTemperature;

    /** Часов группы с градусо-часами > 0. */
    public final int countActiveHours;

    public final int countSpring;
    public final int countSummer;
    public final int countFall;
    public final int countWinter;

    public final String city;
    public final String stateProvince;

    public AggregateRow(int hourOfDay,
                        TemperatureBin bin,
                        double sumDegreeHour,
                        double meanTemperature,
                        int countActiveHours,
                        int countSpring,
                        int countSummer,
                        int countFall,
                        int countWinter,
                        String city,
                        String stateProvince) {
        this.hourOfDay = hourOfDay;
        this.bin = bin;
        this.sumDegreeHour = sumDegreeHour;
        this.meanTemperature = meanTemperature;
        this.countActiveHours = countActiveHours;
        this.countSpring = countSpring;
        this.countSummer = countSummer;
        this.countFall = countFall;
        this.countWinter = countWinter;
        this.city = city;
        this.stateProvince = stateProvince;
    }

    /** Активные часы выбранного сезона. */
    public int countFor(Season season) {
        return switch (season) {
            case SPRING -> countSpring;
            case SUMMER -> countSummer;
            case FALL -> countFall;
            case WINTER -> countWinter;
        };
    }

    @Override
    public String toString() {
        return "h" + hourOfDay + " " + bin.label()
                + " dh=" + sumDegreeHour + " t=" + meanTemperature + " n=" + countActiveHours
                + " [sp=" + countSpring + ", su=" + countSummer + ", fa=" + countFall + ", wi=" + countWinter + "]";
    }
}
