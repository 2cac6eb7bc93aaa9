package dhcore.model;

import dhcore.error.InputShapeException;

import java.time.DateTimeException;
import java.time.MonthDay;

/**
 * Одна почасовая запись метеофайла.
 * Час уже нормализован к 0..23; NaN в температуре означает пропуск.
 */
public final class HourlyRecord {

    private final int month;
    private final int day;
    private final int hour;
    private final double airTemperature;

    public HourlyRecord(int month, int day, int hour, double airTemperature) {
        if (hour < 0 || hour > 23) {
            throw new InputShapeException("Час вне диапазона 0..23: " + hour);
        }
        try {
            MonthDay.of(month, day);
        } catch (DateTimeException e) {
            throw new InputShapeException("Недопустимая дата: месяц=" + month + ", день=" + day, e);
        }
        if (Double.isInfinite(airTemperature)) {
            throw new InputShapeException("Бесконечная температура: " + month + "/" + day + " " + hour + "h");
        }
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.airTemperature = airTemperature;
    }

    public int getMonth() {
        return month;
    }

    public int getDay() {
        return day;
    }

    public int getHour() {
        return hour;
    }

    public double getAirTemperature() {
        return airTemperature;
    }

    public boolean isTemperatureMissing() {
        return Double.isNaN(airTemperature);
    }

    @Override
    public String toString() {
        return month + "/" + day + " " + hour + "h " + airTemperature + "C";
    }
}
