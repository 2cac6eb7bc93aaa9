package dhcore.engine;

/**
 * Замечание по качеству данных: час без температуры.
 * Не прерывает расчёт: час даёт 0 градусо-часов и не попадает в бины.
 */
public record DataQualityWarning(int timeIndex, int month, int day, int hour, String message) {

    @Override
    public String toString() {
        return "[" + timeIndex + "] " + month + "/" + day + " " + hour + "h: " + message;
    }
}
