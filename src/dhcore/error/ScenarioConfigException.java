package dhcore.error;

/**
 * Некорректная конфигурация сценария (диапазон, шаг бина, неоднозначный фильтр).
 */
public class ScenarioConfigException extends DegreeHourException {

    public ScenarioConfigException(String message) {
        super(message);
    }
}
