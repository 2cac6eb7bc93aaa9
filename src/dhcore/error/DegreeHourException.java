package dhcore.error;

/**
 * Базовое исключение расчёта градусо-часов.
 * Бросается только при структурных ошибках, после которых осмысленного
 * частичного результата не существует.
 */
public abstract class DegreeHourException extends RuntimeException {

    protected DegreeHourException(String message) {
        super(message);
    }

    protected DegreeHourException(String message, Throwable cause) {
        super(message, cause);
    }
}
