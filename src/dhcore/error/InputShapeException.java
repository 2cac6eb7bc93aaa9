package dhcore.error;

/**
 * Неверная форма входного ряда: число записей, недопустимые поля, битая строка файла.
 */
public class InputShapeException extends DegreeHourException {

    public InputShapeException(String message) {
        super(message);
    }

    public InputShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
