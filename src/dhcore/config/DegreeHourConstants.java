// File: dhcore/config/DegreeHourConstants.java
package dhcore.config;

/**
 * Глобальные константы расчёта градусо-часов.
 */
public final class DegreeHourConstants {

    /** Часов в сутках (длина суточного блока) */
    public static final int HOURS_PER_DAY = 24;

    /** Часов в неделе (длина недельного блока) */
    public static final int HOURS_PER_WEEK = 168;

    /** Длина ряда обычного года */
    public static final int HOURS_PER_YEAR = 8760;

    /** Длина ряда високосного года */
    public static final int HOURS_PER_LEAP_YEAR = 8784;

    // =========================================================================
    // ===========================    БИНЫ   ===================================
    // =========================================================================

    /** Нижняя граница переполнения: всё, что холоднее диапазона сценария */
    public static final double TEMP_OVERFLOW_MIN = -100.0;

    /** Верхняя граница переполнения: всё, что теплее диапазона сценария */
    public static final double TEMP_OVERFLOW_MAX = 100.0;

    /** Допуск при сравнении границ бинов с верхом диапазона */
    public static final double BOUNDARY_EPSILON = 1e-9;

    /** Знаков после запятой при округлении границ (убирает накопленный шум lo + k*W) */
    public static final int BOUNDARY_SCALE = 10;

    // =========================================================================
    // ===========================    CDD    ===================================
    // =========================================================================

    /** Базовая температура для CDD по умолчанию, °C (67 °F) */
    public static final double DEFAULT_CDD_BASE_TEMPERATURE = 19.44;

    /** Окно скользящего среднего CDD, сутки */
    public static final int CDD_WEEK_DAYS = 7;

    // =========================================================================
    // ===========================    EPW    ===================================
    // =========================================================================

    /** Строк заголовка в EPW до начала почасовых данных */
    public static final int EPW_HEADER_LINES = 8;

    /** Номер колонки температуры сухого термометра (0-based) */
    public static final int EPW_DRY_BULB_COLUMN = 6;

    /** Маркер отсутствующей температуры в EPW */
    public static final double EPW_MISSING_DRY_BULB = 99.9;

    private DegreeHourConstants() {}
}
