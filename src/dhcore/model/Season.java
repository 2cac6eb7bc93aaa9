package dhcore.model;

/**
 * Сезон по фиксированному календарю (без привязки к году).
 */
public enum Season {
    WINTER,  // 01.01 - 20.03 и 21.12 - 31.12
    SPRING,  // 21.03 - 20.06
    SUMMER,  // 21.06 - 20.09
    FALL     // 21.09 - 20.12
}
