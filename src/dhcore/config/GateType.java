package dhcore.config;

/**
 * Вариант фильтра, который обнуляет градусо-часы "неподходящих" часов/суток.
 * Выводится из ScenarioConfig, по имени сценария не выбирается.
 */
public enum GateType {
    DAILY,              // только суточная средняя
    DAILY_OR_WEEKLY,    // суточная ИЛИ недельная средняя (обнуляем, только если обе не прошли)
    DAILY_OR_CDD_WEEK   // суточная средняя ИЛИ скользящая средняя CDD за 7 суток, целыми сутками
}
