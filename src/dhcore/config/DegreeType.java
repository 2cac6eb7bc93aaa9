package dhcore.config;

/**
 * Тип градусо-часов: отопление или охлаждение.
 */
public enum DegreeType {
    HEATING,  // нагрузка, когда на улице холоднее порога
    COOLING   // нагрузка, когда на улице теплее порога
}
