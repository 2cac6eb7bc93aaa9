package dhcore.engine;

/**
 * Площадка, пропущенная пакетным прогоном, и причина.
 */
public record SiteFailure(String source, String reason) {}
