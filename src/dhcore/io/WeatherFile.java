package dhcore.io;

import dhcore.model.SiteMetadata;
import dhcore.model.TemperatureSeries;

/**
 * Прочитанный метеофайл: паспорт станции и почасовой ряд.
 */
public record WeatherFile(String source, SiteMetadata site, TemperatureSeries series) {}
