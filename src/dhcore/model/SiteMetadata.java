package dhcore.model;

/**
 * Паспорт метеостанции из строки LOCATION файла EPW.
 */
public record SiteMetadata(String city,
                           String stateProvince,
                           String country,
                           String source,
                           String wmoCode,
                           double latitude,
                           double longitude,
                           double timeZone,
                           double elevation) {

    /** Паспорт без координат, когда известны только город и регион. */
    public static SiteMetadata named(String city, String stateProvince) {
        return new SiteMetadata(city, stateProvince, "", "", "", Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }
}
