package com.notes.ingestion.satellite;

import com.notes.ingestion.identity.IdentifierSynthesizer;
import com.notes.ingestion.identity.LocationCodes;

import java.time.Year;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Auxiliary records an extraction may carry next to its main entity. Each kind is stored in its own
 * collection under the same name as its extraction key.
 */
public enum SatelliteKind {

    CLIENT("clients", "clientName is required",
            f -> f.has("clientName"),
            (f, ids) -> "CLI-" + LocationCodes.letters(f.text("clientName"), 4) + "-" + ids.randomDigits(4)),

    TECHNOLOGY("technology", "technologyName and officeId are required",
            f -> f.has("technologyName") && f.has("officeId"),
            (f, ids) -> officeCode(f) + "-TECH-" + upper(f.text("technologyName"), 3) + "-" + ids.randomDigits(3)),

    FINANCIAL("financials", "amount, recordType and officeId are required",
            f -> f.has("amount") && f.has("recordType") && f.has("officeId"),
            (f, ids) -> officeCode(f) + "-FIN-" + upper(f.text("recordType"), 3) + "-" + ids.currentMillis()),

    SUPPLY_CHAIN("supplyChain", "supplierName is required",
            f -> f.has("supplierName"),
            (f, ids) -> "SUP-" + LocationCodes.letters(f.text("supplierName"), 4) + "-" + ids.randomDigits(4)),

    LAND_DATA("landData", "location with city and country is required",
            f -> f.has("location.city") && f.has("location.country"),
            (f, ids) -> "LAND-" + upper(f.text("location.country"), 2)
                    + LocationCodes.letters(f.text("location.city"), 3) + "-" + ids.randomDigits(4)),

    CITY_DATA("cityData", "cityId is required",
            f -> f.has("cityId"),
            (f, ids) -> "CITY-" + f.text("cityId")),

    PROJECT_DATA("projectData", "projectId is required",
            f -> f.has("projectId"),
            (f, ids) -> "PROJ-" + f.text("projectId")),

    COMPANY_STRUCTURE("companyStructure", "officeId is required",
            f -> f.has("officeId"),
            (f, ids) -> "STRUCT-" + f.text("officeId")),

    DIVISION_PERCENTAGES("divisionPercentages", "officeId and divisionType are required",
            f -> f.has("officeId") && f.has("divisionType"),
            (f, ids) -> officeCode(f) + "-DIV-" + upper(f.text("divisionType"), 3) + "-" + period(f)),

    NEWS_ARTICLES("newsArticles", "title or url is required",
            f -> f.has("title") || f.has("url"),
            (f, ids) -> "NEWS-" + LocationCodes.compact(f.has("title") ? f.text("title") : "article", 6)
                    + "-" + lastDigits(ids.currentMillis(), 8)),

    POLITICAL_CONTEXT("politicalContext", "jurisdiction.country is required",
            f -> f.has("jurisdiction.country"),
            (f, ids) -> "POL-" + upper(f.text("jurisdiction.country"), 2)
                    + (f.has("jurisdiction.level") ? upper(f.text("jurisdiction.level"), 1) : "N")
                    + (f.has("jurisdiction.state") ? upper(f.text("jurisdiction.state"), 2) : "")
                    + (f.has("jurisdiction.cityId") ? upper(f.text("jurisdiction.cityId"), 3) : "")
                    + "-" + ids.randomDigits(4));

    private final String key;
    private final String requirement;
    private final Predicate<SatelliteFields> valid;
    private final BiFunction<SatelliteFields, IdentifierSynthesizer, String> idRule;

    SatelliteKind(String key, String requirement, Predicate<SatelliteFields> valid,
                  BiFunction<SatelliteFields, IdentifierSynthesizer, String> idRule) {
        this.key = key;
        this.requirement = requirement;
        this.valid = valid;
        this.idRule = idRule;
    }

    /**
     * Extraction key and collection name.
     */
    public String key() {
        return key;
    }

    public String collection() {
        return key;
    }

    public String requirement() {
        return requirement;
    }

    public boolean isValid(SatelliteFields fields) {
        return valid.test(fields);
    }

    public String synthesizeId(SatelliteFields fields, IdentifierSynthesizer ids) {
        return idRule.apply(fields, ids);
    }

    /**
     * True for kinds with one record per owner; their ids are not random, so saving one again
     * updates the stored record.
     */
    public boolean isKeyed() {
        return this == CITY_DATA || this == PROJECT_DATA || this == COMPANY_STRUCTURE
                || this == DIVISION_PERCENTAGES;
    }

    /**
     * True when the record belongs to an office and may inherit the note's office id.
     */
    public boolean isOfficeScoped() {
        return this == TECHNOLOGY || this == FINANCIAL || this == COMPANY_STRUCTURE
                || this == DIVISION_PERCENTAGES;
    }

    public static SatelliteKind fromKey(String key) {
        for (SatelliteKind kind : values()) {
            if (kind.key.equals(key)) {
                return kind;
            }
        }
        return null;
    }

    private static String officeCode(SatelliteFields f) {
        String officeId = f.text("officeId");
        return officeId.length() > 4 ? officeId.substring(0, 4) : officeId;
    }

    private static String upper(String value, int length) {
        String upper = value.trim().toUpperCase(Locale.ROOT);
        return upper.length() > length ? upper.substring(0, length) : upper;
    }

    private static String period(SatelliteFields f) {
        return f.has("period.year") ? f.text("period.year") : String.valueOf(Year.now().getValue());
    }

    private static String lastDigits(long value, int count) {
        String digits = Long.toString(value);
        return digits.length() > count ? digits.substring(digits.length() - count) : digits;
    }
}
