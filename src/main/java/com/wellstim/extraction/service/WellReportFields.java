package com.wellstim.extraction.service;

import com.wellstim.extraction.model.FieldDefinition;
import com.wellstim.extraction.model.ValueKind;

import java.util.List;
import java.util.regex.Pattern;

import static com.wellstim.extraction.model.FieldDefinition.identity;
import static com.wellstim.extraction.model.FieldDefinition.of;

/**
 * Field tables for well reports. Field names are the entity property names the
 * values are written to; column lengths mirror the entity mappings.
 */
public final class WellReportFields {

    private static final String SEP = "[:#\\s-]+";

    // Lazy so a minus sign directly before the number is not eaten as a separator
    private static final String SIGNED_SEP = "[:#\\s-]+?";

    public static final int TEXT_LIMIT = 65500;

    public static final List<FieldDefinition> WELL = List.of(
            of("operator", ValueKind.STRING, 255,
                    "Operator(?: Name)?" + SEP + "(.+)",
                    "Operator\\s+(.*)"),
            of("wellName", ValueKind.STRING, 255,
                    "Well(?: Name)?(?: & Number)?" + SEP + "(.+)",
                    "Well\\s+Name\\s*/\\s*Number" + SEP + "(.+)"),
            identity("api", ValueKind.API_NUMBER, 64,
                    "API(?:\\s*Number|\\s*No\\.?|\\s*#)?[:#\\s-]*([0-9\\-]{5,})",
                    "API(?:\\s*Number|\\s*No\\.?|\\s*#)?[:#\\s-]*([0-9\\s\\-]{5,})"),
            of("ensecoJob", ValueKind.STRING, 64,
                    "Enseco\\s*Job\\s*#" + SEP + "(\\S+)"),
            of("jobType", ValueKind.STRING, 255,
                    "Job\\s*Type" + SEP + "(.+)",
                    "Type of Job" + SEP + "(.+)"),
            of("countyState", ValueKind.STRING, 255,
                    "County,?\\s*State" + SEP + "(.+)",
                    "County" + SEP + "(.+)"),
            of("shl", ValueKind.STRING, TEXT_LIMIT,
                    "Surface\\s*Hole\\s*Location\\s*\\(SHL\\)" + SEP + "(.+)"),
            of("latitude", ValueKind.DOUBLE, 0,
                    "Latitude" + SIGNED_SEP + "(-?\\d+\\.\\d+)",
                    "Lat(?:itude)?" + SIGNED_SEP + "(-?\\d+\\.\\d+)"),
            of("longitude", ValueKind.DOUBLE, 0,
                    "Longitude" + SIGNED_SEP + "(-?\\d+\\.\\d+)",
                    "Long(?:itude)?" + SIGNED_SEP + "(-?\\d+\\.\\d+)"),
            of("datum", ValueKind.STRING, 255,
                    "Datum" + SEP + "(.+)")
    );

    public static final List<FieldDefinition> STIMULATION = List.of(
            identity("dateStimulated", ValueKind.DATE, 0,
                    "Date\\s*Stimulated" + SEP + "(.+)",
                    "Stimulated\\s*Date" + SEP + "(.+)"),
            of("stimulatedFormation", ValueKind.STRING, 255,
                    "Stimulated\\s*Formation" + SEP + "(.+)",
                    "Formation" + SEP + "(.+)"),
            of("topFt", ValueKind.DOUBLE, 0,
                    "Top\\s*\\(ft\\)" + SEP + "([\\d,]+)",
                    "Top" + SEP + "([\\d,]+)\\s*ft"),
            of("bottomFt", ValueKind.DOUBLE, 0,
                    "Bottom\\s*\\(ft\\)" + SEP + "([\\d,]+)",
                    "Bottom" + SEP + "([\\d,]+)\\s*ft"),
            of("stimulationStages", ValueKind.INTEGER, 0,
                    "Stimulation\\s*Stages" + SEP + "(\\d+)",
                    "Stages" + SEP + "(\\d+)"),
            of("volume", ValueKind.DOUBLE, 0,
                    "Volume\\s*\\(?(?:bbls|gal|m3)?\\)?" + SEP + "([\\d,]+(?:\\.\\d+)?)",
                    "Total\\s*Volume" + SEP + "([\\d,]+(?:\\.\\d+)?)"),
            of("volumeUnits", ValueKind.STRING, 32,
                    "Volume\\s*(?:\\(([^)]+)\\))",
                    "Volume\\s*Units" + SEP + "(\\w+)"),
            of("typeTreatment", ValueKind.STRING, 255,
                    "Type\\s*Treatment" + SEP + "(.+)",
                    "Treatment\\s*Type" + SEP + "(.+)"),
            of("acid", ValueKind.STRING, 255,
                    "Acid" + SEP + "(.+)",
                    "Acid\\s*Type" + SEP + "(.+)"),
            of("lbsProppant", ValueKind.DOUBLE, 0,
                    "Lbs?\\.?\\s*Proppant" + SEP + "([\\d,]+)",
                    "Proppant" + SEP + "([\\d,]+)"),
            of("maxTreatmentPressure", ValueKind.DOUBLE, 0,
                    "Max(?:imum)?\\s*Treatment\\s*Pressure" + SEP + "([\\d,]+)"),
            of("maxTreatmentRate", ValueKind.DOUBLE, 0,
                    "Max(?:imum)?\\s*Treatment\\s*Rate" + SEP + "([\\d,]+(?:\\.\\d+)?)"),
            of("details", ValueKind.STRING, TEXT_LIMIT,
                    "Details" + SEP + "(.+)")
    );

    // Latitude and longitude printed on one line, e.g. "Latitude: 48.1 Longitude: -103.6"
    public static final Pattern LAT_LONG = Pattern.compile(
            "Latitude" + SIGNED_SEP + "(-?\\d+\\.\\d+).{0,40}?Longitude" + SIGNED_SEP + "(-?\\d+\\.\\d+)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public static final String DETAILS_LABEL = "Details";

    private WellReportFields() {
    }
}
