package de.htwsaar.datalinker.datalink.tap;

import java.math.BigInteger;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Baut ADQL-Abfragen für die DataLink-Microservices (Cone Search, Zeitreihen) und die
 * zugehörige Weiterleitungs-URL zum synchronen TAP-Endpunkt.
 */
public class TapRedirectService {

    private static final Logger log = LoggerFactory.getLogger(TapRedirectService.class);

    private final String tapSyncUrl;
    private final TapColumnMetadata metadata;

    public TapRedirectService(String tapSyncUrl, TapColumnMetadata metadata) {
        this.tapSyncUrl = Objects.requireNonNull(tapSyncUrl, "tapSyncUrl must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
    }

    /**
     * Kegelsuche um eine Position.
     *
     * @return Weiterleitungs-URL
     * @throws TapQueryException bei ungültigen Tabellen- oder Spaltennamen
     */
    public String coneSearch(String table, String raCol, String decCol, double raVal, double decVal, double radius) {
        require("table", table, AdqlPatterns.COMPOUND_TABLE);
        require("ra_col", raCol, AdqlPatterns.IDENTIFIER);
        require("dec_col", decCol, AdqlPatterns.IDENTIFIER);

        String adql = "SELECT * FROM " + table + " WHERE"
                + " CONTAINS(POINT('ICRS'," + raCol + "," + decCol + "),"
                + "CIRCLE('ICRS'," + raVal + "," + decVal + "," + radius + ")"
                + ")=1";
        return redirect(adql);
    }

    /**
     * Zeitreihe eines Objekts, optional mit Join auf eine Tabelle mit Zeitspalte.
     *
     * @param id             Objekt-ID (kann 64 Bit überschreiten)
     * @param table          Tabelle mit den Messungen
     * @param idColumn       Spalte der Objekt-ID
     * @param bandColumn     Spalte des Filterbands
     * @param band           Band-Einschränkung
     * @param detail         Spaltenumfang
     * @param joinTimeColumn {@code [schema.]table.column} der Zeitspalte oder {@code null}
     * @return Weiterleitungs-URL
     */
    public String timeseries(
            BigInteger id,
            String table,
            String idColumn,
            String bandColumn,
            Band band,
            Detail detail,
            String joinTimeColumn) {
        Objects.requireNonNull(id, "id must not be null");
        require("table", table, AdqlPatterns.COMPOUND_TABLE);
        require("id_column", idColumn, AdqlPatterns.IDENTIFIER);
        require("band_column", bandColumn, AdqlPatterns.IDENTIFIER);
        if (joinTimeColumn != null) {
            require("join_time_column", joinTimeColumn, AdqlPatterns.FOREIGN_COLUMN);
        }

        String columns = columns(table, detail);
        String adql;
        // Normalisierte Zeitreihen-Tabellen haben keine Zeitspalte, Join über ccdVisitId
        if (joinTimeColumn != null) {
            int dot = joinTimeColumn.lastIndexOf('.');
            String joinTable = joinTimeColumn.substring(0, dot);
            String timeColumn = joinTimeColumn.substring(dot + 1);
            adql = "SELECT t." + timeColumn + "," + columns + " FROM " + table + " AS s"
                    + " JOIN " + joinTable + " AS t ON s.ccdVisitId = t.ccdVisitId";
        } else {
            adql = "SELECT " + columns + " FROM " + table + " AS s";
        }

        adql += " WHERE s." + idColumn + " = " + id;
        if (band != Band.ALL) {
            adql += " AND s." + bandColumn + " = '" + band.value() + "'";
        }
        return redirect(adql);
    }

    private String columns(String table, Detail detail) {
        if (detail.metadataKey() == null) return "s.*";
        List<String> cols = metadata.columns(table, detail.metadataKey());
        if (cols.isEmpty()) return "s.*";
        return cols.stream().map(c -> "s." + c).collect(Collectors.joining(","));
    }

    private String redirect(String adql) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("LANG", "ADQL");
        params.put("REQUEST", "doQuery");
        params.put("QUERY", adql);
        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        String url = tapSyncUrl + (tapSyncUrl.contains("?") ? "&" : "?") + query;
        log.info("Redirecting to {}", url);
        return url;
    }

    private static void require(String parameter, String value, Pattern pattern) {
        if (value == null || !pattern.matcher(value).matches()) {
            throw new TapQueryException(parameter, "Invalid value for " + parameter + ": " + value);
        }
    }
}
