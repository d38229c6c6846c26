package de.htwsaar.datalinker.datalink.web;

import de.htwsaar.datalinker.common.serialization.JacksonCodec;
import de.htwsaar.datalinker.datalink.tap.Band;
import de.htwsaar.datalinker.datalink.tap.Detail;
import de.htwsaar.datalinker.datalink.tap.TapQueryException;
import de.htwsaar.datalinker.datalink.tap.TapRedirectService;
import java.math.BigInteger;
import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * DataLink-Microservices, die per 307 auf eine TAP-Abfrage weiterleiten.
 */
@RestController
@RequestMapping("/api/datalink")
public class TapRedirectController {

    private final TapRedirectService tapRedirectService;

    public TapRedirectController(TapRedirectService tapRedirectService) {
        this.tapRedirectService = tapRedirectService;
    }

    @GetMapping("/cone_search")
    public ResponseEntity<String> coneSearch(
            @RequestParam("table") String table,
            @RequestParam("ra_col") String raCol,
            @RequestParam("dec_col") String decCol,
            @RequestParam("ra_val") double raVal,
            @RequestParam("dec_val") double decVal,
            @RequestParam("radius") double radius) {
        try {
            return redirect(tapRedirectService.coneSearch(table, raCol, decCol, raVal, decVal, radius));
        } catch (TapQueryException ex) {
            return unprocessable(ex.getParameter(), ex.getMessage());
        }
    }

    @GetMapping("/timeseries")
    public ResponseEntity<String> timeseries(
            @RequestParam("id") String id,
            @RequestParam("table") String table,
            @RequestParam("id_column") String idColumn,
            @RequestParam(value = "band_column", defaultValue = "band") String bandColumn,
            @RequestParam(value = "band", defaultValue = "all") String band,
            @RequestParam(value = "detail", defaultValue = "full") String detail,
            @RequestParam(value = "join_time_column", required = false) String joinTimeColumn) {
        BigInteger objectId;
        Band parsedBand;
        Detail parsedDetail;
        try {
            objectId = new BigInteger(id.trim());
        } catch (NumberFormatException ex) {
            return unprocessable("id", "Input should be a valid integer: " + id);
        }
        try {
            parsedBand = Band.parse(band);
        } catch (IllegalArgumentException ex) {
            return unprocessable("band", "Unknown band " + band);
        }
        try {
            parsedDetail = Detail.parse(detail);
        } catch (IllegalArgumentException ex) {
            return unprocessable("detail", "Unknown detail level " + detail);
        }
        String join = joinTimeColumn == null || joinTimeColumn.isBlank() ? null : joinTimeColumn.trim();

        try {
            return redirect(tapRedirectService.timeseries(
                    objectId, table, idColumn, bandColumn, parsedBand, parsedDetail, join));
        } catch (TapQueryException ex) {
            return unprocessable(ex.getParameter(), ex.getMessage());
        }
    }

    private static ResponseEntity<String> redirect(String url) {
        return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
                .location(URI.create(url))
                .build();
    }

    private static ResponseEntity<String> unprocessable(String parameter, String msg) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .contentType(MediaType.APPLICATION_JSON)
                .body(JacksonCodec.toJson(ErrorDetail.of(parameter, msg, "value_error")));
    }
}
