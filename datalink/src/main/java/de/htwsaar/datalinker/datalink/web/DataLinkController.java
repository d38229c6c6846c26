package de.htwsaar.datalinker.datalink.web;

import de.htwsaar.datalinker.common.serialization.JacksonCodec;
import de.htwsaar.datalinker.datalink.identifier.InvalidIdentifierException;
import de.htwsaar.datalinker.datalink.render.DataLinkDocument;
import de.htwsaar.datalinker.datalink.service.DataLinkService;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter des DataLink-{@code links}-Endpunkts.
 *
 * <p>Parameternamen sind case-insensitiv ({@code ID}, {@code id}, {@code RESPONSEFORMAT}, …).</p>
 */
@RestController
@RequestMapping("/api/datalink")
public class DataLinkController {

    private static final Logger log = LoggerFactory.getLogger(DataLinkController.class);

    static final MediaType VOTABLE = MediaType.parseMediaType(DataLinkDocument.MEDIA_TYPE);
    static final Set<String> RESPONSE_FORMATS = Set.of("votable", DataLinkDocument.MEDIA_TYPE);

    private final DataLinkService dataLinkService;

    public DataLinkController(DataLinkService dataLinkService) {
        this.dataLinkService = dataLinkService;
    }

    /**
     * Liefert die Links zu einem Identifier als DataLink-VOTable.
     *
     * @param params alle Query-Parameter
     * @return VOTable mit {@code Cache-Control: max-age}, 422 bei ungültigem Identifier oder Format
     */
    @GetMapping("/links")
    public ResponseEntity<String> links(@RequestParam MultiValueMap<String, String> params) {
        List<String> ids = valuesIgnoreCase(params, "id");
        if (ids.size() != 1) {
            String msg = ids.isEmpty() ? "Field required" : "Exactly one ID parameter is supported";
            return unprocessable("id", msg, ids.isEmpty() ? "missing" : "value_error");
        }
        List<String> formats = valuesIgnoreCase(params, "responseformat");
        if (formats.size() > 1
                || (formats.size() == 1 && !RESPONSE_FORMATS.contains(formats.get(0).trim().toLowerCase(Locale.ROOT)))) {
            return unprocessable("responseformat", "Unsupported RESPONSEFORMAT " + formats, "value_error");
        }

        try {
            DataLinkDocument document = dataLinkService.links(ids.get(0));
            return ResponseEntity.ok()
                    .contentType(VOTABLE)
                    .cacheControl(CacheControl.maxAge(document.maxAge()).cachePrivate())
                    .body(document.body());
        } catch (InvalidIdentifierException ex) {
            log.warn("Rejected identifier: {}", ex.getMessage());
            return unprocessable("id", ex.getMessage(), "value_error");
        }
    }

    private static List<String> valuesIgnoreCase(MultiValueMap<String, String> params, String name) {
        List<String> values = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : params.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && e.getValue() != null) {
                values.addAll(e.getValue());
            }
        }
        return values;
    }

    private static ResponseEntity<String> unprocessable(String parameter, String msg, String type) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .contentType(MediaType.APPLICATION_JSON)
                .body(JacksonCodec.toJson(ErrorDetail.of(parameter, msg, type)));
    }
}
