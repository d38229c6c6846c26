package de.htwsaar.datalinker.datalink.hips;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HipsPropertiesFormatTest {

    private static final String SERVICE_LINE = "hips_service_url         = https://hips.example.org/color_gri";

    @Test
    void parse_skipsCommentsAndBlankLines() {
        String text = "# HiPS properties\n"
                + "\n"
                + "creator_did          = ivo://example.org/hips/color_gri\n"
                + "obs_title            = gri color\n"
                + "hips_status          = public master clonableOnce\n";

        Map<String, String> props = HipsPropertiesFormat.parse(text);

        assertEquals(List.of("creator_did", "obs_title", "hips_status"), List.copyOf(props.keySet()));
        assertEquals("gri color", props.get("obs_title"));
    }

    @Test
    void insertServiceUrl_keepsFetchedTextAndInsertsBeforeStatus() {
        String text = "# HiPS properties\n"
                + "\n"
                + "creator_did=ivo://x\n"
                + "obs_title   =   gri color\n"
                + "hips_status = public\n"
                + "hips_order  = 11\n";

        String result = HipsPropertiesFormat.insertServiceUrl(text, "https://hips.example.org/color_gri");

        assertEquals("# HiPS properties\n"
                + "\n"
                + "creator_did=ivo://x\n"
                + "obs_title   =   gri color\n"
                + SERVICE_LINE + "\n"
                + "hips_status = public\n"
                + "hips_order  = 11\n", result);
    }

    @Test
    void insertServiceUrl_appendsWithoutStatusAndReplacesExistingLine() {
        String text = "a = 1\nhips_service_url = https://old.example.org";

        String result = HipsPropertiesFormat.insertServiceUrl(text, "https://hips.example.org/color_gri");

        assertEquals("a = 1\n" + SERVICE_LINE + "\n", result);
        assertEquals(List.of("a", "hips_service_url"), List.copyOf(HipsPropertiesFormat.parse(result).keySet()));
    }

    @Test
    void format_alignsKeys() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("obs_title", "gri color");
        assertEquals("obs_title                = gri color\n", HipsPropertiesFormat.format(props));
    }

    @Test
    void format_keepsSpaceBeforeEqualsForLongKeys() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("hips_initial_ra_and_dec_fov", "1.5");
        assertEquals("hips_initial_ra_and_dec_fov = 1.5\n", HipsPropertiesFormat.format(props));
    }

    @Test
    void formatList_joinsStoredBlocksWithBlankLine() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        String list = HipsPropertiesFormat.formatList(List.of(
                new CollectionListEntry("a", "https://h/a", Map.of("k", "1"), "# a\nk=1\n", now),
                new CollectionListEntry("b", "https://h/b", Map.of("k", "2"), "k  =  2\n", now)));
        assertEquals("# a\nk=1\n\nk  =  2\n", list);
    }
}
