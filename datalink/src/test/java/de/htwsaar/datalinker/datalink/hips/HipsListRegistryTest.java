package de.htwsaar.datalinker.datalink.hips;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HipsListRegistryTest {

    @Test
    void unknownDataset_namesConfiguredOnes() {
        Map<String, CollectionListCache> caches = new LinkedHashMap<>();
        caches.put("dp02", mock(CollectionListCache.class));
        caches.put("dp1", mock(CollectionListCache.class));
        HipsListRegistry registry = new HipsListRegistry(caches, "dp02");

        UnknownDatasetException ex = assertThrows(UnknownDatasetException.class, () -> registry.cacheFor("dp3"));
        assertTrue(ex.getMessage().contains("dp02"), ex.getMessage());
        assertTrue(ex.getMessage().contains("dp1"), ex.getMessage());
        assertEquals(List.of("dp02", "dp1"), registry.datasetNames());
        assertTrue(registry.defaultCache().isPresent());
    }

    @Test
    void noDatasets_hasNoDefault() {
        HipsListRegistry registry = new HipsListRegistry(Map.of(), "");
        assertTrue(registry.defaultCache().isEmpty());
        assertThrows(UnknownDatasetException.class, () -> registry.cacheFor("dp02"));
    }

    @Test
    void refreshAll_countsExecutedRefreshs() {
        CollectionListCache a = mock(CollectionListCache.class);
        CollectionListCache b = mock(CollectionListCache.class);
        when(a.refresh()).thenReturn(true);
        when(b.refresh()).thenReturn(false);
        Map<String, CollectionListCache> caches = new LinkedHashMap<>();
        caches.put("a", a);
        caches.put("b", b);

        assertEquals(1, new HipsListRegistry(caches, null).refreshAll());
        verify(a).refresh();
        verify(b).refresh();
    }
}
