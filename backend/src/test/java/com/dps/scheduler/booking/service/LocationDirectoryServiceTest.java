package com.dps.scheduler.booking.service;

import com.dps.scheduler.SchedulerTestFixtures;
import com.dps.scheduler.booking.http.SchedulerApiClient;
import com.dps.scheduler.booking.location.LocationSelectionCache;
import com.dps.scheduler.booking.location.LocationSelector;
import com.dps.scheduler.booking.model.LocationSearchRequest;
import com.dps.scheduler.booking.model.SiteLocation;
import com.dps.scheduler.config.SchedulerProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LocationDirectoryServiceTest {

    @Mock
    private SchedulerApiClient apiClient;
    @Mock
    private LocationSelectionCache selectionCache;
    @Mock
    private LocationSelector selector;

    private SchedulerProperties properties;
    private LocationDirectoryService service;

    @BeforeEach
    void setUp() {
        properties = SchedulerTestFixtures.properties(null);
        properties.getLocation().setZipCodes(List.of("78701", "78613"));
        service = new LocationDirectoryService(apiClient, properties, selectionCache, selector);
    }

    @Test
    void mergesZipCodeSearchesSortedByDistanceWithoutDuplicates() {
        stubSearch("78701", List.of(
            new SiteLocation(1, "Austin North", "a", 12.0, null),
            new SiteLocation(2, "Austin South", "b", 3.0, null)
        ));
        stubSearch("78613", List.of(
            new SiteLocation(1, "Austin North", "a", 4.0, null),
            new SiteLocation(3, "Cedar Park", "c", 8.5, null)
        ));

        List<SiteLocation> locations = service.findLocations();

        assertThat(locations).extracting(SiteLocation::id).containsExactly(2L, 1L, 3L);
        assertEquals("78613", locations.get(1).zipCode());
        assertEquals(4.0, locations.get(1).distance());

        ArgumentCaptor<Object> request = ArgumentCaptor.forClass(Object.class);
        verify(apiClient, times(2)).post(eq(LocationDirectoryService.LOCATION_SEARCH_PATH), request.capture(), any(TypeReference.class));
        LocationSearchRequest first = (LocationSearchRequest) request.getAllValues().get(0);
        assertEquals(71, first.typeId());
        assertEquals("", first.cityName());
        assertEquals(0, first.preferredDay());
    }

    @Test
    void keepsLocationsCloserThanConfiguredMiles() {
        properties.getLocation().setZipCodes(List.of("78701"));
        properties.getLocation().setMiles(10);
        stubSearch("78701", List.of(
            new SiteLocation(1, "Near", "a", 9.9, null),
            new SiteLocation(2, "Edge", "b", 10.0, null),
            new SiteLocation(3, "Far", "c", 30.0, null)
        ));

        List<SiteLocation> locations = service.resolveScanLocations();

        assertThat(locations).extracting(SiteLocation::name).containsExactly("Near");
        verifyNoInteractions(selectionCache, selector);
    }

    @Test
    void noLocationWithinRangeEndsRunWithZeroExitCode() {
        properties.getLocation().setZipCodes(List.of("78701"));
        properties.getLocation().setMiles(5);
        stubSearch("78701", List.of(new SiteLocation(1, "Far", "a", 30.0, null)));

        assertThatThrownBy(() -> service.resolveScanLocations())
            .isInstanceOf(NoLocationsFoundException.class)
            .hasMessageContaining("30.0")
            .satisfies(error -> assertEquals(0, ((FatalSchedulerException) error).getExitCode()));
    }

    @Test
    void pickLocationUsesCacheWhenPresent() {
        properties.getLocation().setPickLocation(true);
        List<SiteLocation> cached = List.of(SchedulerTestFixtures.location(5, "Cached", 1));
        when(selectionCache.load()).thenReturn(Optional.of(cached));

        assertEquals(cached, service.resolveScanLocations());
        verifyNoInteractions(apiClient, selector);
    }

    @Test
    void pickLocationPromptsAndSavesChoice() {
        properties.getLocation().setPickLocation(true);
        properties.getLocation().setZipCodes(List.of("78701"));
        when(selectionCache.load()).thenReturn(Optional.empty());
        SiteLocation chosen = new SiteLocation(7, "Chosen", "a", 50.0, null);
        stubSearch("78701", List.of(chosen));
        when(selector.select(anyList())).thenReturn(List.of(chosen.withZipCode("78701")));

        List<SiteLocation> locations = service.resolveScanLocations();

        assertThat(locations).extracting(SiteLocation::id).containsExactly(7L);
        verify(selectionCache).save(List.of(chosen.withZipCode("78701")));
    }

    @Test
    void emptyInteractiveChoiceIsFatal() {
        properties.getLocation().setPickLocation(true);
        properties.getLocation().setZipCodes(List.of("78701"));
        when(selectionCache.load()).thenReturn(Optional.empty());
        stubSearch("78701", List.of(new SiteLocation(7, "Only", "a", 1.0, null)));
        when(selector.select(anyList())).thenReturn(List.of());

        assertThatThrownBy(() -> service.resolveScanLocations())
            .isInstanceOf(FatalSchedulerException.class)
            .satisfies(error -> assertEquals(1, ((FatalSchedulerException) error).getExitCode()));
        verify(selectionCache, never()).save(anyList());
    }

    private void stubSearch(String zipCode, List<SiteLocation> response) {
        when(apiClient.post(
            eq(LocationDirectoryService.LOCATION_SEARCH_PATH),
            argThat(body -> body instanceof LocationSearchRequest request && zipCode.equals(request.zipCode())),
            any(TypeReference.class)
        )).thenReturn(response);
    }
}
