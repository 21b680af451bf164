package com.dps.scheduler.booking.service;

import com.dps.scheduler.booking.http.SchedulerApiClient;
import com.dps.scheduler.booking.location.LocationSelectionCache;
import com.dps.scheduler.booking.location.LocationSelector;
import com.dps.scheduler.booking.model.LocationSearchRequest;
import com.dps.scheduler.booking.model.SiteLocation;
import com.dps.scheduler.config.SchedulerProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class LocationDirectoryService {
    private static final Logger log = LoggerFactory.getLogger(LocationDirectoryService.class);
    static final String LOCATION_SEARCH_PATH = "/api/AvailableLocation/";

    private final SchedulerApiClient apiClient;
    private final SchedulerProperties properties;
    private final LocationSelectionCache selectionCache;
    private final LocationSelector selector;

    public LocationDirectoryService(
        SchedulerApiClient apiClient,
        SchedulerProperties properties,
        LocationSelectionCache selectionCache,
        LocationSelector selector
    ) {
        this.apiClient = apiClient;
        this.properties = properties;
        this.selectionCache = selectionCache;
        this.selector = selector;
    }

    /**
     * Searches every configured zip code and returns the merged result sorted by distance,
     * keeping the nearest entry when a location shows up for several zip codes.
     */
    public List<SiteLocation> findLocations() {
        int typeId = properties.getPersonalInfo().getTypeId();
        List<SiteLocation> all = new ArrayList<>();
        for (String zipCode : properties.getLocation().getZipCodes()) {
            LocationSearchRequest request = new LocationSearchRequest("", 0, typeId, zipCode);
            List<SiteLocation> response = apiClient.post(LOCATION_SEARCH_PATH, request, new TypeReference<List<SiteLocation>>() {
            });
            if (response == null) {
                continue;
            }
            for (SiteLocation location : response) {
                all.add(location.withZipCode(zipCode));
            }
        }
        all.sort(Comparator.comparingDouble(SiteLocation::distance));
        Map<Long, SiteLocation> unique = new LinkedHashMap<>();
        for (SiteLocation location : all) {
            unique.putIfAbsent(location.id(), location);
        }
        return List.copyOf(unique.values());
    }

    /**
     * Decides which locations the poll loop scans: the cached or interactive selection when
     * {@code pick-location} is on, otherwise every location closer than {@code miles}.
     */
    public List<SiteLocation> resolveScanLocations() {
        log.info("Requesting list of locations...");
        if (properties.getLocation().isPickLocation()) {
            Optional<List<SiteLocation>> cached = selectionCache.load();
            if (cached.isPresent()) {
                log.info("Found location selection cache. To reset, delete the cache folder.");
                return cached.get();
            }
            List<SiteLocation> selected = selector.select(findLocations());
            if (selected == null || selected.isEmpty()) {
                log.error("You must choose at least one location.");
                throw new FatalSchedulerException("No location selected", 1);
            }
            selectionCache.save(selected);
            return List.copyOf(selected);
        }

        List<SiteLocation> found = findLocations();
        double miles = properties.getLocation().getMiles();
        List<SiteLocation> nearby = found.stream()
            .filter(location -> location.distance() < miles)
            .toList();
        if (nearby.isEmpty()) {
            String nearest = found.isEmpty() ? "unknown" : String.valueOf(found.get(0).distance());
            log.error(
                "No locations found. The nearest location is {} miles away. Please update your settings and try again.",
                nearest
            );
            throw new NoLocationsFoundException("No locations within " + miles + " miles; nearest is " + nearest + " miles away");
        }
        log.info("Found {} locations that match your settings.", nearby.size());
        log.info("{}", nearby.stream().map(SiteLocation::name).collect(Collectors.joining(", ")));
        return nearby;
    }
}
