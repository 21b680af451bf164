package com.dps.scheduler.booking.location;

import com.dps.scheduler.booking.model.SiteLocation;

import java.util.List;
import java.util.Optional;

public interface LocationSelectionCache {

    Optional<List<SiteLocation>> load();

    void save(List<SiteLocation> locations);
}
