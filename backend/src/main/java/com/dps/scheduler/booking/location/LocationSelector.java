package com.dps.scheduler.booking.location;

import com.dps.scheduler.booking.model.SiteLocation;

import java.util.List;

/**
 * Lets the operator pick which of the found locations to scan.
 */
public interface LocationSelector {

    List<SiteLocation> select(List<SiteLocation> candidates);
}
