package com.placeguide.recommend.store;

import com.placeguide.recommend.model.Venue;

public record VenueDistance(Venue venue, double distanceMeters) {}
