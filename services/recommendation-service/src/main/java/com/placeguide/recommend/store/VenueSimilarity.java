package com.placeguide.recommend.store;

import com.placeguide.recommend.model.Venue;

public record VenueSimilarity(Venue venue, double similarity) {}
