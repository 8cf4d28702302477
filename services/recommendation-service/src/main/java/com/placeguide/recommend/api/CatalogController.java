package com.placeguide.recommend.api;

import com.placeguide.recommend.service.CatalogService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CatalogController {
    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping("/catalog/tags")
    public Map<String, List<String>> tags() {
        return Map.of("tags", catalogService.listTags());
    }

    @GetMapping("/catalog/districts")
    public Map<String, List<String>> districts() {
        return Map.of("districts", catalogService.listDistricts());
    }
}
