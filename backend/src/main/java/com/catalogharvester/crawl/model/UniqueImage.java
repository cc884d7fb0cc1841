package com.catalogharvester.crawl.model;

import java.util.List;

public record UniqueImage(String src, String alt, List<String> foundOn) {
    public UniqueImage {
        foundOn = foundOn == null ? List.of() : List.copyOf(foundOn);
    }
}
