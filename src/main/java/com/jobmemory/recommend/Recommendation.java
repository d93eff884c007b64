package com.jobmemory.recommend;

import java.util.List;

public record Recommendation(String type, List<String> items) {

    public Recommendation {
        items = List.copyOf(items);
    }
}
