package com.ragmodule.store;

import java.util.List;

public record ScrollPage(List<Point> points, String nextPageOffset) {
    public ScrollPage {
        points = points == null ? List.of() : points;
    }
}
