package com.ospicorp.navseries.series.model;

import java.time.LocalDate;

public record ChartPoint(LocalDate x, double y) {}
