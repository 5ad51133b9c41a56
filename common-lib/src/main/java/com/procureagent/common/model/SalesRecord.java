package com.procureagent.common.model;

import java.time.LocalDate;

public record SalesRecord(
    String sku,
    LocalDate date,
    int quantitySold
) {}
