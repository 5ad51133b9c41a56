package com.procureagent.negotiation.model;

import java.util.List;

public record Vendor(
    String vendorId,
    String contactName,
    String company,
    String email,
    VendorPersona persona,
    List<String> specialties
) {
    public Vendor {
        specialties = specialties == null ? List.of() : List.copyOf(specialties);
    }
}
