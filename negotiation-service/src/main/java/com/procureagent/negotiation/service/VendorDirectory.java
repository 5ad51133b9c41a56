package com.procureagent.negotiation.service;

import com.procureagent.common.exception.UnknownVendorException;
import com.procureagent.negotiation.model.Vendor;
import com.procureagent.negotiation.model.VendorPersona;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Vendors the buyer can negotiate with, keyed by vendor id. */
public class VendorDirectory {

    private final Map<String, Vendor> vendors = new LinkedHashMap<>();

    public VendorDirectory(Collection<Vendor> vendors) {
        vendors.forEach(v -> this.vendors.put(v.vendorId(), v));
    }

    public static VendorDirectory builtIn() {
        return new VendorDirectory(List.of(
            new Vendor("rajesh_stationery", "Rajesh Kumar", "Rajesh Stationery Wholesale",
                       "rajesh@rswholesale.com", VendorPersona.COOPERATIVE,
                       List.of("WRITING_INSTRUMENTS", "PAPER_NOTEBOOKS")),
            new Vendor("modern_office", "Priya Sharma", "Modern Office Solutions",
                       "priya@modernofficeindia.com", VendorPersona.STRATEGIC,
                       List.of("OFFICE_SUPPLIES", "BAGS_STORAGE")),
            new Vendor("creative_arts", "Amit Patel", "Creative Arts Suppliers",
                       "amit@creativeartsupply.in", VendorPersona.AGGRESSIVE,
                       List.of("ART_CRAFT"))));
    }

    public Optional<Vendor> find(String vendorId) {
        return Optional.ofNullable(vendorId).map(vendors::get);
    }

    public Vendor require(String vendorId) {
        return find(vendorId)
            .orElseThrow(() -> new UnknownVendorException("Unknown vendor " + vendorId));
    }

    public List<Vendor> all() {
        return List.copyOf(vendors.values());
    }
}
