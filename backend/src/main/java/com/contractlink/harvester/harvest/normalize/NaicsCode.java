package com.contractlink.harvester.harvest.normalize;

import java.util.List;

public enum NaicsCode {
    OTHER_BUILDING_SERVICES(
        "561790",
        "Other Services to Buildings and Dwellings",
        List.of("window cleaning", "pressure washing", "power washing", "duct cleaning", "gutter", "exterior cleaning")
    ),
    SPECIALTY_TRADE(
        "238990",
        "All Other Specialty Trade Contractors",
        List.of("floor refinishing", "floor stripping", "floor care", "waxing", "epoxy", "sealcoat", "coating")
    ),
    FACILITIES_SUPPORT(
        "561210",
        "Facilities Support Services",
        List.of("facilities support", "facility management", "facilities management", "facilities maintenance",
            "building maintenance", "operations and maintenance", "o&m")
    ),
    JANITORIAL(
        "561720",
        "Janitorial Services",
        List.of("janitorial", "custodial", "housekeeping", "cleaning", "sanitation", "disinfection", "porter",
            "environmental services")
    );

    private final String code;
    private final String title;
    private final List<String> hints;

    NaicsCode(String code, String title, List<String> hints) {
        this.code = code;
        this.title = title;
        this.hints = hints;
    }

    public String code() {
        return code;
    }

    public String title() {
        return title;
    }

    List<String> hints() {
        return hints;
    }

    public static NaicsCode fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (NaicsCode value : values()) {
            if (value.code.equals(code.trim())) {
                return value;
            }
        }
        return null;
    }
}
