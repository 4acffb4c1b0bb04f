package com.poc.tradedata.model;

import lombok.Value;

@Value
public class ClassifiedCategory {
    CategoryClass categoryClass;
    String rawLabel;

    /**
     * Label after relabelling and prefix stripping.
     */
    String label;
}
