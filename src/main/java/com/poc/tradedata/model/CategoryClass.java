package com.poc.tradedata.model;

public enum CategoryClass {
    MAJOR_HEADING,
    SUB_HEADING,
    UNCLASSIFIED
}
