package com.poc.tradedata.model;

import lombok.Value;

@Value
public class IndicatorCode {
    String code;
    String title;
}
