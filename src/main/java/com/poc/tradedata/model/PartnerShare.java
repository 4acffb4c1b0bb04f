package com.poc.tradedata.model;

import lombok.Value;

@Value
public class PartnerShare {
    String partnerName;
    double rate;
}
