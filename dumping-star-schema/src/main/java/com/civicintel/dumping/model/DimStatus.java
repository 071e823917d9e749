package com.civicintel.dumping.model;

import lombok.Value;

@Value
public class DimStatus {
    String status;
}
