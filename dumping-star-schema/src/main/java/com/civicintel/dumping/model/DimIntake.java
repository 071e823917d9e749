package com.civicintel.dumping.model;

import lombok.Value;

/** How the request reached the city: app, phone, web form... */
@Value
public class DimIntake {
    String methodReceived;
}
