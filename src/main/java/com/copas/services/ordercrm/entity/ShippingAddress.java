package com.copas.services.ordercrm.entity;

import lombok.*;

/**
 * Shipping address snapshot, stored as JSON on the order.
 * Only {@code phone} is interpreted (contact number fallback).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ShippingAddress {

    private String address1;
    private String address2;
    private String city;
    private String province;
    private String country;
    private String zip;
    private String phone;
}
