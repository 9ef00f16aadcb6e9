package com.copas.services.ordercrm.entity;

import lombok.*;

/**
 * One purchased line, stored in order inside the order's JSON line_items column.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LineItem {

    private String name;
    private Integer quantity;
    private String price;
    private String sku;
    private String variantTitle;
}
