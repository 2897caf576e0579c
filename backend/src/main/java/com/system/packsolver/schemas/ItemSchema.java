package com.system.packsolver.schemas;

import lombok.*;

/**
 * An item that can be packed into at most one container.
 * The name is the key synergy rules match on; the category is descriptive only.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString
public class ItemSchema {
    private Integer id;
    private String name;
    private Double weight;
    private Double value;
    private ItemCategory category;
}
