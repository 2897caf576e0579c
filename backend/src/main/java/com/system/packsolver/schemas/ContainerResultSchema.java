package com.system.packsolver.schemas;

import lombok.*;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContainerResultSchema {
    private Integer index;
    private List<ItemSchema> items;
    private Double totalWeight;
    private Double capacity;

    // totalValue = baseValue + synergyBonus
    private Double baseValue;
    private Double synergyBonus;
    private Double totalValue;
}
