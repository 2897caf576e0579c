package com.system.packsolver.schemas;

import lombok.*;
import java.util.List;

/**
 * Bonus awarded once per container when every named item is packed in that container.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class SynergyRuleSchema {
    private List<String> items;
    private Double bonus;
}
