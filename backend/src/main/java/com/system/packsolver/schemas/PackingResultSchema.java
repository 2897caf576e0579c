package com.system.packsolver.schemas;

import lombok.*;
import java.time.LocalDateTime;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackingResultSchema {
    private Boolean success;
    private String message;
    private String algorithmType;

    // Execution metrics
    private LocalDateTime executionStartTime;
    private LocalDateTime executionEndTime;
    private Long runtimeMs;

    // Solution metrics - item level
    private Integer totalItems;
    private Integer assignedItems;
    private Integer unassignedItems;

    private SolutionSchema solution;
}
