package com.system.packsolver.schemas;

import lombok.*;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedInstanceRequest {
    private Integer itemCount;
    private Integer containerCount;
    private Double capacity;    // every generated container gets the same capacity
    private Long seed;          // same seed -> same items
    private String algorithmType;
    private Long timeBudgetMs;
}
