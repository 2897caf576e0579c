package com.system.packsolver.schemas;

public enum ItemCategory {
    ELECTRONICS,
    CLOTHING,
    FOOD,
    TOOLS,
    ACCESSORIES,
    OTHER
}
