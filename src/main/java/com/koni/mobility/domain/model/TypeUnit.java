package com.koni.mobility.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The (type, unit) pair a category label maps to.
 */
@Getter
@ToString
@EqualsAndHashCode
public class TypeUnit {

    private final String type;
    private final String unit;

    public TypeUnit(String type, String unit) {
        this.type = type;
        this.unit = unit;
    }
}
