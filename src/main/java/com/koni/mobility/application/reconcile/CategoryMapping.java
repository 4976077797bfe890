package com.koni.mobility.application.reconcile;

import com.koni.mobility.domain.model.TypeUnit;

import java.util.Optional;

/**
 * Source-specific translation of a category label into the (type, unit) of a datastream.
 */
public interface CategoryMapping {

    /**
     * @return the mapped pair, or empty when no rule matches the label
     */
    Optional<TypeUnit> resolve(String categoryLabel);
}
