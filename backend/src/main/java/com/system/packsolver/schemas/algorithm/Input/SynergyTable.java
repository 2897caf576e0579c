package com.system.packsolver.schemas.algorithm.Input;

import com.system.packsolver.schemas.ItemSchema;
import com.system.packsolver.schemas.SynergyRuleSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable synergy rule set for one solve call.
 *
 * A rule fires for a container when every name it requires is present among that container's
 * items. Each rule fires at most once per container, and independent rules may fire together.
 */
public class SynergyTable {

    private static final SynergyTable EMPTY = new SynergyTable(Collections.emptyList());

    private final List<Rule> rules;
    private final double totalBonus;

    private SynergyTable(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(rules);
        double sum = 0.0;
        for (Rule rule : rules) {
            sum += rule.bonus;
        }
        this.totalBonus = sum;
    }

    public static SynergyTable empty() {
        return EMPTY;
    }

    /**
     * Validates and copies the given rules.
     *
     * @throws InvalidPackingInputException if a rule has no names, a blank name, or a missing,
     *                                      negative or non-finite bonus
     */
    public static SynergyTable of(List<SynergyRuleSchema> ruleSchemas) {
        if (ruleSchemas == null || ruleSchemas.isEmpty()) {
            return EMPTY;
        }

        List<Rule> rules = new ArrayList<>(ruleSchemas.size());
        for (int i = 0; i < ruleSchemas.size(); i++) {
            SynergyRuleSchema schema = ruleSchemas.get(i);
            if (schema == null) {
                throw new InvalidPackingInputException("Synergy rule " + i + " is null");
            }
            if (schema.getItems() == null || schema.getItems().isEmpty()) {
                throw new InvalidPackingInputException("Synergy rule " + i + " names no items");
            }
            Set<String> names = new LinkedHashSet<>();
            for (String name : schema.getItems()) {
                if (name == null || name.isBlank()) {
                    throw new InvalidPackingInputException("Synergy rule " + i + " contains a blank item name");
                }
                names.add(name);
            }
            Double bonus = schema.getBonus();
            if (bonus == null || !Double.isFinite(bonus) || bonus < 0) {
                throw new InvalidPackingInputException(
                    "Synergy rule " + i + " must have a finite bonus >= 0, got " + bonus);
            }
            rules.add(new Rule(Collections.unmodifiableSet(names), bonus));
        }
        return new SynergyTable(rules);
    }

    public double synergyBonus(Collection<ItemSchema> containerItems) {
        if (rules.isEmpty() || containerItems == null || containerItems.isEmpty()) {
            return 0.0;
        }
        Set<String> names = new HashSet<>();
        for (ItemSchema item : containerItems) {
            names.add(item.getName());
        }
        return synergyBonusForNames(names);
    }

    /**
     * Sum of the bonuses of every rule whose required names are all in {@code names}.
     */
    public double synergyBonusForNames(Set<String> names) {
        double bonus = 0.0;
        for (Rule rule : rules) {
            if (names.containsAll(rule.names)) {
                bonus += rule.bonus;
            }
        }
        return bonus;
    }

    /**
     * Sum of every rule's bonus, whether or not it can ever fire.
     */
    public double totalBonus() {
        return totalBonus;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public List<SynergyRuleSchema> toSchemas() {
        List<SynergyRuleSchema> schemas = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            schemas.add(SynergyRuleSchema.builder()
                .items(new ArrayList<>(rule.names))
                .bonus(rule.bonus)
                .build());
        }
        return schemas;
    }

    private static final class Rule {
        private final Set<String> names;
        private final double bonus;

        private Rule(Set<String> names, double bonus) {
            this.names = names;
            this.bonus = bonus;
        }
    }
}
