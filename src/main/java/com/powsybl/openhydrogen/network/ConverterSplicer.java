/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import com.powsybl.openhydrogen.input.ConversionTechnology;
import com.powsybl.openhydrogen.input.H2InputTables;
import com.powsybl.openhydrogen.input.Hub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Inserts converters on the arcs matching the converter rules.
 *
 * <p>For a rule {@code upstream -> downstream}, every arc going from a node of class {@code upstream} to a
 * node of class {@code downstream} is replaced by a free flow arc from its start node to the hub converter
 * (keeping the flow limit) and by an arc from the converter to its end node carrying all the attributes of
 * the replaced arc. Rules are applied in declaration order; each rule first collects its matching arcs
 * and then rewrites them.</p>
 */
public class ConverterSplicer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConverterSplicer.class);

    public void splice(H2Network network, H2InputTables tables) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(tables);
        for (ConversionTechnology rule : tables.getConversionTechnologies()) {
            if (rule.isPassed()) {
                LOGGER.debug("Converter rule '{}' is passed", rule.getName());
                continue;
            }
            List<H2Arc> matchingArcs = findMatchingArcs(network, rule);
            for (H2Arc arc : matchingArcs) {
                rewrite(network, tables, rule, arc);
            }
            LOGGER.debug("Converter '{}' spliced on {} arcs ({} -> {})", rule.getName(), matchingArcs.size(),
                    rule.getUpstreamClass(), rule.getDownstreamClass());
        }
    }

    static List<H2Arc> findMatchingArcs(H2Network network, ConversionTechnology rule) {
        return network.getArcs().stream()
                .filter(arc -> arc.getStart().getNodeClass().key().equals(rule.getUpstreamClass())
                        && arc.getEnd().getNodeClass().key().equals(rule.getDownstreamClass()))
                .toList();
    }

    private static ConverterNode getOrCreateConverter(H2Network network, Hub hub, ConversionTechnology rule) {
        String id = hub.getId() + "_converter_" + rule.getName();
        H2Node node = network.getNodeById(id);
        if (node != null) {
            return (ConverterNode) node;
        }
        ConverterNode converter = network.addNode(new ConverterNode(network, hub.getId(), id, rule.getName()));
        converter.setAttribute(H2Attribute.CAPITAL_COST, rule.getCapitalCost() * hub.getCapitalMultiplier());
        converter.setAttribute(H2Attribute.FIXED_COST, rule.getFixedCost());
        converter.setAttribute(H2Attribute.VARIABLE_COST, rule.getVariableCost());
        converter.setAttribute(H2Attribute.ELECTRICITY_COST, rule.getElectricityCost() * hub.getElectricityMultiplier());
        converter.setAttribute(H2Attribute.UTILIZATION, rule.getUtilization());
        return converter;
    }

    private static void rewrite(H2Network network, H2InputTables tables, ConversionTechnology rule, H2Arc arc) {
        H2Node start = arc.getStart();
        H2Node end = arc.getEnd();
        ConverterNode converter = getOrCreateConverter(network, tables.getHub(start.getHub()), rule);

        double flowLimit = arc.getAttribute(H2Attribute.FLOW_LIMIT);
        H2Arc startToConverter = network.getArc(start, converter).orElse(null);
        if (startToConverter == null) {
            startToConverter = network.addArc(new H2Arc(network, start, converter, H2ArcType.FLOW_THROUGH_CONVERTER,
                    rule.getName(), false));
            startToConverter.setAttribute(H2Attribute.FLOW_LIMIT, flowLimit);
        } else {
            startToConverter.setAttribute(H2Attribute.FLOW_LIMIT, Math.max(flowLimit, startToConverter.getAttribute(H2Attribute.FLOW_LIMIT)));
        }

        H2Arc converterToEnd = new H2Arc(network, converter, end, arc.getType(), arc.getTechnology().orElse(null), arc.isExisting());
        converterToEnd.copyAttributesFrom(arc);
        network.removeArc(arc);
        network.addArc(converterToEnd);
    }
}
