/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.model;

import java.util.*;

/**
 * Registry of the variables of a model, indexed by name.
 */
public class H2VariableSet {

    private final List<H2Variable> variables = new ArrayList<>();

    private final Map<String, H2Variable> variablesByName = new HashMap<>();

    public H2Variable create(H2VariableType type, String elementId) {
        return create(type, elementId, null);
    }

    public H2Variable create(H2VariableType type, String elementId, String qualifier) {
        String name = H2Variable.createName(type, elementId, qualifier);
        if (variablesByName.containsKey(name)) {
            throw new H2ModelException("Variable " + name + " already exists");
        }
        H2Variable variable = new H2Variable(type, elementId, qualifier, variables.size());
        variables.add(variable);
        variablesByName.put(name, variable);
        return variable;
    }

    public H2Variable getVariable(H2VariableType type, String elementId) {
        return getVariable(type, elementId, null);
    }

    public H2Variable getVariable(H2VariableType type, String elementId, String qualifier) {
        H2Variable variable = variablesByName.get(H2Variable.createName(type, elementId, qualifier));
        if (variable == null) {
            throw new H2ModelException("Element '" + elementId + "'" + (qualifier != null ? " (" + qualifier + ")" : "")
                    + " is not in the domain of variable " + type.getSymbol());
        }
        return variable;
    }

    public Optional<H2Variable> findVariable(String name) {
        return Optional.ofNullable(variablesByName.get(name));
    }

    public List<H2Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<H2Variable> getVariables(H2VariableType type) {
        return variables.stream().filter(v -> v.getType() == type).toList();
    }

    public int size() {
        return variables.size();
    }
}
