/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import java.util.*;

/**
 * All the tabular inputs of one planning scenario.
 */
public class H2InputTables {

    private final Map<String, Hub> hubs = new LinkedHashMap<>();

    private final Map<String, ProductionTechnology> productionTechnologies = new LinkedHashMap<>();

    private final List<ExistingProducer> existingProducers = new ArrayList<>();

    private final Map<String, DistributionTechnology> distributionTechnologies = new LinkedHashMap<>();

    private final List<ConversionTechnology> conversionTechnologies = new ArrayList<>();

    private final Map<String, DemandSector> demandSectors = new LinkedHashMap<>();

    private final List<HubConnection> hubConnections = new ArrayList<>();

    private final Map<String, CcsTechnology> ccsTechnologies = new LinkedHashMap<>();

    private static <T> void putUnique(Map<String, T> map, String id, T value, String what) {
        if (map.putIfAbsent(id, value) != null) {
            throw new H2InputException(what + " '" + id + "' is defined twice");
        }
    }

    public H2InputTables addHub(Hub hub) {
        putUnique(hubs, hub.getId(), hub, "Hub");
        return this;
    }

    public H2InputTables addProductionTechnology(ProductionTechnology technology) {
        putUnique(productionTechnologies, technology.getName(), technology, "Production technology");
        return this;
    }

    public H2InputTables addExistingProducer(ExistingProducer producer) {
        existingProducers.add(Objects.requireNonNull(producer));
        return this;
    }

    public H2InputTables addDistributionTechnology(DistributionTechnology technology) {
        putUnique(distributionTechnologies, technology.getName(), technology, "Distribution technology");
        return this;
    }

    public H2InputTables addConversionTechnology(ConversionTechnology technology) {
        conversionTechnologies.add(Objects.requireNonNull(technology));
        return this;
    }

    public H2InputTables addDemandSector(DemandSector sector) {
        putUnique(demandSectors, sector.getName(), sector, "Demand sector");
        return this;
    }

    public H2InputTables addHubConnection(HubConnection connection) {
        hubConnections.add(Objects.requireNonNull(connection));
        return this;
    }

    public H2InputTables addCcsTechnology(CcsTechnology technology) {
        putUnique(ccsTechnologies, technology.getName(), technology, "CCS technology");
        return this;
    }

    public Collection<Hub> getHubs() {
        return Collections.unmodifiableCollection(hubs.values());
    }

    public Hub getHub(String id) {
        Hub hub = hubs.get(id);
        if (hub == null) {
            throw new H2InputException("Hub '" + id + "' not found");
        }
        return hub;
    }

    public Collection<ProductionTechnology> getProductionTechnologies() {
        return Collections.unmodifiableCollection(productionTechnologies.values());
    }

    public ProductionTechnology getProductionTechnology(String name) {
        ProductionTechnology technology = productionTechnologies.get(name);
        if (technology == null) {
            throw new H2InputException("Production technology '" + name + "' not found");
        }
        return technology;
    }

    public List<ExistingProducer> getExistingProducers() {
        return Collections.unmodifiableList(existingProducers);
    }

    public Collection<DistributionTechnology> getDistributionTechnologies() {
        return Collections.unmodifiableCollection(distributionTechnologies.values());
    }

    public List<DistributionTechnology> getDistributionTechnologies(DistributionKind kind) {
        return distributionTechnologies.values().stream().filter(t -> t.getKind() == kind).toList();
    }

    public List<ConversionTechnology> getConversionTechnologies() {
        return Collections.unmodifiableList(conversionTechnologies);
    }

    public Collection<DemandSector> getDemandSectors() {
        return Collections.unmodifiableCollection(demandSectors.values());
    }

    public DemandSector getDemandSector(String name) {
        DemandSector sector = demandSectors.get(name);
        if (sector == null) {
            throw new H2InputException("Demand sector '" + name + "' not found");
        }
        return sector;
    }

    public List<HubConnection> getHubConnections() {
        return Collections.unmodifiableList(hubConnections);
    }

    public Collection<CcsTechnology> getCcsTechnologies() {
        return Collections.unmodifiableCollection(ccsTechnologies.values());
    }

    public CcsTechnology getCcsTechnology(String name) {
        CcsTechnology technology = ccsTechnologies.get(name);
        if (technology == null) {
            throw new H2InputException("CCS technology '" + name + "' not found");
        }
        return technology;
    }
}
