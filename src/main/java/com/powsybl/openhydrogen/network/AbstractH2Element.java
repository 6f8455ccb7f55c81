/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.network;

import java.util.Objects;

public abstract class AbstractH2Element extends AbstractAttributeBag implements H2Element {

    protected final H2Network network;

    protected int num = -1;

    protected AbstractH2Element(H2Network network) {
        this.network = Objects.requireNonNull(network);
    }

    @Override
    public int getNum() {
        return num;
    }

    @Override
    public void setNum(int num) {
        this.num = num;
    }

    @Override
    public H2Network getNetwork() {
        return network;
    }

    @Override
    protected void checkModifiable() {
        if (network.isFrozen()) {
            throw new IllegalStateException("Network '" + network.getId() + "' is frozen, cannot modify " + getId());
        }
    }

    @Override
    public String toString() {
        return getId();
    }
}
