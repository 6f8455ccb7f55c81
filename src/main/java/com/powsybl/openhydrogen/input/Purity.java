/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openhydrogen.input;

import java.util.Objects;

/**
 * Hydrogen quality grade. Each grade is a parallel layer of the flow network.
 */
public enum Purity {
    LOW("lowPurity"),
    HIGH("highPurity");

    private final String tag;

    Purity(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Tag with an upper case first letter, used as a suffix in node identifiers (e.g. "pipelineHighPurity").
     */
    public String getSuffix() {
        return Character.toUpperCase(tag.charAt(0)) + tag.substring(1);
    }

    public static Purity fromTag(String tag) {
        Objects.requireNonNull(tag);
        for (Purity purity : values()) {
            if (purity.tag.equalsIgnoreCase(tag) || purity.name().equalsIgnoreCase(tag)) {
                return purity;
            }
        }
        throw new IllegalArgumentException("Unknown purity: '" + tag + "'");
    }
}
