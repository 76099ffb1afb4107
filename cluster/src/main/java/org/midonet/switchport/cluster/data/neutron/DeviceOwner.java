/*
 * Copyright 2018 Midokura SARL
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.midonet.switchport.cluster.data.neutron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The owners of a port that matter when placing it on a switch. Any other
 * owner decodes to {@link #OTHER}.
 */
public enum DeviceOwner {

    /** Virtual machine ports, "compute:" followed by the availability zone. */
    COMPUTE("compute:nova"),
    BAREMETAL("baremetal:none"),
    DHCP("network:dhcp"),
    OTHER("");

    private static final String COMPUTE_PREFIX = "compute:";

    private final String value;

    DeviceOwner(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DeviceOwner forValue(String owner) {
        if (owner == null || owner.isEmpty()) {
            return null;
        }
        if (owner.toLowerCase().startsWith(COMPUTE_PREFIX)) {
            return COMPUTE;
        }
        if (BAREMETAL.value.equalsIgnoreCase(owner)) {
            return BAREMETAL;
        }
        if (DHCP.value.equalsIgnoreCase(owner)) {
            return DHCP;
        }
        return OTHER;
    }

    @Override
    public String toString() {
        return value;
    }
}
